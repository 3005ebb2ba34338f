package com.referenceextraction;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;

/**
 * Runs every configured text-extraction backend on a document and keeps the best text.
 *
 * <p>Each successful result is scored as
 * {@code min(1, 0.3*chars/10000 + 0.3*words/2000 + 0.4*indicators/N)}, where
 * {@code indicators} is the number of quality-indicator terms present in the text
 * (case-insensitive) and {@code N} the vocabulary size. OCR results are multiplied by 0.8.
 * Backends run sequentially; a failing backend is logged and skipped.
 */
public class TextExtractionArbiter {

    private static final Logger log = LoggerFactory.getLogger(TextExtractionArbiter.class);

    public static final List<String> DEFAULT_QUALITY_INDICATORS = List.of(
            "abstract", "introduction", "methodology", "results", "conclusion",
            "references", "bibliography", "doi:", "http://", "https://",
            "journal", "conference", "proceedings", "volume", "issue"
    );

    static final double OCR_PENALTY = 0.8;

    private final List<TextExtractionBackend> backends;
    private final List<String> qualityIndicators;

    /**
     * A backend that threw or reported an unsuccessful extraction.
     */
    public record BackendFailure(String backend, String message) {}

    /**
     * Outcome of arbitration: the winning extraction plus the backends that failed on the way.
     */
    public record Selection(RawExtraction winner, List<RawExtraction> candidates, List<BackendFailure> failures) {}

    public TextExtractionArbiter(List<TextExtractionBackend> backends) {
        this(backends, DEFAULT_QUALITY_INDICATORS);
    }

    public TextExtractionArbiter(List<TextExtractionBackend> backends, List<String> qualityIndicators) {
        // Stable sort: non-OCR backends first, configured order otherwise preserved.
        List<TextExtractionBackend> ordered = new ArrayList<>(backends);
        ordered.sort(Comparator.comparing(TextExtractionBackend::isOcr));
        this.backends = List.copyOf(ordered);
        this.qualityIndicators = qualityIndicators == null || qualityIndicators.isEmpty()
                ? DEFAULT_QUALITY_INDICATORS
                : qualityIndicators.stream().map(s -> s.toLowerCase(Locale.ROOT)).toList();
    }

    public List<TextExtractionBackend> backends() {
        return backends;
    }

    /**
     * Extracts text from {@code document} with every backend and returns the best result.
     *
     * @throws NoTextExtractedException if no backend produced usable text
     */
    public Selection select(Path document) {
        List<BackendFailure> failures = new ArrayList<>();
        List<RawExtraction> scored = new ArrayList<>();
        RawExtraction best = null;

        for (TextExtractionBackend backend : backends) {
            RawExtraction result;
            try {
                result = backend.extract(document);
            } catch (Exception e) {
                log.warn("Backend {} failed on {}: {}", backend.name(), document, e.getMessage());
                failures.add(new BackendFailure(backend.name(), describe(e)));
                continue;
            }

            if (result == null || !result.success()) {
                String error = result == null ? "no result" : String.valueOf(result.error());
                log.warn("Backend {} reported failure on {}: {}", backend.name(), document, error);
                failures.add(new BackendFailure(backend.name(), error));
                continue;
            }
            if (result.text().isBlank()) {
                log.warn("Backend {} returned no text for {}", backend.name(), document);
                failures.add(new BackendFailure(backend.name(), "empty text"));
                continue;
            }

            double score = score(result.text(), backend.isOcr() || result.ocr());
            RawExtraction withScore = result.withQualityScore(score);
            scored.add(withScore);
            log.debug("Backend {} scored {} ({} chars)", backend.name(),
                    String.format(Locale.ROOT, "%.3f", score), result.text().length());

            // Strictly greater: earlier (higher priority) backends win ties.
            if (best == null || score > best.qualityScore()) {
                best = withScore;
            }
        }

        if (best == null) {
            throw new NoTextExtractedException(String.valueOf(document), failures);
        }

        log.info("Selected {} for {} (quality {})", best.backend(), document,
                String.format(Locale.ROOT, "%.2f", best.qualityScore()));
        return new Selection(best, List.copyOf(scored), List.copyOf(failures));
    }

    /**
     * Quality score of a piece of text, in [0, 1].
     */
    public double score(String text, boolean ocr) {
        if (text == null || text.isEmpty()) {
            return 0.0;
        }
        int charCount = text.length();
        String trimmed = text.strip();
        int wordCount = trimmed.isEmpty() ? 0 : trimmed.split("\\s+").length;

        String lower = text.toLowerCase(Locale.ROOT);
        long indicatorCount = qualityIndicators.stream().filter(lower::contains).count();

        double score = Math.min(1.0,
                (charCount / 10000.0) * 0.3
                        + (wordCount / 2000.0) * 0.3
                        + ((double) indicatorCount / qualityIndicators.size()) * 0.4);
        return ocr ? score * OCR_PENALTY : score;
    }

    private static String describe(Exception e) {
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }
}
