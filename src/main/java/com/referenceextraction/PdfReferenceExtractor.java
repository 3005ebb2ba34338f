package com.referenceextraction;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * Extracts references from documents (PDF, scanned PDF or plain text).
 *
 * <p>This class:
 * <ul>
 *   <li>validates the document (existence, size limit)</li>
 *   <li>lets the {@link TextExtractionArbiter} pick the best raw text</li>
 *   <li>runs the {@link ReferenceExtractor} pipeline on it</li>
 *   <li>filters the result by the configured minimum confidence</li>
 * </ul>
 */
public class PdfReferenceExtractor {

    private static final Logger log = LoggerFactory.getLogger(PdfReferenceExtractor.class);

    private final ExtractionConfig config;
    private final TextExtractionArbiter arbiter;
    private final ReferenceExtractor extractor;
    private final ProcessingStatistics statistics = new ProcessingStatistics();

    public PdfReferenceExtractor() {
        this(ExtractionConfig.load());
    }

    public PdfReferenceExtractor(ExtractionConfig config) {
        this(config, TextExtractionBackends.defaults(config));
    }

    public PdfReferenceExtractor(ExtractionConfig config, List<TextExtractionBackend> backends) {
        this.config = config;
        this.arbiter = new TextExtractionArbiter(backends, config.qualityIndicators());
        this.extractor = new ReferenceExtractor(config);
    }

    /**
     * Result of extracting the references of one document.
     *
     * @param document          document path, or {@code "<text>"} for raw text input
     * @param backendUsed       backend whose text won arbitration
     * @param extractionQuality quality score of the winning text
     * @param textLength        number of characters in the winning text
     * @param allReferences     every deduplicated reference, unfiltered
     * @param references        references at or above the confidence threshold
     * @param threshold         threshold that was applied
     * @param processingTime    wall-clock time spent on the document
     * @param messages          human-readable processing log
     */
    public record ExtractionResult(
            String document,
            String backendUsed,
            double extractionQuality,
            int textLength,
            List<ExtractedReference> allReferences,
            List<ExtractedReference> references,
            double threshold,
            Duration processingTime,
            List<String> messages
    ) {
        public int totalFound() {
            return allReferences.size();
        }

        public int filteredCount() {
            return references.size();
        }

        public double averageConfidence() {
            return ProcessingStatistics.average(references);
        }
    }

    public enum Status {
        SUCCESS,
        ERROR
    }

    /**
     * Outcome of one document in a batch. {@code result} is null when {@code status} is ERROR.
     */
    public record DocumentOutcome(Path document, Status status, ExtractionResult result, String error) {

        public int referencesCount() {
            return result == null ? 0 : result.filteredCount();
        }
    }

    public record BatchResult(List<DocumentOutcome> outcomes, Instant timestamp) {

        public int successful() {
            return (int) outcomes.stream().filter(o -> o.status() == Status.SUCCESS).count();
        }

        public int failed() {
            return outcomes.size() - successful();
        }

        public int totalReferences() {
            return outcomes.stream().mapToInt(DocumentOutcome::referencesCount).sum();
        }
    }

    public ExtractionConfig config() {
        return config;
    }

    public ProcessingStatistics statistics() {
        return statistics;
    }

    /**
     * Extracts references from a document on disk.
     *
     * @throws IOException                  if the file does not exist or cannot be inspected
     * @throws ReferenceExtractionException if no text or no reference could be extracted
     * @throws IllegalArgumentException     if the file exceeds the configured size limit
     */
    public ExtractionResult extractFromDocument(Path document) throws IOException {
        Instant start = Instant.now();
        try {
            if (!Files.isRegularFile(document)) {
                throw new NoSuchFileException(document.toString());
            }
            double sizeMb = Files.size(document) / (1024.0 * 1024.0);
            if (sizeMb > config.maxFileSizeMb()) {
                throw new IllegalArgumentException(String.format(Locale.ROOT,
                        "File too large: %.1fMB (max: %dMB)", sizeMb, config.maxFileSizeMb()));
            }
            log.info("Processing {} ({} MB)", document, String.format(Locale.ROOT, "%.1f", sizeMb));

            TextExtractionArbiter.Selection selection = arbiter.select(document);
            RawExtraction winner = selection.winner();

            List<String> messages = new ArrayList<>();
            for (TextExtractionArbiter.BackendFailure failure : selection.failures()) {
                messages.add("Backend " + failure.backend() + " failed: " + failure.message());
            }
            messages.add(String.format(Locale.ROOT, "Text extracted with %s (quality %.2f, %d characters)",
                    winner.backend(), winner.qualityScore(), winner.text().length()));

            ExtractionResult result = process(document.toString(), winner.backend(), winner.qualityScore(),
                    winner.text(), messages, start);
            statistics.recordSuccess(result.references());
            return result;
        } catch (IOException | RuntimeException e) {
            statistics.recordFailure(document.toString(), e.getMessage());
            throw e;
        }
    }

    /**
     * Extracts references from text that was already extracted elsewhere.
     */
    public ExtractionResult extractReferencesFromText(String text) {
        Instant start = Instant.now();
        try {
            ExtractionResult result = process("<text>", "text", 1.0, text, new ArrayList<>(), start);
            statistics.recordSuccess(result.references());
            return result;
        } catch (RuntimeException e) {
            statistics.recordFailure("<text>", e.getMessage());
            throw e;
        }
    }

    /**
     * Processes several documents. Failures are recorded per document; they do not stop the
     * batch. Documents run concurrently when {@code batch.parallelism} is above one.
     */
    public BatchResult extractBatch(List<Path> documents) {
        log.info("Starting batch extraction of {} documents", documents.size());
        List<DocumentOutcome> outcomes = new ArrayList<>();

        if (config.batchParallelism() <= 1 || documents.size() <= 1) {
            for (Path document : documents) {
                outcomes.add(processSafely(document));
            }
        } else {
            ExecutorService pool = Executors.newFixedThreadPool(Math.min(config.batchParallelism(), documents.size()));
            try {
                List<Future<DocumentOutcome>> futures = new ArrayList<>();
                for (Path document : documents) {
                    futures.add(pool.submit(() -> processSafely(document)));
                }
                for (int i = 0; i < futures.size(); i++) {
                    outcomes.add(await(futures.get(i), documents.get(i)));
                }
            } finally {
                pool.shutdownNow();
            }
        }

        BatchResult batch = new BatchResult(List.copyOf(outcomes), Instant.now());
        log.info("Batch complete: {} succeeded, {} failed, {} references", batch.successful(), batch.failed(),
                batch.totalReferences());
        return batch;
    }

    private DocumentOutcome processSafely(Path document) {
        try {
            return new DocumentOutcome(document, Status.SUCCESS, extractFromDocument(document), null);
        } catch (IOException | RuntimeException e) {
            log.error("Failed to process {}: {}", document, e.getMessage());
            return new DocumentOutcome(document, Status.ERROR, null, describe(e));
        }
    }

    private DocumentOutcome await(Future<DocumentOutcome> future, Path document) {
        try {
            return future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return new DocumentOutcome(document, Status.ERROR, null, "interrupted");
        } catch (ExecutionException e) {
            return new DocumentOutcome(document, Status.ERROR, null, describe(e.getCause()));
        }
    }

    private ExtractionResult process(String document, String backend, double quality, String text,
                                     List<String> messages, Instant start) {
        List<ExtractedReference> all = extractor.extractReferences(text);
        double threshold = config.minConfidenceThreshold();
        List<ExtractedReference> kept = all.stream()
                .filter(r -> r.getConfidenceScore() >= threshold)
                .toList();

        messages.add("Found " + all.size() + " potential references");
        messages.add(String.format(Locale.ROOT, "Kept %d references with confidence >= %.2f", kept.size(), threshold));

        Duration elapsed = Duration.between(start, Instant.now());
        log.info("{}: {} references found, {} above threshold {} in {} ms", document, all.size(), kept.size(),
                threshold, elapsed.toMillis());
        return new ExtractionResult(document, backend, quality, text.length(), all, kept, threshold, elapsed,
                List.copyOf(messages));
    }

    private static String describe(Throwable e) {
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }
}
