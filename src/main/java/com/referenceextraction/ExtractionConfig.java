package com.referenceextraction;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Properties;

/**
 * Pipeline settings.
 *
 * <p>{@link #load()} reads {@code reference-extraction.properties} from the classpath and
 * lets JVM system properties with the same keys override individual values, e.g.
 * {@code -Dextraction.min-confidence-threshold=0.5}.
 *
 * @param minConfidenceThreshold references scoring below this are filtered out by callers
 * @param minReferenceLength     candidates with a shorter body are dropped during segmentation
 * @param qualityIndicators      vocabulary used to score raw text extractions
 * @param maxFileSizeMb          documents larger than this are rejected
 * @param ocrEnabled             whether the OCR backend takes part in arbitration
 * @param ocrCommand             tesseract executable
 * @param ocrLanguage            tesseract language code
 * @param ocrDpi                 page rendering resolution for OCR
 * @param ocrTimeoutSeconds      per-page OCR timeout
 * @param outputFormats          export formats written by the command-line app
 * @param batchParallelism       number of documents processed concurrently in a batch
 */
public record ExtractionConfig(
        double minConfidenceThreshold,
        int minReferenceLength,
        List<String> qualityIndicators,
        long maxFileSizeMb,
        boolean ocrEnabled,
        String ocrCommand,
        String ocrLanguage,
        float ocrDpi,
        long ocrTimeoutSeconds,
        List<String> outputFormats,
        int batchParallelism
) {

    public static final String RESOURCE = "reference-extraction.properties";

    public ExtractionConfig {
        if (minConfidenceThreshold < 0.0 || minConfidenceThreshold > 1.0) {
            throw new IllegalArgumentException("extraction.min-confidence-threshold must be in [0, 1]: " + minConfidenceThreshold);
        }
        if (minReferenceLength < 0) {
            throw new IllegalArgumentException("extraction.min-reference-length must not be negative: " + minReferenceLength);
        }
        if (batchParallelism < 1) {
            throw new IllegalArgumentException("batch.parallelism must be at least 1: " + batchParallelism);
        }
        qualityIndicators = qualityIndicators == null || qualityIndicators.isEmpty()
                ? TextExtractionArbiter.DEFAULT_QUALITY_INDICATORS
                : List.copyOf(qualityIndicators);
        outputFormats = outputFormats == null ? List.of() : List.copyOf(outputFormats);
    }

    public static ExtractionConfig defaults() {
        return new ExtractionConfig(
                0.3,
                ReferenceSegmenter.DEFAULT_MIN_LENGTH,
                TextExtractionArbiter.DEFAULT_QUALITY_INDICATORS,
                50,
                true,
                "tesseract",
                "eng",
                300f,
                300,
                List.of("json", "csv", "txt", "md", "bib"),
                1
        );
    }

    /**
     * Loads the classpath defaults, then applies system property overrides.
     */
    public static ExtractionConfig load() {
        Properties props = new Properties();
        try (InputStream in = ExtractionConfig.class.getClassLoader().getResourceAsStream(RESOURCE)) {
            if (in != null) {
                try (Reader reader = new InputStreamReader(in, StandardCharsets.UTF_8)) {
                    props.load(reader);
                }
            }
        } catch (IOException e) {
            throw new IllegalStateException("Could not read " + RESOURCE, e);
        }
        for (String key : props.stringPropertyNames()) {
            String override = System.getProperty(key);
            if (override != null) {
                props.setProperty(key, override);
            }
        }
        return fromProperties(props);
    }

    /**
     * Builds a configuration from explicit properties; missing keys keep their defaults.
     */
    public static ExtractionConfig fromProperties(Properties props) {
        ExtractionConfig d = defaults();
        return new ExtractionConfig(
                doubleValue(props, "extraction.min-confidence-threshold", d.minConfidenceThreshold()),
                intValue(props, "extraction.min-reference-length", d.minReferenceLength()),
                listValue(props, "extraction.quality-indicators", d.qualityIndicators()),
                longValue(props, "extraction.max-file-size-mb", d.maxFileSizeMb()),
                booleanValue(props, "ocr.enabled", d.ocrEnabled()),
                props.getProperty("ocr.command", d.ocrCommand()).trim(),
                props.getProperty("ocr.language", d.ocrLanguage()).trim(),
                (float) doubleValue(props, "ocr.dpi", d.ocrDpi()),
                longValue(props, "ocr.timeout-seconds", d.ocrTimeoutSeconds()),
                listValue(props, "output.formats", d.outputFormats()),
                intValue(props, "batch.parallelism", d.batchParallelism())
        );
    }

    public ExtractionConfig withMinConfidenceThreshold(double threshold) {
        return new ExtractionConfig(threshold, minReferenceLength, qualityIndicators, maxFileSizeMb,
                ocrEnabled, ocrCommand, ocrLanguage, ocrDpi, ocrTimeoutSeconds, outputFormats, batchParallelism);
    }

    public ExtractionConfig withOutputFormats(List<String> formats) {
        return new ExtractionConfig(minConfidenceThreshold, minReferenceLength, qualityIndicators, maxFileSizeMb,
                ocrEnabled, ocrCommand, ocrLanguage, ocrDpi, ocrTimeoutSeconds, formats, batchParallelism);
    }

    public ExtractionConfig withBatchParallelism(int parallelism) {
        return new ExtractionConfig(minConfidenceThreshold, minReferenceLength, qualityIndicators, maxFileSizeMb,
                ocrEnabled, ocrCommand, ocrLanguage, ocrDpi, ocrTimeoutSeconds, outputFormats, parallelism);
    }

    private static double doubleValue(Properties props, String key, double fallback) {
        String raw = props.getProperty(key);
        if (raw == null || raw.isBlank()) return fallback;
        try {
            return Double.parseDouble(raw.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid number for " + key + ": " + raw, e);
        }
    }

    private static long longValue(Properties props, String key, long fallback) {
        String raw = props.getProperty(key);
        if (raw == null || raw.isBlank()) return fallback;
        try {
            return Long.parseLong(raw.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid integer for " + key + ": " + raw, e);
        }
    }

    private static int intValue(Properties props, String key, int fallback) {
        return Math.toIntExact(longValue(props, key, fallback));
    }

    private static boolean booleanValue(Properties props, String key, boolean fallback) {
        String raw = props.getProperty(key);
        if (raw == null || raw.isBlank()) return fallback;
        return switch (raw.trim().toLowerCase(Locale.ROOT)) {
            case "true", "yes", "on" -> true;
            case "false", "no", "off" -> false;
            default -> throw new IllegalArgumentException("Invalid boolean for " + key + ": " + raw);
        };
    }

    private static List<String> listValue(Properties props, String key, List<String> fallback) {
        String raw = props.getProperty(key);
        if (raw == null || raw.isBlank()) return fallback;
        return Arrays.stream(raw.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .toList();
    }
}
