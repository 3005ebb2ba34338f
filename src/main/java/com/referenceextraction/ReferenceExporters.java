package com.referenceextraction;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Registry of the available output formats.
 */
public final class ReferenceExporters {

    private static final Logger log = LoggerFactory.getLogger(ReferenceExporters.class);

    private static final Map<String, ReferenceExporter> EXPORTERS = new LinkedHashMap<>();

    static {
        register(new JsonReferenceExporter());
        register(new CsvReferenceExporter());
        register(new TextReportExporter());
        register(new MarkdownReferenceExporter());
        register(new BibTeXReferenceExporter());
    }

    private ReferenceExporters() {
    }

    /**
     * Files written by {@link #writeAll}, and the error message of every format that failed.
     */
    public record ExportReport(Map<String, Path> written, Map<String, String> failures) {

        public ExportReport {
            written = Map.copyOf(written);
            failures = Map.copyOf(failures);
        }

        public boolean hasFailures() {
            return !failures.isEmpty();
        }
    }

    private static void register(ReferenceExporter exporter) {
        EXPORTERS.put(exporter.format(), exporter);
    }

    public static List<String> formats() {
        return List.copyOf(EXPORTERS.keySet());
    }

    /**
     * @throws IllegalArgumentException for an unknown format
     */
    public static ReferenceExporter forFormat(String format) {
        ReferenceExporter exporter = EXPORTERS.get(format.trim().toLowerCase(Locale.ROOT));
        if (exporter == null) {
            throw new IllegalArgumentException("Unknown output format: " + format + " (available: "
                    + String.join(", ", EXPORTERS.keySet()) + ")");
        }
        return exporter;
    }

    /**
     * Writes {@code references} once per format to {@code basePath} plus the format's
     * extension. A failing format is logged and reported; the remaining formats are still
     * written.
     */
    public static ExportReport writeAll(List<ExtractedReference> references, Path basePath, List<String> formats) {
        Map<String, Path> written = new LinkedHashMap<>();
        Map<String, String> failures = new LinkedHashMap<>();

        for (String format : formats) {
            try {
                ReferenceExporter exporter = forFormat(format);
                Path target = basePath.resolveSibling(basePath.getFileName() + "." + exporter.extension());
                write(exporter, references, target);
                written.put(exporter.format(), target);
                log.info("Wrote {} references to {}", references.size(), target);
            } catch (IOException | RuntimeException e) {
                log.error("Failed to write {} output for {}: {}", format, basePath, e.getMessage());
                failures.put(format, e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
            }
        }
        return new ExportReport(written, failures);
    }

    public static void write(ReferenceExporter exporter, List<ExtractedReference> references, Path target)
            throws IOException {
        Path parent = target.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        try (Writer out = Files.newBufferedWriter(target, StandardCharsets.UTF_8)) {
            exporter.write(references, out);
        }
    }
}
