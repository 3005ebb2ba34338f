package com.referenceextraction;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;

/**
 * Command-line entry point.
 *
 * <pre>
 * reference-extraction [--threshold X] [--formats json,csv] [--output DIR] [--parallel N] &lt;file&gt;...
 * </pre>
 *
 * One file is extracted on its own; several files run as a batch and additionally produce
 * {@code batch_summary.json}. Exit codes: 0 on success, 1 if any document failed, 2 on
 * invalid arguments.
 */
public class ReferenceExtractionApp {

    private static final Logger log = LoggerFactory.getLogger(ReferenceExtractionApp.class);

    public static final int EXIT_OK = 0;
    public static final int EXIT_FAILURE = 1;
    public static final int EXIT_USAGE = 2;

    private static final String USAGE =
            "Usage: reference-extraction [--threshold X] [--formats json,csv,txt,md,bib] [--output DIR] "
                    + "[--parallel N] <file>...";

    private final PrintStream out;
    private final PrintStream err;

    public ReferenceExtractionApp(PrintStream out, PrintStream err) {
        this.out = out;
        this.err = err;
    }

    public static void main(String[] args) {
        int code = new ReferenceExtractionApp(System.out, System.err).run(args);
        System.exit(code);
    }

    record Arguments(ExtractionConfig config, Path outputDir, List<Path> documents) {}

    static final class UsageException extends Exception {
        UsageException(String message) {
            super(message);
        }
    }

    public int run(String[] args) {
        Arguments arguments;
        try {
            arguments = parse(args, ExtractionConfig.load());
        } catch (UsageException | IllegalArgumentException e) {
            err.println("Error: " + e.getMessage());
            err.println(USAGE);
            return EXIT_USAGE;
        }

        PdfReferenceExtractor extractor = new PdfReferenceExtractor(arguments.config());
        if (arguments.documents().size() == 1) {
            return runSingle(extractor, arguments.documents().get(0), arguments);
        }
        return runBatch(extractor, arguments);
    }

    static Arguments parse(String[] args, ExtractionConfig base) throws UsageException {
        ExtractionConfig config = base;
        Path outputDir = Path.of(".");
        List<Path> documents = new ArrayList<>();

        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            switch (arg) {
                case "--threshold" -> config = config.withMinConfidenceThreshold(parseDouble(arg, value(args, ++i, arg)));
                case "--formats" -> {
                    List<String> formats = Arrays.stream(value(args, ++i, arg).split(","))
                            .map(s -> s.trim().toLowerCase(Locale.ROOT))
                            .filter(s -> !s.isEmpty())
                            .toList();
                    for (String format : formats) {
                        ReferenceExporters.forFormat(format);
                    }
                    config = config.withOutputFormats(formats);
                }
                case "--output" -> outputDir = Path.of(value(args, ++i, arg));
                case "--parallel" -> config = config.withBatchParallelism(parseInt(arg, value(args, ++i, arg)));
                default -> {
                    if (arg.startsWith("--")) {
                        throw new UsageException("Unknown option " + arg);
                    }
                    documents.add(Path.of(arg));
                }
            }
        }
        if (documents.isEmpty()) {
            throw new UsageException("No input files given");
        }
        return new Arguments(config, outputDir, List.copyOf(documents));
    }

    private int runSingle(PdfReferenceExtractor extractor, Path document, Arguments arguments) {
        try {
            PdfReferenceExtractor.ExtractionResult result = extractor.extractFromDocument(document);
            printResult(result);
            ReferenceExporters.ExportReport report = export(result, document, arguments);
            return report.hasFailures() ? EXIT_FAILURE : EXIT_OK;
        } catch (IOException | RuntimeException e) {
            log.error("Extraction failed for {}", document, e);
            err.println("Extraction failed for " + document + ": " + e.getMessage());
            return EXIT_FAILURE;
        }
    }

    private int runBatch(PdfReferenceExtractor extractor, Arguments arguments) {
        PdfReferenceExtractor.BatchResult batch = extractor.extractBatch(arguments.documents());
        boolean exportFailed = false;

        for (PdfReferenceExtractor.DocumentOutcome outcome : batch.outcomes()) {
            if (outcome.status() == PdfReferenceExtractor.Status.SUCCESS) {
                printResult(outcome.result());
                exportFailed |= export(outcome.result(), outcome.document(), arguments).hasFailures();
            } else {
                err.println("Extraction failed for " + outcome.document() + ": " + outcome.error());
            }
        }

        Path summary = arguments.outputDir().resolve("batch_summary.json");
        try {
            Files.createDirectories(arguments.outputDir());
            Files.writeString(summary, new JsonReferenceExporter().batchSummary(batch), StandardCharsets.UTF_8);
        } catch (IOException e) {
            log.error("Could not write {}", summary, e);
            exportFailed = true;
        }

        out.printf(Locale.ROOT, "Batch: %d files, %d succeeded, %d failed, %d references%n",
                batch.outcomes().size(), batch.successful(), batch.failed(), batch.totalReferences());
        return batch.failed() > 0 || exportFailed ? EXIT_FAILURE : EXIT_OK;
    }

    private ReferenceExporters.ExportReport export(PdfReferenceExtractor.ExtractionResult result, Path document,
                                                   Arguments arguments) {
        Path base = arguments.outputDir().resolve(baseName(document) + "_references");
        ReferenceExporters.ExportReport report =
                ReferenceExporters.writeAll(result.references(), base, arguments.config().outputFormats());
        report.written().values().stream().sorted().forEach(p -> out.println("  wrote " + p));
        report.failures().forEach((format, message) -> err.println("  " + format + " failed: " + message));
        return report;
    }

    private void printResult(PdfReferenceExtractor.ExtractionResult result) {
        out.printf(Locale.ROOT, "%s: %d references found, %d kept (threshold %.2f, average confidence %.2f, backend %s)%n",
                result.document(), result.totalFound(), result.filteredCount(), result.threshold(),
                result.averageConfidence(), result.backendUsed());
    }

    static String baseName(Path document) {
        String name = document.getFileName().toString();
        int dot = name.lastIndexOf('.');
        return dot > 0 ? name.substring(0, dot) : name;
    }

    private static String value(String[] args, int index, String option) throws UsageException {
        if (index >= args.length) {
            throw new UsageException("Missing value for " + option);
        }
        return args[index];
    }

    private static double parseDouble(String option, String raw) throws UsageException {
        try {
            return Double.parseDouble(raw);
        } catch (NumberFormatException e) {
            throw new UsageException("Invalid number for " + option + ": " + raw);
        }
    }

    private static int parseInt(String option, String raw) throws UsageException {
        try {
            return Integer.parseInt(raw);
        } catch (NumberFormatException e) {
            throw new UsageException("Invalid integer for " + option + ": " + raw);
        }
    }
}
