package com.referenceextraction;

import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.rendering.ImageType;
import org.apache.pdfbox.rendering.PDFRenderer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * OCR backend for scanned PDFs.
 *
 * <p>Every page is rendered with PDFBox to a temporary PNG and fed to the external
 * {@code tesseract} executable, whose stdout is the page text. The executable, language,
 * rendering resolution and per-page timeout come from {@link ExtractionConfig}.
 */
public class TesseractOcrBackend implements TextExtractionBackend {

    private static final Logger log = LoggerFactory.getLogger(TesseractOcrBackend.class);

    public static final String NAME = "ocr";

    private final String command;
    private final String language;
    private final float dpi;
    private final long timeoutSeconds;

    public TesseractOcrBackend(String command, String language, float dpi, long timeoutSeconds) {
        this.command = command;
        this.language = language;
        this.dpi = dpi;
        this.timeoutSeconds = timeoutSeconds;
    }

    public TesseractOcrBackend(ExtractionConfig config) {
        this(config.ocrCommand(), config.ocrLanguage(), config.ocrDpi(), config.ocrTimeoutSeconds());
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public boolean isOcr() {
        return true;
    }

    @Override
    public RawExtraction extract(Path document) throws IOException {
        Path workDir = Files.createTempDirectory("ocr-pages");
        try (PDDocument pdf = Loader.loadPDF(document.toFile())) {
            PDFRenderer renderer = new PDFRenderer(pdf);
            List<RawExtraction.PageText> pages = new ArrayList<>();

            for (int index = 0; index < pdf.getNumberOfPages(); index++) {
                BufferedImage image = renderer.renderImageWithDPI(index, dpi, ImageType.GRAY);
                Path png = workDir.resolve("page-" + (index + 1) + ".png");
                ImageIO.write(image, "png", png.toFile());

                String pageText = recognize(png);
                if (!pageText.isBlank()) {
                    pages.add(new RawExtraction.PageText(index + 1, pageText));
                }
                Files.deleteIfExists(png);
            }
            return RawExtraction.success(NAME, true, pages);
        } finally {
            deleteQuietly(workDir);
        }
    }

    private String recognize(Path image) throws IOException {
        Path output = image.resolveSibling(image.getFileName() + ".txt");
        ProcessBuilder pb = new ProcessBuilder(command, image.toString(), "stdout", "-l", language);
        pb.redirectOutput(output.toFile());
        pb.redirectError(ProcessBuilder.Redirect.DISCARD);

        Process process = pb.start();
        try {
            boolean finished = process.waitFor(timeoutSeconds, TimeUnit.SECONDS);
            if (!finished) {
                process.destroyForcibly();
                throw new IOException("%s timed out after %d seconds".formatted(command, timeoutSeconds));
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            process.destroyForcibly();
            throw new IOException(command + " interrupted", e);
        }

        if (process.exitValue() != 0) {
            throw new IOException("%s exited with code %d".formatted(command, process.exitValue()));
        }
        String text = Files.readString(output, StandardCharsets.UTF_8);
        Files.deleteIfExists(output);
        return text;
    }

    private static void deleteQuietly(Path dir) {
        try (var files = Files.list(dir)) {
            for (Path file : files.toList()) {
                Files.deleteIfExists(file);
            }
            Files.deleteIfExists(dir);
        } catch (IOException e) {
            log.debug("Could not remove OCR work directory {}: {}", dir, e.getMessage());
        }
    }
}
