package com.referenceextraction;

import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.PDPageContentStream;
import org.apache.pdfbox.pdmodel.font.PDType1Font;
import org.apache.pdfbox.pdmodel.font.Standard14Fonts;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.List;
import java.util.Properties;

import static org.junit.jupiter.api.Assertions.*;

class PdfReferenceExtractorJUnitTest {

    private static final String PAPER = """
            Introduction
            Citation analysis has a long history.

            References
            [1] Smith, J. A. (2023). Machine learning in research. AI Journal, 15(3), 45-62.
            [2] Johnson, M., & Brown, K. (2022). Data Science Fundamentals. Academic Press.
            [3] Some loose remark about related work without structure
            """;

    @TempDir
    Path tempDir;

    private static ExtractionConfig configWithoutOcr() {
        Properties props = new Properties();
        props.setProperty("ocr.enabled", "false");
        return ExtractionConfig.fromProperties(props);
    }

    private Path writeText(String name, String content) throws IOException {
        Path file = tempDir.resolve(name);
        Files.writeString(file, content, StandardCharsets.UTF_8);
        return file;
    }

    @Test
    void extractFromDocument_plainTextFile() throws IOException {
        PdfReferenceExtractor extractor = new PdfReferenceExtractor(configWithoutOcr());

        PdfReferenceExtractor.ExtractionResult result = extractor.extractFromDocument(writeText("paper.txt", PAPER));

        assertEquals(PlainTextBackend.NAME, result.backendUsed());
        assertEquals(3, result.totalFound());
        assertEquals(2, result.filteredCount(), "Unstructured reference scores below the default threshold");
        assertTrue(result.messages().stream().anyMatch(m -> m.startsWith("Backend pdfbox-positional failed")));
        assertTrue(result.averageConfidence() > 0.3);
        assertEquals(0.3, result.threshold(), 1e-9);
    }

    @Test
    void extractFromDocument_pdfTextLayer() throws IOException {
        Path pdf = tempDir.resolve("paper.pdf");
        try (PDDocument document = new PDDocument()) {
            PDPage page = new PDPage();
            document.addPage(page);
            try (PDPageContentStream content = new PDPageContentStream(document, page)) {
                content.beginText();
                content.setFont(new PDType1Font(Standard14Fonts.FontName.HELVETICA), 10);
                content.setLeading(14);
                content.newLineAtOffset(50, 700);
                content.showText("References");
                content.newLine();
                content.showText("[1] Smith, J. A. (2023). Machine learning in research. AI Journal, 15(3), 45-62.");
                content.newLine();
                content.showText("[2] Johnson, M., & Brown, K. (2022). Data Science Fundamentals. Academic Press.");
                content.endText();
            }
            document.save(pdf.toFile());
        }

        PdfReferenceExtractor extractor = new PdfReferenceExtractor(configWithoutOcr());
        PdfReferenceExtractor.ExtractionResult result = extractor.extractFromDocument(pdf);

        assertTrue(result.backendUsed().startsWith("pdfbox"));
        assertEquals(2, result.totalFound());
        assertTrue(result.references().stream().anyMatch(r -> Integer.valueOf(2023).equals(r.getYear())));
        assertTrue(result.messages().stream().anyMatch(m -> m.startsWith("Backend plain-text failed")));
    }

    @Test
    void extractFromDocument_missingFile() {
        PdfReferenceExtractor extractor = new PdfReferenceExtractor(configWithoutOcr());

        assertThrows(NoSuchFileException.class, () -> extractor.extractFromDocument(tempDir.resolve("missing.pdf")));
        assertEquals(1, extractor.statistics().snapshot().errors().size());
    }

    @Test
    void extractFromDocument_rejectsOversizedFiles() throws IOException {
        Properties props = new Properties();
        props.setProperty("ocr.enabled", "false");
        props.setProperty("extraction.max-file-size-mb", "0");
        PdfReferenceExtractor extractor = new PdfReferenceExtractor(ExtractionConfig.fromProperties(props));
        Path file = writeText("paper.txt", PAPER);

        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> extractor.extractFromDocument(file));
        assertTrue(e.getMessage().startsWith("File too large"));
    }

    @Test
    void extractReferencesFromText_appliesThreshold() {
        PdfReferenceExtractor extractor = new PdfReferenceExtractor(
                configWithoutOcr().withMinConfidenceThreshold(0.5), List.of(new PlainTextBackend()));

        PdfReferenceExtractor.ExtractionResult result = extractor.extractReferencesFromText(PAPER);

        assertEquals(3, result.totalFound());
        assertEquals(2, result.filteredCount());
        assertTrue(result.references().stream().allMatch(r -> r.getConfidenceScore() >= 0.5));
        assertTrue(result.allReferences().stream().anyMatch(r -> r.getTitle().isEmpty()));
        assertEquals("text", result.backendUsed());
        assertEquals(1.0, result.extractionQuality(), 1e-9);
    }

    @Test
    void extractBatch_recordsFailuresPerDocument() throws IOException {
        PdfReferenceExtractor extractor = new PdfReferenceExtractor(configWithoutOcr());
        Path good = writeText("good.txt", PAPER);
        Path missing = tempDir.resolve("missing.txt");

        PdfReferenceExtractor.BatchResult batch = extractor.extractBatch(List.of(good, missing));

        assertEquals(1, batch.successful());
        assertEquals(1, batch.failed());
        assertEquals(2, batch.totalReferences());
        assertEquals(PdfReferenceExtractor.Status.ERROR, batch.outcomes().get(1).status());
        assertNotNull(batch.outcomes().get(1).error());

        ProcessingStatistics.Snapshot stats = extractor.statistics().snapshot();
        assertEquals(1, stats.documentsProcessed());
        assertEquals(2, stats.referencesExtracted());
        assertEquals(1, stats.errors().size());
        assertEquals(missing.toString(), stats.errors().get(0).document());
    }

    @Test
    void extractBatch_parallelKeepsInputOrder() throws IOException {
        PdfReferenceExtractor extractor = new PdfReferenceExtractor(configWithoutOcr().withBatchParallelism(3));
        List<Path> documents = List.of(writeText("a.txt", PAPER), writeText("b.txt", PAPER), writeText("c.txt", PAPER));

        PdfReferenceExtractor.BatchResult batch = extractor.extractBatch(documents);

        assertEquals(documents, batch.outcomes().stream().map(PdfReferenceExtractor.DocumentOutcome::document).toList());
        assertEquals(3, batch.successful());
        assertEquals(3, extractor.statistics().snapshot().documentsProcessed());
    }

    @Test
    void statistics_resetClearsTotals() {
        PdfReferenceExtractor extractor = new PdfReferenceExtractor(configWithoutOcr(), List.of(new PlainTextBackend()));
        extractor.extractReferencesFromText(PAPER);

        extractor.statistics().reset();

        ProcessingStatistics.Snapshot stats = extractor.statistics().snapshot();
        assertEquals(0, stats.documentsProcessed());
        assertEquals(0.0, stats.averageConfidence(), 1e-9);
    }
}
