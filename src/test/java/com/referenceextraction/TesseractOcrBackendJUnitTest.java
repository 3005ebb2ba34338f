package com.referenceextraction;

import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.PDPageContentStream;
import org.apache.pdfbox.pdmodel.font.PDType1Font;
import org.apache.pdfbox.pdmodel.font.Standard14Fonts;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.DisabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.PosixFilePermissions;
import java.util.List;
import java.util.Properties;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

// The stub executables are POSIX shell scripts.
@DisabledOnOs(OS.WINDOWS)
class TesseractOcrBackendJUnitTest {

    private static final String RECOGNIZED = """
            References
            [1] Smith, J. A. (2023). Machine learning in research. AI Journal, 15(3), 45-62.
            """;

    @TempDir
    Path tempDir;

    private Path scan;

    @BeforeEach
    void createScan() throws IOException {
        scan = tempDir.resolve("scan.pdf");
        try (PDDocument document = new PDDocument()) {
            PDPage page = new PDPage();
            document.addPage(page);
            try (PDPageContentStream content = new PDPageContentStream(document, page)) {
                content.beginText();
                content.setFont(new PDType1Font(Standard14Fonts.FontName.HELVETICA), 12);
                content.newLineAtOffset(50, 700);
                content.showText("References");
                content.endText();
            }
            document.save(scan.toFile());
        }
    }

    private Path script(String name, String body) throws IOException {
        Path script = tempDir.resolve(name);
        Files.writeString(script, "#!/bin/sh\n" + body + "\n", StandardCharsets.UTF_8);
        Files.setPosixFilePermissions(script, PosixFilePermissions.fromString("rwx------"));
        return script;
    }

    private static TesseractOcrBackend backend(Path command, long timeoutSeconds) {
        return new TesseractOcrBackend(command.toString(), "eng", 72f, timeoutSeconds);
    }

    private static Set<Path> ocrWorkDirs() throws IOException {
        try (Stream<Path> entries = Files.list(Path.of(System.getProperty("java.io.tmpdir")))) {
            return entries.filter(p -> p.getFileName().toString().startsWith("ocr-pages"))
                    .collect(Collectors.toSet());
        }
    }

    @Test
    void extract_returnsRecognizedPageText() throws IOException {
        Path stub = script("fake-tesseract", "cat <<'OUT'\n" + RECOGNIZED + "OUT");
        TesseractOcrBackend backend = backend(stub, 30);

        RawExtraction result = backend.extract(scan);

        assertTrue(backend.isOcr());
        assertEquals(TesseractOcrBackend.NAME, result.backend());
        assertTrue(result.ocr());
        assertTrue(result.success());
        assertEquals(1, result.pages().size());
        assertEquals(1, result.pages().get(0).pageNumber());
        assertEquals(RECOGNIZED, result.text());
    }

    @Test
    void extract_passesImageAndLanguageToCommand() throws IOException {
        Path stub = script("echo-args", "echo \"$2 $3 $4\"\ncase \"$1\" in *.png) ;; *) exit 3 ;; esac");

        RawExtraction result = backend(stub, 30).extract(scan);

        assertEquals("stdout -l eng", result.text().strip());
    }

    @Test
    void select_appliesOcrPenalty() throws IOException {
        Path stub = script("fake-tesseract", "cat <<'OUT'\n" + RECOGNIZED + "OUT");
        TextExtractionArbiter arbiter = new TextExtractionArbiter(List.of(backend(stub, 30)));

        TextExtractionArbiter.Selection selection = arbiter.select(scan);

        RawExtraction winner = selection.winner();
        assertEquals(TesseractOcrBackend.NAME, winner.backend());
        assertEquals(arbiter.score(winner.text(), false) * 0.8, winner.qualityScore(), 1e-9);
    }

    @Test
    void extract_nonZeroExitFails() throws IOException {
        Path stub = script("failing-tesseract", "exit 1");

        IOException e = assertThrows(IOException.class, () -> backend(stub, 30).extract(scan));
        assertTrue(e.getMessage().contains("exited with code 1"), e.getMessage());
    }

    @Test
    void extract_timeoutKillsProcess() throws IOException {
        Path stub = script("slow-tesseract", "sleep 10");

        IOException e = assertThrows(IOException.class, () -> backend(stub, 1).extract(scan));
        assertTrue(e.getMessage().contains("timed out after 1 seconds"), e.getMessage());
    }

    @Test
    void select_recordsMissingExecutableAsBackendFailure() {
        TextExtractionArbiter arbiter = new TextExtractionArbiter(
                List.of(backend(tempDir.resolve("no-such-tesseract"), 30)));

        NoTextExtractedException e = assertThrows(NoTextExtractedException.class, () -> arbiter.select(scan));
        assertEquals(1, e.failures().size());
        assertEquals(TesseractOcrBackend.NAME, e.failures().get(0).backend());
    }

    @Test
    void extract_removesWorkDirectory() throws IOException {
        Path ok = script("fake-tesseract", "echo text");
        Path failing = script("failing-tesseract", "exit 1");
        Set<Path> before = ocrWorkDirs();

        backend(ok, 30).extract(scan);
        assertThrows(IOException.class, () -> backend(failing, 30).extract(scan));

        Set<Path> leftover = ocrWorkDirs();
        leftover.removeAll(before);
        assertTrue(leftover.isEmpty(), "Left behind: " + leftover);
    }

    @Test
    void constructor_readsOcrSettingsFromConfig() throws IOException {
        Path stub = script("fake-tesseract", "echo configured");
        Properties props = new Properties();
        props.setProperty("ocr.command", stub.toString());
        props.setProperty("ocr.dpi", "72");

        RawExtraction result = new TesseractOcrBackend(ExtractionConfig.fromProperties(props)).extract(scan);

        assertEquals("configured", result.text().strip());
    }
}
