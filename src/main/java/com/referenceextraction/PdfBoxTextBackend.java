package com.referenceextraction;

import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.text.PDFTextStripper;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Extracts the text layer of a PDF with Apache PDFBox.
 *
 * <p>Two flavours are useful: sorted by position (best for multi-column papers) and raw
 * content-stream order (sometimes better for single-column documents with odd layouts).
 */
public class PdfBoxTextBackend implements TextExtractionBackend {

    public static final String POSITIONAL = "pdfbox-positional";
    public static final String STREAM = "pdfbox-stream";

    private final boolean sortByPosition;

    public PdfBoxTextBackend(boolean sortByPosition) {
        this.sortByPosition = sortByPosition;
    }

    @Override
    public String name() {
        return sortByPosition ? POSITIONAL : STREAM;
    }

    @Override
    public RawExtraction extract(Path document) throws IOException {
        try (PDDocument pdf = Loader.loadPDF(document.toFile())) {
            PDFTextStripper stripper = new PDFTextStripper();
            stripper.setSortByPosition(sortByPosition);

            List<RawExtraction.PageText> pages = new ArrayList<>();
            int pageCount = pdf.getNumberOfPages();
            for (int page = 1; page <= pageCount; page++) {
                stripper.setStartPage(page);
                stripper.setEndPage(page);
                String pageText = stripper.getText(pdf);
                if (pageText != null && !pageText.isBlank()) {
                    pages.add(new RawExtraction.PageText(page, pageText));
                }
            }
            return RawExtraction.success(name(), false, pages);
        }
    }
}
