package com.referenceextraction;

import java.util.List;

/**
 * Text produced by one {@link TextExtractionBackend} for one document.
 *
 * @param backend      name of the backend that produced it
 * @param ocr          whether the text is OCR-derived
 * @param text         full text (pages joined with newlines), empty when unsuccessful
 * @param pages        per-page breakdown
 * @param success      whether the backend considers the extraction usable
 * @param error        failure description, or {@code null}
 * @param qualityScore score in [0, 1] assigned by the arbiter (0 until scored)
 */
public record RawExtraction(
        String backend,
        boolean ocr,
        String text,
        List<PageText> pages,
        boolean success,
        String error,
        double qualityScore
) {

    public RawExtraction {
        text = text == null ? "" : text;
        pages = pages == null ? List.of() : List.copyOf(pages);
    }

    /**
     * Text of a single page.
     */
    public record PageText(int pageNumber, String text) {

        public int charCount() {
            return text.length();
        }
    }

    public static RawExtraction success(String backend, boolean ocr, List<PageText> pages) {
        StringBuilder text = new StringBuilder();
        for (PageText page : pages) {
            if (text.length() > 0) {
                text.append('\n');
            }
            text.append(page.text());
        }
        return new RawExtraction(backend, ocr, text.toString(), pages, true, null, 0.0);
    }

    public static RawExtraction failure(String backend, boolean ocr, String error) {
        return new RawExtraction(backend, ocr, "", List.of(), false, error, 0.0);
    }

    public RawExtraction withQualityScore(double score) {
        return new RawExtraction(backend, ocr, text, pages, success, error, score);
    }
}
