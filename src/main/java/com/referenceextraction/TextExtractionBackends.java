package com.referenceextraction;

import java.util.ArrayList;
import java.util.List;

/**
 * Builds the default backend chain: PDFBox (positional, then stream order), plain text,
 * and OCR when enabled.
 */
public final class TextExtractionBackends {

    private TextExtractionBackends() {
    }

    public static List<TextExtractionBackend> defaults(ExtractionConfig config) {
        List<TextExtractionBackend> backends = new ArrayList<>();
        backends.add(new PdfBoxTextBackend(true));
        backends.add(new PdfBoxTextBackend(false));
        backends.add(new PlainTextBackend());
        if (config.ocrEnabled()) {
            backends.add(new TesseractOcrBackend(config));
        }
        return backends;
    }
}
