package com.referenceextraction;

import java.io.IOException;
import java.nio.file.Path;

/**
 * A source of raw document text (PDF text layer, OCR, plain text file...).
 *
 * <p>Implementations may block on file or subprocess I/O. They either return a
 * {@link RawExtraction} (successful or not) or throw; the {@link TextExtractionArbiter}
 * treats both a thrown exception and an unsuccessful result as a backend failure.
 */
public interface TextExtractionBackend {

    /**
     * Short identifier used in logs and results, e.g. {@code pdfbox-positional}.
     */
    String name();

    /**
     * Whether the text is OCR-derived. OCR results are scored lower by the arbiter and
     * lose ties against non-OCR backends.
     */
    default boolean isOcr() {
        return false;
    }

    RawExtraction extract(Path document) throws IOException;
}
