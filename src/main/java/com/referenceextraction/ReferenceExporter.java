package com.referenceextraction;

import java.io.IOException;
import java.io.Writer;
import java.util.List;

/**
 * Serializes a list of references into one output format.
 */
public interface ReferenceExporter {

    /**
     * Format identifier used in configuration, e.g. {@code json}.
     */
    String format();

    /**
     * File extension without the dot.
     */
    default String extension() {
        return format();
    }

    void write(List<ExtractedReference> references, Writer out) throws IOException;
}
