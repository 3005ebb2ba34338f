package com.referenceextraction;

/**
 * Base class for document-level failures of the extraction pipeline.
 *
 * <p>Per-reference problems (unparsed candidates, invalid years) are never thrown; they are
 * recorded in {@link ExtractedReference#getNotes()} instead.
 */
public class ReferenceExtractionException extends RuntimeException {

    public ReferenceExtractionException(String message) {
        super(message);
    }

    public ReferenceExtractionException(String message, Throwable cause) {
        super(message, cause);
    }
}
