package com.referenceextraction;

/**
 * Raised when segmentation yields no candidate reference at all.
 */
public class NoCandidatesException extends ReferenceExtractionException {

    public NoCandidatesException(String message) {
        super(message);
    }
}
