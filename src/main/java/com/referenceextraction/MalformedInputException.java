package com.referenceextraction;

/**
 * Raised when the raw text handed to the pipeline is null, empty or whitespace only.
 */
public class MalformedInputException extends ReferenceExtractionException {

    public MalformedInputException(String message) {
        super(message);
    }
}
