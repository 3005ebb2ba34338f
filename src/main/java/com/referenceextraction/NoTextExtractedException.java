package com.referenceextraction;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Raised by the {@link TextExtractionArbiter} when every configured backend failed.
 */
public class NoTextExtractedException extends ReferenceExtractionException {

    private final List<TextExtractionArbiter.BackendFailure> failures;

    public NoTextExtractedException(String document, List<TextExtractionArbiter.BackendFailure> failures) {
        super("No text could be extracted from " + document + describe(failures));
        this.failures = List.copyOf(failures);
    }

    public List<TextExtractionArbiter.BackendFailure> failures() {
        return failures;
    }

    private static String describe(List<TextExtractionArbiter.BackendFailure> failures) {
        if (failures.isEmpty()) {
            return " (no backends configured)";
        }
        return failures.stream()
                .map(f -> f.backend() + ": " + f.message())
                .collect(Collectors.joining("; ", " (", ")"));
    }
}
