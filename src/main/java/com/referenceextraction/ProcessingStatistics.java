package com.referenceextraction;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Running totals across the documents handled by one {@link PdfReferenceExtractor}.
 * Safe to update from concurrent batch workers.
 */
public class ProcessingStatistics {

    public record ProcessingError(String document, String message, Instant timestamp) {}

    public record Snapshot(
            int documentsProcessed,
            int referencesExtracted,
            double averageConfidence,
            List<ProcessingError> errors
    ) {}

    private int documentsProcessed;
    private int referencesExtracted;
    private int documentsWithReferences;
    private double averageConfidence;
    private final List<ProcessingError> errors = new ArrayList<>();

    /**
     * Records a successfully processed document and folds its average confidence into the
     * running average. The average is taken over documents that kept at least one
     * reference; a document with none counts as processed but has no confidence to add.
     */
    public synchronized void recordSuccess(List<ExtractedReference> keptReferences) {
        documentsProcessed++;
        referencesExtracted += keptReferences.size();
        if (!keptReferences.isEmpty()) {
            documentsWithReferences++;
            double documentAverage = average(keptReferences);
            averageConfidence += (documentAverage - averageConfidence) / documentsWithReferences;
        }
    }

    public synchronized void recordFailure(String document, String message) {
        errors.add(new ProcessingError(document, message, Instant.now()));
    }

    public synchronized Snapshot snapshot() {
        return new Snapshot(documentsProcessed, referencesExtracted, averageConfidence, List.copyOf(errors));
    }

    public synchronized void reset() {
        documentsProcessed = 0;
        referencesExtracted = 0;
        documentsWithReferences = 0;
        averageConfidence = 0.0;
        errors.clear();
    }

    static double average(List<ExtractedReference> references) {
        return references.stream()
                .mapToDouble(ExtractedReference::getConfidenceScore)
                .average()
                .orElse(0.0);
    }
}
