package com.referenceextraction;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ProcessingStatisticsJUnitTest {

    private static ExtractedReference scored(double confidence) {
        ExtractedReference ref = new ExtractedReference(1, "Smith, J. (2020). A reference title. Venue.");
        ref.setConfidenceScore(confidence);
        return ref;
    }

    @Test
    void recordSuccess_averagesOverDocumentsWithReferences() {
        ProcessingStatistics stats = new ProcessingStatistics();

        stats.recordSuccess(List.of(scored(0.4), scored(0.6)));
        stats.recordSuccess(List.of());
        stats.recordSuccess(List.of(scored(1.0)));

        ProcessingStatistics.Snapshot snapshot = stats.snapshot();
        assertEquals(3, snapshot.documentsProcessed());
        assertEquals(3, snapshot.referencesExtracted());
        assertEquals(0.75, snapshot.averageConfidence(), 1e-9);
    }

    @Test
    void recordSuccess_emptyFirstDocumentDoesNotDiluteAverage() {
        ProcessingStatistics stats = new ProcessingStatistics();

        stats.recordSuccess(List.of());
        stats.recordSuccess(List.of(scored(0.8)));

        assertEquals(0.8, stats.snapshot().averageConfidence(), 1e-9);
    }

    @Test
    void recordFailure_keepsDocumentAndMessage() {
        ProcessingStatistics stats = new ProcessingStatistics();

        stats.recordFailure("paper.pdf", "broken");

        ProcessingStatistics.ProcessingError error = stats.snapshot().errors().get(0);
        assertEquals("paper.pdf", error.document());
        assertEquals("broken", error.message());
        assertNotNull(error.timestamp());
        assertEquals(0, stats.snapshot().documentsProcessed());
    }

    @Test
    void reset_startsAverageAfresh() {
        ProcessingStatistics stats = new ProcessingStatistics();
        stats.recordSuccess(List.of(scored(0.2)));

        stats.reset();
        stats.recordSuccess(List.of(scored(0.9)));

        assertEquals(0.9, stats.snapshot().averageConfidence(), 1e-9);
        assertEquals(1, stats.snapshot().documentsProcessed());
    }
}
