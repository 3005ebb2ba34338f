package com.referenceextraction;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * JSON output: an {@code extraction_metadata} block followed by the references, with
 * {@code authors} kept as an array.
 */
public class JsonReferenceExporter implements ReferenceExporter {

    public static final String FORMAT_VERSION = "1.0";

    private static final ObjectMapper MAPPER = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);

    @Override
    public String format() {
        return "json";
    }

    @Override
    public void write(List<ExtractedReference> references, Writer out) throws IOException {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("total_references", references.size());
        metadata.put("extraction_timestamp", Instant.now().toString());
        metadata.put("format_version", FORMAT_VERSION);

        Map<String, Object> envelope = new LinkedHashMap<>();
        envelope.put("extraction_metadata", metadata);
        envelope.put("references", references.stream().map(JsonReferenceExporter::toMap).toList());

        out.write(MAPPER.writeValueAsString(envelope));
    }

    /**
     * Renders a batch summary: totals plus one entry per document.
     */
    public String batchSummary(PdfReferenceExtractor.BatchResult batch) {
        Map<String, Object> summary = new LinkedHashMap<>();
        summary.put("total_files", batch.outcomes().size());
        summary.put("successful_extractions", batch.successful());
        summary.put("failed_extractions", batch.failed());
        summary.put("total_references_extracted", batch.totalReferences());
        summary.put("processing_timestamp", batch.timestamp().toString());

        Map<String, Object> individual = new LinkedHashMap<>();
        for (PdfReferenceExtractor.DocumentOutcome outcome : batch.outcomes()) {
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("status", outcome.status().name().toLowerCase(Locale.ROOT));
            entry.put("references_count", outcome.referencesCount());
            entry.put("processing_time_ms", outcome.result() == null ? 0 : outcome.result().processingTime().toMillis());
            entry.put("error", outcome.error());
            individual.put(outcome.document().toString(), entry);
        }

        Map<String, Object> root = new LinkedHashMap<>();
        root.put("batch_summary", summary);
        root.put("individual_results", individual);
        try {
            return MAPPER.writeValueAsString(root);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException(e);
        }
    }

    static Map<String, Object> toMap(ExtractedReference ref) {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("sequence_number", ref.getSequenceNumber());
        map.put("full_text", ref.getFullText());
        map.put("authors", ref.getAuthors());
        map.put("title", ref.getTitle());
        map.put("year", ref.getYear());
        map.put("venue", ref.getVenue());
        map.put("volume", ref.getVolume());
        map.put("issue", ref.getIssue());
        map.put("pages", ref.getPages());
        map.put("doi", ref.getDoi());
        map.put("url", ref.getUrl());
        map.put("isbn", ref.getIsbn());
        map.put("reference_type", ref.getReferenceType().label());
        map.put("citation_style", ref.getCitationStyle().label());
        map.put("confidence_score", ref.getConfidenceScore());
        map.put("match_confidence", ref.getMatchConfidence());
        map.put("segmentation_strategy", ref.getSegmentationStrategy() == null
                ? null : ref.getSegmentationStrategy().name().toLowerCase(Locale.ROOT));
        map.put("notes", ref.getNotes());
        return map;
    }
}
