package com.referenceextraction;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Reference extraction pipeline for raw document text.
 *
 * <p>Stages: segmentation, style matching, metadata enrichment, deduplication and
 * completeness scoring. The returned list is not filtered by confidence; applying a
 * threshold is up to the caller (see {@link PdfReferenceExtractor}).
 */
public class ReferenceExtractor {

    private static final Logger log = LoggerFactory.getLogger(ReferenceExtractor.class);

    private final ReferenceSegmenter segmenter;
    private final CitationStyleMatcher styleMatcher;
    private final MetadataEnricher enricher;
    private final QualityScorer scorer;

    public ReferenceExtractor() {
        this(new ReferenceSegmenter(), new CitationStyleMatcher(), new MetadataEnricher(), new QualityScorer());
    }

    public ReferenceExtractor(ExtractionConfig config) {
        this(new ReferenceSegmenter(config.minReferenceLength()), new CitationStyleMatcher(),
                new MetadataEnricher(), new QualityScorer());
    }

    public ReferenceExtractor(ReferenceSegmenter segmenter, CitationStyleMatcher styleMatcher,
                              MetadataEnricher enricher, QualityScorer scorer) {
        this.segmenter = segmenter;
        this.styleMatcher = styleMatcher;
        this.enricher = enricher;
        this.scorer = scorer;
    }

    /**
     * Extracts, deduplicates and scores the references found in {@code rawText}.
     *
     * @return unmodifiable list in document order
     * @throws MalformedInputException if the text is null or blank
     * @throws NoCandidatesException   if no candidate reference was found
     */
    public List<ExtractedReference> extractReferences(String rawText) {
        if (rawText == null || rawText.isBlank()) {
            throw new MalformedInputException("Document text is empty");
        }

        ReferenceSegmenter.Segmentation segmentation = segmenter.segment(rawText);
        List<ReferenceSegmenter.Candidate> candidates = segmentation.all();
        if (candidates.isEmpty()) {
            throw new NoCandidatesException("No candidate references found"
                    + (segmentation.headerFound() ? " in the reference section" : " (no reference section header)"));
        }

        List<ExtractedReference> parsed = new ArrayList<>(candidates.size());
        for (ReferenceSegmenter.Candidate candidate : candidates) {
            ExtractedReference reference = styleMatcher.match(candidate);
            enricher.enrich(reference);
            parsed.add(reference);
        }

        ReferenceDeduplicator.Result deduplicated = ReferenceDeduplicator.deduplicate(parsed);
        List<ExtractedReference> references = deduplicated.unique();
        references.forEach(scorer::finish);

        log.info("Extracted {} references from {} candidates ({} duplicates merged)",
                references.size(), candidates.size(), deduplicated.duplicateCount());
        return references;
    }
}
