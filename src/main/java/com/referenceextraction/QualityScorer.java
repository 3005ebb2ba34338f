package com.referenceextraction;

import java.util.stream.Stream;

/**
 * Final clean-up and completeness scoring of deduplicated references.
 *
 * <p>The score replaces whatever confidence the style matcher assigned:
 * {@code 0.3*authors + 0.3*title + 0.2*year + 0.2*venue + 0.2*(filled/5)} where
 * {@code filled} counts the non-empty fields among doi, url, volume, issue and pages.
 * The style matcher's value stays available as {@link ExtractedReference#getMatchConfidence()}.
 */
public class QualityScorer {

    public static final String INVALID_YEAR_NOTE = "Invalid year detected.";

    public void finish(ExtractedReference reference) {
        String fullText = clean(reference.getFullText());
        if (!fullText.isEmpty()) {
            reference.setFullText(fullText);
        }
        reference.setTitle(clean(reference.getTitle()));
        reference.setVenue(clean(reference.getVenue()));

        Integer year = reference.getYear();
        if (year != null && (year < ExtractedReference.MIN_YEAR || year > ExtractedReference.MAX_YEAR)) {
            reference.setYear(null);
            reference.addNote(INVALID_YEAR_NOTE);
        }

        reference.setConfidenceScore(completeness(reference));
    }

    public static double completeness(ExtractedReference ref) {
        double score = 0.0;
        if (!ref.getAuthors().isEmpty()) score += 0.3;
        if (!ref.getTitle().isEmpty()) score += 0.3;
        if (ref.getYear() != null) score += 0.2;
        if (!ref.getVenue().isEmpty()) score += 0.2;

        long filledOptional = Stream.of(ref.getDoi(), ref.getUrl(), ref.getVolume(), ref.getIssue(), ref.getPages())
                .filter(s -> !s.isEmpty())
                .count();
        score += (filledOptional / 5.0) * 0.2;

        return Math.max(0.0, Math.min(1.0, score));
    }

    /**
     * Collapses whitespace runs and strips surrounding whitespace and {@code .,;:}.
     */
    public static String clean(String text) {
        if (text == null || text.isEmpty()) {
            return "";
        }
        String collapsed = text.replaceAll("\\s+", " ");
        return collapsed.replaceAll("^[\\s.,;:]+|[\\s.,;:]+$", "");
    }
}
