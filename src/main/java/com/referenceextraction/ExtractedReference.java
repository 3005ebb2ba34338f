package com.referenceextraction;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * One structured reference produced by the extraction pipeline.
 *
 * <p>Instances are mutable while they travel through the pipeline (the style matcher,
 * metadata enricher and quality scorer fill them in place). Callers receive them inside an
 * unmodifiable list once {@link ReferenceExtractor#extractReferences(String)} returns.
 */
public class ExtractedReference {

    public static final int MIN_YEAR = 1900;
    public static final int MAX_YEAR = 2030;

    /**
     * Keys of {@link #toFlatRecord()}, in order.
     */
    public static final List<String> FLAT_RECORD_FIELDS = List.of(
            "sequence_number", "full_text", "authors", "title", "year", "venue", "volume", "issue",
            "pages", "doi", "url", "isbn", "reference_type", "citation_style", "confidence_score", "notes");

    public enum ReferenceType {
        JOURNAL, CONFERENCE, BOOK, WEBSITE, THESIS, UNKNOWN;

        public String label() {
            return name().toLowerCase(Locale.ROOT);
        }
    }

    public enum CitationStyle {
        APA, MLA, CHICAGO, IEEE, UNKNOWN;

        public String label() {
            return name().toLowerCase(Locale.ROOT);
        }
    }

    private Integer sequenceNumber;
    private String fullText;
    private List<String> authors = new ArrayList<>();
    private String title = "";
    private Integer year;
    private String venue = "";
    private String volume = "";
    private String issue = "";
    private String pages = "";
    private String doi = "";
    private String url = "";
    private String isbn = "";
    private ReferenceType referenceType = ReferenceType.UNKNOWN;
    private CitationStyle citationStyle = CitationStyle.UNKNOWN;
    private double confidenceScore;
    private double matchConfidence;
    private ReferenceSegmenter.SegmentationStrategy segmentationStrategy;
    private String notes = "";

    public ExtractedReference(Integer sequenceNumber, String fullText) {
        if (fullText == null || fullText.isBlank()) {
            throw new IllegalArgumentException("Reference text must not be empty");
        }
        this.sequenceNumber = sequenceNumber;
        this.fullText = fullText;
    }

    public Integer getSequenceNumber() {
        return sequenceNumber;
    }

    public void setSequenceNumber(Integer sequenceNumber) {
        this.sequenceNumber = sequenceNumber;
    }

    public String getFullText() {
        return fullText;
    }

    public void setFullText(String fullText) {
        this.fullText = fullText;
    }

    public List<String> getAuthors() {
        return Collections.unmodifiableList(authors);
    }

    public void setAuthors(List<String> authors) {
        this.authors = authors == null ? new ArrayList<>() : new ArrayList<>(authors);
    }

    public String getTitle() {
        return title;
    }

    public void setTitle(String title) {
        this.title = nullToEmpty(title);
    }

    public Integer getYear() {
        return year;
    }

    public void setYear(Integer year) {
        this.year = year;
    }

    public String getVenue() {
        return venue;
    }

    public void setVenue(String venue) {
        this.venue = nullToEmpty(venue);
    }

    public String getVolume() {
        return volume;
    }

    public void setVolume(String volume) {
        this.volume = nullToEmpty(volume);
    }

    public String getIssue() {
        return issue;
    }

    public void setIssue(String issue) {
        this.issue = nullToEmpty(issue);
    }

    public String getPages() {
        return pages;
    }

    public void setPages(String pages) {
        this.pages = nullToEmpty(pages);
    }

    public String getDoi() {
        return doi;
    }

    public void setDoi(String doi) {
        this.doi = nullToEmpty(doi);
    }

    public String getUrl() {
        return url;
    }

    public void setUrl(String url) {
        this.url = nullToEmpty(url);
    }

    public String getIsbn() {
        return isbn;
    }

    public void setIsbn(String isbn) {
        this.isbn = nullToEmpty(isbn);
    }

    public ReferenceType getReferenceType() {
        return referenceType;
    }

    public void setReferenceType(ReferenceType referenceType) {
        this.referenceType = referenceType == null ? ReferenceType.UNKNOWN : referenceType;
    }

    public CitationStyle getCitationStyle() {
        return citationStyle;
    }

    public void setCitationStyle(CitationStyle citationStyle) {
        this.citationStyle = citationStyle == null ? CitationStyle.UNKNOWN : citationStyle;
    }

    public double getConfidenceScore() {
        return confidenceScore;
    }

    /**
     * Sets the confidence score, clamped to [0, 1].
     */
    public void setConfidenceScore(double confidenceScore) {
        this.confidenceScore = clamp(confidenceScore);
    }

    /**
     * Confidence assigned by the style matcher. Unlike {@link #getConfidenceScore()} it is
     * not overwritten by completeness scoring.
     */
    public double getMatchConfidence() {
        return matchConfidence;
    }

    public void setMatchConfidence(double matchConfidence) {
        this.matchConfidence = clamp(matchConfidence);
    }

    public ReferenceSegmenter.SegmentationStrategy getSegmentationStrategy() {
        return segmentationStrategy;
    }

    public void setSegmentationStrategy(ReferenceSegmenter.SegmentationStrategy segmentationStrategy) {
        this.segmentationStrategy = segmentationStrategy;
    }

    public String getNotes() {
        return notes;
    }

    public void addNote(String note) {
        if (note == null || note.isBlank()) return;
        notes = notes.isEmpty() ? note.trim() : notes + " " + note.trim();
    }

    /**
     * Flat representation used by the CSV, text and Markdown writers.
     * Authors are joined with {@code "; "}.
     */
    public Map<String, String> toFlatRecord() {
        Map<String, String> record = new LinkedHashMap<>();
        record.put("sequence_number", sequenceNumber == null ? "" : sequenceNumber.toString());
        record.put("full_text", fullText);
        record.put("authors", String.join("; ", authors));
        record.put("title", title);
        record.put("year", year == null ? "" : year.toString());
        record.put("venue", venue);
        record.put("volume", volume);
        record.put("issue", issue);
        record.put("pages", pages);
        record.put("doi", doi);
        record.put("url", url);
        record.put("isbn", isbn);
        record.put("reference_type", referenceType.label());
        record.put("citation_style", citationStyle.label());
        record.put("confidence_score", String.format(Locale.ROOT, "%.2f", confidenceScore));
        record.put("notes", notes);
        return record;
    }

    @Override
    public String toString() {
        return "ExtractedReference[" + (sequenceNumber == null ? "-" : sequenceNumber) + "] "
                + citationStyle.label() + " " + String.format(Locale.ROOT, "%.2f", confidenceScore)
                + " " + fullText;
    }

    private static double clamp(double value) {
        if (Double.isNaN(value)) return 0.0;
        return Math.max(0.0, Math.min(1.0, value));
    }

    private static String nullToEmpty(String s) {
        return s == null ? "" : s;
    }
}
