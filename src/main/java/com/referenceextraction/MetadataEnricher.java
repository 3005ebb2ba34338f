package com.referenceextraction;

import com.referenceextraction.ExtractedReference.ReferenceType;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Pulls auxiliary identifiers out of the raw reference text and classifies its type.
 *
 * <p>Every pattern runs independently of the others and of the citation grammar that
 * matched (if any). A field is only written when its pattern finds something, so values
 * captured by the grammar are not cleared.
 */
public class MetadataEnricher {

    // Supports "doi: 10.x/y" as well as resolver URLs
    private static final Pattern DOI_PATTERN = Pattern.compile(
            "(?:doi:\\s*|https?://(?:dx\\.)?doi\\.org/)(10\\.\\d+/\\S+)",
            Pattern.CASE_INSENSITIVE
    );

    private static final Pattern URL_PATTERN = Pattern.compile("https?://\\S+");

    private static final Pattern ISBN_PATTERN = Pattern.compile(
            "(?:\\bISBN(?:-1[03])?:?\\s*)?\\b((?:97[89]-)?\\d{1,5}-\\d{1,7}-\\d{1,7}-[\\dX])\\b",
            Pattern.CASE_INSENSITIVE
    );

    private static final Pattern VOLUME_PATTERN = Pattern.compile(
            "\\b(?:vol\\.?|volume)\\s*(\\d+)", Pattern.CASE_INSENSITIVE);

    private static final Pattern ISSUE_PATTERN = Pattern.compile(
            "\\b(?:no\\.?|issue|number)\\s*(\\d+)", Pattern.CASE_INSENSITIVE);

    private static final Pattern PAGES_PATTERN = Pattern.compile(
            "\\b(?:pp?\\.?|pages?)\\s*(\\d[\\d\\u2013-]*)", Pattern.CASE_INSENSITIVE);

    private static final String TRAILING_PUNCTUATION = "[.,;:)\\]>]+$";

    // Checked in order; first hit wins.
    private static final Map<ReferenceType, List<String>> TYPE_KEYWORDS = new LinkedHashMap<>();

    static {
        TYPE_KEYWORDS.put(ReferenceType.JOURNAL, List.of("journal", "vol.", "volume", "issue"));
        TYPE_KEYWORDS.put(ReferenceType.CONFERENCE, List.of("proceedings", "conference", "symposium"));
        TYPE_KEYWORDS.put(ReferenceType.BOOK, List.of("book", "publisher", "press"));
        TYPE_KEYWORDS.put(ReferenceType.WEBSITE, List.of("http://", "https://", "www."));
        TYPE_KEYWORDS.put(ReferenceType.THESIS, List.of("thesis", "dissertation"));
    }

    public void enrich(ExtractedReference reference) {
        String text = reference.getFullText();

        find(DOI_PATTERN, text).ifPresent(doi -> reference.setDoi(trimTrailing(doi)));
        find(URL_PATTERN, text).ifPresent(url -> reference.setUrl(trimTrailing(url)));
        find(ISBN_PATTERN, text).ifPresent(reference::setIsbn);

        // Path segments such as "/vol9/no4/p7" are not bibliographic numbers.
        String withoutLinks = withoutLinks(text);
        find(VOLUME_PATTERN, withoutLinks).ifPresent(reference::setVolume);
        find(ISSUE_PATTERN, withoutLinks).ifPresent(reference::setIssue);
        find(PAGES_PATTERN, withoutLinks).ifPresent(pages -> reference.setPages(pages.replaceAll("-+$", "")));

        reference.setReferenceType(classify(text));
    }

    /**
     * Classifies by keyword priority: journal, conference, book, website, thesis.
     */
    public static ReferenceType classify(String text) {
        String lower = text.toLowerCase(Locale.ROOT);
        for (Map.Entry<ReferenceType, List<String>> entry : TYPE_KEYWORDS.entrySet()) {
            for (String keyword : entry.getValue()) {
                if (lower.contains(keyword)) {
                    return entry.getKey();
                }
            }
        }
        return ReferenceType.UNKNOWN;
    }

    private static Optional<String> find(Pattern pattern, String text) {
        Matcher m = pattern.matcher(text);
        if (m.find()) {
            String value = m.groupCount() >= 1 ? m.group(1) : m.group();
            return Optional.of(value);
        }
        return Optional.empty();
    }

    static String withoutLinks(String text) {
        String stripped = DOI_PATTERN.matcher(text).replaceAll(" ");
        return URL_PATTERN.matcher(stripped).replaceAll(" ");
    }

    private static String trimTrailing(String value) {
        return value.replaceAll(TRAILING_PUNCTUATION, "");
    }
}
