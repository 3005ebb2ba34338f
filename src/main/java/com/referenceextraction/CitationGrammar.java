package com.referenceextraction;

import com.referenceextraction.ExtractedReference.CitationStyle;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * One pattern of a citation style: the style tag, the form it covers (journal article,
 * book), the compiled pattern and the mapping from its named groups to reference fields.
 *
 * <p>{@link #defaults()} is the ordered chain tried by {@link CitationStyleMatcher}.
 */
public record CitationGrammar(CitationStyle style, String form, Pattern pattern, List<String> groups) {

    private static final String QUOTE_OPEN = "[\"\u201C\u2018]";
    private static final String QUOTE_CLOSE = "[\"\u201D\u2019]";
    private static final String QUOTED_TITLE = QUOTE_OPEN + "(?<title>[^\"\u201C\u201D]+?)[.,]?" + QUOTE_CLOSE;

    // "Smith, J. A." / "Smith, J."
    private static final String APA_AUTHOR = "[A-Z][a-z]+(?:,\\s*[A-Z]\\.(?:\\s*[A-Z]\\.)?)*";
    private static final String APA_AUTHORS = APA_AUTHOR + "(?:(?:,\\s*&\\s*|,?\\s+&\\s+|,?\\s+and\\s+|,\\s*)" + APA_AUTHOR + ")*";
    // "Smith, John" (+ middle names for Chicago)
    private static final String MLA_AUTHOR = "[A-Z][a-z]+,\\s*[A-Z][a-z]+";
    private static final String CHICAGO_AUTHOR = "[A-Z][a-z]+,\\s*[A-Z][a-z]+(?:\\s+[A-Z][a-z]+)*";
    // "A. Smith, B. Jones"
    private static final String IEEE_AUTHORS = "[A-Z]\\.\\s*[A-Z][a-z]+(?:(?:,\\s*(?:and\\s+)?|\\s+and\\s+)[A-Z]\\.\\s*[A-Z][a-z]+)*";

    private static final List<CitationGrammar> DEFAULTS = List.of(
            // Author, A. A. (Year). Title. Journal, Volume(Issue), pages.
            grammar(CitationStyle.APA, "journal",
                    "(?<authors>" + APA_AUTHORS + ")\\s*\\((?<year>\\d{4})\\)\\.\\s*(?<title>[^.]+)\\.\\s*"
                            + "(?<venue>[^,]+),\\s*(?<volume>\\d+)(?:\\((?<issue>\\d+)\\))?(?:,\\s*(?<pages>[\\d-]+))?",
                    "authors", "year", "title", "venue", "volume", "issue", "pages"),
            // Author, A. A., & Author, B. B. (Year). Book title. Publisher.
            grammar(CitationStyle.APA, "book",
                    "(?<authors>" + APA_AUTHORS + ")\\s*\\((?<year>\\d{4})\\)\\.\\s*(?<title>[^.]+)\\.\\s*(?<venue>[^.]+)\\.",
                    "authors", "year", "title", "venue"),
            // Author, First. "Title." Journal, vol. #, no. #, Year, pp. #-#.
            grammar(CitationStyle.MLA, "journal",
                    "(?<authors>" + MLA_AUTHOR + ")\\.\\s*" + QUOTED_TITLE + "\\.?\\s*(?<venue>[^,]+),\\s*vol\\.\\s*(?<volume>\\d+)"
                            + "(?:,\\s*no\\.\\s*(?<issue>\\d+))?,\\s*(?<year>\\d{4}),\\s*pp\\.\\s*(?<pages>[\\d-]+)",
                    "authors", "title", "venue", "volume", "issue", "year", "pages"),
            // Author, First. Book Title. Publisher, Year.
            grammar(CitationStyle.MLA, "book",
                    "(?<authors>" + MLA_AUTHOR + ")\\.\\s*(?<title>[^.]+)\\.\\s*(?<venue>[^,]+),\\s*(?<year>\\d{4})\\.",
                    "authors", "title", "venue", "year"),
            // Author, First Last. "Title." Journal Volume, no. Issue (Year): pages.
            grammar(CitationStyle.CHICAGO, "journal",
                    "(?<authors>" + CHICAGO_AUTHOR + ")\\.\\s*" + QUOTED_TITLE + "\\.?\\s*(?<venue>[^0-9]+?)\\s*(?<volume>\\d+)"
                            + "(?:,\\s*no\\.\\s*(?<issue>\\d+))?\\s*\\((?<year>\\d{4})\\):\\s*(?<pages>[\\d-]+)",
                    "authors", "title", "venue", "volume", "issue", "year", "pages"),
            // Author, First Last. Book Title. Place: Publisher, Year.
            grammar(CitationStyle.CHICAGO, "book",
                    "(?<authors>" + CHICAGO_AUTHOR + ")\\.\\s*(?<title>[^.]+)\\.\\s*[^:]+:\\s*(?<venue>[^,]+),\\s*(?<year>\\d{4})\\.",
                    "authors", "title", "venue", "year"),
            // [1] A. Author, "Title," Journal, vol. #, no. #, pp. #-#, Year.
            grammar(CitationStyle.IEEE, "journal",
                    "\\[(?<number>\\d{1,6})]\\s*(?<authors>" + IEEE_AUTHORS + "),\\s*" + QUOTED_TITLE + ",?\\s*(?<venue>[^,]+),\\s*"
                            + "vol\\.\\s*(?<volume>\\d+)(?:,\\s*no\\.\\s*(?<issue>\\d+))?,\\s*pp\\.\\s*(?<pages>[\\d-]+),\\s*(?<year>\\d{4})",
                    "number", "authors", "title", "venue", "volume", "issue", "pages", "year"),
            // [1] A. Author, Book Title. Publisher, Year.
            grammar(CitationStyle.IEEE, "book",
                    "\\[(?<number>\\d{1,6})]\\s*(?<authors>" + IEEE_AUTHORS + "),\\s*(?<title>[^.]+)\\.\\s*(?<venue>[^,]+),\\s*(?<year>\\d{4})\\.",
                    "number", "authors", "title", "venue", "year")
    );

    // Splits "Johnson, M., & Brown, K." or "Smith, J., Doe, A." into single authors.
    private static final Pattern AUTHOR_SEPARATOR = Pattern.compile(
            ",?\\s*&\\s*|\\s+and\\s+|(?<=\\.),\\s*(?=[A-Z][a-z])"
    );

    public CitationGrammar {
        groups = List.copyOf(groups);
    }

    public static List<CitationGrammar> defaults() {
        return DEFAULTS;
    }

    private static CitationGrammar grammar(CitationStyle style, String form, String regex, String... groups) {
        return new CitationGrammar(style, form, Pattern.compile(regex), Arrays.asList(groups));
    }

    /**
     * Copies the captured groups of {@code m} into {@code reference}.
     */
    public void apply(Matcher m, ExtractedReference reference) {
        for (String group : groups) {
            String value = m.group(group);
            if (value == null || value.isBlank()) {
                continue;
            }
            value = value.strip();
            switch (group) {
                case "number" -> reference.setSequenceNumber(Integer.parseInt(value));
                case "authors" -> reference.setAuthors(splitAuthors(value));
                case "year" -> reference.setYear(Integer.parseInt(value));
                case "title" -> reference.setTitle(value);
                case "venue" -> reference.setVenue(value);
                case "volume" -> reference.setVolume(value);
                case "issue" -> reference.setIssue(value);
                case "pages" -> reference.setPages(value);
                default -> throw new IllegalStateException("Unmapped group " + group + " in " + this);
            }
        }
    }

    static List<String> splitAuthors(String authors) {
        List<String> result = new ArrayList<>();
        for (String author : AUTHOR_SEPARATOR.split(authors)) {
            String trimmed = author.strip();
            if (!trimmed.isEmpty()) {
                result.add(trimmed);
            }
        }
        return result;
    }

    @Override
    public String toString() {
        return style.label() + "/" + form;
    }
}
