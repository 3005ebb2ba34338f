package com.referenceextraction;

import java.io.IOException;
import java.io.Writer;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Writes references as BibTeX entries so they can go straight into a .bib file.
 *
 * <p>The entry type follows the reference type; the venue becomes {@code journal},
 * {@code booktitle}, {@code publisher} or {@code school} accordingly. Keys are built from
 * the first author's surname, the year and the first long title word, with a letter suffix
 * when the same key comes up twice.
 */
public class BibTeXReferenceExporter implements ReferenceExporter {

    private static final Pattern SURNAME = Pattern.compile("([A-Z][a-z]+)");
    private static final Pattern KEY_WORD = Pattern.compile("[A-Za-z]{5,}");

    @Override
    public String format() {
        return "bib";
    }

    @Override
    public void write(List<ExtractedReference> references, Writer out) throws IOException {
        Set<String> usedKeys = new HashSet<>();
        for (ExtractedReference ref : references) {
            out.write(toEntry(ref, uniqueKey(generateKey(ref), usedKeys)));
            out.write("\n\n");
        }
    }

    String toEntry(ExtractedReference ref, String key) {
        StringBuilder sb = new StringBuilder();
        sb.append('@').append(entryType(ref.getReferenceType())).append('{').append(key).append(",\n");

        if (!ref.getAuthors().isEmpty()) {
            field(sb, "author", String.join(" and ", ref.getAuthors()));
        }
        if (!ref.getTitle().isEmpty()) {
            field(sb, "title", ref.getTitle());
        } else {
            String shortText = ref.getFullText();
            if (shortText.length() > 100) {
                shortText = shortText.substring(0, 100) + "...";
            }
            field(sb, "title", shortText);
        }
        if (!ref.getVenue().isEmpty()) {
            field(sb, venueField(ref.getReferenceType()), ref.getVenue());
        }
        if (ref.getYear() != null) {
            field(sb, "year", ref.getYear().toString());
        }
        field(sb, "volume", ref.getVolume());
        field(sb, "number", ref.getIssue());
        field(sb, "pages", ref.getPages().replace("-", "--"));
        // DOI and URL are not escaped, BibTeX styles print them verbatim
        if (!ref.getDoi().isEmpty()) {
            sb.append("  doi = {").append(ref.getDoi()).append("},\n");
        }
        if (!ref.getUrl().isEmpty()) {
            sb.append("  url = {").append(ref.getUrl()).append("},\n");
        }
        field(sb, "isbn", ref.getIsbn());
        sb.append(String.format(Locale.ROOT, "  note = {Extracted reference, confidence %.2f}\n", ref.getConfidenceScore()));
        sb.append('}');
        return sb.toString();
    }

    static String entryType(ExtractedReference.ReferenceType type) {
        return switch (type) {
            case JOURNAL -> "article";
            case CONFERENCE -> "inproceedings";
            case BOOK -> "book";
            case THESIS -> "phdthesis";
            case WEBSITE, UNKNOWN -> "misc";
        };
    }

    private static String venueField(ExtractedReference.ReferenceType type) {
        return switch (type) {
            case JOURNAL -> "journal";
            case CONFERENCE -> "booktitle";
            case BOOK -> "publisher";
            case THESIS -> "school";
            case WEBSITE, UNKNOWN -> "howpublished";
        };
    }

    /**
     * Generates a BibTeX key from reference information.
     */
    static String generateKey(ExtractedReference ref) {
        StringBuilder key = new StringBuilder();

        String firstAuthor = ref.getAuthors().isEmpty() ? ref.getFullText() : ref.getAuthors().get(0);
        Matcher authorMatcher = SURNAME.matcher(firstAuthor);
        if (authorMatcher.find()) {
            key.append(authorMatcher.group(1).toLowerCase(Locale.ROOT));
        } else {
            key.append("ref");
        }

        if (ref.getYear() != null) {
            key.append(ref.getYear());
        } else if (ref.getSequenceNumber() != null) {
            key.append(ref.getSequenceNumber());
        }

        Matcher word = KEY_WORD.matcher(ref.getTitle());
        if (word.find()) {
            key.append(word.group().toLowerCase(Locale.ROOT));
        }
        return key.toString();
    }

    private static String uniqueKey(String base, Set<String> used) {
        String key = base;
        char suffix = 'b';
        while (!used.add(key)) {
            key = base + suffix++;
        }
        return key;
    }

    private static void field(StringBuilder sb, String name, String value) {
        if (value == null || value.isEmpty()) return;
        sb.append("  ").append(name).append(" = {").append(escapeBibTeX(value)).append("},\n");
    }

    /**
     * Escapes special BibTeX characters.
     */
    static String escapeBibTeX(String text) {
        if (text == null) return "";
        return text
                .replace("&", "\\&")
                .replace("%", "\\%")
                .replace("$", "\\$")
                .replace("#", "\\#")
                .replace("_", "\\_")
                .replace("{", "\\{")
                .replace("}", "\\}")
                .replace("~", "\\~{}")
                .replace("^", "\\^{}");
    }
}
