package com.referenceextraction;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Collapses near-duplicate references.
 *
 * <p>Dedup policy: candidates are processed in order against the list accepted so far.
 * Two references are duplicates when both have titles whose word sets have a Jaccard
 * similarity above {@value #TITLE_THRESHOLD}, or, when at least one title is missing, when
 * their full texts exceed {@value #TEXT_THRESHOLD}. The higher confidence wins; ties keep
 * the entry accepted first. A winning newcomer takes the position of the entry it replaces.
 *
 * <p>The accepted list never contains two duplicates of each other, so deduplicating an
 * already deduplicated list changes nothing.
 */
public final class ReferenceDeduplicator {

    private static final Logger log = LoggerFactory.getLogger(ReferenceDeduplicator.class);

    public static final double TITLE_THRESHOLD = 0.8;
    public static final double TEXT_THRESHOLD = 0.9;

    private static final Pattern WORD = Pattern.compile("[\\p{L}\\p{N}]+");

    private ReferenceDeduplicator() {
    }

    public enum DuplicateReason {
        TITLE_SIMILAR,
        TEXT_SIMILAR
    }

    public record DuplicateRecord(
            ExtractedReference dropped,
            ExtractedReference kept,
            DuplicateReason reason,
            double similarity
    ) {}

    public record Result(
            List<ExtractedReference> unique,
            int totalEntries,
            List<DuplicateRecord> duplicates
    ) {
        public int duplicateCount() {
            return duplicates.size();
        }
    }

    private record Match(int index, DuplicateReason reason, double similarity) {}

    public static Result deduplicate(List<ExtractedReference> references) {
        List<ExtractedReference> accepted = new ArrayList<>();
        List<DuplicateRecord> duplicates = new ArrayList<>();

        for (ExtractedReference incoming : references) {
            List<Match> matches = new ArrayList<>();
            for (int i = 0; i < accepted.size(); i++) {
                Match match = compare(incoming, accepted.get(i), i);
                if (match != null) {
                    matches.add(match);
                }
            }

            if (matches.isEmpty()) {
                accepted.add(incoming);
                continue;
            }

            Match strongest = matches.get(0);
            for (Match m : matches) {
                if (accepted.get(m.index()).getConfidenceScore() > accepted.get(strongest.index()).getConfidenceScore()) {
                    strongest = m;
                }
            }
            ExtractedReference best = accepted.get(strongest.index());

            if (incoming.getConfidenceScore() > best.getConfidenceScore()) {
                // Newcomer wins against every entry it collides with.
                Match first = matches.get(0);
                for (int k = matches.size() - 1; k >= 0; k--) {
                    Match m = matches.get(k);
                    ExtractedReference loser = accepted.get(m.index());
                    record(duplicates, loser, incoming, m);
                    if (m == first) {
                        accepted.set(m.index(), incoming);
                    } else {
                        accepted.remove(m.index());
                    }
                }
            } else {
                record(duplicates, incoming, best, strongest);
            }
        }

        return new Result(List.copyOf(accepted), references.size(), List.copyOf(duplicates));
    }

    /**
     * Whether the two references would be merged by {@link #deduplicate(List)}.
     */
    public static boolean areSimilar(ExtractedReference a, ExtractedReference b) {
        return compare(a, b, -1) != null;
    }

    private static Match compare(ExtractedReference a, ExtractedReference b, int index) {
        if (!a.getTitle().isBlank() && !b.getTitle().isBlank()) {
            double similarity = jaccard(a.getTitle(), b.getTitle());
            return similarity > TITLE_THRESHOLD ? new Match(index, DuplicateReason.TITLE_SIMILAR, similarity) : null;
        }
        double similarity = jaccard(a.getFullText(), b.getFullText());
        return similarity > TEXT_THRESHOLD ? new Match(index, DuplicateReason.TEXT_SIMILAR, similarity) : null;
    }

    /**
     * Jaccard similarity of the lower-cased word sets of two strings. Words are runs of
     * letters and digits, so punctuation and case are ignored.
     */
    public static double jaccard(String s1, String s2) {
        if (s1 == null || s2 == null || s1.isBlank() || s2.isBlank()) {
            return 0.0;
        }
        Set<String> words1 = words(s1);
        Set<String> words2 = words(s2);

        Set<String> union = new HashSet<>(words1);
        union.addAll(words2);
        if (union.isEmpty()) {
            return 0.0;
        }
        Set<String> intersection = new HashSet<>(words1);
        intersection.retainAll(words2);
        return (double) intersection.size() / union.size();
    }

    private static Set<String> words(String s) {
        Set<String> words = new HashSet<>();
        Matcher m = WORD.matcher(s.toLowerCase(Locale.ROOT));
        while (m.find()) {
            words.add(m.group());
        }
        return words;
    }

    private static void record(List<DuplicateRecord> out, ExtractedReference dropped,
                               ExtractedReference kept, Match match) {
        out.add(new DuplicateRecord(dropped, kept, match.reason(), match.similarity()));
        log.debug("Merged duplicate ({}, {}): dropped '{}' in favour of '{}'", match.reason(),
                String.format(Locale.ROOT, "%.2f", match.similarity()), dropped.getFullText(), kept.getFullText());
    }
}
