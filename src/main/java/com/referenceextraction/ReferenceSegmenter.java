package com.referenceextraction;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Splits raw document text into candidate reference strings.
 *
 * <p>Two passes run on every document:
 * <ul>
 *   <li>a region pass over the bibliography section (or the whole document when no section
 *       header is found), splitting on bracket markers when present and on line structure
 *       otherwise;</li>
 *   <li>a global pass picking up every {@code [n] text} block anywhere in the document.</li>
 * </ul>
 * The passes overlap; {@link ReferenceDeduplicator} collapses the duplicates.
 */
public class ReferenceSegmenter {

    private static final Logger log = LoggerFactory.getLogger(ReferenceSegmenter.class);

    public static final int DEFAULT_MIN_LENGTH = 20;

    public enum SegmentationStrategy {
        BRACKET_NUMBERED,
        LINE_BASED,
        GLOBAL_NUMBERED
    }

    /**
     * A text span hypothesized to be one reference.
     *
     * @param sequenceNumber bracket number when present, positional otherwise
     * @param text           whitespace-normalized span, including any leading marker
     * @param strategy       the pass that produced it
     */
    public record Candidate(int sequenceNumber, String text, SegmentationStrategy strategy) {}

    /**
     * Result of segmenting one document.
     */
    public record Segmentation(
            boolean headerFound,
            String region,
            List<Candidate> regionCandidates,
            List<Candidate> globalCandidates
    ) {
        public List<Candidate> all() {
            List<Candidate> all = new ArrayList<>(regionCandidates);
            all.addAll(globalCandidates);
            return all;
        }
    }

    private static final Pattern REFERENCES_HEADER = Pattern.compile(
            "^\\h*(references|bibliography|works\\h+cited|literature\\h+cited|citations)\\h*:?\\h*$",
            Pattern.CASE_INSENSITIVE | Pattern.MULTILINE
    );

    private static final Pattern TRAILING_SECTION = Pattern.compile(
            "^\\h*(appendix|acknowledge?ments?|author\\h+information|about\\h+the\\h+authors?)\\b",
            Pattern.CASE_INSENSITIVE | Pattern.MULTILINE
    );

    private static final Pattern BRACKET_MARKER = Pattern.compile("\\[(\\d{1,6})]");

    private static final Pattern BLANK_LINE = Pattern.compile("\\R\\h*\\R");

    private static final Pattern[] REFERENCE_START = {
            Pattern.compile("^\\[\\d+]"),
            Pattern.compile("^\\d+\\."),
            Pattern.compile("^\\p{Lu}[\\p{Ll}'\\-]+,\\s*\\p{Lu}")
    };

    private final int minLength;

    public ReferenceSegmenter() {
        this(DEFAULT_MIN_LENGTH);
    }

    public ReferenceSegmenter(int minLength) {
        this.minLength = minLength;
    }

    public Segmentation segment(String text) {
        Matcher header = REFERENCES_HEADER.matcher(text);
        boolean headerFound = header.find();
        String region;
        if (headerFound) {
            int start = header.end();
            Matcher trailing = TRAILING_SECTION.matcher(text);
            int end = trailing.find(start) ? trailing.start() : text.length();
            region = text.substring(start, end);
            log.debug("Reference section '{}' found ({} characters)", header.group(1), region.length());
        } else {
            log.info("No reference section header found, scanning the whole document");
            region = text;
        }

        List<Candidate> regionCandidates = BRACKET_MARKER.matcher(region).find()
                ? splitOnBrackets(region)
                : splitOnLines(region);
        List<Candidate> globalCandidates = findNumberedReferences(text);

        log.debug("Segmented {} region candidates and {} global candidates",
                regionCandidates.size(), globalCandidates.size());
        return new Segmentation(headerFound, region.strip(), regionCandidates, globalCandidates);
    }

    /**
     * Splits strictly on {@code [n]} markers; each span runs from one marker to the next.
     */
    List<Candidate> splitOnBrackets(String region) {
        List<Candidate> candidates = new ArrayList<>();
        Matcher m = BRACKET_MARKER.matcher(region);
        List<int[]> markers = new ArrayList<>();
        while (m.find()) {
            markers.add(new int[]{m.start(), m.end(), Integer.parseInt(m.group(1))});
        }
        for (int i = 0; i < markers.size(); i++) {
            int[] marker = markers.get(i);
            int end = i + 1 < markers.size() ? markers.get(i + 1)[0] : region.length();
            addIfLongEnough(candidates, marker[2], region, marker[0], marker[1], end,
                    SegmentationStrategy.BRACKET_NUMBERED);
        }
        return candidates;
    }

    /**
     * Line-based splitting: a reference-start line opens a new candidate, other lines
     * continue the open one, blank lines close it.
     */
    List<Candidate> splitOnLines(String region) {
        List<String> blocks = new ArrayList<>();
        StringBuilder current = new StringBuilder();

        for (String rawLine : region.split("\\R")) {
            String line = rawLine.strip();
            if (line.isEmpty()) {
                flush(blocks, current);
                continue;
            }
            if (isReferenceStart(line)) {
                flush(blocks, current);
            } else if (current.length() > 0) {
                current.append(' ');
            }
            current.append(line);
        }
        flush(blocks, current);

        List<Candidate> candidates = new ArrayList<>();
        for (String block : blocks) {
            String text = normalize(block);
            if (text.length() >= minLength) {
                candidates.add(new Candidate(candidates.size() + 1, text, SegmentationStrategy.LINE_BASED));
            }
        }
        return candidates;
    }

    /**
     * Whole-document pass: every {@code [n]} marker up to the next marker or blank line.
     */
    List<Candidate> findNumberedReferences(String text) {
        List<Candidate> candidates = new ArrayList<>();
        Matcher m = BRACKET_MARKER.matcher(text);
        List<int[]> markers = new ArrayList<>();
        while (m.find()) {
            markers.add(new int[]{m.start(), m.end(), Integer.parseInt(m.group(1))});
        }
        Matcher blank = BLANK_LINE.matcher(text);
        for (int i = 0; i < markers.size(); i++) {
            int[] marker = markers.get(i);
            int end = i + 1 < markers.size() ? markers.get(i + 1)[0] : text.length();
            if (blank.find(marker[1]) && blank.start() < end) {
                end = blank.start();
            }
            addIfLongEnough(candidates, marker[2], text, marker[0], marker[1], end,
                    SegmentationStrategy.GLOBAL_NUMBERED);
        }
        return candidates;
    }

    static boolean isReferenceStart(String line) {
        for (Pattern p : REFERENCE_START) {
            if (p.matcher(line).find()) {
                return true;
            }
        }
        return false;
    }

    private void addIfLongEnough(List<Candidate> out, int number, String source,
                                 int markerStart, int bodyStart, int end, SegmentationStrategy strategy) {
        String body = normalize(source.substring(bodyStart, end));
        if (body.length() < minLength) {
            log.trace("Dropping short candidate [{}] '{}'", number, body);
            return;
        }
        String marker = source.substring(markerStart, bodyStart);
        out.add(new Candidate(number, marker + " " + body, strategy));
    }

    private static void flush(List<String> blocks, StringBuilder current) {
        if (current.length() > 0) {
            blocks.add(current.toString());
            current.setLength(0);
        }
    }

    static String normalize(String s) {
        return s.replaceAll("\\s+", " ").strip();
    }
}
