package com.referenceextraction;

import com.referenceextraction.ReferenceSegmenter.Candidate;
import com.referenceextraction.ReferenceSegmenter.SegmentationStrategy;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ReferenceSegmenterJUnitTest {

    private final ReferenceSegmenter segmenter = new ReferenceSegmenter();

    @Test
    void segment_bracketMarkersGiveOneCandidateEach() {
        String text = """
                References
                [1] Smith, J. (2020). A first reference title. Journal One, 1(1), 1-2.
                [2] Jones, K. (2019). A second reference title. Journal Two, 2(2), 3-4.
                [3] Brown, L. (2018). A third reference title. Journal Three, 3(3), 5-6.
                """;

        ReferenceSegmenter.Segmentation result = segmenter.segment(text);

        assertTrue(result.headerFound());
        assertEquals(3, result.regionCandidates().size());
        assertEquals(List.of(1, 2, 3), result.regionCandidates().stream().map(Candidate::sequenceNumber).toList());
        assertTrue(result.regionCandidates().get(0).text().startsWith("[1] Smith"));
        assertTrue(result.regionCandidates().stream()
                .allMatch(c -> c.strategy() == SegmentationStrategy.BRACKET_NUMBERED));
    }

    @Test
    void segment_regionStopsAtTrailingSection() {
        String text = """
                Introduction cites [7] in passing.

                References
                [1] Smith, J. (2020). A first reference title. Journal One, 1(1), 1-2.
                [2] Jones, K. (2019). A second reference title. Journal Two, 2(2), 3-4.
                Appendix
                Extra material that is not part of the bibliography at all.
                """;

        ReferenceSegmenter.Segmentation result = segmenter.segment(text);

        assertEquals(2, result.regionCandidates().size());
        assertFalse(result.region().contains("Extra material"));
        assertFalse(result.regionCandidates().get(1).text().contains("Appendix"));
    }

    @Test
    void segment_globalPassScansWholeDocument() {
        String text = """
                As shown in [4] Earlier work on citation indexing by Garfield.

                Bibliography
                [1] Smith, J. (2020). A first reference title. Journal One, 1(1), 1-2.
                """;

        ReferenceSegmenter.Segmentation result = segmenter.segment(text);

        assertEquals(1, result.regionCandidates().size());
        assertEquals(2, result.globalCandidates().size());
        Candidate inline = result.globalCandidates().get(0);
        assertEquals(4, inline.sequenceNumber());
        assertEquals(SegmentationStrategy.GLOBAL_NUMBERED, inline.strategy());
        assertEquals("[4] Earlier work on citation indexing by Garfield.", inline.text());
        assertEquals(3, result.all().size());
    }

    @Test
    void segment_lineBasedWhenNoBrackets() {
        String text = """
                References
                Smith, J. (2020). A first reference title
                that wraps onto a second line. Journal One.
                Jones, K. (2019). A second reference title. Journal Two.

                Brown, L. (2018). Third title after a blank line. Journal Three.
                """;

        List<Candidate> candidates = segmenter.segment(text).regionCandidates();

        assertEquals(3, candidates.size());
        assertEquals("Smith, J. (2020). A first reference title that wraps onto a second line. Journal One.",
                candidates.get(0).text());
        assertEquals(List.of(1, 2, 3), candidates.stream().map(Candidate::sequenceNumber).toList());
        assertTrue(candidates.stream().allMatch(c -> c.strategy() == SegmentationStrategy.LINE_BASED));
    }

    @Test
    void segment_withoutHeaderUsesWholeDocument() {
        ReferenceSegmenter.Segmentation result = segmenter.segment(
                "Smith, J. (2020). A reference with no section header. Journal One.");

        assertFalse(result.headerFound());
        assertEquals(1, result.regionCandidates().size());
        assertTrue(result.globalCandidates().isEmpty());
    }

    @Test
    void segment_dropsCandidatesBelowMinimumLength() {
        String text = """
                References
                [1] Too short.
                [2] Smith, J. (2020). A first reference title. Journal One, 1(1), 1-2.
                """;

        ReferenceSegmenter.Segmentation result = segmenter.segment(text);

        assertEquals(1, result.regionCandidates().size());
        assertEquals(2, result.regionCandidates().get(0).sequenceNumber());
        assertEquals(1, result.globalCandidates().size());
    }

    @Test
    void segment_normalizesWhitespace() {
        List<Candidate> candidates = segmenter.segment("[1]   Smith,\tJ.  (2020).\n   Spread   out title. Journal.")
                .regionCandidates();

        assertEquals("[1] Smith, J. (2020). Spread out title. Journal.", candidates.get(0).text());
    }

    @Test
    void isReferenceStart_recognisesCommonOpenings() {
        assertTrue(ReferenceSegmenter.isReferenceStart("[12] Something"));
        assertTrue(ReferenceSegmenter.isReferenceStart("3. Something"));
        assertTrue(ReferenceSegmenter.isReferenceStart("Smith, J. (2016). Weapons."));
        assertFalse(ReferenceSegmenter.isReferenceStart("continuation of a title"));
    }
}
