package com.referenceextraction;

import com.referenceextraction.ExtractedReference.CitationStyle;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.regex.Matcher;

/**
 * Turns a candidate into a structured reference by trying the citation grammars in order.
 *
 * <p>The first grammar whose pattern is found in the candidate wins; there is no scoring
 * across styles. Unmatched candidates become minimal records carrying only the text.
 */
public class CitationStyleMatcher {

    private static final Logger log = LoggerFactory.getLogger(CitationStyleMatcher.class);

    public static final double MATCHED_CONFIDENCE = 0.8;
    public static final double UNMATCHED_CONFIDENCE = 0.3;
    public static final String UNMATCHED_NOTE = "Pattern matching failed, basic extraction only.";

    private final List<CitationGrammar> grammars;

    public CitationStyleMatcher() {
        this(CitationGrammar.defaults());
    }

    public CitationStyleMatcher(List<CitationGrammar> grammars) {
        this.grammars = List.copyOf(grammars);
    }

    public ExtractedReference match(ReferenceSegmenter.Candidate candidate) {
        String text = candidate.text().strip();
        ExtractedReference reference = new ExtractedReference(candidate.sequenceNumber(), text);
        reference.setSegmentationStrategy(candidate.strategy());

        for (CitationGrammar grammar : grammars) {
            Matcher m = grammar.pattern().matcher(text);
            if (m.find()) {
                grammar.apply(m, reference);
                reference.setCitationStyle(grammar.style());
                reference.setConfidenceScore(MATCHED_CONFIDENCE);
                reference.setMatchConfidence(MATCHED_CONFIDENCE);
                log.trace("Candidate {} matched {}", candidate.sequenceNumber(), grammar);
                return reference;
            }
        }

        reference.setCitationStyle(CitationStyle.UNKNOWN);
        reference.setConfidenceScore(UNMATCHED_CONFIDENCE);
        reference.setMatchConfidence(UNMATCHED_CONFIDENCE);
        reference.addNote(UNMATCHED_NOTE);
        log.trace("Candidate {} matched no citation grammar", candidate.sequenceNumber());
        return reference;
    }
}
