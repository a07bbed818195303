package com.medassist.guideline;

import com.medassist.model.EvidenceRef;
import com.medassist.model.GuidelineRule;

import java.util.List;

/**
 * A rule that matched, with the evidence of why.
 *
 * @param score satisfied tags plus specificity
 * @param matchedClauses human-readable structured clauses that held
 */
public record GuidelineMatch(ParsedGuidelineRule parsedRule,
                             int score,
                             int specificity,
                             List<String> satisfiedTags,
                             List<String> matchedClauses) {

    public GuidelineMatch {
        satisfiedTags = List.copyOf(satisfiedTags);
        matchedClauses = List.copyOf(matchedClauses);
    }

    public GuidelineRule rule() {
        return parsedRule.rule();
    }

    public EvidenceRef evidenceRef() {
        return parsedRule.evidenceRef();
    }
}
