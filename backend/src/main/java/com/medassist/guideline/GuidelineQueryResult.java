package com.medassist.guideline;

import java.util.List;

/**
 * Ranked matches from one corpus snapshot. An empty result is explicit:
 * {@code noMatchingEvidence} is set and nothing is substituted for the missing match.
 */
public record GuidelineQueryResult(List<GuidelineMatch> matches, long corpusVersion, boolean noMatchingEvidence) {

    public GuidelineQueryResult {
        matches = List.copyOf(matches);
    }

    public static GuidelineQueryResult of(List<GuidelineMatch> matches, long corpusVersion) {
        return new GuidelineQueryResult(matches, corpusVersion, matches.isEmpty());
    }

    public boolean hasMatches() {
        return !matches.isEmpty();
    }
}
