package com.medassist.guideline;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;

/**
 * Immutable set of parsed rules. Rules dated after {@code asOf} do not participate.
 */
public record CorpusSnapshot(long version, LocalDate asOf, Instant loadedAt, List<ParsedGuidelineRule> rules) {

    public static final CorpusSnapshot EMPTY = new CorpusSnapshot(0L, LocalDate.MIN, Instant.EPOCH, List.of());

    public CorpusSnapshot {
        rules = List.copyOf(rules);
    }

    public int size() {
        return rules.size();
    }
}
