package com.medassist.guideline;

/**
 * One conjunct of a parsed guideline condition: {@link NumericThreshold},
 * {@link SetMembership} or {@link FreeTextTag}.
 */
public interface ConditionClause {

    /**
     * Structured clauses must hold for a rule to match; tags only add score.
     */
    boolean isStructured();

    String describe();
}
