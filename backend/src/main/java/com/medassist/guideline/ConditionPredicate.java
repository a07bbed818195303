package com.medassist.guideline;

import java.util.List;

/**
 * Conjunction of clauses parsed from one rule condition.
 */
public record ConditionPredicate(List<ConditionClause> clauses) {

    public static final ConditionPredicate EMPTY = new ConditionPredicate(List.of());

    public ConditionPredicate {
        clauses = List.copyOf(clauses);
    }

    /**
     * Number of structured clauses.
     */
    public int specificity() {
        return (int) clauses.stream().filter(ConditionClause::isStructured).count();
    }

    public List<ConditionClause> structuredClauses() {
        return clauses.stream().filter(ConditionClause::isStructured).toList();
    }

    public List<FreeTextTag> tags() {
        return clauses.stream()
            .filter(FreeTextTag.class::isInstance)
            .map(FreeTextTag.class::cast)
            .toList();
    }
}
