package com.medassist.guideline;

import com.medassist.model.DrugClass;
import com.medassist.model.EvidenceRef;
import com.medassist.model.GuidelineRule;

import java.util.Set;

/**
 * A guideline rule with its condition parsed and its content's drug classes extracted.
 */
public record ParsedGuidelineRule(GuidelineRule rule, ConditionPredicate predicate, Set<DrugClass> drugClasses) {

    public ParsedGuidelineRule {
        drugClasses = Set.copyOf(drugClasses);
    }

    public EvidenceRef evidenceRef() {
        return EvidenceRef.guideline(rule.ruleId(), rule.effectiveFrom());
    }
}
