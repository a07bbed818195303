package com.medassist.model;

import lombok.Builder;
import lombok.Value;

import java.util.Objects;
import java.util.Set;

/**
 * One ordered step of a recommendation plan.
 *
 * A {@link PlanStepKind#NO_GUIDELINE_MATCH} step carries no action text and has
 * {@code insufficientEvidence} set.
 */
@Value
@Builder(toBuilder = true)
public class PlanStep {

    public static final String INSUFFICIENT_EVIDENCE = "Insufficient evidence: no matching guideline recommendation";

    PlanStepKind kind;
    Disease disease;
    String action;
    String rationale;
    EvidenceLevel evidenceLevel;

    @Builder.Default
    Set<DrugClass> drugClasses = Set.of();

    EvidenceRef evidence;
    boolean insufficientEvidence;

    public static PlanStep noGuidelineMatch(Disease disease) {
        return PlanStep.builder()
            .kind(PlanStepKind.NO_GUIDELINE_MATCH)
            .disease(disease)
            .rationale(INSUFFICIENT_EVIDENCE)
            .insufficientEvidence(true)
            .build();
    }

    public boolean prescribesAny(Set<DrugClass> classes) {
        return drugClasses.stream().anyMatch(classes::contains);
    }

    /**
     * Clinical content equality, ignoring provenance timestamps.
     */
    public boolean sameContentAs(PlanStep other) {
        return other != null
            && kind == other.kind
            && disease == other.disease
            && Objects.equals(action, other.action)
            && evidenceLevel == other.evidenceLevel
            && drugClasses.equals(other.drugClasses)
            && Objects.equals(locator(), other.locator());
    }

    private String locator() {
        return evidence != null ? evidence.locator() : null;
    }
}
