package com.medassist.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Output of one reasoning pass. Revisions are new instances linked through
 * {@code supersedes}; an instance is never edited after it is built.
 */
@Value
@Builder(toBuilder = true)
public class Recommendation {

    UUID id;

    @Builder.Default
    int version = 1;

    UUID supersedes;
    String patientId;

    /** Condition text the caller asked about; re-used when the plan is reviewed. */
    String requestedConditionText;

    Instant createdAt;
    long corpusVersion;
    RiskAssessment riskAssessment;

    @Builder.Default
    List<DiagnosisCandidate> diagnosisCandidates = List.of();

    @Builder.Default
    List<PlanStep> planSteps = List.of();

    @Builder.Default
    List<Warning> warnings = List.of();

    @Builder.Default
    List<EvidenceHit> supportingEvidence = List.of();

    @Builder.Default
    List<String> degradedSources = List.of();

    public boolean hasBlockingWarning() {
        return warnings.stream().anyMatch(Warning::isBlocksDelivery);
    }

    /**
     * True when both plans list the same steps in the same order.
     */
    public boolean samePlanAs(Recommendation other) {
        if (other == null || planSteps.size() != other.planSteps.size()) {
            return false;
        }
        for (int i = 0; i < planSteps.size(); i++) {
            if (!planSteps.get(i).sameContentAs(other.planSteps.get(i))) {
                return false;
            }
        }
        return true;
    }
}
