package com.medassist.model;

import java.util.List;
import java.util.Optional;

/**
 * Hypertension and diabetes stratification for one profile.
 *
 * @param diabetes null when no HbA1c was available
 * @param missingInputs inputs that a decision row needed but the profile lacked
 */
public record RiskAssessment(String patientId,
                             DiseaseRisk hypertension,
                             DiseaseRisk diabetes,
                             List<String> missingInputs) {

    public RiskAssessment {
        missingInputs = List.copyOf(missingInputs);
    }

    public Optional<DiseaseRisk> diabetesRisk() {
        return Optional.ofNullable(diabetes);
    }

    public HypertensionRiskLevel hypertensionLevel() {
        return (HypertensionRiskLevel) hypertension.level();
    }

    public Optional<DiabetesControlStatus> diabetesStatus() {
        return diabetesRisk().map(r -> (DiabetesControlStatus) r.level());
    }

    /**
     * Combined level: poor diabetes control counts as very high, fair as high.
     */
    public HypertensionRiskLevel overallLevel() {
        HypertensionRiskLevel fromDiabetes = diabetesStatus()
            .map(status -> switch (status) {
                case POOR -> HypertensionRiskLevel.VERY_HIGH;
                case FAIR -> HypertensionRiskLevel.HIGH;
                case GOOD -> HypertensionRiskLevel.LOW;
            })
            .orElse(HypertensionRiskLevel.LOW);
        return hypertensionLevel().max(fromDiabetes);
    }

    /**
     * True when both axes carry the same levels as {@code other}.
     */
    public boolean sameLevelsAs(RiskAssessment other) {
        return other != null
            && hypertension.level() == other.hypertension.level()
            && diabetesStatus().equals(other.diabetesStatus());
    }
}
