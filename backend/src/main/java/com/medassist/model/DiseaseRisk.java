package com.medassist.model;

import java.util.List;

/**
 * Per-disease result of stratification.
 *
 * @param ruleRow 1-based row of the decision table that produced the level
 */
public record DiseaseRisk(Disease disease,
                          RiskGrade level,
                          List<String> contributingFactors,
                          FollowUpInterval followUp,
                          int ruleRow) {

    public DiseaseRisk {
        contributingFactors = List.copyOf(contributingFactors);
    }
}
