package com.medassist.service;

import com.medassist.model.PlanStep;
import com.medassist.model.Warning;

import java.util.List;

/**
 * Plan after blocking substitutions, with every warning that applied.
 */
public record SafetyReview(List<PlanStep> plan, List<Warning> warnings) {

    public SafetyReview {
        plan = List.copyOf(plan);
        warnings = List.copyOf(warnings);
    }

    public boolean blocked() {
        return warnings.stream().anyMatch(Warning::isBlocksDelivery);
    }
}
