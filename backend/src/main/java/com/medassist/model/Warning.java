package com.medassist.model;

import lombok.Builder;
import lombok.Value;

import java.util.Optional;

@Value
@Builder
public class Warning {

    WarningCategory category;
    WarningSeverity severity;
    String message;
    boolean blocksDelivery;
    PlanStep suggestedAlternative;

    public Optional<PlanStep> getSuggestedAlternative() {
        return Optional.ofNullable(suggestedAlternative);
    }
}
