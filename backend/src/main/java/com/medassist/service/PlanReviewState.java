package com.medassist.service;

import java.util.EnumSet;
import java.util.Set;

/**
 * Lifecycle of a recommendation: PROPOSED, ACTIVE, UNDER_REVIEW, then ADJUSTED
 * (back to ACTIVE once accepted) or RESOLVED.
 */
public enum PlanReviewState {
    PROPOSED,
    ACTIVE,
    UNDER_REVIEW,
    ADJUSTED,
    RESOLVED;

    public Set<PlanReviewState> successors() {
        return switch (this) {
            case PROPOSED, ADJUSTED -> EnumSet.of(ACTIVE);
            case ACTIVE -> EnumSet.of(UNDER_REVIEW);
            case UNDER_REVIEW -> EnumSet.of(ADJUSTED, RESOLVED);
            case RESOLVED -> EnumSet.noneOf(PlanReviewState.class);
        };
    }

    public boolean canMoveTo(PlanReviewState next) {
        return successors().contains(next);
    }

    public boolean isTerminal() {
        return this == RESOLVED;
    }
}
