package com.medassist.service;

import java.time.Instant;
import java.util.UUID;

/**
 * One entry of a plan's transition log.
 *
 * @param from null for the registration of a new version
 */
public record PlanTransition(UUID recommendationId, PlanReviewState from, PlanReviewState to, String reason, Instant at) {
}
