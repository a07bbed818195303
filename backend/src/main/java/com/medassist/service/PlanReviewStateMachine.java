package com.medassist.service;

import com.medassist.exception.IllegalPlanTransitionException;
import com.medassist.exception.InvalidProfileException;
import com.medassist.model.PatientProfile;
import com.medassist.model.Recommendation;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.UUID;

/**
 * Plan Review State Machine
 *
 * PROPOSED -> ACTIVE -> UNDER_REVIEW -> ADJUSTED -> ACTIVE, or UNDER_REVIEW -> RESOLVED.
 *
 * A review that changes the plan or the risk levels appends a new version that
 * supersedes the reviewed one; the reviewed version moves to ADJUSTED and the new
 * version starts in ADJUSTED awaiting acceptance. Nothing is overwritten.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PlanReviewStateMachine {

    private final RecommendationLedger ledger;
    private final RecommendationComposer composer;
    private final AuditService auditService;
    private final Clock clock;

    public synchronized Recommendation register(Recommendation recommendation) {
        ledger.append(recommendation, PlanReviewState.PROPOSED,
            new PlanTransition(recommendation.getId(), null, PlanReviewState.PROPOSED, "composed", Instant.now(clock)));
        log.debug("Registered recommendation {} for {}", recommendation.getId(), recommendation.getPatientId());
        return recommendation;
    }

    public synchronized Recommendation accept(UUID id) {
        Recommendation recommendation = ledger.get(id);
        PlanReviewState state = ledger.state(id);
        if (ledger.isSuperseded(id)) {
            throw new IllegalPlanTransitionException(state, PlanReviewState.ACTIVE);
        }
        transition(recommendation, PlanReviewState.ACTIVE, "accepted");
        return recommendation;
    }

    public synchronized Recommendation beginReview(UUID id, String reason) {
        Recommendation recommendation = ledger.get(id);
        transition(recommendation, PlanReviewState.UNDER_REVIEW, reason != null ? reason : "review requested");
        return recommendation;
    }

    /**
     * Re-runs composition on the updated profile. Returns the new version when the plan
     * or the risk levels changed, otherwise the reviewed version, now RESOLVED.
     *
     * Composition runs outside the monitor; the outcome is applied only if the reviewed
     * version is still UNDER_REVIEW, so a review that lost a race fails with
     * {@link IllegalPlanTransitionException}.
     */
    public Recommendation review(UUID id, PatientProfile updatedProfile) {
        Recommendation current;
        synchronized (this) {
            current = ledger.get(id);
            if (!Objects.equals(current.getPatientId(), updatedProfile.getPatientId())) {
                throw new InvalidProfileException("Profile " + updatedProfile.getPatientId()
                    + " does not belong to recommendation " + id);
            }
            if (ledger.state(id) == PlanReviewState.ACTIVE) {
                transition(current, PlanReviewState.UNDER_REVIEW, "updated profile received");
            }
            requireUnderReview(id);
        }

        Recommendation rerun = composer.compose(updatedProfile, current.getRequestedConditionText());
        boolean planChanged = !rerun.samePlanAs(current);
        boolean riskChanged = !rerun.getRiskAssessment().sameLevelsAs(current.getRiskAssessment());

        synchronized (this) {
            requireUnderReview(id);
            if (!planChanged && !riskChanged) {
                transition(current, PlanReviewState.RESOLVED, "plan unchanged and risk stable");
                return current;
            }

            Recommendation revised = rerun.toBuilder()
                .version(current.getVersion() + 1)
                .supersedes(current.getId())
                .build();
            String reason = planChanged ? "plan changed" : "risk level changed";
            transition(current, PlanReviewState.ADJUSTED, reason + ", superseded by " + revised.getId());
            ledger.append(revised, PlanReviewState.ADJUSTED,
                new PlanTransition(revised.getId(), null, PlanReviewState.ADJUSTED, "revision of " + current.getId(),
                    Instant.now(clock)));
            auditService.logPlanTransition(revised.getPatientId(), revised.getId().toString(),
                "registered version " + revised.getVersion() + " superseding " + current.getId());
            log.info("Recommendation {} adjusted to version {} ({})", current.getId(), revised.getVersion(), reason);
            return revised;
        }
    }

    public PlanReviewState state(UUID id) {
        return ledger.state(id);
    }

    public List<Recommendation> history(UUID id) {
        return ledger.history(id);
    }

    public List<PlanTransition> transitions(UUID id) {
        return ledger.transitions(id);
    }

    private void requireUnderReview(UUID id) {
        PlanReviewState state = ledger.state(id);
        if (state != PlanReviewState.UNDER_REVIEW || ledger.isSuperseded(id)) {
            throw new IllegalPlanTransitionException(state, PlanReviewState.ADJUSTED);
        }
    }

    private void transition(Recommendation recommendation, PlanReviewState to, String reason) {
        PlanReviewState from = ledger.state(recommendation.getId());
        if (!from.canMoveTo(to)) {
            throw new IllegalPlanTransitionException(from, to);
        }
        ledger.recordTransition(new PlanTransition(recommendation.getId(), from, to, reason, Instant.now(clock)));
        auditService.logPlanTransition(recommendation.getPatientId(), recommendation.getId().toString(),
            from + " -> " + to + ": " + reason);
        log.debug("Recommendation {}: {} -> {} ({})", recommendation.getId(), from, to, reason);
    }
}
