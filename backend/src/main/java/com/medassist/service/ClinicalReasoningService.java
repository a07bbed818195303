package com.medassist.service;

import com.medassist.entity.AuditLog;
import com.medassist.exception.SourceUnavailableException;
import com.medassist.guideline.CorpusSnapshot;
import com.medassist.guideline.GuidelineCorpus;
import com.medassist.guideline.GuidelineMatcher;
import com.medassist.guideline.GuidelineQuery;
import com.medassist.guideline.GuidelineQueryResult;
import com.medassist.model.Disease;
import com.medassist.model.EvidenceHit;
import com.medassist.model.PatientProfile;
import com.medassist.model.RawPatientFacts;
import com.medassist.model.Recommendation;
import com.medassist.model.RiskAssessment;
import com.medassist.model.TermNormalization;
import com.medassist.model.Warning;
import com.medassist.source.EvidenceCorpusClient;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Entry point of the reasoning core for the API layer.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ClinicalReasoningService {

    static final String DESCRIPTION_PATIENT_PREFIX = "description-";

    private final TermNormalizer termNormalizer;
    private final ClinicalTextExtractor textExtractor;
    private final ProfileAssembler profileAssembler;
    private final RiskStratifier riskStratifier;
    private final GuidelineCorpus guidelineCorpus;
    private final GuidelineMatcher guidelineMatcher;
    private final RecommendationComposer composer;
    private final PlanReviewStateMachine stateMachine;
    private final SourceFanOut sourceFanOut;
    private final EvidenceCorpusClient evidenceClient;
    private final AuditService auditService;

    public RiskAssessment assessRisk(PatientProfile profile) {
        RiskAssessment assessment = riskStratifier.assess(profile);
        auditService.log(AuditLog.AuditAction.RISK_ASSESSED, "PatientProfile", profile.getPatientId(),
            profile.getPatientId(), "hypertension=" + assessment.hypertension().level().label()
                + ", diabetes=" + assessment.diabetesStatus().map(s -> s.label()).orElse("n/a"),
            AuditLog.AuditStatus.SUCCESS, null);
        return assessment;
    }

    public Recommendation composeRecommendation(PatientProfile profile, String requestedConditionText) {
        long started = System.currentTimeMillis();
        Recommendation recommendation = composer.compose(profile, requestedConditionText);
        return publish(recommendation, started);
    }

    /**
     * Full pass for a stored patient: every fact source and the evidence corpus are
     * queried concurrently, then the profile is assembled and the plan composed against
     * the corpus snapshot taken when the pass started.
     */
    public Recommendation composeForPatient(String patientId, String requestedConditionText) {
        long started = System.currentTimeMillis();
        CorpusSnapshot snapshot = guidelineCorpus.snapshot();

        SourceFetchResult fetched = sourceFanOut.fetch(patientId, requestedConditionText, Map.of());
        PatientProfile profile = profileAssembler.assemble(patientId, fetched.facts());
        auditService.log(AuditLog.AuditAction.PROFILE_ASSEMBLED, "PatientProfile", patientId, patientId,
            "sources=" + profile.getSources() + ", degraded=" + fetched.degradedSources(),
            fetched.isDegraded() ? AuditLog.AuditStatus.WARNING : AuditLog.AuditStatus.SUCCESS, null);

        Recommendation recommendation = composer.compose(profile, requestedConditionText, snapshot,
            fetched.evidence(), fetched.degradedSources());
        return publish(recommendation, started);
    }

    /**
     * Pass over a free-text clinical description instead of a stored patient.
     */
    public Recommendation composeFromDescription(String description) {
        long started = System.currentTimeMillis();
        CorpusSnapshot snapshot = guidelineCorpus.snapshot();

        RawPatientFacts facts = textExtractor.extract(description);
        String patientId = DESCRIPTION_PATIENT_PREFIX + UUID.randomUUID();
        PatientProfile profile = profileAssembler.assemble(patientId, List.of(facts));

        List<EvidenceHit> evidence = List.of();
        List<String> degraded = List.of();
        try {
            evidence = evidenceClient.fetchEvidenceCorpusHits(description, Map.of());
        } catch (SourceUnavailableException e) {
            log.warn("Evidence corpus unavailable for description pass: {}", e.getMessage());
            auditService.logSourceDegraded(patientId, e.getSourceName(), e.getMessage());
            degraded = List.of(e.getSourceName());
        }

        Recommendation recommendation = composer.compose(profile, description, snapshot, evidence, degraded);
        return publish(recommendation, started);
    }

    /**
     * Canonical form of a term, with suggestions when it is not in the dictionary.
     */
    public TermNormalization normalizeTerm(String text) {
        TermNormalization result = termNormalizer.lookup(text);
        if (!result.mapped()) {
            auditService.log(AuditLog.AuditAction.TERM_LOOKUP, "Term", text, null,
                result.suggestions().size() + " suggestions", AuditLog.AuditStatus.WARNING, null);
        }
        return result;
    }

    /**
     * Lists participating rules without evaluating them against a patient.
     */
    public GuidelineQueryResult queryGuidelines(Disease diseaseType, LocalDate effectiveFrom, Integer topK) {
        long started = System.currentTimeMillis();
        GuidelineQuery query = GuidelineQuery.builder()
            .diseaseType(diseaseType)
            .effectiveFrom(effectiveFrom)
            .topK(topK)
            .build();
        GuidelineQueryResult result = guidelineMatcher.match(guidelineCorpus.snapshot(), null, query);
        auditService.log(AuditLog.AuditAction.GUIDELINE_QUERY, "GuidelineCorpus", String.valueOf(result.corpusVersion()),
            null, "disease=" + diseaseType + ", effectiveFrom=" + effectiveFrom + ", matches=" + result.matches().size(),
            AuditLog.AuditStatus.SUCCESS, System.currentTimeMillis() - started);
        return result;
    }

    public Recommendation reviewPlan(UUID recommendationId, PatientProfile updatedProfile) {
        return stateMachine.review(recommendationId, updatedProfile);
    }

    public Recommendation acceptPlan(UUID recommendationId) {
        return stateMachine.accept(recommendationId);
    }

    public Recommendation flagForReview(UUID recommendationId, String reason) {
        return stateMachine.beginReview(recommendationId, reason);
    }

    public PlanReviewState planState(UUID recommendationId) {
        return stateMachine.state(recommendationId);
    }

    public List<Recommendation> planHistory(UUID recommendationId) {
        return stateMachine.history(recommendationId);
    }

    public List<PlanTransition> planTransitions(UUID recommendationId) {
        return stateMachine.transitions(recommendationId);
    }

    public CorpusSnapshot reloadCorpus() {
        return guidelineCorpus.reload();
    }

    private Recommendation publish(Recommendation recommendation, long started) {
        stateMachine.register(recommendation);
        long elapsed = System.currentTimeMillis() - started;
        String id = recommendation.getId().toString();
        auditService.logRecommendation(recommendation.getPatientId(), id,
            recommendation.getPlanSteps().size() + " steps, " + recommendation.getWarnings().size()
                + " warnings, corpus version " + recommendation.getCorpusVersion(), elapsed);
        if (recommendation.hasBlockingWarning()) {
            auditService.logContraindication(recommendation.getPatientId(), id,
                recommendation.getWarnings().stream()
                    .filter(Warning::isBlocksDelivery)
                    .map(Warning::getMessage)
                    .collect(Collectors.joining(" | ")));
        }
        return recommendation;
    }
}
