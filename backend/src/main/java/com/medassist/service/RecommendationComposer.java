package com.medassist.service;

import com.medassist.guideline.CorpusSnapshot;
import com.medassist.guideline.GuidelineCorpus;
import com.medassist.guideline.GuidelineMatch;
import com.medassist.guideline.GuidelineMatcher;
import com.medassist.guideline.GuidelineQuery;
import com.medassist.guideline.GuidelineQueryResult;
import com.medassist.model.DiagnosisCandidate;
import com.medassist.model.Disease;
import com.medassist.model.EvidenceHit;
import com.medassist.model.Labs;
import com.medassist.model.PatientProfile;
import com.medassist.model.PlanStep;
import com.medassist.model.PlanStepKind;
import com.medassist.model.Recommendation;
import com.medassist.model.RiskAssessment;
import com.medassist.model.Vitals;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

/**
 * Recommendation Composer
 *
 * One reasoning pass: stratify risk, work out the disease axes the patient has, take the
 * best guideline match per axis from a single corpus snapshot, screen the plan through
 * {@link SafetyGuard} and build the {@link Recommendation}. The result is built only
 * after every step has succeeded.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class RecommendationComposer {

    static final double HYPERTENSION_SYSTOLIC = 140.0;
    static final double HYPERTENSION_DIASTOLIC = 90.0;
    static final double DIABETES_HBA1C = 6.5;
    static final double DIABETES_FASTING_GLUCOSE = 7.0;

    static final double LIKELIHOOD_DIAGNOSED = 1.0;
    static final double LIKELIHOOD_MEASURED = 0.9;
    static final double LIKELIHOOD_REQUESTED = 0.5;

    private final RiskStratifier riskStratifier;
    private final GuidelineCorpus guidelineCorpus;
    private final GuidelineMatcher guidelineMatcher;
    private final SafetyGuard safetyGuard;
    private final TermNormalizer termNormalizer;
    private final Clock clock;

    public Recommendation compose(PatientProfile profile, String requestedConditionText) {
        return compose(profile, requestedConditionText, guidelineCorpus.snapshot(), List.of(), List.of());
    }

    public Recommendation compose(PatientProfile profile, String requestedConditionText, CorpusSnapshot snapshot,
                                  List<EvidenceHit> supportingEvidence, List<String> degradedSources) {
        RiskAssessment risk = riskStratifier.assess(profile);

        Map<Disease, Double> axes = diseaseAxes(profile, requestedConditionText);
        List<PlanStep> proposed = new ArrayList<>();
        for (Disease disease : axes.keySet()) {
            GuidelineQuery query = GuidelineQuery.builder()
                .diseaseType(disease)
                .topK(1)
                .requestedConditionText(requestedConditionText)
                .build();
            GuidelineQueryResult result = guidelineMatcher.match(snapshot, profile, query);
            if (result.hasMatches()) {
                proposed.add(toPlanStep(disease, result.matches().get(0)));
            } else {
                proposed.add(PlanStep.noGuidelineMatch(disease));
            }
        }

        SafetyReview review = safetyGuard.review(profile, risk, proposed, degradedSources);

        Recommendation recommendation = Recommendation.builder()
            .id(UUID.randomUUID())
            .patientId(profile.getPatientId())
            .requestedConditionText(requestedConditionText)
            .createdAt(Instant.now(clock))
            .corpusVersion(snapshot.version())
            .riskAssessment(risk)
            .diagnosisCandidates(diagnosisCandidates(axes))
            .planSteps(review.plan())
            .warnings(review.warnings())
            .supportingEvidence(List.copyOf(supportingEvidence))
            .degradedSources(List.copyOf(degradedSources))
            .build();

        log.info("Composed recommendation {} for {}: axes={}, {} steps, {} warnings, corpus version {}",
            recommendation.getId(), profile.getPatientId(), axes.keySet(), review.plan().size(),
            review.warnings().size(), snapshot.version());
        return recommendation;
    }

    /**
     * Disease axes with the likelihood of each: diagnosed, above a diagnostic
     * threshold, or only named in the caller's text.
     */
    Map<Disease, Double> diseaseAxes(PatientProfile profile, String requestedConditionText) {
        Map<Disease, Double> axes = new EnumMap<>(Disease.class);

        for (Disease disease : ClinicalVocabulary.diseasesIn(profile.getDiagnoses())) {
            axes.put(disease, LIKELIHOOD_DIAGNOSED);
        }
        for (Disease disease : measuredDiseases(profile)) {
            axes.putIfAbsent(disease, LIKELIHOOD_MEASURED);
        }
        if (requestedConditionText != null && !requestedConditionText.isBlank()) {
            Set<String> requested = new HashSet<>(termNormalizer.findTerms(requestedConditionText));
            requested.add(termNormalizer.canonicalize(requestedConditionText));
            for (Disease disease : ClinicalVocabulary.diseasesIn(requested)) {
                axes.putIfAbsent(disease, LIKELIHOOD_REQUESTED);
            }
            Disease.fromText(requestedConditionText).ifPresent(d -> axes.putIfAbsent(d, LIKELIHOOD_REQUESTED));
        }
        return axes;
    }

    private static Set<Disease> measuredDiseases(PatientProfile profile) {
        Set<Disease> diseases = EnumSet.noneOf(Disease.class);
        Vitals vitals = profile.getVitals();
        if ((vitals.systolic() != null && vitals.systolic() >= HYPERTENSION_SYSTOLIC)
            || (vitals.diastolic() != null && vitals.diastolic() >= HYPERTENSION_DIASTOLIC)) {
            diseases.add(Disease.HYPERTENSION);
        }
        Labs labs = profile.getLabs();
        if ((labs.hba1c() != null && labs.hba1c() >= DIABETES_HBA1C)
            || (labs.fastingGlucose() != null && labs.fastingGlucose() >= DIABETES_FASTING_GLUCOSE)) {
            diseases.add(Disease.DIABETES);
        }
        return diseases;
    }

    private static PlanStep toPlanStep(Disease disease, GuidelineMatch match) {
        StringBuilder rationale = new StringBuilder(match.rule().name());
        if (match.rule().evidenceSource() != null) {
            rationale.append(" (").append(match.rule().evidenceSource()).append(")");
        }
        if (!match.matchedClauses().isEmpty()) {
            rationale.append("; matched ").append(String.join(", ", match.matchedClauses()));
        }
        if (!match.satisfiedTags().isEmpty()) {
            rationale.append("; applies to ").append(String.join(", ", match.satisfiedTags()));
        }
        return PlanStep.builder()
            .kind(PlanStepKind.GUIDELINE)
            .disease(disease)
            .action(match.rule().content())
            .rationale(rationale.toString())
            .evidenceLevel(match.rule().level())
            .drugClasses(match.parsedRule().drugClasses())
            .evidence(match.evidenceRef())
            .build();
    }

    private static List<DiagnosisCandidate> diagnosisCandidates(Map<Disease, Double> axes) {
        List<DiagnosisCandidate> candidates = new ArrayList<>();
        axes.forEach((disease, likelihood) -> candidates.add(new DiagnosisCandidate(disease.getCanonicalTerm(), likelihood)));
        // EnumMap order breaks ties
        candidates.sort(Comparator.comparingDouble(DiagnosisCandidate::likelihood).reversed());
        return List.copyOf(candidates);
    }
}
