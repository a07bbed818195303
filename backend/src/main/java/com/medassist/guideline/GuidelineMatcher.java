package com.medassist.guideline;

import com.medassist.config.ReasoningProperties;
import com.medassist.model.GuidelineRule;
import com.medassist.model.PatientProfile;
import com.medassist.service.ClinicalVocabulary;
import com.medassist.service.TermNormalizer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Guideline Matcher
 *
 * Evaluates the parsed rules of one snapshot against a profile. A rule matches when
 * every structured clause holds; free-text tags never exclude a rule and only add score.
 * Ranking: score desc, effective-from desc, name asc, rule id asc.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class GuidelineMatcher {

    static final Comparator<GuidelineMatch> RANKING = Comparator
        .comparingInt(GuidelineMatch::score).reversed()
        .thenComparing(m -> m.rule().effectiveFrom(), Comparator.nullsLast(Comparator.<LocalDate>reverseOrder()))
        .thenComparing(m -> m.rule().name(), Comparator.nullsLast(Comparator.<String>naturalOrder()))
        .thenComparingLong(m -> m.rule().ruleId());

    private final TermNormalizer termNormalizer;
    private final ReasoningProperties properties;

    /**
     * Ranked matches for a profile. With a null profile no structured clause is evaluated
     * and every participating rule is listed.
     */
    public GuidelineQueryResult match(CorpusSnapshot snapshot, PatientProfile profile, GuidelineQuery query) {
        Set<String> context = contextTerms(profile, query.getRequestedConditionText());
        List<GuidelineMatch> matches = new ArrayList<>();

        for (ParsedGuidelineRule parsed : snapshot.rules()) {
            if (!participates(parsed.rule(), snapshot.asOf(), query)) {
                continue;
            }
            GuidelineMatch match = evaluate(parsed, profile, context);
            if (match != null) {
                matches.add(match);
            }
        }

        matches.sort(RANKING);
        int topK = query.getTopK() != null ? query.getTopK() : properties.getGuidelines().getTopK();
        List<GuidelineMatch> ranked = topK > 0 && matches.size() > topK ? matches.subList(0, topK) : matches;

        GuidelineQueryResult result = GuidelineQueryResult.of(ranked, snapshot.version());
        if (result.noMatchingEvidence()) {
            log.info("No matching guideline evidence: disease={}, effectiveFrom={}, corpus version {}",
                query.getDiseaseType(), query.getEffectiveFrom(), snapshot.version());
        }
        return result;
    }

    private GuidelineMatch evaluate(ParsedGuidelineRule parsed, PatientProfile profile, Set<String> context) {
        ConditionPredicate predicate = parsed.predicate();
        List<String> matchedClauses = new ArrayList<>();
        if (profile != null) {
            for (ConditionClause clause : predicate.structuredClauses()) {
                if (!isSatisfied(clause, profile)) {
                    return null;
                }
                matchedClauses.add(clause.describe());
            }
        }

        List<String> satisfiedTags = predicate.tags().stream()
            .map(FreeTextTag::tag)
            .filter(context::contains)
            .toList();

        int specificity = predicate.specificity();
        return new GuidelineMatch(parsed, satisfiedTags.size() + specificity, specificity, satisfiedTags, matchedClauses);
    }

    private static boolean isSatisfied(ConditionClause clause, PatientProfile profile) {
        if (clause instanceof NumericThreshold threshold) {
            return threshold.isSatisfiedBy(profile);
        }
        if (clause instanceof SetMembership membership) {
            return membership.isSatisfiedBy(profile);
        }
        return true;
    }

    static boolean participates(GuidelineRule rule, LocalDate asOf, GuidelineQuery query) {
        if (!rule.active()) {
            return false;
        }
        if (query.getDiseaseType() != null && query.getDiseaseType() != rule.diseaseType()) {
            return false;
        }
        LocalDate effective = rule.effectiveFrom();
        if (effective == null) {
            return query.getEffectiveFrom() == null;
        }
        if (effective.isAfter(asOf)) {
            return false;
        }
        return query.getEffectiveFrom() == null || !effective.isBefore(query.getEffectiveFrom());
    }

    /**
     * Canonical terms that satisfy free-text tags.
     */
    private Set<String> contextTerms(PatientProfile profile, String requestedConditionText) {
        Set<String> terms = new HashSet<>();
        if (profile != null) {
            terms.addAll(profile.getDiagnoses());
            terms.addAll(profile.getRiskFactors());
            terms.addAll(profile.getTargetOrganDamage());
            terms.addAll(profile.getClinicalConditions());
            terms.addAll(profile.getDiabetesComplications());
            if (profile.isPregnant()) {
                terms.add(ClinicalVocabulary.PREGNANCY);
            }
            if (profile.getFlags().frequentHypoglycemia()) {
                terms.add(ClinicalVocabulary.FREQUENT_HYPOGLYCEMIA);
            }
        }
        if (requestedConditionText != null && !requestedConditionText.isBlank()) {
            terms.addAll(termNormalizer.findTerms(requestedConditionText));
            terms.add(termNormalizer.canonicalize(requestedConditionText));
        }
        return terms;
    }
}
