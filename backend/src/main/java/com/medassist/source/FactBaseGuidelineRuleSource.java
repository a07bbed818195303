package com.medassist.source;

import com.medassist.entity.GuidelineRecommendation;
import com.medassist.exception.SourceUnavailableException;
import com.medassist.guideline.GuidelineRuleSource;
import com.medassist.model.Disease;
import com.medassist.model.EvidenceLevel;
import com.medassist.model.GuidelineRule;
import com.medassist.repository.GuidelineRecommendationRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * Guideline rules from the {@code guideline_recommendations} table.
 * {@code update_date} is the rule's effective-from date.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class FactBaseGuidelineRuleSource implements GuidelineRuleSource {

    private final GuidelineRecommendationRepository repository;

    @Override
    @Transactional(readOnly = true)
    public List<GuidelineRule> fetchActiveGuidelineRules(Disease diseaseType, LocalDate effectiveFrom) {
        List<GuidelineRecommendation> rows;
        try {
            rows = repository.findActive(diseaseType, effectiveFrom);
        } catch (DataAccessException e) {
            throw new SourceUnavailableException("guideline_recommendations", e.getMessage(), e);
        }

        List<GuidelineRule> rules = new ArrayList<>(rows.size());
        for (GuidelineRecommendation row : rows) {
            rules.add(toRule(row));
        }
        log.debug("Fetched {} active guideline rules (disease={}, effectiveFrom={})", rules.size(), diseaseType, effectiveFrom);
        return rules;
    }

    static GuidelineRule toRule(GuidelineRecommendation row) {
        return new GuidelineRule(
            row.getRuleId(),
            row.getGuidelineName(),
            row.getDiseaseType(),
            row.getPatientCondition(),
            EvidenceLevel.fromCode(row.getRecommendationLevel()),
            row.getRecommendationContent(),
            row.getEvidenceSource(),
            row.getUpdateDate(),
            !Boolean.FALSE.equals(row.getActive())
        );
    }
}
