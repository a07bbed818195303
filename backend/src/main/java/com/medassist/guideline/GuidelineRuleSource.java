package com.medassist.guideline;

import com.medassist.model.Disease;
import com.medassist.model.GuidelineRule;

import java.time.LocalDate;
import java.util.List;

/**
 * Read-only access to the guideline recommendation table.
 */
public interface GuidelineRuleSource {

    /**
     * Active rules, optionally restricted to one disease and to rules updated on or after a date.
     */
    List<GuidelineRule> fetchActiveGuidelineRules(Disease diseaseType, LocalDate effectiveFrom);
}
