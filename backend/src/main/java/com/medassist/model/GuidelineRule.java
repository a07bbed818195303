package com.medassist.model;

import java.time.LocalDate;

/**
 * Read-only guideline recommendation as stored in the fact base.
 */
public record GuidelineRule(long ruleId,
                            String name,
                            Disease diseaseType,
                            String condition,
                            EvidenceLevel level,
                            String content,
                            String evidenceSource,
                            LocalDate effectiveFrom,
                            boolean active) {
}
