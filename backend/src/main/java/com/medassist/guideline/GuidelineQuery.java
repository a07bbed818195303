package com.medassist.guideline;

import com.medassist.model.Disease;
import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;

/**
 * Filters for one guideline lookup. Every field is optional.
 */
@Value
@Builder(toBuilder = true)
public class GuidelineQuery {

    Disease diseaseType;

    /** Only rules effective on or after this date. */
    LocalDate effectiveFrom;

    /** Null uses the configured default; 0 means unlimited. */
    Integer topK;

    /** Caller's condition text; its canonical terms satisfy tags. */
    String requestedConditionText;

    public static GuidelineQuery forDisease(Disease disease) {
        return GuidelineQuery.builder().diseaseType(disease).build();
    }
}
