package com.medassist.model;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

/**
 * Disease axes known to the guideline corpus. Only hypertension and diabetes
 * are stratified; the others exist so that rules for them load and filter.
 */
public enum Disease {
    HYPERTENSION("hypertension"),
    DIABETES("diabetes mellitus"),
    CORONARY_HEART_DISEASE("coronary heart disease"),
    STROKE("stroke");

    private final String canonicalTerm;

    Disease(String canonicalTerm) {
        this.canonicalTerm = canonicalTerm;
    }

    public String getCanonicalTerm() {
        return canonicalTerm;
    }

    /**
     * Resolves a canonical term, an enum name or a lower-case label.
     */
    public static Optional<Disease> fromText(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        String key = value.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
            .filter(d -> d.canonicalTerm.equals(key)
                || d.name().equalsIgnoreCase(key)
                || d.name().replace('_', ' ').equalsIgnoreCase(key))
            .findFirst();
    }
}
