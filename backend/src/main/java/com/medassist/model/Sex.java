package com.medassist.model;

import java.util.Locale;

public enum Sex {
    MALE,
    FEMALE,
    OTHER,
    UNKNOWN;

    /**
     * Lenient parse of the sex/gender column values found in fact sources
     * (FHIR administrative gender codes, single letters, full words).
     */
    public static Sex fromText(String value) {
        if (value == null || value.isBlank()) {
            return UNKNOWN;
        }
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "m", "male", "man" -> MALE;
            case "f", "female", "woman" -> FEMALE;
            case "other" -> OTHER;
            default -> UNKNOWN;
        };
    }
}
