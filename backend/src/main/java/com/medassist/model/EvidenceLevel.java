package com.medassist.model;

import java.util.Locale;

/**
 * Guideline strength-of-recommendation grade, IA strongest.
 */
public enum EvidenceLevel {
    IA,
    IB,
    IIA,
    IIB,
    III;

    /**
     * Accepts ASCII codes ("IIa", "I-A") as well as the Unicode roman numerals
     * used by the fact base ("ⅠA", "ⅡB", "Ⅲ").
     */
    public static EvidenceLevel fromCode(String code) {
        if (code == null || code.isBlank()) {
            throw new IllegalArgumentException("Evidence level is required");
        }
        String normalized = code.trim()
            .replace("Ⅲ", "III")
            .replace("Ⅱ", "II")
            .replace("Ⅰ", "I")
            .replace("-", "")
            .replace(" ", "")
            .toUpperCase(Locale.ROOT);
        return valueOf(normalized);
    }
}
