package com.medassist.model;

import java.util.List;

/**
 * Result of a term lookup. Suggestions are only filled in for unmapped terms.
 */
public record TermNormalization(String input, String canonical, boolean mapped, List<TermSuggestion> suggestions) {

    public TermNormalization {
        suggestions = List.copyOf(suggestions);
    }

    public static TermNormalization mapped(String input, String canonical) {
        return new TermNormalization(input, canonical, true, List.of());
    }
}
