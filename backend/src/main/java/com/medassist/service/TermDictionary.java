package com.medassist.service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Immutable alias table. Built once per load and swapped as a whole by {@link TermNormalizer}.
 */
final class TermDictionary {

    static final TermDictionary EMPTY = new TermDictionary(Map.of());

    // Every key (alias or canonical) -> canonical, keys as written
    private final Map<String, String> exact;
    // Lower-cased key -> canonical
    private final Map<String, String> caseInsensitive;
    private final Map<String, List<String>> aliasesByCanonical;
    private final Pattern termPattern;

    private TermDictionary(Map<String, List<String>> entries) {
        Map<String, String> exactMap = new LinkedHashMap<>();
        Map<String, String> lowerMap = new HashMap<>();
        Map<String, List<String>> aliases = new TreeMap<>();

        entries.forEach((canonical, aliasList) -> {
            String canonicalTerm = canonical.trim();
            exactMap.put(canonicalTerm, canonicalTerm);
            lowerMap.put(canonicalTerm.toLowerCase(Locale.ROOT), canonicalTerm);
            List<String> kept = new ArrayList<>();
            for (String alias : aliasList) {
                String a = alias.trim();
                if (a.isEmpty() || a.equals(canonicalTerm)) {
                    continue;
                }
                exactMap.putIfAbsent(a, canonicalTerm);
                lowerMap.putIfAbsent(a.toLowerCase(Locale.ROOT), canonicalTerm);
                kept.add(a);
            }
            aliases.put(canonicalTerm, List.copyOf(kept));
        });

        this.exact = Collections.unmodifiableMap(exactMap);
        this.caseInsensitive = Collections.unmodifiableMap(lowerMap);
        this.aliasesByCanonical = Collections.unmodifiableMap(aliases);
        this.termPattern = buildPattern(lowerMap.keySet());
    }

    static TermDictionary of(Map<String, List<String>> entries) {
        return entries == null || entries.isEmpty() ? EMPTY : new TermDictionary(entries);
    }

    boolean isEmpty() {
        return exact.isEmpty();
    }

    int size() {
        return exact.size();
    }

    String lookupExact(String term) {
        return exact.get(term);
    }

    String lookupIgnoreCase(String term) {
        return caseInsensitive.get(term.toLowerCase(Locale.ROOT));
    }

    boolean isCanonical(String term) {
        return aliasesByCanonical.containsKey(term);
    }

    List<String> aliasesOf(String canonical) {
        return aliasesByCanonical.getOrDefault(canonical, List.of());
    }

    /**
     * Every key with the canonical it maps to.
     */
    Map<String, String> keys() {
        return exact;
    }

    /**
     * Whole-word, case-insensitive alternation of all keys, longest first so that
     * "diabetes mellitus" wins over "diabetes".
     */
    Pattern termPattern() {
        return termPattern;
    }

    private static Pattern buildPattern(java.util.Set<String> keys) {
        if (keys.isEmpty()) {
            return null;
        }
        String alternation = keys.stream()
            .sorted(Comparator.comparingInt(String::length).reversed().thenComparing(Comparator.naturalOrder()))
            .map(Pattern::quote)
            .collect(Collectors.joining("|"));
        return Pattern.compile("(?<![\\p{L}\\p{N}])(?:" + alternation + ")(?![\\p{L}\\p{N}])",
            Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);
    }
}
