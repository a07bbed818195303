package com.medassist.service;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.medassist.config.ReasoningProperties;
import com.medassist.exception.CorpusReloadException;
import com.medassist.exception.NoCanonicalFormException;
import com.medassist.model.TermNormalization;
import com.medassist.model.TermSuggestion;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.text.similarity.LevenshteinDistance;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.atomic.AtomicReference;
import java.util.regex.Matcher;

/**
 * Term Normalizer
 *
 * Maps colloquial and abbreviated clinical terms to canonical terms.
 * The dictionary is loaded at startup and only replaced by {@link #reload()};
 * request-time calls never modify it.
 */
@Service
@Slf4j
public class TermNormalizer {

    private static final LevenshteinDistance LEVENSHTEIN = LevenshteinDistance.getDefaultInstance();

    private final ResourceLoader resourceLoader;
    private final ObjectMapper objectMapper;
    private final ReasoningProperties properties;

    private final AtomicReference<TermDictionary> dictionary = new AtomicReference<>(TermDictionary.EMPTY);

    public TermNormalizer(ResourceLoader resourceLoader, ObjectMapper objectMapper, ReasoningProperties properties) {
        this.resourceLoader = resourceLoader;
        this.objectMapper = objectMapper;
        this.properties = properties;
    }

    @PostConstruct
    void loadAtStartup() {
        try {
            reload();
        } catch (CorpusReloadException e) {
            log.error("Term dictionary not loaded, normalization unavailable: {}", e.getMessage());
        }
    }

    /**
     * Reads the dictionary resource and swaps it in. On failure the previous
     * dictionary stays in place.
     *
     * @return number of keys (aliases plus canonical terms) now loaded
     */
    public synchronized int reload() {
        String location = properties.getTerms().getDictionary();
        Resource resource = resourceLoader.getResource(location);
        Map<String, List<String>> entries;
        try (InputStream in = resource.getInputStream()) {
            entries = objectMapper.readValue(in, new TypeReference<Map<String, List<String>>>() {});
        } catch (IOException e) {
            throw new CorpusReloadException("Failed to load term dictionary from " + location, e);
        }
        TermDictionary loaded = TermDictionary.of(entries);
        dictionary.set(loaded);
        log.info("Term dictionary loaded from {}: {} keys", location, loaded.size());
        return loaded.size();
    }

    void install(Map<String, List<String>> entries) {
        dictionary.set(TermDictionary.of(entries));
    }

    /**
     * Canonical form of a term. Canonical input maps to itself with {@code mapped=true};
     * unknown input comes back trimmed with {@code mapped=false}.
     */
    public TermNormalization normalize(String term) {
        TermDictionary dict = requireDictionary();
        String trimmed = term == null ? "" : term.trim();

        String canonical = dict.lookupExact(trimmed);
        if (canonical == null) {
            canonical = dict.lookupIgnoreCase(trimmed);
        }
        if (canonical != null) {
            if (!canonical.equals(trimmed)) {
                log.debug("Term mapped: '{}' -> '{}'", trimmed, canonical);
            }
            return TermNormalization.mapped(trimmed, canonical);
        }
        return new TermNormalization(trimmed, trimmed, false, List.of());
    }

    /**
     * Normalization plus suggestions for terms that did not map.
     */
    public TermNormalization lookup(String term) {
        TermNormalization result = normalize(term);
        if (result.mapped()) {
            return result;
        }
        return new TermNormalization(result.input(), result.canonical(), false, suggest(result.input()));
    }

    /**
     * Canonical term, or the lower-cased input when the dictionary has no mapping.
     */
    public String canonicalize(String term) {
        TermNormalization result = normalize(term);
        return result.mapped() ? result.canonical() : result.canonical().toLowerCase(Locale.ROOT);
    }

    /**
     * Closest dictionary keys by normalized Levenshtein similarity, best first,
     * ties in lexicographic order of the candidate.
     */
    public List<TermSuggestion> suggest(String term) {
        TermDictionary dict = requireDictionary();
        String needle = term == null ? "" : term.trim().toLowerCase(Locale.ROOT);
        if (needle.isEmpty()) {
            return List.of();
        }
        double minSimilarity = properties.getTerms().getMinSimilarity();

        List<TermSuggestion> scored = new ArrayList<>();
        dict.keys().forEach((candidate, canonical) -> {
            double similarity = similarity(needle, candidate.toLowerCase(Locale.ROOT));
            if (similarity >= minSimilarity) {
                scored.add(new TermSuggestion(candidate, canonical, similarity));
            }
        });

        return scored.stream()
            .sorted(Comparator.comparingDouble(TermSuggestion::similarity).reversed()
                .thenComparing(TermSuggestion::candidate))
            .limit(properties.getTerms().getMaxSuggestions())
            .toList();
    }

    /**
     * Rewrites every dictionary key found in free text to its canonical term.
     */
    public String expandQuery(String text) {
        TermDictionary dict = requireDictionary();
        if (text == null || text.isBlank()) {
            return text;
        }
        Matcher matcher = dict.termPattern().matcher(text);
        StringBuilder sb = new StringBuilder();
        while (matcher.find()) {
            String canonical = dict.lookupIgnoreCase(matcher.group());
            matcher.appendReplacement(sb, Matcher.quoteReplacement(canonical));
        }
        matcher.appendTail(sb);
        String expanded = sb.toString();
        if (!expanded.equals(text)) {
            log.debug("Query expanded: '{}' -> '{}'", text, expanded);
        }
        return expanded;
    }

    /**
     * Canonical terms mentioned in free text, in order of first mention.
     */
    public Set<String> findTerms(String text) {
        TermDictionary dict = requireDictionary();
        Set<String> found = new LinkedHashSet<>();
        if (text == null || text.isBlank()) {
            return found;
        }
        Matcher matcher = dict.termPattern().matcher(text);
        while (matcher.find()) {
            found.add(dict.lookupIgnoreCase(matcher.group()));
        }
        return found;
    }

    public List<String> aliasesOf(String canonical) {
        return requireDictionary().aliasesOf(canonical);
    }

    public boolean isCanonical(String term) {
        return requireDictionary().isCanonical(term);
    }

    private TermDictionary requireDictionary() {
        TermDictionary dict = dictionary.get();
        if (dict.isEmpty()) {
            throw new NoCanonicalFormException("Term dictionary is empty; check medassist.terms.dictionary");
        }
        return dict;
    }

    static double similarity(String a, String b) {
        int longest = Math.max(a.length(), b.length());
        if (longest == 0) {
            return 1.0;
        }
        int distance = LEVENSHTEIN.apply(a, b);
        return Math.round((1.0 - (double) distance / longest) * 1000.0) / 1000.0;
    }
}
