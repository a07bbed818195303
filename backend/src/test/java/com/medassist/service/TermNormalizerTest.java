package com.medassist.service;

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;
import java.util.Map;
import java.util.Set;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.core.io.DefaultResourceLoader;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.medassist.config.ReasoningProperties;
import com.medassist.exception.CorpusReloadException;
import com.medassist.exception.NoCanonicalFormException;
import com.medassist.model.TermNormalization;
import com.medassist.model.TermSuggestion;

/**
 * Unit tests for TermNormalizer against the bundled term dictionary.
 */
@DisplayName("TermNormalizer Tests")
class TermNormalizerTest {

    private ReasoningProperties properties;
    private TermNormalizer normalizer;

    @BeforeEach
    void setUp() {
        properties = new ReasoningProperties();
        normalizer = new TermNormalizer(new DefaultResourceLoader(), new ObjectMapper(), properties);
        normalizer.reload();
    }

    @Nested
    @DisplayName("normalize() Tests")
    class NormalizeTests {

        @Test
        @DisplayName("Should map an abbreviation regardless of case")
        void shouldMapAbbreviationRegardlessOfCase() {
            // Act
            TermNormalization result = normalizer.normalize("HTN");

            // Assert
            assertTrue(result.mapped());
            assertEquals("hypertension", result.canonical());
            assertEquals("HTN", result.input());
        }

        @Test
        @DisplayName("Should map a canonical term to itself")
        void shouldMapCanonicalTermToItself() {
            TermNormalization result = normalizer.normalize("type 2 diabetes mellitus");

            assertTrue(result.mapped());
            assertEquals("type 2 diabetes mellitus", result.canonical());
        }

        @Test
        @DisplayName("Should trim input before lookup")
        void shouldTrimInput() {
            assertEquals("diabetes mellitus", normalizer.normalize("  DM ").canonical());
        }

        @Test
        @DisplayName("Should return unknown term unmapped and unchanged")
        void shouldReturnUnknownTermUnmapped() {
            TermNormalization result = normalizer.normalize("Zebra fever");

            assertFalse(result.mapped());
            assertEquals("Zebra fever", result.canonical());
            assertTrue(result.suggestions().isEmpty());
        }

        @Test
        @DisplayName("canonicalize() should lower-case unknown terms")
        void canonicalizeShouldLowerCaseUnknownTerms() {
            assertEquals("zebra fever", normalizer.canonicalize("Zebra Fever"));
            assertEquals("smoking", normalizer.canonicalize("Current smoker"));
        }
    }

    @Nested
    @DisplayName("lookup() and suggest() Tests")
    class SuggestionTests {

        @Test
        @DisplayName("Should suggest the closest canonical term for a misspelling")
        void shouldSuggestClosestTermForMisspelling() {
            // Act
            TermNormalization result = normalizer.lookup("hypertensoin");

            // Assert
            assertFalse(result.mapped());
            assertFalse(result.suggestions().isEmpty());
            assertEquals("hypertension", result.suggestions().get(0).canonical());
        }

        @Test
        @DisplayName("Should not attach suggestions to mapped terms")
        void shouldNotSuggestForMappedTerms() {
            TermNormalization result = normalizer.lookup("high blood pressure");

            assertTrue(result.mapped());
            assertEquals("hypertension", result.canonical());
            assertTrue(result.suggestions().isEmpty());
        }

        @Test
        @DisplayName("Should order suggestions by similarity and cap their number")
        void shouldOrderAndCapSuggestions() {
            properties.getTerms().setMaxSuggestions(3);

            List<TermSuggestion> suggestions = normalizer.suggest("diabetis");

            assertTrue(suggestions.size() <= 3);
            for (int i = 1; i < suggestions.size(); i++) {
                assertTrue(suggestions.get(i - 1).similarity() >= suggestions.get(i).similarity());
            }
            assertEquals("diabetes mellitus", suggestions.get(0).canonical());
        }

        @Test
        @DisplayName("Should return no suggestions for blank input")
        void shouldReturnNoSuggestionsForBlankInput() {
            assertTrue(normalizer.suggest("  ").isEmpty());
        }

        @Test
        @DisplayName("Similarity should be one for identical strings")
        void similarityShouldBeOneForIdenticalStrings() {
            assertEquals(1.0, TermNormalizer.similarity("stroke", "stroke"));
            assertEquals(0.0, TermNormalizer.similarity("abc", "xyz"));
        }
    }

    @Nested
    @DisplayName("Free-text Tests")
    class FreeTextTests {

        @Test
        @DisplayName("Should rewrite every alias in a query to its canonical term")
        void shouldExpandQuery() {
            String expanded = normalizer.expandQuery("first-line drugs for HTN with T2DM");

            assertEquals("first-line drugs for hypertension with type 2 diabetes mellitus", expanded);
        }

        @Test
        @DisplayName("Should find terms in order of first mention, longest alias first")
        void shouldFindTermsInOrder() {
            Set<String> terms = normalizer.findTerms("Smoker with LVH and type 2 diabetes, also a smoker");

            assertEquals(List.of("smoking", "left ventricular hypertrophy", "type 2 diabetes mellitus"),
                    List.copyOf(terms));
        }

        @Test
        @DisplayName("Should not match aliases inside other words")
        void shouldNotMatchInsideWords() {
            assertFalse(normalizer.findTerms("admiration").contains("myocardial infarction"));
        }
    }

    @Nested
    @DisplayName("Dictionary lifecycle Tests")
    class LifecycleTests {

        @Test
        @DisplayName("Should fail with NoCanonicalFormException when no dictionary is loaded")
        void shouldFailWithoutDictionary() {
            // Arrange
            properties.getTerms().setDictionary("classpath:terms/does-not-exist.json");
            TermNormalizer empty = new TermNormalizer(new DefaultResourceLoader(), new ObjectMapper(), properties);

            // Act & Assert
            assertThrows(CorpusReloadException.class, empty::reload);
            assertThrows(NoCanonicalFormException.class, () -> empty.normalize("htn"));
        }

        @Test
        @DisplayName("Should keep the previous dictionary when a reload fails")
        void shouldKeepPreviousDictionaryOnFailedReload() {
            // Arrange
            normalizer.install(Map.of("hypertension", List.of("htn")));
            properties.getTerms().setDictionary("classpath:terms/does-not-exist.json");

            // Act
            assertThrows(CorpusReloadException.class, normalizer::reload);

            // Assert
            assertEquals("hypertension", normalizer.normalize("htn").canonical());
            assertFalse(normalizer.normalize("t2dm").mapped());
        }

        @Test
        @DisplayName("Should list aliases of a canonical term")
        void shouldListAliases() {
            assertTrue(normalizer.aliasesOf("stroke").contains("cva"));
            assertTrue(normalizer.isCanonical("stroke"));
            assertFalse(normalizer.isCanonical("cva"));
        }
    }
}
