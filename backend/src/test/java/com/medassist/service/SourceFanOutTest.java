package com.medassist.service;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.IntFunction;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import com.medassist.config.ReasoningProperties;
import com.medassist.exception.ProfileNotFoundException;
import com.medassist.exception.SourceUnavailableException;
import com.medassist.model.EvidenceHit;
import com.medassist.model.EvidenceKind;
import com.medassist.model.EvidenceRef;
import com.medassist.model.RawPatientFacts;
import com.medassist.source.EvidenceCorpusClient;
import com.medassist.source.PatientFactSource;

/**
 * Unit tests for SourceFanOut on a real thread pool with short timeouts.
 */
@ExtendWith(MockitoExtension.class)
@DisplayName("SourceFanOut Tests")
class SourceFanOutTest {

    private static final String PATIENT_ID = "P0001";

    @Mock
    private EvidenceCorpusClient evidenceClient;

    @Mock
    private AuditService auditService;

    private ExecutorService executor;
    private ReasoningProperties properties;

    @BeforeEach
    void setUp() {
        executor = Executors.newFixedThreadPool(6);
        properties = new ReasoningProperties();
        properties.getSources().setTimeout(Duration.ofMillis(200));
        properties.getSources().setRetryBackoff(Duration.ofMillis(10));
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    private SourceFanOut fanOut(PatientFactSource... sources) {
        return new SourceFanOut(List.of(sources), evidenceClient, executor, properties, auditService);
    }

    private static RawPatientFacts facts(String sourceName) {
        return RawPatientFacts.builder().sourceName(sourceName).patientId(PATIENT_ID).age(58).build();
    }

    /**
     * Source whose answer depends on the attempt number, starting at 1.
     */
    private static final class ScriptedSource implements PatientFactSource {

        private final String name;
        private final IntFunction<RawPatientFacts> script;
        private final AtomicInteger attempts = new AtomicInteger();

        ScriptedSource(String name, IntFunction<RawPatientFacts> script) {
            this.name = name;
            this.script = script;
        }

        static ScriptedSource answering(String name) {
            return new ScriptedSource(name, attempt -> facts(name));
        }

        static ScriptedSource failing(String name) {
            return new ScriptedSource(name, attempt -> {
                throw new SourceUnavailableException(name, "connection refused");
            });
        }

        static ScriptedSource hanging(String name) {
            return new ScriptedSource(name, attempt -> {
                try {
                    Thread.sleep(5_000);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
                return facts(name);
            });
        }

        @Override
        public String getName() {
            return name;
        }

        @Override
        public RawPatientFacts fetchPatientFacts(String patientId) {
            return script.apply(attempts.incrementAndGet());
        }

        int attempts() {
            return attempts.get();
        }
    }

    @Nested
    @DisplayName("Patient Fact Tests")
    class PatientFactTests {

        @Test
        @DisplayName("Should collect facts from every source in source order")
        void shouldCollectFactsInOrder() {
            // Arrange
            SourceFanOut fanOut = fanOut(ScriptedSource.answering("fact-base"), ScriptedSource.answering("fhir"));

            // Act
            SourceFetchResult result = fanOut.fetch(PATIENT_ID, null, Map.of());

            // Assert
            assertEquals(List.of("fact-base", "fhir"),
                    result.facts().stream().map(RawPatientFacts::getSourceName).toList());
            assertFalse(result.isDegraded());
            assertTrue(result.evidence().isEmpty());
            verifyNoInteractions(evidenceClient, auditService);
        }

        @Test
        @DisplayName("Should retry a transient failure once")
        void shouldRetryTransientFailure() {
            ScriptedSource flaky = new ScriptedSource("fhir", attempt -> {
                if (attempt == 1) {
                    throw new SourceUnavailableException("fhir", "503");
                }
                return facts("fhir");
            });

            SourceFetchResult result = fanOut(flaky).fetch(PATIENT_ID, null, Map.of());

            assertEquals(2, flaky.attempts());
            assertEquals(1, result.facts().size());
            assertFalse(result.isDegraded());
        }

        @Test
        @DisplayName("Should mark a source degraded after the retry fails")
        void shouldDegradeAfterRetry() {
            ScriptedSource failing = ScriptedSource.failing("fhir");

            SourceFetchResult result = fanOut(ScriptedSource.answering("fact-base"), failing)
                    .fetch(PATIENT_ID, null, Map.of());

            assertEquals(2, failing.attempts());
            assertEquals(List.of("fhir"), result.degradedSources());
            assertEquals(1, result.facts().size());
            verify(auditService).logSourceDegraded(eq(PATIENT_ID), eq("fhir"), anyString());
        }

        @Test
        @DisplayName("Should mark a source that times out twice as degraded")
        void shouldDegradeOnTimeout() {
            SourceFetchResult result = fanOut(ScriptedSource.answering("fact-base"), ScriptedSource.hanging("fhir"))
                    .fetch(PATIENT_ID, null, Map.of());

            assertEquals(List.of("fhir"), result.degradedSources());
            verify(auditService).logSourceDegraded(PATIENT_ID, "fhir", "timed out");
        }

        @Test
        @DisplayName("A not-found answer should be final and never retried")
        void notFoundShouldNotBeRetried() {
            ScriptedSource unknown = new ScriptedSource("fact-base", attempt -> {
                throw new ProfileNotFoundException(PATIENT_ID);
            });

            SourceFanOut fanOut = fanOut(unknown);

            assertThrows(ProfileNotFoundException.class, () -> fanOut.fetch(PATIENT_ID, null, Map.of()));
            assertEquals(1, unknown.attempts());
            verifyNoInteractions(auditService);
        }

        @Test
        @DisplayName("A patient unknown to one source should still be assembled from the other")
        void unknownToOneSourceShouldNotDegrade() {
            ScriptedSource unknown = new ScriptedSource("fhir", attempt -> {
                throw new ProfileNotFoundException(PATIENT_ID);
            });

            SourceFetchResult result = fanOut(ScriptedSource.answering("fact-base"), unknown)
                    .fetch(PATIENT_ID, null, Map.of());

            assertEquals(1, result.facts().size());
            assertFalse(result.isDegraded());
        }

        @Test
        @DisplayName("Should raise SourceUnavailableException when no source answers")
        void shouldRaiseWhenNoSourceAnswers() {
            SourceFanOut fanOut = fanOut(ScriptedSource.failing("fact-base"), ScriptedSource.failing("fhir"));

            SourceUnavailableException e = assertThrows(SourceUnavailableException.class,
                    () -> fanOut.fetch(PATIENT_ID, null, Map.of()));

            assertEquals("fact-base,fhir", e.getSourceName());
        }
    }

    @Nested
    @DisplayName("Evidence Tests")
    class EvidenceTests {

        @Test
        @DisplayName("Should fetch evidence alongside the patient facts")
        void shouldFetchEvidence() {
            // Arrange
            EvidenceHit hit = new EvidenceHit("Start a CCB",
                    new EvidenceRef(EvidenceKind.CORPUS_DOCUMENT, "htn.pdf#3", null), 0.9);
            when(evidenceClient.isEnabled()).thenReturn(true);
            when(evidenceClient.fetchEvidenceCorpusHits(eq("hypertension"), anyMap())).thenReturn(List.of(hit));

            // Act
            SourceFetchResult result = fanOut(ScriptedSource.answering("fact-base"))
                    .fetch(PATIENT_ID, "hypertension", Map.of("disease", "hypertension"));

            // Assert
            assertEquals(List.of(hit), result.evidence());
            assertFalse(result.isDegraded());
        }

        @Test
        @DisplayName("A failing evidence corpus should degrade without losing the facts")
        void failingEvidenceShouldDegrade() {
            when(evidenceClient.isEnabled()).thenReturn(true);
            when(evidenceClient.fetchEvidenceCorpusHits(anyString(), any()))
                    .thenThrow(new SourceUnavailableException(EvidenceCorpusClient.NAME, "502"));

            SourceFetchResult result = fanOut(ScriptedSource.answering("fact-base"))
                    .fetch(PATIENT_ID, "hypertension", Map.of());

            assertEquals(1, result.facts().size());
            assertEquals(List.of(EvidenceCorpusClient.NAME), result.degradedSources());
            verify(evidenceClient, times(2)).fetchEvidenceCorpusHits(anyString(), any());
        }

        @Test
        @DisplayName("A disabled evidence corpus should be skipped")
        void disabledEvidenceShouldBeSkipped() {
            when(evidenceClient.isEnabled()).thenReturn(false);

            SourceFetchResult result = fanOut(ScriptedSource.answering("fact-base"))
                    .fetch(PATIENT_ID, "hypertension", Map.of());

            assertTrue(result.evidence().isEmpty());
            verify(evidenceClient, never()).fetchEvidenceCorpusHits(anyString(), any());
        }
    }

    @Test
    @DisplayName("An interrupted caller should get a CancellationException")
    void interruptedCallerShouldBeCancelled() {
        SourceFanOut fanOut = fanOut(ScriptedSource.hanging("fhir"));

        Thread.currentThread().interrupt();
        try {
            assertThrows(CancellationException.class, () -> fanOut.fetch(PATIENT_ID, null, Map.of()));
            assertTrue(Thread.currentThread().isInterrupted());
        } finally {
            Thread.interrupted();
        }
    }
}
