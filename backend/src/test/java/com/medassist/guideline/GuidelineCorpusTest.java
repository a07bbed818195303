package com.medassist.guideline;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.contains;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import com.medassist.TestFixtures;
import com.medassist.exception.CorpusReloadException;
import com.medassist.exception.SourceUnavailableException;
import com.medassist.model.Disease;
import com.medassist.model.EvidenceLevel;
import com.medassist.model.GuidelineRule;
import com.medassist.service.AuditService;

/**
 * Unit tests for GuidelineCorpus and its scheduled refresh.
 */
@ExtendWith(MockitoExtension.class)
@DisplayName("GuidelineCorpus Tests")
class GuidelineCorpusTest {

    @Mock
    private GuidelineRuleSource ruleSource;

    @Mock
    private AuditService auditService;

    private GuidelineCorpus corpus;

    @BeforeEach
    void setUp() {
        corpus = new GuidelineCorpus(ruleSource, new GuidelineConditionParser(TestFixtures.termNormalizer()),
                auditService, TestFixtures.CLOCK);
    }

    @Nested
    @DisplayName("reload() Tests")
    class ReloadTests {

        @Test
        @DisplayName("Should start empty at version 0")
        void shouldStartEmpty() {
            assertEquals(0L, corpus.snapshot().version());
            assertEquals(0, corpus.snapshot().size());
        }

        @Test
        @DisplayName("Should load active rules into a new version and audit the reload")
        void shouldLoadActiveRules() {
            // Arrange
            List<GuidelineRule> rules = new ArrayList<>(TestFixtures.seedRules());
            rules.add(new GuidelineRule(9, "Withdrawn", Disease.HYPERTENSION, "SBP >= 140", EvidenceLevel.IIB,
                    "Start a beta blocker", null, LocalDate.of(2010, 1, 1), false));
            when(ruleSource.fetchActiveGuidelineRules(null, null)).thenReturn(rules);

            // Act
            CorpusSnapshot snapshot = corpus.reload();

            // Assert
            assertEquals(1L, snapshot.version());
            assertEquals(7, snapshot.size());
            assertEquals(TestFixtures.TODAY, snapshot.asOf());
            assertEquals(TestFixtures.NOW, snapshot.loadedAt());
            assertSame(snapshot, corpus.snapshot());
            verify(auditService).logCorpusReload(eq(1L), eq(7), anyLong());
        }

        @Test
        @DisplayName("Each reload should bump the version")
        void eachReloadShouldBumpVersion() {
            when(ruleSource.fetchActiveGuidelineRules(null, null)).thenReturn(TestFixtures.seedRules());

            corpus.reload();
            CorpusSnapshot second = corpus.reload();

            assertEquals(2L, second.version());
        }

        @Test
        @DisplayName("A failed reload should keep the previous snapshot")
        void failedReloadShouldKeepPreviousSnapshot() {
            // Arrange
            when(ruleSource.fetchActiveGuidelineRules(null, null))
                    .thenReturn(TestFixtures.seedRules())
                    .thenThrow(new SourceUnavailableException("guideline_recommendations", "connection refused"));
            CorpusSnapshot loaded = corpus.reload();

            // Act & Assert
            assertThrows(CorpusReloadException.class, () -> corpus.reload());
            assertSame(loaded, corpus.snapshot());
            verify(auditService).logCorpusReloadFailure(eq(1L), contains("connection refused"));
        }

        @Test
        @DisplayName("A snapshot held by a reader should not change when the corpus reloads")
        void heldSnapshotShouldNotChange() {
            when(ruleSource.fetchActiveGuidelineRules(null, null))
                    .thenReturn(TestFixtures.seedRules())
                    .thenReturn(List.of());
            CorpusSnapshot held = corpus.reload();

            corpus.reload();

            assertEquals(7, held.size());
            assertEquals(0, corpus.snapshot().size());
        }
    }

    @Nested
    @DisplayName("Startup and Refresh Tests")
    class RefreshTests {

        @Test
        @DisplayName("Startup load should fall back to the empty corpus on failure")
        void startupShouldTolerateFailure() {
            when(ruleSource.fetchActiveGuidelineRules(null, null))
                    .thenThrow(new SourceUnavailableException("guideline_recommendations", "timeout"));

            assertDoesNotThrow(() -> corpus.loadOnStartup());
            assertEquals(0L, corpus.snapshot().version());
        }

        @Test
        @DisplayName("Scheduled refresh should reload and skip failures")
        void refreshShouldReloadAndSkipFailures() {
            // Arrange
            CorpusRefreshJob job = new CorpusRefreshJob(corpus);
            when(ruleSource.fetchActiveGuidelineRules(null, null))
                    .thenReturn(TestFixtures.seedRules())
                    .thenThrow(new SourceUnavailableException("guideline_recommendations", "timeout"));

            // Act
            job.refresh();
            assertDoesNotThrow(job::refresh);

            // Assert
            assertEquals(1L, corpus.snapshot().version());
            verify(ruleSource, times(2)).fetchActiveGuidelineRules(null, null);
        }
    }
}
