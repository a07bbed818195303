package com.medassist.service;

import com.medassist.config.ReasoningProperties;
import com.medassist.exception.ProfileNotFoundException;
import com.medassist.exception.SourceUnavailableException;
import com.medassist.model.EvidenceHit;
import com.medassist.model.RawPatientFacts;
import com.medassist.source.EvidenceCorpusClient;
import com.medassist.source.PatientFactSource;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;

/**
 * Source Fan-Out
 *
 * Fetches patient facts from every {@link PatientFactSource}, and evidence hits when a
 * query is given, concurrently on the source executor. Each source gets a timeout and
 * one retry after a short backoff; a source that still fails is reported as degraded.
 * A "not found" answer is final and never retried.
 */
@Service
@Slf4j
public class SourceFanOut {

    private final List<PatientFactSource> patientSources;
    private final EvidenceCorpusClient evidenceClient;
    private final Executor executor;
    private final ReasoningProperties properties;
    private final AuditService auditService;

    public SourceFanOut(List<PatientFactSource> patientSources,
                        EvidenceCorpusClient evidenceClient,
                        @Qualifier("sourceFetchExecutor") Executor executor,
                        ReasoningProperties properties,
                        AuditService auditService) {
        this.patientSources = List.copyOf(patientSources);
        this.evidenceClient = evidenceClient;
        this.executor = executor;
        this.properties = properties;
        this.auditService = auditService;
    }

    /**
     * @param evidenceQuery null or blank skips the evidence corpus
     * @throws ProfileNotFoundException every patient source answered that it does not know the patient
     * @throws SourceUnavailableException no patient source answered
     * @throws CancellationException the calling thread was interrupted while waiting
     */
    public SourceFetchResult fetch(String patientId, String evidenceQuery, Map<String, Object> evidenceFilters) {
        List<CompletableFuture<Outcome<RawPatientFacts>>> factFutures = new ArrayList<>();
        for (PatientFactSource source : patientSources) {
            factFutures.add(withRetry(source.getName(), () -> source.fetchPatientFacts(patientId)));
        }
        CompletableFuture<Outcome<List<EvidenceHit>>> evidenceFuture = null;
        if (evidenceQuery != null && !evidenceQuery.isBlank() && evidenceClient.isEnabled()) {
            evidenceFuture = withRetry(EvidenceCorpusClient.NAME,
                () -> evidenceClient.fetchEvidenceCorpusHits(evidenceQuery, evidenceFilters));
        }

        List<CompletableFuture<?>> all = new ArrayList<>(factFutures);
        if (evidenceFuture != null) {
            all.add(evidenceFuture);
        }
        awaitAll(all);

        List<RawPatientFacts> facts = new ArrayList<>();
        List<String> degraded = new ArrayList<>();
        int notFound = 0;
        for (CompletableFuture<Outcome<RawPatientFacts>> future : factFutures) {
            Outcome<RawPatientFacts> outcome = future.join();
            if (outcome.error() == null && outcome.value() != null) {
                facts.add(outcome.value());
            } else if (outcome.error() instanceof ProfileNotFoundException) {
                notFound++;
            } else {
                degrade(patientId, outcome, degraded);
            }
        }

        List<EvidenceHit> evidence = List.of();
        if (evidenceFuture != null) {
            Outcome<List<EvidenceHit>> outcome = evidenceFuture.join();
            if (outcome.value() != null) {
                evidence = outcome.value();
            } else {
                degrade(patientId, outcome, degraded);
            }
        }

        if (facts.isEmpty()) {
            if (degraded.isEmpty() || notFound == patientSources.size()) {
                throw new ProfileNotFoundException(patientId);
            }
            throw new SourceUnavailableException(String.join(",", degraded),
                "no patient fact source answered for " + patientId);
        }

        log.debug("Fan-out for {}: {} fact sources answered, {} evidence hits, degraded {}",
            patientId, facts.size(), evidence.size(), degraded);
        return new SourceFetchResult(facts, evidence, degraded);
    }

    /**
     * First attempt, then one retry after the backoff unless the failure is final.
     * Never completes exceptionally; failures are carried in the {@link Outcome}.
     */
    private <T> CompletableFuture<Outcome<T>> withRetry(String name, Supplier<T> fetch) {
        long timeoutMs = properties.getSources().getTimeout().toMillis();
        long backoffMs = properties.getSources().getRetryBackoff().toMillis();

        return attempt(fetch, executor, timeoutMs)
            .handle((value, error) -> error == null
                ? CompletableFuture.completedFuture(Outcome.success(name, value))
                : retryUnlessFinal(name, fetch, unwrap(error), timeoutMs, backoffMs))
            .thenCompose(f -> f);
    }

    private <T> CompletableFuture<Outcome<T>> retryUnlessFinal(String name, Supplier<T> fetch, Throwable error,
                                                               long timeoutMs, long backoffMs) {
        if (error instanceof ProfileNotFoundException) {
            return CompletableFuture.completedFuture(Outcome.failure(name, error));
        }
        log.warn("Source {} failed ({}), retrying in {}ms", name, describe(error), backoffMs);
        Executor delayed = CompletableFuture.delayedExecutor(backoffMs, TimeUnit.MILLISECONDS, executor);
        return attempt(fetch, delayed, timeoutMs)
            .handle((value, retryError) -> retryError == null
                ? Outcome.success(name, value)
                : Outcome.failure(name, unwrap(retryError)));
    }

    private static <T> CompletableFuture<T> attempt(Supplier<T> fetch, Executor executor, long timeoutMs) {
        return CompletableFuture.supplyAsync(fetch, executor).orTimeout(timeoutMs, TimeUnit.MILLISECONDS);
    }

    private void awaitAll(List<CompletableFuture<?>> futures) {
        CompletableFuture<Void> barrier = CompletableFuture.allOf(futures.toArray(new CompletableFuture[0]));
        try {
            barrier.get();
        } catch (InterruptedException e) {
            futures.forEach(f -> f.cancel(true));
            Thread.currentThread().interrupt();
            log.warn("Source fan-out interrupted, {} fetches cancelled", futures.size());
            CancellationException cancelled = new CancellationException("Reasoning pass cancelled while fetching sources");
            cancelled.initCause(e);
            throw cancelled;
        } catch (ExecutionException e) {
            throw new IllegalStateException("Source fan-out failed unexpectedly", e.getCause());
        }
    }

    private void degrade(String patientId, Outcome<?> outcome, List<String> degraded) {
        String reason = describe(outcome.error());
        log.warn("Source {} degraded for patient {}: {}", outcome.sourceName(), patientId, reason);
        auditService.logSourceDegraded(patientId, outcome.sourceName(), reason);
        degraded.add(outcome.sourceName());
    }

    private static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while (current instanceof CompletionException && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    private static String describe(Throwable error) {
        if (error == null) {
            return "no data returned";
        }
        if (error instanceof TimeoutException) {
            return "timed out";
        }
        return error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName();
    }

    private record Outcome<T>(String sourceName, T value, Throwable error) {

        static <T> Outcome<T> success(String sourceName, T value) {
            return new Outcome<>(sourceName, value, null);
        }

        static <T> Outcome<T> failure(String sourceName, Throwable error) {
            return new Outcome<>(sourceName, null, error);
        }
    }
}
