package com.medassist.guideline;

import com.medassist.exception.CorpusReloadException;
import com.medassist.model.GuidelineRule;
import com.medassist.service.AuditService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Guideline Corpus
 *
 * Holds the current {@link CorpusSnapshot}. Readers take {@link #snapshot()} once per
 * pass; {@link #reload()} builds a complete new snapshot before swapping it in, and is
 * serialised. A failed reload leaves the previous snapshot in place.
 */
@Service
@Slf4j
public class GuidelineCorpus {

    private final GuidelineRuleSource ruleSource;
    private final GuidelineConditionParser parser;
    private final AuditService auditService;
    private final Clock clock;

    private final AtomicReference<CorpusSnapshot> current = new AtomicReference<>(CorpusSnapshot.EMPTY);

    public GuidelineCorpus(GuidelineRuleSource ruleSource, GuidelineConditionParser parser,
                           AuditService auditService, Clock clock) {
        this.ruleSource = ruleSource;
        this.parser = parser;
        this.auditService = auditService;
        this.clock = clock;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void loadOnStartup() {
        try {
            reload();
        } catch (CorpusReloadException e) {
            log.warn("Starting with an empty guideline corpus: {}", e.getMessage());
        }
    }

    public CorpusSnapshot snapshot() {
        return current.get();
    }

    public synchronized CorpusSnapshot reload() {
        long started = System.currentTimeMillis();
        CorpusSnapshot previous = current.get();
        try {
            List<GuidelineRule> rules = ruleSource.fetchActiveGuidelineRules(null, null);
            List<ParsedGuidelineRule> parsed = rules.stream()
                .filter(GuidelineRule::active)
                .map(parser::parse)
                .toList();

            CorpusSnapshot next = new CorpusSnapshot(previous.version() + 1, LocalDate.now(clock), Instant.now(clock), parsed);
            current.set(next);

            long elapsed = System.currentTimeMillis() - started;
            log.info("Guideline corpus version {} loaded: {} rules in {}ms", next.version(), next.size(), elapsed);
            auditService.logCorpusReload(next.version(), next.size(), elapsed);
            return next;

        } catch (RuntimeException e) {
            log.error("Guideline corpus reload failed, keeping version {}: {}", previous.version(), e.getMessage());
            auditService.logCorpusReloadFailure(previous.version(), e.getMessage());
            throw new CorpusReloadException("Guideline corpus reload failed", e);
        }
    }
}
