package com.medassist.guideline;

import com.medassist.exception.CorpusReloadException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Periodic corpus refresh so that rule table edits reach the matcher without a restart.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class CorpusRefreshJob {

    private final GuidelineCorpus corpus;

    @Scheduled(fixedDelayString = "${medassist.guidelines.refresh-interval:PT2M}",
               initialDelayString = "${medassist.guidelines.refresh-interval:PT2M}")
    public void refresh() {
        try {
            CorpusSnapshot snapshot = corpus.reload();
            log.debug("Scheduled corpus refresh done, version {}", snapshot.version());
        } catch (CorpusReloadException e) {
            log.warn("Scheduled corpus refresh skipped: {}", e.getMessage());
        }
    }
}
