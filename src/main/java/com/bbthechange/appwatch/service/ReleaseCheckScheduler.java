package com.bbthechange.appwatch.service;

import com.bbthechange.appwatch.dto.CycleReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Fires the release check once at startup and then every monitor.poll-interval after the
 * previous run finished. Fixed-delay scheduling on the single scheduler thread keeps runs
 * from overlapping; manual triggers are guarded by the service itself.
 */
@Component
@ConditionalOnProperty(name = "monitor.scheduler.enabled", havingValue = "true", matchIfMissing = true)
public class ReleaseCheckScheduler {

    private static final Logger logger = LoggerFactory.getLogger(ReleaseCheckScheduler.class);

    private final ReleaseCheckService releaseCheckService;

    public ReleaseCheckScheduler(ReleaseCheckService releaseCheckService) {
        this.releaseCheckService = releaseCheckService;
    }

    @Scheduled(initialDelayString = "${monitor.initial-delay:PT0S}",
            fixedDelayString = "${monitor.poll-interval:PT60M}")
    public void checkForUpdates() {
        CycleReport report = releaseCheckService.runCycle();
        if (report.isFailed()) {
            logger.warn("Scheduled release check failed ({}), changes will be retried next cycle",
                    report.getFailureReason());
        }
    }
}
