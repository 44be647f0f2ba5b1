package com.bbthechange.appwatch.controller;

import com.bbthechange.appwatch.dto.CycleReport;
import com.bbthechange.appwatch.model.ChangeRecord;
import com.bbthechange.appwatch.service.ReleaseCheckService;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Internal controller for running a release check on demand.
 * Protected by InternalApiKeyFilter (X-Api-Key header).
 */
@RestController
@RequestMapping("/internal/release-check")
public class InternalReleaseCheckController {

    private static final Logger logger = LoggerFactory.getLogger(InternalReleaseCheckController.class);

    private final ReleaseCheckService releaseCheckService;
    private final MeterRegistry meterRegistry;

    public InternalReleaseCheckController(ReleaseCheckService releaseCheckService, MeterRegistry meterRegistry) {
        this.releaseCheckService = releaseCheckService;
        this.meterRegistry = meterRegistry;
    }

    /**
     * Run one release-check cycle and return its report.
     *
     * @return 200 OK for complete, degraded or skipped cycles; 500 when the cycle failed
     */
    @PostMapping("/trigger")
    public ResponseEntity<Map<String, Object>> trigger() {
        logger.info("Received manual release-check trigger");

        CycleReport report = releaseCheckService.runCycle();
        meterRegistry.counter("appwatch_manual_trigger_total", "state", report.getState().name()).increment();

        Map<String, Object> body = toBody(report);
        if (report.isFailed()) {
            return ResponseEntity.internalServerError().body(body);
        }
        return ResponseEntity.ok(body);
    }

    private Map<String, Object> toBody(CycleReport report) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("state", report.getState().name());
        body.put("trackedApps", report.getTrackedApps());
        body.put("changes", report.getChanges().stream().map(this::toChange).collect(Collectors.toList()));
        body.put("fetchFailures", report.getFetchFailures());
        body.put("delivered", report.isDelivered());
        body.put("committed", report.isCommitted());
        if (report.getFailureReason() != null) {
            body.put("failureReason", report.getFailureReason().name());
            body.put("error", report.getFailureMessage() != null ? report.getFailureMessage() : "Unknown error");
        }
        body.put("durationMs", report.getDurationMs());
        return body;
    }

    private Map<String, Object> toChange(ChangeRecord change) {
        Map<String, Object> item = new LinkedHashMap<>();
        item.put("appId", change.getAppId());
        item.put("name", change.getMetadata().getName());
        item.put("kind", change.getKind().name());
        item.put("version", change.getVersion());
        change.getPreviousVersion().ifPresent(previous -> item.put("previousVersion", previous));
        return item;
    }
}
