package com.bbthechange.appwatch.service.impl;

import com.bbthechange.appwatch.client.CatalogClient;
import com.bbthechange.appwatch.client.NotificationChannel;
import com.bbthechange.appwatch.config.MonitorProperties;
import com.bbthechange.appwatch.dto.CycleReport;
import com.bbthechange.appwatch.dto.CycleState;
import com.bbthechange.appwatch.dto.FailureReason;
import com.bbthechange.appwatch.dto.NotificationPayload;
import com.bbthechange.appwatch.exception.DeliveryException;
import com.bbthechange.appwatch.exception.StoreException;
import com.bbthechange.appwatch.model.ChangeKind;
import com.bbthechange.appwatch.model.ChangeRecord;
import com.bbthechange.appwatch.model.FetchOutcome;
import com.bbthechange.appwatch.model.VersionSnapshot;
import com.bbthechange.appwatch.repository.VersionStore;
import com.bbthechange.appwatch.service.DiffEngine;
import com.bbthechange.appwatch.service.DiffResult;
import com.bbthechange.appwatch.service.NotificationFormatter;
import com.bbthechange.appwatch.service.ReleaseCheckService;
import com.bbthechange.appwatch.service.TrackedAppsProvider;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Implementation of ReleaseCheckService.
 * Fetches every tracked app, diffs against the version store, sends one consolidated
 * notification and commits the new versions once the notification went out.
 */
@Service
public class ReleaseCheckServiceImpl implements ReleaseCheckService {

    private static final Logger logger = LoggerFactory.getLogger(ReleaseCheckServiceImpl.class);

    private final TrackedAppsProvider trackedAppsProvider;
    private final CatalogClient catalogClient;
    private final VersionStore versionStore;
    private final DiffEngine diffEngine;
    private final NotificationFormatter formatter;
    private final NotificationChannel notificationChannel;
    private final ExecutorService fetchExecutor;
    private final MeterRegistry meterRegistry;
    private final Duration cycleTimeout;

    private final ReentrantLock cycleLock = new ReentrantLock();

    // Gauge value for tracked apps count
    private final AtomicInteger trackedAppsGaugeValue = new AtomicInteger(0);

    @Autowired
    public ReleaseCheckServiceImpl(
            TrackedAppsProvider trackedAppsProvider,
            CatalogClient catalogClient,
            VersionStore versionStore,
            DiffEngine diffEngine,
            NotificationFormatter formatter,
            NotificationChannel notificationChannel,
            @Qualifier("catalogFetchExecutor") ExecutorService fetchExecutor,
            MeterRegistry meterRegistry,
            MonitorProperties properties) {
        this(trackedAppsProvider, catalogClient, versionStore, diffEngine, formatter, notificationChannel,
                fetchExecutor, meterRegistry, properties.getCycleTimeout());
    }

    /**
     * Package-private constructor for testing.
     */
    ReleaseCheckServiceImpl(
            TrackedAppsProvider trackedAppsProvider,
            CatalogClient catalogClient,
            VersionStore versionStore,
            DiffEngine diffEngine,
            NotificationFormatter formatter,
            NotificationChannel notificationChannel,
            ExecutorService fetchExecutor,
            MeterRegistry meterRegistry,
            Duration cycleTimeout) {
        this.trackedAppsProvider = trackedAppsProvider;
        this.catalogClient = catalogClient;
        this.versionStore = versionStore;
        this.diffEngine = diffEngine;
        this.formatter = formatter;
        this.notificationChannel = notificationChannel;
        this.fetchExecutor = fetchExecutor;
        this.meterRegistry = meterRegistry;
        this.cycleTimeout = cycleTimeout;

        meterRegistry.gauge("appwatch_tracked_apps", trackedAppsGaugeValue);
    }

    @Override
    public CycleReport runCycle() {
        if (!cycleLock.tryLock()) {
            logger.warn("Release check already in progress, dropping trigger");
            meterRegistry.counter("appwatch_cycle_total", "status", "skipped").increment();
            return CycleReport.skipped();
        }

        try {
            return doRunCycle();
        } finally {
            cycleLock.unlock();
        }
    }

    private CycleReport doRunCycle() {
        CycleContext ctx = new CycleContext(Timer.start(meterRegistry), System.currentTimeMillis());

        try {
            List<String> trackedIds = trackedAppsProvider.getTrackedAppIds();
            ctx.trackedApps = trackedIds.size();
            trackedAppsGaugeValue.set(trackedIds.size());
            logger.info("Starting competitor check for {} apps...", trackedIds.size());

            VersionSnapshot snapshot;
            try {
                snapshot = versionStore.load();
            } catch (StoreException e) {
                logger.error("Could not load stored versions, aborting cycle", e);
                return finishFailed(ctx, FailureReason.STORE_LOAD, e.getMessage());
            }

            // 1. FETCHING
            Map<String, FetchOutcome> outcomes = fetchAll(trackedIds);
            for (String appId : trackedIds) {
                FetchOutcome outcome = outcomes.get(appId);
                if (!outcome.isSuccess()) {
                    ctx.fetchFailures.put(appId, outcome.getFailureReason());
                }
            }
            if (!ctx.fetchFailures.isEmpty()) {
                logger.warn("{} of {} fetches failed: {}", ctx.fetchFailures.size(), trackedIds.size(),
                        ctx.fetchFailures.keySet());
                meterRegistry.counter("appwatch_fetch_failures").increment(ctx.fetchFailures.size());
            }

            if (Thread.currentThread().isInterrupted()) {
                return finishCancelled(ctx);
            }

            // 2. DIFFING
            DiffResult diff = diffEngine.detectChanges(trackedIds, outcomes, snapshot);
            ctx.changes = diff.getChanges();
            recordChangeMetrics(diff.getChanges());

            // 3. FORMATTING
            Optional<NotificationPayload> payload = formatter.format(diff.getChanges());

            // 4. DELIVERING
            if (payload.isPresent()) {
                try {
                    notificationChannel.deliver(payload.get());
                    ctx.delivered = true;
                    meterRegistry.counter("appwatch_delivery_total", "status", "success").increment();
                    logger.info("Consolidated notification sent for {} app updates", diff.getChanges().size());
                } catch (DeliveryException e) {
                    meterRegistry.counter("appwatch_delivery_total", "status", "error").increment();
                    logger.error("Error sending consolidated notification, versions not committed: {}",
                            e.getMessage(), e);
                    return finishFailed(ctx, FailureReason.DELIVERY, e.getMessage());
                }
            } else {
                logger.info("No updates found for any competitors");
            }

            // 5. COMMITTING
            if (Thread.currentThread().isInterrupted()) {
                return finishCancelled(ctx);
            }
            if (!diff.getDelta().isEmpty()) {
                try {
                    versionStore.commit(snapshot.mergedWith(diff.getDelta()));
                    ctx.committed = true;
                } catch (StoreException e) {
                    logger.error("Notification sent but versions could not be committed", e);
                    return finishFailed(ctx, FailureReason.STORE_COMMIT, e.getMessage());
                }
            }

            CycleState state = ctx.fetchFailures.isEmpty() ? CycleState.CYCLE_COMPLETE : CycleState.CYCLE_DEGRADED;
            return finish(ctx, state, null, null);

        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return finishCancelled(ctx);
        } catch (RuntimeException e) {
            logger.error("Release check failed unexpectedly", e);
            return finishFailed(ctx, FailureReason.UNEXPECTED,
                    e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
        }
    }

    /**
     * Fetch all apps on the worker pool. Apps still outstanding when the cycle timeout
     * elapses are cancelled and recorded as failures.
     */
    private Map<String, FetchOutcome> fetchAll(List<String> trackedIds) throws InterruptedException {
        List<Callable<FetchOutcome>> tasks = new ArrayList<>(trackedIds.size());
        for (String appId : trackedIds) {
            tasks.add(() -> fetchOne(appId));
        }

        List<Future<FetchOutcome>> futures;
        if (cycleTimeout != null && !cycleTimeout.isZero() && !cycleTimeout.isNegative()) {
            futures = fetchExecutor.invokeAll(tasks, cycleTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } else {
            futures = fetchExecutor.invokeAll(tasks);
        }

        Map<String, FetchOutcome> outcomes = new LinkedHashMap<>();
        for (int i = 0; i < trackedIds.size(); i++) {
            String appId = trackedIds.get(i);
            Future<FetchOutcome> future = futures.get(i);
            if (future.isCancelled()) {
                outcomes.put(appId, FetchOutcome.error(appId, "Timed out after " + cycleTimeout.toMillis() + "ms"));
                continue;
            }
            try {
                outcomes.put(appId, future.get());
            } catch (ExecutionException e) {
                outcomes.put(appId, FetchOutcome.error(appId, String.valueOf(e.getCause())));
            }
        }
        return outcomes;
    }

    private FetchOutcome fetchOne(String appId) {
        try {
            FetchOutcome outcome = catalogClient.fetch(appId);
            return outcome != null ? outcome : FetchOutcome.error(appId, "No result from catalog client");
        } catch (RuntimeException e) {
            logger.error("Catalog client failed for {}", appId, e);
            return FetchOutcome.error(appId, e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
        }
    }

    private void recordChangeMetrics(List<ChangeRecord> changes) {
        for (ChangeKind kind : ChangeKind.values()) {
            long count = changes.stream().filter(c -> c.getKind() == kind).count();
            if (count > 0) {
                meterRegistry.counter("appwatch_changes_detected", "kind", kind.name()).increment(count);
            }
        }
    }

    private CycleReport finishCancelled(CycleContext ctx) {
        logger.warn("Release check cancelled before commit; stored versions unchanged");
        return finish(ctx, CycleState.CYCLE_FAILED, FailureReason.CANCELLED, "Cycle cancelled");
    }

    private CycleReport finishFailed(CycleContext ctx, FailureReason reason, String message) {
        return finish(ctx, CycleState.CYCLE_FAILED, reason, message);
    }

    private CycleReport finish(CycleContext ctx, CycleState state, FailureReason reason, String message) {
        long durationMs = System.currentTimeMillis() - ctx.startTime;
        String status = state.name().toLowerCase(Locale.ROOT).replace("cycle_", "");
        ctx.timer.stop(meterRegistry.timer("appwatch_cycle_duration", "status", status));
        meterRegistry.counter("appwatch_cycle_total", "status", status).increment();

        CycleReport report = CycleReport.builder()
                .state(state)
                .trackedApps(ctx.trackedApps)
                .changes(List.copyOf(ctx.changes))
                .fetchFailures(Collections.unmodifiableMap(new LinkedHashMap<>(ctx.fetchFailures)))
                .delivered(ctx.delivered)
                .committed(ctx.committed)
                .failureReason(reason)
                .failureMessage(message)
                .durationMs(durationMs)
                .build();

        logger.info("Release check finished: {}", report);
        return report;
    }

    /**
     * Mutable bookkeeping for the cycle in progress.
     */
    private static final class CycleContext {
        private final Timer.Sample timer;
        private final long startTime;
        private int trackedApps;
        private List<ChangeRecord> changes = List.of();
        private final Map<String, String> fetchFailures = new LinkedHashMap<>();
        private boolean delivered;
        private boolean committed;

        private CycleContext(Timer.Sample timer, long startTime) {
            this.timer = timer;
            this.startTime = startTime;
        }
    }
}
