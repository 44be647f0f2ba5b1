package com.bbthechange.appwatch.dto;

import com.bbthechange.appwatch.model.ChangeRecord;
import lombok.Builder;
import lombok.Getter;

import java.util.List;
import java.util.Map;

/**
 * Result object for a release-check cycle.
 * Contains the detected changes, per-app fetch failures and what happened to delivery and commit.
 */
@Getter
@Builder
public class CycleReport {

    private final CycleState state;
    private final int trackedApps;
    @Builder.Default
    private final List<ChangeRecord> changes = List.of();
    @Builder.Default
    private final Map<String, String> fetchFailures = Map.of();
    private final boolean delivered;
    private final boolean committed;
    private final FailureReason failureReason;
    private final String failureMessage;
    private final long durationMs;

    /**
     * Create a CycleReport for a trigger dropped because another cycle was active.
     */
    public static CycleReport skipped() {
        return CycleReport.builder()
                .state(CycleState.CYCLE_SKIPPED)
                .build();
    }

    public boolean isFailed() {
        return state == CycleState.CYCLE_FAILED;
    }

    @Override
    public String toString() {
        return "CycleReport{" +
                "state=" + state +
                ", trackedApps=" + trackedApps +
                ", changes=" + changes.size() +
                ", fetchFailures=" + fetchFailures.keySet() +
                ", delivered=" + delivered +
                ", committed=" + committed +
                ", failureReason=" + failureReason +
                ", durationMs=" + durationMs +
                '}';
    }
}
