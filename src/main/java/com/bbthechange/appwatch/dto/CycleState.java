package com.bbthechange.appwatch.dto;

/**
 * Terminal state of one release-check cycle.
 */
public enum CycleState {

    /**
     * Every tracked app was fetched; changes (if any) were delivered and committed.
     */
    CYCLE_COMPLETE,

    /**
     * Some fetches failed, but delivery and commit succeeded for the rest.
     */
    CYCLE_DEGRADED,

    /**
     * Delivery or the store failed, or the cycle was cancelled. The store is unchanged.
     */
    CYCLE_FAILED,

    /**
     * Another cycle was already running, so this trigger was dropped.
     */
    CYCLE_SKIPPED
}
