package com.bbthechange.appwatch.service;

import com.bbthechange.appwatch.dto.CycleReport;

/**
 * Runs release-check cycles against the catalog.
 */
public interface ReleaseCheckService {

    /**
     * Run one complete cycle.
     *
     * Process:
     * 1. Load the stored versions once
     * 2. Fetch every tracked app (in parallel, per-app failures tolerated)
     * 3. Diff fetched versions against the stored ones, in tracked order
     * 4. Format all changes into one notification and deliver it
     * 5. Commit the changed versions, only after a confirmed delivery
     *
     * Never throws. At most one cycle runs at a time; a call made while another
     * cycle is active returns a {@code CYCLE_SKIPPED} report immediately.
     *
     * @return CycleReport describing what was detected, delivered and committed
     */
    CycleReport runCycle();
}
