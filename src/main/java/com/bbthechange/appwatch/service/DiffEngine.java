package com.bbthechange.appwatch.service;

import com.bbthechange.appwatch.model.AppMetadata;
import com.bbthechange.appwatch.model.ChangeRecord;
import com.bbthechange.appwatch.model.FetchOutcome;
import com.bbthechange.appwatch.model.VersionSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Compares freshly fetched metadata with the stored versions and classifies every change.
 * Performs no I/O; the caller decides whether and when the returned delta is committed.
 */
@Component
public class DiffEngine {

    private static final Logger logger = LoggerFactory.getLogger(DiffEngine.class);

    /**
     * Detect version changes for one cycle.
     *
     * Changes are emitted in {@code trackedIds} order regardless of the order fetches completed in.
     * Apps whose fetch failed (or that have no outcome at all) are skipped and nothing is staged for them.
     * Versions are compared by exact string equality; any difference, including an apparent
     * rollback, counts as a release.
     *
     * @param trackedIds   configured app ids, in notification order
     * @param fetchResults outcome per app id
     * @param snapshot     versions stored before this cycle
     * @return ordered changes plus the delta of changed ids to commit
     */
    public DiffResult detectChanges(List<String> trackedIds, Map<String, FetchOutcome> fetchResults,
                                    VersionSnapshot snapshot) {
        List<ChangeRecord> changes = new ArrayList<>();
        Map<String, String> delta = new LinkedHashMap<>();
        Set<String> seen = new HashSet<>();

        for (String appId : trackedIds) {
            if (!seen.add(appId)) {
                continue;
            }

            FetchOutcome outcome = fetchResults.get(appId);
            if (outcome == null || !outcome.isSuccess()) {
                continue;
            }

            AppMetadata current = outcome.getMetadata();
            Optional<String> stored = snapshot.get(appId);

            if (stored.isEmpty()) {
                changes.add(ChangeRecord.firstObservation(current));
                delta.put(appId, current.getVersion());
                logger.info("First observation of {}: v{}", current.getName(), current.getVersion());
            } else if (!stored.get().equals(current.getVersion())) {
                changes.add(ChangeRecord.newRelease(current, stored.get()));
                delta.put(appId, current.getVersion());
                logger.info("Update found for {}: {} → {}", current.getName(), stored.get(), current.getVersion());
            } else {
                logger.info("No update for {} (still v{})", current.getName(), current.getVersion());
            }
        }

        return new DiffResult(changes, delta);
    }
}
