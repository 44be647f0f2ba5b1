package com.bbthechange.appwatch.service;

import com.bbthechange.appwatch.model.ChangeRecord;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Output of {@link DiffEngine}: the ordered changes of a cycle and the version delta to commit.
 */
public class DiffResult {

    private final List<ChangeRecord> changes;
    private final Map<String, String> delta;

    public DiffResult(List<ChangeRecord> changes, Map<String, String> delta) {
        this.changes = List.copyOf(changes);
        this.delta = Collections.unmodifiableMap(new LinkedHashMap<>(delta));
    }

    public List<ChangeRecord> getChanges() {
        return changes;
    }

    /**
     * Only the ids whose version changed this cycle, in tracked order.
     */
    public Map<String, String> getDelta() {
        return delta;
    }

    public boolean hasChanges() {
        return !changes.isEmpty();
    }
}
