package com.bbthechange.appwatch.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable view of the persisted app id to version mapping, taken once at the start of a cycle.
 */
public final class VersionSnapshot {

    private static final VersionSnapshot EMPTY = new VersionSnapshot(Map.of());

    private final Map<String, String> versions;

    private VersionSnapshot(Map<String, String> versions) {
        this.versions = Collections.unmodifiableMap(new LinkedHashMap<>(versions));
    }

    public static VersionSnapshot of(Map<String, String> versions) {
        return versions.isEmpty() ? EMPTY : new VersionSnapshot(versions);
    }

    public static VersionSnapshot empty() {
        return EMPTY;
    }

    public Optional<String> get(String appId) {
        return Optional.ofNullable(versions.get(appId));
    }

    public Map<String, String> asMap() {
        return versions;
    }

    public int size() {
        return versions.size();
    }

    /**
     * Returns a new mapping with the staged delta applied on top of this snapshot.
     */
    public Map<String, String> mergedWith(Map<String, String> delta) {
        Map<String, String> merged = new LinkedHashMap<>(versions);
        merged.putAll(delta);
        return merged;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof VersionSnapshot)) return false;
        return versions.equals(((VersionSnapshot) o).versions);
    }

    @Override
    public int hashCode() {
        return versions.hashCode();
    }

    @Override
    public String toString() {
        return "VersionSnapshot" + versions;
    }
}
