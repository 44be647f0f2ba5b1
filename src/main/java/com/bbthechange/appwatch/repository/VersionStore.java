package com.bbthechange.appwatch.repository;

import com.bbthechange.appwatch.exception.StoreException;
import com.bbthechange.appwatch.model.VersionSnapshot;

import java.util.Map;

/**
 * Durable mapping from app id to the last version that was notified.
 */
public interface VersionStore {

    /**
     * Read the full persisted mapping.
     * Returns an empty snapshot only when nothing has ever been committed.
     *
     * @throws StoreException if persisted state exists but cannot be read
     */
    VersionSnapshot load();

    /**
     * Atomically replace the persisted mapping. A subsequent {@link #load()} sees either the old
     * or the new mapping, never a mix.
     *
     * @throws StoreException if the mapping could not be written
     */
    void commit(Map<String, String> versions);
}
