package com.bbthechange.appwatch.model;

/**
 * Classification of a detected version change.
 */
public enum ChangeKind {

    /**
     * No version was stored for the app before this cycle.
     */
    FIRST_OBSERVATION,

    /**
     * A version was stored and the catalog now reports a different one.
     */
    NEW_RELEASE
}
