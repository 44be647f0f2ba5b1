package com.bbthechange.appwatch.client;

import com.bbthechange.appwatch.model.FetchOutcome;

/**
 * Source of app metadata keyed by app id.
 */
public interface CatalogClient {

    /**
     * Fetch the current metadata for one app.
     * Implementations report every per-app problem as a non-success outcome and never throw for it.
     *
     * @param appId catalog app id
     * @return the metadata, or a not-found / error outcome
     */
    FetchOutcome fetch(String appId);
}
