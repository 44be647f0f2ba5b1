package com.bbthechange.appwatch.model;

import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.time.Instant;
import java.util.Optional;

/**
 * Catalog metadata for one tracked app, as fetched in a single polling cycle.
 * The version token is opaque: it is only ever compared for equality.
 */
@Getter
@Builder(toBuilder = true)
@EqualsAndHashCode
@ToString(exclude = "releaseNotes")
public class AppMetadata {

    private final String appId;
    private final String name;
    private final String developer;
    private final String version;
    private final Instant lastUpdated;
    private final String url;
    private final String releaseNotes;

    public Optional<Instant> getLastUpdated() {
        return Optional.ofNullable(lastUpdated);
    }

    /**
     * @return true when release notes contain anything other than whitespace
     */
    public boolean hasReleaseNotes() {
        return releaseNotes != null && !releaseNotes.isBlank();
    }
}
