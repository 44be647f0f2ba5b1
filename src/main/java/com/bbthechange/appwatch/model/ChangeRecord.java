package com.bbthechange.appwatch.model;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.util.Objects;
import java.util.Optional;

/**
 * A version change detected for one app in one cycle.
 */
@Getter
@EqualsAndHashCode
@ToString
public class ChangeRecord {

    private final AppMetadata metadata;
    private final ChangeKind kind;
    private final String previousVersion;

    private ChangeRecord(AppMetadata metadata, ChangeKind kind, String previousVersion) {
        this.metadata = Objects.requireNonNull(metadata, "metadata");
        this.kind = kind;
        this.previousVersion = previousVersion;
    }

    public static ChangeRecord firstObservation(AppMetadata metadata) {
        return new ChangeRecord(metadata, ChangeKind.FIRST_OBSERVATION, null);
    }

    public static ChangeRecord newRelease(AppMetadata metadata, String previousVersion) {
        return new ChangeRecord(metadata, ChangeKind.NEW_RELEASE,
                Objects.requireNonNull(previousVersion, "previousVersion"));
    }

    public String getAppId() {
        return metadata.getAppId();
    }

    public String getVersion() {
        return metadata.getVersion();
    }

    public Optional<String> getPreviousVersion() {
        return Optional.ofNullable(previousVersion);
    }

    public boolean isFirstObservation() {
        return kind == ChangeKind.FIRST_OBSERVATION;
    }
}
