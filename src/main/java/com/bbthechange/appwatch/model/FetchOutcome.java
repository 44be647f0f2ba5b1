package com.bbthechange.appwatch.model;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.util.Objects;

/**
 * Result of fetching one app from the catalog: either its metadata or the reason it is unavailable.
 */
@Getter
@EqualsAndHashCode
@ToString
public class FetchOutcome {

    public enum Status {
        SUCCESS,
        NOT_FOUND,
        ERROR
    }

    private final String appId;
    private final Status status;
    private final AppMetadata metadata;
    private final String failureReason;

    private FetchOutcome(String appId, Status status, AppMetadata metadata, String failureReason) {
        this.appId = Objects.requireNonNull(appId, "appId");
        this.status = status;
        this.metadata = metadata;
        this.failureReason = failureReason;
    }

    public static FetchOutcome success(AppMetadata metadata) {
        return new FetchOutcome(metadata.getAppId(), Status.SUCCESS, metadata, null);
    }

    public static FetchOutcome notFound(String appId) {
        return new FetchOutcome(appId, Status.NOT_FOUND, null, "No app found with ID: " + appId);
    }

    public static FetchOutcome error(String appId, String reason) {
        return new FetchOutcome(appId, Status.ERROR, null, reason);
    }

    public boolean isSuccess() {
        return status == Status.SUCCESS;
    }
}
