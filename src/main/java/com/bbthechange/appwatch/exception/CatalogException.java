package com.bbthechange.appwatch.exception;

/**
 * Exception thrown when a catalog lookup fails.
 * The catalog client converts it into a per-app fetch failure, so it never aborts a cycle.
 */
public class CatalogException extends RuntimeException {

    private final ErrorType errorType;
    private final String appId;

    public enum ErrorType {
        /**
         * The catalog has no app with the requested id.
         */
        APP_NOT_FOUND,

        /**
         * The catalog could not be reached or answered with a non-success status.
         */
        SERVICE_UNAVAILABLE,

        /**
         * The catalog answered but the body could not be mapped to app metadata.
         */
        MALFORMED_RESPONSE
    }

    public CatalogException(ErrorType errorType, String appId, String message) {
        super(message);
        this.errorType = errorType;
        this.appId = appId;
    }

    public CatalogException(ErrorType errorType, String appId, String message, Throwable cause) {
        super(message, cause);
        this.errorType = errorType;
        this.appId = appId;
    }

    public ErrorType getErrorType() {
        return errorType;
    }

    public String getAppId() {
        return appId;
    }

    public static CatalogException appNotFound(String appId) {
        return new CatalogException(ErrorType.APP_NOT_FOUND, appId, "No app found with ID: " + appId);
    }

    public static CatalogException serviceUnavailable(String appId, String message, Throwable cause) {
        return new CatalogException(ErrorType.SERVICE_UNAVAILABLE, appId, message, cause);
    }

    public static CatalogException serviceUnavailable(String appId, int statusCode) {
        return new CatalogException(ErrorType.SERVICE_UNAVAILABLE, appId,
                "Catalog returned status " + statusCode + " for app " + appId);
    }

    public static CatalogException malformedResponse(String appId, String detail) {
        return new CatalogException(ErrorType.MALFORMED_RESPONSE, appId,
                "Malformed catalog response for app " + appId + ": " + detail);
    }

    public static CatalogException malformedResponse(String appId, Throwable cause) {
        return new CatalogException(ErrorType.MALFORMED_RESPONSE, appId,
                "Malformed catalog response for app " + appId, cause);
    }
}
