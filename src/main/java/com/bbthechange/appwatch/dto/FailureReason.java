package com.bbthechange.appwatch.dto;

public enum FailureReason {
    DELIVERY,
    STORE_LOAD,
    STORE_COMMIT,
    CANCELLED,
    UNEXPECTED
}
