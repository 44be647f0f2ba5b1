package com.bbthechange.appwatch.exception;

/**
 * Exception thrown when the version store cannot be read or written.
 * Wraps lower-level I/O and serialization exceptions with meaningful messages.
 */
public class StoreException extends RuntimeException {

    public StoreException(String message) {
        super(message);
    }

    public StoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
