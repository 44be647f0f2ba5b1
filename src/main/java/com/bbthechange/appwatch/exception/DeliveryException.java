package com.bbthechange.appwatch.exception;

/**
 * Exception thrown when a notification could not be delivered to its destination.
 */
public class DeliveryException extends RuntimeException {

    public DeliveryException(String message) {
        super(message);
    }

    public DeliveryException(String message, Throwable cause) {
        super(message, cause);
    }
}
