package com.bbthechange.appwatch.client;

import com.bbthechange.appwatch.dto.NotificationPayload;
import com.bbthechange.appwatch.exception.DeliveryException;

/**
 * Outbound channel for the consolidated release notification.
 */
public interface NotificationChannel {

    /**
     * Deliver one payload to the configured destination.
     *
     * @throws DeliveryException if the destination did not accept the message
     */
    void deliver(NotificationPayload payload);
}
