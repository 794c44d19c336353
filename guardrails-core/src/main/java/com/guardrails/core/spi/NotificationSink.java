package com.guardrails.core.spi;

import com.guardrails.core.model.Notification;

/**
 * Outbound delivery of structured notifications. Delivery is best effort.
 */
public interface NotificationSink {

    void send(Notification notification);
}
