package com.guardrails.engine.notification;

import com.guardrails.core.model.Notification;
import com.guardrails.core.spi.NotificationSink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Sink that writes notifications to the log instead of a chat channel.
 */
public class LoggingNotificationSink implements NotificationSink {

    private static final Logger log = LoggerFactory.getLogger(LoggingNotificationSink.class);

    @Override
    public void send(Notification notification) {
        String destination = notification.route() != null ? notification.route().destination() : null;
        log.info("[{}] policy={} event={} execution={} target={} destination={} attributes={}",
            notification.type(),
            notification.policyId(),
            notification.eventId(),
            notification.executionId(),
            notification.target(),
            destination,
            notification.attributes());
    }
}
