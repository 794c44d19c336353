package com.guardrails.engine.notification;

import com.guardrails.core.model.Notification;
import com.guardrails.core.spi.NotificationSink;
import com.guardrails.engine.metrics.GuardrailMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.util.Map;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Fire-and-forget delivery to the notification sink.
 * Sink failures are logged and counted; they never reach the caller.
 */
public class NotificationDispatcher {

    private static final Logger log = LoggerFactory.getLogger(NotificationDispatcher.class);

    private final NotificationSink sink;
    private final Executor executor;
    private final GuardrailMetrics metrics;

    public NotificationDispatcher(NotificationSink sink, Executor executor, GuardrailMetrics metrics) {
        this.sink = sink;
        this.executor = executor;
        this.metrics = metrics;
    }

    /**
     * Dispatcher that delivers on the calling thread. Used by tests.
     */
    public static NotificationDispatcher direct(NotificationSink sink, GuardrailMetrics metrics) {
        return new NotificationDispatcher(sink, Runnable::run, metrics);
    }

    public void dispatch(Notification notification) {
        Map<String, String> context = MDC.getCopyOfContextMap();
        try {
            executor.execute(() -> deliver(notification, context));
        } catch (RejectedExecutionException e) {
            log.warn("Notification {} for execution {} dropped: dispatcher rejected it",
                notification.type(), notification.executionId());
            metrics.notificationFailed(notification.type().name());
        }
    }

    private void deliver(Notification notification, Map<String, String> context) {
        Map<String, String> previous = MDC.getCopyOfContextMap();
        if (context != null) {
            MDC.setContextMap(context);
        }
        try {
            sink.send(notification);
        } catch (RuntimeException e) {
            log.warn("Failed to deliver {} notification for policy {}: {}",
                notification.type(), notification.policyId(), e.getMessage());
            metrics.notificationFailed(notification.type().name());
        } finally {
            if (previous != null) {
                MDC.setContextMap(previous);
            } else {
                MDC.clear();
            }
        }
    }
}
