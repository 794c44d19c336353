package com.guardrails.testsupport;

import com.guardrails.core.model.Notification;
import com.guardrails.core.model.NotificationType;
import com.guardrails.core.spi.NotificationSink;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Sink that keeps every notification for assertions. Can be told to fail.
 */
public class RecordingNotificationSink implements NotificationSink {

    private final List<Notification> sent = new CopyOnWriteArrayList<>();
    private final FailureInjector failures = FailureInjector.neverFail();

    @Override
    public void send(Notification notification) {
        failures.maybeThrow(() -> new IllegalStateException("webhook returned 500"));
        sent.add(notification);
    }

    public List<Notification> sent() {
        return List.copyOf(sent);
    }

    public List<Notification> ofType(NotificationType type) {
        return sent.stream().filter(n -> n.type() == type).toList();
    }

    public FailureInjector failures() {
        return failures;
    }

    public void clear() {
        sent.clear();
    }
}
