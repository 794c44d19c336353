package com.guardrails.engine.notification;

import com.guardrails.core.model.Notification;
import com.guardrails.core.model.NotificationRoute;
import com.guardrails.core.model.NotificationType;
import com.guardrails.engine.metrics.GuardrailMetrics;
import com.guardrails.testsupport.RecordingNotificationSink;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import java.util.Map;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicReference;

import static com.guardrails.testsupport.GuardrailFixtures.*;
import static org.assertj.core.api.Assertions.*;

class NotificationDispatcherTest {

    private final SimpleMeterRegistry registry = new SimpleMeterRegistry();
    private final GuardrailMetrics metrics = new GuardrailMetrics(registry);
    private final RecordingNotificationSink sink = new RecordingNotificationSink();

    private static Notification dryRun() {
        return new Notification(NotificationType.DRY_RUN, NotificationRoute.to("/guardrails/slack_webhook"),
            "p1", "e1", null, ROLE_R1, Map.of("amount", 250));
    }

    private double failures(NotificationType type) {
        var counter = registry.find(GuardrailMetrics.NOTIFICATION_FAILURES).tag("type", type.name()).counter();
        return counter == null ? 0 : counter.count();
    }

    @Test
    void dispatch_shouldDeliverToSink() {
        NotificationDispatcher.direct(sink, metrics).dispatch(dryRun());

        assertThat(sink.sent()).singleElement()
            .satisfies(n -> assertThat(n.attributes()).containsEntry("amount", 250));
        assertThat(failures(NotificationType.DRY_RUN)).isZero();
    }

    @Test
    void dispatch_shouldSwallowAndCountSinkFailures() {
        sink.failures().failNext(1);
        NotificationDispatcher dispatcher = NotificationDispatcher.direct(sink, metrics);

        assertThatCode(() -> dispatcher.dispatch(dryRun())).doesNotThrowAnyException();
        dispatcher.dispatch(dryRun());

        assertThat(sink.sent()).hasSize(1);
        assertThat(failures(NotificationType.DRY_RUN)).isEqualTo(1.0);
    }

    @Test
    void dispatch_shouldCountRejectedDelivery() {
        Executor saturated = task -> {
            throw new RejectedExecutionException("queue full");
        };

        new NotificationDispatcher(sink, saturated, metrics).dispatch(dryRun());

        assertThat(sink.sent()).isEmpty();
        assertThat(failures(NotificationType.DRY_RUN)).isEqualTo(1.0);
    }

    @Test
    void dispatch_shouldCarryLoggingContextToDeliveryThread() throws InterruptedException {
        AtomicReference<String> seen = new AtomicReference<>();
        AtomicReference<Thread> worker = new AtomicReference<>();
        Executor otherThread = task -> {
            Thread thread = new Thread(task);
            worker.set(thread);
            thread.start();
        };
        NotificationDispatcher dispatcher = new NotificationDispatcher(n -> seen.set(MDC.get("eventId")), otherThread, metrics);

        MDC.put("eventId", "e1");
        try {
            dispatcher.dispatch(dryRun());
        } finally {
            MDC.remove("eventId");
        }
        worker.get().join(5_000);

        assertThat(seen.get()).isEqualTo("e1");
    }
}
