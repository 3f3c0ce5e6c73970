package com.livedesk.relay.notify;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskExecutor;
import org.springframework.stereotype.Component;

import java.util.List;

@Component
public class NotificationDispatcher {

    private static final Logger log = LoggerFactory.getLogger(NotificationDispatcher.class);

    private final List<NotificationSink> sinks;
    private final TaskExecutor executor;

    public NotificationDispatcher(List<NotificationSink> sinks, @Qualifier("notificationExecutor") TaskExecutor executor) {
        this.sinks = List.copyOf(sinks);
        this.executor = executor;
        log.info("notification_sinks configured={}", this.sinks.stream().map(NotificationSink::name).toList());
    }

    /**
     * Hands the event to every sink off the caller's thread. Delivery failures are logged and dropped.
     */
    public void publish(NotificationEvent event) {
        if (event == null) return;
        if (sinks.isEmpty()) {
            log.debug("notification_skipped kind={} roomId={}", event.kind(), event.roomId());
            return;
        }
        for (var sink : sinks) {
            try {
                executor.execute(() -> deliver(sink, event));
            } catch (RuntimeException e) {
                log.warn("notification_rejected sink={} kind={} roomId={}", sink.name(), event.kind(), event.roomId(), e);
            }
        }
    }

    private static void deliver(NotificationSink sink, NotificationEvent event) {
        try {
            sink.deliver(event);
            log.debug("notification_sent sink={} kind={} roomId={}", sink.name(), event.kind(), event.roomId());
        } catch (Exception e) {
            log.warn("notification_failed sink={} kind={} roomId={}", sink.name(), event.kind(), event.roomId(), e);
        }
    }
}
