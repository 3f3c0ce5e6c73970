package com.livedesk.relay.notify;

/**
 * An outbound channel for operator alerts. Called from the notification executor, never from
 * a connection thread; may block and may throw.
 */
public interface NotificationSink {

    String name();

    void deliver(NotificationEvent event) throws Exception;
}
