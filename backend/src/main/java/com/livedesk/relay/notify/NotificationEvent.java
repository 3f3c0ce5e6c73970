package com.livedesk.relay.notify;

import org.springframework.web.util.HtmlUtils;

import java.time.Duration;
import java.time.Instant;

/**
 * @param username display name as stored in the room, HTML-escaped
 * @param waited   how long the visitor has been waiting; only set for {@link NotificationKind#VISITOR_WAITING}
 */
public record NotificationEvent(NotificationKind kind, String roomId, String username, Instant at, Duration waited) {

    public NotificationEvent(NotificationKind kind, String roomId, String username, Instant at) {
        this(kind, roomId, username, at, null);
    }

    /** The name as the visitor typed it, for sinks that are not HTML. */
    public String displayName() {
        return username == null ? null : HtmlUtils.htmlUnescape(username);
    }

    public long waitedMinutes() {
        return waited == null ? 0 : waited.toMinutes();
    }
}
