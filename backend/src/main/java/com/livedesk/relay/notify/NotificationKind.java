package com.livedesk.relay.notify;

public enum NotificationKind {
    ROOM_CREATED,
    VISITOR_WAITING,
    ADMIN_JOINED,
    ROOM_CLOSED
}
