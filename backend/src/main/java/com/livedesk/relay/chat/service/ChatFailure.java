package com.livedesk.relay.chat.service;

/**
 * Per-request failure categories. Only {@link #AUTHENTICATION} ends the connection.
 */
public enum ChatFailure {
    AUTHENTICATION("authentication"),
    VALIDATION("validation"),
    NOT_FOUND("not_found"),
    AUTHORIZATION("authorization"),
    RATE_LIMITED("rate_limited"),
    STALE_ROOM("stale_room");

    private final String wire;

    ChatFailure(String wire) {
        this.wire = wire;
    }

    public String wire() {
        return wire;
    }
}
