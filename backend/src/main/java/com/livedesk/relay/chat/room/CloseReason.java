package com.livedesk.relay.chat.room;

public enum CloseReason {
    ENDED("ended"),
    PAGE_CLOSED("page_closed"),
    DISCONNECTED("disconnected"),
    TIMEOUT("timeout"),
    STALE("stale");

    private final String wire;

    CloseReason(String wire) {
        this.wire = wire;
    }

    public String wire() {
        return wire;
    }
}
