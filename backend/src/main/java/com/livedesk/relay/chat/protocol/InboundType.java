package com.livedesk.relay.chat.protocol;

import java.util.Arrays;
import java.util.Optional;

public enum InboundType {
    JOIN("JOIN"),
    LIST_ROOMS("LIST_ROOMS"),
    JOIN_ROOM("JOIN_ROOM"),
    MSG_SEND("MSG_SEND"),
    TYPING("TYPING"),
    END_SESSION("END_SESSION"),
    PAGE_CLOSED("PAGE_CLOSED"),
    PING("PING");

    private final String wire;

    InboundType(String wire) {
        this.wire = wire;
    }

    public String wire() {
        return wire;
    }

    public static Optional<InboundType> fromWire(String type) {
        if (type == null || type.isBlank()) return Optional.empty();
        var normalized = type.trim();
        return Arrays.stream(values())
                .filter(t -> t.wire.equalsIgnoreCase(normalized))
                .findFirst();
    }
}
