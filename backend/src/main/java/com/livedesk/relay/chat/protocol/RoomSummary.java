package com.livedesk.relay.chat.protocol;

import java.time.Instant;

public record RoomSummary(String roomId, String username, Instant createdAt) {
}
