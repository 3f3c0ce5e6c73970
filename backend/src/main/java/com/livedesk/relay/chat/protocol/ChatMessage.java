package com.livedesk.relay.chat.protocol;

import java.time.Instant;

public record ChatMessage(String sender, String text, Instant timestamp, String roomId) {
}
