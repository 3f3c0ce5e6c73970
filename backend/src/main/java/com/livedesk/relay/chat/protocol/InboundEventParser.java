package com.livedesk.relay.chat.protocol;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.livedesk.relay.chat.service.ChatException;
import com.livedesk.relay.chat.service.ChatFailure;
import org.springframework.stereotype.Component;

@Component
public class InboundEventParser {

    private final ObjectMapper objectMapper;

    public InboundEventParser(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public InboundEvent parse(String payload) {
        final JsonNode root;
        try {
            root = objectMapper.readTree(payload == null ? "" : payload);
        } catch (JsonProcessingException ex) {
            throw new ChatException(ChatFailure.VALIDATION, "invalid_payload", "payload is not valid JSON");
        }
        if (root == null || !root.isObject()) {
            throw new ChatException(ChatFailure.VALIDATION, "invalid_payload", "payload must be a JSON object");
        }

        var rawType = root.path("type").asText(null);
        if (rawType == null || rawType.isBlank()) {
            throw new ChatException(ChatFailure.VALIDATION, "missing_type", "missing field: type");
        }
        var type = InboundType.fromWire(rawType)
                .orElseThrow(() -> new ChatException(ChatFailure.VALIDATION, "unsupported_type", "unsupported type"));

        return switch (type) {
            case JOIN -> new InboundEvent.Join(
                    text(root, "username"),
                    text(root, "password"),
                    text(root, "room_id"));
            case LIST_ROOMS -> new InboundEvent.ListRooms();
            case JOIN_ROOM -> new InboundEvent.JoinRoom(text(root, "room_id"));
            case MSG_SEND -> new InboundEvent.SendMessage(
                    root.has("text") ? text(root, "text") : text(root, "message"));
            case TYPING -> new InboundEvent.Typing(
                    root.has("is_typing") ? root.path("is_typing").asBoolean(false) : root.path("typing").asBoolean(false));
            case END_SESSION -> new InboundEvent.EndSession();
            case PAGE_CLOSED -> new InboundEvent.PageClosed();
            case PING -> new InboundEvent.Ping();
        };
    }

    private static String text(JsonNode root, String field) {
        var node = root.get(field);
        if (node == null || node.isNull() || !node.isValueNode()) return null;
        return node.asText();
    }
}
