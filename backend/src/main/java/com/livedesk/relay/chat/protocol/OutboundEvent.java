package com.livedesk.relay.chat.protocol;

import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.List;

/**
 * Server to client events. Each variant knows its wire type and writes its own fields;
 * {@link OutboundEncoder} adds the envelope.
 */
public interface OutboundEvent {

    String type();

    void writeFields(ObjectNode node);

    record Connected(String sessionId) implements OutboundEvent {
        @Override
        public String type() {
            return "CONNECTED";
        }

        @Override
        public void writeFields(ObjectNode node) {
            node.put("session_id", sessionId);
        }
    }

    record AuthFailed(String reason) implements OutboundEvent {
        @Override
        public String type() {
            return "AUTH_FAILED";
        }

        @Override
        public void writeFields(ObjectNode node) {
            node.put("reason", reason);
        }
    }

    record AdminAuthenticated(String username) implements OutboundEvent {
        @Override
        public String type() {
            return "ADMIN_AUTH_OK";
        }

        @Override
        public void writeFields(ObjectNode node) {
            node.put("username", username);
            node.put("message", "Connected as Admin");
        }
    }

    record WaitingForAdmin(String roomId, String message) implements OutboundEvent {
        @Override
        public String type() {
            return "WAITING_FOR_ADMIN";
        }

        @Override
        public void writeFields(ObjectNode node) {
            node.put("room_id", roomId);
            node.put("message", message);
        }
    }

    record RoomAvailable(RoomSummary room) implements OutboundEvent {
        @Override
        public String type() {
            return "ROOM_AVAILABLE";
        }

        @Override
        public void writeFields(ObjectNode node) {
            writeRoom(node, room);
        }
    }

    record RoomsList(List<RoomSummary> rooms) implements OutboundEvent {
        @Override
        public String type() {
            return "ROOMS_LIST";
        }

        @Override
        public void writeFields(ObjectNode node) {
            var arr = node.putArray("rooms");
            for (var room : rooms) {
                writeRoom(arr.addObject(), room);
            }
        }
    }

    record AdminJoinedRoom(String roomId, String username) implements OutboundEvent {
        @Override
        public String type() {
            return "ADMIN_JOINED_ROOM";
        }

        @Override
        public void writeFields(ObjectNode node) {
            node.put("room_id", roomId);
            node.put("username", username);
            node.put("message", "Joined room with " + username);
        }
    }

    record YouHaveBeenJoined(String roomId, String username) implements OutboundEvent {
        @Override
        public String type() {
            return "YOU_HAVE_BEEN_JOINED";
        }

        @Override
        public void writeFields(ObjectNode node) {
            node.put("room_id", roomId);
            node.put("username", username);
            node.put("message", "Admin has joined the chat!");
        }
    }

    record Message(ChatMessage message) implements OutboundEvent {
        @Override
        public String type() {
            return "MSG";
        }

        @Override
        public void writeFields(ObjectNode node) {
            node.put("sender", message.sender());
            node.put("text", message.text());
            node.put("timestamp", message.timestamp().toString());
            node.put("room_id", message.roomId());
        }
    }

    record UserTyping(String username) implements OutboundEvent {
        @Override
        public String type() {
            return "TYPING";
        }

        @Override
        public void writeFields(ObjectNode node) {
            node.put("username", username);
        }
    }

    record TypingStopped(String username) implements OutboundEvent {
        @Override
        public String type() {
            return "TYPING_STOPPED";
        }

        @Override
        public void writeFields(ObjectNode node) {
            node.put("username", username);
        }
    }

    record PeerLeft(String username, String reason, String message) implements OutboundEvent {
        @Override
        public String type() {
            return "PEER_LEFT";
        }

        @Override
        public void writeFields(ObjectNode node) {
            node.put("username", username);
            node.put("reason", reason);
            node.put("message", message);
        }
    }

    record SystemNotice(String text) implements OutboundEvent {
        @Override
        public String type() {
            return "SYSTEM_NOTICE";
        }

        @Override
        public void writeFields(ObjectNode node) {
            node.put("text", text);
        }
    }

    record ErrorNotice(String code, String failure, String message) implements OutboundEvent {
        @Override
        public String type() {
            return "ERROR";
        }

        @Override
        public void writeFields(ObjectNode node) {
            node.put("code", code);
            node.put("failure", failure);
            node.put("message", message);
        }
    }

    record Pong() implements OutboundEvent {
        @Override
        public String type() {
            return "PONG";
        }

        @Override
        public void writeFields(ObjectNode node) {
        }
    }

    private static void writeRoom(ObjectNode node, RoomSummary room) {
        node.put("room_id", room.roomId());
        node.put("username", room.username());
        node.put("created_at", room.createdAt().toString());
    }
}
