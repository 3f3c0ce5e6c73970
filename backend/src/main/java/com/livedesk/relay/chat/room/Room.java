package com.livedesk.relay.chat.room;

import com.livedesk.relay.chat.protocol.RoomSummary;

import java.time.Instant;
import java.util.HashSet;
import java.util.Set;

/**
 * Mutable room record. Only {@link RoomStore} touches it, always under the store lock.
 */
final class Room {

    final String id;
    final String visitorName;
    final Instant createdAt;

    RoomState state;
    String adminName;
    boolean waitAlertSent;
    final Set<String> typing = new HashSet<>();

    Room(String id, String visitorName, Instant createdAt, RoomState state) {
        this.id = id;
        this.visitorName = visitorName;
        this.createdAt = createdAt;
        this.state = state;
    }

    boolean claimable() {
        return state instanceof RoomState.Waiting || state instanceof RoomState.PendingAdminReturn;
    }

    boolean isVisitor(String connectionId) {
        return connectionId != null && connectionId.equals(state.visitor());
    }

    /** The other bound connection, or null. */
    String peerOf(String connectionId) {
        if (isVisitor(connectionId)) return state.admin();
        if (connectionId != null && connectionId.equals(state.admin())) return state.visitor();
        return null;
    }

    String nameOf(String connectionId) {
        return isVisitor(connectionId) ? visitorName : adminName;
    }

    RoomSummary summary() {
        return new RoomSummary(id, visitorName, createdAt);
    }
}
