package com.livedesk.relay.chat.room;

/**
 * Who is bound to a room right now. Pending variants carry the epoch of the grace timer armed
 * when they were entered.
 */
public interface RoomState {

    default String visitor() {
        return null;
    }

    default String admin() {
        return null;
    }

    String label();

    record Waiting(String visitor) implements RoomState {
        @Override
        public String label() {
            return "waiting";
        }
    }

    record Active(String visitor, String admin) implements RoomState {
        @Override
        public String label() {
            return "active";
        }
    }

    record PendingVisitorReturn(String admin, long epoch) implements RoomState {
        @Override
        public String label() {
            return "pending_visitor_return";
        }
    }

    record PendingAdminReturn(String visitor, long epoch) implements RoomState {
        @Override
        public String label() {
            return "pending_admin_return";
        }
    }
}
