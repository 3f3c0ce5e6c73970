package com.livedesk.relay.chat.protocol;

/**
 * Client to server events, one record per wire type. {@link InboundEventParser} is the only producer.
 */
public interface InboundEvent {

    InboundType type();

    void dispatch(String connectionId, InboundHandler handler);

    record Join(String username, String password, String roomId) implements InboundEvent {
        @Override
        public InboundType type() {
            return InboundType.JOIN;
        }

        @Override
        public void dispatch(String connectionId, InboundHandler handler) {
            handler.onJoin(connectionId, this);
        }

        @Override
        public String toString() {
            return "Join[username=" + username + ", password=" + (password == null ? "null" : "***")
                    + ", roomId=" + roomId + "]";
        }
    }

    record ListRooms() implements InboundEvent {
        @Override
        public InboundType type() {
            return InboundType.LIST_ROOMS;
        }

        @Override
        public void dispatch(String connectionId, InboundHandler handler) {
            handler.onListRooms(connectionId);
        }
    }

    record JoinRoom(String roomId) implements InboundEvent {
        @Override
        public InboundType type() {
            return InboundType.JOIN_ROOM;
        }

        @Override
        public void dispatch(String connectionId, InboundHandler handler) {
            handler.onJoinRoom(connectionId, this);
        }
    }

    record SendMessage(String text) implements InboundEvent {
        @Override
        public InboundType type() {
            return InboundType.MSG_SEND;
        }

        @Override
        public void dispatch(String connectionId, InboundHandler handler) {
            handler.onSendMessage(connectionId, this);
        }
    }

    record Typing(boolean typing) implements InboundEvent {
        @Override
        public InboundType type() {
            return InboundType.TYPING;
        }

        @Override
        public void dispatch(String connectionId, InboundHandler handler) {
            handler.onTyping(connectionId, this);
        }
    }

    record EndSession() implements InboundEvent {
        @Override
        public InboundType type() {
            return InboundType.END_SESSION;
        }

        @Override
        public void dispatch(String connectionId, InboundHandler handler) {
            handler.onEndSession(connectionId);
        }
    }

    record PageClosed() implements InboundEvent {
        @Override
        public InboundType type() {
            return InboundType.PAGE_CLOSED;
        }

        @Override
        public void dispatch(String connectionId, InboundHandler handler) {
            handler.onPageClosed(connectionId);
        }
    }

    record Ping() implements InboundEvent {
        @Override
        public InboundType type() {
            return InboundType.PING;
        }

        @Override
        public void dispatch(String connectionId, InboundHandler handler) {
            handler.onPing(connectionId);
        }
    }
}
