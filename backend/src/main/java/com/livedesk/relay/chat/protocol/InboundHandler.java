package com.livedesk.relay.chat.protocol;

/**
 * One callback per inbound event variant. Adding a variant to {@link InboundEvent}
 * forces every handler to deal with it.
 */
public interface InboundHandler {

    void onJoin(String connectionId, InboundEvent.Join event);

    void onListRooms(String connectionId);

    void onJoinRoom(String connectionId, InboundEvent.JoinRoom event);

    void onSendMessage(String connectionId, InboundEvent.SendMessage event);

    void onTyping(String connectionId, InboundEvent.Typing event);

    void onEndSession(String connectionId);

    void onPageClosed(String connectionId);

    void onPing(String connectionId);
}
