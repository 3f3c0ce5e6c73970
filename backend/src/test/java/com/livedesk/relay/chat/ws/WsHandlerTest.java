package com.livedesk.relay.chat.ws;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.livedesk.relay.chat.protocol.InboundEvent;
import com.livedesk.relay.chat.protocol.InboundEventParser;
import com.livedesk.relay.chat.protocol.OutboundEvent;
import com.livedesk.relay.chat.service.ChatException;
import com.livedesk.relay.chat.service.ChatService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class WsHandlerTest {

    ChatService chatService;
    WsBroadcaster broadcaster;
    WsHandler handler;
    WebSocketSession session;

    @BeforeEach
    void setUp() {
        chatService = mock(ChatService.class);
        broadcaster = mock(WsBroadcaster.class);
        handler = new WsHandler(new InboundEventParser(new ObjectMapper()), chatService, broadcaster);
        session = mock(WebSocketSession.class);
        when(session.getId()).thenReturn("c1");
    }

    @Test
    void lifecycle_is_forwarded() {
        handler.afterConnectionEstablished(session);
        verify(broadcaster).register(session);
        verify(chatService).connected("c1");

        handler.afterConnectionClosed(session, org.springframework.web.socket.CloseStatus.NORMAL);
        verify(broadcaster).unregister(session);
        verify(chatService).disconnected("c1");
    }

    @Test
    void parsed_event_is_handled() {
        handler.handleTextMessage(session, new TextMessage("{\"type\":\"MSG_SEND\",\"text\":\"hi\"}"));

        verify(chatService).handle("c1", new InboundEvent.SendMessage("hi"));
    }

    @Test
    void malformed_frame_is_rejected_to_sender() {
        handler.handleTextMessage(session, new TextMessage("{oops"));

        var captor = ArgumentCaptor.forClass(ChatException.class);
        verify(chatService).reject(eq("c1"), captor.capture());
        assertEquals("invalid_payload", captor.getValue().code());
    }

    @Test
    void unexpected_failure_becomes_internal_error() {
        doThrow(new IllegalStateException("boom")).when(chatService).handle(eq("c1"), any());

        handler.handleTextMessage(session, new TextMessage("{\"type\":\"PING\"}"));

        var captor = ArgumentCaptor.forClass(OutboundEvent.class);
        verify(broadcaster).send(eq("c1"), captor.capture());
        var error = (OutboundEvent.ErrorNotice) captor.getValue();
        assertEquals("ws_internal_error", error.code());
    }

    @Test
    void password_values_are_redacted() {
        var redacted = WsHandler.redactPassword("{\"type\":\"JOIN\",\"username\":\"DARK\",\"password\" : \"p\\\"w\"}");

        assertFalse(redacted.contains("p\\\"w"));
        assertTrue(redacted.contains("\"password\" : \"***\""));
        assertTrue(redacted.contains("\"username\":\"DARK\""));
    }
}
