package com.livedesk.relay.chat.ws;

import com.livedesk.relay.chat.protocol.InboundEventParser;
import com.livedesk.relay.chat.service.ChatException;
import com.livedesk.relay.chat.service.ChatService;
import com.livedesk.relay.chat.protocol.OutboundEvent;
import com.livedesk.relay.common.text.InputSanitizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.TextWebSocketHandler;

import java.util.regex.Pattern;

@Component
public class WsHandler extends TextWebSocketHandler {

    private static final Logger log = LoggerFactory.getLogger(WsHandler.class);

    private static final Pattern PASSWORD_FIELD = Pattern.compile("(\"password\"\\s*:\\s*)\"(?:[^\"\\\\]|\\\\.)*\"");

    private final InboundEventParser parser;
    private final ChatService chatService;
    private final WsBroadcaster broadcaster;

    public WsHandler(InboundEventParser parser, ChatService chatService, WsBroadcaster broadcaster) {
        this.parser = parser;
        this.chatService = chatService;
        this.broadcaster = broadcaster;
    }

    @Override
    public void afterConnectionEstablished(WebSocketSession session) {
        broadcaster.register(session);
        chatService.connected(session.getId());
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
        broadcaster.unregister(session);
        chatService.disconnected(session.getId());
    }

    @Override
    public void handleTransportError(WebSocketSession session, Throwable exception) {
        log.debug("ws_transport_error conn={} error={}", session.getId(), exception.toString());
    }

    @Override
    protected void handleTextMessage(WebSocketSession session, TextMessage message) {
        var connectionId = session.getId();
        try {
            var event = parser.parse(message.getPayload());
            chatService.handle(connectionId, event);
        } catch (ChatException ex) {
            chatService.reject(connectionId, ex);
        } catch (Exception ex) {
            log.warn("ws_internal_error conn={} payload={}", connectionId,
                    InputSanitizer.oneLine(redactPassword(message.getPayload()), 500), ex);
            broadcaster.send(connectionId, new OutboundEvent.ErrorNotice("ws_internal_error", "internal", "Internal error"));
        }
    }

    static String redactPassword(String payload) {
        if (payload == null) return null;
        return PASSWORD_FIELD.matcher(payload).replaceAll("$1\"***\"");
    }
}
