package com.livedesk.relay.chat.ws;

import com.livedesk.relay.chat.protocol.OutboundEncoder;
import com.livedesk.relay.chat.protocol.OutboundEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Holds the live WebSocket sessions and writes outbound events to them. Sessions are wrapped so
 * concurrent senders are serialized per session and a slow client is bounded in time and buffer.
 */
@Component
public class WsBroadcaster implements Outbox {

    private static final Logger log = LoggerFactory.getLogger(WsBroadcaster.class);

    private final OutboundEncoder encoder;
    private final int sendTimeLimitMs;
    private final int bufferSizeLimit;

    private final Map<String, WebSocketSession> liveSessions = new ConcurrentHashMap<>();

    public WsBroadcaster(
            OutboundEncoder encoder,
            @Value("${app.ws.send-time-limit-ms:10000}") int sendTimeLimitMs,
            @Value("${app.ws.send-buffer-bytes:524288}") int bufferSizeLimit
    ) {
        this.encoder = encoder;
        this.sendTimeLimitMs = sendTimeLimitMs;
        this.bufferSizeLimit = bufferSizeLimit;
    }

    public void register(WebSocketSession session) {
        if (session == null) return;
        liveSessions.put(session.getId(), new ConcurrentWebSocketSessionDecorator(session, sendTimeLimitMs, bufferSizeLimit));
    }

    public void unregister(WebSocketSession session) {
        if (session == null) return;
        liveSessions.remove(session.getId());
    }

    @Override
    public void send(String connectionId, OutboundEvent event) {
        if (connectionId == null || event == null) return;
        var s = liveSessions.get(connectionId);
        if (s == null || !s.isOpen()) return;
        try {
            s.sendMessage(new TextMessage(encoder.encode(event)));
        } catch (Exception e) {
            // best-effort
            log.debug("ws_send_failed conn={} type={} error={}", connectionId, event.type(), e.toString());
        }
    }

    @Override
    public void close(String connectionId) {
        var s = connectionId == null ? null : liveSessions.get(connectionId);
        if (s == null) return;
        try {
            s.close(CloseStatus.POLICY_VIOLATION);
        } catch (Exception e) {
            log.debug("ws_close_failed conn={} error={}", connectionId, e.toString());
        }
    }
}
