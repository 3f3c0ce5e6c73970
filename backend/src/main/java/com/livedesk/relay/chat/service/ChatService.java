package com.livedesk.relay.chat.service;

import com.livedesk.relay.auth.service.AdminGate;
import com.livedesk.relay.chat.protocol.ChatMessage;
import com.livedesk.relay.chat.protocol.InboundEvent;
import com.livedesk.relay.chat.protocol.InboundHandler;
import com.livedesk.relay.chat.protocol.OutboundEvent;
import com.livedesk.relay.chat.room.CloseReason;
import com.livedesk.relay.chat.room.Role;
import com.livedesk.relay.chat.room.RoomStore;
import com.livedesk.relay.chat.ws.Outbox;
import com.livedesk.relay.chat.ws.WsSessionRegistry;
import com.livedesk.relay.common.text.InputSanitizer;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

/**
 * Connection lifecycle and inbound event handling. Failures are reported to the originating
 * connection only.
 */
@Service
public class ChatService implements InboundHandler {

    private static final Logger log = LoggerFactory.getLogger(ChatService.class);

    private final WsSessionRegistry registry;
    private final RoomStore roomStore;
    private final AdminGate adminGate;
    private final MessageRateLimiter rateLimiter;
    private final Outbox outbox;
    private final int messageMaxLength;
    private final int usernameMaxLength;

    private final Counter rateLimited;

    public ChatService(
            WsSessionRegistry registry,
            RoomStore roomStore,
            AdminGate adminGate,
            MessageRateLimiter rateLimiter,
            Outbox outbox,
            MeterRegistry meterRegistry,
            @Value("${app.chat.message-max-length:1000}") int messageMaxLength,
            @Value("${app.chat.username-max-length:50}") int usernameMaxLength
    ) {
        this.registry = registry;
        this.roomStore = roomStore;
        this.adminGate = adminGate;
        this.rateLimiter = rateLimiter;
        this.outbox = outbox;
        this.messageMaxLength = Math.max(1, messageMaxLength);
        this.usernameMaxLength = Math.max(1, usernameMaxLength);
        this.rateLimited = Counter.builder("livedesk.messages.rate_limited")
                .description("Messages dropped by the per-connection rate limit")
                .register(meterRegistry);
    }

    public void connected(String connectionId) {
        registry.open(connectionId);
        outbox.send(connectionId, new OutboundEvent.Connected(connectionId));
        log.debug("ws_connected conn={}", connectionId);
    }

    public void disconnected(String connectionId) {
        var name = registry.lookup(connectionId).map(WsSessionRegistry.ConnectionContext::displayName).orElse(null);
        registry.unregister(connectionId);
        rateLimiter.forget(connectionId);
        roomStore.onDisconnect(connectionId);
        log.info("ws_disconnected conn={} username={}", connectionId, name);
    }

    public void handle(String connectionId, InboundEvent event) {
        log.debug("ws_event conn={} type={}", connectionId, event.type());
        try {
            event.dispatch(connectionId, this);
        } catch (ChatException ex) {
            reject(connectionId, ex);
        }
    }

    public void reject(String connectionId, ChatException ex) {
        if (ex.failure() == ChatFailure.AUTHENTICATION) {
            log.warn("admin_auth_failed conn={} code={}", connectionId, ex.code());
            outbox.send(connectionId, new OutboundEvent.AuthFailed(ex.getMessage()));
            outbox.close(connectionId);
            return;
        }
        log.debug("request_rejected conn={} failure={} code={}", connectionId, ex.failure().wire(), ex.code());
        outbox.send(connectionId, new OutboundEvent.ErrorNotice(ex.code(), ex.failure().wire(), ex.getMessage()));
    }

    @Override
    public void onJoin(String connectionId, InboundEvent.Join event) {
        var rawName = event.username() == null ? "Anonymous" : event.username();
        var name = InputSanitizer.sanitize(rawName, usernameMaxLength);
        if (name == null) {
            throw new ChatException(ChatFailure.VALIDATION, "invalid_username", "Invalid username");
        }
        if (roomStore.roomOf(connectionId).isPresent()) {
            throw new ChatException(ChatFailure.VALIDATION, "already_in_room", "You are already in a room");
        }

        if (adminGate.isAdminName(name)) {
            adminGate.authenticate(name, event.password());
            registry.register(connectionId, name, Role.ADMIN);
            outbox.send(connectionId, new OutboundEvent.AdminAuthenticated(name));
            log.info("admin_authenticated conn={}", connectionId);
            return;
        }

        var requested = event.roomId();
        if (requested != null && requested.isBlank()) {
            requested = null;
        }
        if (requested != null && !InputSanitizer.isValidRoomId(requested)) {
            throw new ChatException(ChatFailure.VALIDATION, "invalid_room_id", "Invalid room id");
        }

        registry.register(connectionId, name, Role.VISITOR);
        var joined = roomStore.createOrRejoin(connectionId, name, requested);
        log.info("visitor_joined conn={} roomId={} rejoined={}", connectionId, joined.roomId(), joined.rejoined());
    }

    @Override
    public void onListRooms(String connectionId) {
        requireAdmin(connectionId, "Only Admin can list rooms");
        outbox.send(connectionId, new OutboundEvent.RoomsList(roomStore.listWaiting()));
    }

    @Override
    public void onJoinRoom(String connectionId, InboundEvent.JoinRoom event) {
        var admin = requireAdmin(connectionId, "Only Admin can join rooms");
        var roomId = event.roomId();
        if (!InputSanitizer.isValidRoomId(roomId)) {
            throw new ChatException(ChatFailure.VALIDATION, "invalid_room_id", "Invalid room id");
        }
        roomStore.adminJoin(connectionId, admin.displayName(), roomId);
    }

    @Override
    public void onSendMessage(String connectionId, InboundEvent.SendMessage event) {
        sendMessage(connectionId, event.text());
    }

    /**
     * Rate limit, then content, then room membership, then room activity; the first failing check wins.
     */
    public ChatMessage sendMessage(String connectionId, String text) {
        if (!rateLimiter.allow(connectionId)) {
            rateLimited.increment();
            throw new ChatException(ChatFailure.RATE_LIMITED, "rate_limited", "Rate limit exceeded. Please slow down.");
        }
        var safe = InputSanitizer.sanitize(text, messageMaxLength);
        if (safe == null) {
            throw new ChatException(ChatFailure.VALIDATION, "empty_message", "Message cannot be empty");
        }
        return roomStore.relay(connectionId, safe);
    }

    @Override
    public void onTyping(String connectionId, InboundEvent.Typing event) {
        roomStore.setTyping(connectionId, event.typing());
    }

    @Override
    public void onEndSession(String connectionId) {
        if (!roomStore.closeByConnection(connectionId, CloseReason.ENDED)) {
            throw new ChatException(ChatFailure.STALE_ROOM, "not_in_room", "You are not in any room");
        }
    }

    @Override
    public void onPageClosed(String connectionId) {
        roomStore.closeByConnection(connectionId, CloseReason.PAGE_CLOSED);
    }

    @Override
    public void onPing(String connectionId) {
        outbox.send(connectionId, new OutboundEvent.Pong());
    }

    private WsSessionRegistry.ConnectionContext requireAdmin(String connectionId, String message) {
        return registry.lookup(connectionId)
                .filter(WsSessionRegistry.ConnectionContext::isAdmin)
                .orElseThrow(() -> new ChatException(ChatFailure.AUTHORIZATION, "admin_only", message));
    }
}
