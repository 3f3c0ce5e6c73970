package com.livedesk.relay.chat.room;

import com.livedesk.relay.chat.protocol.ChatMessage;
import com.livedesk.relay.chat.protocol.OutboundEvent;
import com.livedesk.relay.chat.protocol.RoomSummary;
import com.livedesk.relay.chat.service.ChatException;
import com.livedesk.relay.chat.service.ChatFailure;
import com.livedesk.relay.chat.service.ReconnectionSupervisor;
import com.livedesk.relay.chat.ws.Outbox;
import com.livedesk.relay.chat.ws.WsSessionRegistry;
import com.livedesk.relay.notify.NotificationDispatcher;
import com.livedesk.relay.notify.NotificationEvent;
import com.livedesk.relay.notify.NotificationKind;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * The room table. Every mutation runs inside one monitor and only touches memory; deliveries,
 * timer arming and notifications are collected into {@link Effects} and run after the monitor
 * is released.
 */
@Component
public class RoomStore {

    private static final Logger log = LoggerFactory.getLogger(RoomStore.class);

    private static final int MAX_ID_ATTEMPTS = 16;

    public record JoinResult(String roomId, boolean rejoined) {
    }

    public record RoomView(String roomId, String state, String visitorConnection, String adminConnection) {
    }

    public record RoomStats(int waiting, int active, int pending) {
        public int total() {
            return waiting + active + pending;
        }
    }

    private final WsSessionRegistry registry;
    private final Outbox outbox;
    private final ReconnectionSupervisor supervisor;
    private final NotificationDispatcher notifications;
    private final RoomIdGenerator idGenerator;
    private final Clock clock;

    private final Object lock = new Object();
    private final Map<String, Room> rooms = new LinkedHashMap<>();
    private final Map<String, String> roomByConnection = new HashMap<>();
    private long epochSeq;

    private final Counter roomsCreated;
    private final Counter messagesRelayed;
    private final Counter graceExpired;
    private final Map<CloseReason, Counter> roomsClosed = new EnumMap<>(CloseReason.class);

    public RoomStore(
            WsSessionRegistry registry,
            Outbox outbox,
            ReconnectionSupervisor supervisor,
            NotificationDispatcher notifications,
            RoomIdGenerator idGenerator,
            Clock clock,
            MeterRegistry meterRegistry
    ) {
        this.registry = registry;
        this.outbox = outbox;
        this.supervisor = supervisor;
        this.notifications = notifications;
        this.idGenerator = idGenerator;
        this.clock = clock;

        this.roomsCreated = Counter.builder("livedesk.rooms.created")
                .description("Rooms created by visitor joins")
                .register(meterRegistry);
        this.messagesRelayed = Counter.builder("livedesk.messages.relayed")
                .description("Chat messages delivered to a room peer")
                .register(meterRegistry);
        this.graceExpired = Counter.builder("livedesk.grace.expired")
                .description("Pending rooms torn down because the grace period ran out")
                .register(meterRegistry);
        for (var reason : CloseReason.values()) {
            roomsClosed.put(reason, Counter.builder("livedesk.rooms.closed")
                    .description("Rooms torn down")
                    .tag("reason", reason.wire())
                    .register(meterRegistry));
        }
        Gauge.builder("livedesk.rooms.live", this, s -> s.stats().total())
                .description("Rooms currently in the table")
                .register(meterRegistry);
    }

    public JoinResult createOrRejoin(String visitorConn, String visitorName, String requestedRoomId) {
        var fx = new Effects();
        final JoinResult result;
        synchronized (lock) {
            if (roomByConnection.containsKey(visitorConn)) {
                throw new ChatException(ChatFailure.VALIDATION, "already_in_room", "You are already in a room");
            }
            var existing = requestedRoomId == null ? null : rooms.get(requestedRoomId);
            if (existing != null) {
                rebindVisitor(existing, visitorConn, fx);
                result = new JoinResult(existing.id, true);
            } else {
                var room = new Room(allocateId(), visitorName, clock.instant(), new RoomState.Waiting(visitorConn));
                rooms.put(room.id, room);
                roomByConnection.put(visitorConn, room.id);
                roomsCreated.increment();

                fx.send(visitorConn, new OutboundEvent.WaitingForAdmin(room.id, "Room created! Waiting for Admin to join..."));
                fx.toAdmins(new OutboundEvent.RoomAvailable(room.summary()));
                fx.notify(NotificationKind.ROOM_CREATED, room, room.createdAt);
                if (requestedRoomId != null) {
                    log.info("room_rejoin_fallback requestedRoomId={} roomId={}", requestedRoomId, room.id);
                }
                log.info("room_created roomId={} visitorConn={}", room.id, visitorConn);
                result = new JoinResult(room.id, false);
            }
        }
        flush(fx);
        return result;
    }

    private void rebindVisitor(Room room, String visitorConn, Effects fx) {
        var previous = room.state.visitor();
        if (previous != null && !previous.equals(visitorConn)) {
            roomByConnection.remove(previous);
            room.typing.remove(previous);
            fx.send(previous, new OutboundEvent.SystemNotice("This chat was resumed from another connection."));
        }
        roomByConnection.put(visitorConn, room.id);

        var state = room.state;
        if (state instanceof RoomState.Waiting) {
            room.state = new RoomState.Waiting(visitorConn);
            fx.send(visitorConn, new OutboundEvent.WaitingForAdmin(room.id, "Reconnected. Waiting for Admin to join..."));
        } else if (state instanceof RoomState.Active active) {
            room.state = new RoomState.Active(visitorConn, active.admin());
            resumed(room, active.admin(), visitorConn, fx);
        } else if (state instanceof RoomState.PendingVisitorReturn pending) {
            room.state = new RoomState.Active(visitorConn, pending.admin());
            fx.cancel(room.id, pending.epoch());
            resumed(room, pending.admin(), visitorConn, fx);
        } else if (state instanceof RoomState.PendingAdminReturn pending) {
            room.state = new RoomState.PendingAdminReturn(visitorConn, pending.epoch());
            fx.send(visitorConn, new OutboundEvent.WaitingForAdmin(room.id, "Reconnected. Waiting for Admin to reconnect..."));
        }
        log.info("room_rejoined roomId={} state={} visitorConn={}", room.id, room.state.label(), visitorConn);
    }

    private void resumed(Room room, String adminConn, String visitorConn, Effects fx) {
        fx.send(visitorConn, new OutboundEvent.YouHaveBeenJoined(room.id, room.adminName));
        fx.send(adminConn, new OutboundEvent.SystemNotice(room.visitorName + " reconnected"));
    }

    private String allocateId() {
        for (int i = 0; i < MAX_ID_ATTEMPTS; i++) {
            var id = idGenerator.next();
            if (id != null && !rooms.containsKey(id)) {
                return id;
            }
        }
        throw new IllegalStateException("room_id_exhausted");
    }

    /**
     * Rooms an admin may claim, oldest first. A room whose admin dropped is listed again while its
     * grace timer runs.
     */
    public List<RoomSummary> listWaiting() {
        synchronized (lock) {
            return rooms.values().stream()
                    .filter(Room::claimable)
                    .map(Room::summary)
                    .toList();
        }
    }

    public RoomSummary adminJoin(String adminConn, String adminName, String roomId) {
        var fx = new Effects();
        final RoomSummary summary;
        synchronized (lock) {
            var room = roomId == null ? null : rooms.get(roomId);
            if (room == null || !room.claimable()) {
                throw new ChatException(ChatFailure.NOT_FOUND, "room_not_found", "Room " + roomId + " not found");
            }
            if (roomByConnection.containsKey(adminConn)) {
                throw new ChatException(ChatFailure.VALIDATION, "already_in_room", "End your current chat before joining another room");
            }

            var visitorConn = room.state.visitor();
            if (room.state instanceof RoomState.PendingAdminReturn pending) {
                fx.cancel(room.id, pending.epoch());
            }
            room.state = new RoomState.Active(visitorConn, adminConn);
            room.adminName = adminName;
            roomByConnection.put(adminConn, room.id);
            summary = room.summary();

            fx.send(adminConn, new OutboundEvent.AdminJoinedRoom(room.id, room.visitorName));
            fx.send(visitorConn, new OutboundEvent.YouHaveBeenJoined(room.id, adminName));
            fx.notify(NotificationKind.ADMIN_JOINED, room, clock.instant());
            log.info("room_claimed roomId={} adminConn={}", room.id, adminConn);
        }
        flush(fx);
        return summary;
    }

    /**
     * Immediate teardown requested by {@code initiator}; the other party, if any, is told why.
     *
     * @return false when the room does not exist
     */
    public boolean close(String roomId, Role initiator, CloseReason reason) {
        var fx = new Effects();
        synchronized (lock) {
            var room = roomId == null ? null : rooms.get(roomId);
            if (room == null) return false;
            teardown(room, initiator, reason, fx);
        }
        flush(fx);
        return true;
    }

    /**
     * Closes the room {@code connectionId} is bound to.
     *
     * @return false when the connection is not in a room
     */
    public boolean closeByConnection(String connectionId, CloseReason reason) {
        var fx = new Effects();
        synchronized (lock) {
            var room = roomFor(connectionId);
            if (room == null) return false;
            var initiator = room.isVisitor(connectionId) ? Role.VISITOR : Role.ADMIN;
            teardown(room, initiator, reason, fx);
        }
        flush(fx);
        return true;
    }

    private void teardown(Room room, Role initiator, CloseReason reason, Effects fx) {
        final String remaining;
        final PeerNotice notice;
        if (initiator == Role.VISITOR) {
            remaining = room.state.admin();
            notice = new PeerNotice(room.visitorName, room.visitorName + " has left the chat");
        } else {
            remaining = room.state.visitor();
            notice = new PeerNotice(room.adminName, "Admin has ended the chat");
        }
        remove(room, reason, fx);
        fx.send(remaining, new OutboundEvent.PeerLeft(notice.username(), reason.wire(), notice.message()));
        log.info("room_closed roomId={} initiator={} reason={}", room.id, initiator, reason.wire());
    }

    private record PeerNotice(String username, String message) {
    }

    public void onDisconnect(String connectionId) {
        var fx = new Effects();
        synchronized (lock) {
            var room = roomFor(connectionId);
            if (room == null) return;

            var peer = room.peerOf(connectionId);
            if (room.typing.remove(connectionId)) {
                fx.send(peer, new OutboundEvent.TypingStopped(room.nameOf(connectionId)));
            }

            var state = room.state;
            if (state instanceof RoomState.Waiting) {
                remove(room, CloseReason.DISCONNECTED, fx);
                log.info("room_abandoned roomId={} visitorConn={}", room.id, connectionId);
            } else if (state instanceof RoomState.Active active) {
                var epoch = ++epochSeq;
                roomByConnection.remove(connectionId);
                if (connectionId.equals(active.visitor())) {
                    room.state = new RoomState.PendingVisitorReturn(active.admin(), epoch);
                    fx.send(active.admin(), new OutboundEvent.PeerLeft(room.visitorName, CloseReason.DISCONNECTED.wire(),
                            room.visitorName + " disconnected. Waiting for them to reconnect..."));
                } else {
                    room.state = new RoomState.PendingAdminReturn(active.visitor(), epoch);
                    fx.send(active.visitor(), new OutboundEvent.PeerLeft(room.adminName, CloseReason.DISCONNECTED.wire(),
                            "Admin left the chat"));
                    fx.send(active.visitor(), new OutboundEvent.SystemNotice("Waiting for an admin to reconnect..."));
                    fx.toAdmins(new OutboundEvent.RoomAvailable(room.summary()));
                }
                fx.arm(room.id, epoch);
                log.info("room_pending roomId={} state={} epoch={}", room.id, room.state.label(), epoch);
            } else {
                // last remaining party of a pending room
                remove(room, CloseReason.DISCONNECTED, fx);
                log.info("room_abandoned roomId={} state={}", room.id, state.label());
            }
        }
        flush(fx);
    }

    /**
     * Grace timer callback. Does nothing unless the room still sits in the pending state that
     * armed this timer.
     */
    public void expireGrace(String roomId, long epoch) {
        var fx = new Effects();
        synchronized (lock) {
            var room = rooms.get(roomId);
            if (room == null) {
                log.debug("grace_stale roomId={} epoch={} reason=room_gone", roomId, epoch);
                return;
            }
            var state = room.state;
            if (state instanceof RoomState.PendingVisitorReturn pending && pending.epoch() == epoch) {
                remove(room, CloseReason.TIMEOUT, fx);
                fx.send(pending.admin(), new OutboundEvent.PeerLeft(room.visitorName, CloseReason.TIMEOUT.wire(),
                        room.visitorName + " has left the chat"));
            } else if (state instanceof RoomState.PendingAdminReturn pending && pending.epoch() == epoch) {
                remove(room, CloseReason.TIMEOUT, fx);
                fx.send(pending.visitor(), new OutboundEvent.PeerLeft(room.adminName, CloseReason.TIMEOUT.wire(),
                        "Admin has left the chat"));
            } else {
                log.debug("grace_stale roomId={} epoch={} state={}", roomId, epoch, state.label());
                return;
            }
            graceExpired.increment();
            log.info("grace_expired roomId={} epoch={}", roomId, epoch);
        }
        flush(fx);
    }

    public ChatMessage relay(String connectionId, String text) {
        var fx = new Effects();
        final ChatMessage message;
        synchronized (lock) {
            var room = roomFor(connectionId);
            if (room == null) {
                throw new ChatException(ChatFailure.STALE_ROOM, "not_in_room", "You are not in any room yet");
            }
            if (room.state instanceof RoomState.Waiting) {
                throw new ChatException(ChatFailure.STALE_ROOM, "waiting_for_admin", "Waiting for Admin to join...");
            }
            if (!(room.state instanceof RoomState.Active)) {
                throw new ChatException(ChatFailure.STALE_ROOM, "peer_reconnecting", "Your chat partner is reconnecting...");
            }

            var sender = room.nameOf(connectionId);
            var peer = room.peerOf(connectionId);
            message = new ChatMessage(sender, text, clock.instant(), room.id);
            if (room.typing.remove(connectionId)) {
                fx.send(peer, new OutboundEvent.TypingStopped(sender));
            }
            fx.send(peer, new OutboundEvent.Message(message));
            messagesRelayed.increment();
        }
        flush(fx);
        return message;
    }

    /**
     * Ignored unless the connection sits in an active room. Repeated identical states are coalesced.
     */
    public void setTyping(String connectionId, boolean typing) {
        var fx = new Effects();
        synchronized (lock) {
            var room = roomFor(connectionId);
            if (room == null || !(room.state instanceof RoomState.Active)) return;

            var name = room.nameOf(connectionId);
            var peer = room.peerOf(connectionId);
            if (typing) {
                if (room.typing.add(connectionId)) {
                    fx.send(peer, new OutboundEvent.UserTyping(name));
                }
            } else if (room.typing.remove(connectionId)) {
                fx.send(peer, new OutboundEvent.TypingStopped(name));
            }
        }
        flush(fx);
    }

    /**
     * Drops rooms that have been waiting for an admin longer than {@code maxAge}.
     */
    public int expireStaleWaiting(Duration maxAge) {
        var fx = new Effects();
        int removed = 0;
        synchronized (lock) {
            var cutoff = clock.instant().minus(maxAge);
            for (var room : new ArrayList<>(rooms.values())) {
                if (!(room.state instanceof RoomState.Waiting waiting)) continue;
                if (!room.createdAt.isBefore(cutoff)) continue;
                remove(room, CloseReason.STALE, fx);
                fx.send(waiting.visitor(), new OutboundEvent.SystemNotice("No admin is available right now. Please try again later."));
                removed++;
                log.info("room_expired roomId={} createdAt={}", room.id, room.createdAt);
            }
        }
        flush(fx);
        return removed;
    }

    /**
     * Publishes one {@link NotificationKind#VISITOR_WAITING} per room waiting longer than {@code threshold}.
     */
    public int alertLongWaits(Duration threshold) {
        var fx = new Effects();
        int alerted = 0;
        synchronized (lock) {
            var now = clock.instant();
            var cutoff = now.minus(threshold);
            for (var room : rooms.values()) {
                if (!(room.state instanceof RoomState.Waiting) || room.waitAlertSent) continue;
                if (!room.createdAt.isBefore(cutoff)) continue;
                room.waitAlertSent = true;
                fx.notify(NotificationKind.VISITOR_WAITING, room, room.createdAt, Duration.between(room.createdAt, now));
                alerted++;
            }
        }
        flush(fx);
        return alerted;
    }

    public Optional<String> roomOf(String connectionId) {
        synchronized (lock) {
            return Optional.ofNullable(roomByConnection.get(connectionId));
        }
    }

    Optional<RoomView> find(String roomId) {
        synchronized (lock) {
            return Optional.ofNullable(rooms.get(roomId)).map(RoomStore::view);
        }
    }

    List<RoomView> snapshot() {
        synchronized (lock) {
            return rooms.values().stream().map(RoomStore::view).toList();
        }
    }

    public RoomStats stats() {
        synchronized (lock) {
            int waiting = 0;
            int active = 0;
            int pending = 0;
            for (var room : rooms.values()) {
                if (room.state instanceof RoomState.Waiting) waiting++;
                else if (room.state instanceof RoomState.Active) active++;
                else pending++;
            }
            return new RoomStats(waiting, active, pending);
        }
    }

    private Room roomFor(String connectionId) {
        var roomId = connectionId == null ? null : roomByConnection.get(connectionId);
        return roomId == null ? null : rooms.get(roomId);
    }

    private void remove(Room room, CloseReason reason, Effects fx) {
        rooms.remove(room.id);
        var visitor = room.state.visitor();
        var admin = room.state.admin();
        if (visitor != null) roomByConnection.remove(visitor, room.id);
        if (admin != null) roomByConnection.remove(admin, room.id);
        room.typing.clear();
        if (room.state instanceof RoomState.PendingVisitorReturn || room.state instanceof RoomState.PendingAdminReturn) {
            fx.cancelAll(room.id);
        }
        roomsClosed.get(reason).increment();
        fx.notify(NotificationKind.ROOM_CLOSED, room, clock.instant());
    }

    private static RoomView view(Room room) {
        return new RoomView(room.id, room.state.label(), room.state.visitor(), room.state.admin());
    }

    private void flush(Effects fx) {
        for (var action : fx.actions) {
            try {
                action.run();
            } catch (Exception e) {
                log.warn("room_effect_failed", e);
            }
        }
    }

    /**
     * Side effects recorded under the lock and run after it is released, in order.
     */
    private final class Effects {
        private final List<Runnable> actions = new ArrayList<>();

        void send(String connectionId, OutboundEvent event) {
            if (connectionId == null) return;
            actions.add(() -> outbox.send(connectionId, event));
        }

        void toAdmins(OutboundEvent event) {
            actions.add(() -> {
                for (var adminId : registry.adminConnectionIds()) {
                    outbox.send(adminId, event);
                }
            });
        }

        void arm(String roomId, long epoch) {
            actions.add(() -> supervisor.arm(roomId, epoch, () -> expireGrace(roomId, epoch)));
        }

        void cancel(String roomId, long epoch) {
            actions.add(() -> supervisor.cancel(roomId, epoch));
        }

        void cancelAll(String roomId) {
            actions.add(() -> supervisor.cancelAll(roomId));
        }

        void notify(NotificationKind kind, Room room, Instant at) {
            notify(kind, room, at, null);
        }

        void notify(NotificationKind kind, Room room, Instant at, Duration waited) {
            var event = new NotificationEvent(kind, room.id, room.visitorName, at, waited);
            actions.add(() -> notifications.publish(event));
        }
    }
}
