package com.livedesk.relay.support;

import com.livedesk.relay.auth.service.AdminGate;
import com.livedesk.relay.auth.service.crypto.PasswordHasher;
import com.livedesk.relay.chat.protocol.InboundEvent;
import com.livedesk.relay.chat.room.RoomIdGenerator;
import com.livedesk.relay.chat.room.RoomStore;
import com.livedesk.relay.chat.room.RoomTables;
import com.livedesk.relay.chat.service.ChatService;
import com.livedesk.relay.chat.service.MessageRateLimiter;
import com.livedesk.relay.chat.service.ReconnectionSupervisor;
import com.livedesk.relay.chat.ws.WsSessionRegistry;
import com.livedesk.relay.notify.NotificationDispatcher;
import com.livedesk.relay.notify.NotificationEvent;
import com.livedesk.relay.notify.NotificationSink;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.springframework.core.task.SyncTaskExecutor;
import org.springframework.scheduling.TaskScheduler;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

/**
 * The chat engine wired by hand: real store, service and supervisor; manual timers, a fixed clock
 * and an in-memory outbox.
 */
public class ChatFixture {

    public static final String ADMIN_NAME = "admin";
    public static final String ADMIN_PASSWORD = "s3cret!";
    public static final Duration GRACE = Duration.ofSeconds(10);

    private static final PasswordHasher HASHER = new PasswordHasher();
    private static final String ADMIN_HASH = HASHER.hash(ADMIN_PASSWORD);

    public final MutableClock clock = new MutableClock(Instant.parse("2026-03-01T10:00:00Z"));
    public final RecordingOutbox outbox = new RecordingOutbox();
    public final WsSessionRegistry registry = new WsSessionRegistry();
    public final List<ManualScheduledTask> timers = new CopyOnWriteArrayList<>();
    public final List<NotificationEvent> notifications = new CopyOnWriteArrayList<>();
    public final SimpleMeterRegistry meterRegistry = new SimpleMeterRegistry();

    public final ReconnectionSupervisor supervisor;
    public final RoomStore roomStore;
    public final MessageRateLimiter rateLimiter;
    public final AdminGate adminGate;
    public final ChatService chatService;

    public ChatFixture() {
        var scheduler = mock(TaskScheduler.class);
        when(scheduler.schedule(any(Runnable.class), any(Instant.class))).thenAnswer(inv -> {
            var task = new ManualScheduledTask(inv.getArgument(0), inv.getArgument(1));
            timers.add(task);
            return task;
        });
        supervisor = new ReconnectionSupervisor(scheduler, clock, GRACE.toSeconds());

        NotificationSink sink = new NotificationSink() {
            @Override
            public String name() {
                return "recording";
            }

            @Override
            public void deliver(NotificationEvent event) {
                notifications.add(event);
            }
        };
        var dispatcher = new NotificationDispatcher(List.of(sink), new SyncTaskExecutor());

        roomStore = new RoomStore(registry, outbox, supervisor, dispatcher, new SequentialRoomIds(), clock, meterRegistry);
        rateLimiter = new MessageRateLimiter(clock, 10, 60);
        adminGate = new AdminGate(HASHER, ADMIN_NAME, ADMIN_HASH);
        chatService = new ChatService(registry, roomStore, adminGate, rateLimiter, outbox, meterRegistry, 1000, 50);
    }

    public String connect(String connectionId) {
        chatService.connected(connectionId);
        return connectionId;
    }

    public void visitorJoin(String connectionId, String username) {
        visitorJoin(connectionId, username, null);
    }

    public void visitorJoin(String connectionId, String username, String roomId) {
        chatService.handle(connectionId, new InboundEvent.Join(username, null, roomId));
    }

    public void adminLogin(String connectionId) {
        chatService.handle(connectionId, new InboundEvent.Join(ADMIN_NAME, ADMIN_PASSWORD, null));
    }

    public void adminClaim(String connectionId, String roomId) {
        chatService.handle(connectionId, new InboundEvent.JoinRoom(roomId));
    }

    public void send(String connectionId, String text) {
        chatService.handle(connectionId, new InboundEvent.SendMessage(text));
    }

    public void disconnect(String connectionId) {
        chatService.disconnected(connectionId);
    }

    /** Advances the clock and runs every live timer that is now due. */
    public int elapse(Duration d) {
        clock.advance(d);
        int ran = 0;
        for (var t : timers) {
            if (t.runIfDue(clock.instant())) ran++;
        }
        return ran;
    }

    public String roomState(String roomId) {
        return RoomTables.find(roomStore, roomId).map(RoomStore.RoomView::state).orElse("gone");
    }

    public static class SequentialRoomIds extends RoomIdGenerator {
        private final AtomicInteger next = new AtomicInteger(1);

        @Override
        public String next() {
            return "r" + next.getAndIncrement();
        }
    }
}
