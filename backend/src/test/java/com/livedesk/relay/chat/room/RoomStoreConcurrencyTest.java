package com.livedesk.relay.chat.room;

import com.livedesk.relay.chat.protocol.InboundEvent;
import com.livedesk.relay.chat.service.GraceTimers;
import com.livedesk.relay.support.ChatFixture;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Random;
import java.util.concurrent.Callable;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Random interleavings of joins, claims, messages, drops and timer fires; the room table must stay
 * consistent once everything settles.
 */
class RoomStoreConcurrencyTest {

    static final int THREADS = 8;
    static final int OPS_PER_THREAD = 400;

    @Test
    void room_table_stays_consistent_under_concurrent_traffic() throws Exception {
        var fx = new ChatFixture();
        var pool = Executors.newFixedThreadPool(THREADS + 1);
        try {
            var jobs = new ArrayList<Callable<Void>>();
            for (int t = 0; t < THREADS; t++) {
                final int worker = t;
                jobs.add(() -> {
                    runWorker(fx, worker, new Random(1000L + worker));
                    return null;
                });
            }
            jobs.add(() -> {
                for (int i = 0; i < 200; i++) {
                    for (var task : fx.timers) {
                        if (!task.isDone() && i % 3 == 0) task.forceRun();
                    }
                    Thread.yield();
                }
                return null;
            });
            for (var f : pool.invokeAll(jobs, 60, TimeUnit.SECONDS)) {
                f.get();
            }
        } finally {
            pool.shutdownNow();
        }

        assertConsistent(fx);

        fx.elapse(ChatFixture.GRACE);
        assertConsistent(fx);
        assertEquals(0, fx.roomStore.stats().pending());
    }

    private static void runWorker(ChatFixture fx, int worker, Random rnd) {
        boolean admin = worker % 4 == 0;
        int generation = 0;
        String conn = null;
        for (int i = 0; i < OPS_PER_THREAD; i++) {
            if (conn == null) {
                conn = "t" + worker + "-c" + generation++;
                fx.connect(conn);
                if (admin) {
                    fx.adminLogin(conn);
                } else {
                    var rooms = fx.roomStore.snapshot();
                    String target = rooms.isEmpty() || rnd.nextBoolean()
                            ? null
                            : rooms.get(rnd.nextInt(rooms.size())).roomId();
                    fx.visitorJoin(conn, "user" + worker, target);
                }
                continue;
            }
            switch (rnd.nextInt(6)) {
                case 0 -> fx.send(conn, "hello " + i);
                case 1 -> fx.chatService.handle(conn, new InboundEvent.Typing(rnd.nextBoolean()));
                case 2 -> {
                    if (admin) {
                        var waiting = fx.roomStore.listWaiting();
                        if (!waiting.isEmpty()) {
                            fx.adminClaim(conn, waiting.get(rnd.nextInt(waiting.size())).roomId());
                        }
                    } else {
                        fx.send(conn, "   ");
                    }
                }
                case 3 -> fx.chatService.handle(conn, new InboundEvent.EndSession());
                default -> {
                    fx.disconnect(conn);
                    conn = null;
                }
            }
        }
    }

    private static void assertConsistent(ChatFixture fx) {
        var seen = new HashSet<String>();
        List<RoomStore.RoomView> rooms = fx.roomStore.snapshot();
        for (var room : rooms) {
            switch (room.state()) {
                case "waiting" -> assertNotNull(room.visitorConnection());
                case "active" -> {
                    assertNotNull(room.visitorConnection());
                    assertNotNull(room.adminConnection());
                }
                case "pending_visitor_return" -> {
                    assertNotNull(room.adminConnection());
                    assertTrue(GraceTimers.isArmed(fx.supervisor, room.roomId()), "pending room without timer " + room);
                }
                case "pending_admin_return" -> {
                    assertNotNull(room.visitorConnection());
                    assertTrue(GraceTimers.isArmed(fx.supervisor, room.roomId()), "pending room without timer " + room);
                }
                default -> throw new AssertionError("unknown state " + room);
            }
            for (var conn : new String[]{room.visitorConnection(), room.adminConnection()}) {
                if (conn == null) continue;
                assertTrue(seen.add(conn), "connection bound to two rooms: " + conn);
                assertEquals(room.roomId(), fx.roomStore.roomOf(conn).orElse(null));
            }
        }
    }
}
