package com.livedesk.relay.chat.service;

import com.livedesk.relay.support.ManualScheduledTask;
import com.livedesk.relay.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.scheduling.TaskScheduler;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class ReconnectionSupervisorTest {

    final MutableClock clock = new MutableClock(Instant.parse("2026-03-01T10:00:00Z"));
    final List<ManualScheduledTask> tasks = new ArrayList<>();
    ReconnectionSupervisor supervisor;

    @BeforeEach
    void setUp() {
        var scheduler = mock(TaskScheduler.class);
        when(scheduler.schedule(any(Runnable.class), any(Instant.class))).thenAnswer(inv -> {
            var t = new ManualScheduledTask(inv.getArgument(0), inv.getArgument(1));
            tasks.add(t);
            return t;
        });
        supervisor = new ReconnectionSupervisor(scheduler, clock, 10);
    }

    @Test
    void timer_is_due_after_grace_and_clears_itself() {
        var fired = new AtomicInteger();
        supervisor.arm("r1", 1, fired::incrementAndGet);

        assertEquals(clock.instant().plus(Duration.ofSeconds(10)), tasks.get(0).due());
        assertTrue(supervisor.isArmed("r1"));

        tasks.get(0).forceRun();

        assertEquals(1, fired.get());
        assertFalse(supervisor.isArmed("r1"));
    }

    @Test
    void newer_arm_replaces_older_timer() {
        supervisor.arm("r1", 1, () -> { });
        supervisor.arm("r1", 2, () -> { });

        assertTrue(tasks.get(0).isCancelled());
        assertFalse(tasks.get(1).isCancelled());
        assertEquals(1, supervisor.armedCount());
    }

    @Test
    void late_arm_for_older_epoch_is_dropped() {
        supervisor.arm("r1", 5, () -> { });
        supervisor.arm("r1", 4, () -> { });

        assertEquals(1, tasks.size());
        assertFalse(tasks.get(0).isCancelled());
    }

    @Test
    void cancel_only_affects_same_or_older_epoch() {
        supervisor.arm("r1", 3, () -> { });

        supervisor.cancel("r1", 2);
        assertTrue(supervisor.isArmed("r1"));

        supervisor.cancel("r1", 3);
        assertFalse(supervisor.isArmed("r1"));
        assertTrue(tasks.get(0).isCancelled());

        supervisor.cancel("missing", 1);
    }

    @Test
    void stale_fire_does_not_remove_newer_entry() {
        supervisor.arm("r1", 1, () -> { });
        var first = tasks.get(0);
        supervisor.arm("r1", 2, () -> { });

        first.forceRun();

        assertTrue(supervisor.isArmed("r1"));
    }

    @Test
    void failing_callback_is_contained() {
        supervisor.arm("r1", 1, () -> {
            throw new IllegalStateException("boom");
        });

        tasks.get(0).forceRun();

        assertFalse(supervisor.isArmed("r1"));
    }

    @Test
    void cancel_all_removes_any_epoch() {
        supervisor.arm("r1", 9, () -> { });

        supervisor.cancelAll("r1");

        assertEquals(0, supervisor.armedCount());
        assertTrue(tasks.get(0).isCancelled());
    }
}
