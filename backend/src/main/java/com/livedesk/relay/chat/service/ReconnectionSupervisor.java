package com.livedesk.relay.chat.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledFuture;

/**
 * One-shot grace timers keyed by room id. Each timer carries the epoch of the pending room state
 * that armed it; the expiry callback re-checks that epoch against the room table, so a timer
 * that fires after the room moved on is harmless.
 */
@Component
public class ReconnectionSupervisor {

    private static final Logger log = LoggerFactory.getLogger(ReconnectionSupervisor.class);

    private record Armed(long epoch, ScheduledFuture<?> future) {
    }

    private final TaskScheduler scheduler;
    private final Clock clock;
    private final Duration grace;

    private final Map<String, Armed> armed = new ConcurrentHashMap<>();

    public ReconnectionSupervisor(
            @Qualifier("taskScheduler") TaskScheduler scheduler,
            Clock clock,
            @Value("${app.chat.reconnect.grace-seconds:10}") long graceSeconds
    ) {
        this.scheduler = scheduler;
        this.clock = clock;
        this.grace = Duration.ofSeconds(Math.max(1, graceSeconds));
    }

    /**
     * Starts the grace timer for {@code roomId}, replacing an older one. An arm request older than
     * the timer already armed is dropped.
     */
    public void arm(String roomId, long epoch, Runnable onExpiry) {
        armed.compute(roomId, (id, current) -> {
            if (current != null && current.epoch() > epoch) {
                return current;
            }
            if (current != null) {
                cancelFuture(current);
            }
            var holder = new Armed[1];
            var future = scheduler.schedule(() -> fire(id, holder[0], onExpiry), clock.instant().plus(grace));
            holder[0] = new Armed(epoch, future);
            return holder[0];
        });
        log.debug("grace_armed roomId={} epoch={} graceMs={}", roomId, epoch, grace.toMillis());
    }

    /**
     * Cancels the timer for {@code roomId} if it was armed for {@code epoch} or earlier.
     */
    public void cancel(String roomId, long epoch) {
        armed.computeIfPresent(roomId, (id, current) -> {
            if (current.epoch() > epoch) {
                return current;
            }
            cancelFuture(current);
            return null;
        });
    }

    public void cancelAll(String roomId) {
        var current = armed.remove(roomId);
        if (current != null) {
            cancelFuture(current);
        }
    }

    boolean isArmed(String roomId) {
        return armed.containsKey(roomId);
    }

    int armedCount() {
        return armed.size();
    }

    private void fire(String roomId, Armed self, Runnable onExpiry) {
        if (self != null) {
            armed.remove(roomId, self);
        }
        try {
            onExpiry.run();
        } catch (Exception e) {
            log.warn("grace_expiry_failed roomId={}", roomId, e);
        }
    }

    private static void cancelFuture(Armed a) {
        if (a.future() != null) {
            a.future().cancel(false);
        }
    }
}
