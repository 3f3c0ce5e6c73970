package com.livedesk.relay.chat.service;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Fixed-window message counter per connection. Bursts straddling a window boundary can reach
 * twice the nominal rate.
 */
@Component
public class MessageRateLimiter {

    private final Clock clock;
    private final int maxMessages;
    private final long windowMs;

    private final ConcurrentHashMap<String, WindowCounter> counters = new ConcurrentHashMap<>();

    public MessageRateLimiter(
            Clock clock,
            @Value("${app.chat.rate-limit.max-messages:10}") int maxMessages,
            @Value("${app.chat.rate-limit.window-seconds:60}") long windowSeconds
    ) {
        this.clock = clock;
        this.maxMessages = Math.max(1, maxMessages);
        this.windowMs = Duration.ofSeconds(Math.max(1, windowSeconds)).toMillis();
    }

    public boolean allow(String connectionId) {
        final long now = clock.millis();
        var c = counters.computeIfAbsent(connectionId, k -> new WindowCounter(now));

        synchronized (c) {
            if (now - c.windowStartMs > windowMs) {
                c.windowStartMs = now;
                c.count = 0;
            }
            if (c.count >= maxMessages) {
                return false;
            }
            c.count++;
            return true;
        }
    }

    public void forget(String connectionId) {
        if (connectionId == null) return;
        counters.remove(connectionId);
    }

    int trackedConnections() {
        return counters.size();
    }

    private static class WindowCounter {
        long windowStartMs;
        int count;

        WindowCounter(long now) {
            this.windowStartMs = now;
        }
    }
}
