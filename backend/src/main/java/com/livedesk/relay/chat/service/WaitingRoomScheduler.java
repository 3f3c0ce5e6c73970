package com.livedesk.relay.chat.service;

import com.livedesk.relay.chat.room.RoomStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Duration;

@Component
@ConditionalOnProperty(name = "app.rooms.housekeeping.enabled", havingValue = "true", matchIfMissing = true)
public class WaitingRoomScheduler {

    private static final Logger log = LoggerFactory.getLogger(WaitingRoomScheduler.class);

    private final RoomStore roomStore;
    private final Duration waitAlertAfter;
    private final Duration staleAfter;

    public WaitingRoomScheduler(
            RoomStore roomStore,
            @Value("${app.rooms.wait-alert-minutes:5}") int waitAlertMinutes,
            @Value("${app.rooms.stale-minutes:120}") int staleMinutes
    ) {
        this.roomStore = roomStore;
        this.waitAlertAfter = Duration.ofMinutes(clampMinutes(waitAlertMinutes));
        this.staleAfter = Duration.ofMinutes(clampMinutes(staleMinutes));
    }

    @Scheduled(fixedDelayString = "${app.rooms.scan-interval-ms:60000}")
    public void scan() {
        try {
            var alerted = roomStore.alertLongWaits(waitAlertAfter);
            var expired = roomStore.expireStaleWaiting(staleAfter);
            if (alerted > 0 || expired > 0) {
                log.info("waiting_room_scan alerted={} expired={}", alerted, expired);
            }
        } catch (Exception e) {
            log.warn("waiting_room_scan_failed", e);
        }
    }

    private static int clampMinutes(int minutes) {
        return Math.max(1, Math.min(minutes, 24 * 60));
    }
}
