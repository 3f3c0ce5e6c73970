package com.livedesk.relay.notify;

import com.livedesk.relay.common.email.EmailDeliveryService;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.contains;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

class EmailNotificationSinkTest {

    final EmailDeliveryService email = mock(EmailDeliveryService.class);
    final EmailNotificationSink sink = new EmailNotificationSink(email, "ops@example.com", "https://desk.example.com");

    @Test
    void new_room_is_mailed() {
        sink.deliver(new NotificationEvent(NotificationKind.ROOM_CREATED, "r1", "Ana", Instant.parse("2026-03-01T10:00:00Z")));

        verify(email).send(eq("ops@example.com"), eq("New chat request from Ana"), contains("Room: r1"));
    }

    @Test
    void long_wait_subject_has_minutes_and_unescaped_name() {
        sink.deliver(new NotificationEvent(NotificationKind.VISITOR_WAITING, "r1", "A&amp;B",
                Instant.parse("2026-03-01T10:00:00Z"), Duration.ofMinutes(6)));

        verify(email).send(eq("ops@example.com"), eq("A&B has been waiting 6+ minutes"), contains("User: A&B"));
    }

    @Test
    void closed_room_is_not_mailed() {
        sink.deliver(new NotificationEvent(NotificationKind.ROOM_CLOSED, "r1", "Ana", Instant.now()));

        verify(email, never()).send(anyString(), anyString(), anyString());
    }
}
