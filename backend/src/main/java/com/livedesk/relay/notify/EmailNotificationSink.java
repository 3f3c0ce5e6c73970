package com.livedesk.relay.notify;

import com.livedesk.relay.common.email.EmailDeliveryService;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

@Component
@ConditionalOnProperty(name = "app.notify.email.enabled", havingValue = "true")
public class EmailNotificationSink implements NotificationSink {

    private final EmailDeliveryService emailDeliveryService;
    private final String to;
    private final String dashboardUrl;

    public EmailNotificationSink(
            EmailDeliveryService emailDeliveryService,
            @Value("${app.notify.email.to:}") String to,
            @Value("${app.notify.dashboard-url:http://localhost:10000}") String dashboardUrl
    ) {
        if (to == null || to.isBlank()) {
            throw new IllegalStateException("email_to_required");
        }
        this.emailDeliveryService = emailDeliveryService;
        this.to = to.trim();
        this.dashboardUrl = dashboardUrl;
    }

    @Override
    public String name() {
        return "email";
    }

    @Override
    public void deliver(NotificationEvent event) {
        var subject = switch (event.kind()) {
            case ROOM_CREATED -> "New chat request from " + event.displayName();
            case VISITOR_WAITING -> event.displayName() + " has been waiting " + event.waitedMinutes() + "+ minutes";
            case ADMIN_JOINED, ROOM_CLOSED -> null;
        };
        if (subject == null) return;

        var body = "User: " + event.displayName() + "\n"
                + "Room: " + event.roomId() + "\n"
                + "Time: " + event.at() + "\n\n"
                + "Dashboard: " + dashboardUrl + "\n";
        emailDeliveryService.send(to, subject, body);
    }
}
