package com.livedesk.relay.notify;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.http.MediaType;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;

import java.time.Duration;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.LinkedHashMap;
import java.util.Locale;

/**
 * Posts operator alerts to a Telegram chat through the Bot API.
 */
@Component
@ConditionalOnProperty(name = "app.notify.telegram.enabled", havingValue = "true")
public class TelegramNotificationSink implements NotificationSink {

    private static final DateTimeFormatter TIME = DateTimeFormatter.ofPattern("hh:mm a", Locale.ENGLISH);

    private final RestClient restClient;
    private final String botToken;
    private final String chatId;
    private final String dashboardUrl;
    private final ZoneId zone;

    public TelegramNotificationSink(
            @Value("${app.notify.telegram.api-base-url:https://api.telegram.org}") String apiBaseUrl,
            @Value("${app.notify.telegram.bot-token:}") String botToken,
            @Value("${app.notify.telegram.chat-id:}") String chatId,
            @Value("${app.notify.dashboard-url:http://localhost:10000}") String dashboardUrl,
            @Value("${app.notify.zone:UTC}") String zone
    ) {
        if (botToken == null || botToken.isBlank() || chatId == null || chatId.isBlank()) {
            throw new IllegalStateException("telegram_credentials_required");
        }
        var requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout((int) Duration.ofSeconds(5).toMillis());
        requestFactory.setReadTimeout((int) Duration.ofSeconds(5).toMillis());
        this.restClient = RestClient.builder()
                .baseUrl(apiBaseUrl)
                .requestFactory(requestFactory)
                .build();
        this.botToken = botToken.trim();
        this.chatId = chatId.trim();
        this.dashboardUrl = dashboardUrl;
        this.zone = ZoneId.of(zone);
    }

    @Override
    public String name() {
        return "telegram";
    }

    @Override
    public void deliver(NotificationEvent event) {
        var text = format(event);
        if (text == null) return;

        var payload = new LinkedHashMap<String, Object>();
        payload.put("chat_id", chatId);
        payload.put("text", text);
        payload.put("parse_mode", "Markdown");
        payload.put("disable_web_page_preview", true);

        restClient.post()
                .uri("/bot{token}/sendMessage", botToken)
                .contentType(MediaType.APPLICATION_JSON)
                .body(payload)
                .retrieve()
                .toBodilessEntity();
    }

    String format(NotificationEvent event) {
        var user = escapeMarkdown(event.displayName());
        return switch (event.kind()) {
            case ROOM_CREATED -> "🔔 *New Chat Request*\n\n"
                    + "👤 *User:* " + user + "\n"
                    + "🆔 *Room:* `" + event.roomId() + "`\n"
                    + "⏰ *Time:* " + TIME.format(event.at().atZone(zone)) + "\n\n"
                    + "[🔗 Open Dashboard](" + dashboardUrl + ")";
            case VISITOR_WAITING -> "⚠️ *User Waiting " + event.waitedMinutes() + "+ Minutes!*\n\n"
                    + "👤 *User:* " + user + "\n"
                    + "🆔 *Room:* `" + event.roomId() + "`\n"
                    + "⏰ *Waiting:* " + event.waitedMinutes() + " minutes (since "
                    + TIME.format(event.at().atZone(zone)) + ")\n\n"
                    + "🔥 *High Priority*\n"
                    + "[🔗 Open Dashboard Now](" + dashboardUrl + ")";
            case ADMIN_JOINED, ROOM_CLOSED -> null;
        };
    }

    private static String escapeMarkdown(String s) {
        if (s == null) return "";
        return s.replaceAll("([_*`\\[])", "\\\\$1");
    }
}
