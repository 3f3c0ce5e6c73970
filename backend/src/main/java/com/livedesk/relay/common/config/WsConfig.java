package com.livedesk.relay.common.config;

import com.livedesk.relay.chat.ws.WsHandler;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.socket.config.annotation.EnableWebSocket;
import org.springframework.web.socket.config.annotation.WebSocketConfigurer;
import org.springframework.web.socket.config.annotation.WebSocketHandlerRegistry;

import java.util.LinkedHashSet;
import java.util.Set;

@Configuration
@EnableWebSocket
public class WsConfig implements WebSocketConfigurer {

    private final WsHandler wsHandler;
    private final String path;
    private final Set<String> allowedOrigins;

    public WsConfig(
            WsHandler wsHandler,
            @Value("${app.ws.path:/ws}") String path,
            @Value("${app.ws.allowed-origins:*}") String allowedOriginsCsv
    ) {
        this.wsHandler = wsHandler;
        this.path = (path == null || path.isBlank()) ? "/ws" : path.trim();
        this.allowedOrigins = parseCsv(allowedOriginsCsv);
    }

    @Override
    public void registerWebSocketHandlers(WebSocketHandlerRegistry registry) {
        var registration = registry.addHandler(wsHandler, path);
        if (!allowedOrigins.isEmpty()) {
            registration.setAllowedOriginPatterns(allowedOrigins.toArray(new String[0]));
        }
    }

    private static Set<String> parseCsv(String csv) {
        var out = new LinkedHashSet<String>();
        if (csv == null || csv.isBlank()) return out;
        for (var raw : csv.split(",")) {
            var t = raw == null ? "" : raw.trim();
            if (!t.isBlank()) out.add(t);
        }
        return out;
    }
}
