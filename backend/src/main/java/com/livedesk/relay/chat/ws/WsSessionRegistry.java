package com.livedesk.relay.chat.ws;

import com.livedesk.relay.chat.room.Role;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Live connection id to display name and role. Entries exist from transport connect to
 * transport close; {@code displayName} and {@code role} are null until a JOIN succeeds.
 */
@Component
public class WsSessionRegistry {

    public record ConnectionContext(String connectionId, String displayName, Role role) {
        public boolean authenticated() {
            return role != null;
        }

        public boolean isAdmin() {
            return role == Role.ADMIN;
        }
    }

    private final Map<String, ConnectionContext> sessions = new ConcurrentHashMap<>();

    public void open(String connectionId) {
        sessions.putIfAbsent(connectionId, new ConnectionContext(connectionId, null, null));
    }

    public void register(String connectionId, String displayName, Role role) {
        sessions.put(connectionId, new ConnectionContext(connectionId, displayName, role));
    }

    public Optional<ConnectionContext> lookup(String connectionId) {
        if (connectionId == null) return Optional.empty();
        return Optional.ofNullable(sessions.get(connectionId));
    }

    public void unregister(String connectionId) {
        if (connectionId == null) return;
        sessions.remove(connectionId);
    }

    public List<String> adminConnectionIds() {
        return sessions.values().stream()
                .filter(ConnectionContext::isAdmin)
                .map(ConnectionContext::connectionId)
                .toList();
    }

    public int size() {
        return sessions.size();
    }
}
