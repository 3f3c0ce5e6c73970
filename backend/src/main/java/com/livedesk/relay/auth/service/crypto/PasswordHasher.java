package com.livedesk.relay.auth.service.crypto;

import org.springframework.security.crypto.bcrypt.BCryptPasswordEncoder;
import org.springframework.stereotype.Component;

@Component
public class PasswordHasher {
    private final BCryptPasswordEncoder encoder = new BCryptPasswordEncoder();

    public String hash(String raw) {
        return encoder.encode(raw);
    }

    /**
     * Constant-time BCrypt check. Returns false for a blank hash or a malformed one.
     */
    public boolean matches(String raw, String hash) {
        if (raw == null || raw.isEmpty() || hash == null || hash.isBlank()) return false;
        return encoder.matches(raw, hash.trim());
    }
}
