package com.livedesk.relay.auth.service;

import com.livedesk.relay.auth.service.crypto.PasswordHasher;
import com.livedesk.relay.chat.service.ChatException;
import com.livedesk.relay.chat.service.ChatFailure;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

/**
 * Decides whether a join request becomes an admin session. Each attempt stands alone; there is
 * no lockout or backoff, and nothing limits how many admin sessions may be open at once.
 */
@Service
public class AdminGate {

    private static final Logger log = LoggerFactory.getLogger(AdminGate.class);

    private final PasswordHasher passwordHasher;
    private final String adminUsername;
    private final String adminPasswordHash;

    public AdminGate(
            PasswordHasher passwordHasher,
            @Value("${app.admin.username:DARK}") String adminUsername,
            @Value("${app.admin.password-hash:}") String adminPasswordHash
    ) {
        this.passwordHasher = passwordHasher;
        this.adminUsername = adminUsername == null ? "" : adminUsername.trim();
        this.adminPasswordHash = adminPasswordHash == null ? "" : adminPasswordHash.trim();
        if (this.adminPasswordHash.isEmpty()) {
            log.warn("admin_password_hash_not_configured adminUsername={}", this.adminUsername);
        }
    }

    public boolean isAdminName(String claimedName) {
        return !adminUsername.isEmpty() && adminUsername.equals(claimedName);
    }

    /**
     * @throws ChatException with {@link ChatFailure#AUTHENTICATION} when the name or credential is wrong
     */
    public void authenticate(String claimedName, String credential) {
        if (!isAdminName(claimedName)) {
            throw new ChatException(ChatFailure.AUTHENTICATION, "not_admin", "Invalid credentials. Access denied.");
        }
        if (!passwordHasher.matches(credential, adminPasswordHash)) {
            throw new ChatException(ChatFailure.AUTHENTICATION, "invalid_credentials", "Invalid credentials. Access denied.");
        }
    }
}
