package com.livedesk.relay.auth.service.crypto;

/**
 * Prints a BCrypt hash suitable for {@code ADMIN_PASSWORD_HASH}.
 * <pre>java -cp livedesk-backend.jar com.livedesk.relay.auth.service.crypto.PasswordHashCli 'secret'</pre>
 */
public final class PasswordHashCli {

    private PasswordHashCli() {
    }

    public static void main(String[] args) {
        if (args.length != 1 || args[0].isBlank()) {
            System.err.println("usage: PasswordHashCli <password>");
            System.exit(2);
            return;
        }
        System.out.println(new PasswordHasher().hash(args[0]));
    }
}
