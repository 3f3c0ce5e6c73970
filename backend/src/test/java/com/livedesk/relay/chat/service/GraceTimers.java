package com.livedesk.relay.chat.service;

/**
 * Read access to armed grace timers for tests outside this package.
 */
public final class GraceTimers {

    private GraceTimers() {
    }

    public static boolean isArmed(ReconnectionSupervisor supervisor, String roomId) {
        return supervisor.isArmed(roomId);
    }

    public static int armedCount(ReconnectionSupervisor supervisor) {
        return supervisor.armedCount();
    }
}
