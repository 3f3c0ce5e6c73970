package com.livedesk.relay.chat.room;

import org.springframework.stereotype.Component;

import java.util.UUID;

/**
 * Short random room ids. Uniqueness against live rooms is checked by the caller.
 */
@Component
public class RoomIdGenerator {

    public String next() {
        return UUID.randomUUID().toString().substring(0, 8);
    }
}
