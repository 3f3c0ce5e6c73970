package com.livedesk.relay.chat.room;

public enum Role {
    VISITOR,
    ADMIN
}
