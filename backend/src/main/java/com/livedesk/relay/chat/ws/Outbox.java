package com.livedesk.relay.chat.ws;

import com.livedesk.relay.chat.protocol.OutboundEvent;

/**
 * Best-effort delivery to a single live connection. Implementations never throw on a closed
 * or unknown connection.
 */
public interface Outbox {

    void send(String connectionId, OutboundEvent event);

    void close(String connectionId);
}
