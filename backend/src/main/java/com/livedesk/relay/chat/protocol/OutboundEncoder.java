package com.livedesk.relay.chat.protocol;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.springframework.stereotype.Component;

@Component
public class OutboundEncoder {

    private final ObjectMapper objectMapper;

    public OutboundEncoder(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public ObjectNode toNode(OutboundEvent event) {
        ObjectNode node = objectMapper.createObjectNode();
        node.put("type", event.type());
        event.writeFields(node);
        return node;
    }

    public String encode(OutboundEvent event) throws JsonProcessingException {
        return objectMapper.writeValueAsString(toNode(event));
    }
}
