package com.linlay.agentbus.stream.adapter;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.NullNode;

public record NativeEvent(String type, String sessionId, JsonNode data) {

    public NativeEvent {
        if (type == null || type.isBlank()) {
            throw new IllegalArgumentException("type must not be null or blank");
        }
        if (data == null) {
            data = NullNode.getInstance();
        }
    }
}
