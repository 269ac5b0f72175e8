package com.linlay.agentbus.stream.model;

import java.util.Objects;

/**
 * A bus event annotated with the correlation verdict of the flush it was delivered in.
 * Only produced downstream of the dispatcher and never published back onto the bus.
 */
public record EnrichedBusEvent(
        BusEvent event,
        String resolvedToolId,
        String resolvedAgentId,
        boolean subagentTool,
        boolean suppressFromOutput,
        boolean owned
) {

    public EnrichedBusEvent {
        Objects.requireNonNull(event, "event must not be null");
    }

    public BusEventType type() {
        return event.type();
    }

    public String sessionId() {
        return event.sessionId();
    }

    public long runId() {
        return event.runId();
    }
}
