package com.linlay.agentbus.stream.service;

import com.linlay.agentbus.stream.model.BusEvent;

public final class CoalescingKeys {

    private CoalescingKeys() {
    }

    /**
     * Returns the key under which a newer event replaces an older pending one,
     * or {@code null} when the event must always be delivered.
     */
    public static String keyOf(BusEvent event) {
        if (event == null) {
            return null;
        }
        return switch (event.type()) {
            case TOOL_START -> key("tool-start", event.string("toolId"));
            case TOOL_COMPLETE -> key("tool-complete", event.string("toolId"));
            case AGENT_START -> key("agent-start", event.string("agentId"));
            case AGENT_UPDATE -> key("agent-update", event.string("agentId"));
            case SESSION_START -> key("session-start", event.sessionId());
            case SESSION_IDLE -> key("session-idle", event.sessionId());
            case SESSION_ERROR -> key("session-error", event.sessionId());
            case USAGE -> key("usage", event.sessionId());
            case WORKFLOW_TASK_UPDATE -> key("workflow-tasks", event.string("workflowId"));
            case TEXT_COMPLETE -> key("text-complete", event.string("messageId"));
            default -> null;
        };
    }

    private static String key(String prefix, String id) {
        if (id == null || id.isBlank()) {
            return null;
        }
        return prefix + ":" + id;
    }
}
