package com.linlay.agentbus.stream.model;

import java.util.Arrays;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

public enum BusEventType {

    TEXT_DELTA("stream.text.delta"),
    TEXT_COMPLETE("stream.text.complete"),
    THINKING_DELTA("stream.thinking.delta"),
    THINKING_COMPLETE("stream.thinking.complete"),
    TOOL_START("stream.tool.start"),
    TOOL_PARTIAL_RESULT("stream.tool.partial_result"),
    TOOL_COMPLETE("stream.tool.complete"),
    AGENT_START("stream.agent.start"),
    AGENT_UPDATE("stream.agent.update"),
    AGENT_COMPLETE("stream.agent.complete"),
    SESSION_START("stream.session.start"),
    SESSION_IDLE("stream.session.idle"),
    SESSION_ERROR("stream.session.error"),
    SESSION_RETRY("stream.session.retry"),
    SESSION_INFO("stream.session.info"),
    SESSION_WARNING("stream.session.warning"),
    TURN_START("stream.turn.start"),
    TURN_END("stream.turn.end"),
    WORKFLOW_STEP_START("workflow.step.start"),
    WORKFLOW_STEP_COMPLETE("workflow.step.complete"),
    WORKFLOW_TASK_UPDATE("workflow.task.update"),
    PERMISSION_REQUESTED("stream.permission.requested"),
    HUMAN_INPUT_REQUIRED("stream.human_input_required"),
    SKILL_INVOKED("stream.skill.invoked"),
    USAGE("stream.usage");

    private static final Map<String, BusEventType> BY_WIRE_NAME = Arrays.stream(values())
            .collect(Collectors.toUnmodifiableMap(BusEventType::wireName, Function.identity()));

    private final String wireName;

    BusEventType(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    /**
     * Text and thinking deltas carry no identity and are never coalesced or dropped.
     */
    public boolean isDelta() {
        return this == TEXT_DELTA || this == THINKING_DELTA;
    }

    public static BusEventType fromWireName(String wireName) {
        BusEventType type = wireName == null ? null : BY_WIRE_NAME.get(wireName);
        if (type == null) {
            throw new IllegalArgumentException("Unknown bus event type: " + wireName);
        }
        return type;
    }
}
