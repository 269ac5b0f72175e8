package com.linlay.agentbus.stream.bus;

import com.linlay.agentbus.stream.model.BusEventType;

import java.util.EnumMap;
import java.util.Map;
import java.util.Set;

import static com.linlay.agentbus.stream.bus.PayloadSchema.FieldKind.ANY;
import static com.linlay.agentbus.stream.bus.PayloadSchema.FieldKind.BOOLEAN;
import static com.linlay.agentbus.stream.bus.PayloadSchema.FieldKind.ID;
import static com.linlay.agentbus.stream.bus.PayloadSchema.FieldKind.LIST;
import static com.linlay.agentbus.stream.bus.PayloadSchema.FieldKind.MAP;
import static com.linlay.agentbus.stream.bus.PayloadSchema.FieldKind.NUMBER;
import static com.linlay.agentbus.stream.bus.PayloadSchema.FieldKind.STRING;

/**
 * Payload schema registry, one entry per {@link BusEventType}.
 */
public final class BusEventSchemas {

    public static final Set<String> WORKFLOW_STEP_STATUSES = Set.of("success", "error", "skipped");

    private static final PayloadSchema TASK_ITEM = PayloadSchema.builder()
            .required("id", ID)
            .required("title", STRING)
            .required("status", STRING)
            .optional("blockedBy", LIST)
            .build();

    private static final PayloadSchema OPTION_ITEM = PayloadSchema.builder()
            .required("label", STRING)
            .required("value", STRING)
            .optional("description", STRING)
            .build();

    private static final Map<BusEventType, PayloadSchema> SCHEMAS = buildSchemas();

    private BusEventSchemas() {
    }

    public static PayloadSchema schemaFor(BusEventType type) {
        PayloadSchema schema = SCHEMAS.get(type);
        if (schema == null) {
            throw new IllegalStateException("No payload schema registered for " + type);
        }
        return schema;
    }

    private static Map<BusEventType, PayloadSchema> buildSchemas() {
        Map<BusEventType, PayloadSchema> schemas = new EnumMap<>(BusEventType.class);
        schemas.put(BusEventType.TEXT_DELTA, PayloadSchema.builder()
                .required("delta", STRING)
                .required("messageId", ID)
                .optional("agentId", ID)
                .build());
        schemas.put(BusEventType.TEXT_COMPLETE, PayloadSchema.builder()
                .required("messageId", ID)
                .required("fullText", STRING)
                .optional("agentId", ID)
                .build());
        schemas.put(BusEventType.THINKING_DELTA, PayloadSchema.builder()
                .required("delta", STRING)
                .required("sourceKey", ID)
                .required("messageId", ID)
                .optional("agentId", ID)
                .build());
        schemas.put(BusEventType.THINKING_COMPLETE, PayloadSchema.builder()
                .required("sourceKey", ID)
                .required("durationMs", NUMBER)
                .optional("agentId", ID)
                .build());
        schemas.put(BusEventType.TOOL_START, PayloadSchema.builder()
                .required("toolId", ID)
                .required("toolName", STRING)
                .required("toolInput", MAP)
                .optional("providerCorrelationId", ID)
                .optional("parentAgentId", ID)
                .build());
        schemas.put(BusEventType.TOOL_PARTIAL_RESULT, PayloadSchema.builder()
                .required("toolId", ID)
                .required("partialOutput", STRING)
                .build());
        schemas.put(BusEventType.TOOL_COMPLETE, PayloadSchema.builder()
                .required("toolId", ID)
                .required("toolName", STRING)
                .required("success", BOOLEAN)
                .optional("toolResult", ANY)
                .optional("toolInput", MAP)
                .optional("error", STRING)
                .optional("providerCorrelationId", ID)
                .optional("parentAgentId", ID)
                .build());
        schemas.put(BusEventType.AGENT_START, PayloadSchema.builder()
                .required("agentId", ID)
                .required("agentType", STRING)
                .required("task", STRING)
                .required("isBackground", BOOLEAN)
                .optional("providerCorrelationId", ID)
                .build());
        schemas.put(BusEventType.AGENT_UPDATE, PayloadSchema.builder()
                .required("agentId", ID)
                .optional("currentTool", STRING)
                .optional("toolUses", NUMBER)
                .build());
        schemas.put(BusEventType.AGENT_COMPLETE, PayloadSchema.builder()
                .required("agentId", ID)
                .required("success", BOOLEAN)
                .optional("result", ANY)
                .optional("error", STRING)
                .build());
        schemas.put(BusEventType.SESSION_START, PayloadSchema.builder()
                .optional("config", MAP)
                .build());
        schemas.put(BusEventType.SESSION_IDLE, PayloadSchema.builder()
                .optional("reason", STRING)
                .build());
        schemas.put(BusEventType.SESSION_ERROR, PayloadSchema.builder()
                .required("error", STRING)
                .optional("code", STRING)
                .optional("recoverable", BOOLEAN)
                .build());
        schemas.put(BusEventType.SESSION_RETRY, PayloadSchema.builder()
                .required("attempt", NUMBER)
                .required("delayMs", NUMBER)
                .required("message", STRING)
                .required("nextRetryAt", NUMBER)
                .build());
        schemas.put(BusEventType.SESSION_INFO, PayloadSchema.builder()
                .required("infoType", STRING)
                .required("message", STRING)
                .build());
        schemas.put(BusEventType.SESSION_WARNING, PayloadSchema.builder()
                .required("warningType", STRING)
                .required("message", STRING)
                .build());
        schemas.put(BusEventType.TURN_START, PayloadSchema.builder()
                .required("turnId", ID)
                .build());
        schemas.put(BusEventType.TURN_END, PayloadSchema.builder()
                .required("turnId", ID)
                .build());
        schemas.put(BusEventType.WORKFLOW_STEP_START, PayloadSchema.builder()
                .required("workflowId", ID)
                .required("nodeId", ID)
                .required("nodeName", STRING)
                .build());
        schemas.put(BusEventType.WORKFLOW_STEP_COMPLETE, PayloadSchema.builder()
                .required("workflowId", ID)
                .required("nodeId", ID)
                .requiredOneOf("status", WORKFLOW_STEP_STATUSES)
                .optional("result", ANY)
                .build());
        schemas.put(BusEventType.WORKFLOW_TASK_UPDATE, PayloadSchema.builder()
                .required("workflowId", ID)
                .requiredList("tasks", TASK_ITEM)
                .build());
        schemas.put(BusEventType.PERMISSION_REQUESTED, PayloadSchema.builder()
                .required("requestId", ID)
                .required("toolName", STRING)
                .required("question", STRING)
                .requiredList("options", OPTION_ITEM)
                .optional("toolInput", MAP)
                .optional("header", STRING)
                .optional("multiSelect", BOOLEAN)
                .optional("toolCallId", ID)
                .build());
        schemas.put(BusEventType.HUMAN_INPUT_REQUIRED, PayloadSchema.builder()
                .required("requestId", ID)
                .required("question", STRING)
                .required("nodeId", ID)
                .optional("header", STRING)
                .optionalList("options", OPTION_ITEM)
                .build());
        schemas.put(BusEventType.SKILL_INVOKED, PayloadSchema.builder()
                .required("skillName", STRING)
                .optional("skillPath", STRING)
                .build());
        schemas.put(BusEventType.USAGE, PayloadSchema.builder()
                .required("inputTokens", NUMBER)
                .required("outputTokens", NUMBER)
                .optional("model", STRING)
                .optional("agentId", ID)
                .build());
        for (BusEventType type : BusEventType.values()) {
            if (!schemas.containsKey(type)) {
                throw new IllegalStateException("Missing payload schema for " + type);
            }
        }
        return schemas;
    }
}
