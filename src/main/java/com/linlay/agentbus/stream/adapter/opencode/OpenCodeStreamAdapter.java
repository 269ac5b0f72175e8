package com.linlay.agentbus.stream.adapter.opencode;

import com.fasterxml.jackson.databind.JsonNode;
import com.linlay.agentbus.stream.adapter.AbstractStreamAdapter;
import com.linlay.agentbus.stream.adapter.ProviderSession;
import com.linlay.agentbus.stream.adapter.StreamOptions;
import com.linlay.agentbus.stream.adapter.StreamRetryPolicy;
import com.linlay.agentbus.stream.bus.EventBus;
import com.linlay.agentbus.stream.model.BusEventType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static com.linlay.agentbus.stream.adapter.JsonPayloads.flag;
import static com.linlay.agentbus.stream.adapter.JsonPayloads.hasText;
import static com.linlay.agentbus.stream.adapter.JsonPayloads.longValue;
import static com.linlay.agentbus.stream.adapter.JsonPayloads.path;
import static com.linlay.agentbus.stream.adapter.JsonPayloads.resultText;
import static com.linlay.agentbus.stream.adapter.JsonPayloads.text;
import static com.linlay.agentbus.stream.adapter.JsonPayloads.toMap;

/**
 * Pull adapter for the OpenCode event stream. Each item is {@code {"type": ..., "properties": {...}}};
 * items belonging to other sessions are skipped.
 */
public class OpenCodeStreamAdapter extends AbstractStreamAdapter {

    private static final Logger log = LoggerFactory.getLogger(OpenCodeStreamAdapter.class);

    private static final List<Map<String, Object>> PERMISSION_OPTIONS = List.of(
            Map.of("label", "Allow once", "value", "once"),
            Map.of("label", "Always allow", "value", "always"),
            Map.of("label", "Reject", "value", "reject")
    );

    private final Map<String, String> toolStatusById = new HashMap<>();
    private final Map<String, String> agentIdByCallId = new HashMap<>();
    private final Set<String> completedReasoning = new HashSet<>();
    private long inputTokens;
    private long outputTokens;

    public OpenCodeStreamAdapter(EventBus eventBus) {
        this(eventBus, new StreamRetryPolicy());
    }

    public OpenCodeStreamAdapter(EventBus eventBus, StreamRetryPolicy retryPolicy) {
        super(eventBus, retryPolicy);
    }

    @Override
    public Mono<Void> startStreaming(ProviderSession session, String input, StreamOptions options) {
        return Mono.defer(() -> {
            beginTurn(session.id(), options);
            resetTurnState();
            Map<String, Object> config = new LinkedHashMap<>();
            putIfNonNull(config, "agent", options.agentType());
            publishSessionStart(config);
            return nativeStream(session, input, options)
                    .doOnNext(this::handle)
                    .then(Mono.fromRunnable(this::completeTurn))
                    .onErrorResume(this::failTurn)
                    .then();
        });
    }

    private void handle(JsonNode item) {
        if (isCancelled()) {
            return;
        }
        String type = text(item, "type");
        JsonNode properties = path(item, "properties");
        if (type == null || properties == null) {
            log.debug("Skipping OpenCode item without type or properties");
            return;
        }
        if (!belongsToSession(properties)) {
            return;
        }
        switch (type) {
            case "message.part.updated" -> onPartUpdated(properties);
            case "session.idle" -> {
                Map<String, Object> data = new LinkedHashMap<>();
                data.put("reason", "idle");
                publish(BusEventType.SESSION_IDLE, data);
            }
            case "session.error" -> onSessionError(properties);
            case "permission.updated" -> onPermission(properties);
            default -> log.trace("Ignoring OpenCode event {}", type);
        }
    }

    private boolean belongsToSession(JsonNode properties) {
        String owner = text(properties, "sessionID");
        if (owner == null) {
            owner = text(properties, "part", "sessionID");
        }
        return owner == null || owner.equals(sessionId());
    }

    private void onPartUpdated(JsonNode properties) {
        JsonNode part = path(properties, "part");
        String partType = text(part, "type");
        if (partType == null) {
            return;
        }
        switch (partType) {
            case "text" -> publishTextDelta(text(properties, "delta"), null);
            case "reasoning" -> onReasoning(part, text(properties, "delta"));
            case "tool" -> onTool(part);
            case "subtask" -> onSubtask(part);
            case "step-finish" -> onStepFinish(part);
            default -> log.trace("Ignoring OpenCode part {}", partType);
        }
    }

    private void onReasoning(JsonNode part, String delta) {
        String sourceKey = hasText(text(part, "id")) ? text(part, "id") : "reasoning";
        if (delta != null && !delta.isEmpty()) {
            Map<String, Object> data = new LinkedHashMap<>();
            data.put("delta", delta);
            data.put("sourceKey", sourceKey);
            data.put("messageId", messageId());
            publish(BusEventType.THINKING_DELTA, data);
        }
        if (path(part, "time", "end") != null && completedReasoning.add(sourceKey)) {
            long start = longValue(part, "time", "start");
            long end = longValue(part, "time", "end");
            Map<String, Object> data = new LinkedHashMap<>();
            data.put("sourceKey", sourceKey);
            data.put("durationMs", Math.max(0L, end - start));
            publish(BusEventType.THINKING_COMPLETE, data);
        }
    }

    private void onTool(JsonNode part) {
        String callId = text(part, "callID");
        String toolName = text(part, "tool");
        String status = text(part, "state", "status");
        if (!hasText(callId) || toolName == null || status == null) {
            return;
        }
        String previous = toolStatusById.put(callId, status);
        if (status.equals(previous)) {
            return;
        }
        Map<String, Object> toolInput = toMap(path(part, "state", "input"));
        switch (status) {
            case "pending", "running" -> {
                Map<String, Object> data = new LinkedHashMap<>();
                data.put("toolId", callId);
                data.put("toolName", toolName);
                data.put("toolInput", toolInput);
                data.put("providerCorrelationId", callId);
                publish(BusEventType.TOOL_START, data);
            }
            case "completed", "error" -> {
                boolean success = "completed".equals(status);
                String agentId = agentIdByCallId.remove(callId);
                if (agentId != null) {
                    completeSubtask(agentId, part, success);
                }
                Map<String, Object> data = new LinkedHashMap<>();
                data.put("toolId", callId);
                data.put("toolName", toolName);
                data.put("success", success);
                putIfNonNull(data, "toolResult", resultText(path(part, "state", "output")));
                data.put("toolInput", toolInput);
                if (!success) {
                    putIfNonNull(data, "error", text(part, "state", "error"));
                }
                data.put("providerCorrelationId", callId);
                publish(BusEventType.TOOL_COMPLETE, data);
            }
            default -> log.trace("Ignoring tool status {}", status);
        }
    }

    private void onSubtask(JsonNode part) {
        String agentId = text(part, "id");
        if (!hasText(agentId)) {
            return;
        }
        String description = text(part, "description");
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("agentId", agentId);
        data.put("agentType", hasText(text(part, "agent")) ? text(part, "agent") : "general");
        data.put("task", description != null ? description : (text(part, "prompt") == null ? "" : text(part, "prompt")));
        data.put("isBackground", flag(part, "background"));
        String callId = text(part, "callID");
        if (hasText(callId)) {
            data.put("providerCorrelationId", callId);
            agentIdByCallId.put(callId, agentId);
        }
        publish(BusEventType.AGENT_START, data);
    }

    /**
     * Subtasks have no completion part of their own; they finish with the dispatch tool that spawned them.
     */
    private void completeSubtask(String agentId, JsonNode toolPart, boolean success) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("agentId", agentId);
        data.put("success", success);
        putIfNonNull(data, "result", resultText(path(toolPart, "state", "output")));
        if (!success) {
            putIfNonNull(data, "error", text(toolPart, "state", "error"));
        }
        publish(BusEventType.AGENT_COMPLETE, data);
    }

    private void onStepFinish(JsonNode part) {
        JsonNode tokens = path(part, "tokens");
        if (tokens == null) {
            return;
        }
        inputTokens += longValue(tokens, "input");
        outputTokens += longValue(tokens, "output");
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("inputTokens", inputTokens);
        data.put("outputTokens", outputTokens);
        putIfNonNull(data, "model", text(part, "modelID"));
        publish(BusEventType.USAGE, data);
    }

    private void onSessionError(JsonNode properties) {
        JsonNode error = path(properties, "error");
        String message = text(error, "data", "message");
        if (message == null) {
            message = text(error, "message");
        }
        if (message == null) {
            message = text(error, "name");
        }
        publishSessionError(message, text(error, "name"), false);
    }

    private void onPermission(JsonNode properties) {
        String requestId = text(properties, "id");
        if (!hasText(requestId)) {
            return;
        }
        String title = text(properties, "title");
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("requestId", requestId);
        data.put("toolName", hasText(text(properties, "type")) ? text(properties, "type") : "unknown");
        data.put("question", title != null ? title : "Allow this action?");
        data.put("options", PERMISSION_OPTIONS);
        Map<String, Object> metadata = toMap(path(properties, "metadata"));
        putIfNonNull(data, "toolInput", metadata.isEmpty() ? null : metadata);
        putIfNonNull(data, "toolCallId", hasText(text(properties, "callID")) ? text(properties, "callID") : null);
        publish(BusEventType.PERMISSION_REQUESTED, data);
    }

    private void resetTurnState() {
        toolStatusById.clear();
        agentIdByCallId.clear();
        completedReasoning.clear();
        inputTokens = 0;
        outputTokens = 0;
    }
}
