package com.linlay.agentbus.stream.adapter.copilot;

import com.fasterxml.jackson.databind.JsonNode;
import com.linlay.agentbus.stream.adapter.AbstractPushStreamAdapter;
import com.linlay.agentbus.stream.adapter.NativeEvent;
import com.linlay.agentbus.stream.adapter.ProviderEventSource;
import com.linlay.agentbus.stream.adapter.ProviderSession;
import com.linlay.agentbus.stream.adapter.PushSettings;
import com.linlay.agentbus.stream.adapter.StreamOptions;
import com.linlay.agentbus.stream.adapter.StreamRetryPolicy;
import com.linlay.agentbus.stream.bus.EventBus;
import com.linlay.agentbus.stream.model.BusEventType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

import static com.linlay.agentbus.stream.adapter.JsonPayloads.hasText;
import static com.linlay.agentbus.stream.adapter.JsonPayloads.longValue;
import static com.linlay.agentbus.stream.adapter.JsonPayloads.path;
import static com.linlay.agentbus.stream.adapter.JsonPayloads.resultText;
import static com.linlay.agentbus.stream.adapter.JsonPayloads.text;
import static com.linlay.agentbus.stream.adapter.JsonPayloads.toMap;

/**
 * Push adapter for the Copilot session emitter. The session stream only drives the turn;
 * content arrives through the listener.
 * <p>
 * A sub-agent is identified by the tool call that launched it, which also serves as the
 * correlation token for its agent-start and as the parent of its own tool calls.
 */
public class CopilotStreamAdapter extends AbstractPushStreamAdapter {

    private static final Logger log = LoggerFactory.getLogger(CopilotStreamAdapter.class);

    private final Map<String, String> toolNameById = new ConcurrentHashMap<>();
    private final Map<String, Long> reasoningStartedAt = new ConcurrentHashMap<>();
    private long inputTokens;
    private long outputTokens;

    public CopilotStreamAdapter(EventBus eventBus, ProviderEventSource eventSource) {
        this(eventBus, eventSource, PushSettings.defaults(), new StreamRetryPolicy());
    }

    public CopilotStreamAdapter(
            EventBus eventBus,
            ProviderEventSource eventSource,
            PushSettings settings,
            StreamRetryPolicy retryPolicy
    ) {
        super(eventBus, eventSource, settings, retryPolicy);
    }

    @Override
    public Mono<Void> startStreaming(ProviderSession session, String input, StreamOptions options) {
        return Mono.defer(() -> {
            beginTurn(session.id(), options);
            resetTurnState();
            openTurn();
            publishSessionStart(null);
            Mono<Void> turn = nativeStream(session, input, options)
                    .then(Mono.<Void>fromRunnable(this::completeTurn))
                    .onErrorResume(this::failTurn);
            return finishTurn(turn);
        });
    }

    @Override
    protected void onNativeEvent(NativeEvent event) {
        if (!acceptsEvent(event)) {
            return;
        }
        JsonNode data = event.data();
        switch (event.type()) {
            case "assistant.message_delta" ->
                    publishTextDelta(text(data, "deltaContent"), emptyToNull(text(data, "parentToolCallId")));
            case "assistant.reasoning_delta" -> onReasoningDelta(data);
            case "assistant.reasoning", "assistant.message" -> completeReasoning(text(data, "reasoningId"));
            case "tool.execution_start" -> onToolStart(data);
            case "tool.execution_partial_result" -> onToolPartialResult(data);
            case "tool.execution_complete" -> onToolComplete(data);
            case "subagent.started" -> onSubagentStarted(data);
            case "subagent.completed" -> onSubagentFinished(data, true);
            case "subagent.failed" -> onSubagentFinished(data, false);
            case "assistant.usage" -> onUsage(data);
            case "session.idle" -> {
                Map<String, Object> payload = new LinkedHashMap<>();
                payload.put("reason", "idle");
                publish(BusEventType.SESSION_IDLE, payload);
            }
            case "session.error" -> publishSessionError(text(data, "message"), text(data, "errorType"), false);
            default -> log.trace("Ignoring Copilot event {}", event.type());
        }
    }

    private void onReasoningDelta(JsonNode data) {
        String delta = text(data, "deltaContent");
        if (delta == null || delta.isEmpty()) {
            return;
        }
        String sourceKey = hasText(text(data, "reasoningId")) ? text(data, "reasoningId") : "reasoning";
        reasoningStartedAt.putIfAbsent(sourceKey, System.currentTimeMillis());
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("delta", delta);
        payload.put("sourceKey", sourceKey);
        payload.put("messageId", messageId());
        publish(BusEventType.THINKING_DELTA, payload);
    }

    private void completeReasoning(String reasoningId) {
        if (hasText(reasoningId)) {
            completeReasoningBlock(reasoningId);
            return;
        }
        for (String sourceKey : reasoningStartedAt.keySet()) {
            completeReasoningBlock(sourceKey);
        }
    }

    private void completeReasoningBlock(String sourceKey) {
        Long startedAt = reasoningStartedAt.remove(sourceKey);
        if (startedAt == null) {
            return;
        }
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("sourceKey", sourceKey);
        payload.put("durationMs", Math.max(0L, System.currentTimeMillis() - startedAt));
        publish(BusEventType.THINKING_COMPLETE, payload);
    }

    private void onToolStart(JsonNode data) {
        String toolCallId = text(data, "toolCallId");
        String toolName = text(data, "toolName");
        if (!hasText(toolCallId) || toolName == null) {
            return;
        }
        toolNameById.put(toolCallId, toolName);
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("toolId", toolCallId);
        payload.put("toolName", toolName);
        payload.put("toolInput", toMap(path(data, "arguments")));
        payload.put("providerCorrelationId", toolCallId);
        putIfNonNull(payload, "parentAgentId", emptyToNull(text(data, "parentToolCallId")));
        publish(BusEventType.TOOL_START, payload);
    }

    private void onToolPartialResult(JsonNode data) {
        String toolCallId = text(data, "toolCallId");
        String partialOutput = text(data, "partialOutput");
        if (!hasText(toolCallId) || partialOutput == null) {
            return;
        }
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("toolId", toolCallId);
        payload.put("partialOutput", partialOutput);
        publish(BusEventType.TOOL_PARTIAL_RESULT, payload);
    }

    private void onToolComplete(JsonNode data) {
        String toolCallId = text(data, "toolCallId");
        if (!hasText(toolCallId)) {
            return;
        }
        String toolName = toolNameById.remove(toolCallId);
        boolean success = !data.has("success") || data.get("success").asBoolean();
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("toolId", toolCallId);
        payload.put("toolName", toolName != null ? toolName : "unknown");
        payload.put("success", success);
        JsonNode result = path(data, "result", "content");
        putIfNonNull(payload, "toolResult", resultText(result != null ? result : path(data, "result")));
        if (!success) {
            String error = text(data, "error", "message");
            putIfNonNull(payload, "error", error != null ? error : text(data, "error"));
        }
        payload.put("providerCorrelationId", toolCallId);
        putIfNonNull(payload, "parentAgentId", emptyToNull(text(data, "parentToolCallId")));
        publish(BusEventType.TOOL_COMPLETE, payload);
    }

    private void onSubagentStarted(JsonNode data) {
        String toolCallId = text(data, "toolCallId");
        if (!hasText(toolCallId)) {
            return;
        }
        String agentName = text(data, "agentName");
        String description = text(data, "agentDescription");
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("agentId", toolCallId);
        payload.put("agentType", agentName != null ? agentName : "general");
        payload.put("task", description != null ? description : "");
        payload.put("isBackground", "background".equals(text(data, "mode")));
        payload.put("providerCorrelationId", toolCallId);
        publish(BusEventType.AGENT_START, payload);
    }

    private void onSubagentFinished(JsonNode data, boolean success) {
        String toolCallId = text(data, "toolCallId");
        if (!hasText(toolCallId)) {
            return;
        }
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("agentId", toolCallId);
        payload.put("success", success);
        putIfNonNull(payload, "result", resultText(path(data, "result")));
        if (!success) {
            putIfNonNull(payload, "error", text(data, "error"));
        }
        publish(BusEventType.AGENT_COMPLETE, payload);
    }

    private synchronized void onUsage(JsonNode data) {
        inputTokens += longValue(data, "inputTokens");
        outputTokens += longValue(data, "outputTokens");
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("inputTokens", inputTokens);
        payload.put("outputTokens", outputTokens);
        putIfNonNull(payload, "model", text(data, "model"));
        publish(BusEventType.USAGE, payload);
    }

    private synchronized void resetTurnState() {
        toolNameById.clear();
        reasoningStartedAt.clear();
        inputTokens = 0;
        outputTokens = 0;
    }

    private static String emptyToNull(String value) {
        return hasText(value) ? value : null;
    }
}
