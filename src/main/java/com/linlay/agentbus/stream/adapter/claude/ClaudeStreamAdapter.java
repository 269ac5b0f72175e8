package com.linlay.agentbus.stream.adapter.claude;

import com.fasterxml.jackson.databind.JsonNode;
import com.linlay.agentbus.stream.adapter.AbstractPushStreamAdapter;
import com.linlay.agentbus.stream.adapter.NativeEvent;
import com.linlay.agentbus.stream.adapter.ProviderEventSource;
import com.linlay.agentbus.stream.adapter.ProviderSession;
import com.linlay.agentbus.stream.adapter.PushSettings;
import com.linlay.agentbus.stream.adapter.StreamOptions;
import com.linlay.agentbus.stream.adapter.StreamRetryPolicy;
import com.linlay.agentbus.stream.adapter.ToolIdRegistry;
import com.linlay.agentbus.stream.bus.EventBus;
import com.linlay.agentbus.stream.model.BusEventType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

import static com.linlay.agentbus.stream.adapter.JsonPayloads.flag;
import static com.linlay.agentbus.stream.adapter.JsonPayloads.hasText;
import static com.linlay.agentbus.stream.adapter.JsonPayloads.longValue;
import static com.linlay.agentbus.stream.adapter.JsonPayloads.optionalLong;
import static com.linlay.agentbus.stream.adapter.JsonPayloads.path;
import static com.linlay.agentbus.stream.adapter.JsonPayloads.resultText;
import static com.linlay.agentbus.stream.adapter.JsonPayloads.text;
import static com.linlay.agentbus.stream.adapter.JsonPayloads.toMap;

/**
 * Hybrid adapter: message content is pulled from the session stream while sub-agent lifecycle,
 * usage and permission prompts arrive as hook callbacks. Both sources share the turn's queue.
 * <p>
 * The background flag of a sub-agent is only visible on the dispatch tool's input
 * ({@code run_in_background}), so it is remembered by tool-use id until the matching
 * {@code subagent.start} hook arrives.
 */
public class ClaudeStreamAdapter extends AbstractPushStreamAdapter {

    private static final Logger log = LoggerFactory.getLogger(ClaudeStreamAdapter.class);

    private static final Set<String> DISPATCH_TOOL_NAMES = Set.of("Task", "task", "Agent", "agent");

    private final ToolIdRegistry toolIds = new ToolIdRegistry("claude_tool");
    private final Map<String, Boolean> backgroundByToolUseId = new ConcurrentHashMap<>();
    private final Map<String, String> toolNameById = new ConcurrentHashMap<>();
    private final Map<String, Long> thinkingStartedAt = new ConcurrentHashMap<>();

    public ClaudeStreamAdapter(EventBus eventBus, ProviderEventSource hookSource) {
        this(eventBus, hookSource, PushSettings.defaults(), new StreamRetryPolicy());
    }

    public ClaudeStreamAdapter(
            EventBus eventBus,
            ProviderEventSource hookSource,
            PushSettings settings,
            StreamRetryPolicy retryPolicy
    ) {
        super(eventBus, hookSource, settings, retryPolicy);
    }

    @Override
    public Mono<Void> startStreaming(ProviderSession session, String input, StreamOptions options) {
        return Mono.defer(() -> {
            beginTurn(session.id(), options);
            toolIds.clear();
            backgroundByToolUseId.clear();
            toolNameById.clear();
            thinkingStartedAt.clear();
            openTurn();
            publishSessionStart(null);
            Mono<Void> turn = nativeStream(session, input, options)
                    .doOnNext(this::onMessage)
                    .then(Mono.<Void>fromRunnable(this::completeTurn))
                    .onErrorResume(this::failTurn);
            return finishTurn(turn);
        });
    }

    private void onMessage(JsonNode message) {
        if (isCancelled()) {
            return;
        }
        String type = text(message, "type");
        if (type == null) {
            return;
        }
        switch (type) {
            case "text" -> {
                JsonNode content = path(message, "content");
                if (content != null && content.isTextual()) {
                    publishTextDelta(content.asText(), null);
                }
            }
            case "thinking" -> onThinking(message);
            case "tool_use" -> onToolUse(message);
            case "tool_result" -> onToolResult(message);
            default -> log.trace("Ignoring Claude message {}", type);
        }
    }

    private void onThinking(JsonNode message) {
        String sourceKey = text(message, "metadata", "thinkingSourceKey");
        if (!hasText(sourceKey)) {
            sourceKey = "default";
        }
        String delta = text(message, "content");
        if (delta != null && !delta.isEmpty()) {
            thinkingStartedAt.putIfAbsent(sourceKey, System.currentTimeMillis());
            Map<String, Object> data = new LinkedHashMap<>();
            data.put("delta", delta);
            data.put("sourceKey", sourceKey);
            data.put("messageId", messageId());
            publish(BusEventType.THINKING_DELTA, data);
            return;
        }
        Long reported = optionalLong(path(message, "metadata", "streamingStats", "thinkingMs"));
        if (reported == null) {
            return;
        }
        Long startedAt = thinkingStartedAt.remove(sourceKey);
        long durationMs = reported > 0 || startedAt == null ? reported : System.currentTimeMillis() - startedAt;
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("sourceKey", sourceKey);
        data.put("durationMs", durationMs);
        publish(BusEventType.THINKING_COMPLETE, data);
    }

    private void onToolUse(JsonNode message) {
        JsonNode content = path(message, "content");
        String toolName = firstText(text(content, "name"), text(message, "metadata", "toolName"));
        if (toolName == null) {
            toolName = "unknown";
        }
        String explicitId = firstText(text(content, "id"), text(content, "toolUseId"), text(message, "metadata", "toolUseId"));
        String toolId = toolIds.onStart(explicitId, toolName);
        toolNameById.put(toolId, toolName);
        Map<String, Object> toolInput = toMap(path(content, "input"));
        if (DISPATCH_TOOL_NAMES.contains(toolName) && flag(content, "input", "run_in_background")) {
            backgroundByToolUseId.put(toolId, Boolean.TRUE);
        }
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("toolId", toolId);
        data.put("toolName", toolName);
        data.put("toolInput", toolInput);
        data.put("providerCorrelationId", explicitId != null ? explicitId : toolId);
        putIfNonNull(data, "parentAgentId", text(message, "metadata", "parentToolUseId"));
        publish(BusEventType.TOOL_START, data);
    }

    private void onToolResult(JsonNode message) {
        String toolName = firstText(text(message, "metadata", "toolName"), text(message, "toolName"));
        String explicitId = firstText(text(message, "metadata", "toolUseId"), text(message, "toolUseId"));
        String toolId = toolIds.onComplete(explicitId, toolName);
        String startedName = toolNameById.remove(toolId);
        if (toolName == null) {
            toolName = startedName;
        }
        boolean error = flag(message, "metadata", "isError") || flag(message, "isError");
        String result = resultText(path(message, "content"));
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("toolId", toolId);
        data.put("toolName", toolName != null ? toolName : "unknown");
        data.put("success", !error);
        putIfNonNull(data, "toolResult", result);
        if (error) {
            putIfNonNull(data, "error", result);
        }
        data.put("providerCorrelationId", explicitId != null ? explicitId : toolId);
        putIfNonNull(data, "parentAgentId", text(message, "metadata", "parentToolUseId"));
        publish(BusEventType.TOOL_COMPLETE, data);
    }

    @Override
    protected void onNativeEvent(NativeEvent event) {
        if (!acceptsEvent(event)) {
            return;
        }
        JsonNode data = event.data();
        switch (event.type()) {
            case "subagent.start" -> onSubagentStart(data);
            case "subagent.update" -> onSubagentUpdate(data);
            case "subagent.complete" -> onSubagentComplete(data);
            case "usage" -> onUsage(data);
            case "permission.requested" -> onPermission(data);
            default -> log.trace("Ignoring Claude hook {}", event.type());
        }
    }

    private void onSubagentStart(JsonNode data) {
        String agentId = text(data, "agentId");
        if (!hasText(agentId)) {
            return;
        }
        String toolUseId = firstText(text(data, "toolUseId"), text(data, "toolUseID"));
        String task = firstText(text(data, "task"), text(data, "prompt"), text(data, "description"));
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("agentId", agentId);
        payload.put("agentType", hasText(text(data, "agentType")) ? text(data, "agentType") : "general");
        payload.put("task", task != null ? task : "");
        payload.put("isBackground", toolUseId != null && backgroundByToolUseId.getOrDefault(toolUseId, Boolean.FALSE));
        putIfNonNull(payload, "providerCorrelationId", toolUseId);
        publish(BusEventType.AGENT_START, payload);
    }

    private void onSubagentUpdate(JsonNode data) {
        String agentId = text(data, "agentId");
        if (!hasText(agentId)) {
            return;
        }
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("agentId", agentId);
        putIfNonNull(payload, "currentTool", text(data, "currentTool"));
        putIfNonNull(payload, "toolUses", optionalLong(path(data, "toolUses")));
        publish(BusEventType.AGENT_UPDATE, payload);
    }

    private void onSubagentComplete(JsonNode data) {
        String agentId = text(data, "agentId");
        if (!hasText(agentId)) {
            return;
        }
        boolean success = !data.has("success") || data.get("success").asBoolean();
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("agentId", agentId);
        payload.put("success", success);
        putIfNonNull(payload, "result", resultText(path(data, "result")));
        putIfNonNull(payload, "error", text(data, "error"));
        publish(BusEventType.AGENT_COMPLETE, payload);
    }

    private void onUsage(JsonNode data) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("inputTokens", longValue(data, "inputTokens"));
        payload.put("outputTokens", longValue(data, "outputTokens"));
        putIfNonNull(payload, "model", text(data, "model"));
        publish(BusEventType.USAGE, payload);
    }

    private void onPermission(JsonNode data) {
        String requestId = text(data, "requestId");
        if (!hasText(requestId)) {
            return;
        }
        List<Map<String, Object>> options = new ArrayList<>();
        JsonNode optionNodes = path(data, "options");
        if (optionNodes != null && optionNodes.isArray()) {
            for (JsonNode option : optionNodes) {
                String label = text(option, "label");
                if (label == null) {
                    continue;
                }
                Map<String, Object> item = new LinkedHashMap<>();
                item.put("label", label);
                item.put("value", hasText(text(option, "value")) ? text(option, "value") : label);
                putIfNonNull(item, "description", text(option, "description"));
                options.add(item);
            }
        }
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("requestId", requestId);
        payload.put("toolName", hasText(text(data, "toolName")) ? text(data, "toolName") : "unknown");
        payload.put("question", hasText(text(data, "question")) ? text(data, "question") : "Allow this action?");
        payload.put("options", options);
        Map<String, Object> toolInput = toMap(path(data, "toolInput"));
        putIfNonNull(payload, "toolInput", toolInput.isEmpty() ? null : toolInput);
        putIfNonNull(payload, "header", text(data, "header"));
        if (data.has("multiSelect")) {
            payload.put("multiSelect", flag(data, "multiSelect"));
        }
        putIfNonNull(payload, "toolCallId", firstText(text(data, "toolUseId"), text(data, "toolCallId")));
        publish(BusEventType.PERMISSION_REQUESTED, payload);
    }

    private static String firstText(String... candidates) {
        for (String candidate : candidates) {
            if (hasText(candidate)) {
                return candidate;
            }
        }
        return null;
    }
}
