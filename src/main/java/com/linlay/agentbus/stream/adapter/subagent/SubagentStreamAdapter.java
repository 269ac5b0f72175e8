package com.linlay.agentbus.stream.adapter.subagent;

import com.fasterxml.jackson.databind.JsonNode;
import com.linlay.agentbus.stream.adapter.AbstractStreamAdapter;
import com.linlay.agentbus.stream.adapter.ProviderSession;
import com.linlay.agentbus.stream.adapter.StreamOptions;
import com.linlay.agentbus.stream.adapter.StreamRetryPolicy;
import com.linlay.agentbus.stream.adapter.ToolIdRegistry;
import com.linlay.agentbus.stream.adapter.subagent.SubagentStreamResult.ToolDetail;
import com.linlay.agentbus.stream.bus.EventBus;
import com.linlay.agentbus.stream.model.BusEventType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static com.linlay.agentbus.stream.adapter.JsonPayloads.flag;
import static com.linlay.agentbus.stream.adapter.JsonPayloads.hasText;
import static com.linlay.agentbus.stream.adapter.JsonPayloads.longValue;
import static com.linlay.agentbus.stream.adapter.JsonPayloads.optionalLong;
import static com.linlay.agentbus.stream.adapter.JsonPayloads.path;
import static com.linlay.agentbus.stream.adapter.JsonPayloads.resultText;
import static com.linlay.agentbus.stream.adapter.JsonPayloads.text;
import static com.linlay.agentbus.stream.adapter.JsonPayloads.toMap;

/**
 * 子代理流适配器：消费单个子代理会话的拉取流，以父会话 id 发布事件，
 * 文本与思考事件携带 agentId，工具事件以 parentAgentId 指向该代理，以便关联服务归属到代理树。
 * <p>
 * 失败不会向上抛出，而是体现在返回的 {@link SubagentStreamResult} 中；
 * 发布的 session-error 为可恢复错误，不会使父会话被裁剪。
 */
public class SubagentStreamAdapter extends AbstractStreamAdapter {

    private static final Logger log = LoggerFactory.getLogger(SubagentStreamAdapter.class);

    public static final String SUBAGENT_ERROR = "SUBAGENT_ERROR";

    private final String parentSessionId;
    private final String agentId;
    private final ToolIdRegistry toolIds;

    private final StringBuilder output = new StringBuilder();
    private final Map<String, Long> thinkingStartedAt = new HashMap<>();
    private final Map<String, Long> toolStartedAt = new HashMap<>();
    private final Map<String, String> toolNameById = new HashMap<>();
    private final List<ToolDetail> toolDetails = new ArrayList<>();
    private int toolUses;
    private long inputTokens;
    private long outputTokens;
    private long thinkingDurationMs;

    public SubagentStreamAdapter(EventBus eventBus, String parentSessionId, String agentId) {
        this(eventBus, parentSessionId, agentId, StreamRetryPolicy.disabled());
    }

    public SubagentStreamAdapter(
            EventBus eventBus,
            String parentSessionId,
            String agentId,
            StreamRetryPolicy retryPolicy
    ) {
        super(eventBus, retryPolicy);
        if (!hasText(parentSessionId)) {
            throw new IllegalArgumentException("parentSessionId must not be blank");
        }
        if (!hasText(agentId)) {
            throw new IllegalArgumentException("agentId must not be blank");
        }
        this.parentSessionId = parentSessionId;
        this.agentId = agentId;
        this.toolIds = new ToolIdRegistry("tool_" + agentId);
    }

    @Override
    public Mono<Void> startStreaming(ProviderSession session, String input, StreamOptions options) {
        return consume(session, input, options).then();
    }

    /**
     * Runs the sub-agent turn and reports its outcome. The returned Mono never errors for
     * provider failures; they are folded into an unsuccessful result.
     */
    public Mono<SubagentStreamResult> consume(ProviderSession session, String input, StreamOptions options) {
        return Mono.defer(() -> {
            StreamOptions scoped = new StreamOptions(options.runId(), "subagent-" + agentId,
                    options.agentType(), options.cancelSignal());
            beginTurn(parentSessionId, scoped);
            resetTurnState();
            long startedAt = System.currentTimeMillis();
            return nativeStream(session, input, scoped)
                    .doOnNext(this::handle)
                    .then(Mono.fromCallable(() -> finish(startedAt)))
                    .onErrorResume(error -> Mono.just(fail(startedAt, error)));
        });
    }

    private void handle(JsonNode chunk) {
        if (isCancelled()) {
            return;
        }
        String type = text(chunk, "type");
        if (type != null) {
            switch (type) {
                case "text" -> onText(path(chunk, "content"));
                case "thinking" -> onThinking(chunk);
                case "tool_use" -> onToolUse(chunk);
                case "tool_result" -> onToolResult(chunk);
                default -> log.trace("Ignoring sub-agent chunk {}", type);
            }
        }
        onUsage(chunk);
    }

    private void onText(JsonNode content) {
        if (content == null || !content.isTextual() || content.asText().isEmpty()) {
            return;
        }
        output.append(content.asText());
        publishTextDelta(content.asText(), agentId);
    }

    private void onThinking(JsonNode chunk) {
        String sourceKey = text(chunk, "metadata", "thinkingSourceKey");
        if (!hasText(sourceKey)) {
            sourceKey = "default";
        }
        String delta = text(chunk, "content");
        if (delta != null && !delta.isEmpty()) {
            thinkingStartedAt.putIfAbsent(sourceKey, System.currentTimeMillis());
            Map<String, Object> data = new LinkedHashMap<>();
            data.put("delta", delta);
            data.put("sourceKey", sourceKey);
            data.put("messageId", messageId());
            data.put("agentId", agentId);
            publish(BusEventType.THINKING_DELTA, data);
            return;
        }
        Long reported = optionalLong(path(chunk, "metadata", "streamingStats", "thinkingMs"));
        if (reported == null) {
            return;
        }
        Long startedAt = thinkingStartedAt.remove(sourceKey);
        long durationMs = reported > 0 || startedAt == null ? reported : System.currentTimeMillis() - startedAt;
        thinkingDurationMs += durationMs;
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("sourceKey", sourceKey);
        data.put("durationMs", durationMs);
        data.put("agentId", agentId);
        publish(BusEventType.THINKING_COMPLETE, data);
    }

    private void onToolUse(JsonNode chunk) {
        JsonNode content = path(chunk, "content");
        String toolName = firstText(text(content, "name"), text(chunk, "name"), text(chunk, "metadata", "toolName"));
        if (toolName == null) {
            toolName = "unknown";
        }
        String explicitId = firstText(text(content, "toolUseId"), text(content, "id"), text(chunk, "toolUseId"),
                text(chunk, "id"), text(chunk, "metadata", "toolUseId"), text(chunk, "metadata", "toolCallId"));
        String toolId = toolIds.onStart(explicitId, toolName);
        JsonNode inputNode = path(content, "input");
        Map<String, Object> toolInput = toMap(inputNode != null ? inputNode : path(chunk, "input"));

        toolUses++;
        toolStartedAt.put(toolId, System.currentTimeMillis());
        toolNameById.put(toolId, toolName);
        publishAgentUpdate(toolName);

        Map<String, Object> data = new LinkedHashMap<>();
        data.put("toolId", toolId);
        data.put("toolName", toolName);
        data.put("toolInput", toolInput);
        data.put("providerCorrelationId", explicitId != null ? explicitId : toolId);
        data.put("parentAgentId", agentId);
        publish(BusEventType.TOOL_START, data);
    }

    private void onToolResult(JsonNode chunk) {
        String reportedName = firstText(text(chunk, "toolName"), text(chunk, "metadata", "toolName"));
        String explicitId = firstText(text(chunk, "tool_use_id"), text(chunk, "toolUseId"),
                text(chunk, "metadata", "toolUseId"), text(chunk, "metadata", "toolCallId"));
        String toolId = toolIds.onComplete(explicitId, reportedName != null ? reportedName : "unknown");
        String toolName = toolNameById.remove(toolId);
        if (toolName == null) {
            toolName = reportedName != null ? reportedName : "unknown";
        }
        JsonNode content = path(chunk, "content");
        JsonNode errorNode = content != null && content.isObject() ? path(content, "error") : null;
        boolean error = flag(chunk, "is_error") || errorNode != null;
        Long startedAt = toolStartedAt.remove(toolId);
        toolDetails.add(new ToolDetail(toolId, toolName,
                startedAt == null ? 0L : System.currentTimeMillis() - startedAt, !error));
        publishAgentUpdate(null);

        Map<String, Object> data = new LinkedHashMap<>();
        data.put("toolId", toolId);
        data.put("toolName", toolName);
        data.put("success", !error);
        putIfNonNull(data, "toolResult", resultText(content));
        if (error) {
            String message = errorNode != null && errorNode.isTextual() ? errorNode.asText() : resultText(content);
            putIfNonNull(data, "error", message);
        }
        data.put("providerCorrelationId", explicitId != null ? explicitId : toolId);
        data.put("parentAgentId", agentId);
        publish(BusEventType.TOOL_COMPLETE, data);
    }

    private void onUsage(JsonNode chunk) {
        JsonNode usage = path(chunk, "metadata", "tokenUsage");
        if (usage == null) {
            return;
        }
        long input = longValue(usage, "inputTokens");
        long out = longValue(usage, "outputTokens");
        if (input <= 0 && out <= 0) {
            return;
        }
        inputTokens += input;
        outputTokens += out;
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("inputTokens", inputTokens);
        data.put("outputTokens", outputTokens);
        putIfNonNull(data, "model", text(chunk, "metadata", "model"));
        data.put("agentId", agentId);
        publish(BusEventType.USAGE, data);
    }

    private void publishAgentUpdate(String currentTool) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("agentId", agentId);
        putIfNonNull(data, "currentTool", currentTool);
        data.put("toolUses", toolUses);
        publish(BusEventType.AGENT_UPDATE, data);
    }

    private SubagentStreamResult finish(long startedAt) {
        closeThinking();
        if (isCancelled()) {
            return result(startedAt, false, "Sub-agent was cancelled");
        }
        publishTextComplete();
        return result(startedAt, true, null);
    }

    private SubagentStreamResult fail(long startedAt, Throwable error) {
        closeThinking();
        String message = retryPolicy.classify(error).message();
        log.warn("Sub-agent {} failed: {}", agentId, message);
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("error", message);
        data.put("code", SUBAGENT_ERROR);
        data.put("recoverable", true);
        publish(BusEventType.SESSION_ERROR, data);
        publishTextComplete();
        return result(startedAt, false, message);
    }

    private void publishTextComplete() {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("messageId", messageId());
        data.put("fullText", output.toString());
        data.put("agentId", agentId);
        publish(BusEventType.TEXT_COMPLETE, data);
    }

    private void closeThinking() {
        long now = System.currentTimeMillis();
        for (Long startedAt : thinkingStartedAt.values()) {
            thinkingDurationMs += now - startedAt;
        }
        thinkingStartedAt.clear();
    }

    private SubagentStreamResult result(long startedAt, boolean success, String error) {
        return new SubagentStreamResult(agentId, success, output.toString(), error, toolUses,
                inputTokens, outputTokens, thinkingDurationMs, System.currentTimeMillis() - startedAt, toolDetails);
    }

    private void resetTurnState() {
        output.setLength(0);
        thinkingStartedAt.clear();
        toolStartedAt.clear();
        toolNameById.clear();
        toolDetails.clear();
        toolIds.clear();
        toolUses = 0;
        inputTokens = 0;
        outputTokens = 0;
        thinkingDurationMs = 0;
    }

    public String agentId() {
        return agentId;
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
