package com.linlay.agentbus.stream.consumer;

import com.linlay.agentbus.stream.model.BusEvent;
import com.linlay.agentbus.stream.model.EnrichedBusEvent;
import com.linlay.agentbus.stream.model.RenderCommand;
import com.linlay.agentbus.stream.model.RenderCommand.AgentStatus;
import com.linlay.agentbus.stream.model.RenderCommand.PromptKind;
import com.linlay.agentbus.stream.model.RenderCommand.SessionState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.Disposable;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * 渲染边界：把一次 flush 的事件批次经关联、回显抑制后转换为渲染指令，每个批次至多回调一次。
 */
public class StreamPipelineConsumer {

    private static final Logger log = LoggerFactory.getLogger(StreamPipelineConsumer.class);

    public static final Set<String> DEFAULT_ECHO_TOOL_NAMES = Set.of("Task", "task");

    private final CorrelationService correlationService;
    private final EchoSuppressor echoSuppressor;
    private final Set<String> echoToolNames;
    private final List<Consumer<List<RenderCommand>>> handlers = new CopyOnWriteArrayList<>();

    public StreamPipelineConsumer(CorrelationService correlationService, EchoSuppressor echoSuppressor) {
        this(correlationService, echoSuppressor, DEFAULT_ECHO_TOOL_NAMES);
    }

    public StreamPipelineConsumer(
            CorrelationService correlationService,
            EchoSuppressor echoSuppressor,
            Collection<String> echoToolNames
    ) {
        this.correlationService = Objects.requireNonNull(correlationService, "correlationService must not be null");
        this.echoSuppressor = Objects.requireNonNull(echoSuppressor, "echoSuppressor must not be null");
        this.echoToolNames = echoToolNames == null ? DEFAULT_ECHO_TOOL_NAMES : Set.copyOf(echoToolNames);
    }

    public Disposable onBatch(Consumer<List<RenderCommand>> handler) {
        Objects.requireNonNull(handler, "handler must not be null");
        handlers.add(handler);
        return () -> handlers.remove(handler);
    }

    /**
     * Entry point for the dispatcher: correlates the raw batch, then renders it.
     */
    public void accept(List<BusEvent> batch) {
        if (batch == null || batch.isEmpty()) {
            return;
        }
        processBatch(correlationService.processBatch(batch));
    }

    public void processBatch(List<EnrichedBusEvent> events) {
        List<RenderCommand> commands = new ArrayList<>();
        for (EnrichedBusEvent event : events) {
            if (!event.owned() || event.suppressFromOutput()) {
                continue;
            }
            try {
                RenderCommand command = map(event);
                if (command != null) {
                    commands.add(command);
                }
            } catch (IllegalArgumentException ex) {
                log.warn("Skipping unrenderable {} event: {}", event.type().wireName(), ex.getMessage());
            }
        }
        if (commands.isEmpty()) {
            return;
        }
        List<RenderCommand> batch = List.copyOf(commands);
        log.debug("Delivering {} render commands", batch.size());
        for (Consumer<List<RenderCommand>> handler : handlers) {
            try {
                handler.accept(batch);
            } catch (RuntimeException ex) {
                log.warn("Render handler failed on batch of {} commands", batch.size(), ex);
            }
        }
    }

    public void reset() {
        echoSuppressor.reset();
    }

    private RenderCommand map(EnrichedBusEvent enriched) {
        BusEvent event = enriched.event();
        return switch (event.type()) {
            case TEXT_DELTA -> {
                String filtered = echoSuppressor.filterDelta(event.string("delta"));
                yield filtered.isEmpty() ? null : new RenderCommand.AppendText(event.string("messageId"), filtered);
            }
            case TEXT_COMPLETE -> new RenderCommand.CompleteText(event.string("messageId"), event.string("fullText"));
            case THINKING_DELTA -> new RenderCommand.AppendThinking(
                    event.string("messageId"), event.string("sourceKey"), event.string("delta"));
            case THINKING_COMPLETE -> new RenderCommand.CompleteThinking(
                    event.string("sourceKey"), longValue(event.value("durationMs")));
            case TOOL_START -> new RenderCommand.OpenTool(
                    enriched.resolvedToolId(), event.string("toolName"), asMap(event.value("toolInput")),
                    enriched.resolvedAgentId());
            case TOOL_PARTIAL_RESULT -> new RenderCommand.ToolOutput(
                    enriched.resolvedToolId(), event.string("partialOutput"));
            case TOOL_COMPLETE -> closeTool(enriched);
            case AGENT_START -> new RenderCommand.UpsertAgent(
                    event.string("agentId"), enriched.resolvedToolId(), AgentStatus.RUNNING,
                    event.string("agentType"), event.string("task"), event.flag("isBackground"),
                    null, null, null, null);
            case AGENT_UPDATE -> new RenderCommand.UpsertAgent(
                    event.string("agentId"), enriched.resolvedToolId(), AgentStatus.RUNNING,
                    null, null, null, event.string("currentTool"), intValue(event.value("toolUses")), null, null);
            case AGENT_COMPLETE -> new RenderCommand.UpsertAgent(
                    event.string("agentId"), enriched.resolvedToolId(),
                    event.flag("success") ? AgentStatus.COMPLETED : AgentStatus.FAILED,
                    null, null, null, null, null, event.value("result"), event.string("error"));
            case WORKFLOW_TASK_UPDATE -> new RenderCommand.UpsertTaskList(
                    event.string("workflowId"), asMapList(event.value("tasks")));
            case WORKFLOW_STEP_START -> new RenderCommand.WorkflowStep(
                    event.string("workflowId"), event.string("nodeId"), event.string("nodeName"),
                    "running", null, event.timestamp());
            case WORKFLOW_STEP_COMPLETE -> new RenderCommand.WorkflowStep(
                    event.string("workflowId"), event.string("nodeId"), null,
                    event.string("status"), event.value("result"), event.timestamp());
            case SESSION_START -> status(event, SessionState.STARTED, null);
            case SESSION_IDLE -> status(event, SessionState.IDLE, event.string("reason"));
            case SESSION_ERROR -> new RenderCommand.SessionStatus(event.sessionId(), SessionState.ERROR,
                    event.string("error"), event.string("code"), event.flag("recoverable"));
            case SESSION_RETRY -> status(event, SessionState.RETRYING, event.string("message"));
            case SESSION_INFO -> status(event, SessionState.INFO, event.string("message"));
            case SESSION_WARNING -> status(event, SessionState.WARNING, event.string("message"));
            case TURN_START -> status(event, SessionState.TURN_STARTED, event.string("turnId"));
            case TURN_END -> status(event, SessionState.TURN_ENDED, event.string("turnId"));
            case SKILL_INVOKED -> status(event, SessionState.SKILL_INVOKED, event.string("skillName"));
            case PERMISSION_REQUESTED -> new RenderCommand.PromptUser(
                    event.string("requestId"), PromptKind.PERMISSION, event.string("question"),
                    event.string("header"), event.string("toolName"), asMapList(event.value("options")),
                    event.flag("multiSelect"), null);
            case HUMAN_INPUT_REQUIRED -> new RenderCommand.PromptUser(
                    event.string("requestId"), PromptKind.HUMAN_INPUT, event.string("question"),
                    event.string("header"), null, asMapList(event.value("options")), false,
                    event.string("nodeId"));
            case USAGE -> new RenderCommand.UpdateUsage(enriched.resolvedAgentId(),
                    longValue(event.value("inputTokens")), longValue(event.value("outputTokens")),
                    event.string("model"));
        };
    }

    private RenderCommand closeTool(EnrichedBusEvent enriched) {
        BusEvent event = enriched.event();
        String toolName = event.string("toolName");
        Object result = event.value("toolResult");
        if (echoToolNames.contains(toolName) && result instanceof String text) {
            echoSuppressor.expectEcho(text);
        }
        return new RenderCommand.CloseTool(enriched.resolvedToolId(), toolName, event.flag("success"),
                result, event.string("error"), enriched.resolvedAgentId());
    }

    private static RenderCommand status(BusEvent event, SessionState state, String message) {
        return new RenderCommand.SessionStatus(event.sessionId(), state, message, null, null);
    }

    private static long longValue(Object value) {
        return value instanceof Number number ? number.longValue() : 0L;
    }

    private static Integer intValue(Object value) {
        return value instanceof Number number ? number.intValue() : null;
    }

    private static Map<String, Object> asMap(Object value) {
        if (!(value instanceof Map<?, ?> map)) {
            return Map.of();
        }
        Map<String, Object> result = new LinkedHashMap<>();
        map.forEach((key, entry) -> result.put(String.valueOf(key), entry));
        return result;
    }

    private static List<Map<String, Object>> asMapList(Object value) {
        if (!(value instanceof List<?> items)) {
            return List.of();
        }
        List<Map<String, Object>> result = new ArrayList<>(items.size());
        for (Object item : items) {
            if (item instanceof Map<?, ?>) {
                result.add(asMap(item));
            }
        }
        return result;
    }
}
