package com.linlay.agentbus.stream.model;

import java.util.List;
import java.util.Map;

public sealed interface RenderCommand permits
        RenderCommand.AppendText,
        RenderCommand.AppendThinking,
        RenderCommand.CompleteThinking,
        RenderCommand.CompleteText,
        RenderCommand.OpenTool,
        RenderCommand.ToolOutput,
        RenderCommand.CloseTool,
        RenderCommand.UpsertAgent,
        RenderCommand.UpsertTaskList,
        RenderCommand.WorkflowStep,
        RenderCommand.SessionStatus,
        RenderCommand.PromptUser,
        RenderCommand.UpdateUsage {

    enum AgentStatus {
        RUNNING,
        COMPLETED,
        FAILED
    }

    enum SessionState {
        STARTED,
        IDLE,
        ERROR,
        RETRYING,
        INFO,
        WARNING,
        TURN_STARTED,
        TURN_ENDED,
        SKILL_INVOKED
    }

    enum PromptKind {
        PERMISSION,
        HUMAN_INPUT
    }

    record AppendText(String messageId, String text) implements RenderCommand {
        public AppendText {
            requireNonBlank(messageId, "messageId");
            requireNonNull(text, "text");
        }
    }

    record AppendThinking(String messageId, String sourceKey, String text) implements RenderCommand {
        public AppendThinking {
            requireNonBlank(sourceKey, "sourceKey");
            requireNonNull(text, "text");
        }
    }

    record CompleteThinking(String sourceKey, long durationMs) implements RenderCommand {
        public CompleteThinking {
            requireNonBlank(sourceKey, "sourceKey");
        }
    }

    record CompleteText(String messageId, String fullText) implements RenderCommand {
        public CompleteText {
            requireNonBlank(messageId, "messageId");
            requireNonNull(fullText, "fullText");
        }
    }

    record OpenTool(String toolId, String toolName, Map<String, Object> input, String agentId) implements RenderCommand {
        public OpenTool {
            requireNonBlank(toolId, "toolId");
            input = input == null ? Map.of() : input;
        }
    }

    record ToolOutput(String toolId, String output) implements RenderCommand {
        public ToolOutput {
            requireNonBlank(toolId, "toolId");
            requireNonNull(output, "output");
        }
    }

    record CloseTool(
            String toolId,
            String toolName,
            boolean success,
            Object result,
            String error,
            String agentId
    ) implements RenderCommand {
        public CloseTool {
            requireNonBlank(toolId, "toolId");
        }
    }

    /**
     * Null fields leave the existing agent node untouched.
     */
    record UpsertAgent(
            String agentId,
            String toolId,
            AgentStatus status,
            String agentType,
            String task,
            Boolean background,
            String currentTool,
            Integer toolUses,
            Object result,
            String error
    ) implements RenderCommand {
        public UpsertAgent {
            requireNonBlank(agentId, "agentId");
            requireNonNull(status, "status");
        }
    }

    record UpsertTaskList(String workflowId, List<Map<String, Object>> tasks) implements RenderCommand {
        public UpsertTaskList {
            requireNonBlank(workflowId, "workflowId");
            tasks = tasks == null ? List.of() : List.copyOf(tasks);
        }
    }

    record WorkflowStep(
            String workflowId,
            String nodeId,
            String nodeName,
            String status,
            Object result,
            long timestamp
    ) implements RenderCommand {
        public WorkflowStep {
            requireNonBlank(workflowId, "workflowId");
            requireNonBlank(nodeId, "nodeId");
            requireNonBlank(status, "status");
        }
    }

    record SessionStatus(
            String sessionId,
            SessionState state,
            String message,
            String code,
            Boolean recoverable
    ) implements RenderCommand {
        public SessionStatus {
            requireNonNull(sessionId, "sessionId");
            requireNonNull(state, "state");
        }
    }

    record PromptUser(
            String requestId,
            PromptKind kind,
            String question,
            String header,
            String toolName,
            List<Map<String, Object>> options,
            boolean multiSelect,
            String nodeId
    ) implements RenderCommand {
        public PromptUser {
            requireNonBlank(requestId, "requestId");
            requireNonNull(kind, "kind");
            options = options == null ? List.of() : List.copyOf(options);
        }
    }

    record UpdateUsage(String agentId, long inputTokens, long outputTokens, String model) implements RenderCommand {
    }

    private static void requireNonBlank(String value, String fieldName) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(fieldName + " must not be null or blank");
        }
    }

    private static void requireNonNull(Object value, String fieldName) {
        if (value == null) {
            throw new IllegalArgumentException(fieldName + " must not be null");
        }
    }
}
