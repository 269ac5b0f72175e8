package com.linlay.agentbus.stream.adapter.subagent;

import java.util.List;

/**
 * Summary of one sub-agent execution, handed back to whoever launched it.
 */
public record SubagentStreamResult(
        String agentId,
        boolean success,
        String output,
        String error,
        int toolUses,
        long inputTokens,
        long outputTokens,
        long thinkingDurationMs,
        long durationMs,
        List<ToolDetail> toolDetails
) {

    public SubagentStreamResult {
        if (agentId == null || agentId.isBlank()) {
            throw new IllegalArgumentException("agentId must not be blank");
        }
        output = output == null ? "" : output;
        toolDetails = toolDetails == null ? List.of() : List.copyOf(toolDetails);
    }

    public record ToolDetail(String toolId, String toolName, long durationMs, boolean success) {
    }
}
