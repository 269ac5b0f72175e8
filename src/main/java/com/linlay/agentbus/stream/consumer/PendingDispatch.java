package com.linlay.agentbus.stream.consumer;

/**
 * A dispatch tool that has started but not yet been linked to the agent it spawns.
 */
record PendingDispatch(String toolId, String toolName, String sessionId, String correlationToken) {
}
