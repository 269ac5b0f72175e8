package com.linlay.agentbus.stream.consumer;

import com.linlay.agentbus.stream.model.Run;

import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Working set of one run. Replaced as a whole when the next run starts, so nothing
 * recorded for an earlier run can leak into a later one.
 */
final class CorrelationState {

    final Run run;
    final Set<String> ownedSessionIds = new HashSet<>();
    final Map<String, String> toolIdByToken = new HashMap<>();
    final Map<String, String> agentIdByToken = new HashMap<>();
    final Map<String, String> agentByTool = new HashMap<>();
    final Set<String> subagentToolIds = new HashSet<>();
    final Map<String, String> dispatchToolByAgent = new HashMap<>();
    final Map<String, String> agentByDispatchTool = new HashMap<>();
    final Map<String, LinkedHashMap<String, PendingDispatch>> pendingBySession = new HashMap<>();
    final Map<String, String> sessionByTool = new HashMap<>();
    final Map<String, String> sessionByAgent = new HashMap<>();

    private CorrelationState(Run run) {
        this.run = run;
    }

    static CorrelationState idle() {
        return new CorrelationState(null);
    }

    static CorrelationState forRun(Run run) {
        CorrelationState state = new CorrelationState(run);
        state.ownedSessionIds.add(run.sessionId());
        return state;
    }

    void addPending(PendingDispatch dispatch) {
        pendingBySession.computeIfAbsent(dispatch.sessionId(), ignored -> new LinkedHashMap<>())
                .put(dispatch.toolId(), dispatch);
    }

    PendingDispatch removePending(String sessionId, String toolId) {
        LinkedHashMap<String, PendingDispatch> pending = pendingBySession.get(sessionId);
        if (pending == null) {
            return null;
        }
        PendingDispatch removed = pending.remove(toolId);
        if (pending.isEmpty()) {
            pendingBySession.remove(sessionId);
        }
        return removed;
    }

    PendingDispatch oldestPending(String sessionId) {
        LinkedHashMap<String, PendingDispatch> pending = pendingBySession.get(sessionId);
        if (pending == null || pending.isEmpty()) {
            return null;
        }
        return pending.values().iterator().next();
    }

    void pruneSession(String sessionId) {
        pendingBySession.remove(sessionId);
        Set<String> toolIds = keysWithValue(sessionByTool, sessionId);
        Set<String> agentIds = keysWithValue(sessionByAgent, sessionId);
        for (String toolId : toolIds) {
            sessionByTool.remove(toolId);
            agentByTool.remove(toolId);
            subagentToolIds.remove(toolId);
            String agentId = agentByDispatchTool.remove(toolId);
            if (agentId != null) {
                dispatchToolByAgent.remove(agentId);
            }
        }
        for (String agentId : agentIds) {
            sessionByAgent.remove(agentId);
            String toolId = dispatchToolByAgent.remove(agentId);
            if (toolId != null) {
                agentByDispatchTool.remove(toolId);
            }
        }
        toolIdByToken.values().removeAll(toolIds);
        agentIdByToken.values().removeAll(agentIds);
        agentByTool.values().removeAll(agentIds);
        if (run == null || !run.sessionId().equals(sessionId)) {
            ownedSessionIds.remove(sessionId);
        }
    }

    private static Set<String> keysWithValue(Map<String, String> map, String value) {
        Set<String> keys = new HashSet<>();
        for (Map.Entry<String, String> entry : map.entrySet()) {
            if (value.equals(entry.getValue())) {
                keys.add(entry.getKey());
            }
        }
        return keys;
    }
}
