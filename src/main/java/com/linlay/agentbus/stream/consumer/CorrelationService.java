package com.linlay.agentbus.stream.consumer;

import com.linlay.agentbus.stream.model.BusEvent;
import com.linlay.agentbus.stream.model.BusEventType;
import com.linlay.agentbus.stream.model.EnrichedBusEvent;
import com.linlay.agentbus.stream.model.Run;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * 关联服务：把一批总线事件解析为带 tool/agent 归属和 run 归属判定的事件。
 * <p>
 * 匹配策略：provider 给出的关联 token 优先；没有 token 时按会话内派发工具的启动顺序（FIFO）尽力匹配，
 * 同一会话中并发派发且 agent-start 乱序到达时可能错配。
 * 早于当前 run 的事件视为过期；未被认领的事件（含过期事件）不会修改当前 run 的状态。runId 为 0 的事件不参与过期判定。
 */
public class CorrelationService {

    private static final Logger log = LoggerFactory.getLogger(CorrelationService.class);

    public static final Set<String> DEFAULT_DISPATCH_TOOL_NAMES = Set.of("Task", "task", "Agent", "agent", "launch_agent");

    private final Set<String> dispatchToolNames;
    private CorrelationState state = CorrelationState.idle();

    public CorrelationService() {
        this(DEFAULT_DISPATCH_TOOL_NAMES);
    }

    public CorrelationService(Collection<String> dispatchToolNames) {
        this.dispatchToolNames = dispatchToolNames == null ? DEFAULT_DISPATCH_TOOL_NAMES : Set.copyOf(dispatchToolNames);
    }

    public synchronized Run startRun(long runId, String sessionId) {
        Run run = new Run(runId, sessionId, Instant.now());
        state = CorrelationState.forRun(run);
        log.debug("Started run {} for session {}", runId, sessionId);
        return run;
    }

    public synchronized Optional<Run> activeRun() {
        return Optional.ofNullable(state.run);
    }

    public synchronized void claimSession(String sessionId) {
        if (state.run == null || sessionId == null || sessionId.isBlank()) {
            return;
        }
        state.ownedSessionIds.add(sessionId);
    }

    public synchronized void pruneSession(String sessionId) {
        if (sessionId == null) {
            return;
        }
        state.pruneSession(sessionId);
    }

    public synchronized void registerTool(String toolId, String agentId, boolean subagentTool) {
        if (toolId == null || agentId == null) {
            return;
        }
        state.agentByTool.put(toolId, agentId);
        if (subagentTool) {
            state.subagentToolIds.add(toolId);
        }
    }

    public synchronized void reset() {
        state = CorrelationState.idle();
    }

    /**
     * Run id 0 marks an event that was not stamped with a run; its ownership follows the session alone.
     */
    public synchronized boolean isOwned(BusEvent event) {
        Run run = state.run;
        if (run == null || isStale(event, run)) {
            return false;
        }
        return event.runId() == run.runId() || state.ownedSessionIds.contains(event.sessionId());
    }

    public synchronized List<EnrichedBusEvent> processBatch(List<BusEvent> events) {
        List<EnrichedBusEvent> enriched = new ArrayList<>(events.size());
        for (BusEvent event : events) {
            enriched.add(enrich(event));
        }
        return enriched;
    }

    public synchronized EnrichedBusEvent enrich(BusEvent event) {
        if (!isOwned(event)) {
            return unowned(event);
        }
        Resolution resolution = new Resolution();
        switch (event.type()) {
            case TOOL_START -> onToolStart(event, resolution);
            case TOOL_COMPLETE -> onToolComplete(event, resolution);
            case TOOL_PARTIAL_RESULT -> {
                String toolId = event.string("toolId");
                resolution.toolId = toolId;
                resolution.agentId = state.agentByTool.get(toolId);
                resolution.subagentTool = state.subagentToolIds.contains(toolId);
            }
            case AGENT_START -> onAgentStart(event, resolution);
            case AGENT_UPDATE, AGENT_COMPLETE -> {
                String agentId = event.string("agentId");
                resolution.agentId = agentId;
                resolution.toolId = state.dispatchToolByAgent.get(agentId);
            }
            case TEXT_DELTA, TEXT_COMPLETE, THINKING_DELTA, THINKING_COMPLETE, USAGE ->
                    resolution.agentId = event.string("agentId");
            default -> {
            }
        }
        EnrichedBusEvent enriched = new EnrichedBusEvent(event, resolution.toolId, resolution.agentId,
                resolution.subagentTool, suppress(event, resolution.subagentTool), true);
        if (event.type() == BusEventType.SESSION_ERROR && !event.flag("recoverable")) {
            state.pruneSession(event.sessionId());
        }
        return enriched;
    }

    private void onToolStart(BusEvent event, Resolution resolution) {
        String toolId = event.string("toolId");
        String token = event.string("providerCorrelationId");
        resolution.toolId = toolId;
        state.sessionByTool.put(toolId, event.sessionId());
        if (token != null) {
            state.toolIdByToken.put(token, toolId);
        }

        boolean dispatch = dispatchToolNames.contains(event.string("toolName"));
        String owner = resolveAgentReference(event.string("parentAgentId"));
        if (owner == null && token != null && !dispatch && !state.agentByDispatchTool.containsKey(toolId)) {
            owner = state.agentIdByToken.get(token);
        }
        if (owner != null) {
            state.agentByTool.put(toolId, owner);
            state.subagentToolIds.add(toolId);
            resolution.agentId = owner;
            resolution.subagentTool = true;
            return;
        }
        String spawned = state.agentByDispatchTool.get(toolId);
        if (spawned != null) {
            resolution.agentId = spawned;
        } else if (dispatch) {
            state.addPending(new PendingDispatch(toolId, event.string("toolName"), event.sessionId(), token));
        }
    }

    private void onAgentStart(BusEvent event, Resolution resolution) {
        String agentId = event.string("agentId");
        String token = event.string("providerCorrelationId");
        resolution.agentId = agentId;
        state.sessionByAgent.put(agentId, event.sessionId());
        if (token != null) {
            state.agentIdByToken.put(token, agentId);
        }

        String linked = state.dispatchToolByAgent.get(agentId);
        if (linked != null) {
            resolution.toolId = linked;
            return;
        }
        String toolId = null;
        if (token != null) {
            String candidate = state.toolIdByToken.get(token);
            if (candidate != null && !state.agentByDispatchTool.containsKey(candidate)) {
                toolId = candidate;
            }
        }
        if (toolId == null) {
            PendingDispatch oldest = state.oldestPending(event.sessionId());
            if (oldest != null) {
                toolId = oldest.toolId();
                log.debug("Matched agent {} to dispatch tool {} by start order", agentId, toolId);
            }
        }
        if (toolId == null) {
            return;
        }
        state.removePending(state.sessionByTool.getOrDefault(toolId, event.sessionId()), toolId);
        state.agentByDispatchTool.put(toolId, agentId);
        state.dispatchToolByAgent.put(agentId, toolId);
        resolution.toolId = toolId;
    }

    private void onToolComplete(BusEvent event, Resolution resolution) {
        String toolId = event.string("toolId");
        String token = event.string("providerCorrelationId");
        if (!state.sessionByTool.containsKey(toolId) && token != null && state.toolIdByToken.containsKey(token)) {
            toolId = state.toolIdByToken.get(token);
        }
        resolution.toolId = toolId;

        String parent = resolveAgentReference(event.string("parentAgentId"));
        String owner = state.agentByTool.get(toolId);
        if (owner == null && parent != null) {
            owner = parent;
            state.agentByTool.put(toolId, owner);
            state.subagentToolIds.add(toolId);
        }
        if (owner != null) {
            resolution.agentId = owner;
            resolution.subagentTool = state.subagentToolIds.contains(toolId);
        } else {
            resolution.agentId = state.agentByDispatchTool.get(toolId);
        }
        state.removePending(state.sessionByTool.getOrDefault(toolId, event.sessionId()), toolId);
    }

    // parentAgentId may be an agent id or a provider token that names one
    private String resolveAgentReference(String reference) {
        if (reference == null || reference.isBlank()) {
            return null;
        }
        String agentId = state.agentIdByToken.get(reference);
        return agentId != null ? agentId : reference;
    }

    private EnrichedBusEvent unowned(BusEvent event) {
        String toolId = event.string("toolId");
        String agentId = event.string("agentId");
        boolean subagentTool = (event.type() == BusEventType.TOOL_START || event.type() == BusEventType.TOOL_COMPLETE)
                && event.string("parentAgentId") != null;
        if (agentId == null && subagentTool) {
            agentId = event.string("parentAgentId");
        }
        return new EnrichedBusEvent(event, toolId, agentId, subagentTool, suppress(event, subagentTool), false);
    }

    private static boolean isStale(BusEvent event, Run run) {
        return event.runId() != 0 && event.runId() < run.runId();
    }

    private static boolean suppress(BusEvent event, boolean subagentTool) {
        if (subagentTool) {
            return true;
        }
        return switch (event.type()) {
            case TEXT_DELTA, TEXT_COMPLETE, THINKING_DELTA, THINKING_COMPLETE -> event.string("agentId") != null;
            default -> false;
        };
    }

    private static final class Resolution {
        private String toolId;
        private String agentId;
        private boolean subagentTool;
    }
}
