package com.linlay.agentbus.stream.adapter.workflow;

import com.linlay.agentbus.stream.bus.BusEventSchemas;
import com.linlay.agentbus.stream.bus.EventBus;
import com.linlay.agentbus.stream.model.BusEvent;
import com.linlay.agentbus.stream.model.BusEventType;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Producer side of the bus for workflow executors. Unlike provider adapters nothing is consumed;
 * each call publishes one event for the run this adapter was created for.
 */
public class WorkflowEventAdapter {

    private final EventBus eventBus;
    private final String sessionId;
    private final long runId;

    public WorkflowEventAdapter(EventBus eventBus, String sessionId, long runId) {
        this.eventBus = Objects.requireNonNull(eventBus, "eventBus must not be null");
        if (sessionId == null || sessionId.isBlank()) {
            throw new IllegalArgumentException("sessionId must not be blank");
        }
        this.sessionId = sessionId;
        this.runId = runId;
    }

    public boolean publishStepStart(String workflowId, String nodeName, String nodeId) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("workflowId", workflowId);
        data.put("nodeId", nodeId);
        data.put("nodeName", nodeName);
        return publish(BusEventType.WORKFLOW_STEP_START, data);
    }

    public boolean publishStepComplete(String workflowId, String nodeId) {
        return publishStepComplete(workflowId, nodeId, "success", null);
    }

    /**
     * @param status one of {@code success}, {@code error}, {@code skipped}
     * @throws IllegalArgumentException for any other status
     */
    public boolean publishStepComplete(String workflowId, String nodeId, String status, Object result) {
        if (!BusEventSchemas.WORKFLOW_STEP_STATUSES.contains(status)) {
            throw new IllegalArgumentException("Unsupported workflow step status: " + status);
        }
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("workflowId", workflowId);
        data.put("nodeId", nodeId);
        data.put("status", status);
        if (result != null) {
            data.put("result", result);
        }
        return publish(BusEventType.WORKFLOW_STEP_COMPLETE, data);
    }

    public boolean publishTaskUpdate(String workflowId, List<WorkflowTask> tasks) {
        List<Map<String, Object>> items = new ArrayList<>();
        if (tasks != null) {
            for (WorkflowTask task : tasks) {
                items.add(task.toMap());
            }
        }
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("workflowId", workflowId);
        data.put("tasks", items);
        return publish(BusEventType.WORKFLOW_TASK_UPDATE, data);
    }

    public boolean publishAgentStart(String agentId, String agentType, String task, boolean background) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("agentId", agentId);
        data.put("agentType", agentType);
        data.put("task", task);
        data.put("isBackground", background);
        return publish(BusEventType.AGENT_START, data);
    }

    public boolean publishAgentUpdate(String agentId, String currentTool, Integer toolUses) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("agentId", agentId);
        if (currentTool != null) {
            data.put("currentTool", currentTool);
        }
        if (toolUses != null) {
            data.put("toolUses", toolUses);
        }
        return publish(BusEventType.AGENT_UPDATE, data);
    }

    public boolean publishAgentComplete(String agentId, boolean success, String result, String error) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("agentId", agentId);
        data.put("success", success);
        if (result != null) {
            data.put("result", result);
        }
        if (error != null) {
            data.put("error", error);
        }
        return publish(BusEventType.AGENT_COMPLETE, data);
    }

    public String sessionId() {
        return sessionId;
    }

    public long runId() {
        return runId;
    }

    private boolean publish(BusEventType type, Map<String, Object> data) {
        return eventBus.publish(BusEvent.of(type, sessionId, runId, data));
    }
}
