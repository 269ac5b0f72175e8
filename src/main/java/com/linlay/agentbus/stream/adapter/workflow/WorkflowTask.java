package com.linlay.agentbus.stream.adapter.workflow;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public record WorkflowTask(String id, String title, String status, List<String> blockedBy) {

    public WorkflowTask {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("id must not be blank");
        }
        if (title == null) {
            throw new IllegalArgumentException("title must not be null");
        }
        if (status == null || status.isBlank()) {
            throw new IllegalArgumentException("status must not be blank");
        }
        blockedBy = blockedBy == null ? List.of() : List.copyOf(blockedBy);
    }

    public static WorkflowTask of(String id, String title, String status) {
        return new WorkflowTask(id, title, status, List.of());
    }

    Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("id", id);
        map.put("title", title);
        map.put("status", status);
        if (!blockedBy.isEmpty()) {
            map.put("blockedBy", blockedBy);
        }
        return map;
    }
}
