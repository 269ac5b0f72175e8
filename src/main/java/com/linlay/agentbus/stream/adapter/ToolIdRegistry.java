package com.linlay.agentbus.stream.adapter;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Pairs tool starts and completions when the provider omits the call id on one side.
 * Open tools are tracked per tool name in start order.
 */
public class ToolIdRegistry {

    private final String prefix;
    private final AtomicLong sequence = new AtomicLong();
    private final Map<String, Deque<String>> openByName = new HashMap<>();

    public ToolIdRegistry(String prefix) {
        this.prefix = prefix;
    }

    public synchronized String onStart(String explicitId, String toolName) {
        String toolId = JsonPayloads.hasText(explicitId) ? explicitId : prefix + "_" + sequence.incrementAndGet();
        Deque<String> open = openByName.computeIfAbsent(key(toolName), ignored -> new ArrayDeque<>());
        if (!open.contains(toolId)) {
            open.addLast(toolId);
        }
        return toolId;
    }

    public synchronized String onComplete(String explicitId, String toolName) {
        if (JsonPayloads.hasText(explicitId)) {
            for (Deque<String> open : openByName.values()) {
                if (open.remove(explicitId)) {
                    break;
                }
            }
            return explicitId;
        }
        Deque<String> open = openByName.get(key(toolName));
        if (open != null && !open.isEmpty()) {
            return open.pollFirst();
        }
        return prefix + "_" + sequence.incrementAndGet();
    }

    public synchronized int openCount() {
        int count = 0;
        for (Deque<String> open : openByName.values()) {
            count += open.size();
        }
        return count;
    }

    public synchronized void clear() {
        openByName.clear();
    }

    private static String key(String toolName) {
        return toolName == null ? "" : toolName;
    }
}
