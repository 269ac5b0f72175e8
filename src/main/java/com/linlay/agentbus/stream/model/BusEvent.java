package com.linlay.agentbus.stream.model;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

public record BusEvent(
        BusEventType type,
        String sessionId,
        long runId,
        long timestamp,
        Map<String, Object> data
) {

    private static final Set<String> RESERVED_KEYS = Set.of("type", "sessionId", "runId", "timestamp");

    public BusEvent {
        Objects.requireNonNull(type, "type must not be null");
        if (sessionId == null) {
            throw new IllegalArgumentException("sessionId must not be null");
        }
        if (runId < 0) {
            throw new IllegalArgumentException("runId must not be negative");
        }
        if (data == null || data.isEmpty()) {
            data = Map.of();
        } else {
            data = Collections.unmodifiableMap(new LinkedHashMap<>(data));
        }
    }

    public static BusEvent of(BusEventType type, String sessionId, long runId, Map<String, Object> data) {
        return new BusEvent(type, sessionId, runId, Instant.now().toEpochMilli(), data);
    }

    public Object value(String key) {
        return data.get(key);
    }

    public String string(String key) {
        Object value = data.get(key);
        return value instanceof String text ? text : null;
    }

    public boolean flag(String key) {
        return Boolean.TRUE.equals(data.get(key));
    }

    public Long number(String key) {
        Object value = data.get(key);
        return value instanceof Number number ? number.longValue() : null;
    }

    public BusEvent withData(Map<String, Object> replacement) {
        return new BusEvent(type, sessionId, runId, timestamp, replacement);
    }

    public Map<String, Object> toData() {
        Map<String, Object> result = new LinkedHashMap<>();
        result.put("type", type.wireName());
        result.put("sessionId", sessionId);
        result.put("runId", runId);
        result.put("timestamp", timestamp);
        data.forEach((key, value) -> {
            if (!RESERVED_KEYS.contains(key)) {
                result.put(key, value);
            }
        });
        return result;
    }
}
