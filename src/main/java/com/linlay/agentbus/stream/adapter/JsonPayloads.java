package com.linlay.agentbus.stream.adapter;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Null-tolerant readers over provider JSON and conversion into plain payload values.
 */
public final class JsonPayloads {

    private JsonPayloads() {
    }

    public static boolean isPresent(JsonNode node) {
        return node != null && !node.isNull() && !node.isMissingNode();
    }

    public static JsonNode path(JsonNode node, String... fields) {
        JsonNode current = node;
        for (String field : fields) {
            if (!isPresent(current)) {
                return null;
            }
            current = current.get(field);
        }
        return isPresent(current) ? current : null;
    }

    public static String optionalText(JsonNode node) {
        if (!isPresent(node)) {
            return null;
        }
        if (node.isTextual()) {
            return node.asText();
        }
        return node.toString();
    }

    public static String text(JsonNode node, String... fields) {
        return optionalText(path(node, fields));
    }

    public static Long optionalLong(JsonNode node) {
        if (!isPresent(node)) {
            return null;
        }
        if (node.isNumber()) {
            return node.asLong();
        }
        if (node.isTextual()) {
            try {
                return Long.parseLong(node.asText().trim());
            } catch (NumberFormatException ignored) {
                return null;
            }
        }
        return null;
    }

    public static long longValue(JsonNode node, String... fields) {
        Long value = optionalLong(path(node, fields));
        return value == null ? 0L : value;
    }

    public static boolean flag(JsonNode node, String... fields) {
        JsonNode value = path(node, fields);
        if (value == null) {
            return false;
        }
        if (value.isBoolean()) {
            return value.asBoolean();
        }
        return value.isTextual() && "true".equalsIgnoreCase(value.asText());
    }

    public static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }

    public static Map<String, Object> toMap(JsonNode node) {
        Map<String, Object> map = new LinkedHashMap<>();
        if (!isPresent(node) || !node.isObject()) {
            return map;
        }
        node.fields().forEachRemaining(entry -> {
            Object value = toPlain(entry.getValue());
            if (value != null) {
                map.put(entry.getKey(), value);
            }
        });
        return map;
    }

    public static Object toPlain(JsonNode node) {
        if (!isPresent(node)) {
            return null;
        }
        if (node.isInt() || node.isLong()) {
            return node.asLong();
        }
        if (node.isFloat() || node.isDouble() || node.isBigDecimal()) {
            return node.doubleValue();
        }
        if (node.isNumber()) {
            return node.numberValue();
        }
        if (node.isTextual()) {
            return node.asText();
        }
        if (node.isBoolean()) {
            return node.asBoolean();
        }
        if (node.isArray()) {
            List<Object> list = new ArrayList<>();
            for (JsonNode item : node) {
                list.add(toPlain(item));
            }
            return list;
        }
        if (node.isObject()) {
            return toMap(node);
        }
        return node.toString();
    }

    /**
     * Tool results are rendered as text; structured results keep their JSON form.
     */
    public static String resultText(JsonNode node) {
        if (!isPresent(node)) {
            return null;
        }
        if (node.isTextual()) {
            return node.asText();
        }
        if (node.isArray()) {
            StringBuilder text = new StringBuilder();
            for (JsonNode item : node) {
                String part = text(item, "text");
                if (part != null) {
                    text.append(part);
                }
            }
            if (!text.isEmpty()) {
                return text.toString();
            }
        }
        return node.toString();
    }
}
