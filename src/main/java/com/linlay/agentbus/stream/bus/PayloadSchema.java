package com.linlay.agentbus.stream.bus;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Field-level shape of one event payload. Unknown keys are tolerated.
 */
public final class PayloadSchema {

    public enum FieldKind {
        ID,
        STRING,
        NUMBER,
        BOOLEAN,
        MAP,
        LIST,
        ANY
    }

    public record Field(String name, FieldKind kind, boolean required, Set<String> allowedValues, PayloadSchema elementSchema) {
    }

    private final Map<String, Field> fields;

    private PayloadSchema(Map<String, Field> fields) {
        this.fields = fields;
    }

    public static Builder builder() {
        return new Builder();
    }

    public Map<String, Field> fields() {
        return fields;
    }

    public List<String> violations(Map<String, Object> payload) {
        List<String> violations = new ArrayList<>();
        collect("", payload == null ? Map.of() : payload, violations);
        return violations;
    }

    private void collect(String prefix, Map<?, ?> payload, List<String> violations) {
        for (Field field : fields.values()) {
            String path = prefix + field.name();
            Object value = payload.get(field.name());
            if (value == null) {
                if (field.required()) {
                    violations.add(path + " is required");
                }
                continue;
            }
            if (!matches(field.kind(), value)) {
                violations.add(path + " must be " + field.kind().name().toLowerCase(Locale.ROOT));
                continue;
            }
            if (field.allowedValues() != null && !field.allowedValues().contains(String.valueOf(value))) {
                violations.add(path + " must be one of " + field.allowedValues());
            }
            if (field.elementSchema() != null && value instanceof List<?> items) {
                for (int i = 0; i < items.size(); i++) {
                    Object item = items.get(i);
                    String itemPath = path + "[" + i + "]";
                    if (!(item instanceof Map<?, ?> itemMap)) {
                        violations.add(itemPath + " must be map");
                        continue;
                    }
                    field.elementSchema().collect(itemPath + ".", itemMap, violations);
                }
            }
        }
    }

    private static boolean matches(FieldKind kind, Object value) {
        return switch (kind) {
            case ID -> value instanceof String text && !text.isBlank();
            case STRING -> value instanceof String;
            case NUMBER -> value instanceof Number;
            case BOOLEAN -> value instanceof Boolean;
            case MAP -> value instanceof Map<?, ?>;
            case LIST -> value instanceof List<?>;
            case ANY -> true;
        };
    }

    public static final class Builder {

        private final Map<String, Field> fields = new LinkedHashMap<>();

        private Builder() {
        }

        public Builder required(String name, FieldKind kind) {
            return add(new Field(name, kind, true, null, null));
        }

        public Builder optional(String name, FieldKind kind) {
            return add(new Field(name, kind, false, null, null));
        }

        public Builder requiredOneOf(String name, Set<String> allowedValues) {
            return add(new Field(name, FieldKind.STRING, true, Set.copyOf(allowedValues), null));
        }

        public Builder requiredList(String name, PayloadSchema elementSchema) {
            return add(new Field(name, FieldKind.LIST, true, null, elementSchema));
        }

        public Builder optionalList(String name, PayloadSchema elementSchema) {
            return add(new Field(name, FieldKind.LIST, false, null, elementSchema));
        }

        private Builder add(Field field) {
            fields.put(field.name(), field);
            return this;
        }

        public PayloadSchema build() {
            return new PayloadSchema(Collections.unmodifiableMap(new LinkedHashMap<>(fields)));
        }
    }
}
