package com.linlay.agentbus.stream.model;

import java.util.List;

public class InvalidBusEventException extends IllegalArgumentException {

    private final BusEventType type;
    private final List<String> violations;

    public InvalidBusEventException(BusEventType type, List<String> violations) {
        super("Invalid " + (type == null ? "bus event" : type.wireName()) + " payload: " + String.join("; ", violations));
        this.type = type;
        this.violations = List.copyOf(violations);
    }

    public BusEventType type() {
        return type;
    }

    public List<String> violations() {
        return violations;
    }
}
