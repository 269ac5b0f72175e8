package com.linlay.agentbus.stream.bus;

import com.linlay.agentbus.stream.model.BusEvent;
import com.linlay.agentbus.stream.model.InvalidBusEventException;

import java.util.List;

public class BusEventValidator {

    public void validate(BusEvent event) {
        if (event == null) {
            throw new InvalidBusEventException(null, List.of("event must not be null"));
        }
        List<String> violations = BusEventSchemas.schemaFor(event.type()).violations(event.data());
        if (!violations.isEmpty()) {
            throw new InvalidBusEventException(event.type(), violations);
        }
    }
}
