package com.linlay.agentbus.stream.model;

import java.time.Instant;
import java.util.Objects;

public record Run(long runId, String sessionId, Instant startedAt) {

    public Run {
        if (runId <= 0) {
            throw new IllegalArgumentException("runId must be positive");
        }
        if (sessionId == null || sessionId.isBlank()) {
            throw new IllegalArgumentException("sessionId must not be blank");
        }
        Objects.requireNonNull(startedAt, "startedAt must not be null");
    }
}
