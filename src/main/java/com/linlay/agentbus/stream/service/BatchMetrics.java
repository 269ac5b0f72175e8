package com.linlay.agentbus.stream.service;

import java.time.Duration;

public record BatchMetrics(
        long totalFlushed,
        long totalCoalesced,
        long flushCount,
        int lastFlushSize,
        Duration lastFlushDuration
) {

    public static BatchMetrics empty() {
        return new BatchMetrics(0, 0, 0, 0, Duration.ZERO);
    }
}
