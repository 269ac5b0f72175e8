package com.linlay.agentbus.stream.adapter;

import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

import java.util.Objects;

public record PushSettings(int highWaterMark, int drainBatchSize, Scheduler drainScheduler) {

    public PushSettings {
        if (highWaterMark < 1) {
            throw new IllegalArgumentException("highWaterMark must be positive");
        }
        if (drainBatchSize < 1) {
            throw new IllegalArgumentException("drainBatchSize must be positive");
        }
        Objects.requireNonNull(drainScheduler, "drainScheduler must not be null");
    }

    public static PushSettings defaults() {
        return new PushSettings(1000, 64, Schedulers.boundedElastic());
    }
}
