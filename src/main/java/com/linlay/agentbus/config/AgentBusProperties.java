package com.linlay.agentbus.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.List;

@Validated
@ConfigurationProperties(prefix = "agent.bus")
public record AgentBusProperties(
        Duration flushInterval,
        Boolean debugEvents,
        @Valid Adapter adapter,
        @Valid Retry retry,
        Correlation correlation,
        Echo echo
) {

    @ConstructorBinding
    public AgentBusProperties {
        if (flushInterval == null || flushInterval.isZero() || flushInterval.isNegative()) {
            flushInterval = Duration.ofMillis(16);
        }
        if (debugEvents == null) {
            debugEvents = Boolean.FALSE;
        }
        if (adapter == null) {
            adapter = new Adapter(null, null);
        }
        if (retry == null) {
            retry = new Retry(null, null, null);
        }
        if (correlation == null) {
            correlation = new Correlation(null);
        }
        if (echo == null) {
            echo = new Echo(null);
        }
    }

    public AgentBusProperties() {
        this(null, null, null, null, null, null);
    }

    public record Adapter(
            @Min(1) Integer highWaterMark,
            @Min(1) Integer drainBatchSize
    ) {

        public Adapter {
            if (highWaterMark == null) {
                highWaterMark = 1000;
            }
            if (drainBatchSize == null) {
                drainBatchSize = 64;
            }
        }
    }

    public record Retry(
            @Min(0) Integer maxAttempts,
            Duration initialDelay,
            Duration maxDelay
    ) {

        public Retry {
            if (maxAttempts == null) {
                maxAttempts = 5;
            }
            if (initialDelay == null) {
                initialDelay = Duration.ofSeconds(2);
            }
            if (maxDelay == null) {
                maxDelay = Duration.ofSeconds(30);
            }
        }
    }

    public record Correlation(List<String> dispatchToolNames) {

        public Correlation {
            dispatchToolNames = dispatchToolNames == null || dispatchToolNames.isEmpty()
                    ? List.of("Task", "task", "Agent", "agent", "launch_agent")
                    : List.copyOf(dispatchToolNames);
        }
    }

    public record Echo(List<String> toolNames) {

        public Echo {
            toolNames = toolNames == null ? List.of("Task", "task") : List.copyOf(toolNames);
        }
    }
}
