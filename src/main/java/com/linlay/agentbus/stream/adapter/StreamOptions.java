package com.linlay.agentbus.stream.adapter;

import reactor.core.publisher.Mono;

import java.util.UUID;

public record StreamOptions(
        long runId,
        String messageId,
        String agentType,
        Mono<Void> cancelSignal
) {

    public StreamOptions {
        if (runId < 0) {
            throw new IllegalArgumentException("runId must not be negative");
        }
        if (messageId == null || messageId.isBlank()) {
            messageId = "msg_" + UUID.randomUUID().toString().replace("-", "");
        }
        if (cancelSignal == null) {
            cancelSignal = Mono.never();
        }
    }

    public static StreamOptions of(long runId, String messageId) {
        return new StreamOptions(runId, messageId, null, null);
    }

    public StreamOptions withCancelSignal(Mono<Void> signal) {
        return new StreamOptions(runId, messageId, agentType, signal);
    }
}
