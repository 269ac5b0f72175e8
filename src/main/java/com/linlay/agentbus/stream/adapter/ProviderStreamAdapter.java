package com.linlay.agentbus.stream.adapter;

import reactor.core.publisher.Mono;

public interface ProviderStreamAdapter {

    /**
     * Streams one provider turn onto the bus. Completes when the turn is done or cancelled,
     * errors with {@link ProviderStreamException} after publishing a session error.
     */
    Mono<Void> startStreaming(ProviderSession session, String input, StreamOptions options);

    void dispose();
}
