package com.linlay.agentbus.stream.adapter;

import com.fasterxml.jackson.databind.JsonNode;
import reactor.core.publisher.Flux;

/**
 * A provider conversation. The stream is cold: each subscription sends the input once.
 */
public interface ProviderSession {

    String id();

    Flux<JsonNode> stream(String input, StreamOptions options);
}
