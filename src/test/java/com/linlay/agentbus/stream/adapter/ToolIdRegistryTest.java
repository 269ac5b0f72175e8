package com.linlay.agentbus.stream.adapter;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class ToolIdRegistryTest {

    private final ToolIdRegistry registry = new ToolIdRegistry("tool");

    @Test
    void shouldPairAnonymousCompletionsWithOldestOpenToolOfSameName() {
        String first = registry.onStart(null, "Read");
        String second = registry.onStart(null, "Read");
        String grep = registry.onStart(null, "Grep");

        assertThat(first).isEqualTo("tool_1");
        assertThat(registry.onComplete(null, "Read")).isEqualTo(first);
        assertThat(registry.onComplete(null, "Grep")).isEqualTo(grep);
        assertThat(registry.onComplete(null, "Read")).isEqualTo(second);
        assertThat(registry.openCount()).isZero();
    }

    @Test
    void shouldPreferExplicitIds() {
        registry.onStart("call_1", "Read");
        registry.onStart(null, "Read");

        assertThat(registry.onComplete("call_1", null)).isEqualTo("call_1");
        assertThat(registry.openCount()).isEqualTo(1);
    }

    @Test
    void shouldSynthesizeIdForUnknownCompletion() {
        assertThat(registry.onComplete(null, "Write")).startsWith("tool_");

        registry.onStart(null, "Write");
        registry.clear();

        assertThat(registry.openCount()).isZero();
    }
}
