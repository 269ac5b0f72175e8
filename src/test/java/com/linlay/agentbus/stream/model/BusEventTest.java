package com.linlay.agentbus.stream.model;

import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class BusEventTest {

    @Test
    void shouldCopyPayloadDefensively() {
        Map<String, Object> data = new HashMap<>();
        data.put("delta", "a");
        BusEvent event = BusEvent.of(BusEventType.TEXT_DELTA, "s1", 1, data);

        data.put("delta", "b");

        assertThat(event.string("delta")).isEqualTo("a");
        assertThatThrownBy(() -> event.data().put("x", 1)).isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void shouldKeepEnvelopeFieldsOverPayloadKeysWhenFlattening() {
        BusEvent event = new BusEvent(BusEventType.USAGE, "s1", 3, 1000L,
                Map.of("inputTokens", 5L, "outputTokens", 7L, "sessionId", "spoofed"));

        Map<String, Object> flat = event.toData();

        assertThat(flat).containsEntry("type", "stream.usage")
                .containsEntry("sessionId", "s1")
                .containsEntry("runId", 3L)
                .containsEntry("timestamp", 1000L)
                .containsEntry("inputTokens", 5L);
    }

    @Test
    void shouldRejectNegativeRunIdAndNullSession() {
        assertThatThrownBy(() -> BusEvent.of(BusEventType.SESSION_IDLE, "s1", -1, null))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> BusEvent.of(BusEventType.SESSION_IDLE, null, 1, null))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void shouldResolveWireNames() {
        assertThat(BusEventType.fromWireName("stream.tool.partial_result")).isEqualTo(BusEventType.TOOL_PARTIAL_RESULT);
        assertThat(BusEventType.TEXT_DELTA.isDelta()).isTrue();
        assertThat(BusEventType.TEXT_COMPLETE.isDelta()).isFalse();
        assertThatThrownBy(() -> BusEventType.fromWireName("stream.nope"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("stream.nope");
    }

    @Test
    void shouldExposeTypedAccessors() {
        BusEvent event = BusEvent.of(BusEventType.TOOL_COMPLETE, "s1", 1,
                Map.of("toolId", "t1", "toolName", "bash", "success", true, "count", 3));

        assertThat(event.flag("success")).isTrue();
        assertThat(event.number("count")).isEqualTo(3L);
        assertThat(event.string("count")).isNull();
        assertThat(event.withData(Map.of("toolId", "t2")).string("toolId")).isEqualTo("t2");
    }
}
