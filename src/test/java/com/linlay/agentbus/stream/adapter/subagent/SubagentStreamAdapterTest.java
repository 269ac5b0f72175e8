package com.linlay.agentbus.stream.adapter.subagent;

import com.fasterxml.jackson.databind.JsonNode;
import com.linlay.agentbus.stream.adapter.ProviderStreamException;
import com.linlay.agentbus.stream.adapter.StreamOptions;
import com.linlay.agentbus.stream.bus.EventBus;
import com.linlay.agentbus.stream.model.BusEvent;
import com.linlay.agentbus.stream.model.BusEventType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Sinks;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.util.List;

import static com.linlay.agentbus.stream.adapter.AdapterFixtures.items;
import static com.linlay.agentbus.stream.adapter.AdapterFixtures.ofType;
import static com.linlay.agentbus.stream.adapter.AdapterFixtures.recordAll;
import static com.linlay.agentbus.stream.adapter.AdapterFixtures.session;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SubagentStreamAdapterTest {

    private List<BusEvent> events;
    private SubagentStreamAdapter adapter;

    @BeforeEach
    void setUp() {
        EventBus eventBus = new EventBus();
        events = recordAll(eventBus);
        adapter = new SubagentStreamAdapter(eventBus, "parent", "agent_1");
    }

    @Test
    void shouldPublishAgentScopedEventsUnderParentSession() {
        Flux<JsonNode> stream = items(
                "{'type':'thinking','content':'plan','metadata':{'thinkingSourceKey':'t1'}}",
                "{'type':'thinking','content':'','metadata':{'thinkingSourceKey':'t1','streamingStats':{'thinkingMs':40}}}",
                "{'type':'text','content':'Found '}",
                "{'type':'tool_use','content':{'id':'tu_1','name':'Grep','input':{'pattern':'TODO'}}}",
                "{'type':'tool_result','tool_use_id':'tu_1','content':'2 matches','metadata':{'tokenUsage':{'inputTokens':30,'outputTokens':4}}}",
                "{'type':'text','content':'2 files','metadata':{'tokenUsage':{'inputTokens':10,'outputTokens':6},'model':'haiku'}}"
        );

        SubagentStreamResult result = adapter.consume(session("child", stream), "scan", StreamOptions.of(4, "m1")).block();

        assertThat(result).isNotNull();
        assertThat(result.agentId()).isEqualTo("agent_1");
        assertThat(result.success()).isTrue();
        assertThat(result.output()).isEqualTo("Found 2 files");
        assertThat(result.error()).isNull();
        assertThat(result.toolUses()).isEqualTo(1);
        assertThat(result.inputTokens()).isEqualTo(40);
        assertThat(result.outputTokens()).isEqualTo(10);
        assertThat(result.thinkingDurationMs()).isEqualTo(40);
        assertThat(result.toolDetails()).singleElement().satisfies(detail -> {
            assertThat(detail.toolId()).isEqualTo("tu_1");
            assertThat(detail.toolName()).isEqualTo("Grep");
            assertThat(detail.success()).isTrue();
        });

        assertThat(events).allSatisfy(event -> {
            assertThat(event.sessionId()).isEqualTo("parent");
            assertThat(event.runId()).isEqualTo(4);
        });
        assertThat(events).extracting(BusEvent::type).containsExactly(
                BusEventType.THINKING_DELTA,
                BusEventType.THINKING_COMPLETE,
                BusEventType.TEXT_DELTA,
                BusEventType.AGENT_UPDATE,
                BusEventType.TOOL_START,
                BusEventType.AGENT_UPDATE,
                BusEventType.TOOL_COMPLETE,
                BusEventType.USAGE,
                BusEventType.TEXT_DELTA,
                BusEventType.USAGE,
                BusEventType.TEXT_COMPLETE
        );
        assertThat(ofType(events, BusEventType.TEXT_DELTA)).allSatisfy(event -> {
            assertThat(event.string("agentId")).isEqualTo("agent_1");
            assertThat(event.string("messageId")).isEqualTo("subagent-agent_1");
        });
        assertThat(ofType(events, BusEventType.TOOL_START).get(0).string("parentAgentId")).isEqualTo("agent_1");
        assertThat(ofType(events, BusEventType.AGENT_UPDATE).get(0).string("currentTool")).isEqualTo("Grep");
        assertThat(ofType(events, BusEventType.AGENT_UPDATE).get(1).value("currentTool")).isNull();
        assertThat(ofType(events, BusEventType.USAGE)).extracting(event -> event.number("inputTokens"))
                .containsExactly(30L, 40L);
        BusEvent complete = ofType(events, BusEventType.TEXT_COMPLETE).get(0);
        assertThat(complete.string("fullText")).isEqualTo("Found 2 files");
        assertThat(complete.string("agentId")).isEqualTo("agent_1");
        assertThat(events).noneMatch(event -> event.type() == BusEventType.SESSION_IDLE);
    }

    @Test
    void shouldReportToolErrors() {
        Flux<JsonNode> stream = items(
                "{'type':'tool_use','name':'Bash','id':'tu_9','input':{'command':'make'}}",
                "{'type':'tool_result','toolUseId':'tu_9','content':{'error':'exit 2'}}"
        );

        SubagentStreamResult result = adapter.consume(session("child", stream), "build", StreamOptions.of(1, "m1")).block();

        assertThat(result.toolDetails()).singleElement().satisfies(detail -> assertThat(detail.success()).isFalse());
        BusEvent toolComplete = ofType(events, BusEventType.TOOL_COMPLETE).get(0);
        assertThat(toolComplete.flag("success")).isFalse();
        assertThat(toolComplete.string("error")).isEqualTo("exit 2");
        assertThat(toolComplete.string("toolName")).isEqualTo("Bash");
    }

    @Test
    void shouldFoldProviderFailureIntoResult() {
        Flux<JsonNode> stream = Flux.concat(
                items("{'type':'text','content':'partial'}"),
                Flux.error(new ProviderStreamException("gateway", 502, null)));

        StepVerifier.create(adapter.consume(session("child", stream), "scan", StreamOptions.of(1, "m1")))
                .assertNext(result -> {
                    assertThat(result.success()).isFalse();
                    assertThat(result.error()).isEqualTo("Server error (502)");
                    assertThat(result.output()).isEqualTo("partial");
                })
                .verifyComplete();

        BusEvent error = ofType(events, BusEventType.SESSION_ERROR).get(0);
        assertThat(error.string("code")).isEqualTo(SubagentStreamAdapter.SUBAGENT_ERROR);
        assertThat(error.flag("recoverable")).isTrue();
        assertThat(ofType(events, BusEventType.TEXT_COMPLETE).get(0).string("fullText")).isEqualTo("partial");
    }

    @Test
    void shouldReturnCancelledResultWithoutCompletionEvents() {
        Sinks.Empty<Void> cancel = Sinks.empty();
        Flux<JsonNode> stream = Flux.concat(items("{'type':'text','content':'half'}"), Flux.never());
        StreamOptions options = StreamOptions.of(1, "m1").withCancelSignal(cancel.asMono());

        StepVerifier.create(adapter.consume(session("child", stream), "scan", options))
                .then(cancel::tryEmitEmpty)
                .assertNext(result -> {
                    assertThat(result.success()).isFalse();
                    assertThat(result.error()).isEqualTo("Sub-agent was cancelled");
                    assertThat(result.output()).isEqualTo("half");
                })
                .expectComplete()
                .verify(Duration.ofSeconds(5));

        assertThat(events).extracting(BusEvent::type).containsExactly(BusEventType.TEXT_DELTA);
    }

    @Test
    void shouldRequireIdentifiers() {
        EventBus eventBus = new EventBus();

        assertThatThrownBy(() -> new SubagentStreamAdapter(eventBus, " ", "agent_1"))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new SubagentStreamAdapter(eventBus, "parent", null))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
