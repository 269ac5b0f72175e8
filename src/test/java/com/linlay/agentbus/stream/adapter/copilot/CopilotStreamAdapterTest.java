package com.linlay.agentbus.stream.adapter.copilot;

import com.fasterxml.jackson.databind.JsonNode;
import com.linlay.agentbus.stream.adapter.AbstractPushStreamAdapter;
import com.linlay.agentbus.stream.adapter.AdapterFixtures.ScriptedEventSource;
import com.linlay.agentbus.stream.adapter.ProviderStreamException;
import com.linlay.agentbus.stream.adapter.PushSettings;
import com.linlay.agentbus.stream.adapter.StreamOptions;
import com.linlay.agentbus.stream.adapter.StreamRetryPolicy;
import com.linlay.agentbus.stream.bus.EventBus;
import com.linlay.agentbus.stream.model.BusEvent;
import com.linlay.agentbus.stream.model.BusEventType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Flux;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;

import static com.linlay.agentbus.stream.adapter.AdapterFixtures.ofType;
import static com.linlay.agentbus.stream.adapter.AdapterFixtures.recordAll;
import static com.linlay.agentbus.stream.adapter.AdapterFixtures.session;
import static org.assertj.core.api.Assertions.assertThat;

class CopilotStreamAdapterTest {

    private EventBus eventBus;
    private List<BusEvent> events;
    private ScriptedEventSource source;
    private CopilotStreamAdapter adapter;

    @BeforeEach
    void setUp() {
        eventBus = new EventBus();
        events = recordAll(eventBus);
        source = new ScriptedEventSource();
        adapter = new CopilotStreamAdapter(eventBus, source,
                new PushSettings(1000, 64, Schedulers.immediate()), StreamRetryPolicy.disabled());
    }

    @Test
    void shouldTranslatePushedEventsInEmissionOrder() {
        Flux<JsonNode> stream = source.during(() -> {
            source.emit("assistant.message_delta", "s1", "{'deltaContent':'Hi'}");
            source.emit("tool.execution_start", "s1",
                    "{'toolCallId':'c1','toolName':'task','arguments':{'prompt':'scan'}}");
            source.emit("subagent.started", "s1",
                    "{'toolCallId':'c1','agentName':'explore','agentDescription':'scan','mode':'background'}");
            source.emit("tool.execution_start", "s1",
                    "{'toolCallId':'c2','toolName':'grep','arguments':{},'parentToolCallId':'c1'}");
            source.emit("assistant.message_delta", "s1", "{'deltaContent':'inner','parentToolCallId':'c1'}");
            source.emit("tool.execution_complete", "s1",
                    "{'toolCallId':'c2','success':true,'result':{'content':'found'},'parentToolCallId':'c1'}");
            source.emit("subagent.completed", "s1", "{'toolCallId':'c1'}");
            source.emit("tool.execution_complete", "s1", "{'toolCallId':'c1','success':true,'result':{'content':'done'}}");
            source.emit("assistant.usage", "s1", "{'inputTokens':10,'outputTokens':3,'model':'gpt-4o'}");
            source.emit("assistant.usage", "s1", "{'inputTokens':5,'outputTokens':2}");
            source.emit("assistant.message_delta", "other", "{'deltaContent':'not ours'}");
            source.emit("session.idle", "s1", "{}");
        });

        StepVerifier.create(adapter.startStreaming(session("s1", stream), "hi", StreamOptions.of(3, "m1")))
                .verifyComplete();

        assertThat(events).extracting(BusEvent::type).containsExactly(
                BusEventType.SESSION_START,
                BusEventType.TEXT_DELTA,
                BusEventType.TOOL_START,
                BusEventType.AGENT_START,
                BusEventType.TOOL_START,
                BusEventType.TEXT_DELTA,
                BusEventType.TOOL_COMPLETE,
                BusEventType.AGENT_COMPLETE,
                BusEventType.TOOL_COMPLETE,
                BusEventType.USAGE,
                BusEventType.USAGE,
                BusEventType.TEXT_COMPLETE,
                BusEventType.SESSION_IDLE
        );
        BusEvent agentStart = ofType(events, BusEventType.AGENT_START).get(0);
        assertThat(agentStart.string("agentId")).isEqualTo("c1");
        assertThat(agentStart.string("providerCorrelationId")).isEqualTo("c1");
        assertThat(agentStart.flag("isBackground")).isTrue();
        BusEvent childTool = ofType(events, BusEventType.TOOL_START).get(1);
        assertThat(childTool.string("parentAgentId")).isEqualTo("c1");
        assertThat(ofType(events, BusEventType.TEXT_DELTA).get(1).string("agentId")).isEqualTo("c1");
        BusEvent dispatchComplete = ofType(events, BusEventType.TOOL_COMPLETE).get(1);
        assertThat(dispatchComplete.string("toolName")).isEqualTo("task");
        assertThat(dispatchComplete.string("toolResult")).isEqualTo("done");
        assertThat(ofType(events, BusEventType.USAGE)).extracting(event -> event.number("inputTokens"))
                .containsExactly(10L, 15L);
        assertThat(ofType(events, BusEventType.TEXT_COMPLETE).get(0).string("fullText")).isEqualTo("Hi");
        assertThat(source.isListening()).isFalse();
    }

    @Test
    void shouldIgnoreEventsOutsideTheTurn() {
        source.emit("assistant.message_delta", "s1", "{'deltaContent':'early'}");

        StepVerifier.create(adapter.startStreaming(session("s1", Flux.empty()), "hi", StreamOptions.of(1, "m1")))
                .verifyComplete();
        source.emit("assistant.message_delta", "s1", "{'deltaContent':'late'}");

        assertThat(events).extracting(BusEvent::type)
                .containsExactly(BusEventType.SESSION_START, BusEventType.SESSION_IDLE);
    }

    @Test
    void shouldReportFailedToolAndSubagent() {
        Flux<JsonNode> stream = source.during(() -> {
            source.emit("tool.execution_start", "s1", "{'toolCallId':'c1','toolName':'bash','arguments':{}}");
            source.emit("tool.execution_complete", "s1",
                    "{'toolCallId':'c1','success':false,'error':{'message':'exit 1'}}");
            source.emit("subagent.failed", "s1", "{'toolCallId':'c5','error':'crashed'}");
        });

        StepVerifier.create(adapter.startStreaming(session("s1", stream), "hi", StreamOptions.of(1, "m1")))
                .verifyComplete();

        BusEvent toolComplete = ofType(events, BusEventType.TOOL_COMPLETE).get(0);
        assertThat(toolComplete.flag("success")).isFalse();
        assertThat(toolComplete.string("error")).isEqualTo("exit 1");
        BusEvent agentComplete = ofType(events, BusEventType.AGENT_COMPLETE).get(0);
        assertThat(agentComplete.flag("success")).isFalse();
        assertThat(agentComplete.string("error")).isEqualTo("crashed");
    }

    @Test
    void shouldDrainQueuedEventsBeforeFailing() {
        Flux<JsonNode> stream = Flux.concat(
                source.during(() -> source.emit("assistant.message_delta", "s1", "{'deltaContent':'Hi'}")),
                Flux.error(new ProviderStreamException("unauthorized", 401, null)));

        StepVerifier.create(adapter.startStreaming(session("s1", stream), "hi", StreamOptions.of(1, "m1")))
                .expectError(ProviderStreamException.class)
                .verify(Duration.ofSeconds(5));

        assertThat(events).extracting(BusEvent::type).containsExactly(
                BusEventType.SESSION_START, BusEventType.TEXT_DELTA, BusEventType.SESSION_ERROR);
        assertThat(source.isListening()).isFalse();
    }

    @Test
    void shouldDropOldestEventsAndWarnOnceUnderBackpressure() {
        List<Runnable> tasks = new ArrayList<>();
        Scheduler manual = Schedulers.fromExecutor(tasks::add);
        CopilotStreamAdapter bounded = new CopilotStreamAdapter(eventBus, source,
                new PushSettings(5, 64, manual), StreamRetryPolicy.disabled());
        Flux<JsonNode> stream = source.during(() -> {
            for (int i = 0; i < 10; i++) {
                source.emit("tool.execution_start", "s1", "{'toolCallId':'c" + i + "','toolName':'bash','arguments':{}}");
            }
        });

        CompletableFuture<Void> done = bounded.startStreaming(session("s1", stream), "hi", StreamOptions.of(1, "m1"))
                .toFuture();
        assertThat(done).isNotDone();
        while (!tasks.isEmpty()) {
            tasks.remove(0).run();
        }

        assertThat(done).isDone();
        List<BusEvent> warnings = ofType(events, BusEventType.SESSION_ERROR);
        assertThat(warnings).hasSize(1);
        assertThat(warnings.get(0).string("code")).isEqualTo(AbstractPushStreamAdapter.BACKPRESSURE_DROP);
        assertThat(warnings.get(0).flag("recoverable")).isTrue();
        assertThat(events).hasSize(6);
        assertThat(events.get(0).type()).isEqualTo(BusEventType.SESSION_ERROR);
        assertThat(events.get(5).type()).isEqualTo(BusEventType.SESSION_IDLE);
    }
}
