package com.linlay.agentbus.stream.consumer;

import com.linlay.agentbus.stream.model.BusEvent;
import com.linlay.agentbus.stream.model.BusEventType;
import com.linlay.agentbus.stream.model.EnrichedBusEvent;
import com.linlay.agentbus.stream.model.RenderCommand;
import com.linlay.agentbus.stream.model.RenderCommand.AgentStatus;
import com.linlay.agentbus.stream.model.RenderCommand.PromptKind;
import com.linlay.agentbus.stream.model.RenderCommand.SessionState;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class StreamPipelineConsumerTest {

    private CorrelationService correlationService;
    private StreamPipelineConsumer consumer;
    private final List<List<RenderCommand>> rendered = new ArrayList<>();

    @BeforeEach
    void setUp() {
        correlationService = new CorrelationService();
        correlationService.startRun(1, "s1");
        consumer = new StreamPipelineConsumer(correlationService, new EchoSuppressor());
        consumer.onBatch(rendered::add);
    }

    @Test
    void shouldRenderMainTranscriptAndDropSubagentActivity() {
        consumer.accept(List.of(
                event(BusEventType.SESSION_START, Map.of()),
                event(BusEventType.TEXT_DELTA, Map.of("delta", "Hi", "messageId", "m1")),
                event(BusEventType.TEXT_DELTA, Map.of("delta", "inner", "messageId", "m2", "agentId", "a1")),
                toolStart("grep_1", "Grep", Map.of("parentAgentId", "a1")),
                event(BusEventType.TEXT_COMPLETE, Map.of("messageId", "m1", "fullText", "Hi"))
        ));

        assertThat(rendered).hasSize(1);
        assertThat(rendered.get(0)).containsExactly(
                new RenderCommand.SessionStatus("s1", SessionState.STARTED, null, null, null),
                new RenderCommand.AppendText("m1", "Hi"),
                new RenderCommand.CompleteText("m1", "Hi")
        );
    }

    @Test
    void shouldSuppressEchoOfDispatchResult() {
        consumer.accept(List.of(
                toolStart("task_1", "Task", Map.of()),
                toolComplete("task_1", "Task", "The answer is 42")
        ));
        consumer.accept(List.of(
                event(BusEventType.TEXT_DELTA, Map.of("delta", "The answer ", "messageId", "m1")),
                event(BusEventType.TEXT_DELTA, Map.of("delta", "is 42", "messageId", "m1")),
                event(BusEventType.TEXT_DELTA, Map.of("delta", ". Done.", "messageId", "m1"))
        ));

        assertThat(rendered).hasSize(2);
        assertThat(rendered.get(1)).containsExactly(new RenderCommand.AppendText("m1", ". Done."));
    }

    @Test
    void shouldNotRegisterEchoForOtherTools() {
        consumer.accept(List.of(
                toolStart("bash_1", "bash", Map.of()),
                toolComplete("bash_1", "bash", "file.txt"),
                event(BusEventType.TEXT_DELTA, Map.of("delta", "file.txt", "messageId", "m1"))
        ));

        assertThat(rendered.get(0)).contains(new RenderCommand.AppendText("m1", "file.txt"));
    }

    @Test
    void shouldRenderToolInputWithStringKeys() {
        Map<Object, Object> input = new LinkedHashMap<>();
        input.put("path", "a.txt");
        input.put(2, "second");
        consumer.accept(List.of(toolStart("read_1", "Read", Map.of("toolInput", input))));

        assertThat(rendered.get(0)).containsExactly(
                new RenderCommand.OpenTool("read_1", "Read", Map.of("path", "a.txt", "2", "second"), null));
    }

    @Test
    void shouldRenderToolAndAgentLifecycle() {
        consumer.accept(List.of(
                toolStart("task_1", "Task", Map.of("providerCorrelationId", "call_1")),
                agentStart("a1", "call_1"),
                event(BusEventType.AGENT_UPDATE, Map.of("agentId", "a1", "currentTool", "Grep", "toolUses", 2)),
                event(BusEventType.AGENT_COMPLETE, Map.of("agentId", "a1", "success", false, "error", "timeout"))
        ));

        List<RenderCommand> commands = rendered.get(0);
        assertThat(commands).hasSize(4);
        assertThat(commands.get(0)).isEqualTo(new RenderCommand.OpenTool("task_1", "Task", Map.of(), null));
        assertThat(commands.get(1)).isEqualTo(new RenderCommand.UpsertAgent("a1", "task_1", AgentStatus.RUNNING,
                "explore", "scan", true, null, null, null, null));
        assertThat(commands.get(2)).isEqualTo(new RenderCommand.UpsertAgent("a1", "task_1", AgentStatus.RUNNING,
                null, null, null, "Grep", 2, null, null));
        assertThat(commands.get(3)).isEqualTo(new RenderCommand.UpsertAgent("a1", "task_1", AgentStatus.FAILED,
                null, null, null, null, null, null, "timeout"));
    }

    @Test
    void shouldRenderWorkflowPromptsAndUsage() {
        Map<String, Object> permission = new LinkedHashMap<>();
        permission.put("requestId", "r1");
        permission.put("toolName", "bash");
        permission.put("question", "Run ls?");
        permission.put("options", List.of(Map.of("label", "Yes", "value", "yes")));
        BusEvent stepStart = event(BusEventType.WORKFLOW_STEP_START,
                Map.of("workflowId", "wf", "nodeId", "n1", "nodeName", "Plan"));

        consumer.accept(List.of(
                stepStart,
                event(BusEventType.WORKFLOW_TASK_UPDATE, Map.of("workflowId", "wf",
                        "tasks", List.of(Map.of("id", "t1", "title", "Plan", "status", "pending")))),
                event(BusEventType.PERMISSION_REQUESTED, permission),
                event(BusEventType.HUMAN_INPUT_REQUIRED, Map.of("requestId", "r2", "question", "Name?", "nodeId", "n1")),
                event(BusEventType.USAGE, Map.of("inputTokens", 10L, "outputTokens", 5L, "model", "m"))
        ));

        List<RenderCommand> commands = rendered.get(0);
        assertThat(commands.get(0)).isEqualTo(new RenderCommand.WorkflowStep("wf", "n1", "Plan", "running", null,
                stepStart.timestamp()));
        assertThat(commands.get(1)).isInstanceOfSatisfying(RenderCommand.UpsertTaskList.class,
                tasks -> assertThat(tasks.tasks()).hasSize(1));
        assertThat(commands.get(2)).isInstanceOfSatisfying(RenderCommand.PromptUser.class, prompt -> {
            assertThat(prompt.kind()).isEqualTo(PromptKind.PERMISSION);
            assertThat(prompt.toolName()).isEqualTo("bash");
            assertThat(prompt.options()).hasSize(1);
        });
        assertThat(commands.get(3)).isInstanceOfSatisfying(RenderCommand.PromptUser.class, prompt -> {
            assertThat(prompt.kind()).isEqualTo(PromptKind.HUMAN_INPUT);
            assertThat(prompt.nodeId()).isEqualTo("n1");
        });
        assertThat(commands.get(4)).isEqualTo(new RenderCommand.UpdateUsage(null, 10L, 5L, "m"));
    }

    @Test
    void shouldSkipUnownedEventsAndEmptyBatches() {
        consumer.accept(List.of(BusEvent.of(BusEventType.TEXT_DELTA, "other", 0,
                Map.of("delta", "x", "messageId", "m9"))));
        consumer.accept(List.of());

        assertThat(rendered).isEmpty();
    }

    @Test
    void shouldSkipUnrenderableEventAndKeepTheRest() {
        consumer.processBatch(List.of(
                new EnrichedBusEvent(event(BusEventType.TOOL_PARTIAL_RESULT, Map.of("partialOutput", "x")),
                        null, null, false, false, true),
                new EnrichedBusEvent(event(BusEventType.SESSION_IDLE, Map.of("reason", "idle")),
                        null, null, false, false, true)
        ));

        assertThat(rendered.get(0)).containsExactly(
                new RenderCommand.SessionStatus("s1", SessionState.IDLE, "idle", null, null));
    }

    @Test
    void shouldDelegateCorrelationBeforeRendering() {
        CorrelationService mocked = mock(CorrelationService.class);
        when(mocked.processBatch(anyList())).thenReturn(List.of());
        StreamPipelineConsumer isolated = new StreamPipelineConsumer(mocked, new EchoSuppressor());
        List<BusEvent> batch = List.of(event(BusEventType.SESSION_IDLE, Map.of()));

        isolated.accept(batch);

        verify(mocked).processBatch(batch);
    }

    @Test
    void shouldIsolateFailingRenderHandler() {
        List<List<RenderCommand>> second = new ArrayList<>();
        consumer.onBatch(commands -> {
            throw new IllegalStateException("ui gone");
        });
        consumer.onBatch(second::add);

        consumer.accept(List.of(event(BusEventType.SESSION_IDLE, Map.of())));

        assertThat(rendered).hasSize(1);
        assertThat(second).hasSize(1);
    }

    private static BusEvent event(BusEventType type, Map<String, Object> data) {
        return BusEvent.of(type, "s1", 1, data);
    }

    private static BusEvent toolStart(String toolId, String toolName, Map<String, Object> extra) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("toolId", toolId);
        data.put("toolName", toolName);
        data.put("toolInput", Map.of());
        data.putAll(extra);
        return event(BusEventType.TOOL_START, data);
    }

    private static BusEvent toolComplete(String toolId, String toolName, String result) {
        return event(BusEventType.TOOL_COMPLETE,
                Map.of("toolId", toolId, "toolName", toolName, "success", true, "toolResult", result));
    }

    private static BusEvent agentStart(String agentId, String token) {
        return event(BusEventType.AGENT_START, Map.of("agentId", agentId, "agentType", "explore", "task", "scan",
                "isBackground", true, "providerCorrelationId", token));
    }
}
