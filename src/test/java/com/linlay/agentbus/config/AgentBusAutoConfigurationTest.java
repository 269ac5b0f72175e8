package com.linlay.agentbus.config;

import com.linlay.agentbus.stream.adapter.PushSettings;
import com.linlay.agentbus.stream.adapter.StreamRetryPolicy;
import com.linlay.agentbus.stream.bus.BusEventLogger;
import com.linlay.agentbus.stream.bus.EventBus;
import com.linlay.agentbus.stream.consumer.StreamPipelineConsumer;
import com.linlay.agentbus.stream.service.StreamPipeline;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

class AgentBusAutoConfigurationTest {

    private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
            .withConfiguration(AutoConfigurations.of(AgentBusAutoConfiguration.class));

    @Test
    void shouldRegisterPipelineWithDefaults() {
        contextRunner.run(context -> {
            assertThat(context).hasSingleBean(EventBus.class);
            assertThat(context).hasSingleBean(StreamPipeline.class);
            assertThat(context).hasBean(AgentBusAutoConfiguration.FLUSH_SCHEDULER_BEAN);

            StreamPipeline pipeline = context.getBean(StreamPipeline.class);
            assertThat(pipeline.eventBus()).isSameAs(context.getBean(EventBus.class));
            assertThat(context.getBean(StreamPipelineConsumer.class)).isSameAs(pipeline.consumer());

            AgentBusProperties properties = context.getBean(AgentBusProperties.class);
            assertThat(properties.flushInterval()).isEqualTo(Duration.ofMillis(16));
            assertThat(properties.correlation().dispatchToolNames()).contains("Task", "launch_agent");
            assertThat(properties.echo().toolNames()).containsExactly("Task", "task");
            assertThat(context.getBean(PushSettings.class).highWaterMark()).isEqualTo(1000);
            assertThat(context.getBean(StreamRetryPolicy.class).maxAttempts()).isEqualTo(5);
            assertThat(context.getBean(BusEventLogger.class).isRunning()).isFalse();
        });
    }

    @Test
    void shouldBindPropertyOverrides() {
        contextRunner
                .withPropertyValues(
                        "agent.bus.flush-interval=50ms",
                        "agent.bus.debug-events=true",
                        "agent.bus.adapter.high-water-mark=10",
                        "agent.bus.adapter.drain-batch-size=2",
                        "agent.bus.retry.max-attempts=2",
                        "agent.bus.echo.tool-names=delegate")
                .run(context -> {
                    AgentBusProperties properties = context.getBean(AgentBusProperties.class);
                    assertThat(properties.flushInterval()).isEqualTo(Duration.ofMillis(50));
                    assertThat(properties.echo().toolNames()).containsExactly("delegate");
                    PushSettings settings = context.getBean(PushSettings.class);
                    assertThat(settings.highWaterMark()).isEqualTo(10);
                    assertThat(settings.drainBatchSize()).isEqualTo(2);
                    assertThat(context.getBean(StreamRetryPolicy.class).maxAttempts()).isEqualTo(2);
                    assertThat(context.getBean(BusEventLogger.class).isRunning()).isTrue();
                });
    }

    @Test
    void shouldRejectNonPositiveHighWaterMark() {
        contextRunner
                .withPropertyValues("agent.bus.adapter.high-water-mark=0")
                .run(context -> assertThat(context).hasFailed());
    }

    @Test
    void shouldBackOffWhenApplicationDefinesEventBus() {
        EventBus custom = new EventBus();
        contextRunner
                .withBean(EventBus.class, () -> custom)
                .run(context -> {
                    assertThat(context).hasSingleBean(EventBus.class);
                    assertThat(context.getBean(StreamPipeline.class).eventBus()).isSameAs(custom);
                });
    }
}
