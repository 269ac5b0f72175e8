package com.linlay.agentbus.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.linlay.agentbus.stream.adapter.PushSettings;
import com.linlay.agentbus.stream.adapter.StreamRetryPolicy;
import com.linlay.agentbus.stream.bus.BusEventLogger;
import com.linlay.agentbus.stream.bus.EventBus;
import com.linlay.agentbus.stream.consumer.StreamPipelineConsumer;
import com.linlay.agentbus.stream.service.StreamPipeline;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.jackson.JacksonAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import reactor.core.publisher.Flux;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

@AutoConfiguration(after = JacksonAutoConfiguration.class)
@ConditionalOnClass({Flux.class, ObjectMapper.class})
@EnableConfigurationProperties(AgentBusProperties.class)
public class AgentBusAutoConfiguration {

    public static final String FLUSH_SCHEDULER_BEAN = "agentBusFlushScheduler";

    @Bean
    @ConditionalOnMissingBean
    public ObjectMapper agentBusObjectMapper() {
        return new ObjectMapper();
    }

    @Bean
    @ConditionalOnMissingBean
    public EventBus eventBus() {
        return new EventBus();
    }

    @Bean(name = FLUSH_SCHEDULER_BEAN, destroyMethod = "dispose")
    @ConditionalOnMissingBean(name = FLUSH_SCHEDULER_BEAN)
    public Scheduler agentBusFlushScheduler() {
        return Schedulers.newSingle("agent-bus-flush", true);
    }

    @Bean(destroyMethod = "close")
    @ConditionalOnMissingBean
    public StreamPipeline streamPipeline(
            EventBus eventBus,
            @Qualifier(FLUSH_SCHEDULER_BEAN) Scheduler flushScheduler,
            AgentBusProperties properties
    ) {
        return new StreamPipeline(eventBus, flushScheduler, properties);
    }

    @Bean
    @ConditionalOnMissingBean
    public StreamPipelineConsumer streamPipelineConsumer(StreamPipeline streamPipeline) {
        return streamPipeline.consumer();
    }

    @Bean
    @ConditionalOnMissingBean
    public StreamRetryPolicy streamRetryPolicy(AgentBusProperties properties) {
        AgentBusProperties.Retry retry = properties.retry();
        return new StreamRetryPolicy(retry.maxAttempts(), retry.initialDelay(), retry.maxDelay(), Schedulers.parallel());
    }

    @Bean
    @ConditionalOnMissingBean
    public PushSettings pushSettings(AgentBusProperties properties) {
        AgentBusProperties.Adapter adapter = properties.adapter();
        return new PushSettings(adapter.highWaterMark(), adapter.drainBatchSize(), Schedulers.boundedElastic());
    }

    @Bean(destroyMethod = "stop")
    @ConditionalOnMissingBean
    public BusEventLogger busEventLogger(EventBus eventBus, ObjectMapper objectMapper, AgentBusProperties properties) {
        BusEventLogger logger = new BusEventLogger(eventBus, objectMapper);
        if (Boolean.TRUE.equals(properties.debugEvents())) {
            logger.start();
        }
        return logger;
    }
}
