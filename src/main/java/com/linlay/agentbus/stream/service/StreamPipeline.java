package com.linlay.agentbus.stream.service;

import com.linlay.agentbus.config.AgentBusProperties;
import com.linlay.agentbus.stream.bus.EventBus;
import com.linlay.agentbus.stream.consumer.CorrelationService;
import com.linlay.agentbus.stream.consumer.EchoSuppressor;
import com.linlay.agentbus.stream.consumer.StreamPipelineConsumer;
import com.linlay.agentbus.stream.model.RenderCommand;
import com.linlay.agentbus.stream.model.Run;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.Disposable;
import reactor.core.scheduler.Scheduler;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;

/**
 * Wires bus, dispatcher, correlation, echo suppression and the render boundary for one chat surface.
 */
public class StreamPipeline implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(StreamPipeline.class);

    private final EventBus eventBus;
    private final BatchDispatcher dispatcher;
    private final CorrelationService correlationService;
    private final StreamPipelineConsumer consumer;
    private final Disposable dispatcherRegistration;
    private final AtomicLong runSequence = new AtomicLong();

    public StreamPipeline(EventBus eventBus, Scheduler scheduler) {
        this(eventBus, scheduler, new AgentBusProperties());
    }

    public StreamPipeline(EventBus eventBus, Scheduler scheduler, AgentBusProperties properties) {
        this.eventBus = Objects.requireNonNull(eventBus, "eventBus must not be null");
        Objects.requireNonNull(properties, "properties must not be null");
        this.correlationService = new CorrelationService(properties.correlation().dispatchToolNames());
        this.consumer = new StreamPipelineConsumer(correlationService, new EchoSuppressor(),
                properties.echo().toolNames());
        this.dispatcher = new BatchDispatcher(eventBus, properties.flushInterval(), scheduler);
        this.dispatcherRegistration = dispatcher.addConsumer(consumer::accept);
    }

    /**
     * Flushes whatever the previous run left pending, then supersedes it with a new run.
     */
    public Run startRun(String sessionId) {
        dispatcher.flush();
        long runId = runSequence.incrementAndGet();
        Run run = correlationService.startRun(runId, sessionId);
        consumer.reset();
        log.info("Run {} started for session {}", runId, sessionId);
        return run;
    }

    public long currentRunId() {
        return runSequence.get();
    }

    public Disposable onBatch(Consumer<List<RenderCommand>> handler) {
        return consumer.onBatch(handler);
    }

    public void flush() {
        dispatcher.flush();
    }

    public EventBus eventBus() {
        return eventBus;
    }

    public BatchDispatcher dispatcher() {
        return dispatcher;
    }

    public CorrelationService correlationService() {
        return correlationService;
    }

    public StreamPipelineConsumer consumer() {
        return consumer;
    }

    @Override
    public void close() {
        dispatcherRegistration.dispose();
        dispatcher.dispose();
        correlationService.reset();
        consumer.reset();
    }
}
