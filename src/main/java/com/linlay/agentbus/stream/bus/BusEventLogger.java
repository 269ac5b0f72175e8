package com.linlay.agentbus.stream.bus;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.linlay.agentbus.stream.model.BusEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.Disposable;

import java.util.Objects;

/**
 * Debug tap on the bus: logs every published event as its JSON envelope.
 */
public class BusEventLogger {

    private static final Logger log = LoggerFactory.getLogger(BusEventLogger.class);

    private final EventBus eventBus;
    private final ObjectMapper objectMapper;
    private Disposable subscription;

    public BusEventLogger(EventBus eventBus, ObjectMapper objectMapper) {
        this.eventBus = Objects.requireNonNull(eventBus, "eventBus must not be null");
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper must not be null");
    }

    public synchronized void start() {
        if (subscription != null) {
            return;
        }
        subscription = eventBus.subscribeAll(this::log);
        log.debug("Bus event logging enabled");
    }

    public synchronized void stop() {
        if (subscription == null) {
            return;
        }
        subscription.dispose();
        subscription = null;
    }

    public synchronized boolean isRunning() {
        return subscription != null;
    }

    String toJson(BusEvent event) {
        try {
            return objectMapper.writeValueAsString(event.toData());
        } catch (JsonProcessingException ex) {
            return String.valueOf(event.toData());
        }
    }

    private void log(BusEvent event) {
        if (log.isDebugEnabled()) {
            log.debug("[bus] {}", toJson(event));
        }
    }
}
