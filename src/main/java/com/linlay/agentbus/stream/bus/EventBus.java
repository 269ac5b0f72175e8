package com.linlay.agentbus.stream.bus;

import com.linlay.agentbus.stream.model.BusEvent;
import com.linlay.agentbus.stream.model.BusEventType;
import com.linlay.agentbus.stream.model.InvalidBusEventException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.Disposable;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * 同步、带类型的事件总线。发布前按事件类型校验负载，校验失败只记录日志并丢弃，不向发布方抛出。
 */
public class EventBus {

    private static final Logger log = LoggerFactory.getLogger(EventBus.class);

    private final Map<BusEventType, List<Registration>> typedHandlers = new ConcurrentHashMap<>();
    private final List<Registration> wildcardHandlers = new CopyOnWriteArrayList<>();
    private final BusEventValidator validator;

    public EventBus() {
        this(new BusEventValidator());
    }

    public EventBus(BusEventValidator validator) {
        this.validator = Objects.requireNonNull(validator, "validator must not be null");
    }

    public Disposable subscribe(BusEventType type, Consumer<BusEvent> handler) {
        Objects.requireNonNull(type, "type must not be null");
        Objects.requireNonNull(handler, "handler must not be null");
        List<Registration> handlers = typedHandlers.computeIfAbsent(type, ignored -> new CopyOnWriteArrayList<>());
        Registration registration = new Registration(handler);
        handlers.add(registration);
        return () -> handlers.remove(registration);
    }

    public Disposable subscribeAll(Consumer<BusEvent> handler) {
        Objects.requireNonNull(handler, "handler must not be null");
        Registration registration = new Registration(handler);
        wildcardHandlers.add(registration);
        return () -> wildcardHandlers.remove(registration);
    }

    /**
     * @return false when the event failed validation and was dropped
     */
    public boolean publish(BusEvent event) {
        try {
            validator.validate(event);
        } catch (InvalidBusEventException ex) {
            log.warn("Dropping invalid bus event: {}", ex.getMessage());
            return false;
        }
        List<Registration> handlers = typedHandlers.get(event.type());
        if (handlers != null) {
            for (Registration registration : handlers) {
                deliver(registration, event);
            }
        }
        for (Registration registration : wildcardHandlers) {
            deliver(registration, event);
        }
        return true;
    }

    public boolean hasHandlers(BusEventType type) {
        List<Registration> handlers = typedHandlers.get(type);
        return (handlers != null && !handlers.isEmpty()) || !wildcardHandlers.isEmpty();
    }

    public int handlerCount() {
        int count = wildcardHandlers.size();
        for (List<Registration> handlers : typedHandlers.values()) {
            count += handlers.size();
        }
        return count;
    }

    public void reset() {
        typedHandlers.clear();
        wildcardHandlers.clear();
    }

    private void deliver(Registration registration, BusEvent event) {
        try {
            registration.handler().accept(event);
        } catch (RuntimeException ex) {
            log.warn("Bus handler failed on {} (session={})", event.type().wireName(), event.sessionId(), ex);
        }
    }

    // identity-based so the same handler may be registered twice and removed once
    private static final class Registration {

        private final Consumer<BusEvent> handler;

        private Registration(Consumer<BusEvent> handler) {
            this.handler = handler;
        }

        private Consumer<BusEvent> handler() {
            return handler;
        }
    }
}
