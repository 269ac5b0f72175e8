package com.linlay.agentbus.stream.adapter;

import com.fasterxml.jackson.databind.JsonNode;
import com.linlay.agentbus.stream.bus.EventBus;
import com.linlay.agentbus.stream.model.BusEvent;
import com.linlay.agentbus.stream.model.BusEventType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Shared turn bookkeeping for provider adapters. An adapter instance drives one turn at a time.
 */
public abstract class AbstractStreamAdapter implements ProviderStreamAdapter {

    private static final Logger log = LoggerFactory.getLogger(AbstractStreamAdapter.class);

    protected final EventBus eventBus;
    protected final StreamRetryPolicy retryPolicy;

    private final AtomicBoolean disposed = new AtomicBoolean();
    private final AtomicBoolean cancelled = new AtomicBoolean();
    private final StringBuilder text = new StringBuilder();

    private volatile String sessionId = "";
    private volatile long runId;
    private volatile String messageId;
    private volatile boolean idleSeen;
    private volatile boolean textCompleted;

    protected AbstractStreamAdapter(EventBus eventBus, StreamRetryPolicy retryPolicy) {
        this.eventBus = Objects.requireNonNull(eventBus, "eventBus must not be null");
        this.retryPolicy = retryPolicy == null ? StreamRetryPolicy.disabled() : retryPolicy;
    }

    protected void beginTurn(String turnSessionId, StreamOptions options) {
        if (disposed.get()) {
            throw new IllegalStateException(getClass().getSimpleName() + " is disposed");
        }
        this.sessionId = turnSessionId;
        this.runId = options.runId();
        this.messageId = options.messageId();
        this.idleSeen = false;
        this.textCompleted = false;
        this.cancelled.set(false);
        synchronized (text) {
            text.setLength(0);
        }
    }

    /**
     * The provider stream with pre-output retry applied and cut at the cancel signal.
     */
    protected Flux<JsonNode> nativeStream(ProviderSession session, String input, StreamOptions options) {
        AtomicBoolean produced = new AtomicBoolean();
        Mono<Boolean> cancel = options.cancelSignal()
                .then(Mono.fromCallable(() -> {
                    cancelled.set(true);
                    log.debug("Turn cancelled for session {}", sessionId);
                    return Boolean.TRUE;
                }));
        return Flux.defer(() -> session.stream(input, options))
                .doOnNext(item -> produced.set(true))
                .retryWhen(retryPolicy.toRetry(produced::get, this::publishRetry))
                .takeUntilOther(cancel);
    }

    protected BusEvent event(BusEventType type, Map<String, Object> data) {
        return BusEvent.of(type, sessionId, runId, data);
    }

    protected void publish(BusEventType type, Map<String, Object> data) {
        if (cancelled.get()) {
            return;
        }
        if (type == BusEventType.SESSION_IDLE) {
            publishTextComplete();
            idleSeen = true;
        }
        emit(event(type, data));
    }

    /**
     * Delivery channel for adapter events; push adapters route through their queue.
     */
    protected void emit(BusEvent event) {
        eventBus.publish(event);
    }

    protected void publishSessionStart(Map<String, Object> config) {
        Map<String, Object> data = new LinkedHashMap<>();
        putIfNonNull(data, "config", config == null || config.isEmpty() ? null : config);
        publish(BusEventType.SESSION_START, data);
    }

    protected void publishTextDelta(String delta, String agentId) {
        if (delta == null || delta.isEmpty()) {
            return;
        }
        if (agentId == null) {
            synchronized (text) {
                text.append(delta);
            }
        }
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("delta", delta);
        data.put("messageId", messageId);
        putIfNonNull(data, "agentId", agentId);
        publish(BusEventType.TEXT_DELTA, data);
    }

    protected void publishSessionError(String error, String code, boolean recoverable) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("error", JsonPayloads.hasText(error) ? error : "Unknown provider error");
        putIfNonNull(data, "code", code);
        data.put("recoverable", recoverable);
        publish(BusEventType.SESSION_ERROR, data);
    }

    /**
     * Closes the turn: flushes the accumulated text as a completion and marks the session idle
     * when the provider did not.
     */
    protected void completeTurn() {
        if (cancelled.get()) {
            return;
        }
        publishTextComplete();
        if (!idleSeen) {
            Map<String, Object> data = new LinkedHashMap<>();
            data.put("reason", "stream_complete");
            publish(BusEventType.SESSION_IDLE, data);
        }
    }

    // Runs ahead of every session-idle so the full text lands before the idle status.
    private void publishTextComplete() {
        if (textCompleted) {
            return;
        }
        String fullText;
        synchronized (text) {
            fullText = text.toString();
        }
        if (fullText.isEmpty()) {
            return;
        }
        textCompleted = true;
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("messageId", messageId);
        data.put("fullText", fullText);
        publish(BusEventType.TEXT_COMPLETE, data);
    }

    protected Mono<Void> failTurn(Throwable error) {
        if (cancelled.get()) {
            log.debug("Ignoring provider failure after cancel: {}", error.toString());
            return Mono.empty();
        }
        StreamRetryPolicy.Classification classification = retryPolicy.classify(error);
        log.warn("Provider stream failed for session {}: {}", sessionId, classification.message());
        publishSessionError(classification.message(), "PROVIDER_ERROR", false);
        if (error instanceof ProviderStreamException providerError) {
            return Mono.error(providerError);
        }
        return Mono.error(new ProviderStreamException(classification.message(), classification.statusCode(), error));
    }

    protected void publishRetry(int attempt, Duration delay, String message) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("attempt", attempt);
        data.put("delayMs", delay.toMillis());
        data.put("message", message);
        data.put("nextRetryAt", Instant.now().plus(delay).toEpochMilli());
        publish(BusEventType.SESSION_RETRY, data);
    }

    protected boolean isCancelled() {
        return cancelled.get();
    }

    protected boolean isDisposed() {
        return disposed.get();
    }

    protected String sessionId() {
        return sessionId;
    }

    protected long runId() {
        return runId;
    }

    protected String messageId() {
        return messageId;
    }

    @Override
    public void dispose() {
        if (disposed.compareAndSet(false, true)) {
            onDispose();
        }
    }

    protected void onDispose() {
    }

    protected static void putIfNonNull(Map<String, Object> data, String key, Object value) {
        if (value != null) {
            data.put(key, value);
        }
    }
}
