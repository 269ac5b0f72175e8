package com.linlay.agentbus.stream.adapter;

import com.linlay.agentbus.stream.bus.EventBus;
import com.linlay.agentbus.stream.model.BusEvent;
import com.linlay.agentbus.stream.model.BusEventType;
import reactor.core.Disposable;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Base for adapters fed by a provider emitter. Every event of a turn goes through one
 * {@link PushEventQueue}, so the bus sees them in emission order and off the provider thread.
 */
public abstract class AbstractPushStreamAdapter extends AbstractStreamAdapter {

    public static final String BACKPRESSURE_DROP = "BACKPRESSURE_DROP";

    protected final ProviderEventSource eventSource;

    private final int highWaterMark;
    private final int drainBatchSize;
    private final Scheduler drainScheduler;

    private volatile PushEventQueue queue;
    private volatile Disposable listener;

    protected AbstractPushStreamAdapter(
            EventBus eventBus,
            ProviderEventSource eventSource,
            PushSettings settings,
            StreamRetryPolicy retryPolicy
    ) {
        super(eventBus, retryPolicy);
        this.eventSource = Objects.requireNonNull(eventSource, "eventSource must not be null");
        Objects.requireNonNull(settings, "settings must not be null");
        this.highWaterMark = settings.highWaterMark();
        this.drainBatchSize = settings.drainBatchSize();
        this.drainScheduler = settings.drainScheduler();
    }

    /**
     * Opens the turn's queue and starts listening to the provider emitter.
     */
    protected void openTurn() {
        queue = new PushEventQueue(highWaterMark, drainBatchSize, drainScheduler,
                eventBus::publish, this::backpressureWarning);
        listener = eventSource.listen(this::onNativeEvent);
    }

    /**
     * Waits for the queued backlog after the turn finished, then replays the turn outcome.
     */
    protected Mono<Void> finishTurn(Mono<Void> turn) {
        return turn
                .then(Mono.defer(this::drain))
                .onErrorResume(error -> drain().then(Mono.error(error)))
                .doFinally(signal -> stopListening());
    }

    protected abstract void onNativeEvent(NativeEvent event);

    @Override
    protected void emit(BusEvent event) {
        PushEventQueue current = queue;
        if (current == null) {
            super.emit(event);
            return;
        }
        current.offer(event);
    }

    protected boolean acceptsEvent(NativeEvent event) {
        return queue != null && !isCancelled() && !isDisposed()
                && (event.sessionId() == null || event.sessionId().equals(sessionId()));
    }

    protected long droppedCount() {
        PushEventQueue current = queue;
        return current == null ? 0 : current.droppedCount();
    }

    @Override
    protected void onDispose() {
        stopListening();
        PushEventQueue current = queue;
        if (current != null) {
            current.clear();
        }
    }

    private Mono<Void> drain() {
        PushEventQueue current = queue;
        if (current == null) {
            return Mono.empty();
        }
        stopListening();
        if (isCancelled()) {
            current.clear();
        } else {
            current.close();
        }
        return current.whenDrained();
    }

    private void stopListening() {
        Disposable current = listener;
        if (current != null) {
            listener = null;
            current.dispose();
        }
    }

    private BusEvent backpressureWarning() {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("error", "Provider events arrived faster than they could be rendered; some updates were dropped");
        data.put("code", BACKPRESSURE_DROP);
        data.put("recoverable", true);
        return event(BusEventType.SESSION_ERROR, data);
    }
}
