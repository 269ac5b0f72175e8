package com.linlay.agentbus.stream.adapter;

import com.linlay.agentbus.stream.model.BusEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;
import reactor.core.scheduler.Scheduler;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Iterator;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;
import java.util.function.Supplier;

/**
 * 推送型 provider 的有界缓冲：provider 回调线程只负责入队，由调度器上的单一排空任务按批发布到总线。
 * <p>
 * 超过高水位时丢弃最早的非 delta 事件（delta 永不丢弃），每个队列只发出一次溢出告警事件，且排在下一批之首。
 */
public class PushEventQueue {

    private static final Logger log = LoggerFactory.getLogger(PushEventQueue.class);

    private final Object lock = new Object();
    private final Deque<BusEvent> queue = new ArrayDeque<>();
    private final AtomicBoolean draining = new AtomicBoolean();
    private final Sinks.Empty<Void> drained = Sinks.empty();
    private final int highWaterMark;
    private final int drainBatchSize;
    private final Scheduler scheduler;
    private final Consumer<BusEvent> downstream;
    private final Supplier<BusEvent> overflowWarning;

    private boolean warningPending;
    private boolean warningEmitted;
    private boolean closed;
    private long droppedCount;

    public PushEventQueue(
            int highWaterMark,
            int drainBatchSize,
            Scheduler scheduler,
            Consumer<BusEvent> downstream,
            Supplier<BusEvent> overflowWarning
    ) {
        if (highWaterMark < 1) {
            throw new IllegalArgumentException("highWaterMark must be positive");
        }
        if (drainBatchSize < 1) {
            throw new IllegalArgumentException("drainBatchSize must be positive");
        }
        this.highWaterMark = highWaterMark;
        this.drainBatchSize = drainBatchSize;
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler must not be null");
        this.downstream = Objects.requireNonNull(downstream, "downstream must not be null");
        this.overflowWarning = Objects.requireNonNull(overflowWarning, "overflowWarning must not be null");
    }

    public boolean offer(BusEvent event) {
        if (event == null) {
            return false;
        }
        synchronized (lock) {
            if (closed) {
                return false;
            }
            queue.addLast(event);
            if (queue.size() > highWaterMark) {
                dropOldestNonDelta();
            }
        }
        scheduleDrain();
        return true;
    }

    /**
     * No further offers are accepted; {@link #whenDrained()} completes once the backlog is published.
     */
    public void close() {
        synchronized (lock) {
            closed = true;
        }
        scheduleDrain();
    }

    /**
     * Discards the backlog without publishing it.
     */
    public void clear() {
        synchronized (lock) {
            queue.clear();
            warningPending = false;
            closed = true;
        }
        scheduleDrain();
    }

    public Mono<Void> whenDrained() {
        return drained.asMono();
    }

    public long droppedCount() {
        synchronized (lock) {
            return droppedCount;
        }
    }

    public int size() {
        synchronized (lock) {
            return queue.size();
        }
    }

    // caller holds the lock
    private void dropOldestNonDelta() {
        Iterator<BusEvent> iterator = queue.iterator();
        while (iterator.hasNext()) {
            BusEvent candidate = iterator.next();
            if (!candidate.type().isDelta()) {
                iterator.remove();
                droppedCount++;
                if (!warningEmitted) {
                    warningEmitted = true;
                    warningPending = true;
                    log.warn("Push queue over high-water mark {}, dropping oldest non-delta events (first: {})",
                            highWaterMark, candidate.type().wireName());
                }
                return;
            }
        }
    }

    private void scheduleDrain() {
        if (draining.compareAndSet(false, true)) {
            scheduler.schedule(this::drainPass);
        }
    }

    private void drainPass() {
        for (int published = 0; published < drainBatchSize; published++) {
            BusEvent next;
            synchronized (lock) {
                if (warningPending) {
                    warningPending = false;
                    next = overflowWarning.get();
                } else {
                    next = queue.pollFirst();
                }
            }
            if (next == null) {
                break;
            }
            try {
                downstream.accept(next);
            } catch (RuntimeException ex) {
                log.warn("Failed to publish queued {} event", next.type().wireName(), ex);
            }
        }
        boolean finished;
        synchronized (lock) {
            if (!queue.isEmpty() || warningPending) {
                scheduler.schedule(this::drainPass);
                return;
            }
            draining.set(false);
            finished = closed;
        }
        if (finished) {
            drained.tryEmitEmpty();
        }
    }
}
