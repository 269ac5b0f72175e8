package com.linlay.agentbus.stream.service;

import com.linlay.agentbus.stream.bus.EventBus;
import com.linlay.agentbus.stream.model.BusEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.Disposable;
import reactor.core.scheduler.Scheduler;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

/**
 * 将总线事件合并后按固定节奏批量投递给消费者。
 * <p>
 * enqueue 与 flush 由同一把锁串行化；计时器只在缓冲区由空变为非空时挂起一次，
 * flush 时先清空计时器句柄再调用消费者，消费者中再次发布的事件进入下一批。
 */
public class BatchDispatcher implements Disposable {

    private static final Logger log = LoggerFactory.getLogger(BatchDispatcher.class);

    public static final Duration DEFAULT_FLUSH_INTERVAL = Duration.ofMillis(16);

    private final Object lock = new Object();
    private final long flushIntervalNanos;
    private final Scheduler scheduler;
    private final List<Consumer<List<BusEvent>>> consumers = new CopyOnWriteArrayList<>();
    private final Map<String, Integer> coalescingIndex = new HashMap<>();
    private final Disposable busSubscription;

    private List<BusEvent> writeBuffer = new ArrayList<>();
    private List<BusEvent> readBuffer = new ArrayList<>();
    private Disposable flushTask;
    private long lastFlushAt;
    private boolean disposed;

    private long totalFlushed;
    private long totalCoalesced;
    private long flushCount;
    private int lastFlushSize;
    private long lastFlushDurationNanos;

    public BatchDispatcher(EventBus eventBus, Duration flushInterval, Scheduler scheduler) {
        Objects.requireNonNull(eventBus, "eventBus must not be null");
        Objects.requireNonNull(flushInterval, "flushInterval must not be null");
        if (flushInterval.isNegative() || flushInterval.isZero()) {
            throw new IllegalArgumentException("flushInterval must be positive");
        }
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler must not be null");
        this.flushIntervalNanos = flushInterval.toNanos();
        this.lastFlushAt = scheduler.now(TimeUnit.NANOSECONDS);
        this.busSubscription = eventBus.subscribeAll(this::enqueue);
    }

    public Disposable addConsumer(Consumer<List<BusEvent>> consumer) {
        Objects.requireNonNull(consumer, "consumer must not be null");
        consumers.add(consumer);
        return () -> consumers.remove(consumer);
    }

    public void enqueue(BusEvent event) {
        if (event == null) {
            return;
        }
        synchronized (lock) {
            if (disposed) {
                return;
            }
            String key = CoalescingKeys.keyOf(event);
            if (key != null) {
                Integer index = coalescingIndex.get(key);
                if (index != null) {
                    writeBuffer.set(index, event);
                    totalCoalesced++;
                    if (log.isTraceEnabled()) {
                        log.trace("Coalesced {} at index {}", key, index);
                    }
                    return;
                }
                coalescingIndex.put(key, writeBuffer.size());
            }
            writeBuffer.add(event);
            scheduleFlush();
        }
    }

    public void flush() {
        synchronized (lock) {
            if (flushTask != null) {
                flushTask.dispose();
                flushTask = null;
            }
            if (writeBuffer.isEmpty()) {
                return;
            }
            long startedAt = System.nanoTime();
            List<BusEvent> batch = writeBuffer;
            writeBuffer = readBuffer;
            writeBuffer.clear();
            readBuffer = batch;
            coalescingIndex.clear();
            lastFlushAt = scheduler.now(TimeUnit.NANOSECONDS);

            // consumers may keep the batch, the backing buffer is reused on the next swap
            List<BusEvent> view = List.copyOf(batch);
            for (Consumer<List<BusEvent>> consumer : consumers) {
                try {
                    consumer.accept(view);
                } catch (RuntimeException ex) {
                    log.warn("Batch consumer failed on batch of {} events", view.size(), ex);
                }
            }

            flushCount++;
            totalFlushed += batch.size();
            lastFlushSize = batch.size();
            lastFlushDurationNanos = System.nanoTime() - startedAt;
            log.debug("Flushed batch #{} with {} events", flushCount, lastFlushSize);
        }
    }

    public BatchMetrics metrics() {
        synchronized (lock) {
            return new BatchMetrics(totalFlushed, totalCoalesced, flushCount, lastFlushSize,
                    Duration.ofNanos(lastFlushDurationNanos));
        }
    }

    public int pendingCount() {
        synchronized (lock) {
            return writeBuffer.size();
        }
    }

    @Override
    public void dispose() {
        synchronized (lock) {
            if (disposed) {
                return;
            }
            disposed = true;
            if (flushTask != null) {
                flushTask.dispose();
                flushTask = null;
            }
            busSubscription.dispose();
            writeBuffer.clear();
            readBuffer.clear();
            coalescingIndex.clear();
            consumers.clear();
        }
    }

    @Override
    public boolean isDisposed() {
        synchronized (lock) {
            return disposed;
        }
    }

    // caller holds the lock
    private void scheduleFlush() {
        if (flushTask != null) {
            return;
        }
        long elapsed = scheduler.now(TimeUnit.NANOSECONDS) - lastFlushAt;
        if (elapsed >= flushIntervalNanos) {
            flush();
            return;
        }
        flushTask = scheduler.schedule(this::onTimer, flushIntervalNanos - elapsed, TimeUnit.NANOSECONDS);
    }

    private void onTimer() {
        synchronized (lock) {
            flushTask = null;
            if (!disposed) {
                flush();
            }
        }
    }
}
