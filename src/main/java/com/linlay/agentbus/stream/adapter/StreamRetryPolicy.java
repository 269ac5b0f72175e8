package com.linlay.agentbus.stream.adapter;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;
import reactor.util.retry.Retry;

import java.net.ConnectException;
import java.net.SocketTimeoutException;
import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.TimeoutException;
import java.util.function.BooleanSupplier;

/**
 * Exponential backoff for transient provider failures that happen before a turn has produced anything.
 */
public class StreamRetryPolicy {

    private static final Logger log = LoggerFactory.getLogger(StreamRetryPolicy.class);

    private static final Set<Integer> RETRYABLE_STATUS_CODES = Set.of(429, 500, 502, 503, 504);
    private static final List<String> TRANSIENT_PATTERNS = List.of(
            "connection reset",
            "connection refused",
            "timed out",
            "socket hang up",
            "network",
            "overloaded",
            "rate limit",
            "too many requests",
            "service unavailable",
            "bad gateway",
            "gateway timeout",
            "internal server error"
    );

    public record Classification(boolean retryable, String message, Integer statusCode) {
    }

    @FunctionalInterface
    public interface RetryListener {

        void onRetry(int attempt, Duration delay, String message);
    }

    private final int maxAttempts;
    private final Duration initialDelay;
    private final Duration maxDelay;
    private final Scheduler scheduler;

    public StreamRetryPolicy() {
        this(5, Duration.ofSeconds(2), Duration.ofSeconds(30), Schedulers.parallel());
    }

    public StreamRetryPolicy(int maxAttempts, Duration initialDelay, Duration maxDelay, Scheduler scheduler) {
        if (maxAttempts < 0) {
            throw new IllegalArgumentException("maxAttempts must not be negative");
        }
        this.maxAttempts = maxAttempts;
        this.initialDelay = Objects.requireNonNull(initialDelay, "initialDelay must not be null");
        this.maxDelay = Objects.requireNonNull(maxDelay, "maxDelay must not be null");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler must not be null");
    }

    public static StreamRetryPolicy disabled() {
        return new StreamRetryPolicy(0, Duration.ofSeconds(2), Duration.ofSeconds(30), Schedulers.parallel());
    }

    public int maxAttempts() {
        return maxAttempts;
    }

    public Classification classify(Throwable error) {
        if (error == null) {
            return new Classification(false, "Unknown error", null);
        }
        Integer statusCode = error instanceof ProviderStreamException providerError ? providerError.statusCode() : null;
        String message = error.getMessage() == null ? error.getClass().getSimpleName() : error.getMessage();

        if (statusCode != null && RETRYABLE_STATUS_CODES.contains(statusCode)) {
            String retryMessage = switch (statusCode) {
                case 429 -> "Rate limited";
                case 503 -> "Service unavailable";
                default -> "Server error (" + statusCode + ")";
            };
            return new Classification(true, retryMessage, statusCode);
        }
        for (Throwable current = error; current != null; current = current.getCause()) {
            if (current instanceof ConnectException
                    || current instanceof SocketTimeoutException
                    || current instanceof TimeoutException) {
                return new Classification(true, "Connection error: " + current.getClass().getSimpleName(), statusCode);
            }
        }
        String lower = message.toLowerCase(Locale.ROOT);
        for (String pattern : TRANSIENT_PATTERNS) {
            if (lower.contains(pattern)) {
                String retryMessage = lower.contains("overloaded")
                        ? "Provider is overloaded"
                        : lower.contains("rate limit") || lower.contains("too many requests") ? "Rate limited" : message;
                return new Classification(true, retryMessage, statusCode);
            }
        }
        return new Classification(false, message, statusCode);
    }

    /**
     * @param attempt 1-based retry attempt
     */
    public Duration computeDelay(int attempt) {
        int exponent = Math.max(0, Math.min(attempt - 1, 30));
        Duration delay = initialDelay.multipliedBy(1L << exponent);
        return delay.compareTo(maxDelay) > 0 ? maxDelay : delay;
    }

    /**
     * @param producedOutput reports whether the turn already emitted a native event; such failures are final
     */
    public Retry toRetry(BooleanSupplier producedOutput, RetryListener listener) {
        return Retry.backoff(maxAttempts, initialDelay)
                .maxBackoff(maxDelay)
                .jitter(0.0d)
                .scheduler(scheduler)
                .filter(ex -> !producedOutput.getAsBoolean() && classify(ex).retryable())
                .doBeforeRetry(signal -> {
                    int attempt = (int) signal.totalRetries() + 1;
                    Duration delay = computeDelay(attempt);
                    String message = classify(signal.failure()).message();
                    log.warn("Provider stream failed ({}), retry {}/{} in {} ms", message, attempt, maxAttempts, delay.toMillis());
                    listener.onRetry(attempt, delay, message);
                })
                .onRetryExhaustedThrow((spec, signal) -> signal.failure());
    }
}
