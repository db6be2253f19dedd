package com.gridmaker.api;

import com.gridmaker.config.MakerConfig;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.function.Supplier;

/**
 * One retry schedule shared by REST calls and stream reconnects:
 * bounded attempts, exponential backoff with jitter, capped delay.
 */
public final class RetryPolicy {
    private static final Logger logger = LoggerFactory.getLogger(RetryPolicy.class);

    private static final double MULTIPLIER = 2.0;
    private static final double JITTER = 0.2;

    private final String name;
    private final int maxAttempts;
    private final Duration maxDelay;
    private final IntervalFunction backoff;
    private final Retry retry;

    public RetryPolicy(String name, int maxAttempts, Duration baseDelay, Duration maxDelay) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1");
        }
        this.name = name;
        this.maxAttempts = maxAttempts;
        this.maxDelay = maxDelay;
        this.backoff = IntervalFunction.ofExponentialRandomBackoff(baseDelay, MULTIPLIER, JITTER, maxDelay);

        var config = RetryConfig.custom()
            .maxAttempts(maxAttempts)
            .intervalFunction(backoff)
            .retryOnException(e -> e instanceof ExchangeException ex && ex.isRetryable())
            .build();
        this.retry = Retry.of(name, config);

        retry.getEventPublisher()
            .onRetry(event -> logger.warn("⚠️ {} attempt {}/{} failed: {} - retrying in {}ms",
                name, event.getNumberOfRetryAttempts(), maxAttempts,
                event.getLastThrowable() != null ? event.getLastThrowable().getMessage() : "unknown",
                event.getWaitInterval().toMillis()));
    }

    public static RetryPolicy fromConfig(String name, MakerConfig config) {
        return new RetryPolicy(name, config.getRestMaxAttempts(), config.getRetryBaseDelay(), config.getRetryMaxDelay());
    }

    /**
     * Run the call, retrying {@link ExchangeException}s. The last failure is rethrown.
     */
    public <T> T execute(String operation, Supplier<T> call) {
        try {
            return Retry.decorateSupplier(retry, call).get();
        } catch (ExchangeException e) {
            logger.error("❌ {} {} failed after {} attempts: {}", name, operation, maxAttempts, e.getMessage());
            throw e;
        }
    }

    /**
     * Delay before the given attempt (1-based), used by callers that schedule retries themselves.
     */
    public Duration backoffFor(int attempt) {
        long millis = backoff.apply(Math.max(1, attempt));
        return Duration.ofMillis(Math.min(millis, maxDelay.toMillis()));
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    public String getName() {
        return name;
    }
}
