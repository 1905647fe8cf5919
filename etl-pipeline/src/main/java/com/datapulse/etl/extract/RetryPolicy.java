package com.datapulse.etl.extract;

import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import lombok.Builder;
import lombok.Value;

import java.time.Duration;

/**
 * Bounded retry with a backoff that grows with the attempt index.
 * Immutable; each extractor holds its own copy.
 */
@Value
@Builder
public class RetryPolicy {

    public enum Backoff { LINEAR, EXPONENTIAL }

    @Builder.Default
    int maxAttempts = 3;

    @Builder.Default
    Duration baseDelay = Duration.ofSeconds(1);

    @Builder.Default
    Backoff backoff = Backoff.LINEAR;

    @Builder.Default
    Duration maxDelay = Duration.ofMinutes(1);

    /**
     * Wait before the next attempt once attempt number {@code failedAttempt} (1-based) failed.
     * LINEAR: base x n. EXPONENTIAL: base x 2^(n-1). Both capped at {@link #maxDelay}.
     */
    public Duration delayAfter(int failedAttempt) {
        int n = Math.max(1, failedAttempt);
        long baseMillis = baseDelay.toMillis();
        long millis = switch (backoff) {
            case LINEAR -> baseMillis * n;
            case EXPONENTIAL -> baseMillis * (1L << Math.min(n - 1, 30));
        };
        return Duration.ofMillis(Math.min(millis, maxDelay.toMillis()));
    }

    /**
     * Resilience4j retry that retries transient fetch outcomes only. Exceptions, including
     * {@link PipelineCancelledException}, are never retried.
     */
    public Retry toRetry(String name) {
        RetryConfig config = RetryConfig.<FetchOutcome>custom()
                .maxAttempts(Math.max(1, maxAttempts))
                .intervalFunction((IntervalFunction) attempt -> delayAfter(attempt).toMillis())
                .retryOnResult(FetchOutcome::isTransient)
                .retryOnException(e -> false)
                .build();
        return Retry.of(name, config);
    }
}
