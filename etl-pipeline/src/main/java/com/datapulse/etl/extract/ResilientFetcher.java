package com.datapulse.etl.extract;

import io.github.resilience4j.retry.Retry;
import lombok.extern.slf4j.Slf4j;

/**
 * A {@link PageFetcher} wrapped with one client's throttle and retry policy.
 *
 * Every attempt, retries included, passes through the throttle, and the token is checked
 * before each attempt so a cancelled run stops between retries.
 */
@Slf4j
public class ResilientFetcher {

    private final PageFetcher fetcher;
    private final RetryPolicy retryPolicy;
    private final RequestThrottle throttle;
    private final Retry retry;

    public ResilientFetcher(String name, PageFetcher fetcher, RetryPolicy retryPolicy, RequestThrottle throttle) {
        this.fetcher = fetcher;
        this.retryPolicy = retryPolicy;
        this.throttle = throttle;
        this.retry = retryPolicy.toRetry(name);
        this.retry.getEventPublisher().onRetry(event ->
                log.warn("[{}] attempt {} failed ({}), retrying in {}ms",
                        name, event.getNumberOfRetryAttempts(),
                        event.getLastThrowable() != null ? event.getLastThrowable().getMessage() : "transient outcome",
                        event.getWaitInterval().toMillis()));
    }

    public FetchOutcome fetch(String url, CancellationToken token) {
        FetchOutcome outcome = Retry.decorateSupplier(retry, () -> {
            token.throwIfCancelled();
            throttle.throttle();
            return fetcher.get(url, token);
        }).get();

        if (outcome.isTransient()) {
            log.error("GET {} failed after {} attempts: {}", url, retryPolicy.getMaxAttempts(), outcome.reason());
        }
        return outcome;
    }

    public RetryPolicy getRetryPolicy() {
        return retryPolicy;
    }
}
