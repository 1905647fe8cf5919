package com.datapulse.etl.extract;

import java.time.Duration;
import java.util.function.LongSupplier;

/**
 * Keeps consecutive requests of one client at least {@code minInterval} apart.
 * Owned by a single client instance; calls are serialized on the instance.
 */
public class RequestThrottle {

    @FunctionalInterface
    public interface Sleeper {
        void sleep(Duration duration) throws InterruptedException;
    }

    private final Duration minInterval;
    private final Sleeper sleeper;
    private final LongSupplier nanoClock;
    private long lastRequestNanos;
    private boolean first = true;

    public RequestThrottle(Duration minInterval) {
        this(minInterval, d -> Thread.sleep(d.toMillis()), System::nanoTime);
    }

    public RequestThrottle(Duration minInterval, Sleeper sleeper, LongSupplier nanoClock) {
        this.minInterval = minInterval;
        this.sleeper = sleeper;
        this.nanoClock = nanoClock;
    }

    /**
     * Blocks until the minimum interval since the previous call has elapsed.
     *
     * @throws PipelineCancelledException if the thread is interrupted while waiting
     */
    public synchronized void throttle() {
        if (!first && !minInterval.isZero()) {
            long elapsed = nanoClock.getAsLong() - lastRequestNanos;
            long remaining = minInterval.toNanos() - elapsed;
            if (remaining > 0) {
                try {
                    sleeper.sleep(Duration.ofNanos(remaining));
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new PipelineCancelledException("Interrupted while throttling");
                }
            }
        }
        first = false;
        lastRequestNanos = nanoClock.getAsLong();
    }

    public Duration getMinInterval() {
        return minInterval;
    }
}
