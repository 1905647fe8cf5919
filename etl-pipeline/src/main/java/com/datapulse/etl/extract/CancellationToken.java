package com.datapulse.etl.extract;

import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative cancellation shared by every component of one run.
 *
 * Loops call {@link #throwIfCancelled()} between pages, rows and records. In-flight HTTP
 * calls register a callback with {@link #onCancel(Runnable)} so they can be aborted
 * without waiting for their timeout.
 */
@Slf4j
public class CancellationToken {

    private final AtomicBoolean cancelled = new AtomicBoolean(false);
    private final List<Runnable> callbacks = new CopyOnWriteArrayList<>();

    public static CancellationToken none() {
        return new CancellationToken();
    }

    public void cancel() {
        if (cancelled.compareAndSet(false, true)) {
            log.info("Cancellation requested");
            for (Runnable callback : callbacks) {
                try {
                    callback.run();
                } catch (RuntimeException e) {
                    log.warn("Cancellation callback failed: {}", e.getMessage());
                }
            }
        }
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    public void throwIfCancelled() {
        if (cancelled.get()) {
            throw new PipelineCancelledException("Run cancelled");
        }
    }

    /**
     * Runs {@code callback} when the token is cancelled, immediately if it already is.
     * Close the returned registration once the guarded call is over.
     */
    public Registration onCancel(Runnable callback) {
        callbacks.add(callback);
        if (cancelled.get()) {
            callback.run();
        }
        return () -> callbacks.remove(callback);
    }

    @FunctionalInterface
    public interface Registration extends AutoCloseable {
        @Override
        void close();
    }
}
