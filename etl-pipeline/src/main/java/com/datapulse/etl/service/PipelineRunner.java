package com.datapulse.etl.service;

import com.datapulse.etl.extract.CancellationToken;
import com.datapulse.etl.model.PipelineReport;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Entry point shared by the REST API and the scheduler. Allows one active run at a time
 * and keeps the report of the last finished one.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class PipelineRunner {

    private final PipelineOrchestrator orchestrator;

    private final AtomicReference<CancellationToken> active = new AtomicReference<>();
    private volatile PipelineReport lastReport;

    /**
     * Runs on the calling thread.
     *
     * @throws IllegalStateException if another run is active
     */
    public PipelineReport runNow(RunOptions options) {
        CancellationToken token = acquire();
        return execute(options, token);
    }

    /** Starts a run on a background thread; false if another run is active. */
    public boolean startAsync(RunOptions options) {
        CancellationToken token;
        try {
            token = acquire();
        } catch (IllegalStateException e) {
            return false;
        }
        new Thread(() -> execute(options, token), "pipeline-run").start();
        return true;
    }

    /** Cancels the active run; false if none is running. */
    public boolean cancel() {
        CancellationToken token = active.get();
        if (token == null) {
            return false;
        }
        token.cancel();
        return true;
    }

    public boolean isRunning() {
        return active.get() != null;
    }

    public Optional<PipelineReport> lastReport() {
        return Optional.ofNullable(lastReport);
    }

    // ── Internal ─────────────────────────────────────────────────────────────

    private CancellationToken acquire() {
        CancellationToken token = new CancellationToken();
        if (!active.compareAndSet(null, token)) {
            throw new IllegalStateException("A pipeline run is already in progress");
        }
        return token;
    }

    private PipelineReport execute(RunOptions options, CancellationToken token) {
        try {
            PipelineReport report = orchestrator.run(options, token);
            lastReport = report;
            return report;
        } catch (RuntimeException e) {
            log.error("Pipeline run crashed: {}", e.getMessage(), e);
            throw e;
        } finally {
            active.set(null);
        }
    }
}
