package com.datapulse.etl.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;

/**
 * Immutable end-of-run summary, returned by the REST API and logged at the end of each run.
 *
 * @param errors      the first N error messages
 * @param totalErrors all errors recorded, including those not kept in {@code errors}
 */
public record PipelineReport(
        String batchId,
        LocalDateTime startedAt,
        LocalDateTime completedAt,
        RunStatus status,
        PipelinePhase lastPhase,
        Map<Domain, DomainCounters> counters,
        List<String> errors,
        int totalErrors) {

    /** True when extract, transform and load all ran to the end. */
    public boolean completedAllPhases() {
        return lastPhase == PipelinePhase.DONE;
    }

    /** 0 when every phase completed, 1 on failure, 130 when cancelled. */
    public int exitCode() {
        if (completedAllPhases()) {
            return 0;
        }
        return status == RunStatus.CANCELLED ? 130 : 1;
    }

    @JsonIgnore
    public Duration duration() {
        if (startedAt == null || completedAt == null) {
            return Duration.ZERO;
        }
        return Duration.between(startedAt, completedAt);
    }
}
