package com.datapulse.etl.model;

import lombok.Data;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Batch metadata of one pipeline run. Created when the run starts, mutated by the
 * orchestrator only, and turned into a {@link PipelineReport} when it ends.
 * Stored in the pipeline_runs table.
 */
@Data
public class PipelineRun {

    private static final DateTimeFormatter BATCH_TIME = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");

    private final String batchId;
    private final LocalDateTime startedAt;
    private LocalDateTime completedAt;
    private PipelinePhase phase = PipelinePhase.EXTRACT;
    private RunStatus status = RunStatus.RUNNING;
    private final Map<Domain, DomainCounters> counters = new EnumMap<>(Domain.class);
    private final List<String> errors = new ArrayList<>();
    private final int maxReportedErrors;
    private int totalErrors;

    public static PipelineRun start(int maxReportedErrors) {
        LocalDateTime now = LocalDateTime.now();
        String suffix = UUID.randomUUID().toString().replace("-", "").substring(0, 8);
        return new PipelineRun("pipeline_" + BATCH_TIME.format(now) + "_" + suffix, now, maxReportedErrors);
    }

    public DomainCounters counters(Domain domain) {
        return counters.computeIfAbsent(domain, d -> new DomainCounters());
    }

    /** Keeps the first N messages; all errors are counted. */
    public void addError(String message) {
        totalErrors++;
        if (errors.size() < maxReportedErrors) {
            errors.add(message);
        }
    }

    public PipelineReport toReport() {
        Map<Domain, DomainCounters> copy = new EnumMap<>(Domain.class);
        counters.forEach((domain, c) -> {
            DomainCounters snapshot = new DomainCounters();
            snapshot.setExtracted(c.getExtracted());
            snapshot.setTransformed(c.getTransformed());
            snapshot.setLoaded(c.getLoaded());
            snapshot.setDuplicates(c.getDuplicates());
            snapshot.setInvalid(c.getInvalid());
            snapshot.setFailed(c.getFailed());
            copy.put(domain, snapshot);
        });
        return new PipelineReport(batchId, startedAt, completedAt, status, phase,
                copy, List.copyOf(errors), totalErrors);
    }
}
