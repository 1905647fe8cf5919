package com.datapulse.etl.model;

import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class PipelineRunTest {

    @Test
    void keepsOnlyTheFirstErrorsButCountsThemAll() {
        PipelineRun run = PipelineRun.start(2);

        run.addError("one");
        run.addError("two");
        run.addError("three");

        PipelineReport report = run.toReport();
        assertThat(report.errors()).containsExactly("one", "two");
        assertThat(report.totalErrors()).isEqualTo(3);
    }

    @Test
    void reportIsASnapshot() {
        PipelineRun run = PipelineRun.start(20);
        run.counters(Domain.BOOKS).setExtracted(4);

        PipelineReport report = run.toReport();
        run.counters(Domain.BOOKS).setExtracted(9);

        assertThat(report.counters().get(Domain.BOOKS).getExtracted()).isEqualTo(4);
    }

    @Test
    void batchIdsAreUnique() {
        assertThat(PipelineRun.start(1).getBatchId()).isNotEqualTo(PipelineRun.start(1).getBatchId());
    }

    @Test
    void exitCodeFollowsTheLastPhase() {
        assertThat(report(RunStatus.PARTIAL, PipelinePhase.DONE).exitCode()).isZero();
        assertThat(report(RunStatus.SUCCESS, PipelinePhase.DONE).exitCode()).isZero();
        assertThat(report(RunStatus.FAILED, PipelinePhase.FAILED).exitCode()).isEqualTo(1);
        assertThat(report(RunStatus.CANCELLED, PipelinePhase.CANCELLED).exitCode()).isEqualTo(130);
    }

    private static PipelineReport report(RunStatus status, PipelinePhase phase) {
        return new PipelineReport("b", LocalDateTime.now(), LocalDateTime.now(), status, phase, Map.of(), List.of(), 0);
    }
}
