package com.datapulse.etl.service;

import com.datapulse.etl.extract.CancellationToken;
import com.datapulse.etl.model.PipelinePhase;
import com.datapulse.etl.model.PipelineReport;
import com.datapulse.etl.model.RunStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class PipelineRunnerTest {

    @Mock
    private PipelineOrchestrator orchestrator;

    private PipelineRunner runner;

    @BeforeEach
    void setUp() {
        runner = new PipelineRunner(orchestrator);
    }

    private static PipelineReport report(String batchId, RunStatus status, PipelinePhase phase) {
        return new PipelineReport(batchId, LocalDateTime.now(), LocalDateTime.now(), status, phase,
                Map.of(), List.of(), 0);
    }

    @Test
    void runNowKeepsTheLastReport() {
        when(orchestrator.run(any(), any())).thenReturn(report("b1", RunStatus.SUCCESS, PipelinePhase.DONE));

        PipelineReport report = runner.runNow(RunOptions.defaults());

        assertThat(report.batchId()).isEqualTo("b1");
        assertThat(runner.lastReport()).contains(report);
        assertThat(runner.isRunning()).isFalse();
    }

    @Test
    void onlyOneRunAtATimeAndCancelReachesIt() throws Exception {
        CountDownLatch started = new CountDownLatch(1);
        CountDownLatch finished = new CountDownLatch(1);
        when(orchestrator.run(any(), any())).thenAnswer(invocation -> {
            CancellationToken token = invocation.getArgument(1);
            started.countDown();
            while (!token.isCancelled()) {
                Thread.sleep(5);
            }
            finished.countDown();
            return report("b2", RunStatus.CANCELLED, PipelinePhase.CANCELLED);
        });

        assertThat(runner.startAsync(RunOptions.defaults())).isTrue();
        assertThat(started.await(5, TimeUnit.SECONDS)).isTrue();

        assertThat(runner.isRunning()).isTrue();
        assertThat(runner.startAsync(RunOptions.defaults())).isFalse();
        assertThatThrownBy(() -> runner.runNow(RunOptions.defaults())).isInstanceOf(IllegalStateException.class);

        assertThat(runner.cancel()).isTrue();
        assertThat(finished.await(5, TimeUnit.SECONDS)).isTrue();
        for (int i = 0; i < 100 && runner.isRunning(); i++) {
            Thread.sleep(10);
        }
        assertThat(runner.isRunning()).isFalse();
        assertThat(runner.lastReport()).hasValueSatisfying(r -> assertThat(r.exitCode()).isEqualTo(130));
    }

    @Test
    void cancelWithoutActiveRunReturnsFalse() {
        assertThat(runner.cancel()).isFalse();
    }

    @Test
    void crashedRunReleasesTheSlot() {
        when(orchestrator.run(any(), any())).thenThrow(new IllegalStateException("boom"))
                .thenReturn(report("b3", RunStatus.SUCCESS, PipelinePhase.DONE));

        assertThatThrownBy(() -> runner.runNow(RunOptions.defaults())).hasMessage("boom");

        assertThat(runner.isRunning()).isFalse();
        assertThat(runner.runNow(RunOptions.defaults()).batchId()).isEqualTo("b3");
    }
}
