package com.datapulse.etl.scheduler;

import com.datapulse.etl.config.DataPulseProperties;
import com.datapulse.etl.model.PipelinePhase;
import com.datapulse.etl.model.PipelineReport;
import com.datapulse.etl.model.RunStatus;
import com.datapulse.etl.output.GoldSchema;
import com.datapulse.etl.service.PipelineRunner;
import com.datapulse.etl.service.RunOptions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.boot.DefaultApplicationArguments;
import org.springframework.context.ApplicationContext;
import org.springframework.dao.DataAccessResourceFailureException;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class PipelineSchedulerTest {

    @Mock
    private PipelineRunner pipelineRunner;

    @Mock
    private GoldSchema goldSchema;

    @Mock
    private ApplicationContext applicationContext;

    private DataPulseProperties properties;
    private PipelineScheduler scheduler;

    @BeforeEach
    void setUp() {
        properties = new DataPulseProperties();
        scheduler = new PipelineScheduler(pipelineRunner, goldSchema, properties, applicationContext);
    }

    @Test
    void startupDoesNotRunByDefault() {
        scheduler.run(new DefaultApplicationArguments());

        verify(pipelineRunner, never()).runNow(any());
    }

    @Test
    void runOnStartupTriggersOneRun() {
        properties.getScheduling().setRunOnStartup(true);
        when(pipelineRunner.runNow(any(RunOptions.class))).thenReturn(new PipelineReport("b", LocalDateTime.now(),
                LocalDateTime.now(), RunStatus.SUCCESS, PipelinePhase.DONE, Map.of(), List.of(), 0));

        scheduler.run(new DefaultApplicationArguments());

        verify(pipelineRunner).runNow(any(RunOptions.class));
    }

    @Test
    void failedStartupRunDoesNotPropagate() {
        properties.getScheduling().setRunOnStartup(true);
        when(pipelineRunner.runNow(any(RunOptions.class))).thenThrow(new RuntimeException("boom"));

        assertThatCode(() -> scheduler.run(new DefaultApplicationArguments())).doesNotThrowAnyException();
    }

    @Test
    void scheduledRunIsSkippedWhileAnotherIsActive() {
        when(pipelineRunner.runNow(any(RunOptions.class))).thenThrow(new IllegalStateException("A pipeline run is already in progress"));

        assertThatCode(() -> scheduler.scheduledRun()).doesNotThrowAnyException();
    }

    @Test
    void unreachableDatabaseOnlyWarnsAtStartup() {
        doThrow(new DataAccessResourceFailureException("connection refused")).when(goldSchema).ensureSchema();

        assertThatCode(() -> scheduler.ensureSchema()).doesNotThrowAnyException();
    }
}
