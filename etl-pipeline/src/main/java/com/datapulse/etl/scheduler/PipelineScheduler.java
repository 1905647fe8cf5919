package com.datapulse.etl.scheduler;

import com.datapulse.etl.config.DataPulseProperties;
import com.datapulse.etl.model.PipelineReport;
import com.datapulse.etl.output.GoldSchema;
import com.datapulse.etl.service.PipelineRunner;
import com.datapulse.etl.service.RunOptions;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.context.ApplicationContext;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Manages scheduled and on-startup pipeline runs.
 *
 * No schedule by default; set datapulse.scheduling.cron (DATAPULSE_SCHEDULING_CRON) to a
 * Spring cron expression to enable one, e.g. "0 0 3 * * *" for 03:00 every day.
 *
 * With run-on-startup and exit-after-run both set, the application behaves like a batch
 * job: it runs once and exits with the run's exit code.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class PipelineScheduler implements ApplicationRunner {

    private final PipelineRunner pipelineRunner;
    private final GoldSchema goldSchema;
    private final DataPulseProperties properties;
    private final ApplicationContext applicationContext;

    /** The database schema is always ensured before any run. */
    @PostConstruct
    public void ensureSchema() {
        try {
            goldSchema.ensureSchema();
        } catch (Exception e) {
            log.warn("Could not initialise PostgreSQL schema (database down?): {}", e.getMessage());
        }
    }

    @Override
    public void run(ApplicationArguments args) {
        DataPulseProperties.Scheduling scheduling = properties.getScheduling();
        if (!scheduling.isRunOnStartup()) {
            log.info("Pipeline ready. Schedule: {}", "-".equals(scheduling.getCron()) ? "none" : scheduling.getCron());
            return;
        }

        log.info("RUN_ON_STARTUP=true, running the pipeline once");
        int exitCode;
        try {
            PipelineReport report = pipelineRunner.runNow(RunOptions.defaults());
            exitCode = report.exitCode();
        } catch (Exception e) {
            log.error("Startup run failed: {}", e.getMessage(), e);
            exitCode = 1;
        }

        if (scheduling.isExitAfterRun()) {
            int code = exitCode;
            log.info("Exiting with code {}", code);
            System.exit(SpringApplication.exit(applicationContext, () -> code));
        }
    }

    @Scheduled(cron = "${datapulse.scheduling.cron:-}")
    public void scheduledRun() {
        log.info("Scheduled pipeline run triggered");
        try {
            pipelineRunner.runNow(RunOptions.defaults());
        } catch (IllegalStateException e) {
            log.warn("Scheduled run skipped: {}", e.getMessage());
        } catch (Exception e) {
            log.error("Scheduled run failed: {}", e.getMessage(), e);
        }
    }
}
