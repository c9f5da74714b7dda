package io.contextrunr.background;

import io.contextrunr.config.ContextProperties;
import org.jobrunr.scheduling.JobScheduler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Registers the recurring maintenance jobs with JobRunr once the application is ready.
 */
@Service
public class MaintenanceScheduler {

    private static final Logger log = LoggerFactory.getLogger(MaintenanceScheduler.class);
    static final String SWEEP_JOB_ID = "context-session-sweep";
    static final String CONSOLIDATION_JOB_ID = "context-memory-consolidation";

    private final JobScheduler jobScheduler;
    private final ContextProperties properties;

    public MaintenanceScheduler(JobScheduler jobScheduler, ContextProperties properties) {
        this.jobScheduler = jobScheduler;
        this.properties = properties;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void start() {
        if (!properties.background().maintenanceEnabled()) {
            log.info("Maintenance jobs disabled via configuration");
            return;
        }

        String sweepCron = properties.session().sweepCron();
        jobScheduler.<MaintenanceJobs>scheduleRecurrently(SWEEP_JOB_ID, sweepCron, x -> x.sweepSessions());
        log.info("Session sweep registered with cron: {}", sweepCron);

        Duration interval = Duration.ofHours(properties.memory().consolidationIntervalHours());
        jobScheduler.<MaintenanceJobs>scheduleRecurrently(CONSOLIDATION_JOB_ID, interval, x -> x.consolidateMemories());
        log.info("Memory consolidation registered every {}", interval);
    }

    /**
     * Removes both recurring jobs.
     */
    public void stop() {
        jobScheduler.deleteRecurringJob(SWEEP_JOB_ID);
        jobScheduler.deleteRecurringJob(CONSOLIDATION_JOB_ID);
        log.info("Maintenance jobs stopped");
    }
}
