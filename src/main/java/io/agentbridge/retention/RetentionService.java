package io.agentbridge.retention;

import io.agentbridge.config.MemoryProperties;
import org.jobrunr.scheduling.JobScheduler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;

/**
 * Registers the retention jobs with JobRunr on application startup. The sweep runs on a cron
 * derived from {@code retention.interval-minutes}; the cache purge runs every
 * {@code retention.cache-purge-interval}.
 */
@Service
public class RetentionService {

    private static final Logger log = LoggerFactory.getLogger(RetentionService.class);
    static final String SWEEP_JOB_ID = "memory-retention-sweep";
    static final String PURGE_JOB_ID = "cache-expiry-purge";

    private final JobScheduler jobScheduler;
    private final RetentionJob retentionJob;
    private final MemoryProperties.Retention retention;

    public RetentionService(JobScheduler jobScheduler, RetentionJob retentionJob, MemoryProperties properties) {
        this.jobScheduler = jobScheduler;
        this.retentionJob = retentionJob;
        this.retention = properties.retention();
    }

    @EventListener(ApplicationReadyEvent.class)
    public void start() {
        if (!retention.enabled()) {
            log.info("Retention jobs disabled via configuration");
            return;
        }

        String cronExpression = buildCronExpression(retention.intervalMinutes());
        jobScheduler.<RetentionJob>scheduleRecurrently(SWEEP_JOB_ID, cronExpression, x -> x.sweep());
        log.info("Retention sweep registered with cron: {} (max age {})", cronExpression, retention.maxAge());

        jobScheduler.<RetentionJob>scheduleRecurrently(PURGE_JOB_ID, retention.cachePurgeInterval(),
                x -> x.purgeCache());
        log.info("Cache expiry purge registered every {}", retention.cachePurgeInterval());
    }

    /**
     * Runs the durable sweep immediately (outside the schedule).
     *
     * @return number of removed entries
     */
    public int triggerNow() {
        log.info("Triggering immediate retention sweep");
        return retentionJob.sweep();
    }

    public void stop() {
        jobScheduler.deleteRecurringJob(SWEEP_JOB_ID);
        jobScheduler.deleteRecurringJob(PURGE_JOB_ID);
        log.info("Retention jobs stopped");
    }

    /**
     * Builds a cron expression for the given interval in minutes.
     * Intervals under an hour use the minute field, longer ones the hour field
     * (rounded down to whole hours), and a day or more runs daily at midnight.
     */
    static String buildCronExpression(int intervalMinutes) {
        if (intervalMinutes <= 0) throw new IllegalArgumentException("Interval must be positive");
        if (intervalMinutes < 60) {
            return "*/%d * * * *".formatted(intervalMinutes);
        }
        if (intervalMinutes >= 1440) {
            return "0 0 * * *";
        }
        return "0 */%d * * *".formatted(intervalMinutes / 60);
    }
}
