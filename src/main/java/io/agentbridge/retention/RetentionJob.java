package io.agentbridge.retention;

import io.agentbridge.config.MemoryProperties;
import io.agentbridge.core.UnifiedMemory;
import io.agentbridge.memory.StoreException;
import org.jobrunr.jobs.annotations.Job;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Retention work run as recurring JobRunr jobs: the durable store sweep and the
 * in-process cache expiry purge.
 */
@Component
public class RetentionJob {

    private static final Logger log = LoggerFactory.getLogger(RetentionJob.class);

    private final UnifiedMemory memory;
    private final MemoryProperties properties;

    public RetentionJob(UnifiedMemory memory, MemoryProperties properties) {
        this.memory = memory;
        this.properties = properties;
    }

    /**
     * Removes durable entries past the configured horizon or count bound.
     *
     * @return number of removed entries
     * @throws StoreException if the sweep failed; JobRunr records the failure and retries
     */
    @Job(name = "Durable store retention sweep")
    public int sweep() {
        MemoryProperties.Retention retention = properties.retention();
        int removed = memory.sweep(retention.toPolicy());
        if (removed > 0) {
            log.info("Retention sweep removed {} entries (max age {}, max per category {})",
                    removed, retention.maxAge(), retention.maxEntriesPerCategory());
        } else {
            log.debug("Retention sweep found nothing to remove");
        }
        return removed;
    }

    @Job(name = "Cache expiry purge")
    public int purgeCache() {
        int purged = memory.purgeExpiredCache();
        if (purged > 0) {
            log.debug("Purged {} expired cache entries", purged);
        }
        return purged;
    }
}
