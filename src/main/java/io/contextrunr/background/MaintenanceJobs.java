package io.contextrunr.background;

import io.contextrunr.memory.MemoryStore;
import io.contextrunr.session.SessionStore;
import org.jobrunr.jobs.annotations.Job;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Recurring maintenance executed by JobRunr: session expiry and memory consolidation.
 */
@Component
public class MaintenanceJobs {

    private static final Logger log = LoggerFactory.getLogger(MaintenanceJobs.class);

    private final SessionStore sessionStore;
    private final MemoryStore memoryStore;

    public MaintenanceJobs(SessionStore sessionStore, MemoryStore memoryStore) {
        this.sessionStore = sessionStore;
        this.memoryStore = memoryStore;
    }

    @Job(name = "Session TTL sweep", retries = 0)
    public void sweepSessions() {
        try {
            int archived = sessionStore.sweepExpired();
            log.info("Session sweep finished, {} archived", archived);
        } catch (Exception e) {
            log.error("Session sweep failed: {}", e.getMessage(), e);
        }
    }

    @Job(name = "Memory consolidation", retries = 0)
    public void consolidateMemories() {
        try {
            int users = memoryStore.consolidateAll();
            log.info("Memory consolidation finished for {} user(s)", users);
        } catch (Exception e) {
            log.error("Memory consolidation failed: {}", e.getMessage(), e);
        }
    }
}
