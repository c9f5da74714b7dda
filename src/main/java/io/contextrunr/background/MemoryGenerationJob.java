package io.contextrunr.background;

import io.contextrunr.memory.MemoryStore;
import org.jobrunr.jobs.annotations.Job;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Generates a long-term memory from a session transcript, as a JobRunr background job.
 * Runs at most once per turn: failures are logged and not retried.
 */
@Component
public class MemoryGenerationJob {

    private static final Logger log = LoggerFactory.getLogger(MemoryGenerationJob.class);

    private final MemoryStore memoryStore;

    public MemoryGenerationJob(MemoryStore memoryStore) {
        this.memoryStore = memoryStore;
    }

    @Job(name = "Memory generation for session %1", retries = 0)
    public void generate(String userId, String sessionId, String transcript, List<String> topics) {
        try {
            memoryStore.generateMemory(userId, transcript, topics).ifPresentOrElse(
                    memory -> log.debug("Session {} produced memory {}", sessionId, memory.id()),
                    () -> log.debug("Session {} produced no memory", sessionId));
        } catch (Exception e) {
            log.error("Memory generation failed for session {}: {}", sessionId, e.getMessage(), e);
        }
    }
}
