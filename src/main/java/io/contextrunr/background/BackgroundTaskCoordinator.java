package io.contextrunr.background;

import org.jobrunr.scheduling.JobScheduler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.Executor;

/**
 * Runs work off the request path.
 *
 * <p>Two kinds of background work:</p>
 * <ul>
 *   <li>Memory generation: one JobRunr job per (session, turn). The job id is a name-based UUID
 *       of the pair, so enqueueing the same turn twice yields one job.</li>
 *   <li>Detached tasks: fire-and-forget work on the bounded in-process pool, such as cache
 *       write-backs.</li>
 * </ul>
 *
 * <p>Nothing here ever throws to the caller. Failures are logged.</p>
 */
@Service
public class BackgroundTaskCoordinator {

    private static final Logger log = LoggerFactory.getLogger(BackgroundTaskCoordinator.class);

    private final JobScheduler jobScheduler;
    private final MemoryGenerationJob memoryGenerationJob;
    private final Executor executor;

    public BackgroundTaskCoordinator(JobScheduler jobScheduler, MemoryGenerationJob memoryGenerationJob,
                                     @Qualifier("contextTaskExecutor") Executor executor) {
        this.jobScheduler = jobScheduler;
        this.memoryGenerationJob = memoryGenerationJob;
        this.executor = executor;
    }

    /**
     * Enqueues memory generation for one turn of a session.
     *
     * @return the job id, derived from session id and turn
     */
    public UUID scheduleMemoryGeneration(String sessionId, int turn, String userId,
                                         String transcript, List<String> topics) {
        UUID jobId = generationJobId(sessionId, turn);
        List<String> topicList = topics == null ? new ArrayList<>() : new ArrayList<>(topics);

        try {
            jobScheduler.enqueue(jobId, () ->
                    memoryGenerationJob.generate(userId, sessionId, transcript, topicList));
            log.debug("Enqueued memory generation [{}] for session {} turn {}", jobId, sessionId, turn);
        } catch (Exception e) {
            log.warn("Could not enqueue memory generation for session {} turn {}: {}",
                    sessionId, turn, e.getMessage());
        }
        return jobId;
    }

    /**
     * Runs a task on the in-process pool. Rejections and task failures are logged.
     */
    public void runDetached(String description, Runnable task) {
        try {
            executor.execute(() -> {
                try {
                    task.run();
                } catch (Exception e) {
                    log.warn("Background task '{}' failed: {}", description, e.getMessage());
                }
            });
        } catch (RuntimeException e) {
            log.warn("Background task '{}' rejected: {}", description, e.getMessage());
        }
    }

    static UUID generationJobId(String sessionId, int turn) {
        return UUID.nameUUIDFromBytes((sessionId + ":" + turn).getBytes(StandardCharsets.UTF_8));
    }
}
