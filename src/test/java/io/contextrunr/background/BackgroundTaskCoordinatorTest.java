package io.contextrunr.background;

import org.jobrunr.jobs.lambdas.JobLambda;
import org.jobrunr.scheduling.JobScheduler;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.UUID;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class BackgroundTaskCoordinatorTest {

    @Mock
    private JobScheduler jobScheduler;

    @Mock
    private MemoryGenerationJob memoryGenerationJob;

    private BackgroundTaskCoordinator coordinator;

    @BeforeEach
    void setUp() {
        coordinator = new BackgroundTaskCoordinator(jobScheduler, memoryGenerationJob, Runnable::run);
    }

    @Test
    void shouldDeriveJobIdFromSessionAndTurn() {
        UUID first = BackgroundTaskCoordinator.generationJobId("session_1", 3);

        assertEquals(first, BackgroundTaskCoordinator.generationJobId("session_1", 3));
        assertNotEquals(first, BackgroundTaskCoordinator.generationJobId("session_1", 4));
        assertNotEquals(first, BackgroundTaskCoordinator.generationJobId("session_2", 3));
    }

    @Test
    void shouldEnqueueGenerationJobUnderDerivedId() throws Exception {
        UUID jobId = coordinator.scheduleMemoryGeneration("session_1", 2, "alice",
                "I prefer window seats", List.of("personal preferences"));

        assertEquals(BackgroundTaskCoordinator.generationJobId("session_1", 2), jobId);
        ArgumentCaptor<JobLambda> lambda = ArgumentCaptor.forClass(JobLambda.class);
        verify(jobScheduler).enqueue(eq(jobId), lambda.capture());

        lambda.getValue().run();
        verify(memoryGenerationJob).generate("alice", "session_1", "I prefer window seats",
                List.of("personal preferences"));
    }

    @Test
    void shouldSwallowEnqueueFailure() {
        when(jobScheduler.enqueue(any(UUID.class), any(JobLambda.class)))
                .thenThrow(new IllegalStateException("storage unavailable"));

        assertDoesNotThrow(() -> coordinator.scheduleMemoryGeneration("session_1", 1, "alice", "hi", null));
    }

    @Test
    void shouldRunDetachedTask() {
        AtomicBoolean ran = new AtomicBoolean();

        coordinator.runDetached("flag", () -> ran.set(true));

        assertTrue(ran.get());
    }

    @Test
    void shouldSwallowFailingDetachedTask() {
        assertDoesNotThrow(() -> coordinator.runDetached("boom", () -> {
            throw new IllegalStateException("boom");
        }));
    }

    @Test
    void shouldSwallowRejectedDetachedTask() {
        BackgroundTaskCoordinator saturated = new BackgroundTaskCoordinator(jobScheduler, memoryGenerationJob,
                command -> {
                    throw new RejectedExecutionException("queue full");
                });

        assertDoesNotThrow(() -> saturated.runDetached("rejected", () -> { }));
    }
}
