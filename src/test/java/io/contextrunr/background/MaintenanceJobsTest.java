package io.contextrunr.background;

import io.contextrunr.memory.MemoryStore;
import io.contextrunr.session.SessionStore;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class MaintenanceJobsTest {

    @Mock
    private SessionStore sessionStore;

    @Mock
    private MemoryStore memoryStore;

    @InjectMocks
    private MaintenanceJobs jobs;

    @Test
    void shouldSweepSessions() {
        when(sessionStore.sweepExpired()).thenReturn(2);

        jobs.sweepSessions();

        verify(sessionStore).sweepExpired();
    }

    @Test
    void shouldConsolidateAllUsers() {
        when(memoryStore.consolidateAll()).thenReturn(3);

        jobs.consolidateMemories();

        verify(memoryStore).consolidateAll();
    }

    @Test
    void shouldNotPropagateMaintenanceFailures() {
        when(sessionStore.sweepExpired()).thenThrow(new IllegalStateException("boom"));
        when(memoryStore.consolidateAll()).thenThrow(new IllegalStateException("boom"));

        assertDoesNotThrow(() -> jobs.sweepSessions());
        assertDoesNotThrow(() -> jobs.consolidateMemories());
    }
}
