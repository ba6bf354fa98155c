package com.trellis.core.persistence;

import com.trellis.core.config.TrellisProperties;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class CheckpointCleanupSchedulerTest {

    @Test
    void runCleanupDelegatesToCheckpointer() {
        ThreadCheckpointer checkpointer = mock(ThreadCheckpointer.class);
        var scheduler = new CheckpointCleanupScheduler(checkpointer, new TrellisProperties());

        scheduler.runCleanup();

        verify(checkpointer).cleanup();
        scheduler.shutdown();
    }

    @Test
    void runCleanupSurvivesFailures() {
        ThreadCheckpointer checkpointer = mock(ThreadCheckpointer.class);
        when(checkpointer.cleanup()).thenThrow(new PersistenceException("db down", null));
        var scheduler = new CheckpointCleanupScheduler(checkpointer, new TrellisProperties());

        assertDoesNotThrow(scheduler::runCleanup);
        scheduler.shutdown();
    }

    @Test
    void zeroIntervalDisablesScheduling() {
        ThreadCheckpointer checkpointer = mock(ThreadCheckpointer.class);
        var props = new TrellisProperties();
        props.getCheckpoint().setCleanupIntervalMs(0);
        var scheduler = new CheckpointCleanupScheduler(checkpointer, props);

        scheduler.start();
        scheduler.shutdown();

        verifyNoInteractions(checkpointer);
    }
}
