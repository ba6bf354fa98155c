package com.trellis.core.metrics;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class CoordinationMetricsTest {

    private SimpleMeterRegistry registry;
    private CoordinationMetrics metrics;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        metrics = new CoordinationMetrics(registry);
    }

    @Test
    void recordTaskTransitionTagsBothEnds() {
        metrics.recordTaskTransition("READY", "RUNNING");
        metrics.recordTaskTransition(null, "PENDING");

        assertEquals(1.0, registry.find("trellis.task.transitions")
                .tag("from", "READY").tag("to", "RUNNING").counter().count());
        assertEquals(1.0, registry.find("trellis.task.transitions")
                .tag("from", "NONE").tag("to", "PENDING").counter().count());
    }

    @Test
    void recordCycleRejectedIncrements() {
        metrics.recordCycleRejected();
        metrics.recordCycleRejected();
        assertEquals(2.0, registry.find("trellis.task.cycles_rejected").counter().count());
    }

    @Test
    void recordBlockedCascadeRecordsSize() {
        metrics.recordBlockedCascade(3);
        var summary = registry.find("trellis.task.blocked_cascade").summary();
        assertEquals(1, summary.count());
        assertEquals(3.0, summary.totalAmount());
    }

    @Test
    void checkpointCountersAreTaggedByPhase() {
        metrics.recordCheckpointSaved("pre_execution");
        metrics.recordCheckpointSaved("pre_execution");
        metrics.recordCheckpointSaved("post_execution");
        metrics.recordCheckpointFailure("save");
        metrics.recordRevert();

        assertEquals(2.0, registry.find("trellis.checkpoint.saved").tag("phase", "pre_execution").counter().count());
        assertEquals(1.0, registry.find("trellis.checkpoint.saved").tag("phase", "post_execution").counter().count());
        assertEquals(1.0, registry.find("trellis.checkpoint.failures").tag("operation", "save").counter().count());
        assertEquals(1.0, registry.find("trellis.checkpoint.reverts").counter().count());
    }

    @Test
    void recordApprovalRecordsOutcomeAndWait() {
        metrics.recordApproval("approved", Duration.ofSeconds(2));

        assertEquals(1.0, registry.find("trellis.approval.decisions").tag("outcome", "approved").counter().count());
        var timer = registry.find("trellis.approval.wait").tag("outcome", "approved").timer();
        assertNotNull(timer);
        assertEquals(2000.0, timer.totalTime(TimeUnit.MILLISECONDS), 1.0);
    }

    @Test
    void recordExecutionResultRecordsOutcomeAndDuration() {
        metrics.recordExecutionAttempt("executeTask");
        metrics.recordExecutionAttempt("executeTask");
        metrics.recordExecutionResult("executeTask", "completed", 150);

        assertEquals(2.0, registry.find("trellis.execution.attempts").tag("operation", "executeTask").counter().count());
        assertEquals(1.0, registry.find("trellis.execution.results")
                .tag("operation", "executeTask").tag("outcome", "completed").counter().count());
        var timer = registry.find("trellis.execution.duration").tag("operation", "executeTask").timer();
        assertEquals(1, timer.count());
        assertEquals(150.0, timer.totalTime(TimeUnit.MILLISECONDS), 1.0);
    }
}
