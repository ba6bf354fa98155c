package com.trellis.core.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Centralised Micrometer metrics for task coordination and checkpointed execution.
 */
@Service
public class CoordinationMetrics {

    private final MeterRegistry registry;

    public CoordinationMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordTaskTransition(String from, String to) {
        Counter.builder("trellis.task.transitions")
                .tag("from", from != null ? from : "NONE")
                .tag("to", to)
                .register(registry)
                .increment();
    }

    public void recordCycleRejected() {
        Counter.builder("trellis.task.cycles_rejected")
                .description("Registrations refused because they would close a dependency cycle")
                .register(registry)
                .increment();
    }

    public void recordBlockedCascade(int blockedCount) {
        DistributionSummary.builder("trellis.task.blocked_cascade")
                .description("Dependents blocked by a single task failure")
                .register(registry)
                .record(blockedCount);
    }

    public void recordCheckpointSaved(String phase) {
        Counter.builder("trellis.checkpoint.saved")
                .tag("phase", phase)
                .register(registry)
                .increment();
    }

    public void recordCheckpointFailure(String operation) {
        Counter.builder("trellis.checkpoint.failures")
                .tag("operation", operation)
                .register(registry)
                .increment();
    }

    public void recordRevert() {
        Counter.builder("trellis.checkpoint.reverts")
                .register(registry)
                .increment();
    }

    /**
     * Records how an approval request was resolved and how long it waited.
     *
     * @param outcome "approved", "rejected", "timed_out" or "automatic"
     * @param waited  time between request and resolution
     */
    public void recordApproval(String outcome, Duration waited) {
        Counter.builder("trellis.approval.decisions")
                .tag("outcome", outcome)
                .register(registry)
                .increment();
        Timer.builder("trellis.approval.wait")
                .tag("outcome", outcome)
                .register(registry)
                .record(waited);
    }

    public void recordExecutionAttempt(String operation) {
        Counter.builder("trellis.execution.attempts")
                .tag("operation", operation)
                .register(registry)
                .increment();
    }

    public void recordExecutionResult(String operation, String outcome, long ms) {
        Counter.builder("trellis.execution.results")
                .tag("operation", operation)
                .tag("outcome", outcome)
                .register(registry)
                .increment();
        Timer.builder("trellis.execution.duration")
                .tag("operation", operation)
                .register(registry)
                .record(Duration.ofMillis(ms));
    }
}
