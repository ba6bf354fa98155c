package com.trellis.core.persistence;

import com.trellis.core.config.TrellisProperties;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Runs {@link ThreadCheckpointer#cleanup()} on a fixed interval.
 */
@Component
public class CheckpointCleanupScheduler {

    private static final Logger log = LoggerFactory.getLogger(CheckpointCleanupScheduler.class);

    private final ThreadCheckpointer checkpointer;
    private final long intervalMs;
    private final ScheduledExecutorService scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
        Thread t = new Thread(r, "checkpoint-cleanup");
        t.setDaemon(true);
        return t;
    });

    public CheckpointCleanupScheduler(ThreadCheckpointer checkpointer, TrellisProperties properties) {
        this.checkpointer = checkpointer;
        this.intervalMs = properties.getCheckpoint().getCleanupIntervalMs();
    }

    @PostConstruct
    void start() {
        if (intervalMs <= 0) {
            log.info("Checkpoint cleanup disabled");
            return;
        }
        scheduler.scheduleAtFixedRate(this::runCleanup, intervalMs, intervalMs, TimeUnit.MILLISECONDS);
    }

    void runCleanup() {
        try {
            checkpointer.cleanup();
        } catch (RuntimeException e) {
            log.warn("Checkpoint cleanup failed: {}", e.getMessage(), e);
        }
    }

    @PreDestroy
    void shutdown() {
        scheduler.shutdownNow();
    }
}
