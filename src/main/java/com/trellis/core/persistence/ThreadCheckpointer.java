package com.trellis.core.persistence;

import com.trellis.core.approval.ApprovalGate;
import com.trellis.core.config.TrellisProperties;
import com.trellis.core.events.CoordinationEvent;
import com.trellis.core.events.EventBus;
import com.trellis.core.metrics.CoordinationMetrics;
import com.trellis.core.model.Checkpoint;
import com.trellis.core.model.CheckpointPhase;
import com.trellis.core.model.ExecutionThread;
import com.trellis.core.model.ThreadConfig;
import com.trellis.core.model.ThreadStats;
import com.trellis.core.model.ThreadStatus;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Thread-scoped checkpoint log with time travel.
 * <p>
 * Every write goes through the configured {@link CheckpointStore}. Threads touched by
 * this process are also tracked in an in-memory cache that feeds {@link #getThreadStats()}
 * and is trimmed by {@link #cleanup()}.
 */
@Service
public class ThreadCheckpointer {

    private static final Logger log = LoggerFactory.getLogger(ThreadCheckpointer.class);

    public static final String DEFAULT_NAMESPACE = "trellis";
    public static final String PHASE_KEY = "phase";
    public static final int DEFAULT_HISTORY_LIMIT = 10;

    private final CheckpointStore store;
    private final ApprovalGate approvalGate;
    private final EventBus eventBus;
    private final CoordinationMetrics metrics;
    private final boolean timeTravelEnabled;
    private final Duration retention;

    private final Map<String, TrackedThread> knownThreads = new LinkedHashMap<>();
    private final AtomicBoolean closed = new AtomicBoolean(false);

    @Autowired
    public ThreadCheckpointer(CheckpointStore store, ApprovalGate approvalGate, EventBus eventBus,
                              CoordinationMetrics metrics, TrellisProperties properties) {
        this(store, approvalGate, eventBus, metrics,
                properties.getCheckpoint().isTimeTravelEnabled(),
                Duration.ofMillis(properties.getCheckpoint().getRetentionMs()));
    }

    public ThreadCheckpointer(CheckpointStore store, ApprovalGate approvalGate, EventBus eventBus,
                              CoordinationMetrics metrics, boolean timeTravelEnabled, Duration retention) {
        this.store = store;
        this.approvalGate = approvalGate;
        this.eventBus = eventBus;
        this.metrics = metrics;
        this.timeTravelEnabled = timeTravelEnabled;
        this.retention = retention;
    }

    public boolean isTimeTravelEnabled() {
        return timeTravelEnabled;
    }

    /**
     * Creates a thread. A {@code thread_<uuid>} id is generated unless the config names one.
     *
     * @throws IllegalArgumentException if a thread with the requested id already exists
     */
    public synchronized ExecutionThread createThread(ThreadConfig config) {
        ThreadConfig cfg = config != null ? config : ThreadConfig.defaults();
        String threadId = cfg.threadId() != null && !cfg.threadId().isBlank()
                ? cfg.threadId()
                : "thread_" + UUID.randomUUID();
        if (store.findThread(threadId).isPresent()) {
            throw new IllegalArgumentException("Thread " + threadId + " already exists");
        }
        String namespace = cfg.namespace() != null && !cfg.namespace().isBlank() ? cfg.namespace() : DEFAULT_NAMESPACE;
        Map<String, Object> metadata = cfg.metadata() == null ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(cfg.metadata()));

        ExecutionThread thread = new ExecutionThread(threadId, namespace, metadata, ThreadStatus.ACTIVE,
                Instant.now(), null);
        store.insertThread(thread);
        track(thread);

        eventBus.publish(CoordinationEvent.forThread("thread.created", threadId, null, ThreadStatus.ACTIVE,
                Map.of("namespace", namespace)));
        log.info("Created execution thread {} (namespace={})", threadId, namespace);
        return thread;
    }

    public Optional<ExecutionThread> getThread(String threadId) {
        return store.findThread(threadId);
    }

    public List<ExecutionThread> listThreads() {
        return store.listThreads();
    }

    /**
     * Saves a checkpoint whose phase is read from {@code metadata.phase}, {@code manual} if absent.
     *
     * @return the new checkpoint id
     */
    public String saveCheckpoint(String threadId, Map<String, Object> payload, Map<String, Object> metadata) {
        Object phase = metadata != null ? metadata.get(PHASE_KEY) : null;
        return saveCheckpoint(threadId, CheckpointPhase.fromTag(phase != null ? phase.toString() : null),
                payload, metadata);
    }

    public String saveCheckpoint(String threadId, CheckpointPhase phase, Map<String, Object> payload,
                                 Map<String, Object> metadata) {
        return appendCheckpoint(threadId, phase, payload, metadata).checkpointId();
    }

    /**
     * @throws ThreadNotFoundException if the thread does not exist
     * @throws IllegalStateException   if the thread is closed
     * @throws PersistenceException    if the store cannot write
     */
    public synchronized Checkpoint appendCheckpoint(String threadId, CheckpointPhase phase,
                                                    Map<String, Object> payload, Map<String, Object> metadata) {
        ExecutionThread thread = requireThread(threadId);
        if (!thread.isActive()) {
            throw new IllegalStateException("Thread " + threadId + " is closed");
        }
        return write(threadId, phase, payload, metadata);
    }

    /** Payload of the newest visible checkpoint. */
    public Optional<Map<String, Object>> loadCheckpoint(String threadId) {
        return getLatestCheckpoint(threadId).map(Checkpoint::payload);
    }

    public synchronized Optional<Checkpoint> getLatestCheckpoint(String threadId) {
        requireThread(threadId);
        return store.findLatest(threadId);
    }

    /**
     * Visible checkpoints, newest first, at most {@code limit}. Empty when time travel is disabled.
     */
    public synchronized List<Checkpoint> getCheckpointHistory(String threadId, int limit) {
        requireThread(threadId);
        if (!timeTravelEnabled) {
            return List.of();
        }
        return store.findHistory(threadId, limit);
    }

    /** Number of visible checkpoints of the thread. */
    public long countCheckpoints(String threadId) {
        return store.countCheckpoints(threadId);
    }

    /** Every checkpoint including superseded ones, oldest first. */
    public synchronized List<Checkpoint> getFullHistory(String threadId) {
        requireThread(threadId);
        return store.findAll(threadId);
    }

    /**
     * Hides every checkpoint written after {@code checkpointId} and returns its payload.
     * Subsequent saves continue after the target; the hidden branch is kept for forensics.
     *
     * @throws IllegalStateException       if time travel is disabled or the thread is closed
     * @throws CheckpointNotFoundException if the id is unknown or already superseded
     */
    public synchronized Map<String, Object> revertToCheckpoint(String threadId, String checkpointId) {
        if (!timeTravelEnabled) {
            throw new IllegalStateException("Time travel not enabled");
        }
        if (!requireThread(threadId).isActive()) {
            throw new IllegalStateException("Thread " + threadId + " is closed");
        }
        Checkpoint target = store.findById(threadId, checkpointId)
                .filter(cp -> !cp.superseded())
                .orElseThrow(() -> new CheckpointNotFoundException(threadId, checkpointId));

        int superseded;
        try {
            superseded = store.supersedeAfter(threadId, target.sequence());
        } catch (PersistenceException e) {
            metrics.recordCheckpointFailure("revert");
            throw e;
        }
        touch(threadId);
        metrics.recordRevert();

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("checkpointId", checkpointId);
        payload.put("sequence", target.sequence());
        payload.put("superseded", superseded);
        eventBus.publish(CoordinationEvent.forThread("checkpoint.reverted", threadId, null, null, payload));
        log.info("Reverted thread {} to checkpoint {} (seq {}, {} superseded)",
                threadId, checkpointId, target.sequence(), superseded);
        return target.payload();
    }

    /**
     * Writes a {@code thread_closed} checkpoint, marks the thread CLOSED and rejects its
     * pending approvals. Closing an already closed thread returns it unchanged.
     */
    public synchronized ExecutionThread closeThread(String threadId, Map<String, Object> finalState) {
        ExecutionThread thread = requireThread(threadId);
        if (!thread.isActive()) {
            return thread;
        }
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("finalState", finalState != null ? finalState : Map.of());
        write(threadId, CheckpointPhase.THREAD_CLOSED, payload, Map.of(PHASE_KEY, CheckpointPhase.THREAD_CLOSED.tag()));

        Instant now = Instant.now();
        store.updateThreadStatus(threadId, ThreadStatus.CLOSED, now);
        ExecutionThread closedThread = thread.closed(now);
        track(closedThread);

        int rejected = approvalGate.rejectPendingForThread(threadId, ApprovalGate.THREAD_CLOSED_REASON);
        eventBus.publish(CoordinationEvent.forThread("thread.closed", threadId, ThreadStatus.ACTIVE,
                ThreadStatus.CLOSED, Map.of("rejectedApprovals", rejected)));
        log.info("Closed execution thread {}", threadId);
        return closedThread;
    }

    public ExecutionThread closeThread(String threadId) {
        return closeThread(threadId, null);
    }

    public synchronized ThreadStats getThreadStats() {
        List<ThreadStats.ThreadSummary> summaries = new ArrayList<>();
        int active = 0;
        long total = 0;
        for (TrackedThread tracked : knownThreads.values()) {
            ExecutionThread thread = tracked.thread;
            long count = store.countCheckpoints(thread.threadId());
            total += count;
            if (thread.isActive()) {
                active++;
            }
            summaries.add(new ThreadStats.ThreadSummary(thread.threadId(), thread.status(), count,
                    thread.createdAt(), thread.metadata()));
        }
        return new ThreadStats(active, total, approvalGate.pendingCount(), summaries);
    }

    /**
     * Drops closed threads idle longer than the retention window from the cache and
     * prunes old resolved approvals. Durable rows are untouched.
     *
     * @return number of threads evicted
     */
    public synchronized int cleanup() {
        Instant cutoff = Instant.now().minus(retention);
        int evicted = 0;
        Iterator<TrackedThread> it = knownThreads.values().iterator();
        while (it.hasNext()) {
            TrackedThread tracked = it.next();
            if (!tracked.thread.isActive() && tracked.lastActivity.isBefore(cutoff)) {
                it.remove();
                evicted++;
            }
        }
        int pruned = approvalGate.prune(cutoff);
        if (evicted > 0 || pruned > 0) {
            log.info("Cleanup evicted {} closed thread(s) and {} resolved approval(s)", evicted, pruned);
        }
        return evicted;
    }

    /** Releases the store. Idempotent. */
    @PreDestroy
    public void close() {
        if (closed.compareAndSet(false, true)) {
            store.close();
            log.info("Thread checkpointer closed");
        }
    }

    private Checkpoint write(String threadId, CheckpointPhase phase, Map<String, Object> payload,
                             Map<String, Object> metadata) {
        Checkpoint checkpoint;
        try {
            checkpoint = store.append(threadId, phase, payload, metadata);
        } catch (PersistenceException e) {
            metrics.recordCheckpointFailure("save");
            throw e;
        }
        touch(threadId);
        metrics.recordCheckpointSaved(phase.tag());

        Map<String, Object> eventPayload = new LinkedHashMap<>();
        eventPayload.put("checkpointId", checkpoint.checkpointId());
        eventPayload.put("sequence", checkpoint.sequence());
        eventPayload.put(PHASE_KEY, phase.tag());
        eventBus.publish(CoordinationEvent.forThread("checkpoint.saved", threadId, null, null, eventPayload));
        log.debug("Saved {} checkpoint {} (seq {}) on thread {}",
                phase.tag(), checkpoint.checkpointId(), checkpoint.sequence(), threadId);
        return checkpoint;
    }

    private ExecutionThread requireThread(String threadId) {
        TrackedThread tracked = knownThreads.get(threadId);
        if (tracked != null) {
            return tracked.thread;
        }
        ExecutionThread thread = store.findThread(threadId).orElseThrow(() -> new ThreadNotFoundException(threadId));
        track(thread);
        return thread;
    }

    private void track(ExecutionThread thread) {
        knownThreads.put(thread.threadId(), new TrackedThread(thread, Instant.now()));
    }

    private void touch(String threadId) {
        TrackedThread tracked = knownThreads.get(threadId);
        if (tracked != null) {
            tracked.lastActivity = Instant.now();
        }
    }

    private static final class TrackedThread {
        final ExecutionThread thread;
        Instant lastActivity;

        TrackedThread(ExecutionThread thread, Instant lastActivity) {
            this.thread = thread;
            this.lastActivity = lastActivity;
        }
    }
}
