package com.trellis.core.persistence;

import com.trellis.core.model.Checkpoint;
import com.trellis.core.model.CheckpointPhase;
import com.trellis.core.model.ExecutionThread;
import com.trellis.core.model.ThreadStatus;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Storage for threads and their append-only checkpoint log.
 * <p>
 * Implementations own sequence allocation: {@link #append} assigns
 * {@code max(sequence) + 1} over every row of the thread, superseded ones included,
 * so sequence numbers are never reused. All failures surface as {@link PersistenceException}.
 */
public interface CheckpointStore {

    /** Creates backing tables or structures if needed. Called once at startup. */
    void initialize();

    void insertThread(ExecutionThread thread);

    Optional<ExecutionThread> findThread(String threadId);

    /** All threads, oldest first. */
    List<ExecutionThread> listThreads();

    void updateThreadStatus(String threadId, ThreadStatus status, Instant closedAt);

    Checkpoint append(String threadId, CheckpointPhase phase, Map<String, Object> payload,
                      Map<String, Object> metadata);

    /** Highest-sequence checkpoint that is not superseded. */
    Optional<Checkpoint> findLatest(String threadId);

    /** Visible (non-superseded) checkpoints, highest sequence first. */
    List<Checkpoint> findHistory(String threadId, int limit);

    /** Every checkpoint including superseded ones, lowest sequence first. */
    List<Checkpoint> findAll(String threadId);

    Optional<Checkpoint> findById(String threadId, String checkpointId);

    /**
     * Marks every visible checkpoint with a sequence greater than {@code sequence} as superseded.
     *
     * @return number of rows marked
     */
    int supersedeAfter(String threadId, long sequence);

    /** Number of visible checkpoints of the thread. */
    long countCheckpoints(String threadId);

    /** Cheap liveness probe used by health checks. */
    boolean isAvailable();

    /** Releases connections or other resources. Idempotent. */
    void close();
}
