package com.trellis.core.persistence;

import com.trellis.core.model.Checkpoint;
import com.trellis.core.model.CheckpointPhase;
import com.trellis.core.model.ExecutionThread;
import com.trellis.core.model.ThreadStatus;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Non-durable {@link CheckpointStore}: suitable for development and tests, state is
 * lost when the process exits.
 */
public class InMemoryCheckpointStore implements CheckpointStore {

    private final Map<String, ExecutionThread> threads = new LinkedHashMap<>();
    private final Map<String, List<Checkpoint>> checkpointsByThread = new LinkedHashMap<>();

    @Override
    public void initialize() {
        // nothing to create
    }

    @Override
    public synchronized void insertThread(ExecutionThread thread) {
        threads.put(thread.threadId(), thread);
        checkpointsByThread.putIfAbsent(thread.threadId(), new ArrayList<>());
    }

    @Override
    public synchronized Optional<ExecutionThread> findThread(String threadId) {
        return Optional.ofNullable(threads.get(threadId));
    }

    @Override
    public synchronized List<ExecutionThread> listThreads() {
        return List.copyOf(threads.values());
    }

    @Override
    public synchronized void updateThreadStatus(String threadId, ThreadStatus status, Instant closedAt) {
        ExecutionThread thread = threads.get(threadId);
        if (thread != null) {
            threads.put(threadId, new ExecutionThread(thread.threadId(), thread.namespace(), thread.metadata(),
                    status, thread.createdAt(), closedAt));
        }
    }

    @Override
    public synchronized Checkpoint append(String threadId, CheckpointPhase phase, Map<String, Object> payload,
                                          Map<String, Object> metadata) {
        List<Checkpoint> log = checkpointsByThread.computeIfAbsent(threadId, k -> new ArrayList<>());
        long next = log.isEmpty() ? 1 : log.get(log.size() - 1).sequence() + 1;
        Checkpoint checkpoint = new Checkpoint(UUID.randomUUID().toString(), threadId, next, phase,
                copy(payload), copy(metadata), false, Instant.now());
        log.add(checkpoint);
        return checkpoint;
    }

    @Override
    public synchronized Optional<Checkpoint> findLatest(String threadId) {
        List<Checkpoint> history = findHistory(threadId, 1);
        return history.isEmpty() ? Optional.empty() : Optional.of(history.get(0));
    }

    @Override
    public synchronized List<Checkpoint> findHistory(String threadId, int limit) {
        return checkpointsByThread.getOrDefault(threadId, List.of()).stream()
                .filter(cp -> !cp.superseded())
                .sorted(Comparator.comparingLong(Checkpoint::sequence).reversed())
                .limit(Math.max(limit, 0))
                .toList();
    }

    @Override
    public synchronized List<Checkpoint> findAll(String threadId) {
        return List.copyOf(checkpointsByThread.getOrDefault(threadId, List.of()));
    }

    @Override
    public synchronized Optional<Checkpoint> findById(String threadId, String checkpointId) {
        return checkpointsByThread.getOrDefault(threadId, List.of()).stream()
                .filter(cp -> cp.checkpointId().equals(checkpointId))
                .findFirst();
    }

    @Override
    public synchronized int supersedeAfter(String threadId, long sequence) {
        List<Checkpoint> log = checkpointsByThread.getOrDefault(threadId, List.of());
        int marked = 0;
        for (int i = 0; i < log.size(); i++) {
            Checkpoint cp = log.get(i);
            if (cp.sequence() > sequence && !cp.superseded()) {
                log.set(i, new Checkpoint(cp.checkpointId(), cp.threadId(), cp.sequence(), cp.phase(),
                        cp.payload(), cp.metadata(), true, cp.createdAt()));
                marked++;
            }
        }
        return marked;
    }

    @Override
    public synchronized long countCheckpoints(String threadId) {
        return checkpointsByThread.getOrDefault(threadId, List.of()).stream()
                .filter(cp -> !cp.superseded())
                .count();
    }

    @Override
    public boolean isAvailable() {
        return true;
    }

    @Override
    public void close() {
        // nothing to release
    }

    private static Map<String, Object> copy(Map<String, Object> source) {
        return source == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(source));
    }
}
