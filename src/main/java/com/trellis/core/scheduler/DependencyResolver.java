package com.trellis.core.scheduler;

import com.trellis.core.events.CoordinationEvent;
import com.trellis.core.events.EventBus;
import com.trellis.core.metrics.CoordinationMetrics;
import com.trellis.core.model.DependencyChain;
import com.trellis.core.model.SystemStatus;
import com.trellis.core.model.TaskSnapshot;
import com.trellis.core.model.TaskStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Deque;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;

/**
 * In-memory registry of tasks and the dependency DAG between them.
 * <p>
 * A task is READY exactly when every dependency is COMPLETED; callers either poll
 * {@link #canTaskStart(String)} or wait on the future returned by
 * {@link #registerTask}. Every public method runs under the instance lock, so a
 * registration's validate-then-insert and a completion's status change, dependent
 * promotion and future resolution are each a single atomic step.
 * <p>
 * Failure cascades: when a task fails, every non-terminal transitive dependent becomes
 * BLOCKED and stays BLOCKED until the failed task is registered again under the same id.
 */
@Service
public class DependencyResolver {

    private static final Logger log = LoggerFactory.getLogger(DependencyResolver.class);

    static final String STATUS_CHANGED = "task.status_changed";
    static final String FORCE_COMPLETED = "task.force_completed";

    /** Registered tasks in registration order. */
    private final Map<String, TaskEntry> tasks = new LinkedHashMap<>();

    /** Dependency id to the ids of tasks that directly depend on it; the id need not be registered. */
    private final Map<String, Set<String>> dependents = new HashMap<>();

    private final EventBus eventBus;
    private final CoordinationMetrics metrics;

    public DependencyResolver(EventBus eventBus, CoordinationMetrics metrics) {
        this.eventBus = eventBus;
        this.metrics = metrics;
    }

    /**
     * Registers a task with its dependencies.
     *
     * @param taskId        unique, caller-assigned id
     * @param dependencyIds ids this task depends on; they need not be registered yet
     * @param agentId       owning agent, may be null
     * @param metadata      arbitrary task data, may be null
     * @return a future completed with the task's result, or exceptionally with a
     *         {@link TaskFailedException} when the task fails
     * @throws DuplicateTaskException   if a task with this id exists and has not failed
     * @throws DependencyCycleException if the new edges would close a cycle
     */
    public synchronized CompletableFuture<Object> registerTask(String taskId, Collection<String> dependencyIds,
                                                               String agentId, Map<String, Object> metadata) {
        if (taskId == null || taskId.isBlank()) {
            throw new IllegalArgumentException("taskId is required");
        }
        List<String> deps = dependencyIds == null ? List.of() : List.copyOf(new LinkedHashSet<>(dependencyIds));

        TaskEntry existing = tasks.get(taskId);
        if (existing != null && existing.status != TaskStatus.FAILED) {
            throw new DuplicateTaskException(taskId);
        }

        List<String> cycle = findCycle(taskId, deps);
        if (cycle != null) {
            metrics.recordCycleRejected();
            log.warn("Rejected task {}: dependency cycle {}", taskId, cycle);
            throw new DependencyCycleException(taskId, cycle);
        }

        // Validation passed: commit.
        boolean retry = existing != null;
        if (retry) {
            for (String oldDep : existing.dependencies) {
                Set<String> set = dependents.get(oldDep);
                if (set != null) {
                    set.remove(taskId);
                    if (set.isEmpty()) {
                        dependents.remove(oldDep);
                    }
                }
            }
        }

        TaskEntry entry = new TaskEntry(taskId, deps, agentId, metadata);
        if (retry) {
            entry.status = existing.status;
        }
        tasks.put(taskId, entry);
        for (String dep : deps) {
            dependents.computeIfAbsent(dep, k -> new LinkedHashSet<>()).add(taskId);
        }

        transition(entry, evaluate(entry));
        log.info("Task {} {} with {} dependencies", taskId, retry ? "re-registered" : "registered", deps.size());

        if (retry) {
            refreshTransitiveDependents(taskId);
        } else if (entry.status == TaskStatus.BLOCKED) {
            // dependents registered ahead of this task inherit the block
            int blocked = blockTransitiveDependents(taskId);
            if (blocked > 0) {
                metrics.recordBlockedCascade(blocked);
            }
        }
        return entry.future;
    }

    /**
     * Pure read: true iff the task exists and is READY.
     */
    public synchronized boolean canTaskStart(String taskId) {
        TaskEntry entry = tasks.get(taskId);
        return entry != null && entry.status == TaskStatus.READY;
    }

    /**
     * Moves a READY task to RUNNING.
     *
     * @throws TaskNotFoundException           if the task is unknown
     * @throws InvalidStateTransitionException if the task is not READY
     */
    public synchronized void startTask(String taskId, String agentId) {
        TaskEntry entry = require(taskId);
        if (entry.status != TaskStatus.READY) {
            throw new InvalidStateTransitionException(taskId, entry.status, TaskStatus.RUNNING);
        }
        if (agentId != null) {
            entry.agentId = agentId;
        }
        entry.startedAt = Instant.now();
        transition(entry, TaskStatus.RUNNING);
        log.info("Task {} started by agent {}", taskId, entry.agentId);
    }

    /**
     * Completes a RUNNING task, promotes every direct dependent whose dependencies are
     * now all COMPLETED, and resolves the task's future with {@code result}.
     *
     * @throws TaskNotFoundException           if the task is unknown
     * @throws InvalidStateTransitionException if the task is not RUNNING
     */
    public synchronized void completeTask(String taskId, Object result) {
        TaskEntry entry = require(taskId);
        if (entry.status != TaskStatus.RUNNING) {
            throw new InvalidStateTransitionException(taskId, entry.status, TaskStatus.COMPLETED);
        }
        markCompleted(entry, result);
        log.info("Task {} completed successfully", taskId);
    }

    /**
     * Manual override: completes a task from any non-terminal status, bypassing the
     * READY/RUNNING lifecycle. Dependents blocked behind it are re-evaluated.
     *
     * @param result result to record; defaults to {@code {forcedComplete: true}} when null
     */
    public synchronized void forceCompleteTask(String taskId, Object result) {
        TaskEntry entry = require(taskId);
        if (entry.status.isTerminal()) {
            throw new InvalidStateTransitionException(taskId, entry.status, TaskStatus.COMPLETED);
        }
        log.warn("FORCE COMPLETING task {} from {} - manual override", taskId, entry.status);
        Object effective = result != null ? result
                : Map.of("forcedComplete", true, "timestamp", Instant.now().toString());
        markCompleted(entry, effective);
        refreshTransitiveDependents(taskId);
        eventBus.publish(CoordinationEvent.forTask(FORCE_COMPLETED, taskId, null, TaskStatus.COMPLETED,
                Map.of("warning", "Task was manually force-completed")));
    }

    public synchronized void failTask(String taskId, String errorMessage) {
        failTask(taskId, errorMessage, null);
    }

    public synchronized void failTask(String taskId, Throwable error) {
        failTask(taskId, describe(error), error);
    }

    /**
     * Fails a non-terminal task, rejects its future and blocks every non-terminal
     * transitive dependent.
     *
     * @throws TaskNotFoundException           if the task is unknown
     * @throws InvalidStateTransitionException if the task is already COMPLETED or FAILED
     */
    public synchronized void failTask(String taskId, String errorMessage, Throwable cause) {
        TaskEntry entry = require(taskId);
        if (entry.status.isTerminal()) {
            throw new InvalidStateTransitionException(taskId, entry.status, TaskStatus.FAILED);
        }
        String message = errorMessage != null ? errorMessage : "Task failed";
        entry.error = message;
        entry.failedAt = Instant.now();
        transition(entry, TaskStatus.FAILED);
        entry.future.completeExceptionally(new TaskFailedException(taskId, message, cause));

        int blocked = blockTransitiveDependents(taskId);
        metrics.recordBlockedCascade(blocked);
        log.warn("Task {} failed: {} ({} dependent{} blocked)", taskId, message, blocked, blocked != 1 ? "s" : "");
    }

    /**
     * Transitive closure of the task's dependencies, depth-first, starting with the task itself.
     */
    public synchronized DependencyChain getDependencyChain(String taskId) {
        require(taskId);
        List<DependencyChain.Entry> entries = new ArrayList<>();
        collectChain(taskId, 0, new HashSet<>(), entries);
        int totalDepth = entries.stream().mapToInt(DependencyChain.Entry::depth).max().orElse(0);
        return new DependencyChain(taskId, List.copyOf(entries), totalDepth);
    }

    /**
     * Counts per status plus the full task set. Two calls with no mutation in between
     * return equal values.
     */
    public synchronized SystemStatus getSystemStatus() {
        Map<TaskStatus, Long> counts = new EnumMap<>(TaskStatus.class);
        for (TaskStatus status : TaskStatus.values()) {
            counts.put(status, 0L);
        }
        List<TaskSnapshot> snapshots = new ArrayList<>(tasks.size());
        for (TaskEntry entry : tasks.values()) {
            counts.merge(entry.status, 1L, Long::sum);
            snapshots.add(snapshot(entry));
        }
        int graphSize = (int) dependents.values().stream().filter(s -> !s.isEmpty()).count();
        return new SystemStatus(tasks.size(), counts.get(TaskStatus.RUNNING).intValue(),
                Collections.unmodifiableMap(counts), graphSize, List.copyOf(snapshots));
    }

    public synchronized Optional<TaskSnapshot> getTask(String taskId) {
        return Optional.ofNullable(tasks.get(taskId)).map(this::snapshot);
    }

    /**
     * The completion future of the task's current registration.
     */
    public synchronized CompletableFuture<Object> awaitTask(String taskId) {
        return require(taskId).future;
    }

    // ── Internals (caller holds the lock) ─────────────────────────────────

    private void markCompleted(TaskEntry entry, Object result) {
        entry.result = result;
        entry.completedAt = Instant.now();
        transition(entry, TaskStatus.COMPLETED);
        promoteDirectDependents(entry.id);
        // Resolved last so continuations observe the promoted dependents.
        entry.future.complete(result);
    }

    private void promoteDirectDependents(String taskId) {
        for (String dependentId : dependents.getOrDefault(taskId, Set.of())) {
            TaskEntry dependent = tasks.get(dependentId);
            if (dependent != null && dependent.status == TaskStatus.PENDING
                    && evaluate(dependent) == TaskStatus.READY) {
                transition(dependent, TaskStatus.READY);
                log.info("Task {} unblocked", dependentId);
            }
        }
    }

    private int blockTransitiveDependents(String taskId) {
        int blocked = 0;
        for (String id : transitiveDependents(taskId)) {
            TaskEntry dependent = tasks.get(id);
            if (dependent == null || dependent.status.isTerminal()
                    || dependent.status == TaskStatus.BLOCKED || dependent.status == TaskStatus.RUNNING) {
                continue;
            }
            transition(dependent, TaskStatus.BLOCKED);
            blocked++;
        }
        return blocked;
    }

    /**
     * Re-evaluates PENDING and BLOCKED transitive dependents until nothing changes.
     * Iterating to a fixpoint handles diamonds where a node is visited before one of
     * its dependencies has been unblocked.
     */
    private void refreshTransitiveDependents(String taskId) {
        List<String> affected = transitiveDependents(taskId);
        boolean changed = true;
        while (changed) {
            changed = false;
            for (String id : affected) {
                TaskEntry dependent = tasks.get(id);
                if (dependent == null
                        || (dependent.status != TaskStatus.BLOCKED && dependent.status != TaskStatus.PENDING)) {
                    continue;
                }
                TaskStatus next = evaluate(dependent);
                if (next != dependent.status) {
                    transition(dependent, next);
                    changed = true;
                }
            }
        }
    }

    /** Breadth-first list of every task that transitively depends on {@code taskId}. */
    private List<String> transitiveDependents(String taskId) {
        List<String> result = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        Deque<String> queue = new ArrayDeque<>(dependents.getOrDefault(taskId, Set.of()));
        while (!queue.isEmpty()) {
            String id = queue.poll();
            if (!seen.add(id)) {
                continue;
            }
            result.add(id);
            queue.addAll(dependents.getOrDefault(id, Set.of()));
        }
        return result;
    }

    /** Status a not-yet-started task should have given its dependencies' statuses. */
    private TaskStatus evaluate(TaskEntry entry) {
        boolean allCompleted = true;
        for (String depId : entry.dependencies) {
            TaskEntry dep = tasks.get(depId);
            if (dep == null) {
                allCompleted = false;
                continue;
            }
            if (dep.status == TaskStatus.FAILED || dep.status == TaskStatus.BLOCKED) {
                return TaskStatus.BLOCKED;
            }
            if (dep.status != TaskStatus.COMPLETED) {
                allCompleted = false;
            }
        }
        return allCompleted ? TaskStatus.READY : TaskStatus.PENDING;
    }

    /**
     * Searches from each new dependency along depends-on edges for {@code taskId}.
     *
     * @return the cycle path starting and ending at {@code taskId}, or null when acyclic
     */
    private List<String> findCycle(String taskId, List<String> deps) {
        Set<String> visited = new HashSet<>();
        for (String dep : deps) {
            Deque<String> path = new ArrayDeque<>();
            if (reaches(dep, taskId, visited, path)) {
                List<String> cycle = new ArrayList<>(path.size() + 1);
                cycle.add(taskId);
                cycle.addAll(path);
                return cycle;
            }
        }
        return null;
    }

    private boolean reaches(String current, String target, Set<String> visited, Deque<String> path) {
        path.addLast(current);
        if (current.equals(target)) {
            return true;
        }
        if (visited.add(current)) {
            TaskEntry entry = tasks.get(current);
            if (entry != null) {
                for (String next : entry.dependencies) {
                    if (reaches(next, target, visited, path)) {
                        return true;
                    }
                }
            }
        }
        path.removeLast();
        return false;
    }

    private void collectChain(String taskId, int depth, Set<String> visited, List<DependencyChain.Entry> out) {
        if (!visited.add(taskId)) {
            return;
        }
        TaskEntry entry = tasks.get(taskId);
        if (entry == null) {
            out.add(new DependencyChain.Entry(taskId, null, depth, List.of(), false));
            return;
        }
        out.add(new DependencyChain.Entry(taskId, entry.status, depth, entry.dependencies, true));
        for (String dep : entry.dependencies) {
            collectChain(dep, depth + 1, visited, out);
        }
    }

    private void transition(TaskEntry entry, TaskStatus next) {
        TaskStatus previous = entry.status;
        entry.status = next;
        metrics.recordTaskTransition(previous != null ? previous.name() : null, next.name());

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("dependencies", entry.dependencies);
        if (entry.agentId != null) {
            payload.put("agentId", entry.agentId);
        }
        eventBus.publish(CoordinationEvent.forTask(STATUS_CHANGED, entry.id, previous, next, payload));
        log.debug("Task {}: {} -> {}", entry.id, previous, next);
    }

    private TaskEntry require(String taskId) {
        TaskEntry entry = tasks.get(taskId);
        if (entry == null) {
            throw new TaskNotFoundException(taskId);
        }
        return entry;
    }

    private TaskSnapshot snapshot(TaskEntry e) {
        List<String> directDependents = List.copyOf(dependents.getOrDefault(e.id, Set.of()));
        return new TaskSnapshot(e.id, e.status, e.agentId, e.dependencies, directDependents, e.metadata,
                e.result, e.error, e.registeredAt, e.startedAt, e.completedAt, e.failedAt);
    }

    private static String describe(Throwable error) {
        if (error == null) return null;
        return error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName();
    }

    /** Mutable registry entry; never leaves this class. */
    private static final class TaskEntry {
        final String id;
        final List<String> dependencies;
        final Map<String, Object> metadata;
        final Instant registeredAt = Instant.now();
        final CompletableFuture<Object> future = new CompletableFuture<>();
        TaskStatus status;
        String agentId;
        Object result;
        String error;
        Instant startedAt;
        Instant completedAt;
        Instant failedAt;

        TaskEntry(String id, List<String> dependencies, String agentId, Map<String, Object> metadata) {
            this.id = id;
            this.dependencies = dependencies;
            this.agentId = agentId;
            this.metadata = metadata == null ? Map.of()
                    : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
        }
    }
}
