package com.trellis.core.engine;

import com.trellis.core.approval.ApprovalGate;
import com.trellis.core.approval.ApprovalPolicy;
import com.trellis.core.events.CoordinationEvent;
import com.trellis.core.events.EventBus;
import com.trellis.core.logging.MdcContext;
import com.trellis.core.metrics.CoordinationMetrics;
import com.trellis.core.model.ApprovalDecision;
import com.trellis.core.model.CheckpointPhase;
import com.trellis.core.model.ExecutionThread;
import com.trellis.core.persistence.ThreadCheckpointer;
import com.trellis.core.scheduler.DependencyResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;

/**
 * Runs agent operations on one execution thread with approval gating, checkpointing
 * and linear-backoff retries.
 * <p>
 * A session is obtained from {@link ExecutionEngine}. Operations are expected to run
 * one at a time; {@link #cancel()} may be called from any thread and takes effect at
 * the next retry boundary or immediately during a backoff wait.
 */
public class ExecutionSession {

    private static final Logger log = LoggerFactory.getLogger(ExecutionSession.class);

    private final String threadId;
    private final String agentType;
    private final ExecutionSettings settings;
    private final ThreadCheckpointer checkpointer;
    private final ApprovalGate approvalGate;
    private final ApprovalPolicy approvalPolicy;
    private final DependencyResolver resolver;
    private final EventBus eventBus;
    private final CoordinationMetrics metrics;

    private final CountDownLatch cancelSignal = new CountDownLatch(1);
    private volatile CompletableFuture<ApprovalDecision> pendingApproval;

    private ExecutionState state = ExecutionState.IDLE;
    private String lastCheckpointId;
    private int executions;
    private int retryCount;
    private boolean closed;

    public ExecutionSession(String threadId, String agentType, ExecutionSettings settings,
                            ThreadCheckpointer checkpointer, ApprovalGate approvalGate,
                            ApprovalPolicy approvalPolicy, DependencyResolver resolver,
                            EventBus eventBus, CoordinationMetrics metrics) {
        this.threadId = threadId;
        this.agentType = agentType;
        this.settings = settings;
        this.checkpointer = checkpointer;
        this.approvalGate = approvalGate;
        this.approvalPolicy = approvalPolicy;
        this.resolver = resolver;
        this.eventBus = eventBus;
        this.metrics = metrics;
    }

    public String getThreadId() {
        return threadId;
    }

    public String getAgentType() {
        return agentType;
    }

    /**
     * Runs {@code operation}, retrying up to {@code maxRetries} times.
     *
     * @return the operation's result
     * @throws ExecutionRejectedException if approval was required and not granted
     * @throws RetriesExhaustedException  if every attempt failed; the last error is the cause
     * @throws ExecutionCancelledException if the session was cancelled
     */
    public <T> T execute(String operationName, Map<String, Object> args, AgentOperation<T> operation) {
        MdcContext.setOperation(threadId, operationName);
        long started = System.currentTimeMillis();
        try {
            ensureUsable(operationName);
            beginExecution();

            if (settings.approvalGatesEnabled() && approvalPolicy.requiresApproval(agentType, operationName)) {
                awaitApproval(operationName, args, started);
            }

            Map<String, Object> prePayload = new LinkedHashMap<>();
            prePayload.put("operation", operationName);
            prePayload.put("args", PayloadSanitizer.sanitizeArgs(args));
            checkpoint(CheckpointPhase.PRE_EXECUTION, prePayload);

            return runWithRetries(operationName, operation, started);
        } finally {
            MdcContext.clearOperation();
        }
    }

    /**
     * Starts {@code taskId} in the resolver, executes the operation and completes the
     * task with its result. A terminal execution error fails the task, which blocks its
     * dependents, and is rethrown.
     */
    public <T> T runTask(String taskId, String agentId, String operationName, Map<String, Object> args,
                         AgentOperation<T> operation) {
        MdcContext.setTask(taskId, agentId);
        try {
            resolver.startTask(taskId, agentId);
            T result;
            try {
                result = execute(operationName, args, operation);
            } catch (RuntimeException e) {
                resolver.failTask(taskId, e.getMessage(), e);
                throw e;
            }
            resolver.completeTask(taskId, result);
            return result;
        } finally {
            MdcContext.clear();
        }
    }

    /**
     * Stops the current and any future operation. Idempotent.
     */
    public void cancel() {
        synchronized (this) {
            if (state == ExecutionState.CANCELLED) {
                return;
            }
            state = ExecutionState.CANCELLED;
        }
        cancelSignal.countDown();
        CompletableFuture<ApprovalDecision> approval = pendingApproval;
        if (approval != null) {
            approval.cancel(false);
        }
        eventBus.publish(CoordinationEvent.forThread("execution.cancelled", threadId, null,
                ExecutionState.CANCELLED, Map.of("agentType", agentType)));
        log.info("Execution session on thread {} cancelled", threadId);
    }

    public boolean isCancelled() {
        return cancelSignal.getCount() == 0;
    }

    /**
     * True once the session is cancelled or its thread has been closed elsewhere.
     */
    private boolean stopRequested() {
        if (isCancelled()) {
            return true;
        }
        boolean threadActive;
        try {
            threadActive = checkpointer.getThread(threadId).map(ExecutionThread::isActive).orElse(true);
        } catch (RuntimeException e) {
            log.warn("Could not read status of thread {}: {}", threadId, e.getMessage());
            return false;
        }
        if (!threadActive) {
            cancel();
        }
        return !threadActive;
    }

    /**
     * Closes the underlying thread, writing its {@code thread_closed} checkpoint. Idempotent.
     */
    public void close() {
        ExecutionStats finalStats;
        synchronized (this) {
            if (closed) {
                return;
            }
            closed = true;
            finalStats = stats();
        }
        Map<String, Object> finalState = new LinkedHashMap<>();
        finalState.put("agentType", agentType);
        finalState.put("state", finalStats.state().name());
        finalState.put("executions", finalStats.historySize());
        finalState.put("lastCheckpointId", finalStats.lastCheckpointId());
        checkpointer.closeThread(threadId, finalState);
    }

    public synchronized ExecutionStats stats() {
        return new ExecutionStats(threadId, agentType, state, lastCheckpointId, executions, retryCount);
    }

    private <T> T runWithRetries(String operationName, AgentOperation<T> operation, long started) {
        int attempt = 0;
        while (true) {
            if (stopRequested()) {
                throw cancelled(operationName, attempt + 1, started);
            }
            attempt++;
            metrics.recordExecutionAttempt(operationName);
            publish("execution.started", operationName, Map.of("attempt", attempt));
            try {
                T result = operation.execute();
                onSuccess(operationName, result, started);
                return result;
            } catch (Exception e) {
                if (e instanceof InterruptedException) {
                    Thread.currentThread().interrupt();
                    throw cancelled(operationName, attempt, started);
                }
                synchronized (this) {
                    retryCount = attempt;
                }
                if (attempt > settings.maxRetries()) {
                    throw onExhausted(operationName, attempt, e, started);
                }
                if (stopRequested()) {
                    log.info("Operation {} stopped after attempt {}: thread {} is no longer active",
                            operationName, attempt, threadId);
                    throw cancelled(operationName, attempt + 1, started);
                }
                log.warn("Operation {} failed (attempt {}/{}): {}",
                        operationName, attempt, settings.maxRetries() + 1, e.getMessage());
                Map<String, Object> failure = new LinkedHashMap<>();
                failure.put("operation", operationName);
                failure.put("attempt", attempt);
                failure.put("error", describe(e));
                checkpoint(CheckpointPhase.EXECUTION_FAILURE, failure);
                publish("execution.retry", operationName, Map.of("attempt", attempt, "error", describe(e)));
                backoff(operationName, attempt, started);
            }
        }
    }

    private void awaitApproval(String operationName, Map<String, Object> args, long started) {
        Map<String, Object> action = new LinkedHashMap<>();
        action.put("agentType", agentType);
        action.put("operation", operationName);
        action.put("args", PayloadSanitizer.sanitizeArgs(args));

        CompletableFuture<ApprovalDecision> future =
                approvalGate.requestApproval(threadId, action, settings.approvalTimeout());
        pendingApproval = future;
        if (isCancelled()) {
            future.cancel(false);
        }
        ApprovalDecision decision;
        try {
            decision = future.get();
        } catch (CancellationException e) {
            throw cancelled(operationName, 1, started);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw cancelled(operationName, 1, started);
        } catch (ExecutionException e) {
            throw rejected(operationName, describe(e.getCause()), started);
        } finally {
            pendingApproval = null;
        }
        if (!decision.approved()) {
            throw rejected(operationName, decision.reason(), started);
        }
        log.debug("Operation {} approved{}", operationName, decision.automatic() ? " automatically" : "");
    }

    private void backoff(String operationName, int attempt, long started) {
        long delayMs = settings.retryDelay().toMillis() * attempt;
        try {
            if (cancelSignal.await(delayMs, TimeUnit.MILLISECONDS)) {
                throw cancelled(operationName, attempt + 1, started);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw cancelled(operationName, attempt + 1, started);
        }
    }

    private void onSuccess(String operationName, Object result, long started) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("operation", operationName);
        payload.put("result", PayloadSanitizer.sanitizeResult(result));
        checkpoint(CheckpointPhase.POST_EXECUTION, payload);
        finish(ExecutionState.COMPLETED);
        long elapsed = System.currentTimeMillis() - started;
        metrics.recordExecutionResult(operationName, "completed", elapsed);
        publish("execution.completed", operationName, Map.of("durationMs", elapsed));
        log.info("Operation {} completed in {}ms", operationName, elapsed);
    }

    private RetriesExhaustedException onExhausted(String operationName, int attempts, Exception last, long started) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("operation", operationName);
        payload.put("attempts", attempts);
        payload.put("error", describe(last));
        checkpoint(CheckpointPhase.EXECUTION_FAILED, payload);
        finish(ExecutionState.FAILED);
        metrics.recordExecutionResult(operationName, "failed", System.currentTimeMillis() - started);
        publish("execution.failed", operationName, Map.of("attempts", attempts, "error", describe(last)));
        log.error("Operation {} failed after {} attempts", operationName, attempts, last);
        return new RetriesExhaustedException(operationName, attempts, last);
    }

    private ExecutionRejectedException rejected(String operationName, String reason, long started) {
        finish(ExecutionState.FAILED);
        metrics.recordExecutionResult(operationName, "rejected", System.currentTimeMillis() - started);
        publish("execution.failed", operationName, Map.of("rejected", true, "reason", String.valueOf(reason)));
        log.warn("Operation {} rejected: {}", operationName, reason);
        return new ExecutionRejectedException(operationName, reason);
    }

    private ExecutionCancelledException cancelled(String operationName, int attempt, long started) {
        metrics.recordExecutionResult(operationName, "cancelled", System.currentTimeMillis() - started);
        return new ExecutionCancelledException(operationName, attempt);
    }

    /**
     * Writes a checkpoint; failures are logged and never abort the execution.
     */
    private void checkpoint(CheckpointPhase phase, Map<String, Object> payload) {
        if (!settings.checkpointingEnabled()) {
            return;
        }
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put(ThreadCheckpointer.PHASE_KEY, phase.tag());
        metadata.put("agentType", agentType);
        try {
            String id = checkpointer.saveCheckpoint(threadId, phase, payload, metadata);
            synchronized (this) {
                lastCheckpointId = id;
            }
        } catch (RuntimeException e) {
            log.warn("Failed to write {} checkpoint on thread {}: {}", phase.tag(), threadId, e.getMessage());
        }
    }

    private synchronized void ensureUsable(String operationName) {
        if (state == ExecutionState.CANCELLED) {
            throw new ExecutionCancelledException(operationName, 1);
        }
        if (closed) {
            throw new IllegalStateException("Execution session on thread " + threadId + " is closed");
        }
    }

    private synchronized void beginExecution() {
        state = ExecutionState.RUNNING;
        executions++;
        retryCount = 0;
    }

    private synchronized void finish(ExecutionState outcome) {
        if (state != ExecutionState.CANCELLED) {
            state = outcome;
        }
    }

    private void publish(String type, String operationName, Map<String, Object> extra) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("operation", operationName);
        payload.put("agentType", agentType);
        payload.putAll(extra);
        eventBus.publish(CoordinationEvent.forThread(type, threadId, null, null, payload));
    }

    private static String describe(Throwable error) {
        if (error == null) {
            return "unknown error";
        }
        return error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName();
    }
}
