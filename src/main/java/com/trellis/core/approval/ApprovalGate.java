package com.trellis.core.approval;

import com.trellis.core.config.TrellisProperties;
import com.trellis.core.events.CoordinationEvent;
import com.trellis.core.events.EventBus;
import com.trellis.core.metrics.CoordinationMetrics;
import com.trellis.core.model.ApprovalDecision;
import com.trellis.core.model.ApprovalRequest;
import com.trellis.core.model.ApprovalStatus;
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
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Queue of actions awaiting a human (or policy) decision.
 * <p>
 * Each request moves PENDING to exactly one of APPROVED, REJECTED or TIMED_OUT. The
 * first resolution wins; resolving again raises {@link ApprovalAlreadyResolvedException}.
 * Requests live in memory only and do not survive a restart.
 */
@Service
public class ApprovalGate {

    private static final Logger log = LoggerFactory.getLogger(ApprovalGate.class);

    public static final String THREAD_CLOSED_REASON = "thread_closed";
    public static final String GATE_CLOSED_REASON = "gate_closed";

    private final Map<String, Entry> requests = new LinkedHashMap<>();
    private final EventBus eventBus;
    private final CoordinationMetrics metrics;
    private final boolean enabled;
    private final Duration defaultTimeout;
    private final ScheduledExecutorService timer;
    private boolean closed;

    @Autowired
    public ApprovalGate(EventBus eventBus, CoordinationMetrics metrics, TrellisProperties properties) {
        this(eventBus, metrics, properties.getApproval().isEnabled(),
                Duration.ofMillis(properties.getApproval().getDefaultTimeoutMs()),
                Executors.newSingleThreadScheduledExecutor(r -> {
                    Thread t = new Thread(r, "approval-timeout");
                    t.setDaemon(true);
                    return t;
                }));
    }

    public ApprovalGate(EventBus eventBus, CoordinationMetrics metrics, boolean enabled,
                        Duration defaultTimeout, ScheduledExecutorService timer) {
        this.eventBus = eventBus;
        this.metrics = metrics;
        this.enabled = enabled;
        this.defaultTimeout = defaultTimeout;
        this.timer = timer;
    }

    public CompletableFuture<ApprovalDecision> requestApproval(String threadId, Map<String, Object> action) {
        return requestApproval(threadId, action, defaultTimeout);
    }

    /**
     * Enqueues a request and returns a future that completes with the decision. When
     * nobody decides within {@code timeout}, the request is TIMED_OUT and the future
     * completes with {@code {approved: false, reason: "timeout"}}.
     * <p>
     * With the gate disabled the future is already completed with an automatic approval.
     */
    public synchronized CompletableFuture<ApprovalDecision> requestApproval(String threadId,
                                                                           Map<String, Object> action,
                                                                           Duration timeout) {
        if (!enabled) {
            metrics.recordApproval("automatic", Duration.ZERO);
            return CompletableFuture.completedFuture(ApprovalDecision.autoApproved());
        }
        if (closed) {
            log.warn("Approval requested for thread {} after the gate was closed", threadId);
            return CompletableFuture.completedFuture(ApprovalDecision.reject(GATE_CLOSED_REASON));
        }
        Duration effective = timeout != null ? timeout : defaultTimeout;
        String approvalId = "approval_" + UUID.randomUUID();
        Map<String, Object> actionCopy = action == null ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(action));

        Entry entry = new Entry(approvalId, threadId, actionCopy, effective);
        entry.timeoutTask = timer.schedule(() -> expire(approvalId), effective.toMillis(), TimeUnit.MILLISECONDS);
        requests.put(approvalId, entry);

        publish("approval.requested", entry, null);
        log.info("Requested approval {} for thread {} (timeout={}ms)", approvalId, threadId, effective.toMillis());
        return entry.future;
    }

    /**
     * @throws ApprovalNotFoundException        if the id is unknown
     * @throws ApprovalAlreadyResolvedException if the request was already resolved
     */
    public synchronized ApprovalRequest approveAction(String approvalId, String feedback) {
        Entry entry = requirePending(approvalId);
        resolve(entry, ApprovalStatus.APPROVED, feedback, ApprovalDecision.approve(feedback));
        log.info("Approved action: {}", approvalId);
        return entry.snapshot();
    }

    /**
     * @throws ApprovalNotFoundException        if the id is unknown
     * @throws ApprovalAlreadyResolvedException if the request was already resolved
     */
    public synchronized ApprovalRequest rejectAction(String approvalId, String reason) {
        Entry entry = requirePending(approvalId);
        resolve(entry, ApprovalStatus.REJECTED, reason, ApprovalDecision.reject(reason));
        log.info("Rejected action: {} ({})", approvalId, reason);
        return entry.snapshot();
    }

    /**
     * Rejects every pending request of a thread, e.g. when the thread is closed.
     *
     * @return the number of requests rejected
     */
    public synchronized int rejectPendingForThread(String threadId, String reason) {
        int rejected = 0;
        for (Entry entry : new ArrayList<>(requests.values())) {
            if (entry.status == ApprovalStatus.PENDING && entry.threadId != null && entry.threadId.equals(threadId)) {
                resolve(entry, ApprovalStatus.REJECTED, reason, ApprovalDecision.reject(reason));
                rejected++;
            }
        }
        if (rejected > 0) {
            log.info("Auto-rejected {} pending approval(s) for thread {}: {}", rejected, threadId, reason);
        }
        return rejected;
    }

    public synchronized Optional<ApprovalRequest> getRequest(String approvalId) {
        return Optional.ofNullable(requests.get(approvalId)).map(Entry::snapshot);
    }

    public synchronized List<ApprovalRequest> listPending() {
        return requests.values().stream()
                .filter(e -> e.status == ApprovalStatus.PENDING)
                .map(Entry::snapshot)
                .toList();
    }

    public synchronized List<ApprovalRequest> listPending(String threadId) {
        return listPending().stream()
                .filter(r -> threadId.equals(r.threadId()))
                .toList();
    }

    public synchronized int pendingCount() {
        return (int) requests.values().stream().filter(e -> e.status == ApprovalStatus.PENDING).count();
    }

    /**
     * Drops resolved requests that were made before {@code cutoff}. Pending ones are kept.
     *
     * @return number of requests removed
     */
    public synchronized int prune(Instant cutoff) {
        int removed = 0;
        Iterator<Entry> it = requests.values().iterator();
        while (it.hasNext()) {
            Entry entry = it.next();
            if (entry.status != ApprovalStatus.PENDING && entry.requestedAt.isBefore(cutoff)) {
                it.remove();
                removed++;
            }
        }
        return removed;
    }

    /**
     * Rejects whatever is still pending and stops the timeout scheduler. Idempotent.
     */
    @PreDestroy
    public synchronized void close() {
        closed = true;
        for (Entry entry : new ArrayList<>(requests.values())) {
            if (entry.status == ApprovalStatus.PENDING) {
                resolve(entry, ApprovalStatus.REJECTED, GATE_CLOSED_REASON, ApprovalDecision.reject(GATE_CLOSED_REASON));
            }
        }
        timer.shutdownNow();
    }

    private synchronized void expire(String approvalId) {
        Entry entry = requests.get(approvalId);
        if (entry == null || entry.status != ApprovalStatus.PENDING) {
            return;
        }
        resolve(entry, ApprovalStatus.TIMED_OUT, ApprovalDecision.TIMEOUT_REASON, ApprovalDecision.timeout());
        log.warn("Approval {} for thread {} timed out after {}ms", approvalId, entry.threadId, entry.timeout.toMillis());
    }

    private Entry requirePending(String approvalId) {
        Entry entry = requests.get(approvalId);
        if (entry == null) {
            throw new ApprovalNotFoundException(approvalId);
        }
        if (entry.status != ApprovalStatus.PENDING) {
            throw new ApprovalAlreadyResolvedException(approvalId, entry.status);
        }
        return entry;
    }

    private void resolve(Entry entry, ApprovalStatus status, String feedback, ApprovalDecision decision) {
        entry.status = status;
        entry.feedback = feedback;
        entry.resolvedAt = Instant.now();
        if (entry.timeoutTask != null) {
            entry.timeoutTask.cancel(false);
        }
        metrics.recordApproval(status.name().toLowerCase(), Duration.between(entry.requestedAt, entry.resolvedAt));
        publish("approval." + status.name().toLowerCase(), entry, ApprovalStatus.PENDING);
        entry.future.complete(decision);
    }

    private void publish(String type, Entry entry, ApprovalStatus previous) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("approvalId", entry.approvalId);
        payload.put("action", entry.action);
        if (entry.feedback != null) {
            payload.put("feedback", entry.feedback);
        }
        eventBus.publish(CoordinationEvent.forThread(type, entry.threadId, previous, entry.status, payload));
    }

    private static final class Entry {
        final String approvalId;
        final String threadId;
        final Map<String, Object> action;
        final Duration timeout;
        final Instant requestedAt = Instant.now();
        final CompletableFuture<ApprovalDecision> future = new CompletableFuture<>();
        ApprovalStatus status = ApprovalStatus.PENDING;
        Instant resolvedAt;
        String feedback;
        ScheduledFuture<?> timeoutTask;

        Entry(String approvalId, String threadId, Map<String, Object> action, Duration timeout) {
            this.approvalId = approvalId;
            this.threadId = threadId;
            this.action = action;
            this.timeout = timeout;
        }

        ApprovalRequest snapshot() {
            return new ApprovalRequest(approvalId, threadId, action, status, requestedAt, resolvedAt, feedback, timeout);
        }
    }
}
