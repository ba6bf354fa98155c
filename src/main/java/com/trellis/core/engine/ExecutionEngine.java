package com.trellis.core.engine;

import com.trellis.core.approval.ApprovalGate;
import com.trellis.core.approval.ApprovalPolicy;
import com.trellis.core.config.TrellisProperties;
import com.trellis.core.events.EventBus;
import com.trellis.core.metrics.CoordinationMetrics;
import com.trellis.core.model.ExecutionThread;
import com.trellis.core.model.ThreadConfig;
import com.trellis.core.persistence.ThreadCheckpointer;
import com.trellis.core.persistence.ThreadNotFoundException;
import com.trellis.core.scheduler.DependencyResolver;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Opens {@link ExecutionSession}s, one per agent thread.
 * <p>
 * New sessions get a fresh checkpoint thread in namespace {@code agent_<type>};
 * {@link #resumeSession} reattaches to an existing thread, optionally reverting it first.
 */
@Service
public class ExecutionEngine {

    private static final Logger log = LoggerFactory.getLogger(ExecutionEngine.class);

    static final String AGENT_TYPE_KEY = "agentType";

    private final ThreadCheckpointer checkpointer;
    private final ApprovalGate approvalGate;
    private final ApprovalPolicy approvalPolicy;
    private final DependencyResolver resolver;
    private final EventBus eventBus;
    private final CoordinationMetrics metrics;
    private final ExecutionSettings settings;

    private final Map<String, ExecutionSession> sessions = new ConcurrentHashMap<>();

    @Autowired
    public ExecutionEngine(ThreadCheckpointer checkpointer, ApprovalGate approvalGate, ApprovalPolicy approvalPolicy,
                           DependencyResolver resolver, EventBus eventBus, CoordinationMetrics metrics,
                           TrellisProperties properties) {
        this(checkpointer, approvalGate, approvalPolicy, resolver, eventBus, metrics,
                ExecutionSettings.from(properties.getExecution()));
    }

    public ExecutionEngine(ThreadCheckpointer checkpointer, ApprovalGate approvalGate, ApprovalPolicy approvalPolicy,
                           DependencyResolver resolver, EventBus eventBus, CoordinationMetrics metrics,
                           ExecutionSettings settings) {
        this.checkpointer = checkpointer;
        this.approvalGate = approvalGate;
        this.approvalPolicy = approvalPolicy;
        this.resolver = resolver;
        this.eventBus = eventBus;
        this.metrics = metrics;
        this.settings = settings;
    }

    public ExecutionSession startSession(String agentType) {
        return startSession(agentType, null);
    }

    /**
     * Creates a thread for {@code agentType} and opens a session on it.
     */
    public ExecutionSession startSession(String agentType, ThreadConfig config) {
        ThreadConfig cfg = config != null ? config : ThreadConfig.defaults();
        Map<String, Object> metadata = new LinkedHashMap<>();
        if (cfg.metadata() != null) {
            metadata.putAll(cfg.metadata());
        }
        metadata.put(AGENT_TYPE_KEY, agentType);
        String namespace = cfg.namespace() != null ? cfg.namespace() : "agent_" + agentType;

        ExecutionThread thread = checkpointer.createThread(new ThreadConfig(cfg.threadId(), namespace, metadata));
        log.info("Started execution session for agent {} on thread {}", agentType, thread.threadId());
        return open(thread.threadId(), agentType);
    }

    /**
     * Reattaches to an existing thread. When {@code checkpointId} is given the thread is
     * first reverted to it.
     *
     * @throws ThreadNotFoundException if the thread does not exist
     * @throws IllegalStateException   if the thread is closed
     */
    public ExecutionSession resumeSession(String threadId, String checkpointId) {
        ExecutionThread thread = checkpointer.getThread(threadId)
                .orElseThrow(() -> new ThreadNotFoundException(threadId));
        if (!thread.isActive()) {
            throw new IllegalStateException("Thread " + threadId + " is closed");
        }
        if (checkpointId != null && !checkpointId.isBlank()) {
            checkpointer.revertToCheckpoint(threadId, checkpointId);
        }
        Object agentType = thread.metadata() != null ? thread.metadata().get(AGENT_TYPE_KEY) : null;
        log.info("Resumed execution session on thread {}{}", threadId,
                checkpointId != null ? " at checkpoint " + checkpointId : "");
        return open(threadId, agentType != null ? agentType.toString() : thread.namespace());
    }

    public Optional<ExecutionSession> getSession(String threadId) {
        return Optional.ofNullable(sessions.get(threadId));
    }

    public List<ExecutionStats> listSessions() {
        return sessions.values().stream().map(ExecutionSession::stats).toList();
    }

    /**
     * Cancels every open session. Threads are left open so they can be resumed later.
     */
    @PreDestroy
    public void shutdown() {
        sessions.values().forEach(ExecutionSession::cancel);
        sessions.clear();
    }

    private ExecutionSession open(String threadId, String agentType) {
        ExecutionSession session = new ExecutionSession(threadId, agentType, settings, checkpointer,
                approvalGate, approvalPolicy, resolver, eventBus, metrics);
        sessions.put(threadId, session);
        return session;
    }
}
