package com.trellis.core.persistence;

import com.trellis.core.approval.ApprovalGate;
import com.trellis.core.events.CoordinationEvent;
import com.trellis.core.events.EventBus;
import com.trellis.core.metrics.CoordinationMetrics;
import com.trellis.core.model.ApprovalDecision;
import com.trellis.core.model.Checkpoint;
import com.trellis.core.model.CheckpointPhase;
import com.trellis.core.model.ExecutionThread;
import com.trellis.core.model.ThreadConfig;
import com.trellis.core.model.ThreadStats;
import com.trellis.core.model.ThreadStatus;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

class ThreadCheckpointerTest {

    private ScheduledExecutorService timer;
    private SimpleMeterRegistry registry;
    private CoordinationMetrics metrics;
    private EventBus eventBus;
    private List<CoordinationEvent> events;
    private ApprovalGate approvalGate;
    private InMemoryCheckpointStore store;
    private ThreadCheckpointer checkpointer;

    @BeforeEach
    void setUp() {
        timer = Executors.newSingleThreadScheduledExecutor();
        registry = new SimpleMeterRegistry();
        metrics = new CoordinationMetrics(registry);
        eventBus = new EventBus(Runnable::run);
        events = new ArrayList<>();
        eventBus.subscribeAll(events::add);
        approvalGate = new ApprovalGate(eventBus, metrics, true, Duration.ofMinutes(5), timer);
        store = new InMemoryCheckpointStore();
        checkpointer = new ThreadCheckpointer(store, approvalGate, eventBus, metrics, true, Duration.ofHours(24));
    }

    @AfterEach
    void tearDown() {
        timer.shutdownNow();
    }

    private String newThread() {
        return checkpointer.createThread(ThreadConfig.defaults()).threadId();
    }

    private String save(String threadId, String step) {
        return checkpointer.saveCheckpoint(threadId, Map.of("step", step), Map.of("phase", "manual"));
    }

    // -- Threads ----------------------------------------------------------------

    @Nested
    @DisplayName("createThread")
    class CreateThreadTests {

        @Test
        @DisplayName("generates a thread_ id and the default namespace")
        void generatesId() {
            ExecutionThread thread = checkpointer.createThread(null);

            assertTrue(thread.threadId().startsWith("thread_"));
            assertEquals(ThreadCheckpointer.DEFAULT_NAMESPACE, thread.namespace());
            assertEquals(ThreadStatus.ACTIVE, thread.status());
            assertTrue(checkpointer.getThread(thread.threadId()).isPresent());
            assertEquals("thread.created", events.get(0).eventType());
        }

        @Test
        @DisplayName("honours a caller-supplied id, namespace and metadata")
        void callerSuppliedId() {
            ExecutionThread thread = checkpointer.createThread(
                    new ThreadConfig("thread_custom", "agent_planner", Map.of("agentType", "planner")));

            assertEquals("thread_custom", thread.threadId());
            assertEquals("agent_planner", thread.namespace());
            assertEquals("planner", thread.metadata().get("agentType"));
        }

        @Test
        @DisplayName("duplicate id is rejected")
        void duplicateId() {
            checkpointer.createThread(new ThreadConfig("thread_dup", null, null));
            assertThrows(IllegalArgumentException.class,
                    () -> checkpointer.createThread(new ThreadConfig("thread_dup", null, null)));
        }
    }

    // -- Save and load ----------------------------------------------------------

    @Nested
    @DisplayName("save and load")
    class SaveLoadTests {

        @Test
        @DisplayName("loadCheckpoint returns the last saved payload")
        void loadLatest() {
            String threadId = newThread();
            save(threadId, "one");
            save(threadId, "two");

            assertEquals(Optional.of(Map.of("step", "two")), checkpointer.loadCheckpoint(threadId));
        }

        @Test
        @DisplayName("loadCheckpoint on a thread without checkpoints is empty")
        void loadEmpty() {
            assertTrue(checkpointer.loadCheckpoint(newThread()).isEmpty());
        }

        @Test
        @DisplayName("phase is taken from metadata, defaulting to manual")
        void phaseFromMetadata() {
            String threadId = newThread();
            checkpointer.saveCheckpoint(threadId, Map.of(), Map.of("phase", "pre_execution"));
            assertEquals(CheckpointPhase.PRE_EXECUTION, checkpointer.getLatestCheckpoint(threadId).orElseThrow().phase());

            checkpointer.saveCheckpoint(threadId, Map.of(), null);
            assertEquals(CheckpointPhase.MANUAL, checkpointer.getLatestCheckpoint(threadId).orElseThrow().phase());
        }

        @Test
        @DisplayName("save publishes checkpoint.saved and counts by phase")
        void saveEventsAndMetrics() {
            String threadId = newThread();
            String id = save(threadId, "one");

            CoordinationEvent event = events.get(events.size() - 1);
            assertEquals("checkpoint.saved", event.eventType());
            assertEquals(threadId, event.threadId());
            assertEquals(id, event.payload().get("checkpointId"));
            assertEquals(1.0, registry.find("trellis.checkpoint.saved").tag("phase", "manual").counter().count());
        }

        @Test
        @DisplayName("unknown thread raises ThreadNotFoundException")
        void unknownThread() {
            assertThrows(ThreadNotFoundException.class, () -> save("thread_missing", "x"));
            assertThrows(ThreadNotFoundException.class, () -> checkpointer.loadCheckpoint("thread_missing"));
            assertThrows(ThreadNotFoundException.class, () -> checkpointer.getCheckpointHistory("thread_missing", 10));
        }

        @Test
        @DisplayName("store failure is counted and propagated")
        void storeFailure() {
            CheckpointStore failing = mock(CheckpointStore.class);
            ExecutionThread thread = new ExecutionThread("thread_1", "trellis", Map.of(), ThreadStatus.ACTIVE,
                    Instant.now(), null);
            when(failing.findThread("thread_1")).thenReturn(Optional.of(thread));
            when(failing.append(eq("thread_1"), any(), any(), any()))
                    .thenThrow(new PersistenceException("disk full", null));
            var failingCheckpointer = new ThreadCheckpointer(failing, approvalGate, eventBus, metrics,
                    true, Duration.ofHours(1));

            assertThrows(PersistenceException.class,
                    () -> failingCheckpointer.saveCheckpoint("thread_1", Map.of(), Map.of()));
            assertEquals(1.0, registry.find("trellis.checkpoint.failures").tag("operation", "save").counter().count());
        }
    }

    // -- History and time travel -------------------------------------------------

    @Nested
    @DisplayName("history and revert")
    class TimeTravelTests {

        @Test
        @DisplayName("history is newest first with strictly decreasing sequences")
        void historyOrder() {
            String threadId = newThread();
            for (int i = 0; i < 5; i++) {
                save(threadId, "s" + i);
            }

            List<Checkpoint> history = checkpointer.getCheckpointHistory(threadId, 3);

            assertEquals(3, history.size());
            assertEquals("s4", history.get(0).payload().get("step"));
            for (int i = 1; i < history.size(); i++) {
                assertTrue(history.get(i - 1).sequence() > history.get(i).sequence());
            }
        }

        @Test
        @DisplayName("revert then load returns the target payload and hides later checkpoints")
        void revertThenLoad() {
            String threadId = newThread();
            String first = save(threadId, "one");
            save(threadId, "two");
            save(threadId, "three");

            Map<String, Object> restored = checkpointer.revertToCheckpoint(threadId, first);

            assertEquals(Map.of("step", "one"), restored);
            assertEquals(Optional.of(Map.of("step", "one")), checkpointer.loadCheckpoint(threadId));
            assertEquals(1, checkpointer.getCheckpointHistory(threadId, 10).size());
            assertEquals(3, checkpointer.getFullHistory(threadId).size());
            assertEquals(1L, checkpointer.countCheckpoints(threadId));
            assertEquals(1.0, registry.find("trellis.checkpoint.reverts").counter().count());
            assertEquals("checkpoint.reverted", events.get(events.size() - 1).eventType());
        }

        @Test
        @DisplayName("a save after a revert continues from the target")
        void saveAfterRevert() {
            String threadId = newThread();
            String first = save(threadId, "one");
            save(threadId, "two");
            checkpointer.revertToCheckpoint(threadId, first);

            save(threadId, "branch");

            List<Checkpoint> history = checkpointer.getCheckpointHistory(threadId, 10);
            assertEquals(List.of("branch", "one"), history.stream().map(cp -> cp.payload().get("step")).toList());
            assertEquals(3L, history.get(0).sequence());
        }

        @Test
        @DisplayName("reverting to a superseded or unknown checkpoint fails")
        void revertInvalidTarget() {
            String threadId = newThread();
            String first = save(threadId, "one");
            String second = save(threadId, "two");
            checkpointer.revertToCheckpoint(threadId, first);

            assertThrows(CheckpointNotFoundException.class, () -> checkpointer.revertToCheckpoint(threadId, second));
            assertThrows(CheckpointNotFoundException.class, () -> checkpointer.revertToCheckpoint(threadId, "nope"));
        }

        @Test
        @DisplayName("with time travel disabled history is empty and revert is refused")
        void timeTravelDisabled() {
            var noTravel = new ThreadCheckpointer(store, approvalGate, eventBus, metrics, false, Duration.ofHours(1));
            String threadId = noTravel.createThread(null).threadId();
            String id = noTravel.saveCheckpoint(threadId, Map.of("step", "one"), null);

            assertTrue(noTravel.getCheckpointHistory(threadId, 10).isEmpty());
            var ex = assertThrows(IllegalStateException.class, () -> noTravel.revertToCheckpoint(threadId, id));
            assertEquals("Time travel not enabled", ex.getMessage());
            assertTrue(noTravel.loadCheckpoint(threadId).isPresent());
        }
    }

    // -- Close ------------------------------------------------------------------

    @Nested
    @DisplayName("closeThread")
    class CloseTests {

        @Test
        @DisplayName("writes a thread_closed checkpoint and marks the thread CLOSED")
        void closes() {
            String threadId = newThread();

            ExecutionThread closed = checkpointer.closeThread(threadId, Map.of("state", "completed"));

            assertEquals(ThreadStatus.CLOSED, closed.status());
            assertNotNull(closed.closedAt());
            assertEquals(ThreadStatus.CLOSED, store.findThread(threadId).orElseThrow().status());
            Checkpoint last = checkpointer.getLatestCheckpoint(threadId).orElseThrow();
            assertEquals(CheckpointPhase.THREAD_CLOSED, last.phase());
            assertEquals(Map.of("state", "completed"), last.payload().get("finalState"));
        }

        @Test
        @DisplayName("rejects the thread's pending approvals")
        void rejectsPendingApprovals() throws Exception {
            String threadId = newThread();
            CompletableFuture<ApprovalDecision> pending = approvalGate.requestApproval(threadId, Map.of());

            checkpointer.closeThread(threadId);

            ApprovalDecision decision = pending.get();
            assertFalse(decision.approved());
            assertEquals(ApprovalGate.THREAD_CLOSED_REASON, decision.reason());
        }

        @Test
        @DisplayName("is idempotent and leaves the thread read-only")
        void idempotentAndReadOnly() {
            String threadId = newThread();
            checkpointer.closeThread(threadId);
            long count = checkpointer.countCheckpoints(threadId);

            checkpointer.closeThread(threadId);

            assertEquals(count, checkpointer.countCheckpoints(threadId));
            assertThrows(IllegalStateException.class, () -> save(threadId, "late"));
        }

        @Test
        @DisplayName("refuses to revert a closed thread and supersedes nothing")
        void revertClosedThread() {
            String threadId = newThread();
            String first = save(threadId, "one");
            save(threadId, "two");
            checkpointer.closeThread(threadId);

            assertThrows(IllegalStateException.class, () -> checkpointer.revertToCheckpoint(threadId, first));

            assertTrue(checkpointer.getFullHistory(threadId).stream().noneMatch(Checkpoint::superseded));
            assertEquals(CheckpointPhase.THREAD_CLOSED, checkpointer.getLatestCheckpoint(threadId).orElseThrow().phase());
        }
    }

    // -- Stats and cleanup -------------------------------------------------------

    @Nested
    @DisplayName("stats and cleanup")
    class StatsTests {

        @Test
        @DisplayName("stats count active threads, checkpoints and pending approvals")
        void stats() {
            String a = newThread();
            String b = newThread();
            save(a, "one");
            save(a, "two");
            checkpointer.closeThread(b);
            approvalGate.requestApproval(a, Map.of());

            ThreadStats stats = checkpointer.getThreadStats();

            assertEquals(1, stats.activeThreads());
            assertEquals(3L, stats.totalCheckpoints());
            assertEquals(1, stats.pendingApprovals());
            assertEquals(2, stats.threads().size());
        }

        @Test
        @DisplayName("cleanup evicts idle closed threads but keeps durable rows")
        void cleanup() throws InterruptedException {
            var shortRetention = new ThreadCheckpointer(store, approvalGate, eventBus, metrics, true, Duration.ZERO);
            String closedId = shortRetention.createThread(null).threadId();
            String activeId = shortRetention.createThread(null).threadId();
            shortRetention.closeThread(closedId);
            Thread.sleep(5);

            int evicted = shortRetention.cleanup();

            assertEquals(1, evicted);
            assertEquals(1, shortRetention.getThreadStats().threads().size());
            assertEquals(activeId, shortRetention.getThreadStats().threads().get(0).threadId());
            assertTrue(shortRetention.getThread(closedId).isPresent());
            assertTrue(shortRetention.loadCheckpoint(closedId).isPresent());
        }

        @Test
        @DisplayName("close releases the store once")
        void closeOnce() {
            CheckpointStore mockStore = mock(CheckpointStore.class);
            var c = new ThreadCheckpointer(mockStore, approvalGate, eventBus, metrics, true, Duration.ofHours(1));

            c.close();
            c.close();

            verify(mockStore, times(1)).close();
        }
    }
}
