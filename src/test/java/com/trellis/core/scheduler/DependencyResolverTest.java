package com.trellis.core.scheduler;

import com.trellis.core.events.CoordinationEvent;
import com.trellis.core.events.EventBus;
import com.trellis.core.metrics.CoordinationMetrics;
import com.trellis.core.model.DependencyChain;
import com.trellis.core.model.SystemStatus;
import com.trellis.core.model.TaskStatus;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for {@link DependencyResolver}. Events are delivered synchronously.
 */
class DependencyResolverTest {

    private List<CoordinationEvent> events;
    private SimpleMeterRegistry registry;
    private DependencyResolver resolver;

    @BeforeEach
    void setUp() {
        EventBus eventBus = new EventBus(Runnable::run);
        events = new ArrayList<>();
        eventBus.subscribeAll(events::add);
        registry = new SimpleMeterRegistry();
        resolver = new DependencyResolver(eventBus, new CoordinationMetrics(registry));
    }

    private TaskStatus statusOf(String taskId) {
        return resolver.getTask(taskId).orElseThrow().status();
    }

    private void run(String taskId, Object result) {
        resolver.startTask(taskId, "agent-1");
        resolver.completeTask(taskId, result);
    }

    // -- Registration ---------------------------------------------------------

    @Nested
    @DisplayName("registerTask")
    class RegisterTests {

        @Test
        @DisplayName("task without dependencies is READY")
        void noDependenciesIsReady() {
            resolver.registerTask("A", List.of(), "agent-1", Map.of());
            assertEquals(TaskStatus.READY, statusOf("A"));
            assertTrue(resolver.canTaskStart("A"));
        }

        @Test
        @DisplayName("task with an incomplete dependency is PENDING")
        void incompleteDependencyIsPending() {
            resolver.registerTask("A", List.of(), null, null);
            resolver.registerTask("B", List.of("A"), null, null);
            assertEquals(TaskStatus.PENDING, statusOf("B"));
            assertFalse(resolver.canTaskStart("B"));
        }

        @Test
        @DisplayName("dependency on an unregistered task keeps the task PENDING")
        void unknownDependencyIsPending() {
            resolver.registerTask("B", List.of("ghost"), null, null);
            assertEquals(TaskStatus.PENDING, statusOf("B"));
        }

        @Test
        @DisplayName("registering a dependent of a COMPLETED task makes it READY immediately")
        void dependencyAlreadyCompleted() {
            resolver.registerTask("A", List.of(), null, null);
            run("A", "done");
            resolver.registerTask("B", List.of("A"), null, null);
            assertEquals(TaskStatus.READY, statusOf("B"));
        }

        @Test
        @DisplayName("registering a dependent of a FAILED task makes it BLOCKED")
        void dependencyAlreadyFailed() {
            resolver.registerTask("A", List.of(), null, null);
            resolver.failTask("A", "boom");
            resolver.registerTask("B", List.of("A"), null, null);
            assertEquals(TaskStatus.BLOCKED, statusOf("B"));
        }

        @Test
        @DisplayName("duplicate dependency ids are collapsed")
        void duplicateDependencies() {
            resolver.registerTask("A", List.of(), null, null);
            resolver.registerTask("B", List.of("A", "A"), null, null);
            assertEquals(List.of("A"), resolver.getTask("B").orElseThrow().dependencies());
        }

        @Test
        @DisplayName("duplicate id raises DuplicateTaskException")
        void duplicateId() {
            resolver.registerTask("A", List.of(), null, null);
            assertThrows(DuplicateTaskException.class,
                    () -> resolver.registerTask("A", List.of(), null, null));
        }

        @Test
        @DisplayName("blank id is rejected")
        void blankId() {
            assertThrows(IllegalArgumentException.class,
                    () -> resolver.registerTask(" ", List.of(), null, null));
        }

        @Test
        @DisplayName("emits one status_changed event for the initial status")
        void emitsInitialEvent() {
            resolver.registerTask("A", List.of(), "agent-1", null);
            assertEquals(1, events.size());
            CoordinationEvent event = events.get(0);
            assertEquals(DependencyResolver.STATUS_CHANGED, event.eventType());
            assertEquals("A", event.taskId());
            assertNull(event.previousStatus());
            assertEquals("READY", event.newStatus());
            assertEquals("agent-1", event.payload().get("agentId"));
        }
    }

    // -- Cycle detection ------------------------------------------------------

    @Nested
    @DisplayName("cycle detection")
    class CycleTests {

        @Test
        @DisplayName("self-dependency is a cycle")
        void selfDependency() {
            var ex = assertThrows(DependencyCycleException.class,
                    () -> resolver.registerTask("A", List.of("A"), null, null));
            assertEquals(List.of("A", "A"), ex.getCycle());
            assertTrue(resolver.getTask("A").isEmpty());
        }

        @Test
        @DisplayName("closing a cycle through a not-yet-registered task is rejected and mutates nothing")
        void forwardReferenceCycle() {
            resolver.registerTask("A", List.of("B"), null, null);
            SystemStatus before = resolver.getSystemStatus();
            int eventsBefore = events.size();

            var ex = assertThrows(DependencyCycleException.class,
                    () -> resolver.registerTask("B", List.of("A"), null, null));

            assertEquals(List.of("B", "A", "B"), ex.getCycle());
            assertEquals(before, resolver.getSystemStatus());
            assertEquals(eventsBefore, events.size());
            assertEquals(1.0, registry.find("trellis.task.cycles_rejected").counter().count());
        }

        @Test
        @DisplayName("longer cycle path is reported")
        void longCycle() {
            resolver.registerTask("A", List.of("B"), null, null);
            resolver.registerTask("B", List.of("C"), null, null);
            var ex = assertThrows(DependencyCycleException.class,
                    () -> resolver.registerTask("C", List.of("A"), null, null));
            assertEquals(List.of("C", "A", "B", "C"), ex.getCycle());
        }

        @Test
        @DisplayName("diamond is not a cycle")
        void diamondIsAcyclic() {
            resolver.registerTask("A", List.of(), null, null);
            resolver.registerTask("B", List.of("A"), null, null);
            resolver.registerTask("C", List.of("A"), null, null);
            assertDoesNotThrow(() -> resolver.registerTask("D", List.of("B", "C"), null, null));
        }
    }

    // -- Lifecycle ------------------------------------------------------------

    @Nested
    @DisplayName("lifecycle")
    class LifecycleTests {

        @Test
        @DisplayName("A -> B -> C runs in dependency order and resolves futures")
        void linearChain() throws Exception {
            CompletableFuture<Object> fa = resolver.registerTask("A", List.of(), null, null);
            resolver.registerTask("B", List.of("A"), null, null);
            CompletableFuture<Object> fc = resolver.registerTask("C", List.of("B"), null, null);

            run("A", Map.of("x", 1));
            assertEquals(Map.of("x", 1), fa.get());
            assertEquals(TaskStatus.READY, statusOf("B"));
            assertEquals(TaskStatus.PENDING, statusOf("C"));

            run("B", "b");
            assertEquals(TaskStatus.READY, statusOf("C"));
            run("C", "c");
            assertEquals("c", fc.get());
        }

        @Test
        @DisplayName("dependents are READY by the time the dependency's future completes")
        void dependentsPromotedBeforeFuture() {
            CompletableFuture<Object> fa = resolver.registerTask("A", List.of(), null, null);
            resolver.registerTask("B", List.of("A"), null, null);
            AtomicReference<TaskStatus> seen = new AtomicReference<>();
            fa.thenRun(() -> seen.set(statusOf("B")));

            run("A", "ok");

            assertEquals(TaskStatus.READY, seen.get());
        }

        @Test
        @DisplayName("dependent with two dependencies waits for both")
        void waitsForAllDependencies() {
            resolver.registerTask("A", List.of(), null, null);
            resolver.registerTask("B", List.of(), null, null);
            resolver.registerTask("C", List.of("A", "B"), null, null);

            run("A", "a");
            assertEquals(TaskStatus.PENDING, statusOf("C"));
            run("B", "b");
            assertEquals(TaskStatus.READY, statusOf("C"));
        }

        @Test
        @DisplayName("startTask on a PENDING task raises InvalidStateTransitionException")
        void startPending() {
            resolver.registerTask("A", List.of(), null, null);
            resolver.registerTask("B", List.of("A"), null, null);
            var ex = assertThrows(InvalidStateTransitionException.class, () -> resolver.startTask("B", null));
            assertTrue(ex.getMessage().contains("PENDING"));
        }

        @Test
        @DisplayName("completeTask on a READY task raises InvalidStateTransitionException")
        void completeReady() {
            resolver.registerTask("A", List.of(), null, null);
            assertThrows(InvalidStateTransitionException.class, () -> resolver.completeTask("A", "x"));
        }

        @Test
        @DisplayName("unknown ids raise TaskNotFoundException")
        void unknownTask() {
            assertThrows(TaskNotFoundException.class, () -> resolver.startTask("nope", null));
            assertThrows(TaskNotFoundException.class, () -> resolver.completeTask("nope", null));
            assertThrows(TaskNotFoundException.class, () -> resolver.failTask("nope", "x"));
            assertThrows(TaskNotFoundException.class, () -> resolver.awaitTask("nope"));
            assertFalse(resolver.canTaskStart("nope"));
        }

        @Test
        @DisplayName("startTask records the agent and start time")
        void startRecordsAgent() {
            resolver.registerTask("A", List.of(), null, null);
            resolver.startTask("A", "agent-7");
            var task = resolver.getTask("A").orElseThrow();
            assertEquals(TaskStatus.RUNNING, task.status());
            assertEquals("agent-7", task.agentId());
            assertNotNull(task.startedAt());
        }
    }

    // -- Failure cascade ------------------------------------------------------

    @Nested
    @DisplayName("failure cascade")
    class FailureTests {

        @Test
        @DisplayName("failing a task blocks transitive dependents and rejects its future")
        void cascadeBlocks() {
            CompletableFuture<Object> fa = resolver.registerTask("A", List.of(), null, null);
            resolver.registerTask("B", List.of("A"), null, null);
            resolver.registerTask("C", List.of("B"), null, null);
            resolver.registerTask("D", List.of(), null, null);

            resolver.startTask("A", null);
            resolver.failTask("A", new IllegalStateException("disk full"));

            assertEquals(TaskStatus.FAILED, statusOf("A"));
            assertEquals(TaskStatus.BLOCKED, statusOf("B"));
            assertEquals(TaskStatus.BLOCKED, statusOf("C"));
            assertEquals(TaskStatus.READY, statusOf("D"));
            assertEquals("disk full", resolver.getTask("A").orElseThrow().error());

            var ex = assertThrows(ExecutionException.class, fa::get);
            assertInstanceOf(TaskFailedException.class, ex.getCause());
            assertInstanceOf(IllegalStateException.class, ex.getCause().getCause());
        }

        @Test
        @DisplayName("failing a COMPLETED task is rejected")
        void failCompleted() {
            resolver.registerTask("A", List.of(), null, null);
            run("A", "ok");
            assertThrows(InvalidStateTransitionException.class, () -> resolver.failTask("A", "late"));
        }

        @Test
        @DisplayName("re-registering a FAILED task retries it and unblocks dependents")
        void retryAfterFailure() throws Exception {
            resolver.registerTask("A", List.of(), null, null);
            resolver.registerTask("B", List.of("A"), null, null);
            resolver.registerTask("C", List.of("B"), null, null);
            resolver.failTask("A", "first try");
            assertEquals(TaskStatus.BLOCKED, statusOf("C"));

            CompletableFuture<Object> retry = resolver.registerTask("A", List.of(), null, null);
            assertEquals(TaskStatus.READY, statusOf("A"));
            assertEquals(TaskStatus.PENDING, statusOf("B"));
            assertEquals(TaskStatus.PENDING, statusOf("C"));

            run("A", "second try");
            assertEquals("second try", retry.get());
            assertEquals(TaskStatus.READY, statusOf("B"));
        }

        @Test
        @DisplayName("a new task registered BLOCKED blocks dependents registered ahead of it")
        void blockedRegistrationCascades() {
            resolver.registerTask("D", List.of("X"), null, null);
            resolver.registerTask("E", List.of("D"), null, null);
            resolver.registerTask("F", List.of(), null, null);
            resolver.startTask("F", null);
            resolver.failTask("F", "boom");

            resolver.registerTask("X", List.of("F"), null, null);

            assertEquals(TaskStatus.BLOCKED, statusOf("X"));
            assertEquals(TaskStatus.BLOCKED, statusOf("D"));
            assertEquals(TaskStatus.BLOCKED, statusOf("E"));
            SystemStatus status = resolver.getSystemStatus();
            assertEquals(0L, status.statusCounts().get(TaskStatus.PENDING));
            assertEquals(3L, status.statusCounts().get(TaskStatus.BLOCKED));

            resolver.registerTask("F", List.of(), null, null);
            assertEquals(TaskStatus.PENDING, statusOf("X"));
            assertEquals(TaskStatus.PENDING, statusOf("D"));
        }

        @Test
        @DisplayName("retry event carries FAILED as the previous status")
        void retryEventPreviousStatus() {
            resolver.registerTask("A", List.of(), null, null);
            resolver.failTask("A", "x");
            events.clear();

            resolver.registerTask("A", List.of(), null, null);

            assertEquals("FAILED", events.get(0).previousStatus());
            assertEquals("READY", events.get(0).newStatus());
        }

        @Test
        @DisplayName("records the size of the blocked cascade")
        void cascadeMetric() {
            resolver.registerTask("A", List.of(), null, null);
            resolver.registerTask("B", List.of("A"), null, null);
            resolver.registerTask("C", List.of("A"), null, null);
            resolver.failTask("A", "x");

            var summary = registry.find("trellis.task.blocked_cascade").summary();
            assertNotNull(summary);
            assertEquals(2.0, summary.totalAmount());
        }
    }

    // -- Force complete -------------------------------------------------------

    @Nested
    @DisplayName("forceCompleteTask")
    class ForceCompleteTests {

        @Test
        @DisplayName("completes a PENDING task and promotes its dependents")
        void forcePending() throws Exception {
            resolver.registerTask("A", List.of("ghost"), null, null);
            resolver.registerTask("B", List.of("A"), null, null);
            CompletableFuture<Object> fa = resolver.awaitTask("A");

            resolver.forceCompleteTask("A", null);

            assertEquals(TaskStatus.COMPLETED, statusOf("A"));
            assertEquals(TaskStatus.READY, statusOf("B"));
            @SuppressWarnings("unchecked")
            Map<String, Object> result = (Map<String, Object>) fa.get();
            assertEquals(true, result.get("forcedComplete"));
            assertTrue(events.stream().anyMatch(e -> e.eventType().equals(DependencyResolver.FORCE_COMPLETED)));
        }

        @Test
        @DisplayName("unblocks a BLOCKED task whose failed dependency is gone from its path")
        void forceBlocked() {
            resolver.registerTask("A", List.of(), null, null);
            resolver.registerTask("B", List.of("A"), null, null);
            resolver.registerTask("C", List.of("B"), null, null);
            resolver.failTask("A", "x");

            resolver.forceCompleteTask("B", "manual");

            assertEquals(TaskStatus.COMPLETED, statusOf("B"));
            assertEquals(TaskStatus.READY, statusOf("C"));
        }

        @Test
        @DisplayName("terminal tasks cannot be force-completed")
        void forceTerminal() {
            resolver.registerTask("A", List.of(), null, null);
            run("A", "ok");
            assertThrows(InvalidStateTransitionException.class, () -> resolver.forceCompleteTask("A", null));
        }
    }

    // -- Queries --------------------------------------------------------------

    @Nested
    @DisplayName("queries")
    class QueryTests {

        @Test
        @DisplayName("getSystemStatus counts every status and is pure")
        void systemStatus() {
            resolver.registerTask("A", List.of(), null, null);
            resolver.registerTask("B", List.of("A"), null, null);
            resolver.registerTask("C", List.of(), null, null);
            resolver.startTask("C", null);

            SystemStatus first = resolver.getSystemStatus();
            SystemStatus second = resolver.getSystemStatus();

            assertEquals(first, second);
            assertEquals(3, first.totalTasks());
            assertEquals(1, first.runningTasks());
            assertEquals(1L, first.count(TaskStatus.READY));
            assertEquals(1L, first.count(TaskStatus.PENDING));
            assertEquals(0L, first.count(TaskStatus.FAILED));
            assertEquals(TaskStatus.values().length, first.statusCounts().size());
            assertEquals(1, first.dependencyGraphSize());
        }

        @Test
        @DisplayName("getDependencyChain walks transitive dependencies with depth")
        void dependencyChain() {
            resolver.registerTask("A", List.of(), null, null);
            resolver.registerTask("B", List.of("A", "ghost"), null, null);
            resolver.registerTask("C", List.of("B"), null, null);

            DependencyChain chain = resolver.getDependencyChain("C");

            assertEquals("C", chain.taskId());
            assertEquals(2, chain.totalDepth());
            assertEquals(List.of("C", "B", "A", "ghost"),
                    chain.entries().stream().map(DependencyChain.Entry::taskId).toList());
            DependencyChain.Entry ghost = chain.entries().get(3);
            assertFalse(ghost.registered());
            assertNull(ghost.status());
        }

        @Test
        @DisplayName("snapshot lists direct dependents")
        void snapshotDependents() {
            resolver.registerTask("A", List.of(), null, null);
            resolver.registerTask("B", List.of("A"), null, null);
            assertEquals(List.of("B"), resolver.getTask("A").orElseThrow().dependents());
        }
    }
}
