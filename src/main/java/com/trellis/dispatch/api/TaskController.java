package com.trellis.dispatch.api;

import com.trellis.core.model.DependencyChain;
import com.trellis.core.model.SystemStatus;
import com.trellis.core.scheduler.DependencyCycleException;
import com.trellis.core.scheduler.DependencyResolver;
import com.trellis.core.scheduler.DuplicateTaskException;
import com.trellis.core.scheduler.InvalidStateTransitionException;
import com.trellis.core.scheduler.TaskNotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.Consumer;

/**
 * REST controller for task registration and lifecycle transitions.
 */
@RestController
@RequestMapping("/api/v1/tasks")
public class TaskController {

    private static final Logger log = LoggerFactory.getLogger(TaskController.class);

    private final DependencyResolver resolver;

    public TaskController(DependencyResolver resolver) {
        this.resolver = resolver;
    }

    /**
     * POST /api/v1/tasks: Register a task. 201 with the task snapshot.
     */
    @PostMapping
    public ResponseEntity<Object> registerTask(@RequestBody RegisterTaskRequest request) {
        if (request.taskId() == null || request.taskId().isBlank()) {
            return ResponseEntity.badRequest().body(Map.of("error", "task_id is required"));
        }
        try {
            resolver.registerTask(request.taskId(), request.dependencies(), request.agentId(), request.metadata());
        } catch (DependencyCycleException e) {
            Map<String, Object> body = new LinkedHashMap<>();
            body.put("error", e.getMessage());
            body.put("cycle", e.getCycle());
            return ResponseEntity.badRequest().body(body);
        } catch (DuplicateTaskException e) {
            return ResponseEntity.status(HttpStatus.CONFLICT).body(Map.of("error", e.getMessage()));
        }
        return ResponseEntity.status(HttpStatus.CREATED).body(resolver.getTask(request.taskId()).orElseThrow());
    }

    /**
     * GET /api/v1/tasks: Counts per status plus every task.
     */
    @GetMapping
    public ResponseEntity<SystemStatus> getSystemStatus() {
        return ResponseEntity.ok(resolver.getSystemStatus());
    }

    /**
     * GET /api/v1/tasks/{id}: The task snapshot and whether it may start now.
     */
    @GetMapping("/{id}")
    public ResponseEntity<Map<String, Object>> getTask(@PathVariable String id) {
        return resolver.getTask(id)
                .map(task -> {
                    Map<String, Object> body = new LinkedHashMap<>();
                    body.put("task", task);
                    body.put("canStart", resolver.canTaskStart(id));
                    return ResponseEntity.ok(body);
                })
                .orElseGet(() -> ResponseEntity.notFound().build());
    }

    @PostMapping("/{id}/start")
    public ResponseEntity<Object> startTask(@PathVariable String id,
                                            @RequestBody(required = false) TaskTransitionRequest request) {
        String agentId = request != null ? request.agentId() : null;
        return transition(id, taskId -> resolver.startTask(taskId, agentId));
    }

    @PostMapping("/{id}/complete")
    public ResponseEntity<Object> completeTask(@PathVariable String id,
                                               @RequestBody(required = false) TaskTransitionRequest request) {
        Object result = request != null ? request.result() : null;
        return transition(id, taskId -> resolver.completeTask(taskId, result));
    }

    @PostMapping("/{id}/fail")
    public ResponseEntity<Object> failTask(@PathVariable String id,
                                           @RequestBody(required = false) TaskTransitionRequest request) {
        String error = request != null ? request.error() : null;
        return transition(id, taskId -> resolver.failTask(taskId, error));
    }

    /**
     * POST /api/v1/tasks/{id}/force-complete: Manual override for stuck tasks.
     */
    @PostMapping("/{id}/force-complete")
    public ResponseEntity<Object> forceCompleteTask(@PathVariable String id,
                                                    @RequestBody(required = false) TaskTransitionRequest request) {
        Object result = request != null ? request.result() : null;
        log.warn("Force-complete requested for task {}", id);
        return transition(id, taskId -> resolver.forceCompleteTask(taskId, result));
    }

    @GetMapping("/{id}/chain")
    public ResponseEntity<Object> getDependencyChain(@PathVariable String id) {
        try {
            DependencyChain chain = resolver.getDependencyChain(id);
            return ResponseEntity.ok(chain);
        } catch (TaskNotFoundException e) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body(Map.of("error", e.getMessage()));
        }
    }

    private ResponseEntity<Object> transition(String taskId, Consumer<String> action) {
        try {
            action.accept(taskId);
        } catch (TaskNotFoundException e) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body(Map.of("error", e.getMessage()));
        } catch (InvalidStateTransitionException e) {
            return ResponseEntity.status(HttpStatus.CONFLICT).body(Map.of("error", e.getMessage()));
        }
        return ResponseEntity.ok(resolver.getTask(taskId).orElseThrow());
    }
}
