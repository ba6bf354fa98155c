package com.trellis.dispatch.api;

import com.trellis.core.model.Checkpoint;
import com.trellis.core.model.ExecutionThread;
import com.trellis.core.model.ThreadConfig;
import com.trellis.core.model.ThreadStats;
import com.trellis.core.persistence.CheckpointNotFoundException;
import com.trellis.core.persistence.PersistenceException;
import com.trellis.core.persistence.ThreadCheckpointer;
import com.trellis.core.persistence.ThreadNotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * REST controller for execution threads, their checkpoint history and time travel.
 */
@RestController
@RequestMapping("/api/v1/threads")
public class ThreadController {

    private static final Logger log = LoggerFactory.getLogger(ThreadController.class);

    private final ThreadCheckpointer checkpointer;

    public ThreadController(ThreadCheckpointer checkpointer) {
        this.checkpointer = checkpointer;
    }

    /**
     * POST /api/v1/threads: Create a thread. 201 with the thread.
     */
    @PostMapping
    public ResponseEntity<Object> createThread(@RequestBody(required = false) CreateThreadRequest request) {
        ThreadConfig config = request == null ? ThreadConfig.defaults()
                : new ThreadConfig(request.threadId(), request.namespace(), request.metadata());
        try {
            ExecutionThread thread = checkpointer.createThread(config);
            return ResponseEntity.status(HttpStatus.CREATED).body(thread);
        } catch (IllegalArgumentException e) {
            return ResponseEntity.status(HttpStatus.CONFLICT).body(Map.of("error", e.getMessage()));
        } catch (PersistenceException e) {
            return persistenceFailure(e);
        }
    }

    @GetMapping
    public ResponseEntity<Object> listThreads() {
        try {
            return ResponseEntity.ok(checkpointer.listThreads());
        } catch (PersistenceException e) {
            return persistenceFailure(e);
        }
    }

    @GetMapping("/stats")
    public ResponseEntity<ThreadStats> getStats() {
        return ResponseEntity.ok(checkpointer.getThreadStats());
    }

    /**
     * GET /api/v1/threads/{id}/checkpoint: Payload of the latest visible checkpoint.
     */
    @GetMapping("/{id}/checkpoint")
    public ResponseEntity<Object> loadCheckpoint(@PathVariable String id) {
        try {
            Optional<Checkpoint> latest = checkpointer.getLatestCheckpoint(id);
            if (latest.isEmpty()) {
                return ResponseEntity.status(HttpStatus.NOT_FOUND)
                        .body(Map.of("error", "Thread " + id + " has no checkpoints"));
            }
            return ResponseEntity.ok(latest.get());
        } catch (ThreadNotFoundException e) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body(Map.of("error", e.getMessage()));
        } catch (PersistenceException e) {
            return persistenceFailure(e);
        }
    }

    @PostMapping("/{id}/checkpoints")
    public ResponseEntity<Object> saveCheckpoint(@PathVariable String id,
                                                 @RequestBody SaveCheckpointRequest request) {
        try {
            String checkpointId = checkpointer.saveCheckpoint(id, request.payload(), request.metadata());
            return ResponseEntity.status(HttpStatus.CREATED).body(Map.of(
                    "thread_id", id,
                    "checkpoint_id", checkpointId));
        } catch (ThreadNotFoundException e) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body(Map.of("error", e.getMessage()));
        } catch (IllegalStateException e) {
            return ResponseEntity.status(HttpStatus.CONFLICT).body(Map.of("error", e.getMessage()));
        } catch (PersistenceException e) {
            return persistenceFailure(e);
        }
    }

    /**
     * GET /api/v1/threads/{id}/checkpoints?limit=: Visible history, newest first.
     * With {@code all=true} superseded checkpoints are included, oldest first.
     */
    @GetMapping("/{id}/checkpoints")
    public ResponseEntity<Object> getHistory(@PathVariable String id,
                                             @RequestParam(defaultValue = "10") int limit,
                                             @RequestParam(defaultValue = "false") boolean all) {
        if (limit < 0) {
            return ResponseEntity.badRequest().body(Map.of("error", "limit must not be negative"));
        }
        try {
            List<Checkpoint> history = all
                    ? checkpointer.getFullHistory(id)
                    : checkpointer.getCheckpointHistory(id, limit);
            return ResponseEntity.ok(history);
        } catch (ThreadNotFoundException e) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body(Map.of("error", e.getMessage()));
        } catch (PersistenceException e) {
            return persistenceFailure(e);
        }
    }

    /**
     * POST /api/v1/threads/{id}/revert: Time travel to an earlier checkpoint.
     */
    @PostMapping("/{id}/revert")
    public ResponseEntity<Object> revert(@PathVariable String id, @RequestBody RevertRequest request) {
        if (request.checkpointId() == null || request.checkpointId().isBlank()) {
            return ResponseEntity.badRequest().body(Map.of("error", "checkpoint_id is required"));
        }
        try {
            Map<String, Object> payload = checkpointer.revertToCheckpoint(id, request.checkpointId());
            Map<String, Object> body = new LinkedHashMap<>();
            body.put("thread_id", id);
            body.put("checkpoint_id", request.checkpointId());
            body.put("payload", payload);
            return ResponseEntity.ok(body);
        } catch (ThreadNotFoundException | CheckpointNotFoundException e) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body(Map.of("error", e.getMessage()));
        } catch (IllegalStateException e) {
            return ResponseEntity.status(HttpStatus.CONFLICT).body(Map.of("error", e.getMessage()));
        } catch (PersistenceException e) {
            return persistenceFailure(e);
        }
    }

    @PostMapping("/{id}/close")
    public ResponseEntity<Object> closeThread(@PathVariable String id,
                                              @RequestBody(required = false) Map<String, Object> finalState) {
        try {
            return ResponseEntity.ok(checkpointer.closeThread(id, finalState));
        } catch (ThreadNotFoundException e) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body(Map.of("error", e.getMessage()));
        } catch (PersistenceException e) {
            return persistenceFailure(e);
        }
    }

    private ResponseEntity<Object> persistenceFailure(PersistenceException e) {
        log.error("Checkpoint store failure: {}", e.getMessage(), e);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(Map.of("error", e.getMessage()));
    }
}
