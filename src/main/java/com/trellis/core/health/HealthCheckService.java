package com.trellis.core.health;

import com.trellis.core.approval.ApprovalGate;
import com.trellis.core.model.SystemStatus;
import com.trellis.core.model.TaskStatus;
import com.trellis.core.persistence.CheckpointStore;
import com.trellis.core.scheduler.DependencyResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

@Service
public class HealthCheckService {

    private static final Logger log = LoggerFactory.getLogger(HealthCheckService.class);

    private final DependencyResolver resolver;
    private final CheckpointStore checkpointStore;
    private final ApprovalGate approvalGate;

    public HealthCheckService(
            @Autowired(required = false) DependencyResolver resolver,
            @Autowired(required = false) CheckpointStore checkpointStore,
            @Autowired(required = false) ApprovalGate approvalGate) {
        this.resolver = resolver;
        this.checkpointStore = checkpointStore;
        this.approvalGate = approvalGate;
    }

    public List<HealthStatus> checkAll() {
        var results = new ArrayList<HealthStatus>();
        results.add(checkResolver());
        results.add(checkCheckpointStore());
        results.add(checkApprovalGate());
        return results;
    }

    private HealthStatus checkResolver() {
        if (resolver == null) {
            return new HealthStatus("resolver", HealthStatus.Status.DOWN,
                    "Dependency resolver not available", Map.of());
        }
        SystemStatus status = resolver.getSystemStatus();
        Map<String, String> metadata = Map.of(
                "tasks", String.valueOf(status.totalTasks()),
                "running", String.valueOf(status.runningTasks()),
                "blocked", String.valueOf(status.count(TaskStatus.BLOCKED)));
        if (status.count(TaskStatus.BLOCKED) > 0) {
            return new HealthStatus("resolver", HealthStatus.Status.DEGRADED,
                    status.count(TaskStatus.BLOCKED) + " task(s) blocked by failed dependencies", metadata);
        }
        return new HealthStatus("resolver", HealthStatus.Status.UP,
                "Tracking " + status.totalTasks() + " task(s)", metadata);
    }

    private HealthStatus checkCheckpointStore() {
        if (checkpointStore == null) {
            return new HealthStatus("checkpoint-store", HealthStatus.Status.DOWN,
                    "No CheckpointStore configured", Map.of());
        }
        String type = checkpointStore.getClass().getSimpleName();
        try {
            if (checkpointStore.isAvailable()) {
                return new HealthStatus("checkpoint-store", HealthStatus.Status.UP,
                        "Checkpoint store available (" + type + ")", Map.of("type", type));
            }
            return new HealthStatus("checkpoint-store", HealthStatus.Status.DOWN,
                    "Checkpoint store unreachable (" + type + ")", Map.of("type", type));
        } catch (Exception e) {
            log.warn("Checkpoint store health check failed: {}", e.getMessage());
            return new HealthStatus("checkpoint-store", HealthStatus.Status.DOWN,
                    "Checkpoint store error: " + e.getMessage(), Map.of("type", type));
        }
    }

    private HealthStatus checkApprovalGate() {
        if (approvalGate == null) {
            return new HealthStatus("approval-gate", HealthStatus.Status.DOWN,
                    "Approval gate not available", Map.of());
        }
        int pending = approvalGate.pendingCount();
        return new HealthStatus("approval-gate", HealthStatus.Status.UP,
                pending + " pending approval(s)", Map.of("pending", String.valueOf(pending)));
    }
}
