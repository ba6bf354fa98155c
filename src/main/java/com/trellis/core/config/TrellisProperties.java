package com.trellis.core.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Component
@ConfigurationProperties(prefix = "trellis")
public class TrellisProperties {

    private Execution execution = new Execution();
    private Approval approval = new Approval();
    private Checkpoint checkpoint = new Checkpoint();

    public Execution getExecution() { return execution; }
    public void setExecution(Execution execution) { this.execution = execution; }
    public Approval getApproval() { return approval; }
    public void setApproval(Approval approval) { this.approval = approval; }
    public Checkpoint getCheckpoint() { return checkpoint; }
    public void setCheckpoint(Checkpoint checkpoint) { this.checkpoint = checkpoint; }

    public static class Execution {
        private int maxRetries = 3;
        private long retryDelayMs = 1000;
        private boolean checkpointingEnabled = true;
        private boolean approvalGatesEnabled = true;
        private long approvalTimeoutMs = 5 * 60 * 1000L;

        public int getMaxRetries() { return maxRetries; }
        public void setMaxRetries(int maxRetries) { this.maxRetries = maxRetries; }
        public long getRetryDelayMs() { return retryDelayMs; }
        public void setRetryDelayMs(long retryDelayMs) { this.retryDelayMs = retryDelayMs; }
        public boolean isCheckpointingEnabled() { return checkpointingEnabled; }
        public void setCheckpointingEnabled(boolean checkpointingEnabled) { this.checkpointingEnabled = checkpointingEnabled; }
        public boolean isApprovalGatesEnabled() { return approvalGatesEnabled; }
        public void setApprovalGatesEnabled(boolean approvalGatesEnabled) { this.approvalGatesEnabled = approvalGatesEnabled; }
        public long getApprovalTimeoutMs() { return approvalTimeoutMs; }
        public void setApprovalTimeoutMs(long approvalTimeoutMs) { this.approvalTimeoutMs = approvalTimeoutMs; }
    }

    public static class Approval {
        private boolean enabled = true;
        private long defaultTimeoutMs = 5 * 60 * 1000L;
        /** Agent type to the operation names that must be approved before they run. */
        private Map<String, List<String>> gates = new LinkedHashMap<>();

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }
        public long getDefaultTimeoutMs() { return defaultTimeoutMs; }
        public void setDefaultTimeoutMs(long defaultTimeoutMs) { this.defaultTimeoutMs = defaultTimeoutMs; }
        public Map<String, List<String>> getGates() { return gates; }
        public void setGates(Map<String, List<String>> gates) { this.gates = gates; }

        public void addGate(String agentType, String... operations) {
            gates.computeIfAbsent(agentType, k -> new ArrayList<>()).addAll(List.of(operations));
        }
    }

    public static class Checkpoint {
        /** "memory" or "jdbc". */
        private String store = "memory";
        private boolean timeTravelEnabled = true;
        private long retentionMs = 24 * 60 * 60 * 1000L;
        private long cleanupIntervalMs = 24 * 60 * 60 * 1000L;

        public String getStore() { return store; }
        public void setStore(String store) { this.store = store; }
        public boolean isTimeTravelEnabled() { return timeTravelEnabled; }
        public void setTimeTravelEnabled(boolean timeTravelEnabled) { this.timeTravelEnabled = timeTravelEnabled; }
        public long getRetentionMs() { return retentionMs; }
        public void setRetentionMs(long retentionMs) { this.retentionMs = retentionMs; }
        public long getCleanupIntervalMs() { return cleanupIntervalMs; }
        public void setCleanupIntervalMs(long cleanupIntervalMs) { this.cleanupIntervalMs = cleanupIntervalMs; }
    }
}
