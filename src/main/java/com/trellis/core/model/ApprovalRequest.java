package com.trellis.core.model;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;

/**
 * Snapshot of an approval request held by the approval gate.
 *
 * @param approvalId  unique identifier
 * @param threadId    thread the guarded action belongs to
 * @param action      description of the action awaiting approval
 * @param status      current status; anything but PENDING is terminal
 * @param requestedAt when the request was enqueued
 * @param resolvedAt  when it was resolved, null while pending
 * @param feedback    approver feedback or rejection reason
 * @param timeout     how long the request waits before it times out
 */
public record ApprovalRequest(
    String approvalId,
    String threadId,
    Map<String, Object> action,
    ApprovalStatus status,
    Instant requestedAt,
    Instant resolvedAt,
    String feedback,
    Duration timeout
) {
    public boolean isPending() {
        return status == ApprovalStatus.PENDING;
    }
}
