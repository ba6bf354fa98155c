package com.trellis.core.model;

/**
 * Outcome delivered to whoever awaits an approval request.
 *
 * @param approved  whether the action may proceed
 * @param feedback  approver feedback (approved only)
 * @param reason    rejection reason, {@code "timeout"} when the request expired
 * @param automatic true when the gate is disabled and approved without asking
 */
public record ApprovalDecision(boolean approved, String feedback, String reason, boolean automatic) {

    public static final String TIMEOUT_REASON = "timeout";

    public static ApprovalDecision approve(String feedback) {
        return new ApprovalDecision(true, feedback, null, false);
    }

    public static ApprovalDecision reject(String reason) {
        return new ApprovalDecision(false, null, reason, false);
    }

    public static ApprovalDecision timeout() {
        return new ApprovalDecision(false, null, TIMEOUT_REASON, false);
    }

    public static ApprovalDecision autoApproved() {
        return new ApprovalDecision(true, null, null, true);
    }
}
