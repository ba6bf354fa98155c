package com.trellis.core.approval;

import com.trellis.core.CoordinationException;
import com.trellis.core.model.ApprovalStatus;

/**
 * Thrown when an approval request is resolved a second time. The first resolution wins.
 */
public class ApprovalAlreadyResolvedException extends CoordinationException {

    private final ApprovalStatus status;

    public ApprovalAlreadyResolvedException(String approvalId, ApprovalStatus status) {
        super("Approval request " + approvalId + " is already " + status);
        this.status = status;
    }

    public ApprovalStatus getStatus() {
        return status;
    }
}
