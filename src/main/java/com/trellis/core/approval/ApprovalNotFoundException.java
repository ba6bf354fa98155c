package com.trellis.core.approval;

import com.trellis.core.CoordinationException;

public class ApprovalNotFoundException extends CoordinationException {

    public ApprovalNotFoundException(String approvalId) {
        super("Approval request " + approvalId + " not found");
    }
}
