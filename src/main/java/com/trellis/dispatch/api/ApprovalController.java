package com.trellis.dispatch.api;

import com.trellis.core.approval.ApprovalAlreadyResolvedException;
import com.trellis.core.approval.ApprovalGate;
import com.trellis.core.approval.ApprovalNotFoundException;
import com.trellis.core.model.ApprovalRequest;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

/**
 * REST controller for the human side of the approval gate.
 */
@RestController
@RequestMapping("/api/v1/approvals")
public class ApprovalController {

    private final ApprovalGate approvalGate;

    public ApprovalController(ApprovalGate approvalGate) {
        this.approvalGate = approvalGate;
    }

    /**
     * GET /api/v1/approvals: Pending requests, optionally for one thread.
     */
    @GetMapping
    public ResponseEntity<List<ApprovalRequest>> listPending(
            @RequestParam(name = "thread_id", required = false) String threadId) {
        return ResponseEntity.ok(threadId != null ? approvalGate.listPending(threadId) : approvalGate.listPending());
    }

    @GetMapping("/{id}")
    public ResponseEntity<ApprovalRequest> getRequest(@PathVariable String id) {
        return approvalGate.getRequest(id)
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.notFound().build());
    }

    @PostMapping("/{id}/approve")
    public ResponseEntity<Object> approve(@PathVariable String id,
                                          @RequestBody(required = false) ApprovalDecisionRequest request) {
        String feedback = request != null ? request.feedback() : null;
        return resolve(() -> approvalGate.approveAction(id, feedback));
    }

    @PostMapping("/{id}/reject")
    public ResponseEntity<Object> reject(@PathVariable String id,
                                         @RequestBody(required = false) ApprovalDecisionRequest request) {
        String reason = request != null ? request.reason() : null;
        return resolve(() -> approvalGate.rejectAction(id, reason));
    }

    private ResponseEntity<Object> resolve(Supplier<ApprovalRequest> action) {
        try {
            return ResponseEntity.ok(action.get());
        } catch (ApprovalNotFoundException e) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body(Map.of("error", e.getMessage()));
        } catch (ApprovalAlreadyResolvedException e) {
            return ResponseEntity.status(HttpStatus.CONFLICT).body(Map.of("error", e.getMessage()));
        }
    }
}
