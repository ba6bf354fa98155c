package com.trellis.dispatch.api;

/**
 * Optional body for the approve and reject endpoints: {@code feedback} for approvals,
 * {@code reason} for rejections.
 */
public record ApprovalDecisionRequest(
    String feedback,
    String reason
) {}
