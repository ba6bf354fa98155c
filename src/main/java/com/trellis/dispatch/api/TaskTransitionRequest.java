package com.trellis.dispatch.api;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Optional body for the start, complete, fail and force-complete task endpoints.
 * Each endpoint reads only the field it needs.
 */
public record TaskTransitionRequest(
    @JsonProperty("agent_id") String agentId,
    Object result,
    String error
) {}
