package com.trellis.dispatch.api;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

/**
 * Inbound JSON body for POST /api/v1/threads. Every field is optional.
 */
public record CreateThreadRequest(
    @JsonProperty("thread_id") String threadId,
    String namespace,
    Map<String, Object> metadata
) {}
