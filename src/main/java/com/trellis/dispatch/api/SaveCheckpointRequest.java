package com.trellis.dispatch.api;

import java.util.Map;

/**
 * Inbound JSON body for POST /api/v1/threads/{id}/checkpoints. The phase is read from
 * {@code metadata.phase}.
 */
public record SaveCheckpointRequest(
    Map<String, Object> payload,
    Map<String, Object> metadata
) {}
