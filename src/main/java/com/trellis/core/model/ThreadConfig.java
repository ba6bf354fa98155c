package com.trellis.core.model;

import java.util.Map;

/**
 * Parameters for creating a thread. Every field is optional.
 *
 * @param threadId  explicit id; one is generated when null or blank
 * @param namespace namespace; defaults to {@code trellis}
 * @param metadata  metadata stored with the thread
 */
public record ThreadConfig(String threadId, String namespace, Map<String, Object> metadata) {

    public static ThreadConfig defaults() {
        return new ThreadConfig(null, null, Map.of());
    }

    public static ThreadConfig ofNamespace(String namespace, Map<String, Object> metadata) {
        return new ThreadConfig(null, namespace, metadata);
    }
}
