package com.trellis.dispatch.api;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Map;

/**
 * Inbound JSON body for POST /api/v1/tasks.
 *
 * @param taskId       unique task id
 * @param dependencies ids of tasks that must complete first; nullable
 * @param agentId      owning agent; nullable
 * @param metadata     arbitrary task data; nullable
 */
public record RegisterTaskRequest(
    @JsonProperty("task_id") String taskId,
    List<String> dependencies,
    @JsonProperty("agent_id") String agentId,
    Map<String, Object> metadata
) {}
