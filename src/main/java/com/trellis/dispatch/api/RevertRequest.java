package com.trellis.dispatch.api;

import com.fasterxml.jackson.annotation.JsonProperty;

public record RevertRequest(
    @JsonProperty("checkpoint_id") String checkpointId
) {}
