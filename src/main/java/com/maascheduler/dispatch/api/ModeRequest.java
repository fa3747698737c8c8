package com.maascheduler.dispatch.api;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Request body for the mode endpoint: {@code scheduler} or {@code single_task}.
 */
public record ModeRequest(
    @JsonProperty("mode") String mode
) {}
