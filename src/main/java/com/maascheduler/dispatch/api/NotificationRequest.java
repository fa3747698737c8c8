package com.maascheduler.dispatch.api;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Optional request body for the test notification endpoint.
 */
public record NotificationRequest(
    @JsonProperty("title") String title,
    @JsonProperty("content") String content
) {}
