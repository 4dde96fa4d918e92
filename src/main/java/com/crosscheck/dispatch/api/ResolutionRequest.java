package com.crosscheck.dispatch.api;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Request body for resolving an escalation.
 *
 * @param resolution RETRY_RESET, ABORT or FORCE_ACCEPT (case-insensitive)
 */
public record ResolutionRequest(
    @JsonProperty("resolution") String resolution,
    @JsonProperty("reviewer") String reviewer,
    @JsonProperty("note") String note
) {}
