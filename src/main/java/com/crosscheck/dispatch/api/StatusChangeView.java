package com.crosscheck.dispatch.api;

import com.crosscheck.core.model.StatusChange;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

public record StatusChangeView(
    @JsonProperty("from") String from,
    @JsonProperty("to") String to,
    @JsonProperty("agent_id") String agentId,
    @JsonProperty("at") Instant at
) {

    public static StatusChangeView from(StatusChange change) {
        return new StatusChangeView(change.from() != null ? change.from().name() : null, change.to().name(),
                change.agentId(), change.at());
    }
}
