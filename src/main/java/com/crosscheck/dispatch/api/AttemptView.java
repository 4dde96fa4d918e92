package com.crosscheck.dispatch.api;

import com.crosscheck.core.model.ValidationAttempt;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

public record AttemptView(
    @JsonProperty("round") int round,
    @JsonProperty("attempt_number") int attemptNumber,
    @JsonProperty("validator_id") String validatorId,
    @JsonProperty("result") String result,
    @JsonProperty("feedback") String feedback,
    @JsonProperty("timestamp") Instant timestamp
) {

    public static AttemptView from(ValidationAttempt attempt) {
        return new AttemptView(attempt.round(), attempt.attemptNumber(), attempt.validatorId(),
                attempt.result().name(), attempt.feedback(), attempt.timestamp());
    }
}
