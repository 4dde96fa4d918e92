package com.crosscheck.core.model;

import java.time.Instant;

/**
 * One judgement recorded in a task's attempt history. Never edited once appended.
 *
 * @param round         validation round the attempt belongs to (incremented by RETRY_RESET)
 * @param attemptNumber 1-indexed, equal to the task's retryCount + 1 when the attempt was made
 * @param validatorId   agent that judged the artifact
 * @param result        PASS or FAIL
 * @param feedback      free-form feedback handed to the next generation attempt
 * @param timestamp     when the result was applied
 */
public record ValidationAttempt(
    int round,
    int attemptNumber,
    String validatorId,
    ValidationVerdict result,
    String feedback,
    Instant timestamp
) {

    public boolean failed() {
        return result == ValidationVerdict.FAIL;
    }
}
