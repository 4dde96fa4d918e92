package com.crosscheck.core.message;

/**
 * Any participant to orchestrator: stop the task wherever it is.
 */
public record CancelTask(String reason) implements MessagePayload {
}
