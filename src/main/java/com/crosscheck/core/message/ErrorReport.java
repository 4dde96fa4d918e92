package com.crosscheck.core.message;

/**
 * Agent to orchestrator: the agent could not complete the attempt.
 */
public record ErrorReport(
    int round,
    int attemptNumber,
    String code,
    String message
) implements MessagePayload {
}
