package com.crosscheck.core.message;

/**
 * Any participant to orchestrator: ask for a task snapshot. The answer is sent to the requester.
 */
public record QueryRequest(String query) implements MessagePayload {
}
