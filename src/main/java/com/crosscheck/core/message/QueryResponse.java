package com.crosscheck.core.message;

import com.crosscheck.core.model.FailureReason;
import com.crosscheck.core.model.TaskState;

/**
 * Orchestrator to requester: snapshot of the task named in the envelope.
 *
 * @param inReplyTo id of the query message
 * @param found     false when the task is unknown, in which case the other fields are empty
 */
public record QueryResponse(
    String inReplyTo,
    boolean found,
    TaskState state,
    int retryCount,
    int maxRetries,
    int round,
    String ownerAgentId,
    FailureReason failureReason,
    String failureDetail
) implements MessagePayload {

    public static QueryResponse notFound(String inReplyTo) {
        return new QueryResponse(inReplyTo, false, null, 0, 0, 0, null, null, null);
    }
}
