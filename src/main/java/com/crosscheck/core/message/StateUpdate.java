package com.crosscheck.core.message;

import com.crosscheck.core.model.TaskState;

/**
 * Agent to orchestrator: work on the attempt started or is still progressing.
 */
public record StateUpdate(
    int round,
    int attemptNumber,
    TaskState reportedState,
    String note
) implements MessagePayload {
}
