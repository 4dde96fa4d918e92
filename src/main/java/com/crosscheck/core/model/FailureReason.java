package com.crosscheck.core.model;

/**
 * Why a task ended in {@link TaskState#FAILED}.
 */
public enum FailureReason {
    CANCELLED,
    /** No progress from the owner within the liveness deadline. */
    AGENT_UNAVAILABLE,
    /** Validator did not answer within the validation deadline. */
    TIMEOUT,
    /** Agent reported an error and no reassignment was possible. */
    AGENT_ERROR,
    /** A human resolved the escalation with {@link Resolution#ABORT}. */
    ABORTED,
    /** A task this one depends on failed, so it can never start. */
    DEPENDENCY_FAILED
}
