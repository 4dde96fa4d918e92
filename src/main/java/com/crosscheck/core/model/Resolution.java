package com.crosscheck.core.model;

/**
 * Human decision on an open escalation, with the task state it leads to.
 */
public enum Resolution {
    RETRY_RESET(TaskState.IN_PROGRESS),
    ABORT(TaskState.FAILED),
    FORCE_ACCEPT(TaskState.COMPLETED);

    private final TaskState targetState;

    Resolution(TaskState targetState) {
        this.targetState = targetState;
    }

    public TaskState targetState() {
        return targetState;
    }
}
