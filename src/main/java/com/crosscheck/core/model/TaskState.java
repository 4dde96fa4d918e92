package com.crosscheck.core.model;

/**
 * Lifecycle state of a {@link Task}.
 * <p>
 * COMPLETED and FAILED are terminal. An owner agent is attached only while the task is
 * ASSIGNED, IN_PROGRESS or VALIDATING.
 */
public enum TaskState {
    PENDING,
    ASSIGNED,
    IN_PROGRESS,
    VALIDATING,
    ESCALATED,
    COMPLETED,
    FAILED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }

    public boolean holdsOwner() {
        return this == ASSIGNED || this == IN_PROGRESS || this == VALIDATING;
    }

    /**
     * Whether the state machine has an edge from this state to {@code next}.
     * Same-state edges on owner-holding states record progress without changing state.
     */
    public boolean canTransitionTo(TaskState next) {
        if (isTerminal()) return false;
        if (next == FAILED) return true;
        return switch (this) {
            case PENDING -> next == ASSIGNED;
            case ASSIGNED -> next == IN_PROGRESS || next == ASSIGNED;
            case IN_PROGRESS -> next == VALIDATING || next == IN_PROGRESS || next == ASSIGNED;
            case VALIDATING -> next == COMPLETED || next == IN_PROGRESS || next == ESCALATED || next == VALIDATING;
            case ESCALATED -> next == IN_PROGRESS || next == COMPLETED;
            default -> false;
        };
    }
}
