package com.crosscheck.core.registry;

import com.crosscheck.core.model.TaskState;

/**
 * Thrown for an edge the task state machine does not have. Indicates a programming error.
 */
public class IllegalTransitionException extends RuntimeException {

    public IllegalTransitionException(String taskId, TaskState from, TaskState to) {
        super("Illegal transition for task " + taskId + ": " + from + " -> " + to);
    }
}
