package com.crosscheck.core.registry;

import com.crosscheck.core.model.TaskState;

/**
 * Thrown when a transition's expected state does not match the task's current state.
 * The caller lost an optimistic-concurrency race and should re-read the task.
 */
public class ConflictException extends RuntimeException {

    private final String taskId;
    private final TaskState expected;
    private final TaskState actual;

    public ConflictException(String taskId, TaskState expected, TaskState actual) {
        super("Task " + taskId + " is " + actual + ", expected " + expected);
        this.taskId = taskId;
        this.expected = expected;
        this.actual = actual;
    }

    /** Conflict on a task whose state matched but whose attempt moved on. */
    public ConflictException(String taskId, TaskState state, String detail) {
        super("Task " + taskId + " changed while " + state + ": " + detail);
        this.taskId = taskId;
        this.expected = state;
        this.actual = state;
    }

    public String getTaskId() {
        return taskId;
    }

    public TaskState getExpected() {
        return expected;
    }

    public TaskState getActual() {
        return actual;
    }
}
