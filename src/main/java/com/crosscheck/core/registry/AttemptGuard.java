package com.crosscheck.core.registry;

import com.crosscheck.core.model.Task;

/**
 * Check run inside a transition mutator for tasks that may have left and re-entered the
 * expected state since they were read.
 */
public final class AttemptGuard {

    private AttemptGuard() {}

    /**
     * @throws ConflictException if the task is no longer at the given round and attempt
     */
    public static void require(Task.Builder b, String taskId, int round, int attemptNumber) {
        if (b.round() != round || b.retryCount() + 1 != attemptNumber) {
            throw new ConflictException(taskId, b.state(), "now at round " + b.round()
                    + " attempt " + (b.retryCount() + 1));
        }
    }
}
