package com.crosscheck.core.agent;

/**
 * Lets a long-running agent signal that it is still working. Each report becomes a StateUpdate
 * message and resets the task's liveness deadline.
 */
@FunctionalInterface
public interface ProgressReporter {

    void report(String note);
}
