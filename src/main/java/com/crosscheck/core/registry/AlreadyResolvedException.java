package com.crosscheck.core.registry;

/**
 * Thrown when resolving an escalation that is no longer OPEN.
 */
public class AlreadyResolvedException extends RuntimeException {

    public AlreadyResolvedException(String taskId, String escalationId) {
        super("Escalation " + escalationId + " for task " + taskId + " is already resolved");
    }
}
