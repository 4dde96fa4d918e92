package com.crosscheck.core.registry;

public class EscalationAlreadyOpenException extends RuntimeException {

    public EscalationAlreadyOpenException(String taskId, String escalationId) {
        super("Task " + taskId + " already has open escalation " + escalationId);
    }
}
