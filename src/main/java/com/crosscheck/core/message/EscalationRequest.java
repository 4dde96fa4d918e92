package com.crosscheck.core.message;

import com.crosscheck.core.model.ValidationAttempt;

import java.util.List;

/**
 * Validation loop to escalation manager: the task ran out of attempts.
 *
 * @param round          round that was exhausted
 * @param rejectionCount failed attempts in that round
 * @param ownerAgentId   producer at the time of escalation
 * @param attemptHistory full history, all rounds
 */
public record EscalationRequest(
    int round,
    int rejectionCount,
    String ownerAgentId,
    List<ValidationAttempt> attemptHistory
) implements MessagePayload {

    public EscalationRequest {
        attemptHistory = attemptHistory == null ? List.of() : List.copyOf(attemptHistory);
    }
}
