package com.crosscheck.core.message;

import com.crosscheck.core.model.Resolution;

/**
 * Human oversight to escalation manager: the reviewer's decision.
 */
public record HumanApprovalResponse(
    String escalationId,
    Resolution resolution,
    String reviewer,
    String note
) implements MessagePayload {
}
