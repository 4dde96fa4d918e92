package com.crosscheck.core.message;

import com.crosscheck.core.model.EscalationReason;
import com.crosscheck.core.model.Resolution;
import com.crosscheck.core.model.ValidationAttempt;

import java.util.List;

/**
 * Escalation manager to human oversight: a reviewer must choose a resolution.
 *
 * @param escalationId     escalation record to resolve
 * @param classification   advisory classification
 * @param rejectionCount   failed attempts that triggered it
 * @param mostCommonReason most frequent normalized failure reason
 * @param recommendation   suggestion for the reviewer
 * @param options          resolutions the reviewer may pick
 * @param context          attempt history at escalation time
 */
public record HumanApprovalRequest(
    String escalationId,
    EscalationReason classification,
    int rejectionCount,
    String mostCommonReason,
    String recommendation,
    List<Resolution> options,
    List<ValidationAttempt> context
) implements MessagePayload {

    public HumanApprovalRequest {
        options = options == null ? List.of() : List.copyOf(options);
        context = context == null ? List.of() : List.copyOf(context);
    }
}
