package com.crosscheck.core.model;

import java.time.Instant;
import java.util.List;

/**
 * Human-approval record raised when a task exhausts its validation attempts.
 *
 * @param id             unique identifier
 * @param taskId         escalated task
 * @param reason         advisory classification of the failure pattern
 * @param rejectionCount failed attempts that led to the escalation
 * @param ownerAgentId   producer at escalation time, restored on RETRY_RESET
 * @param context        copy of the attempt history at escalation time
 * @param recommendation suggestion shown to the reviewer
 * @param status         OPEN until resolved exactly once
 * @param resolution     chosen resolution, null while OPEN
 * @param resolvedBy     reviewer or subsystem that resolved it
 * @param note           free-form reviewer note
 * @param createdAt      when the escalation was opened
 * @param resolvedAt     when it was resolved
 */
public record Escalation(
    String id,
    String taskId,
    EscalationReason reason,
    int rejectionCount,
    String ownerAgentId,
    List<ValidationAttempt> context,
    String recommendation,
    EscalationStatus status,
    Resolution resolution,
    String resolvedBy,
    String note,
    Instant createdAt,
    Instant resolvedAt
) {

    public Escalation {
        context = context == null ? List.of() : List.copyOf(context);
    }

    public static Escalation open(String id, String taskId, EscalationReason reason, int rejectionCount,
                                  String ownerAgentId, List<ValidationAttempt> context,
                                  String recommendation, Instant createdAt) {
        return new Escalation(id, taskId, reason, rejectionCount, ownerAgentId, context, recommendation,
                EscalationStatus.OPEN, null, null, null, createdAt, null);
    }

    public boolean isOpen() {
        return status == EscalationStatus.OPEN;
    }

    public Escalation resolve(Resolution resolution, String resolvedBy, String note, Instant resolvedAt) {
        return new Escalation(id, taskId, reason, rejectionCount, ownerAgentId, context, recommendation,
                EscalationStatus.RESOLVED, resolution, resolvedBy, note, createdAt, resolvedAt);
    }
}
