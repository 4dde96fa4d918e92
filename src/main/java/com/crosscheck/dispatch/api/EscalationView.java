package com.crosscheck.dispatch.api;

import com.crosscheck.core.model.Escalation;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.List;

public record EscalationView(
    @JsonProperty("escalation_id") String escalationId,
    @JsonProperty("task_id") String taskId,
    @JsonProperty("reason") String reason,
    @JsonProperty("rejection_count") int rejectionCount,
    @JsonProperty("owner_agent_id") String ownerAgentId,
    @JsonProperty("recommendation") String recommendation,
    @JsonProperty("status") String status,
    @JsonProperty("resolution") String resolution,
    @JsonProperty("resolved_by") String resolvedBy,
    @JsonProperty("note") String note,
    @JsonProperty("context") List<AttemptView> context,
    @JsonProperty("created_at") Instant createdAt,
    @JsonProperty("resolved_at") Instant resolvedAt
) {

    public static EscalationView from(Escalation escalation) {
        return new EscalationView(
                escalation.id(),
                escalation.taskId(),
                escalation.reason().wireName(),
                escalation.rejectionCount(),
                escalation.ownerAgentId(),
                escalation.recommendation(),
                escalation.status().name(),
                escalation.resolution() != null ? escalation.resolution().name() : null,
                escalation.resolvedBy(),
                escalation.note(),
                escalation.context().stream().map(AttemptView::from).toList(),
                escalation.createdAt(),
                escalation.resolvedAt());
    }
}
