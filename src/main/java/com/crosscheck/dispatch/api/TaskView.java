package com.crosscheck.dispatch.api;

import com.crosscheck.core.model.Task;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.List;

/**
 * Response body describing a task.
 */
public record TaskView(
    @JsonProperty("task_id") String taskId,
    @JsonProperty("component_id") String componentId,
    @JsonProperty("task_class") String taskClass,
    @JsonProperty("state") String state,
    @JsonProperty("priority") String priority,
    @JsonProperty("depends_on") List<String> dependsOn,
    @JsonProperty("owner_agent_id") String ownerAgentId,
    @JsonProperty("validator_agent_id") String validatorAgentId,
    @JsonProperty("retry_count") int retryCount,
    @JsonProperty("max_retries") int maxRetries,
    @JsonProperty("round") int round,
    @JsonProperty("reassignment_count") int reassignmentCount,
    @JsonProperty("artifact_id") String artifactId,
    @JsonProperty("failure_reason") String failureReason,
    @JsonProperty("failure_detail") String failureDetail,
    @JsonProperty("attempt_history") List<AttemptView> attemptHistory,
    @JsonProperty("status_history") List<StatusChangeView> statusHistory,
    @JsonProperty("created_at") Instant createdAt,
    @JsonProperty("updated_at") Instant updatedAt
) {

    public static TaskView from(Task task) {
        return new TaskView(
                task.id(),
                task.componentId(),
                task.taskClass(),
                task.state().name(),
                task.priority().name(),
                List.copyOf(task.dependsOn()),
                task.ownerAgentId(),
                task.validatorAgentId(),
                task.retryCount(),
                task.maxRetries(),
                task.round(),
                task.reassignmentCount(),
                task.artifact() != null ? task.artifact().id() : null,
                task.failureReason() != null ? task.failureReason().name() : null,
                task.failureDetail(),
                task.attemptHistory().stream().map(AttemptView::from).toList(),
                task.statusHistory().stream().map(StatusChangeView::from).toList(),
                task.createdAt(),
                task.updatedAt());
    }
}
