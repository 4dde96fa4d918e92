package com.crosscheck.dispatch.api;

import com.crosscheck.core.model.TaskPriority;
import com.crosscheck.core.model.TaskSubmission;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Request body for submitting a new task.
 */
public record TaskRequest(
    @JsonProperty("component_id") String componentId,
    @JsonProperty("task_class") String taskClass,
    @JsonProperty("required_capabilities") List<String> requiredCapabilities,
    @JsonProperty("validator_capability") String validatorCapability,
    @JsonProperty("input") Map<String, Object> input,
    @JsonProperty("criteria") List<String> criteria,
    @JsonProperty("max_retries") Integer maxRetries,
    @JsonProperty("priority") String priority,
    @JsonProperty("depends_on") List<String> dependsOn
) {

    /**
     * @throws IllegalArgumentException if the priority is not a known level
     */
    public TaskSubmission toSubmission() {
        return new TaskSubmission(componentId, taskClass,
                requiredCapabilities != null ? new LinkedHashSet<>(requiredCapabilities) : null,
                validatorCapability, input, criteria, maxRetries,
                priority != null ? parsePriority(priority) : null,
                dependsOn != null ? new LinkedHashSet<>(dependsOn) : null);
    }

    private static TaskPriority parsePriority(String value) {
        try {
            return TaskPriority.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Invalid priority: " + value, e);
        }
    }
}
