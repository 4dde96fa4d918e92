package com.crosscheck.core.model;

import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Request to track a new task.
 *
 * @param componentId          component the task produces
 * @param taskClass            selects per-class deadlines; null means the defaults
 * @param requiredCapabilities capabilities the producing agent must declare
 * @param validatorCapability  capability the validating agent must declare
 * @param input                opaque input handed to the producer
 * @param criteria             validation criteria handed to the validator
 * @param maxRetries           null means the configured default
 * @param priority             null means MEDIUM
 * @param dependsOn            ids of existing tasks that must complete first
 */
public record TaskSubmission(
    String componentId,
    String taskClass,
    Set<String> requiredCapabilities,
    String validatorCapability,
    Map<String, Object> input,
    List<String> criteria,
    Integer maxRetries,
    TaskPriority priority,
    Set<String> dependsOn
) {

    public TaskSubmission(String componentId, String taskClass, Set<String> requiredCapabilities,
                          String validatorCapability, Map<String, Object> input, List<String> criteria,
                          Integer maxRetries) {
        this(componentId, taskClass, requiredCapabilities, validatorCapability, input, criteria, maxRetries,
                null, null);
    }
}
