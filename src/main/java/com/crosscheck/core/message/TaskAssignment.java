package com.crosscheck.core.message;

import java.util.List;
import java.util.Map;

/**
 * Orchestrator to producer: produce (or re-produce) the artifact for a task.
 *
 * @param round         validation round
 * @param attemptNumber attempt the producer is working on
 * @param componentId   component to produce
 * @param input         producer input
 * @param criteria      criteria the artifact will be judged against
 * @param feedback      accumulated validator feedback, oldest first
 */
public record TaskAssignment(
    int round,
    int attemptNumber,
    String componentId,
    Map<String, Object> input,
    List<String> criteria,
    List<String> feedback
) implements MessagePayload {

    public TaskAssignment {
        input = input == null ? Map.of() : input;
        criteria = criteria == null ? List.of() : List.copyOf(criteria);
        feedback = feedback == null ? List.of() : List.copyOf(feedback);
    }
}
