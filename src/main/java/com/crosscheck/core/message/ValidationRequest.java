package com.crosscheck.core.message;

import com.crosscheck.core.model.Artifact;

import java.util.List;

/**
 * Validation loop to validator: judge an artifact against the criteria.
 *
 * @param previousFeedback feedback of every earlier failed attempt, oldest first
 */
public record ValidationRequest(
    int round,
    int attemptNumber,
    String componentId,
    Artifact artifact,
    List<String> criteria,
    List<String> previousFeedback
) implements MessagePayload {

    public ValidationRequest {
        criteria = criteria == null ? List.of() : List.copyOf(criteria);
        previousFeedback = previousFeedback == null ? List.of() : List.copyOf(previousFeedback);
    }
}
