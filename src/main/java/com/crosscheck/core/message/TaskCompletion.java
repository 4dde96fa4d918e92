package com.crosscheck.core.message;

import com.crosscheck.core.model.Artifact;

/**
 * Producer to validation loop: the artifact for the given attempt is ready.
 */
public record TaskCompletion(
    int round,
    int attemptNumber,
    Artifact artifact
) implements MessagePayload {
}
