package com.crosscheck.core.agent;

import com.crosscheck.core.model.Artifact;

/**
 * Outcome of a task assignment: an artifact or an error.
 */
public interface AgentResult {

    static AgentResult success(Artifact artifact) {
        return new Success(artifact);
    }

    static AgentResult failure(String code, String message) {
        return new Failure(new AgentError(code, message));
    }

    record Success(Artifact artifact) implements AgentResult {}

    record Failure(AgentError error) implements AgentResult {}
}
