package com.crosscheck.core.agent;

import com.crosscheck.core.message.TaskAssignment;
import com.crosscheck.core.message.ValidationRequest;

import java.util.Set;
import java.util.concurrent.CompletableFuture;

/**
 * Capability implemented by every worker and validator.
 * <p>
 * Agents never call each other. They receive work from the bus and their results are
 * published back to it by the {@link AgentInvocationInterceptor}.
 */
public interface AgentProxy {

    String agentId();

    String role();

    Set<String> capabilities();

    /**
     * Produces the artifact for one attempt. May run for an unbounded time; progress should be
     * reported through {@code progress} so the task is not failed as unavailable.
     */
    CompletableFuture<AgentResult> handleTaskAssignment(String taskId, TaskAssignment assignment,
                                                        ProgressReporter progress);

    /**
     * Judges an artifact. Must not have side effects on task state.
     */
    CompletableFuture<ValidationOutcome> handleValidationRequest(String taskId, ValidationRequest request);
}
