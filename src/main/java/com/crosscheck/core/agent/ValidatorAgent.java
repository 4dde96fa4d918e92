package com.crosscheck.core.agent;

import com.crosscheck.core.message.TaskAssignment;
import com.crosscheck.core.message.ValidationRequest;
import com.crosscheck.core.model.ValidationVerdict;

import java.util.Set;
import java.util.concurrent.CompletableFuture;

/**
 * Adapts a {@link ValidatorJudgment} into an {@link AgentProxy}. Task assignments are refused.
 */
public class ValidatorAgent implements AgentProxy {

    private final String agentId;
    private final String role;
    private final Set<String> capabilities;
    private final ValidatorJudgment judgment;

    public ValidatorAgent(String agentId, String role, Set<String> capabilities, ValidatorJudgment judgment) {
        this.agentId = agentId;
        this.role = role;
        this.capabilities = Set.copyOf(capabilities);
        this.judgment = judgment;
    }

    @Override
    public String agentId() {
        return agentId;
    }

    @Override
    public String role() {
        return role;
    }

    @Override
    public Set<String> capabilities() {
        return capabilities;
    }

    @Override
    public CompletableFuture<AgentResult> handleTaskAssignment(String taskId, TaskAssignment assignment,
                                                               ProgressReporter progress) {
        return CompletableFuture.completedFuture(
                AgentResult.failure("unsupported", "Agent " + agentId + " only validates"));
    }

    @Override
    public CompletableFuture<ValidationOutcome> handleValidationRequest(String taskId, ValidationRequest request) {
        var result = judgment.judge(request.artifact(), request.criteria());
        return CompletableFuture.completedFuture(new ValidationOutcome(
                result.pass() ? ValidationVerdict.PASS : ValidationVerdict.FAIL, result.feedback()));
    }
}
