package com.crosscheck.core.agent;

import com.crosscheck.core.message.TaskAssignment;
import com.crosscheck.core.message.ValidationRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Set;
import java.util.concurrent.CompletableFuture;

/**
 * Adapts an {@link ArtifactProducer} into an {@link AgentProxy}. Validation requests are refused.
 */
public class ProducerAgent implements AgentProxy {

    private static final Logger log = LoggerFactory.getLogger(ProducerAgent.class);

    private final String agentId;
    private final String role;
    private final Set<String> capabilities;
    private final ArtifactProducer producer;

    public ProducerAgent(String agentId, String role, Set<String> capabilities, ArtifactProducer producer) {
        this.agentId = agentId;
        this.role = role;
        this.capabilities = Set.copyOf(capabilities);
        this.producer = producer;
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
        log.debug("Producing {} for task {} (round {}, attempt {})", assignment.componentId(), taskId,
                assignment.round(), assignment.attemptNumber());
        progress.report("producing attempt " + assignment.attemptNumber());
        return CompletableFuture.completedFuture(producer.produce(assignment.input(), assignment.feedback()));
    }

    @Override
    public CompletableFuture<ValidationOutcome> handleValidationRequest(String taskId, ValidationRequest request) {
        return CompletableFuture.failedFuture(
                new UnsupportedOperationException("Agent " + agentId + " does not validate"));
    }
}
