package com.crosscheck.core.agent;

import com.crosscheck.core.bus.DeliveryException;
import com.crosscheck.core.bus.RetryingPublisher;
import com.crosscheck.core.logging.MdcContext;
import com.crosscheck.core.message.ErrorReport;
import com.crosscheck.core.message.Message;
import com.crosscheck.core.message.MessagePayload;
import com.crosscheck.core.message.Roles;
import com.crosscheck.core.message.StateUpdate;
import com.crosscheck.core.message.TaskAssignment;
import com.crosscheck.core.message.TaskCompletion;
import com.crosscheck.core.message.ValidationRequest;
import com.crosscheck.core.message.ValidationResult;
import com.crosscheck.core.metrics.CrosscheckMetrics;
import com.crosscheck.core.model.TaskState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

/**
 * Runs agent invocations and turns their outcome into bus messages.
 * <p>
 * A task assignment publishes a StateUpdate before the agent starts, then a TaskCompletion on
 * success or an ErrorReport on failure. A validation request publishes a ValidationResult or an
 * ErrorReport. Exceptions thrown by an agent are converted to ErrorReports and never reach the bus.
 */
@Component
public class AgentInvocationInterceptor {

    private static final Logger log = LoggerFactory.getLogger(AgentInvocationInterceptor.class);

    private final RetryingPublisher publisher;
    private final CrosscheckMetrics metrics;

    public AgentInvocationInterceptor(RetryingPublisher publisher,
                                      @Autowired(required = false) CrosscheckMetrics metrics) {
        this.publisher = publisher;
        this.metrics = metrics;
    }

    public CompletableFuture<Void> invokeAssignment(AgentProxy agent, Message message) {
        String taskId = message.taskId();
        TaskAssignment assignment = message.payloadAs(TaskAssignment.class);
        int round = assignment.round();
        int attempt = assignment.attemptNumber();

        send(agent, taskId, Roles.ORCHESTRATOR,
                new StateUpdate(round, attempt, TaskState.IN_PROGRESS, "started"));
        ProgressReporter progress = note -> send(agent, taskId, Roles.ORCHESTRATOR,
                new StateUpdate(round, attempt, TaskState.IN_PROGRESS, note));

        long start = System.currentTimeMillis();
        CompletableFuture<AgentResult> invocation;
        try {
            invocation = agent.handleTaskAssignment(taskId, assignment, progress);
        } catch (RuntimeException e) {
            invocation = CompletableFuture.failedFuture(e);
        }
        return invocation.handle((result, error) -> {
            long elapsed = System.currentTimeMillis() - start;
            MdcContext.setTask(taskId);
            MdcContext.setAgent(agent.agentId());
            try {
                if (error != null) {
                    Throwable cause = unwrap(error);
                    log.warn("Agent {} threw on task {}: {}", agent.agentId(), taskId, cause.getMessage());
                    record(agent, "assignment", "exception", elapsed);
                    send(agent, taskId, Roles.ORCHESTRATOR, new ErrorReport(round, attempt, "exception",
                            cause.getClass().getSimpleName() + ": " + cause.getMessage()));
                } else if (result instanceof AgentResult.Success success) {
                    record(agent, "assignment", "success", elapsed);
                    send(agent, taskId, Roles.VALIDATION_LOOP,
                            new TaskCompletion(round, attempt, success.artifact()));
                } else if (result instanceof AgentResult.Failure failure) {
                    log.info("Agent {} reported {} on task {}: {}", agent.agentId(), failure.error().code(),
                            taskId, failure.error().message());
                    record(agent, "assignment", "error", elapsed);
                    send(agent, taskId, Roles.ORCHESTRATOR, new ErrorReport(round, attempt,
                            failure.error().code(), failure.error().message()));
                } else {
                    record(agent, "assignment", "error", elapsed);
                    send(agent, taskId, Roles.ORCHESTRATOR,
                            new ErrorReport(round, attempt, "no_result", "Agent returned no result"));
                }
            } finally {
                MdcContext.clear();
            }
            return null;
        });
    }

    public CompletableFuture<Void> invokeValidation(AgentProxy agent, Message message) {
        String taskId = message.taskId();
        ValidationRequest request = message.payloadAs(ValidationRequest.class);

        long start = System.currentTimeMillis();
        CompletableFuture<ValidationOutcome> invocation;
        try {
            invocation = agent.handleValidationRequest(taskId, request);
        } catch (RuntimeException e) {
            invocation = CompletableFuture.failedFuture(e);
        }
        return invocation.handle((outcome, error) -> {
            long elapsed = System.currentTimeMillis() - start;
            MdcContext.setTask(taskId);
            MdcContext.setAgent(agent.agentId());
            try {
                if (error != null || outcome == null || outcome.verdict() == null) {
                    String detail = error != null
                            ? unwrap(error).getClass().getSimpleName() + ": " + unwrap(error).getMessage()
                            : "Validator returned no verdict";
                    log.warn("Validator {} failed on task {}: {}", agent.agentId(), taskId, detail);
                    record(agent, "validation", error != null ? "exception" : "error", elapsed);
                    send(agent, taskId, Roles.ORCHESTRATOR, new ErrorReport(request.round(),
                            request.attemptNumber(), "validator_error", detail));
                } else {
                    record(agent, "validation", "success", elapsed);
                    send(agent, taskId, Roles.VALIDATION_LOOP, new ValidationResult(request.round(),
                            request.attemptNumber(), outcome.verdict(), outcome.feedback()));
                }
            } finally {
                MdcContext.clear();
            }
            return null;
        });
    }

    private void send(AgentProxy agent, String taskId, String recipientRole, MessagePayload payload) {
        Message message = Message.builder(payload)
                .from(agent.agentId(), agent.role())
                .toRole(recipientRole)
                .task(taskId)
                .build();
        try {
            publisher.publish(message);
        } catch (DeliveryException e) {
            // the liveness monitor fails the task if the result never arrives
            log.warn("Agent {} could not publish {} for task {}: {}", agent.agentId(),
                    message.type().wireName(), taskId, e.getMessage());
        }
    }

    private void record(AgentProxy agent, String kind, String outcome, long ms) {
        if (metrics != null) {
            metrics.recordAgentInvocation(agent.agentId(), kind, outcome, ms);
        }
    }

    private static Throwable unwrap(Throwable error) {
        return error instanceof CompletionException && error.getCause() != null ? error.getCause() : error;
    }
}
