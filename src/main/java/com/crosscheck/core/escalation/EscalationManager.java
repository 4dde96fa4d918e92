package com.crosscheck.core.escalation;

import com.crosscheck.core.bus.DeliveryException;
import com.crosscheck.core.bus.IdempotentHandler;
import com.crosscheck.core.bus.MessageBus;
import com.crosscheck.core.bus.MessageBus.Subscription;
import com.crosscheck.core.bus.MessageFilters;
import com.crosscheck.core.bus.RetryingPublisher;
import com.crosscheck.core.config.OrchestrationProperties;
import com.crosscheck.core.logging.MdcContext;
import com.crosscheck.core.message.EscalationRequest;
import com.crosscheck.core.message.HumanApprovalRequest;
import com.crosscheck.core.message.HumanApprovalResponse;
import com.crosscheck.core.message.Message;
import com.crosscheck.core.message.MessageType;
import com.crosscheck.core.message.Roles;
import com.crosscheck.core.message.TaskMessages;
import com.crosscheck.core.metrics.CrosscheckMetrics;
import com.crosscheck.core.model.Escalation;
import com.crosscheck.core.model.FailureReason;
import com.crosscheck.core.model.Resolution;
import com.crosscheck.core.model.Task;
import com.crosscheck.core.model.TaskState;
import com.crosscheck.core.registry.AlreadyResolvedException;
import com.crosscheck.core.registry.ConflictException;
import com.crosscheck.core.registry.EscalationAlreadyOpenException;
import com.crosscheck.core.registry.EscalationNotFoundException;
import com.crosscheck.core.registry.TaskRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.Arrays;
import java.util.Optional;
import java.util.UUID;

/**
 * Turns exhausted validation loops into human-approval requests and applies the reviewer's decision.
 * <p>
 * Escalation records are opened once per episode and resolved exactly once. The classification
 * attached to a record is advisory: every escalation offers the same resolutions.
 */
@Service
public class EscalationManager {

    private static final Logger log = LoggerFactory.getLogger(EscalationManager.class);

    private final MessageBus bus;
    private final RetryingPublisher publisher;
    private final TaskRegistry registry;
    private final FailurePatternAnalyzer analyzer;
    private final Clock clock;
    private final CrosscheckMetrics metrics;
    private final int dedupWindow;
    private Subscription subscription;

    public EscalationManager(MessageBus bus,
                             RetryingPublisher publisher,
                             TaskRegistry registry,
                             FailurePatternAnalyzer analyzer,
                             Clock clock,
                             OrchestrationProperties properties,
                             @Autowired(required = false) CrosscheckMetrics metrics) {
        this.bus = bus;
        this.publisher = publisher;
        this.registry = registry;
        this.analyzer = analyzer;
        this.clock = clock;
        this.metrics = metrics;
        this.dedupWindow = properties.getBus().getDedupWindow();
    }

    public synchronized void attach() {
        if (subscription == null) {
            subscription = bus.subscribe(Roles.ESCALATION_MANAGER,
                    MessageFilters.forRole(Roles.ESCALATION_MANAGER)
                            .and(MessageFilters.ofType(MessageType.ESCALATION_REQUEST,
                                    MessageType.HUMAN_APPROVAL_RESPONSE)),
                    new IdempotentHandler(this::handle, dedupWindow));
        }
    }

    public synchronized void detach() {
        if (subscription != null) {
            subscription.unsubscribe();
            subscription = null;
        }
    }

    void handle(Message message) {
        MdcContext.setMessage(message, Roles.ESCALATION_MANAGER);
        try {
            if (message.type() == MessageType.ESCALATION_REQUEST) {
                onEscalationRequest(message);
            } else if (message.type() == MessageType.HUMAN_APPROVAL_RESPONSE) {
                onHumanApprovalResponse(message);
            }
        } finally {
            MdcContext.clear();
        }
    }

    void onEscalationRequest(Message message) {
        EscalationRequest request = message.payloadAs(EscalationRequest.class);
        String taskId = message.taskId();
        Optional<Task> task = registry.find(taskId);
        if (task.isEmpty() || task.get().state() != TaskState.ESCALATED || task.get().round() != request.round()) {
            log.warn("Ignoring escalation request {} for task {} that is no longer escalated in round {}",
                    message.id(), taskId, request.round());
            if (metrics != null) {
                metrics.recordStaleDiscard(message.type());
            }
            return;
        }

        FailurePattern pattern = analyzer.analyze(request.attemptHistory(), request.rejectionCount());
        Escalation escalation = Escalation.open(UUID.randomUUID().toString(), taskId, pattern.classification(),
                request.rejectionCount(), request.ownerAgentId(), request.attemptHistory(),
                pattern.recommendation(), clock.instant());
        try {
            registry.openEscalation(escalation, request.round());
        } catch (EscalationAlreadyOpenException e) {
            log.info("Task {} is already escalated: {}", taskId, e.getMessage());
            return;
        } catch (ConflictException e) {
            log.warn("Task {} left ESCALATED before escalation {} could open: {}", taskId, escalation.id(),
                    e.getMessage());
            if (metrics != null) {
                metrics.recordStaleDiscard(message.type());
            }
            return;
        }
        if (metrics != null) {
            metrics.recordEscalation(pattern.classification());
        }
        log.warn("Escalated task {} as {} after {} rejections (most common: {})", taskId,
                pattern.classification().wireName(), request.rejectionCount(), pattern.mostCommonReason());

        HumanApprovalRequest approval = new HumanApprovalRequest(escalation.id(), pattern.classification(),
                request.rejectionCount(), pattern.mostCommonReason(), pattern.recommendation(),
                Arrays.asList(Resolution.values()), request.attemptHistory());
        send(Message.builder(approval)
                .from(Roles.ESCALATION_MANAGER, Roles.ESCALATION_MANAGER)
                .toRole(Roles.HUMAN_OVERSIGHT)
                .task(taskId)
                .build());
    }

    void onHumanApprovalResponse(Message message) {
        HumanApprovalResponse response = message.payloadAs(HumanApprovalResponse.class);
        String taskId = message.taskId();
        if (response.resolution() == null) {
            log.warn("Ignoring approval response {} for task {} without a resolution", message.id(), taskId);
            return;
        }
        Escalation resolved;
        try {
            resolved = registry.resolveEscalation(taskId, response.escalationId(), response.resolution(),
                    response.reviewer(), response.note());
        } catch (AlreadyResolvedException | EscalationNotFoundException e) {
            log.warn("Rejected approval response {} for task {}: {}", message.id(), taskId, e.getMessage());
            return;
        }
        if (metrics != null) {
            metrics.recordResolution(resolved.resolution());
        }
        applyResolution(resolved);
    }

    /**
     * Moves the escalated task to the state the resolution leads to.
     *
     * @return the updated task, or empty if the task had already left ESCALATED
     */
    public Optional<Task> applyResolution(Escalation escalation) {
        String taskId = escalation.taskId();
        Resolution resolution = escalation.resolution();
        try {
            Task updated = registry.transition(taskId, TaskState.ESCALATED, resolution.targetState(), b -> {
                switch (resolution) {
                    case RETRY_RESET -> b.retryCount(0)
                            .round(b.round() + 1)
                            .ownerAgentId(escalation.ownerAgentId());
                    case FORCE_ACCEPT -> b.failureDetail(null);
                    case ABORT -> b.failureReason(FailureReason.ABORTED)
                            .failureDetail("Aborted by " + escalation.resolvedBy()
                                    + (escalation.note() != null ? ": " + escalation.note() : ""));
                }
            });
            log.info("Task {} resolved as {} by {}, now {}", taskId, resolution, escalation.resolvedBy(),
                    updated.state());
            if (resolution == Resolution.RETRY_RESET) {
                send(Message.builder(TaskMessages.assignment(updated))
                        .from(Roles.ESCALATION_MANAGER, Roles.ESCALATION_MANAGER)
                        .toAgent(updated.ownerAgentId())
                        .task(taskId)
                        .build());
            }
            return Optional.of(updated);
        } catch (ConflictException e) {
            log.warn("Resolution {} for task {} not applied: {}", resolution, taskId, e.getMessage());
            return Optional.empty();
        }
    }

    private void send(Message message) {
        try {
            publisher.publish(message);
        } catch (DeliveryException e) {
            log.error("Could not publish {} for task {}: {}", message.type().wireName(), message.taskId(),
                    e.getMessage());
        }
    }
}
