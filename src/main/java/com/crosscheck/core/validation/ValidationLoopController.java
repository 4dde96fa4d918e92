package com.crosscheck.core.validation;

import com.crosscheck.core.bus.DeliveryException;
import com.crosscheck.core.bus.IdempotentHandler;
import com.crosscheck.core.bus.MessageBus;
import com.crosscheck.core.bus.MessageBus.Subscription;
import com.crosscheck.core.bus.MessageFilters;
import com.crosscheck.core.bus.RetryingPublisher;
import com.crosscheck.core.config.OrchestrationProperties;
import com.crosscheck.core.logging.MdcContext;
import com.crosscheck.core.message.EscalationRequest;
import com.crosscheck.core.message.Message;
import com.crosscheck.core.message.MessageType;
import com.crosscheck.core.message.Roles;
import com.crosscheck.core.message.TaskCompletion;
import com.crosscheck.core.message.TaskMessages;
import com.crosscheck.core.message.ValidationResult;
import com.crosscheck.core.metrics.CrosscheckMetrics;
import com.crosscheck.core.model.Task;
import com.crosscheck.core.model.TaskState;
import com.crosscheck.core.model.ValidationAttempt;
import com.crosscheck.core.model.ValidationVerdict;
import com.crosscheck.core.registry.AttemptGuard;
import com.crosscheck.core.registry.ConflictException;
import com.crosscheck.core.registry.TaskRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.Optional;

/**
 * Drives the generate, validate, retry-or-accept cycle of each task.
 * <p>
 * A TaskCompletion for the expected attempt moves the task to VALIDATING and asks the designated
 * validator for a verdict. A PASS completes the task. A FAIL sends the task back to its producer
 * with the accumulated feedback while retries remain, and escalates it once they are exhausted.
 * Messages for any other round, attempt, sender or state are discarded as stale.
 */
@Service
public class ValidationLoopController {

    private static final Logger log = LoggerFactory.getLogger(ValidationLoopController.class);

    private final MessageBus bus;
    private final RetryingPublisher publisher;
    private final TaskRegistry registry;
    private final Clock clock;
    private final CrosscheckMetrics metrics;
    private final int dedupWindow;
    private Subscription subscription;

    public ValidationLoopController(MessageBus bus,
                                    RetryingPublisher publisher,
                                    TaskRegistry registry,
                                    Clock clock,
                                    OrchestrationProperties properties,
                                    @Autowired(required = false) CrosscheckMetrics metrics) {
        this.bus = bus;
        this.publisher = publisher;
        this.registry = registry;
        this.clock = clock;
        this.metrics = metrics;
        this.dedupWindow = properties.getBus().getDedupWindow();
    }

    public synchronized void attach() {
        if (subscription == null) {
            subscription = bus.subscribe(Roles.VALIDATION_LOOP,
                    MessageFilters.forRole(Roles.VALIDATION_LOOP)
                            .and(MessageFilters.ofType(MessageType.TASK_COMPLETION, MessageType.VALIDATION_RESULT)),
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
        MdcContext.setMessage(message, Roles.VALIDATION_LOOP);
        try {
            if (message.type() == MessageType.TASK_COMPLETION) {
                onTaskCompletion(message);
            } else if (message.type() == MessageType.VALIDATION_RESULT) {
                onValidationResult(message);
            }
        } finally {
            MdcContext.clear();
        }
    }

    void onTaskCompletion(Message message) {
        TaskCompletion completion = message.payloadAs(TaskCompletion.class);
        Optional<Task> found = registry.find(message.taskId());
        if (found.isEmpty()) {
            log.warn("TaskCompletion {} for unknown task {}", message.id(), message.taskId());
            return;
        }
        Task task = found.get();
        if (!isCurrentAttempt(task, completion.round(), completion.attemptNumber())
                || !message.senderId().equals(task.ownerAgentId())) {
            discardStale(message, task);
            return;
        }
        if (task.state() == TaskState.ASSIGNED) {
            // the completion overtook the producer's start notice
            try {
                registry.transition(task.id(), TaskState.ASSIGNED, TaskState.IN_PROGRESS);
            } catch (ConflictException e) {
                log.debug("Task {} left ASSIGNED concurrently: {}", task.id(), e.getMessage());
            }
        }

        Task validating;
        try {
            validating = registry.transition(task.id(), TaskState.IN_PROGRESS, TaskState.VALIDATING, b -> {
                AttemptGuard.require(b, task.id(), completion.round(), completion.attemptNumber());
                b.artifact(completion.artifact());
            });
        } catch (ConflictException e) {
            discardStale(message, task);
            return;
        }

        log.info("Task {} attempt {} submitted by {}, requesting validation from {}", task.id(),
                completion.attemptNumber(), message.senderId(), validating.validatorAgentId());
        send(Message.builder(TaskMessages.validationRequest(validating))
                .from(Roles.VALIDATION_LOOP, Roles.VALIDATION_LOOP)
                .toAgent(validating.validatorAgentId())
                .task(task.id())
                .build());
    }

    void onValidationResult(Message message) {
        ValidationResult result = message.payloadAs(ValidationResult.class);
        Optional<Task> found = registry.find(message.taskId());
        if (found.isEmpty()) {
            log.warn("ValidationResult {} for unknown task {}", message.id(), message.taskId());
            return;
        }
        Task task = found.get();
        if (task.state() != TaskState.VALIDATING
                || !isCurrentAttempt(task, result.round(), result.attemptNumber())
                || !message.senderId().equals(task.validatorAgentId())) {
            discardStale(message, task);
            return;
        }

        ValidationAttempt attempt = new ValidationAttempt(result.round(), result.attemptNumber(),
                message.senderId(), result.verdict(), result.feedback(), clock.instant());
        try {
            if (result.verdict() == ValidationVerdict.PASS) {
                accept(task, attempt);
            } else {
                reject(task, attempt);
            }
        } catch (ConflictException e) {
            // a duplicate or concurrent result already moved the task
            discardStale(message, task);
            return;
        }
        if (metrics != null) {
            metrics.recordVerdict(result.verdict(), result.attemptNumber());
        }
    }

    private void accept(Task task, ValidationAttempt attempt) {
        registry.transition(task.id(), TaskState.VALIDATING, TaskState.COMPLETED, b -> {
            AttemptGuard.require(b, task.id(), attempt.round(), attempt.attemptNumber());
            b.appendAttempt(attempt);
        });
        log.info("Task {} accepted on attempt {} by {}", task.id(), attempt.attemptNumber(), attempt.validatorId());
    }

    private void reject(Task task, ValidationAttempt attempt) {
        int failures = task.retryCount() + 1;
        if (failures < task.maxRetries()) {
            Task retrying = registry.transition(task.id(), TaskState.VALIDATING, TaskState.IN_PROGRESS, b -> {
                AttemptGuard.require(b, task.id(), attempt.round(), attempt.attemptNumber());
                b.appendAttempt(attempt).retryCount(failures);
            });
            log.info("Task {} rejected on attempt {} ({}/{}), retrying: {}", task.id(), attempt.attemptNumber(),
                    failures, task.maxRetries(), attempt.feedback());
            send(Message.builder(TaskMessages.assignment(retrying))
                    .from(Roles.VALIDATION_LOOP, Roles.VALIDATION_LOOP)
                    .toAgent(retrying.ownerAgentId())
                    .task(task.id())
                    .build());
            return;
        }

        Task escalated = registry.transition(task.id(), TaskState.VALIDATING, TaskState.ESCALATED, b -> {
            AttemptGuard.require(b, task.id(), attempt.round(), attempt.attemptNumber());
            b.appendAttempt(attempt).retryCount(b.maxRetries());
        });
        log.warn("Task {} rejected {} times in round {}, escalating", task.id(), escalated.maxRetries(),
                escalated.round());
        requestEscalation(escalated);
    }

    /**
     * Asks the escalation manager to open a record for an ESCALATED task. The producer to restore
     * on RETRY_RESET is the one that held the task when it was escalated.
     *
     * @return false if the request could not be published
     */
    public boolean requestEscalation(Task escalated) {
        String owner = escalated.lastAgentEntering(TaskState.ESCALATED);
        return send(Message.builder(new EscalationRequest(escalated.round(), escalated.maxRetries(), owner,
                        escalated.attemptHistory()))
                .from(Roles.VALIDATION_LOOP, Roles.VALIDATION_LOOP)
                .toRole(Roles.ESCALATION_MANAGER)
                .task(escalated.id())
                .build());
    }

    private static boolean isCurrentAttempt(Task task, int round, int attemptNumber) {
        return round == task.round() && attemptNumber == task.currentAttemptNumber();
    }

    private void discardStale(Message message, Task task) {
        log.warn("Discarding stale {} {} from {} (round {}, task is {} at round {} attempt {})",
                message.type().wireName(), message.id(), message.senderId(), roundOf(message),
                task.state(), task.round(), task.currentAttemptNumber());
        if (metrics != null) {
            metrics.recordStaleDiscard(message.type());
        }
    }

    private static int roundOf(Message message) {
        if (message.payload() instanceof TaskCompletion completion) {
            return completion.round();
        }
        if (message.payload() instanceof ValidationResult result) {
            return result.round();
        }
        return 0;
    }

    private boolean send(Message message) {
        try {
            publisher.publish(message);
            return true;
        } catch (DeliveryException e) {
            log.error("Could not publish {} for task {}: {}", message.type().wireName(), message.taskId(),
                    e.getMessage());
            return false;
        }
    }
}
