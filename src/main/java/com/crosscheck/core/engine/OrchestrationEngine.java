package com.crosscheck.core.engine;

import com.crosscheck.core.agent.AgentDispatcher;
import com.crosscheck.core.agent.AgentProxy;
import com.crosscheck.core.agent.AgentRegistry;
import com.crosscheck.core.bus.DeliveryException;
import com.crosscheck.core.bus.IdempotentHandler;
import com.crosscheck.core.bus.MessageBus;
import com.crosscheck.core.bus.MessageBus.Subscription;
import com.crosscheck.core.bus.MessageFilters;
import com.crosscheck.core.bus.RetryingPublisher;
import com.crosscheck.core.config.OrchestrationProperties;
import com.crosscheck.core.escalation.EscalationManager;
import com.crosscheck.core.escalation.HumanApprovalGateway;
import com.crosscheck.core.logging.MdcContext;
import com.crosscheck.core.message.CancelTask;
import com.crosscheck.core.message.ErrorReport;
import com.crosscheck.core.message.Message;
import com.crosscheck.core.message.MessageType;
import com.crosscheck.core.message.QueryResponse;
import com.crosscheck.core.message.Roles;
import com.crosscheck.core.message.StateUpdate;
import com.crosscheck.core.message.TaskMessages;
import com.crosscheck.core.metrics.CrosscheckMetrics;
import com.crosscheck.core.model.Escalation;
import com.crosscheck.core.model.FailureReason;
import com.crosscheck.core.model.Resolution;
import com.crosscheck.core.model.Task;
import com.crosscheck.core.model.TaskPriority;
import com.crosscheck.core.model.TaskState;
import com.crosscheck.core.model.TaskSubmission;
import com.crosscheck.core.registry.AlreadyResolvedException;
import com.crosscheck.core.registry.AttemptGuard;
import com.crosscheck.core.registry.ConflictException;
import com.crosscheck.core.registry.TaskNotFoundException;
import com.crosscheck.core.registry.TaskRegistry;
import com.crosscheck.core.validation.ValidationLoopController;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.context.SmartLifecycle;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * Top-level coordinator.
 * <p>
 * Owns the message bus lifecycle and attaches the validation loop, the escalation manager, the
 * human-approval gateway and the agents to it. Assigns pending tasks to capable agents once their
 * dependencies have completed, tracks their progress, reassigns once after an agent error, and
 * handles cancellation and queries.
 */
@Service
public class OrchestrationEngine implements SmartLifecycle {

    private static final Logger log = LoggerFactory.getLogger(OrchestrationEngine.class);

    private static final Comparator<Task> ASSIGNMENT_ORDER = Comparator
            .comparing(Task::priority)
            .thenComparing(Task::createdAt)
            .thenComparing(Task::id);

    private final MessageBus bus;
    private final RetryingPublisher publisher;
    private final TaskRegistry registry;
    private final AgentRegistry agentRegistry;
    private final AgentDispatcher dispatcher;
    private final ValidationLoopController validationLoop;
    private final EscalationManager escalationManager;
    private final HumanApprovalGateway approvalGateway;
    private final OrchestrationProperties properties;
    private final Clock clock;
    private final CrosscheckMetrics metrics;

    private volatile boolean running;
    private Subscription subscription;

    public OrchestrationEngine(MessageBus bus,
                               RetryingPublisher publisher,
                               TaskRegistry registry,
                               AgentRegistry agentRegistry,
                               AgentDispatcher dispatcher,
                               ValidationLoopController validationLoop,
                               EscalationManager escalationManager,
                               HumanApprovalGateway approvalGateway,
                               OrchestrationProperties properties,
                               Clock clock,
                               @Autowired(required = false) CrosscheckMetrics metrics) {
        this.bus = bus;
        this.publisher = publisher;
        this.registry = registry;
        this.agentRegistry = agentRegistry;
        this.dispatcher = dispatcher;
        this.validationLoop = validationLoop;
        this.escalationManager = escalationManager;
        this.approvalGateway = approvalGateway;
        this.properties = properties;
        this.clock = clock;
        this.metrics = metrics;
    }

    // -- Lifecycle --

    @Override
    public synchronized void start() {
        if (running) {
            return;
        }
        bus.start();
        validationLoop.attach();
        escalationManager.attach();
        approvalGateway.attach();
        dispatcher.attach();
        subscription = bus.subscribe(Roles.ORCHESTRATOR,
                MessageFilters.forRole(Roles.ORCHESTRATOR)
                        .and(MessageFilters.ofType(MessageType.STATE_UPDATE, MessageType.ERROR_REPORT,
                                MessageType.CANCEL_TASK, MessageType.QUERY_REQUEST)),
                new IdempotentHandler(this::handle, properties.getBus().getDedupWindow()));
        running = true;
        log.info("Orchestration engine started with {} agents", agentRegistry.agents().size());
        assignPending();
    }

    @Override
    public synchronized void stop() {
        if (!running) {
            return;
        }
        running = false;
        bus.close();
        if (subscription != null) {
            subscription.unsubscribe();
            subscription = null;
        }
        dispatcher.detach();
        approvalGateway.detach();
        escalationManager.detach();
        validationLoop.detach();
        log.info("Orchestration engine stopped");
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    // -- Submission and assignment --

    /**
     * Registers a new task and tries to assign it right away. A task with no eligible agent stays
     * PENDING until a later sweep finds one.
     *
     * @throws IllegalArgumentException if the component, required capabilities or validator
     *                                  capability is missing, maxRetries is below 1, or a
     *                                  dependency is unknown
     */
    public Task submit(TaskSubmission submission) {
        if (submission.componentId() == null || submission.componentId().isBlank()) {
            throw new IllegalArgumentException("component_id is required");
        }
        if (submission.requiredCapabilities() == null || submission.requiredCapabilities().isEmpty()) {
            throw new IllegalArgumentException("required_capabilities must not be empty");
        }
        if (submission.validatorCapability() == null || submission.validatorCapability().isBlank()) {
            throw new IllegalArgumentException("validator_capability is required");
        }
        int maxRetries = submission.maxRetries() != null ? submission.maxRetries() : properties.getMaxRetries();
        if (maxRetries < 1) {
            throw new IllegalArgumentException("max_retries must be at least 1");
        }
        Set<String> dependsOn = submission.dependsOn() != null ? submission.dependsOn() : Set.of();
        for (String dependency : dependsOn) {
            if (registry.find(dependency).isEmpty()) {
                throw new IllegalArgumentException("Unknown dependency: " + dependency);
            }
        }
        Task task = Task.builder()
                .id(UUID.randomUUID().toString())
                .componentId(submission.componentId())
                .taskClass(submission.taskClass())
                .requiredCapabilities(submission.requiredCapabilities())
                .validatorCapability(submission.validatorCapability())
                .input(submission.input())
                .criteria(submission.criteria())
                .maxRetries(maxRetries)
                .priority(submission.priority() != null ? submission.priority() : TaskPriority.MEDIUM)
                .dependsOn(dependsOn)
                .build();
        String taskId = registry.create(task);
        if (running) {
            tryAssign(taskId);
        }
        return registry.get(taskId);
    }

    /**
     * Assigns every PENDING task that now has eligible agents and completed dependencies, most
     * urgent first and oldest first within a priority.
     *
     * @return number of tasks assigned
     */
    public int assignPending() {
        int assigned = 0;
        List<Task> pending = registry.findByState(TaskState.PENDING).stream().sorted(ASSIGNMENT_ORDER).toList();
        for (Task task : pending) {
            if (tryAssign(task.id())) {
                assigned++;
            }
        }
        return assigned;
    }

    boolean tryAssign(String taskId) {
        Task task = registry.get(taskId);
        if (task.state() != TaskState.PENDING || !dependenciesMet(task)) {
            return false;
        }
        Optional<AgentProxy> producer = agentRegistry.select(task.requiredCapabilities(), Set.of());
        if (producer.isEmpty()) {
            log.debug("No agent with {} for task {}, leaving it PENDING", task.requiredCapabilities(), taskId);
            return false;
        }
        String producerId = producer.get().agentId();
        Optional<AgentProxy> validator = agentRegistry.select(Set.of(task.validatorCapability()), Set.of(producerId));
        if (validator.isEmpty()) {
            log.debug("No validator with {} for task {}, leaving it PENDING", task.validatorCapability(), taskId);
            return false;
        }

        Task assigned;
        try {
            assigned = registry.transition(taskId, TaskState.PENDING, TaskState.ASSIGNED, b -> b
                    .ownerAgentId(producerId)
                    .validatorAgentId(validator.get().agentId()));
        } catch (ConflictException e) {
            log.debug("Task {} was assigned concurrently", taskId);
            return false;
        }
        log.info("Assigned task {} to {} (validator {})", taskId, producerId, assigned.validatorAgentId());
        sendAssignment(assigned);
        return true;
    }

    /**
     * True when every dependency has completed. A failed dependency fails the task, since it can
     * never start.
     */
    private boolean dependenciesMet(Task task) {
        for (String dependency : task.dependsOn()) {
            Task upstream = registry.get(dependency);
            if (upstream.state() == TaskState.FAILED) {
                registry.failIfActive(task.id(), FailureReason.DEPENDENCY_FAILED,
                        "Dependency " + dependency + " failed: " + upstream.failureReason());
                log.warn("Task {} failed because dependency {} failed", task.id(), dependency);
                return false;
            }
            if (upstream.state() != TaskState.COMPLETED) {
                log.debug("Task {} waits for dependency {} ({})", task.id(), dependency, upstream.state());
                return false;
            }
        }
        return true;
    }

    // -- Cancellation and queries --

    /**
     * Fails a non-terminal task with CANCELLED. An open escalation is resolved as ABORT.
     *
     * @return the cancelled task, or empty if it was already terminal
     * @throws TaskNotFoundException if the task is unknown
     */
    public Optional<Task> cancel(String taskId, String reason) {
        registry.get(taskId);
        String detail = "Cancelled" + (reason != null && !reason.isBlank() ? ": " + reason : "");
        Optional<Task> cancelled = registry.failIfActive(taskId, FailureReason.CANCELLED, detail);
        if (cancelled.isEmpty()) {
            log.info("Task {} already terminal, nothing to cancel", taskId);
            return cancelled;
        }
        log.info("Cancelled task {}", taskId);
        Optional<Escalation> open = registry.findOpenEscalation(taskId);
        if (open.isPresent()) {
            try {
                registry.resolveEscalation(taskId, open.get().id(), Resolution.ABORT, "cancellation", detail);
                if (metrics != null) {
                    metrics.recordResolution(Resolution.ABORT);
                }
            } catch (AlreadyResolvedException e) {
                log.info("Escalation of cancelled task {} was resolved concurrently", taskId);
            }
        }
        return cancelled;
    }

    public Optional<Task> find(String taskId) {
        return registry.find(taskId);
    }

    public List<Task> list(TaskState state) {
        return state != null ? registry.findByState(state) : registry.findAll();
    }

    // -- Bus handlers --

    void handle(Message message) {
        MdcContext.setMessage(message, Roles.ORCHESTRATOR);
        try {
            switch (message.type()) {
                case STATE_UPDATE -> onStateUpdate(message);
                case ERROR_REPORT -> onErrorReport(message);
                case CANCEL_TASK -> cancel(message.taskId(), message.payloadAs(CancelTask.class).reason());
                case QUERY_REQUEST -> onQuery(message);
                default -> log.debug("Orchestrator ignores {}", message.type().wireName());
            }
        } catch (TaskNotFoundException e) {
            log.warn("{} {} refers to unknown task {}", message.type().wireName(), message.id(), message.taskId());
        } finally {
            MdcContext.clear();
        }
    }

    void onStateUpdate(Message message) {
        StateUpdate update = message.payloadAs(StateUpdate.class);
        Task task = registry.get(message.taskId());
        if (!isCurrent(task, update.round(), update.attemptNumber())
                || !message.senderId().equals(task.ownerAgentId())) {
            discardStale(message, task);
            return;
        }
        try {
            if (task.state() == TaskState.ASSIGNED) {
                registry.transition(task.id(), TaskState.ASSIGNED, TaskState.IN_PROGRESS,
                        b -> AttemptGuard.require(b, task.id(), update.round(), update.attemptNumber()));
                log.info("Task {} started by {}", task.id(), message.senderId());
            } else if (task.state() == TaskState.IN_PROGRESS) {
                registry.transition(task.id(), TaskState.IN_PROGRESS, TaskState.IN_PROGRESS,
                        b -> AttemptGuard.require(b, task.id(), update.round(), update.attemptNumber()));
                log.debug("Task {} progress from {}: {}", task.id(), message.senderId(), update.note());
            } else {
                log.debug("Progress for task {} in {} ignored", task.id(), task.state());
            }
        } catch (ConflictException e) {
            log.debug("Progress for task {} lost a race: {}", task.id(), e.getMessage());
        }
    }

    void onErrorReport(Message message) {
        ErrorReport report = message.payloadAs(ErrorReport.class);
        Task task = registry.get(message.taskId());
        if (!isCurrent(task, report.round(), report.attemptNumber())) {
            discardStale(message, task);
            return;
        }
        String detail = message.senderId() + " reported " + report.code() + ": " + report.message();
        boolean producerError = message.senderId().equals(task.ownerAgentId())
                && (task.state() == TaskState.ASSIGNED || task.state() == TaskState.IN_PROGRESS);
        boolean validatorError = message.senderId().equals(task.validatorAgentId())
                && task.state() == TaskState.VALIDATING;
        if (!producerError && !validatorError) {
            discardStale(message, task);
            return;
        }
        log.warn("Task {}: {}", task.id(), detail);
        try {
            if (task.reassignmentCount() < properties.getMaxReassignments() && reassign(task, producerError)) {
                return;
            }
            registry.transition(task.id(), task.state(), TaskState.FAILED, b -> {
                AttemptGuard.require(b, task.id(), report.round(), report.attemptNumber());
                b.failureReason(FailureReason.AGENT_ERROR).failureDetail(detail);
            });
            log.warn("Task {} failed after agent error", task.id());
        } catch (ConflictException e) {
            discardStale(message, task);
        }
    }

    private boolean reassign(Task task, boolean producer) {
        Set<String> excluded = new HashSet<>();
        excluded.add(task.ownerAgentId());
        excluded.add(task.validatorAgentId());
        if (producer) {
            Optional<AgentProxy> replacement = agentRegistry.select(task.requiredCapabilities(), excluded);
            if (replacement.isEmpty()) {
                log.info("No other agent can take over task {}", task.id());
                return false;
            }
            Task reassigned = registry.transition(task.id(), task.state(), TaskState.ASSIGNED, b -> {
                AttemptGuard.require(b, task.id(), task.round(), task.currentAttemptNumber());
                b.ownerAgentId(replacement.get().agentId()).reassignmentCount(b.reassignmentCount() + 1);
            });
            log.info("Reassigned task {} from {} to {}", task.id(), task.ownerAgentId(), reassigned.ownerAgentId());
            sendAssignment(reassigned);
        } else {
            Optional<AgentProxy> replacement = agentRegistry.select(Set.of(task.validatorCapability()), excluded);
            if (replacement.isEmpty()) {
                log.info("No other validator can take over task {}", task.id());
                return false;
            }
            Task reassigned = registry.transition(task.id(), TaskState.VALIDATING, TaskState.VALIDATING, b -> {
                AttemptGuard.require(b, task.id(), task.round(), task.currentAttemptNumber());
                // the replacement gets a full validation deadline
                b.validatorAgentId(replacement.get().agentId())
                        .reassignmentCount(b.reassignmentCount() + 1)
                        .stateEnteredAt(clock.instant());
            });
            log.info("Reassigned validation of task {} from {} to {}", task.id(), task.validatorAgentId(),
                    reassigned.validatorAgentId());
            send(Message.builder(TaskMessages.validationRequest(reassigned))
                    .from(Roles.ORCHESTRATOR, Roles.ORCHESTRATOR)
                    .toAgent(reassigned.validatorAgentId())
                    .task(task.id())
                    .build());
        }
        return true;
    }

    void onQuery(Message message) {
        QueryResponse response = registry.find(message.taskId())
                .map(t -> new QueryResponse(message.id(), true, t.state(), t.retryCount(), t.maxRetries(),
                        t.round(), t.ownerAgentId(), t.failureReason(), t.failureDetail()))
                .orElseGet(() -> QueryResponse.notFound(message.id()));
        send(Message.builder(response)
                .from(Roles.ORCHESTRATOR, Roles.ORCHESTRATOR)
                .toAgent(message.senderId())
                .toRole(message.senderRole())
                .task(message.taskId())
                .build());
    }

    // -- Helpers --

    private void sendAssignment(Task task) {
        send(Message.builder(TaskMessages.assignment(task))
                .from(Roles.ORCHESTRATOR, Roles.ORCHESTRATOR)
                .toAgent(task.ownerAgentId())
                .task(task.id())
                .build());
    }

    private void send(Message message) {
        try {
            publisher.publish(message);
        } catch (DeliveryException e) {
            log.error("Could not publish {} for task {}: {}", message.type().wireName(), message.taskId(),
                    e.getMessage());
        }
    }

    private static boolean isCurrent(Task task, int round, int attemptNumber) {
        return round == task.round() && attemptNumber == task.currentAttemptNumber();
    }

    private void discardStale(Message message, Task task) {
        log.warn("Discarding stale {} {} from {} (task {} is {} at round {} attempt {})",
                message.type().wireName(), message.id(), message.senderId(), task.id(), task.state(),
                task.round(), task.currentAttemptNumber());
        if (metrics != null) {
            metrics.recordStaleDiscard(message.type());
        }
    }
}
