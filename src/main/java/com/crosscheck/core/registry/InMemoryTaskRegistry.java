package com.crosscheck.core.registry;

import com.crosscheck.core.metrics.CrosscheckMetrics;
import com.crosscheck.core.model.Escalation;
import com.crosscheck.core.model.FailureReason;
import com.crosscheck.core.model.Resolution;
import com.crosscheck.core.model.StatusChange;
import com.crosscheck.core.model.Task;
import com.crosscheck.core.model.TaskState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Consumer;

/**
 * Task registry backed by {@link ConcurrentHashMap}. Each transition runs inside
 * {@code compute}, which serializes concurrent transitions of the same task.
 */
@Service
public class InMemoryTaskRegistry implements TaskRegistry {

    private static final Logger log = LoggerFactory.getLogger(InMemoryTaskRegistry.class);

    private final ConcurrentHashMap<String, Task> tasks = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, List<Escalation>> escalations = new ConcurrentHashMap<>();
    private final Clock clock;
    private final CrosscheckMetrics metrics;

    public InMemoryTaskRegistry(Clock clock, @Autowired(required = false) CrosscheckMetrics metrics) {
        this.clock = clock;
        this.metrics = metrics;
    }

    @Override
    public String create(Task task) {
        Objects.requireNonNull(task.id(), "task id");
        Instant now = clock.instant();
        Task stored = task.toBuilder()
                .state(TaskState.PENDING)
                .ownerAgentId(null)
                .createdAt(task.createdAt() != null ? task.createdAt() : now)
                .updatedAt(now)
                .stateEnteredAt(now)
                .lastProgressAt(now)
                .recordStatusChange(new StatusChange(null, TaskState.PENDING, null, now))
                .build();
        if (stored.maxRetries() < 1) {
            throw new IllegalArgumentException("maxRetries must be at least 1, was " + stored.maxRetries());
        }
        if (tasks.putIfAbsent(stored.id(), stored) != null) {
            throw new IllegalArgumentException("Task already exists: " + stored.id());
        }
        log.info("Created task {} for component {}", stored.id(), stored.componentId());
        if (metrics != null) {
            metrics.recordTransition(TaskState.PENDING);
        }
        return stored.id();
    }

    @Override
    public Task get(String taskId) {
        return find(taskId).orElseThrow(() -> new TaskNotFoundException(taskId));
    }

    @Override
    public Optional<Task> find(String taskId) {
        return Optional.ofNullable(tasks.get(taskId));
    }

    @Override
    public Task transition(String taskId, TaskState expected, TaskState next, Consumer<Task.Builder> mutator) {
        Task updated = tasks.compute(taskId, (id, current) -> {
            if (current == null) {
                throw new TaskNotFoundException(id);
            }
            if (current.state() != expected) {
                throw new ConflictException(id, expected, current.state());
            }
            if (!expected.canTransitionTo(next)) {
                throw new IllegalTransitionException(id, expected, next);
            }
            Task.Builder builder = current.toBuilder().state(next);
            mutator.accept(builder);
            Instant now = clock.instant();
            builder.updatedAt(now).lastProgressAt(now);
            if (next != expected) {
                builder.stateEnteredAt(now)
                        .recordStatusChange(new StatusChange(expected, next, builder.ownerAgentId(), now));
            }
            return enforceInvariants(current, builder, next);
        });
        if (next != expected) {
            log.info("Task {} {} -> {}", taskId, expected, next);
            if (metrics != null) {
                metrics.recordTransition(next);
            }
        }
        return updated;
    }

    private static Task enforceInvariants(Task current, Task.Builder builder, TaskState next) {
        if (builder.state() != next) {
            throw new IllegalStateException("Mutator changed the target state of task " + current.id());
        }
        if (!next.holdsOwner()) {
            builder.ownerAgentId(null);
        }
        Task updated = builder.build();
        if (!updated.id().equals(current.id())) {
            throw new IllegalStateException("Mutator changed the id of task " + current.id());
        }
        if (!next.isTerminal() && (updated.retryCount() < 0 || updated.retryCount() > updated.maxRetries())) {
            throw new IllegalStateException("Task " + current.id() + " retryCount " + updated.retryCount()
                    + " outside [0, " + updated.maxRetries() + "]");
        }
        List<?> before = current.attemptHistory();
        List<?> after = updated.attemptHistory();
        if (after.size() < before.size() || !after.subList(0, before.size()).equals(before)) {
            throw new IllegalStateException("Attempt history of task " + current.id() + " is append-only");
        }
        List<?> trailBefore = current.statusHistory();
        List<?> trailAfter = updated.statusHistory();
        if (trailAfter.size() < trailBefore.size()
                || !trailAfter.subList(0, trailBefore.size()).equals(trailBefore)) {
            throw new IllegalStateException("Status history of task " + current.id() + " is append-only");
        }
        return updated;
    }

    @Override
    public Optional<Task> failIfActive(String taskId, FailureReason reason, String detail) {
        while (true) {
            Task current = get(taskId);
            if (current.isTerminal()) {
                return Optional.empty();
            }
            try {
                return Optional.of(transition(taskId, current.state(), TaskState.FAILED, b -> b
                        .failureReason(reason)
                        .failureDetail(detail)));
            } catch (ConflictException e) {
                log.debug("Retrying failure of task {} after conflict: {}", taskId, e.getMessage());
            }
        }
    }

    @Override
    public List<Task> findAll() {
        return sortedByCreation(new ArrayList<>(tasks.values()));
    }

    @Override
    public List<Task> findByState(TaskState state) {
        return sortedByCreation(tasks.values().stream().filter(t -> t.state() == state).toList());
    }

    @Override
    public List<Task> findActive() {
        return sortedByCreation(tasks.values().stream().filter(t -> !t.isTerminal()).toList());
    }

    @Override
    public int countOwnedBy(String agentId) {
        return (int) tasks.values().stream()
                .filter(t -> agentId.equals(t.ownerAgentId()))
                .count();
    }

    @Override
    public Escalation openEscalation(Escalation escalation) {
        get(escalation.taskId());
        appendEscalation(escalation);
        log.info("Opened escalation {} for task {} ({})", escalation.id(), escalation.taskId(),
                escalation.reason().wireName());
        return escalation;
    }

    @Override
    public Escalation openEscalation(Escalation escalation, int round) {
        // holding the task's bin serializes this against a concurrent cancel or timeout
        tasks.compute(escalation.taskId(), (id, current) -> {
            if (current == null) {
                throw new TaskNotFoundException(id);
            }
            if (current.state() != TaskState.ESCALATED) {
                throw new ConflictException(id, TaskState.ESCALATED, current.state());
            }
            if (current.round() != round) {
                throw new ConflictException(id, TaskState.ESCALATED,
                        "round is " + current.round() + ", escalation was for round " + round);
            }
            appendEscalation(escalation);
            return current;
        });
        log.info("Opened escalation {} for task {} ({}) in round {}", escalation.id(), escalation.taskId(),
                escalation.reason().wireName(), round);
        return escalation;
    }

    private void appendEscalation(Escalation escalation) {
        escalations.compute(escalation.taskId(), (taskId, history) -> {
            List<Escalation> updated = history == null ? new ArrayList<>() : new ArrayList<>(history);
            for (Escalation existing : updated) {
                if (existing.isOpen()) {
                    throw new EscalationAlreadyOpenException(taskId, existing.id());
                }
            }
            updated.add(escalation);
            return List.copyOf(updated);
        });
    }

    @Override
    public Escalation resolveEscalation(String taskId, String escalationId, Resolution resolution,
                                        String resolvedBy, String note) {
        Escalation[] resolved = new Escalation[1];
        escalations.compute(taskId, (id, history) -> {
            if (history == null || history.isEmpty()) {
                throw new EscalationNotFoundException("No escalation for task " + id);
            }
            List<Escalation> updated = new ArrayList<>(history);
            int index = indexOf(updated, escalationId);
            if (index < 0) {
                if (escalationId != null) {
                    throw new EscalationNotFoundException("No escalation " + escalationId + " for task " + id);
                }
                throw new AlreadyResolvedException(id, updated.get(updated.size() - 1).id());
            }
            Escalation target = updated.get(index);
            if (!target.isOpen()) {
                throw new AlreadyResolvedException(id, target.id());
            }
            resolved[0] = target.resolve(resolution, resolvedBy, note, clock.instant());
            updated.set(index, resolved[0]);
            return List.copyOf(updated);
        });
        log.info("Resolved escalation {} for task {} as {} by {}", resolved[0].id(), taskId, resolution, resolvedBy);
        return resolved[0];
    }

    private static int indexOf(List<Escalation> history, String escalationId) {
        for (int i = history.size() - 1; i >= 0; i--) {
            Escalation e = history.get(i);
            if (escalationId == null ? e.isOpen() : e.id().equals(escalationId)) {
                return i;
            }
        }
        return -1;
    }

    @Override
    public Optional<Escalation> findOpenEscalation(String taskId) {
        return escalationHistory(taskId).stream().filter(Escalation::isOpen).findFirst();
    }

    @Override
    public List<Escalation> escalationHistory(String taskId) {
        return escalations.getOrDefault(taskId, List.of());
    }

    @Override
    public List<Escalation> openEscalations() {
        return escalations.values().stream()
                .flatMap(List::stream)
                .filter(Escalation::isOpen)
                .sorted(Comparator.comparing(Escalation::createdAt))
                .toList();
    }

    private static List<Task> sortedByCreation(List<Task> list) {
        return list.stream()
                .sorted(Comparator.comparing(Task::createdAt).thenComparing(Task::id))
                .toList();
    }
}
