package com.crosscheck.core.registry;

import com.crosscheck.core.model.Escalation;
import com.crosscheck.core.model.FailureReason;
import com.crosscheck.core.model.Resolution;
import com.crosscheck.core.model.Task;
import com.crosscheck.core.model.TaskState;

import java.util.List;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Authoritative store of task and escalation records.
 * <p>
 * {@link #transition} is the only way to change a task and is atomic per task.
 */
public interface TaskRegistry {

    /**
     * Stores a new task in {@link TaskState#PENDING}.
     *
     * @return the task id
     */
    String create(Task task);

    /**
     * @throws TaskNotFoundException if the task is unknown
     */
    Task get(String taskId);

    Optional<Task> find(String taskId);

    /**
     * Atomically moves a task from {@code expected} to {@code next}. The mutator receives a builder
     * seeded from the current task with {@code next} already set, and may change any other field.
     * Timestamps are stamped after the mutator runs. A mutator that throws aborts the transition.
     *
     * @throws ConflictException           if the task is not in {@code expected}
     * @throws IllegalTransitionException  if the state machine has no such edge
     * @throws TaskNotFoundException       if the task is unknown
     */
    Task transition(String taskId, TaskState expected, TaskState next, Consumer<Task.Builder> mutator);

    default Task transition(String taskId, TaskState expected, TaskState next) {
        return transition(taskId, expected, next, b -> {});
    }

    /**
     * Fails a task from whatever non-terminal state it is in, retrying on lost races.
     *
     * @return the failed task, or empty if it was already terminal
     */
    Optional<Task> failIfActive(String taskId, FailureReason reason, String detail);

    List<Task> findAll();

    List<Task> findByState(TaskState state);

    /** Tasks that are not yet COMPLETED or FAILED. */
    List<Task> findActive();

    /** Number of tasks currently owned by the agent, the load measure for assignment. */
    int countOwnedBy(String agentId);

    /**
     * @throws EscalationAlreadyOpenException if the task already has an OPEN escalation
     */
    Escalation openEscalation(Escalation escalation);

    /**
     * Opens an escalation only while the task is still ESCALATED in the given round. The check
     * and the insert are atomic with respect to transitions of the same task.
     *
     * @throws ConflictException              if the task left ESCALATED or moved to another round
     * @throws EscalationAlreadyOpenException if the task already has an OPEN escalation
     * @throws TaskNotFoundException          if the task is unknown
     */
    Escalation openEscalation(Escalation escalation, int round);

    /**
     * Resolves the task's open escalation exactly once.
     *
     * @param escalationId expected escalation, or null for whichever is open
     * @throws AlreadyResolvedException    if the escalation is not OPEN
     * @throws EscalationNotFoundException if the task never had the escalation
     */
    Escalation resolveEscalation(String taskId, String escalationId, Resolution resolution,
                                 String resolvedBy, String note);

    Optional<Escalation> findOpenEscalation(String taskId);

    List<Escalation> escalationHistory(String taskId);

    List<Escalation> openEscalations();
}
