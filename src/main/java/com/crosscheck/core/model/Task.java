package com.crosscheck.core.model;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * A unit of work tracked end-to-end, from assignment through validation to a terminal state.
 * <p>
 * Instances are immutable snapshots. The only way to change a task is a registry transition,
 * which takes a {@link Builder} seeded from the current snapshot.
 *
 * @param id                   unique identifier
 * @param componentId          component the task produces
 * @param taskClass            selects per-class deadlines (nullable)
 * @param requiredCapabilities capabilities the producer must declare
 * @param validatorCapability  capability the validator must declare
 * @param input                opaque producer input
 * @param criteria             validation criteria
 * @param priority             assignment precedence among PENDING tasks
 * @param dependsOn            tasks that must be COMPLETED before this one is assigned
 * @param ownerAgentId         producing agent while the task holds an owner
 * @param validatorAgentId     validator chosen at assignment
 * @param state                current lifecycle state
 * @param retryCount           failed validations counted in the current round
 * @param maxRetries           validation attempts allowed per round
 * @param round                starts at 1, incremented on every RETRY_RESET
 * @param reassignmentCount    reassignments performed after agent errors
 * @param attemptHistory       append-only validation history across all rounds
 * @param statusHistory        append-only trail of state changes
 * @param artifact             latest submitted artifact
 * @param failureReason        why the task failed (FAILED only)
 * @param failureDetail        human-readable terminal detail
 * @param createdAt            creation time
 * @param updatedAt            time of the last transition
 * @param stateEnteredAt       time the current state was entered
 * @param lastProgressAt       time of the last progress report or transition
 */
public record Task(
    String id,
    String componentId,
    String taskClass,
    Set<String> requiredCapabilities,
    String validatorCapability,
    Map<String, Object> input,
    List<String> criteria,
    TaskPriority priority,
    Set<String> dependsOn,
    String ownerAgentId,
    String validatorAgentId,
    TaskState state,
    int retryCount,
    int maxRetries,
    int round,
    int reassignmentCount,
    List<ValidationAttempt> attemptHistory,
    List<StatusChange> statusHistory,
    Artifact artifact,
    FailureReason failureReason,
    String failureDetail,
    Instant createdAt,
    Instant updatedAt,
    Instant stateEnteredAt,
    Instant lastProgressAt
) {

    public Task {
        requiredCapabilities = requiredCapabilities == null ? Set.of()
                : Collections.unmodifiableSet(new LinkedHashSet<>(requiredCapabilities));
        input = input == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(input));
        criteria = criteria == null ? List.of() : List.copyOf(criteria);
        priority = priority == null ? TaskPriority.MEDIUM : priority;
        dependsOn = dependsOn == null ? Set.of() : Collections.unmodifiableSet(new LinkedHashSet<>(dependsOn));
        attemptHistory = attemptHistory == null ? List.of() : List.copyOf(attemptHistory);
        statusHistory = statusHistory == null ? List.of() : List.copyOf(statusHistory);
    }

    /** The attempt number the loop is currently waiting on. */
    public int currentAttemptNumber() {
        return retryCount + 1;
    }

    public boolean isTerminal() {
        return state.isTerminal();
    }

    /** Feedback of every failed attempt, oldest first. */
    public List<String> failureFeedback() {
        List<String> feedback = new ArrayList<>();
        for (ValidationAttempt attempt : attemptHistory) {
            if (attempt.failed() && attempt.feedback() != null) {
                feedback.add(attempt.feedback());
            }
        }
        return feedback;
    }

    /** Producer that held the task when it last entered {@code state}, or null if it never did. */
    public String lastAgentEntering(TaskState state) {
        for (int i = statusHistory.size() - 1; i >= 0; i--) {
            StatusChange change = statusHistory.get(i);
            if (change.to() == state) {
                return change.agentId();
            }
        }
        return null;
    }

    public Builder toBuilder() {
        return new Builder(this);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Mutable staging area for a new snapshot. Registry transitions hand one of these to the mutator.
     */
    public static final class Builder {
        private String id;
        private String componentId;
        private String taskClass;
        private Set<String> requiredCapabilities = Set.of();
        private String validatorCapability;
        private Map<String, Object> input = Map.of();
        private List<String> criteria = List.of();
        private TaskPriority priority = TaskPriority.MEDIUM;
        private Set<String> dependsOn = Set.of();
        private String ownerAgentId;
        private String validatorAgentId;
        private TaskState state = TaskState.PENDING;
        private int retryCount;
        private int maxRetries = 3;
        private int round = 1;
        private int reassignmentCount;
        private List<ValidationAttempt> attemptHistory = new ArrayList<>();
        private List<StatusChange> statusHistory = new ArrayList<>();
        private Artifact artifact;
        private FailureReason failureReason;
        private String failureDetail;
        private Instant createdAt;
        private Instant updatedAt;
        private Instant stateEnteredAt;
        private Instant lastProgressAt;

        private Builder() {
        }

        private Builder(Task task) {
            this.id = task.id;
            this.componentId = task.componentId;
            this.taskClass = task.taskClass;
            this.requiredCapabilities = task.requiredCapabilities;
            this.validatorCapability = task.validatorCapability;
            this.input = task.input;
            this.criteria = task.criteria;
            this.priority = task.priority;
            this.dependsOn = task.dependsOn;
            this.ownerAgentId = task.ownerAgentId;
            this.validatorAgentId = task.validatorAgentId;
            this.state = task.state;
            this.retryCount = task.retryCount;
            this.maxRetries = task.maxRetries;
            this.round = task.round;
            this.reassignmentCount = task.reassignmentCount;
            this.attemptHistory = new ArrayList<>(task.attemptHistory);
            this.statusHistory = new ArrayList<>(task.statusHistory);
            this.artifact = task.artifact;
            this.failureReason = task.failureReason;
            this.failureDetail = task.failureDetail;
            this.createdAt = task.createdAt;
            this.updatedAt = task.updatedAt;
            this.stateEnteredAt = task.stateEnteredAt;
            this.lastProgressAt = task.lastProgressAt;
        }

        public Builder id(String id) { this.id = id; return this; }
        public Builder componentId(String componentId) { this.componentId = componentId; return this; }
        public Builder taskClass(String taskClass) { this.taskClass = taskClass; return this; }
        public Builder requiredCapabilities(Set<String> caps) { this.requiredCapabilities = caps; return this; }
        public Builder validatorCapability(String cap) { this.validatorCapability = cap; return this; }
        public Builder input(Map<String, Object> input) { this.input = input; return this; }
        public Builder criteria(List<String> criteria) { this.criteria = criteria; return this; }
        public Builder priority(TaskPriority priority) { this.priority = priority; return this; }
        public Builder dependsOn(Set<String> dependsOn) { this.dependsOn = dependsOn; return this; }
        public Builder ownerAgentId(String ownerAgentId) { this.ownerAgentId = ownerAgentId; return this; }
        public Builder validatorAgentId(String validatorAgentId) { this.validatorAgentId = validatorAgentId; return this; }
        public Builder state(TaskState state) { this.state = state; return this; }
        public Builder retryCount(int retryCount) { this.retryCount = retryCount; return this; }
        public Builder maxRetries(int maxRetries) { this.maxRetries = maxRetries; return this; }
        public Builder round(int round) { this.round = round; return this; }
        public Builder reassignmentCount(int count) { this.reassignmentCount = count; return this; }
        public Builder artifact(Artifact artifact) { this.artifact = artifact; return this; }
        public Builder failureReason(FailureReason reason) { this.failureReason = reason; return this; }
        public Builder failureDetail(String detail) { this.failureDetail = detail; return this; }
        public Builder createdAt(Instant createdAt) { this.createdAt = createdAt; return this; }
        public Builder updatedAt(Instant updatedAt) { this.updatedAt = updatedAt; return this; }
        public Builder stateEnteredAt(Instant at) { this.stateEnteredAt = at; return this; }
        public Builder lastProgressAt(Instant at) { this.lastProgressAt = at; return this; }

        /** Appends to the history. Earlier entries cannot be replaced through the builder. */
        public Builder appendAttempt(ValidationAttempt attempt) {
            this.attemptHistory.add(attempt);
            return this;
        }

        public Builder recordStatusChange(StatusChange change) {
            this.statusHistory.add(change);
            return this;
        }

        public TaskState state() { return state; }
        public int retryCount() { return retryCount; }
        public int maxRetries() { return maxRetries; }
        public int round() { return round; }
        public String ownerAgentId() { return ownerAgentId; }
        public String validatorAgentId() { return validatorAgentId; }
        public int reassignmentCount() { return reassignmentCount; }
        public Instant stateEnteredAt() { return stateEnteredAt; }
        public Instant lastProgressAt() { return lastProgressAt; }

        public Task build() {
            return new Task(id, componentId, taskClass, requiredCapabilities, validatorCapability, input,
                    criteria, priority, dependsOn, ownerAgentId, validatorAgentId, state, retryCount,
                    maxRetries, round, reassignmentCount, attemptHistory, statusHistory, artifact, failureReason, failureDetail,
                    createdAt, updatedAt, stateEnteredAt, lastProgressAt);
        }
    }
}
