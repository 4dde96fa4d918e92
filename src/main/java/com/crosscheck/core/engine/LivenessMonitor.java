package com.crosscheck.core.engine;

import com.crosscheck.core.config.OrchestrationProperties;
import com.crosscheck.core.metrics.CrosscheckMetrics;
import com.crosscheck.core.model.Escalation;
import com.crosscheck.core.model.FailureReason;
import com.crosscheck.core.model.Task;
import com.crosscheck.core.model.TaskState;
import com.crosscheck.core.registry.ConflictException;
import com.crosscheck.core.registry.TaskRegistry;
import com.crosscheck.core.validation.ValidationLoopController;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Periodic sweep that retries assignment of PENDING tasks and enforces deadlines.
 * <p>
 * A task in ASSIGNED or IN_PROGRESS without progress for longer than its class's liveness
 * deadline fails with AGENT_UNAVAILABLE. A task in VALIDATING for longer than the validation
 * deadline fails with TIMEOUT. Neither is retried. An ESCALATED task whose escalation request
 * never produced a record is escalated again.
 */
@Service
public class LivenessMonitor {

    private static final Logger log = LoggerFactory.getLogger(LivenessMonitor.class);

    private final TaskRegistry registry;
    private final OrchestrationEngine engine;
    private final ValidationLoopController validationLoop;
    private final OrchestrationProperties properties;
    private final Clock clock;
    private final CrosscheckMetrics metrics;

    public LivenessMonitor(TaskRegistry registry,
                           OrchestrationEngine engine,
                           ValidationLoopController validationLoop,
                           OrchestrationProperties properties,
                           Clock clock,
                           @Autowired(required = false) CrosscheckMetrics metrics) {
        this.registry = registry;
        this.engine = engine;
        this.validationLoop = validationLoop;
        this.properties = properties;
        this.clock = clock;
        this.metrics = metrics;
    }

    @Scheduled(fixedDelayString = "${crosscheck.monitor.interval:5s}")
    public void sweep() {
        if (!engine.isRunning()) {
            return;
        }
        int assigned = engine.assignPending();
        int failed = checkDeadlines();
        int reissued = reissueEscalations();
        if (assigned > 0 || failed > 0 || reissued > 0) {
            log.info("Liveness sweep assigned {}, failed {} and re-escalated {} tasks", assigned, failed, reissued);
        }
    }

    /**
     * @return number of tasks failed by this check
     */
    public int checkDeadlines() {
        Instant now = clock.instant();
        int failed = 0;
        for (Task task : registry.findActive()) {
            switch (task.state()) {
                case ASSIGNED, IN_PROGRESS -> {
                    Duration deadline = properties.livenessTimeout(task.taskClass());
                    if (expire(task, now, deadline, FailureReason.AGENT_UNAVAILABLE, false)) {
                        failed++;
                    }
                }
                case VALIDATING -> {
                    Duration deadline = properties.validationTimeout(task.taskClass());
                    if (expire(task, now, deadline, FailureReason.TIMEOUT, true)) {
                        failed++;
                    }
                }
                default -> {
                }
            }
        }
        return failed;
    }

    /**
     * Re-publishes the escalation request of every task that has been ESCALATED for longer than
     * one monitor interval without an escalation record opened since it got there.
     *
     * @return number of requests published
     */
    public int reissueEscalations() {
        Instant now = clock.instant();
        Duration grace = properties.getMonitor().getInterval();
        int reissued = 0;
        for (Task task : registry.findByState(TaskState.ESCALATED)) {
            if (task.stateEnteredAt() == null || !now.isAfter(task.stateEnteredAt().plus(grace))) {
                continue;
            }
            boolean recorded = registry.escalationHistory(task.id()).stream()
                    .map(Escalation::createdAt)
                    .anyMatch(created -> !created.isBefore(task.stateEnteredAt()));
            if (recorded) {
                continue;
            }
            log.warn("Task {} has been ESCALATED since {} without an escalation record, requesting again",
                    task.id(), task.stateEnteredAt());
            if (validationLoop.requestEscalation(task)) {
                reissued++;
            }
        }
        return reissued;
    }

    private boolean expire(Task task, Instant now, Duration deadline, FailureReason reason, boolean sinceEntered) {
        Instant since = sinceEntered ? task.stateEnteredAt() : task.lastProgressAt();
        if (since == null || !now.isAfter(since.plus(deadline))) {
            return false;
        }
        String agent = sinceEntered ? task.validatorAgentId() : task.ownerAgentId();
        String detail = sinceEntered
                ? "Validator " + agent + " gave no verdict within " + deadline
                : "Agent " + agent + " reported no progress within " + deadline;
        try {
            registry.transition(task.id(), task.state(), TaskState.FAILED, b -> {
                Instant current = sinceEntered ? b.stateEnteredAt() : b.lastProgressAt();
                if (!current.equals(since)) {
                    throw new ConflictException(task.id(), task.state(), "progressed since the deadline check");
                }
                b.failureReason(reason).failureDetail(detail);
            });
        } catch (ConflictException e) {
            log.debug("Task {} moved on before it could be expired: {}", task.id(), e.getMessage());
            return false;
        }
        log.warn("Task {} failed with {}: {}", task.id(), reason, detail);
        if (metrics != null) {
            metrics.recordLivenessFailure(reason);
        }
        return true;
    }
}
