package com.crosscheck.core.metrics;

import com.crosscheck.core.message.MessageType;
import com.crosscheck.core.model.EscalationReason;
import com.crosscheck.core.model.FailureReason;
import com.crosscheck.core.model.Resolution;
import com.crosscheck.core.model.TaskState;
import com.crosscheck.core.model.ValidationVerdict;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Centralised Micrometer metrics for task orchestration.
 */
@Service
public class CrosscheckMetrics {

    private final MeterRegistry registry;

    public CrosscheckMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordTransition(TaskState to) {
        Counter.builder("crosscheck.task.transitions")
                .tag("state", to.name())
                .register(registry)
                .increment();
    }

    public void recordVerdict(ValidationVerdict verdict, int attemptNumber) {
        Counter.builder("crosscheck.validation.verdicts")
                .tag("verdict", verdict.name())
                .register(registry)
                .increment();

        DistributionSummary.builder("crosscheck.validation.attempt")
                .description("Attempt number at which a verdict was recorded")
                .register(registry)
                .record(attemptNumber);
    }

    public void recordEscalation(EscalationReason reason) {
        Counter.builder("crosscheck.escalations.total")
                .tag("reason", reason.wireName())
                .register(registry)
                .increment();
    }

    public void recordResolution(Resolution resolution) {
        Counter.builder("crosscheck.escalations.resolutions")
                .tag("resolution", resolution.name())
                .register(registry)
                .increment();
    }

    /**
     * Records a message that was dropped because it referred to an outdated attempt or state.
     */
    public void recordStaleDiscard(MessageType type) {
        Counter.builder("crosscheck.messages.stale")
                .description("Messages discarded as stale or duplicate")
                .tag("type", type.wireName())
                .register(registry)
                .increment();
    }

    public void recordPublishRetry() {
        Counter.builder("crosscheck.bus.publish_retries")
                .register(registry)
                .increment();
    }

    public void recordLivenessFailure(FailureReason reason) {
        Counter.builder("crosscheck.liveness.failures")
                .tag("reason", reason.name())
                .register(registry)
                .increment();
    }

    /**
     * @param kind    "assignment" or "validation"
     * @param outcome "success", "error" or "exception"
     */
    public void recordAgentInvocation(String agentId, String kind, String outcome, long ms) {
        Timer.builder("crosscheck.agent.invocation")
                .tag("agent", agentId)
                .tag("kind", kind)
                .tag("outcome", outcome)
                .register(registry)
                .record(Duration.ofMillis(ms));
    }
}
