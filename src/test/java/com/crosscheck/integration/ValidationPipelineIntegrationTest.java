package com.crosscheck.integration;

import com.crosscheck.core.message.CancelTask;
import com.crosscheck.core.message.HumanApprovalRequest;
import com.crosscheck.core.message.Message;
import com.crosscheck.core.message.Roles;
import com.crosscheck.core.model.Escalation;
import com.crosscheck.core.model.EscalationReason;
import com.crosscheck.core.model.FailureReason;
import com.crosscheck.core.model.Resolution;
import com.crosscheck.core.model.StatusChange;
import com.crosscheck.core.model.Task;
import com.crosscheck.core.model.TaskState;
import com.crosscheck.core.model.ValidationVerdict;
import com.crosscheck.core.registry.AlreadyResolvedException;
import com.crosscheck.testing.OrchestrationHarness;
import com.crosscheck.testing.TestAgents;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * End-to-end runs of the generate, validate, retry and escalate cycle over the in-memory bus.
 */
class ValidationPipelineIntegrationTest {

    private OrchestrationHarness harness;

    @AfterEach
    void tearDown() {
        if (harness != null) {
            harness.engine.stop();
        }
    }

    @Nested
    @DisplayName("validation loop")
    class Loop {

        @Test
        @DisplayName("PASS on the first attempt completes with one attempt and no retries")
        void passFirstTime() {
            harness = new OrchestrationHarness(List.of(
                    TestAgents.producer("coder", "java"),
                    TestAgents.validator("reviewer", "review", "PASS"))).start();

            Task task = harness.submit("auth-service", "java", "review");

            assertEquals(TaskState.COMPLETED, task.state());
            assertEquals(0, task.retryCount());
            assertEquals(1, task.attemptHistory().size());
            assertEquals(ValidationVerdict.PASS, task.attemptHistory().get(0).result());
            assertEquals("reviewer", task.attemptHistory().get(0).validatorId());
            assertEquals("coder-1", task.artifact().id());
            assertNull(task.ownerAgentId());
            assertEquals(List.of(TaskState.PENDING, TaskState.ASSIGNED, TaskState.IN_PROGRESS,
                            TaskState.VALIDATING, TaskState.COMPLETED),
                    task.statusHistory().stream().map(StatusChange::to).toList());
        }

        @Test
        @DisplayName("a FAIL followed by a PASS completes on the second attempt")
        void failThenPass() {
            harness = new OrchestrationHarness(List.of(
                    TestAgents.producer("coder", "java"),
                    TestAgents.validator("reviewer", "review", "FAIL:missing error handling", "PASS"))).start();

            Task task = harness.submit("auth-service", "java", "review");

            assertEquals(TaskState.COMPLETED, task.state());
            assertEquals(1, task.retryCount());
            assertEquals(List.of(ValidationVerdict.FAIL, ValidationVerdict.PASS),
                    task.attemptHistory().stream().map(a -> a.result()).toList());
            assertEquals(List.of(1, 2), task.attemptHistory().stream().map(a -> a.attemptNumber()).toList());
            assertEquals("coder-2", task.artifact().id());
        }

        @Test
        @DisplayName("the retry count never exceeds the budget")
        void retryBound() {
            harness = new OrchestrationHarness(List.of(
                    TestAgents.producer("coder", "java"),
                    TestAgents.validator("reviewer", "review", "FAIL:nope"))).start();

            Task task = harness.submit("auth-service", "java", "review", 5);

            assertEquals(TaskState.ESCALATED, task.state());
            assertEquals(5, task.retryCount());
            assertEquals(5, task.attemptHistory().size());
            assertTrue(task.attemptHistory().stream().allMatch(a -> a.result() == ValidationVerdict.FAIL));
        }
    }

    @Nested
    @DisplayName("escalation")
    class EscalationFlow {

        @Test
        @DisplayName("three identical failures escalate as a repeated failure")
        void repeatedFailure() {
            harness = new OrchestrationHarness(List.of(
                    TestAgents.producer("coder", "java"),
                    TestAgents.validator("reviewer", "review", "FAIL:missing_error_handling"))).start();

            Task task = harness.submit("auth-service", "java", "review");

            assertEquals(TaskState.ESCALATED, task.state());
            assertEquals(3, task.retryCount());
            Escalation escalation = harness.registry.findOpenEscalation(task.id()).orElseThrow();
            assertEquals(EscalationReason.REPEATED_SAME_FAILURE, escalation.reason());
            assertEquals(3, escalation.rejectionCount());
            assertEquals("coder", escalation.ownerAgentId());

            assertEquals(1, harness.approvalRequests.size());
            HumanApprovalRequest request = harness.approvalRequests.get(0);
            assertEquals(escalation.id(), request.escalationId());
            assertEquals("missing_error_handling", request.mostCommonReason());
            assertEquals(List.of(Resolution.values()), request.options());
        }

        @Test
        @DisplayName("alternating failures escalate as divergent")
        void divergentFailure() {
            harness = new OrchestrationHarness(List.of(
                    TestAgents.producer("coder", "java"),
                    TestAgents.validator("reviewer", "review",
                            "FAIL:sql_injection", "FAIL:missing_error_handling", "FAIL:sql_injection"))).start();

            Task task = harness.submit("auth-service", "java", "review");

            assertEquals(TaskState.ESCALATED, task.state());
            Escalation escalation = harness.registry.findOpenEscalation(task.id()).orElseThrow();
            assertEquals(EscalationReason.DIVERGENT_FAILURE, escalation.reason());
            assertEquals("sql_injection", harness.approvalRequests.get(0).mostCommonReason());
        }

        @Test
        @DisplayName("RETRY_RESET runs a second round that can pass")
        void retryReset() {
            harness = new OrchestrationHarness(List.of(
                    TestAgents.producer("coder", "java"),
                    TestAgents.validator("reviewer", "review", "FAIL:a", "FAIL:a", "FAIL:a", "PASS"))).start();
            Task escalated = harness.submit("auth-service", "java", "review");

            harness.gateway.submitResolution(escalated.id(), Resolution.RETRY_RESET, "alice", "criteria fixed");

            Task task = harness.task(escalated.id());
            assertEquals(TaskState.COMPLETED, task.state());
            assertEquals(2, task.round());
            assertEquals(0, task.retryCount());
            assertEquals(4, task.attemptHistory().size());
            assertEquals(2, task.attemptHistory().get(3).round());
            assertEquals(1, task.attemptHistory().get(3).attemptNumber());
            Escalation resolved = harness.registry.escalationHistory(task.id()).get(0);
            assertEquals(Resolution.RETRY_RESET, resolved.resolution());
            assertEquals("alice", resolved.resolvedBy());
        }

        @Test
        @DisplayName("a second round can escalate again with a new record")
        void escalatesAgain() {
            harness = new OrchestrationHarness(List.of(
                    TestAgents.producer("coder", "java"),
                    TestAgents.validator("reviewer", "review", "FAIL:a"))).start();
            Task escalated = harness.submit("auth-service", "java", "review");

            harness.gateway.submitResolution(escalated.id(), Resolution.RETRY_RESET, "alice", null);

            Task task = harness.task(escalated.id());
            assertEquals(TaskState.ESCALATED, task.state());
            assertEquals(2, task.round());
            assertEquals(6, task.attemptHistory().size());
            assertEquals(2, harness.registry.escalationHistory(task.id()).size());
            assertTrue(harness.registry.findOpenEscalation(task.id()).isPresent());
        }

        @Test
        @DisplayName("FORCE_ACCEPT completes and a second resolution is rejected")
        void forceAcceptOnce() {
            harness = new OrchestrationHarness(List.of(
                    TestAgents.producer("coder", "java"),
                    TestAgents.validator("reviewer", "review", "FAIL:false positive"))).start();
            Task escalated = harness.submit("auth-service", "java", "review");

            harness.gateway.submitResolution(escalated.id(), Resolution.FORCE_ACCEPT, "alice", null);

            assertEquals(TaskState.COMPLETED, harness.task(escalated.id()).state());
            assertThrows(AlreadyResolvedException.class,
                    () -> harness.gateway.submitResolution(escalated.id(), Resolution.ABORT, "bob", null));
            assertEquals(TaskState.COMPLETED, harness.task(escalated.id()).state());
        }

        @Test
        @DisplayName("ABORT fails the task")
        void abort() {
            harness = new OrchestrationHarness(List.of(
                    TestAgents.producer("coder", "java"),
                    TestAgents.validator("reviewer", "review", "FAIL:x"))).start();
            Task escalated = harness.submit("auth-service", "java", "review");

            harness.gateway.submitResolution(escalated.id(), Resolution.ABORT, "alice", "out of scope");

            Task task = harness.task(escalated.id());
            assertEquals(TaskState.FAILED, task.state());
            assertEquals(FailureReason.ABORTED, task.failureReason());
            assertEquals("Aborted by alice: out of scope", task.failureDetail());
        }
    }

    @Nested
    @DisplayName("cancellation and liveness")
    class CancellationAndLiveness {

        @Test
        @DisplayName("cancelling mid-flight fails the task and discards the late completion")
        void cancelMidFlight() {
            var producer = new TestAgents.ManualProducer("coder", "java");
            harness = new OrchestrationHarness(List.of(producer,
                    TestAgents.validator("reviewer", "review", "PASS"))).start();
            Task task = harness.submit("auth-service", "java", "review");
            assertEquals(TaskState.IN_PROGRESS, task.state());

            harness.engine.cancel(task.id(), "requirements changed");
            producer.completeNext();

            Task cancelled = harness.task(task.id());
            assertEquals(TaskState.FAILED, cancelled.state());
            assertEquals(FailureReason.CANCELLED, cancelled.failureReason());
            assertEquals("Cancelled: requirements changed", cancelled.failureDetail());
            assertNull(cancelled.artifact());
            assertEquals(1.0, harness.count("crosscheck.messages.stale", "type", "task_completion"));
        }

        @Test
        @DisplayName("a CancelTask message resolves an open escalation as ABORT")
        void cancelEscalated() {
            harness = new OrchestrationHarness(List.of(
                    TestAgents.producer("coder", "java"),
                    TestAgents.validator("reviewer", "review", "FAIL:x"))).start();
            Task escalated = harness.submit("auth-service", "java", "review");

            harness.bus.publish(Message.builder(new CancelTask("no longer needed"))
                    .from("client", "client").toRole(Roles.ORCHESTRATOR).task(escalated.id()).build());

            assertEquals(FailureReason.CANCELLED, harness.task(escalated.id()).failureReason());
            Escalation escalation = harness.registry.escalationHistory(escalated.id()).get(0);
            assertEquals(Resolution.ABORT, escalation.resolution());
            assertEquals("cancellation", escalation.resolvedBy());
        }

        @Test
        @DisplayName("a silent agent fails the task as unavailable, without retry")
        void livenessTimeout() {
            var producer = new TestAgents.ManualProducer("coder", "java");
            harness = new OrchestrationHarness(List.of(producer,
                    TestAgents.validator("reviewer", "review", "PASS"))).start();
            Task task = harness.submit("auth-service", "java", "review");

            harness.clock.advance(Duration.ofMinutes(11));
            harness.livenessMonitor.sweep();

            Task failed = harness.task(task.id());
            assertEquals(TaskState.FAILED, failed.state());
            assertEquals(FailureReason.AGENT_UNAVAILABLE, failed.failureReason());
            assertEquals(1, producer.received().size());
        }

        @Test
        @DisplayName("a PENDING task is picked up once an agent can take it")
        void pendingWithoutAgents() {
            harness = new OrchestrationHarness(List.of(TestAgents.producer("coder", "java"))).start();

            Task task = harness.submit("auth-service", "java", "review");

            assertEquals(TaskState.PENDING, task.state());
            assertEquals(0, harness.engine.assignPending());
        }
    }

    @Nested
    @DisplayName("agent errors")
    class AgentErrors {

        @Test
        @DisplayName("a producer error is reassigned once to another capable agent")
        void reassignsProducer() {
            harness = new OrchestrationHarness(List.of(
                    TestAgents.failingProducer("flaky", "oom", "java"),
                    TestAgents.producer("steady", "java"),
                    TestAgents.validator("reviewer", "review", "PASS"))).start();

            Task task = harness.submit("auth-service", "java", "review");

            assertEquals(TaskState.COMPLETED, task.state());
            assertEquals(1, task.reassignmentCount());
            assertEquals("steady-1", task.artifact().id());
        }

        @Test
        @DisplayName("a second agent error fails the task")
        void failsAfterReassignment() {
            harness = new OrchestrationHarness(List.of(
                    TestAgents.failingProducer("flaky-1", "oom", "java"),
                    TestAgents.failingProducer("flaky-2", "oom", "java"),
                    TestAgents.validator("reviewer", "review", "PASS"))).start();

            Task task = harness.submit("auth-service", "java", "review");

            assertEquals(TaskState.FAILED, task.state());
            assertEquals(FailureReason.AGENT_ERROR, task.failureReason());
            assertTrue(task.failureDetail().startsWith("flaky-2 reported oom"));
        }

        @Test
        @DisplayName("a validator error moves validation to another validator")
        void reassignsValidator() {
            harness = new OrchestrationHarness(List.of(
                    TestAgents.producer("coder", "java"),
                    TestAgents.brokenValidator("broken", "review"),
                    TestAgents.validator("reviewer", "review", "PASS"))).start();

            Task task = harness.submit("auth-service", "java", "review");

            assertEquals(TaskState.COMPLETED, task.state());
            assertEquals("reviewer", task.validatorAgentId());
            assertEquals("reviewer", task.attemptHistory().get(0).validatorId());
        }

        @Test
        @DisplayName("without another agent the error fails the task")
        void noReplacement() {
            harness = new OrchestrationHarness(List.of(
                    TestAgents.failingProducer("flaky", "oom", "java"),
                    TestAgents.validator("reviewer", "review", "PASS"))).start();

            Task task = harness.submit("auth-service", "java", "review");

            assertEquals(TaskState.FAILED, task.state());
            assertEquals(0, task.reassignmentCount());
            assertEquals(1.0, harness.count("crosscheck.task.transitions", "state", TaskState.FAILED.name()));
        }
    }

    @Test
    @DisplayName("stopping the engine closes the bus")
    void stop() {
        harness = new OrchestrationHarness(List.of(TestAgents.producer("coder", "java"))).start();

        harness.engine.stop();

        assertFalse(harness.bus.isRunning());
        assertEquals(0, harness.bus.subscriptionCount());
    }
}
