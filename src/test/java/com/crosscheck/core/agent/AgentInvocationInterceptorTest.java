package com.crosscheck.core.agent;

import com.crosscheck.core.bus.DeliveryException;
import com.crosscheck.core.bus.RetryingPublisher;
import com.crosscheck.core.message.ErrorReport;
import com.crosscheck.core.message.Message;
import com.crosscheck.core.message.MessageType;
import com.crosscheck.core.message.Roles;
import com.crosscheck.core.message.StateUpdate;
import com.crosscheck.core.message.TaskAssignment;
import com.crosscheck.core.message.TaskCompletion;
import com.crosscheck.core.message.ValidationRequest;
import com.crosscheck.core.message.ValidationResult;
import com.crosscheck.core.metrics.CrosscheckMetrics;
import com.crosscheck.core.model.Artifact;
import com.crosscheck.core.model.TaskState;
import com.crosscheck.core.model.ValidationVerdict;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class AgentInvocationInterceptorTest {

    private RetryingPublisher publisher;
    private SimpleMeterRegistry meterRegistry;
    private AgentInvocationInterceptor interceptor;

    @BeforeEach
    void setUp() {
        publisher = mock(RetryingPublisher.class);
        meterRegistry = new SimpleMeterRegistry();
        interceptor = new AgentInvocationInterceptor(publisher, new CrosscheckMetrics(meterRegistry));
    }

    private List<Message> published(int expected) {
        ArgumentCaptor<Message> captor = ArgumentCaptor.forClass(Message.class);
        verify(publisher, times(expected)).publish(captor.capture());
        return captor.getAllValues();
    }

    private static Message assignment(String agentId) {
        return Message.builder(new TaskAssignment(1, 2, "auth", Map.of(), List.of("has tests"), List.of("no tests")))
                .from(Roles.ORCHESTRATOR, Roles.ORCHESTRATOR).toAgent(agentId).task("T-1").build();
    }

    private static Message validationRequest(String agentId) {
        return Message.builder(new ValidationRequest(1, 2, "auth", new Artifact("a", "p1", "src", "x", null),
                        List.of("has tests"), List.of()))
                .from(Roles.VALIDATION_LOOP, Roles.VALIDATION_LOOP).toAgent(agentId).task("T-1").build();
    }

    @Nested
    @DisplayName("task assignments")
    class Assignments {

        @Test
        @DisplayName("publishes a start notice, progress and the completion")
        void success() {
            Artifact artifact = new Artifact("a-1", "p1", "source", "code", null);
            AgentProxy agent = new ProducerAgent("p1", "producer", Set.of("java"),
                    (input, feedback) -> AgentResult.success(artifact));

            interceptor.invokeAssignment(agent, assignment("p1")).join();

            List<Message> messages = published(3);
            assertEquals(MessageType.STATE_UPDATE, messages.get(0).type());
            assertEquals(TaskState.IN_PROGRESS, messages.get(0).payloadAs(StateUpdate.class).reportedState());
            assertEquals(Roles.ORCHESTRATOR, messages.get(0).recipientRole());
            assertEquals(MessageType.STATE_UPDATE, messages.get(1).type());

            Message completion = messages.get(2);
            assertEquals(MessageType.TASK_COMPLETION, completion.type());
            assertEquals(Roles.VALIDATION_LOOP, completion.recipientRole());
            assertEquals("p1", completion.senderId());
            assertEquals("producer", completion.senderRole());
            TaskCompletion payload = completion.payloadAs(TaskCompletion.class);
            assertEquals(1, payload.round());
            assertEquals(2, payload.attemptNumber());
            assertEquals(artifact, payload.artifact());
            assertNotNull(meterRegistry.find("crosscheck.agent.invocation")
                    .tag("agent", "p1").tag("outcome", "success").timer());
        }

        @Test
        @DisplayName("turns an agent failure into an error report")
        void agentFailure() {
            AgentProxy agent = new ProducerAgent("p1", "producer", Set.of("java"),
                    (input, feedback) -> AgentResult.failure("compile_error", "does not compile"));

            interceptor.invokeAssignment(agent, assignment("p1")).join();

            Message report = published(3).get(2);
            assertEquals(MessageType.ERROR_REPORT, report.type());
            assertEquals(Roles.ORCHESTRATOR, report.recipientRole());
            assertEquals("compile_error", report.payloadAs(ErrorReport.class).code());
        }

        @Test
        @DisplayName("turns a thrown exception into an error report")
        void agentThrows() {
            AgentProxy agent = mock(AgentProxy.class);
            when(agent.agentId()).thenReturn("p1");
            when(agent.role()).thenReturn("producer");
            when(agent.handleTaskAssignment(any(), any(), any())).thenThrow(new IllegalStateException("crashed"));

            interceptor.invokeAssignment(agent, assignment("p1")).join();

            List<Message> messages = published(2);
            ErrorReport report = messages.get(1).payloadAs(ErrorReport.class);
            assertEquals("exception", report.code());
            assertTrue(report.message().contains("crashed"));
            assertEquals(2, report.attemptNumber());
        }

        @Test
        @DisplayName("a bus outage is logged, not thrown")
        void publishFailure() {
            when(publisher.publish(any())).thenThrow(new DeliveryException("down"));
            AgentProxy agent = new ProducerAgent("p1", "producer", Set.of("java"),
                    (input, feedback) -> AgentResult.success(new Artifact("a", "p1", "src", "x", null)));

            assertDoesNotThrow(() -> interceptor.invokeAssignment(agent, assignment("p1")).join());
        }
    }

    @Nested
    @DisplayName("validation requests")
    class Validations {

        @Test
        @DisplayName("publishes the verdict to the validation loop")
        void verdict() {
            AgentProxy agent = new ValidatorAgent("v1", "validator", Set.of("review"),
                    (artifact, criteria) -> new ValidatorJudgment.Judgment(false, "no tests"));

            interceptor.invokeValidation(agent, validationRequest("v1")).join();

            Message message = published(1).get(0);
            assertEquals(MessageType.VALIDATION_RESULT, message.type());
            assertEquals(Roles.VALIDATION_LOOP, message.recipientRole());
            ValidationResult result = message.payloadAs(ValidationResult.class);
            assertEquals(ValidationVerdict.FAIL, result.verdict());
            assertEquals("no tests", result.feedback());
            assertEquals(2, result.attemptNumber());
        }

        @Test
        @DisplayName("a throwing validator yields a validator_error report")
        void validatorThrows() {
            AgentProxy agent = new ValidatorAgent("v1", "validator", Set.of("review"), (artifact, criteria) -> {
                throw new IllegalStateException("model offline");
            });

            interceptor.invokeValidation(agent, validationRequest("v1")).join();

            Message message = published(1).get(0);
            assertEquals(MessageType.ERROR_REPORT, message.type());
            assertEquals("validator_error", message.payloadAs(ErrorReport.class).code());
        }

        @Test
        @DisplayName("a missing verdict yields a validator_error report")
        void noVerdict() {
            AgentProxy agent = mock(AgentProxy.class);
            when(agent.agentId()).thenReturn("v1");
            when(agent.role()).thenReturn("validator");
            when(agent.handleValidationRequest(any(), any()))
                    .thenReturn(CompletableFuture.completedFuture(new ValidationOutcome(null, "?")));

            interceptor.invokeValidation(agent, validationRequest("v1")).join();

            assertEquals("validator_error", published(1).get(0).payloadAs(ErrorReport.class).code());
        }
    }
}
