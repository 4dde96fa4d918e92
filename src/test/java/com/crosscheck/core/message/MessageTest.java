package com.crosscheck.core.message;

import com.crosscheck.core.model.Task;
import com.crosscheck.core.model.ValidationAttempt;
import com.crosscheck.core.model.ValidationVerdict;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class MessageTest {

    @Nested
    @DisplayName("envelope validation")
    class Validation {

        @Test
        @DisplayName("builder infers the type from the payload")
        void infersType() {
            Message message = Message.builder(new CancelTask("stop"))
                    .from("client", "client").toRole(Roles.ORCHESTRATOR).task("T-1").build();

            assertEquals(MessageType.CANCEL_TASK, message.type());
            assertNotNull(message.id());
            assertNotNull(message.createdAt());
        }

        @Test
        @DisplayName("rejects a payload that does not match the type")
        void rejectsMismatchedPayload() {
            assertThrows(InvalidMessageException.class, () -> new Message("m-1", MessageType.TASK_COMPLETION,
                    "p1", "producer", null, Roles.VALIDATION_LOOP, "T-1", new CancelTask("x"), Instant.now()));
        }

        @Test
        @DisplayName("rejects a message without recipient")
        void rejectsMissingRecipient() {
            assertThrows(InvalidMessageException.class, () -> Message.builder(new CancelTask("x"))
                    .from("client", "client").task("T-1").build());
        }

        @Test
        @DisplayName("rejects a message without task id")
        void rejectsMissingTask() {
            assertThrows(InvalidMessageException.class, () -> Message.builder(new CancelTask("x"))
                    .from("client", "client").toRole(Roles.ORCHESTRATOR).build());
        }
    }

    @Test
    @DisplayName("ordering key combines sender and task")
    void orderingKey() {
        Message message = Message.builder(new QueryRequest("status"))
                .from("agent-7", "producer").toRole(Roles.ORCHESTRATOR).task("T-9").build();

        assertEquals("agent-7|T-9", message.orderingKey());
    }

    @Test
    @DisplayName("payloadAs rejects the wrong payload type")
    void payloadAs() {
        Message message = Message.builder(new QueryRequest("status"))
                .from("agent-7", "producer").toRole(Roles.ORCHESTRATOR).task("T-9").build();

        assertEquals("status", message.payloadAs(QueryRequest.class).query());
        assertThrows(InvalidMessageException.class, () -> message.payloadAs(CancelTask.class));
    }

    @Test
    @DisplayName("wire names resolve back to their types")
    void wireNames() {
        for (MessageType type : MessageType.values()) {
            assertEquals(type, MessageType.fromWireName(type.wireName()));
        }
        assertThrows(InvalidMessageException.class, () -> MessageType.fromWireName("telepathy"));
    }

    @Test
    @DisplayName("assignment merges accumulated feedback into the input")
    void assignmentCarriesFeedback() {
        Task task = Task.builder().id("T-1").componentId("auth").round(2).retryCount(1)
                .input(Map.of("spec", "login form"))
                .appendAttempt(new ValidationAttempt(2, 1, "v1", ValidationVerdict.FAIL, "no tests", Instant.EPOCH))
                .build();

        TaskAssignment assignment = TaskMessages.assignment(task);

        assertEquals(2, assignment.round());
        assertEquals(2, assignment.attemptNumber());
        assertEquals(List.of("no tests"), assignment.feedback());
        assertEquals("login form", assignment.input().get("spec"));
        assertEquals(List.of("no tests"), assignment.input().get(TaskMessages.FEEDBACK_KEY));
    }

    @Test
    @DisplayName("first assignment carries the input unchanged")
    void firstAssignment() {
        Task task = Task.builder().id("T-1").componentId("auth").input(Map.of("spec", "x")).build();

        TaskAssignment assignment = TaskMessages.assignment(task);

        assertEquals(1, assignment.attemptNumber());
        assertEquals(Map.of("spec", "x"), assignment.input());
        assertTrue(assignment.feedback().isEmpty());
    }
}
