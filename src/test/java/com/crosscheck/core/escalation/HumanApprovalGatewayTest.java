package com.crosscheck.core.escalation;

import com.crosscheck.core.bus.MessageBus;
import com.crosscheck.core.bus.RetryingPublisher;
import com.crosscheck.core.message.HumanApprovalRequest;
import com.crosscheck.core.message.HumanApprovalResponse;
import com.crosscheck.core.message.Message;
import com.crosscheck.core.message.MessageType;
import com.crosscheck.core.message.Roles;
import com.crosscheck.core.model.Escalation;
import com.crosscheck.core.model.EscalationReason;
import com.crosscheck.core.model.Resolution;
import com.crosscheck.core.model.Task;
import com.crosscheck.core.registry.AlreadyResolvedException;
import com.crosscheck.core.registry.EscalationNotFoundException;
import com.crosscheck.core.registry.InMemoryTaskRegistry;
import com.crosscheck.core.registry.TaskNotFoundException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class HumanApprovalGatewayTest {

    private InMemoryTaskRegistry registry;
    private RetryingPublisher publisher;

    @BeforeEach
    void setUp() {
        registry = new InMemoryTaskRegistry(Clock.systemUTC(), null);
        publisher = mock(RetryingPublisher.class);
        registry.create(Task.builder().id("T-1").componentId("auth").build());
    }

    private Escalation openEscalation() {
        return registry.openEscalation(Escalation.open("E-1", "T-1", EscalationReason.DIVERGENT_FAILURE, 3, "p1",
                List.of(), "review the criteria", Instant.now()));
    }

    private static Message approvalRequest() {
        return Message.builder(new HumanApprovalRequest("E-1", EscalationReason.DIVERGENT_FAILURE, 3, "no_tests",
                        "review", List.of(Resolution.values()), List.of()))
                .from(Roles.ESCALATION_MANAGER, Roles.ESCALATION_MANAGER).toRole(Roles.HUMAN_OVERSIGHT)
                .task("T-1").build();
    }

    @Test
    @DisplayName("forwards approval requests to every notifier, even when one fails")
    void notifies() {
        List<String> notified = new ArrayList<>();
        HumanApprovalNotifier failing = (taskId, request) -> {
            throw new IllegalStateException("pager down");
        };
        HumanApprovalNotifier recording = (taskId, request) -> notified.add(taskId + ":" + request.escalationId());
        var gateway = new HumanApprovalGateway(mock(MessageBus.class), publisher, registry, List.of(failing, recording));

        gateway.onApprovalRequest(approvalRequest());

        assertEquals(List.of("T-1:E-1"), notified);
    }

    @Test
    @DisplayName("publishes the reviewer's decision for the open escalation")
    void submitsResolution() {
        openEscalation();
        var gateway = new HumanApprovalGateway(mock(MessageBus.class), publisher, registry, null);

        Escalation target = gateway.submitResolution("T-1", Resolution.RETRY_RESET, "alice", "try again");

        assertEquals("E-1", target.id());
        ArgumentCaptor<Message> captor = ArgumentCaptor.forClass(Message.class);
        verify(publisher).publish(captor.capture());
        Message message = captor.getValue();
        assertEquals(MessageType.HUMAN_APPROVAL_RESPONSE, message.type());
        assertEquals(Roles.ESCALATION_MANAGER, message.recipientRole());
        HumanApprovalResponse response = message.payloadAs(HumanApprovalResponse.class);
        assertEquals("E-1", response.escalationId());
        assertEquals(Resolution.RETRY_RESET, response.resolution());
        assertEquals("alice", response.reviewer());
    }

    @Test
    @DisplayName("rejects decisions without an open escalation")
    void rejects() {
        var gateway = new HumanApprovalGateway(mock(MessageBus.class), publisher, registry, List.of());

        assertThrows(TaskNotFoundException.class,
                () -> gateway.submitResolution("T-unknown", Resolution.ABORT, "alice", null));
        assertThrows(EscalationNotFoundException.class,
                () -> gateway.submitResolution("T-1", Resolution.ABORT, "alice", null));

        openEscalation();
        registry.resolveEscalation("T-1", "E-1", Resolution.ABORT, "bob", null);
        assertThrows(AlreadyResolvedException.class,
                () -> gateway.submitResolution("T-1", Resolution.ABORT, "alice", null));
        verify(publisher, never()).publish(any());
    }
}
