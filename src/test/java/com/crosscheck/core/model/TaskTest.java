package com.crosscheck.core.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class TaskTest {

    private static ValidationAttempt attempt(int n, ValidationVerdict verdict, String feedback) {
        return new ValidationAttempt(1, n, "validator-1", verdict, feedback, Instant.EPOCH);
    }

    @Test
    @DisplayName("builder defaults to PENDING, round 1 and three retries")
    void builderDefaults() {
        Task task = Task.builder().id("T-1").componentId("auth").build();

        assertEquals(TaskState.PENDING, task.state());
        assertEquals(1, task.round());
        assertEquals(3, task.maxRetries());
        assertEquals(0, task.retryCount());
        assertEquals(1, task.currentAttemptNumber());
        assertTrue(task.attemptHistory().isEmpty());
        assertTrue(task.input().isEmpty());
    }

    @Test
    @DisplayName("failureFeedback lists failed attempts oldest first")
    void failureFeedback() {
        Task task = Task.builder().id("T-1")
                .appendAttempt(attempt(1, ValidationVerdict.FAIL, "missing tests"))
                .appendAttempt(attempt(2, ValidationVerdict.FAIL, "no error handling"))
                .appendAttempt(attempt(3, ValidationVerdict.PASS, "looks good"))
                .build();

        assertEquals(List.of("missing tests", "no error handling"), task.failureFeedback());
    }

    @Test
    @DisplayName("snapshots are immutable")
    void immutable() {
        Task task = Task.builder().id("T-1")
                .requiredCapabilities(Set.of("java"))
                .input(Map.of("spec", "x"))
                .appendAttempt(attempt(1, ValidationVerdict.FAIL, "bad"))
                .build();

        assertThrows(UnsupportedOperationException.class, () -> task.attemptHistory().add(attempt(2, ValidationVerdict.PASS, "")));
        assertThrows(UnsupportedOperationException.class, () -> task.input().put("k", "v"));
        assertThrows(UnsupportedOperationException.class, () -> task.requiredCapabilities().add("go"));
    }

    @Test
    @DisplayName("toBuilder copies every field and leaves the original untouched")
    void toBuilder() {
        Task original = Task.builder().id("T-1").componentId("auth").ownerAgentId("p1").retryCount(2).build();
        Task changed = original.toBuilder().retryCount(0).round(2)
                .appendAttempt(attempt(1, ValidationVerdict.FAIL, "x")).build();

        assertEquals("auth", changed.componentId());
        assertEquals("p1", changed.ownerAgentId());
        assertEquals(2, changed.round());
        assertEquals(2, original.retryCount());
        assertTrue(original.attemptHistory().isEmpty());
        assertEquals(1, changed.attemptHistory().size());
    }

    @Test
    @DisplayName("resolving an escalation keeps its identity and context")
    void escalationResolve() {
        Escalation open = Escalation.open("E-1", "T-1", EscalationReason.REPEATED_SAME_FAILURE, 3, "p1",
                List.of(attempt(1, ValidationVerdict.FAIL, "x")), "retry", Instant.EPOCH);
        assertTrue(open.isOpen());

        Escalation resolved = open.resolve(Resolution.ABORT, "alice", "not worth it", Instant.EPOCH.plusSeconds(5));

        assertFalse(resolved.isOpen());
        assertEquals(EscalationStatus.RESOLVED, resolved.status());
        assertEquals("E-1", resolved.id());
        assertEquals(Resolution.ABORT, resolved.resolution());
        assertEquals("alice", resolved.resolvedBy());
        assertEquals(1, resolved.context().size());
        assertEquals(TaskState.FAILED, resolved.resolution().targetState());
    }
}
