package com.crosscheck.core.bus;

import com.crosscheck.core.message.Message;
import com.crosscheck.core.message.MessageType;

import java.util.EnumSet;
import java.util.Set;
import java.util.function.Predicate;

/**
 * Standard subscription predicates.
 * <p>
 * A message with a {@code recipient_id} is delivered only to that recipient. A message
 * addressed by role alone is broadcast to every subscriber of the role.
 */
public final class MessageFilters {

    private MessageFilters() {}

    /** Messages addressed to this agent id, or broadcast to its role. */
    public static Predicate<Message> forAgent(String agentId, String role) {
        return m -> m.recipientId() != null
                ? m.recipientId().equals(agentId)
                : role != null && role.equals(m.recipientRole());
    }

    /** Messages broadcast to a role, or addressed to a component whose id is the role name. */
    public static Predicate<Message> forRole(String role) {
        return forAgent(role, role);
    }

    public static Predicate<Message> ofType(MessageType first, MessageType... rest) {
        Set<MessageType> types = EnumSet.of(first, rest);
        return m -> types.contains(m.type());
    }

    public static Predicate<Message> forTask(String taskId) {
        return m -> taskId.equals(m.taskId());
    }
}
