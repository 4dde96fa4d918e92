package com.crosscheck.core.message;

import java.time.Instant;
import java.util.UUID;

/**
 * Immutable envelope exchanged on the message bus.
 * <p>
 * The constructor rejects envelopes whose payload does not match {@code type}, that have no
 * recipient, or that carry no task correlation key. The bus never looks inside the payload.
 *
 * @param id            unique message id, the idempotency key for handlers
 * @param type          tagged variant
 * @param senderId      sending agent or component id
 * @param senderRole    sending role
 * @param recipientId   exact recipient (nullable when addressed by role)
 * @param recipientRole broadcast role (nullable when addressed by id)
 * @param taskId        correlation key
 * @param payload       typed payload for {@code type}
 * @param createdAt     creation time
 */
public record Message(
    String id,
    MessageType type,
    String senderId,
    String senderRole,
    String recipientId,
    String recipientRole,
    String taskId,
    MessagePayload payload,
    Instant createdAt
) {

    public Message {
        if (id == null || id.isBlank()) {
            throw new InvalidMessageException("Message id is required");
        }
        if (type == null) {
            throw new InvalidMessageException("Message type is required");
        }
        if (payload == null || !type.payloadType().isInstance(payload)) {
            throw new InvalidMessageException("Payload of message " + id + " does not match type "
                    + type.wireName());
        }
        if (isBlank(recipientId) && isBlank(recipientRole)) {
            throw new InvalidMessageException("Message " + id + " has neither recipient_id nor recipient_role");
        }
        if (isBlank(taskId)) {
            throw new InvalidMessageException("Message " + id + " has no task_id");
        }
        if (createdAt == null) {
            createdAt = Instant.now();
        }
    }

    /** Ordering key: delivery is ordered per sender and task. */
    public String orderingKey() {
        return senderId + "|" + taskId;
    }

    /**
     * Typed view of the payload.
     *
     * @throws InvalidMessageException if the payload is not of the requested type
     */
    public <P extends MessagePayload> P payloadAs(Class<P> payloadType) {
        if (!payloadType.isInstance(payload)) {
            throw new InvalidMessageException("Message " + id + " of type " + type.wireName()
                    + " does not carry " + payloadType.getSimpleName());
        }
        return payloadType.cast(payload);
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }

    public static Builder builder(MessagePayload payload) {
        return new Builder(payload);
    }

    public static final class Builder {
        private final MessagePayload payload;
        private String id;
        private String senderId;
        private String senderRole;
        private String recipientId;
        private String recipientRole;
        private String taskId;
        private Instant createdAt;

        private Builder(MessagePayload payload) {
            this.payload = payload;
        }

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder from(String senderId, String senderRole) {
            this.senderId = senderId;
            this.senderRole = senderRole;
            return this;
        }

        public Builder toAgent(String recipientId) {
            this.recipientId = recipientId;
            return this;
        }

        public Builder toRole(String recipientRole) {
            this.recipientRole = recipientRole;
            return this;
        }

        public Builder task(String taskId) {
            this.taskId = taskId;
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public Message build() {
            return new Message(
                    id != null ? id : UUID.randomUUID().toString(),
                    MessageType.forPayload(payload),
                    senderId, senderRole, recipientId, recipientRole, taskId, payload,
                    createdAt != null ? createdAt : Instant.now());
        }
    }
}
