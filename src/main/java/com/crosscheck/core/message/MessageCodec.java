package com.crosscheck.core.message;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.time.Instant;
import java.time.format.DateTimeParseException;

/**
 * Converts messages to and from the JSON wire shape:
 * <pre>
 * { id, type, sender_id, sender_role, recipient_id, recipient_role, task_id, payload, created_at }
 * </pre>
 * {@code type} uses the snake_case wire name, and payload fields are snake_case too.
 */
public class MessageCodec {

    private final ObjectMapper objectMapper;

    public MessageCodec() {
        this.objectMapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE)
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    public String encode(Message message) {
        ObjectNode root = objectMapper.createObjectNode();
        root.put("id", message.id());
        root.put("type", message.type().wireName());
        root.put("sender_id", message.senderId());
        root.put("sender_role", message.senderRole());
        root.put("recipient_id", message.recipientId());
        root.put("recipient_role", message.recipientRole());
        root.put("task_id", message.taskId());
        root.set("payload", objectMapper.valueToTree(message.payload()));
        root.put("created_at", message.createdAt().toString());
        try {
            return objectMapper.writeValueAsString(root);
        } catch (JsonProcessingException e) {
            throw new InvalidMessageException("Cannot encode message " + message.id(), e);
        }
    }

    /**
     * @throws InvalidMessageException if the JSON is malformed, the type is unknown or the
     *                                 envelope fails validation
     */
    public Message decode(String json) {
        JsonNode root;
        try {
            root = objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new InvalidMessageException("Malformed message JSON: " + e.getOriginalMessage(), e);
        }
        if (root == null || !root.isObject()) {
            throw new InvalidMessageException("Message JSON must be an object");
        }
        MessageType type = MessageType.fromWireName(text(root, "type"));
        MessagePayload payload;
        try {
            JsonNode payloadNode = root.get("payload");
            if (payloadNode == null || payloadNode.isNull()) {
                throw new InvalidMessageException("Message payload is required");
            }
            payload = objectMapper.treeToValue(payloadNode, type.payloadType());
        } catch (JsonProcessingException e) {
            throw new InvalidMessageException("Invalid " + type.wireName() + " payload: "
                    + e.getOriginalMessage(), e);
        }
        return new Message(
                text(root, "id"),
                type,
                text(root, "sender_id"),
                text(root, "sender_role"),
                text(root, "recipient_id"),
                text(root, "recipient_role"),
                text(root, "task_id"),
                payload,
                parseInstant(text(root, "created_at")));
    }

    private static Instant parseInstant(String value) {
        if (value == null) {
            return null;
        }
        try {
            return Instant.parse(value);
        } catch (DateTimeParseException e) {
            throw new InvalidMessageException("Invalid created_at: " + value, e);
        }
    }

    private static String text(JsonNode root, String field) {
        JsonNode node = root.get(field);
        return node == null || node.isNull() ? null : node.asText();
    }
}
