package com.crosscheck.core.message;

import java.util.Arrays;

/**
 * Tagged message variants with their wire names and payload types.
 */
public enum MessageType {
    TASK_ASSIGNMENT("task_assignment", TaskAssignment.class),
    TASK_COMPLETION("task_completion", TaskCompletion.class),
    VALIDATION_REQUEST("validation_request", ValidationRequest.class),
    VALIDATION_RESULT("validation_result", ValidationResult.class),
    ESCALATION_REQUEST("escalation_request", EscalationRequest.class),
    QUERY_REQUEST("query_request", QueryRequest.class),
    QUERY_RESPONSE("query_response", QueryResponse.class),
    STATE_UPDATE("state_update", StateUpdate.class),
    ERROR_REPORT("error_report", ErrorReport.class),
    HUMAN_APPROVAL_REQUEST("human_approval_request", HumanApprovalRequest.class),
    HUMAN_APPROVAL_RESPONSE("human_approval_response", HumanApprovalResponse.class),
    CANCEL_TASK("cancel_task", CancelTask.class);

    private final String wireName;
    private final Class<? extends MessagePayload> payloadType;

    MessageType(String wireName, Class<? extends MessagePayload> payloadType) {
        this.wireName = wireName;
        this.payloadType = payloadType;
    }

    public String wireName() {
        return wireName;
    }

    public Class<? extends MessagePayload> payloadType() {
        return payloadType;
    }

    public static MessageType fromWireName(String wireName) {
        return Arrays.stream(values())
                .filter(t -> t.wireName.equals(wireName))
                .findFirst()
                .orElseThrow(() -> new InvalidMessageException("Unknown message type: " + wireName));
    }

    public static MessageType forPayload(MessagePayload payload) {
        if (payload == null) {
            throw new InvalidMessageException("Message payload is required");
        }
        return Arrays.stream(values())
                .filter(t -> t.payloadType == payload.getClass())
                .findFirst()
                .orElseThrow(() -> new InvalidMessageException(
                        "No message type for payload " + payload.getClass().getSimpleName()));
    }
}
