package com.crosscheck.core.logging;

import com.crosscheck.core.message.Message;
import org.slf4j.MDC;

/**
 * Utility for managing Crosscheck-specific MDC keys for structured logging.
 */
public final class MdcContext {

    private MdcContext() {}

    public static void setTask(String taskId) {
        MDC.put("taskId", taskId);
    }

    public static void setAgent(String agentId) {
        MDC.put("agentId", agentId);
    }

    /**
     * Puts the task, the handling agent and the message type of a delivery into the MDC.
     */
    public static void setMessage(Message message, String handlerId) {
        MDC.put("taskId", message.taskId());
        MDC.put("agentId", handlerId);
        MDC.put("messageType", message.type().wireName());
    }

    public static void clear() {
        MDC.remove("taskId");
        MDC.remove("agentId");
        MDC.remove("messageType");
    }
}
