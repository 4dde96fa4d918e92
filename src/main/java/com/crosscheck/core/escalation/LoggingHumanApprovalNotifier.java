package com.crosscheck.core.escalation;

import com.crosscheck.core.message.HumanApprovalRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Default notifier: writes the request to the log, where operators pick it up.
 */
@Component
public class LoggingHumanApprovalNotifier implements HumanApprovalNotifier {

    private static final Logger log = LoggerFactory.getLogger(LoggingHumanApprovalNotifier.class);

    @Override
    public void notify(String taskId, HumanApprovalRequest request) {
        log.warn("Human approval needed for task {} (escalation {}, {} after {} rejections, most common: {}). {} "
                        + "Resolve with one of {}",
                taskId, request.escalationId(), request.classification().wireName(), request.rejectionCount(),
                request.mostCommonReason(), request.recommendation(), request.options());
    }
}
