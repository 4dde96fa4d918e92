package com.crosscheck.core.escalation;

import com.crosscheck.core.message.HumanApprovalRequest;

/**
 * Delivers human-approval requests to reviewers. Resolutions come back through
 * {@link HumanApprovalGateway#submitResolution}.
 */
public interface HumanApprovalNotifier {

    void notify(String taskId, HumanApprovalRequest request);
}
