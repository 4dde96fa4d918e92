package com.crosscheck.core.escalation;

import com.crosscheck.core.bus.MessageBus;
import com.crosscheck.core.bus.MessageBus.Subscription;
import com.crosscheck.core.bus.MessageFilters;
import com.crosscheck.core.bus.RetryingPublisher;
import com.crosscheck.core.logging.MdcContext;
import com.crosscheck.core.message.HumanApprovalRequest;
import com.crosscheck.core.message.HumanApprovalResponse;
import com.crosscheck.core.message.Message;
import com.crosscheck.core.message.MessageType;
import com.crosscheck.core.message.Roles;
import com.crosscheck.core.model.Escalation;
import com.crosscheck.core.model.Resolution;
import com.crosscheck.core.registry.AlreadyResolvedException;
import com.crosscheck.core.registry.EscalationNotFoundException;
import com.crosscheck.core.registry.TaskRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * The human-oversight participant on the bus.
 * <p>
 * Approval requests are forwarded to every {@link HumanApprovalNotifier}. Reviewer decisions
 * arriving through the REST API or CLI are checked against the open escalation and published
 * as HumanApprovalResponse messages for the {@link EscalationManager}.
 */
@Service
public class HumanApprovalGateway {

    private static final Logger log = LoggerFactory.getLogger(HumanApprovalGateway.class);

    private final MessageBus bus;
    private final RetryingPublisher publisher;
    private final TaskRegistry registry;
    private final List<HumanApprovalNotifier> notifiers;
    private Subscription subscription;

    public HumanApprovalGateway(MessageBus bus,
                                RetryingPublisher publisher,
                                TaskRegistry registry,
                                @Autowired(required = false) List<HumanApprovalNotifier> notifiers) {
        this.bus = bus;
        this.publisher = publisher;
        this.registry = registry;
        this.notifiers = notifiers != null ? List.copyOf(notifiers) : List.of();
    }

    public synchronized void attach() {
        if (subscription == null) {
            subscription = bus.subscribe(Roles.HUMAN_OVERSIGHT,
                    MessageFilters.forRole(Roles.HUMAN_OVERSIGHT)
                            .and(MessageFilters.ofType(MessageType.HUMAN_APPROVAL_REQUEST)),
                    this::onApprovalRequest);
        }
    }

    public synchronized void detach() {
        if (subscription != null) {
            subscription.unsubscribe();
            subscription = null;
        }
    }

    void onApprovalRequest(Message message) {
        HumanApprovalRequest request = message.payloadAs(HumanApprovalRequest.class);
        MdcContext.setMessage(message, Roles.HUMAN_OVERSIGHT);
        try {
            for (HumanApprovalNotifier notifier : notifiers) {
                try {
                    notifier.notify(message.taskId(), request);
                } catch (Exception e) {
                    log.warn("Notifier {} failed for escalation {}: {}", notifier.getClass().getSimpleName(),
                            request.escalationId(), e.getMessage(), e);
                }
            }
        } finally {
            MdcContext.clear();
        }
    }

    /**
     * Submits a reviewer's decision for the task's open escalation.
     *
     * @return the escalation the decision was submitted for (still OPEN until the manager applies it)
     * @throws com.crosscheck.core.registry.TaskNotFoundException if the task is unknown
     * @throws EscalationNotFoundException                        if the task was never escalated
     * @throws AlreadyResolvedException                           if no escalation is open
     */
    public Escalation submitResolution(String taskId, Resolution resolution, String reviewer, String note) {
        registry.get(taskId);
        List<Escalation> history = registry.escalationHistory(taskId);
        if (history.isEmpty()) {
            throw new EscalationNotFoundException("No escalation for task " + taskId);
        }
        Escalation open = registry.findOpenEscalation(taskId)
                .orElseThrow(() -> new AlreadyResolvedException(taskId, history.get(history.size() - 1).id()));

        log.info("Submitting {} for escalation {} of task {} by {}", resolution, open.id(), taskId, reviewer);
        publisher.publish(Message.builder(new HumanApprovalResponse(open.id(), resolution, reviewer, note))
                .from(Roles.HUMAN_OVERSIGHT, Roles.HUMAN_OVERSIGHT)
                .toRole(Roles.ESCALATION_MANAGER)
                .task(taskId)
                .build());
        return open;
    }
}
