package com.crosscheck.core.agent;

import com.crosscheck.core.bus.IdempotentHandler;
import com.crosscheck.core.bus.MessageBus;
import com.crosscheck.core.bus.MessageBus.Subscription;
import com.crosscheck.core.bus.MessageFilters;
import com.crosscheck.core.config.OrchestrationProperties;
import com.crosscheck.core.message.Message;
import com.crosscheck.core.message.MessageType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * Connects every registered agent to the bus. Assignments and validation requests addressed to
 * an agent are handed to the agent executor, so a slow agent never holds a delivery thread.
 */
@Service
public class AgentDispatcher {

    private static final Logger log = LoggerFactory.getLogger(AgentDispatcher.class);

    private final MessageBus bus;
    private final AgentRegistry agentRegistry;
    private final AgentInvocationInterceptor interceptor;
    private final Executor agentExecutor;
    private final int dedupWindow;
    private final List<Subscription> subscriptions = new ArrayList<>();

    public AgentDispatcher(MessageBus bus,
                           AgentRegistry agentRegistry,
                           AgentInvocationInterceptor interceptor,
                           @Qualifier("agentExecutor") Executor agentExecutor,
                           OrchestrationProperties properties) {
        this.bus = bus;
        this.agentRegistry = agentRegistry;
        this.interceptor = interceptor;
        this.agentExecutor = agentExecutor;
        this.dedupWindow = properties.getBus().getDedupWindow();
    }

    public synchronized void attach() {
        if (!subscriptions.isEmpty()) {
            return;
        }
        for (AgentProxy agent : agentRegistry.agents()) {
            var handler = new IdempotentHandler(message -> dispatch(agent, message), dedupWindow);
            subscriptions.add(bus.subscribe(agent.agentId(),
                    MessageFilters.forAgent(agent.agentId(), agent.role())
                            .and(MessageFilters.ofType(MessageType.TASK_ASSIGNMENT, MessageType.VALIDATION_REQUEST)),
                    handler));
        }
        log.info("Attached {} agents to the message bus", subscriptions.size());
    }

    public synchronized void detach() {
        subscriptions.forEach(Subscription::unsubscribe);
        subscriptions.clear();
    }

    private void dispatch(AgentProxy agent, Message message) {
        log.debug("Dispatching {} for task {} to {}", message.type().wireName(), message.taskId(), agent.agentId());
        CompletableFuture.runAsync(() -> {
            if (message.type() == MessageType.TASK_ASSIGNMENT) {
                interceptor.invokeAssignment(agent, message);
            } else {
                interceptor.invokeValidation(agent, message);
            }
        }, agentExecutor).exceptionally(e -> {
            log.warn("Invocation of {} for task {} failed to start: {}", agent.agentId(), message.taskId(),
                    e.getMessage());
            return null;
        });
    }
}
