package com.crosscheck.core.health;

import com.crosscheck.core.agent.AgentRegistry;
import com.crosscheck.core.bus.MessageBus;
import com.crosscheck.core.model.TaskState;
import com.crosscheck.core.registry.TaskRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

@Service
public class HealthCheckService {

    private static final Logger log = LoggerFactory.getLogger(HealthCheckService.class);

    private final MessageBus messageBus;
    private final TaskRegistry taskRegistry;
    private final AgentRegistry agentRegistry;

    public HealthCheckService(
            @Autowired(required = false) MessageBus messageBus,
            @Autowired(required = false) TaskRegistry taskRegistry,
            @Autowired(required = false) AgentRegistry agentRegistry) {
        this.messageBus = messageBus;
        this.taskRegistry = taskRegistry;
        this.agentRegistry = agentRegistry;
    }

    public List<HealthStatus> checkAll() {
        var results = new ArrayList<HealthStatus>();
        results.add(checkBus());
        results.add(checkRegistry());
        results.add(checkAgents());
        return results;
    }

    private HealthStatus checkBus() {
        if (messageBus == null) {
            return new HealthStatus("bus", HealthStatus.Status.DOWN, "No message bus configured", Map.of());
        }
        if (messageBus.isRunning()) {
            return new HealthStatus("bus", HealthStatus.Status.UP, "Message bus accepting messages", Map.of());
        }
        return new HealthStatus("bus", HealthStatus.Status.DOWN, "Message bus not running", Map.of());
    }

    private HealthStatus checkRegistry() {
        if (taskRegistry == null) {
            return new HealthStatus("registry", HealthStatus.Status.DOWN, "No task registry configured", Map.of());
        }
        try {
            int active = taskRegistry.findActive().size();
            int escalated = taskRegistry.findByState(TaskState.ESCALATED).size();
            int openEscalations = taskRegistry.openEscalations().size();
            var metadata = Map.of(
                    "active", String.valueOf(active),
                    "escalated", String.valueOf(escalated),
                    "open_escalations", String.valueOf(openEscalations));
            if (openEscalations > 0) {
                return new HealthStatus("registry", HealthStatus.Status.DEGRADED,
                        openEscalations + " escalation(s) awaiting a human decision", metadata);
            }
            return new HealthStatus("registry", HealthStatus.Status.UP,
                    active + " active task(s)", metadata);
        } catch (Exception e) {
            log.warn("Registry health check failed: {}", e.getMessage());
            return new HealthStatus("registry", HealthStatus.Status.DOWN,
                    "Registry error: " + e.getMessage(), Map.of());
        }
    }

    private HealthStatus checkAgents() {
        if (agentRegistry == null || agentRegistry.agents().isEmpty()) {
            return new HealthStatus("agents", HealthStatus.Status.DEGRADED,
                    "No agents registered, tasks will stay PENDING", Map.of());
        }
        return new HealthStatus("agents", HealthStatus.Status.UP,
                agentRegistry.agents().size() + " agent(s) registered",
                Map.of("count", String.valueOf(agentRegistry.agents().size())));
    }
}
