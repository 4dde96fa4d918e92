package com.crosscheck.core.agent;

import com.crosscheck.core.config.OrchestrationProperties;
import com.crosscheck.core.registry.TaskRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Capability registry of the agents known at startup.
 * <p>
 * Each agent's capabilities are the ones it declares plus any listed for it under
 * {@code crosscheck.routing.<agent-id>}. The registry is frozen once built.
 * Selection prefers the agent with the fewest owned tasks, then registration order.
 */
@Service
public class AgentRegistry {

    private static final Logger log = LoggerFactory.getLogger(AgentRegistry.class);

    private final List<AgentProxy> agents;
    private final Map<String, Set<String>> capabilities;
    private final TaskRegistry taskRegistry;

    public AgentRegistry(@Autowired(required = false) List<AgentProxy> agents,
                         OrchestrationProperties properties,
                         TaskRegistry taskRegistry) {
        this.taskRegistry = taskRegistry;
        Map<String, AgentProxy> byId = new LinkedHashMap<>();
        Map<String, Set<String>> caps = new LinkedHashMap<>();
        for (AgentProxy agent : agents != null ? agents : List.<AgentProxy>of()) {
            if (byId.putIfAbsent(agent.agentId(), agent) != null) {
                throw new IllegalStateException("Duplicate agent id: " + agent.agentId());
            }
            Set<String> declared = new LinkedHashSet<>(agent.capabilities());
            declared.addAll(properties.getRouting().getOrDefault(agent.agentId(), List.of()));
            caps.put(agent.agentId(), Collections.unmodifiableSet(declared));
        }
        for (String routed : properties.getRouting().keySet()) {
            if (!byId.containsKey(routed)) {
                log.warn("Routing entry for unknown agent {} ignored", routed);
            }
        }
        this.agents = List.copyOf(byId.values());
        this.capabilities = Collections.unmodifiableMap(caps);
        log.info("Agent registry built with {} agents: {}", this.agents.size(), this.capabilities);
    }

    public List<AgentProxy> agents() {
        return agents;
    }

    public Optional<AgentProxy> find(String agentId) {
        return agents.stream().filter(a -> a.agentId().equals(agentId)).findFirst();
    }

    public Set<String> capabilitiesOf(String agentId) {
        return capabilities.getOrDefault(agentId, Set.of());
    }

    /**
     * Agents declaring every required capability, in registration order.
     */
    public List<AgentProxy> eligible(Collection<String> required, Collection<String> excluded) {
        List<AgentProxy> result = new ArrayList<>();
        for (AgentProxy agent : agents) {
            if (!excluded.contains(agent.agentId()) && capabilitiesOf(agent.agentId()).containsAll(required)) {
                result.add(agent);
            }
        }
        return result;
    }

    /**
     * Picks the least loaded eligible agent. Ties go to the earliest registered agent.
     */
    public Optional<AgentProxy> select(Collection<String> required, Collection<String> excluded) {
        List<AgentProxy> candidates = eligible(required, excluded);
        // min() keeps the first of equally loaded candidates
        return candidates.stream()
                .min(Comparator.comparingInt(a -> taskRegistry.countOwnedBy(a.agentId())));
    }
}
