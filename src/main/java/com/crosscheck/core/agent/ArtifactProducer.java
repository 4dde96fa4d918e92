package com.crosscheck.core.agent;

import java.util.List;
import java.util.Map;

/**
 * External collaborator that does the actual producing work behind a {@link ProducerAgent}.
 */
@FunctionalInterface
public interface ArtifactProducer {

    /**
     * @param input    task input, with accumulated feedback merged under {@code "feedback"}
     * @param feedback validator feedback of earlier attempts, oldest first
     */
    AgentResult produce(Map<String, Object> input, List<String> feedback);
}
