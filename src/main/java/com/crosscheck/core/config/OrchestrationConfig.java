package com.crosscheck.core.config;

import com.crosscheck.core.bus.InMemoryMessageBus;
import com.crosscheck.core.bus.MessageBus;
import com.crosscheck.core.bus.RetryingPublisher;
import com.crosscheck.core.message.MessageCodec;
import com.crosscheck.core.metrics.CrosscheckMetrics;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Wires the message bus and the executors it and the agents run on.
 * The bus is created stopped; the orchestration engine starts and closes it.
 */
@Configuration
@EnableScheduling
public class OrchestrationConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean(destroyMethod = "shutdown")
    public ExecutorService deliveryExecutor(OrchestrationProperties properties) {
        return Executors.newFixedThreadPool(properties.getBus().getDeliveryThreads(), namedThreads("crosscheck-bus-"));
    }

    @Bean(destroyMethod = "shutdown")
    public ExecutorService agentExecutor(OrchestrationProperties properties) {
        return Executors.newFixedThreadPool(properties.getAgents().getThreads(), namedThreads("crosscheck-agent-"));
    }

    @Bean
    public MessageBus messageBus(@Qualifier("deliveryExecutor") ExecutorService deliveryExecutor,
                                 OrchestrationProperties properties) {
        var bus = properties.getBus();
        return new InMemoryMessageBus(deliveryExecutor, bus.getMaxDeliveryAttempts(),
                bus.getRedeliveryBackoff(), bus.getDrainTimeout());
    }

    @Bean
    public RetryingPublisher retryingPublisher(MessageBus messageBus, OrchestrationProperties properties,
                                               CrosscheckMetrics metrics) {
        var publish = properties.getPublish();
        return new RetryingPublisher(messageBus, publish.getMaxAttempts(), publish.getInitialBackoff(),
                publish.getMultiplier(), metrics);
    }

    @Bean
    public MessageCodec messageCodec() {
        return new MessageCodec();
    }

    private static ThreadFactory namedThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
