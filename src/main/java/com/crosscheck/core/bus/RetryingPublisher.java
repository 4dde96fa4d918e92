package com.crosscheck.core.bus;

import com.crosscheck.core.message.Message;
import com.crosscheck.core.metrics.CrosscheckMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;

/**
 * Publishes through a {@link MessageBus}, retrying {@link DeliveryException} with exponential backoff.
 * After the last attempt the exception is rethrown; a message is never dropped silently.
 */
public class RetryingPublisher {

    private static final Logger log = LoggerFactory.getLogger(RetryingPublisher.class);

    private final MessageBus bus;
    private final int maxAttempts;
    private final Duration initialBackoff;
    private final double multiplier;
    private final CrosscheckMetrics metrics;
    private final Sleeper sleeper;

    public RetryingPublisher(MessageBus bus, int maxAttempts, Duration initialBackoff, double multiplier,
                             CrosscheckMetrics metrics) {
        this(bus, maxAttempts, initialBackoff, multiplier, metrics, Thread::sleep);
    }

    RetryingPublisher(MessageBus bus, int maxAttempts, Duration initialBackoff, double multiplier,
                      CrosscheckMetrics metrics, Sleeper sleeper) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1");
        }
        this.bus = bus;
        this.maxAttempts = maxAttempts;
        this.initialBackoff = initialBackoff;
        this.multiplier = multiplier;
        this.metrics = metrics;
        this.sleeper = sleeper;
    }

    /**
     * @return the message id
     * @throws DeliveryException when every attempt failed
     */
    public String publish(Message message) {
        long backoffMs = initialBackoff.toMillis();
        for (int attempt = 1; ; attempt++) {
            try {
                return bus.publish(message);
            } catch (DeliveryException e) {
                if (attempt >= maxAttempts) {
                    log.warn("Giving up publishing {} {} after {} attempts: {}",
                            message.type().wireName(), message.id(), attempt, e.getMessage());
                    throw e;
                }
                log.debug("Publish of {} failed (attempt {}), retrying in {}ms", message.id(), attempt, backoffMs);
                if (metrics != null) {
                    metrics.recordPublishRetry();
                }
                try {
                    sleeper.sleep(backoffMs);
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    throw new DeliveryException("Interrupted while retrying publish of " + message.id(), ie);
                }
                backoffMs = (long) (backoffMs * multiplier);
            }
        }
    }

    public MessageBus bus() {
        return bus;
    }

    @FunctionalInterface
    interface Sleeper {
        void sleep(long millis) throws InterruptedException;
    }
}
