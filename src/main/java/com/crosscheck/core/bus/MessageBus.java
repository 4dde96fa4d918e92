package com.crosscheck.core.bus;

import com.crosscheck.core.message.Message;

import java.util.function.Consumer;
import java.util.function.Predicate;

/**
 * Ordered, at-least-once delivery channel between orchestration components and agents.
 * <p>
 * Ordering is guaranteed only between messages with the same sender and task. A handler that
 * throws has the message redelivered, so handlers must be idempotent on the message id.
 */
public interface MessageBus {

    /**
     * Publishes a message to every subscription whose filter accepts it.
     *
     * @return the message id
     * @throws DeliveryException if the bus is not running
     */
    String publish(Message message);

    /**
     * Registers a handler for the messages accepted by {@code filter}.
     *
     * @param subscriberId name used in logs
     */
    Subscription subscribe(String subscriberId, Predicate<Message> filter, Consumer<Message> handler);

    void start();

    /**
     * Stops accepting publishes and waits for in-flight deliveries to drain.
     */
    void close();

    boolean isRunning();

    /**
     * Handle for cancelling a subscription.
     */
    @FunctionalInterface
    interface Subscription {
        void unsubscribe();
    }
}
