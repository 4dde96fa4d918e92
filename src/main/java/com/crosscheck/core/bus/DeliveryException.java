package com.crosscheck.core.bus;

/**
 * Thrown by {@link MessageBus#publish} when the bus cannot accept a message.
 * Callers are expected to retry with backoff, see {@link RetryingPublisher}.
 */
public class DeliveryException extends RuntimeException {

    public DeliveryException(String message) {
        super(message);
    }

    public DeliveryException(String message, Throwable cause) {
        super(message, cause);
    }
}
