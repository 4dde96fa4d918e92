package com.crosscheck.core.bus;

import com.crosscheck.core.message.InvalidMessageException;
import com.crosscheck.core.message.Message;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;
import java.util.function.Predicate;

/**
 * In-process message bus.
 * <p>
 * Every subscription keeps one serial lane per (sender, task) key. A lane delivers its
 * messages one at a time in publish order, while different lanes run in parallel on the
 * delivery executor. A failing handler is retried in place after a backoff, which holds back
 * later messages of the same lane until the message is delivered or given up.
 */
public class InMemoryMessageBus implements MessageBus {

    private static final Logger log = LoggerFactory.getLogger(InMemoryMessageBus.class);

    private final Executor deliveryExecutor;
    private final int maxDeliveryAttempts;
    private final Duration redeliveryBackoff;
    private final Duration drainTimeout;

    private final List<SubscriptionEntry> subscriptions = new CopyOnWriteArrayList<>();
    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicInteger inFlight = new AtomicInteger();
    private final Object drainLock = new Object();

    public InMemoryMessageBus(Executor deliveryExecutor, int maxDeliveryAttempts,
                              Duration redeliveryBackoff, Duration drainTimeout) {
        if (maxDeliveryAttempts < 1) {
            throw new IllegalArgumentException("maxDeliveryAttempts must be at least 1");
        }
        this.deliveryExecutor = deliveryExecutor;
        this.maxDeliveryAttempts = maxDeliveryAttempts;
        this.redeliveryBackoff = redeliveryBackoff;
        this.drainTimeout = drainTimeout;
    }

    @Override
    public String publish(Message message) {
        if (!running.get()) {
            throw new DeliveryException("Message bus is not running, cannot publish " + message.id());
        }
        checkRouting(message);
        log.debug("Publishing {} {} for task {} from {} to {}", message.type().wireName(), message.id(),
                message.taskId(), message.senderId(),
                message.recipientId() != null ? message.recipientId() : "role:" + message.recipientRole());

        int matched = 0;
        for (SubscriptionEntry subscription : subscriptions) {
            if (subscription.active.get() && subscription.filter.test(message)) {
                matched++;
                enqueue(subscription, message);
            }
        }
        if (matched == 0) {
            log.debug("No subscriber for {} {}", message.type().wireName(), message.id());
        }
        return message.id();
    }

    @Override
    public Subscription subscribe(String subscriberId, Predicate<Message> filter, Consumer<Message> handler) {
        SubscriptionEntry entry = new SubscriptionEntry(subscriberId, filter, handler);
        subscriptions.add(entry);
        log.debug("Subscribed {}", subscriberId);
        return () -> {
            entry.active.set(false);
            subscriptions.remove(entry);
            log.debug("Unsubscribed {}", subscriberId);
        };
    }

    @Override
    public void start() {
        if (running.compareAndSet(false, true)) {
            log.info("Message bus started");
        }
    }

    @Override
    public void close() {
        if (!running.compareAndSet(true, false)) {
            return;
        }
        long deadline = System.nanoTime() + drainTimeout.toNanos();
        synchronized (drainLock) {
            while (inFlight.get() > 0) {
                long remainingMs = (deadline - System.nanoTime()) / 1_000_000;
                if (remainingMs <= 0) {
                    log.warn("Message bus closed with {} deliveries still in flight", inFlight.get());
                    break;
                }
                try {
                    drainLock.wait(remainingMs);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    log.warn("Interrupted while draining message bus");
                    break;
                }
            }
        }
        log.info("Message bus closed");
    }

    @Override
    public boolean isRunning() {
        return running.get();
    }

    /** Deliveries enqueued but not yet handled or given up. */
    public int inFlight() {
        return inFlight.get();
    }

    public int subscriptionCount() {
        return subscriptions.size();
    }

    private static void checkRouting(Message message) {
        boolean noRecipientId = message.recipientId() == null || message.recipientId().isBlank();
        boolean noRecipientRole = message.recipientRole() == null || message.recipientRole().isBlank();
        if (noRecipientId && noRecipientRole) {
            throw new InvalidMessageException("Message " + message.id() + " has no recipient");
        }
        if (message.senderId() == null || message.senderId().isBlank()) {
            throw new InvalidMessageException("Message " + message.id() + " has no sender_id");
        }
    }

    private void enqueue(SubscriptionEntry subscription, Message message) {
        inFlight.incrementAndGet();
        String key = message.orderingKey();
        while (true) {
            SerialLane lane = subscription.lanes.computeIfAbsent(key, k -> new SerialLane(subscription, k));
            if (lane.offer(message)) {
                return;
            }
        }
    }

    private void deliver(SubscriptionEntry subscription, Message message) {
        try {
            for (int attempt = 1; attempt <= maxDeliveryAttempts; attempt++) {
                if (!subscription.active.get()) {
                    log.debug("Dropping {} for unsubscribed {}", message.id(), subscription.subscriberId);
                    return;
                }
                try {
                    subscription.handler.accept(message);
                    return;
                } catch (Exception e) {
                    if (attempt == maxDeliveryAttempts) {
                        log.warn("Subscriber {} failed {} {} after {} attempts: {}", subscription.subscriberId,
                                message.type().wireName(), message.id(), attempt, e.getMessage(), e);
                        return;
                    }
                    log.debug("Subscriber {} failed {} (attempt {}), redelivering: {}",
                            subscription.subscriberId, message.id(), attempt, e.getMessage());
                    if (!backoff(attempt)) {
                        log.warn("Redelivery of {} to {} interrupted", message.id(), subscription.subscriberId);
                        return;
                    }
                }
            }
        } finally {
            if (inFlight.decrementAndGet() == 0) {
                synchronized (drainLock) {
                    drainLock.notifyAll();
                }
            }
        }
    }

    private boolean backoff(int attempt) {
        long ms = redeliveryBackoff.toMillis() * attempt;
        if (ms <= 0) {
            return true;
        }
        try {
            Thread.sleep(ms);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private static final class SubscriptionEntry {
        final String subscriberId;
        final Predicate<Message> filter;
        final Consumer<Message> handler;
        final ConcurrentHashMap<String, SerialLane> lanes = new ConcurrentHashMap<>();
        final AtomicBoolean active = new AtomicBoolean(true);

        SubscriptionEntry(String subscriberId, Predicate<Message> filter, Consumer<Message> handler) {
            this.subscriberId = subscriberId;
            this.filter = filter;
            this.handler = handler;
        }
    }

    /**
     * Queue of one (sender, task) key for one subscription. At most one drain runs at a time.
     * An idle lane retires itself from the map; an offer to a retired lane fails and the caller
     * creates a fresh one.
     */
    private final class SerialLane implements Runnable {
        private final SubscriptionEntry subscription;
        private final String key;
        private final Deque<Message> queue = new ArrayDeque<>();
        private boolean draining;
        private boolean retired;

        SerialLane(SubscriptionEntry subscription, String key) {
            this.subscription = subscription;
            this.key = key;
        }

        boolean offer(Message message) {
            boolean schedule;
            synchronized (this) {
                if (retired) {
                    return false;
                }
                queue.addLast(message);
                schedule = !draining;
                draining = true;
            }
            if (schedule) {
                try {
                    deliveryExecutor.execute(this);
                } catch (RuntimeException e) {
                    log.warn("Delivery executor rejected lane {} of {}: {}", key, subscription.subscriberId,
                            e.getMessage());
                    abandon();
                }
            }
            return true;
        }

        @Override
        public void run() {
            while (true) {
                Message next;
                synchronized (this) {
                    next = queue.pollFirst();
                    if (next == null) {
                        draining = false;
                        retired = true;
                        subscription.lanes.remove(key, this);
                        return;
                    }
                }
                deliver(subscription, next);
            }
        }

        private void abandon() {
            int dropped;
            synchronized (this) {
                dropped = queue.size();
                queue.clear();
                draining = false;
                retired = true;
                subscription.lanes.remove(key, this);
            }
            if (inFlight.addAndGet(-dropped) == 0) {
                synchronized (drainLock) {
                    drainLock.notifyAll();
                }
            }
        }
    }
}
