package com.crosscheck.core.bus;

import com.crosscheck.core.message.CancelTask;
import com.crosscheck.core.message.Message;
import com.crosscheck.core.message.MessageType;
import com.crosscheck.core.message.QueryRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class InMemoryMessageBusTest {

    private ExecutorService pool;

    @AfterEach
    void tearDown() {
        if (pool != null) {
            pool.shutdownNow();
        }
    }

    private static InMemoryMessageBus directBus(int maxAttempts) {
        InMemoryMessageBus bus = new InMemoryMessageBus(Runnable::run, maxAttempts, Duration.ZERO, Duration.ofSeconds(1));
        bus.start();
        return bus;
    }

    private static Message toRole(String sender, String role, String taskId, String query) {
        return Message.builder(new QueryRequest(query)).from(sender, "client").toRole(role).task(taskId).build();
    }

    private static Message toAgent(String sender, String agentId, String role, String taskId) {
        return Message.builder(new CancelTask("x")).from(sender, "client").toAgent(agentId).toRole(role)
                .task(taskId).build();
    }

    @Nested
    @DisplayName("routing")
    class Routing {

        @Test
        @DisplayName("refuses to publish before start")
        void notRunning() {
            var bus = new InMemoryMessageBus(Runnable::run, 1, Duration.ZERO, Duration.ofSeconds(1));

            assertThrows(DeliveryException.class, () -> bus.publish(toRole("c", "orchestrator", "T-1", "q")));
        }

        @Test
        @DisplayName("delivers role broadcasts to every subscriber of the role")
        void broadcast() {
            var bus = directBus(1);
            List<String> received = new ArrayList<>();
            bus.subscribe("v1", MessageFilters.forAgent("v1", "validator"), m -> received.add("v1"));
            bus.subscribe("v2", MessageFilters.forAgent("v2", "validator"), m -> received.add("v2"));
            bus.subscribe("p1", MessageFilters.forAgent("p1", "producer"), m -> received.add("p1"));

            bus.publish(toRole("c", "validator", "T-1", "q"));

            assertEquals(List.of("v1", "v2"), received);
        }

        @Test
        @DisplayName("a recipient id restricts delivery to that agent")
        void exactRecipient() {
            var bus = directBus(1);
            List<String> received = new ArrayList<>();
            bus.subscribe("v1", MessageFilters.forAgent("v1", "validator"), m -> received.add("v1"));
            bus.subscribe("v2", MessageFilters.forAgent("v2", "validator"), m -> received.add("v2"));

            bus.publish(toAgent("c", "v2", "validator", "T-1"));

            assertEquals(List.of("v2"), received);
        }

        @Test
        @DisplayName("type filters combine with recipient filters")
        void typeFilter() {
            var bus = directBus(1);
            AtomicInteger cancels = new AtomicInteger();
            bus.subscribe("orch", MessageFilters.forRole("orchestrator")
                    .and(MessageFilters.ofType(MessageType.CANCEL_TASK)), m -> cancels.incrementAndGet());

            bus.publish(toRole("c", "orchestrator", "T-1", "q"));
            bus.publish(toAgent("c", "orchestrator", null, "T-1"));

            assertEquals(1, cancels.get());
        }

        @Test
        @DisplayName("unsubscribed handlers receive nothing")
        void unsubscribe() {
            var bus = directBus(1);
            AtomicInteger count = new AtomicInteger();
            MessageBus.Subscription subscription = bus.subscribe("orch", MessageFilters.forRole("orchestrator"),
                    m -> count.incrementAndGet());

            bus.publish(toRole("c", "orchestrator", "T-1", "q"));
            subscription.unsubscribe();
            bus.publish(toRole("c", "orchestrator", "T-1", "q"));

            assertEquals(1, count.get());
            assertEquals(0, bus.subscriptionCount());
        }
    }

    @Nested
    @DisplayName("redelivery")
    class Redelivery {

        @Test
        @DisplayName("redelivers until the handler succeeds")
        void redeliversUntilSuccess() {
            var bus = directBus(5);
            AtomicInteger attempts = new AtomicInteger();
            bus.subscribe("flaky", MessageFilters.forRole("orchestrator"), m -> {
                if (attempts.incrementAndGet() < 3) {
                    throw new IllegalStateException("not yet");
                }
            });

            bus.publish(toRole("c", "orchestrator", "T-1", "q"));

            assertEquals(3, attempts.get());
            assertEquals(0, bus.inFlight());
        }

        @Test
        @DisplayName("gives up after the attempt cap and moves on")
        void givesUp() {
            var bus = directBus(3);
            AtomicInteger attempts = new AtomicInteger();
            bus.subscribe("broken", MessageFilters.forRole("orchestrator"), m -> {
                attempts.incrementAndGet();
                throw new IllegalStateException("always");
            });

            bus.publish(toRole("c", "orchestrator", "T-1", "q"));
            bus.publish(toRole("c", "orchestrator", "T-1", "q"));

            assertEquals(6, attempts.get());
            assertEquals(0, bus.inFlight());
        }

        @Test
        @DisplayName("a failing subscriber does not affect other subscribers")
        void isolatesSubscribers() {
            var bus = directBus(2);
            AtomicInteger healthy = new AtomicInteger();
            bus.subscribe("broken", MessageFilters.forRole("orchestrator"), m -> {
                throw new IllegalStateException("always");
            });
            bus.subscribe("healthy", MessageFilters.forRole("orchestrator"), m -> healthy.incrementAndGet());

            bus.publish(toRole("c", "orchestrator", "T-1", "q"));

            assertEquals(1, healthy.get());
        }
    }

    @Nested
    @DisplayName("ordering and concurrency")
    class Ordering {

        @Test
        @DisplayName("preserves publish order per sender and task")
        void perKeyOrder() throws Exception {
            pool = Executors.newFixedThreadPool(4);
            var bus = new InMemoryMessageBus(pool, 3, Duration.ZERO, Duration.ofSeconds(5));
            bus.start();
            int perKey = 200;
            CountDownLatch done = new CountDownLatch(perKey * 2);
            List<String> first = new CopyOnWriteArrayList<>();
            List<String> second = new CopyOnWriteArrayList<>();
            bus.subscribe("orch", MessageFilters.forRole("orchestrator"), m -> {
                String query = m.payloadAs(QueryRequest.class).query();
                (m.taskId().equals("T-1") ? first : second).add(query);
                done.countDown();
            });

            for (int i = 0; i < perKey; i++) {
                bus.publish(toRole("p1", "orchestrator", "T-1", String.valueOf(i)));
                bus.publish(toRole("p1", "orchestrator", "T-2", String.valueOf(i)));
            }

            assertTrue(done.await(10, TimeUnit.SECONDS));
            for (int i = 0; i < perKey; i++) {
                assertEquals(String.valueOf(i), first.get(i));
                assertEquals(String.valueOf(i), second.get(i));
            }
        }

        @Test
        @DisplayName("a redelivered message holds back later messages of its lane")
        void redeliveryKeepsOrder() throws Exception {
            pool = Executors.newFixedThreadPool(2);
            var bus = new InMemoryMessageBus(pool, 3, Duration.ofMillis(5), Duration.ofSeconds(5));
            bus.start();
            CountDownLatch done = new CountDownLatch(2);
            AtomicInteger failures = new AtomicInteger();
            List<String> received = new CopyOnWriteArrayList<>();
            bus.subscribe("orch", MessageFilters.forRole("orchestrator"), m -> {
                String query = m.payloadAs(QueryRequest.class).query();
                if (query.equals("first") && failures.getAndIncrement() == 0) {
                    throw new IllegalStateException("transient");
                }
                received.add(query);
                done.countDown();
            });

            bus.publish(toRole("p1", "orchestrator", "T-1", "first"));
            bus.publish(toRole("p1", "orchestrator", "T-1", "second"));

            assertTrue(done.await(5, TimeUnit.SECONDS));
            assertEquals(List.of("first", "second"), received);
        }

        @Test
        @DisplayName("close waits for in-flight deliveries and then refuses publishes")
        void closeDrains() {
            pool = Executors.newFixedThreadPool(2);
            var bus = new InMemoryMessageBus(pool, 1, Duration.ZERO, Duration.ofSeconds(5));
            bus.start();
            AtomicInteger handled = new AtomicInteger();
            bus.subscribe("slow", MessageFilters.forRole("orchestrator"), m -> {
                try {
                    Thread.sleep(100);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
                handled.incrementAndGet();
            });

            bus.publish(toRole("p1", "orchestrator", "T-1", "a"));
            bus.publish(toRole("p2", "orchestrator", "T-1", "b"));
            bus.close();

            assertEquals(2, handled.get());
            assertEquals(0, bus.inFlight());
            assertFalse(bus.isRunning());
            assertThrows(DeliveryException.class, () -> bus.publish(toRole("p1", "orchestrator", "T-1", "c")));
        }
    }
}
