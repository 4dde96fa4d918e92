package com.crosscheck.core.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Component
@ConfigurationProperties(prefix = "crosscheck")
public class OrchestrationProperties {

    private int maxRetries = 3;
    private int maxReassignments = 1;
    private Timeouts timeouts = new Timeouts();
    private Map<String, List<String>> routing = new LinkedHashMap<>();
    private Bus bus = new Bus();
    private Publish publish = new Publish();
    private Agents agents = new Agents();
    private Monitor monitor = new Monitor();

    /**
     * Liveness deadline for a task class, falling back to the default when the class has none.
     */
    public Duration livenessTimeout(String taskClass) {
        ClassTimeouts perClass = taskClass != null ? timeouts.taskClasses.get(taskClass) : null;
        return perClass != null && perClass.liveness != null ? perClass.liveness : timeouts.liveness;
    }

    public Duration validationTimeout(String taskClass) {
        ClassTimeouts perClass = taskClass != null ? timeouts.taskClasses.get(taskClass) : null;
        return perClass != null && perClass.validation != null ? perClass.validation : timeouts.validation;
    }

    public int getMaxRetries() { return maxRetries; }
    public void setMaxRetries(int maxRetries) { this.maxRetries = maxRetries; }
    public int getMaxReassignments() { return maxReassignments; }
    public void setMaxReassignments(int maxReassignments) { this.maxReassignments = maxReassignments; }
    public Timeouts getTimeouts() { return timeouts; }
    public void setTimeouts(Timeouts timeouts) { this.timeouts = timeouts; }
    public Map<String, List<String>> getRouting() { return routing; }
    public void setRouting(Map<String, List<String>> routing) { this.routing = routing; }
    public Bus getBus() { return bus; }
    public void setBus(Bus bus) { this.bus = bus; }
    public Publish getPublish() { return publish; }
    public void setPublish(Publish publish) { this.publish = publish; }
    public Agents getAgents() { return agents; }
    public void setAgents(Agents agents) { this.agents = agents; }
    public Monitor getMonitor() { return monitor; }
    public void setMonitor(Monitor monitor) { this.monitor = monitor; }

    public static class Timeouts {
        private Duration liveness = Duration.ofMinutes(10);
        private Duration validation = Duration.ofMinutes(5);
        private Map<String, ClassTimeouts> taskClasses = new LinkedHashMap<>();

        public Duration getLiveness() { return liveness; }
        public void setLiveness(Duration liveness) { this.liveness = liveness; }
        public Duration getValidation() { return validation; }
        public void setValidation(Duration validation) { this.validation = validation; }
        public Map<String, ClassTimeouts> getTaskClasses() { return taskClasses; }
        public void setTaskClasses(Map<String, ClassTimeouts> taskClasses) { this.taskClasses = taskClasses; }
    }

    /** Per-class overrides. A null field falls back to the default. */
    public static class ClassTimeouts {
        private Duration liveness;
        private Duration validation;

        public Duration getLiveness() { return liveness; }
        public void setLiveness(Duration liveness) { this.liveness = liveness; }
        public Duration getValidation() { return validation; }
        public void setValidation(Duration validation) { this.validation = validation; }
    }

    public static class Bus {
        private int deliveryThreads = 4;
        private int maxDeliveryAttempts = 5;
        private Duration redeliveryBackoff = Duration.ofMillis(200);
        private Duration drainTimeout = Duration.ofSeconds(10);
        private int dedupWindow = 10_000;

        public int getDeliveryThreads() { return deliveryThreads; }
        public void setDeliveryThreads(int deliveryThreads) { this.deliveryThreads = deliveryThreads; }
        public int getMaxDeliveryAttempts() { return maxDeliveryAttempts; }
        public void setMaxDeliveryAttempts(int maxDeliveryAttempts) { this.maxDeliveryAttempts = maxDeliveryAttempts; }
        public Duration getRedeliveryBackoff() { return redeliveryBackoff; }
        public void setRedeliveryBackoff(Duration redeliveryBackoff) { this.redeliveryBackoff = redeliveryBackoff; }
        public Duration getDrainTimeout() { return drainTimeout; }
        public void setDrainTimeout(Duration drainTimeout) { this.drainTimeout = drainTimeout; }
        public int getDedupWindow() { return dedupWindow; }
        public void setDedupWindow(int dedupWindow) { this.dedupWindow = dedupWindow; }
    }

    public static class Publish {
        private int maxAttempts = 5;
        private Duration initialBackoff = Duration.ofMillis(100);
        private double multiplier = 2.0;

        public int getMaxAttempts() { return maxAttempts; }
        public void setMaxAttempts(int maxAttempts) { this.maxAttempts = maxAttempts; }
        public Duration getInitialBackoff() { return initialBackoff; }
        public void setInitialBackoff(Duration initialBackoff) { this.initialBackoff = initialBackoff; }
        public double getMultiplier() { return multiplier; }
        public void setMultiplier(double multiplier) { this.multiplier = multiplier; }
    }

    public static class Agents {
        private int threads = 8;

        public int getThreads() { return threads; }
        public void setThreads(int threads) { this.threads = threads; }
    }

    public static class Monitor {
        private Duration interval = Duration.ofSeconds(5);

        public Duration getInterval() { return interval; }
        public void setInterval(Duration interval) { this.interval = interval; }
    }
}
