package com.ivamare.requestqueue;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.List;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Configuration properties for the request retry queue.
 *
 * <p>Example configuration:
 * <pre>
 * requestqueue:
 *   enabled: true
 *   max-request-retries: 10
 *   backoff-schedule: [1, 5, 15, 30, 60]
 *   store: jdbc
 *   request-timeout-ms: 30000
 *   sequential:
 *     auto-start: true
 *     poll-interval-ms: 1000
 *     resilience:
 *       initial-backoff-ms: 1000
 *       max-backoff-ms: 30000
 *       backoff-multiplier: 2.0
 *       error-threshold: 5
 * </pre>
 */
@ConfigurationProperties(prefix = "requestqueue")
public class RequestQueueProperties {

    /**
     * Enable/disable request queue auto-configuration.
     */
    private boolean enabled = true;

    /**
     * Failures after which a persisted request is removed from the queue.
     */
    private int maxRequestRetries = 10;

    /**
     * Delay in seconds before retrying a persisted request, by retry count.
     */
    private List<Integer> backoffSchedule = List.of(1, 5, 15, 30, 60);

    /**
     * Where persisted requests are stored.
     */
    private Store store = Store.MEMORY;

    /**
     * Time in milliseconds after which an attempt counts as failed, for
     * interactive and persisted requests alike.
     */
    private long requestTimeoutMs = 30000;

    /**
     * Sequential queue configuration.
     */
    private SequentialProperties sequential = new SequentialProperties();

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public int getMaxRequestRetries() {
        return maxRequestRetries;
    }

    public void setMaxRequestRetries(int maxRequestRetries) {
        this.maxRequestRetries = maxRequestRetries;
    }

    public List<Integer> getBackoffSchedule() {
        return backoffSchedule;
    }

    public void setBackoffSchedule(List<Integer> backoffSchedule) {
        this.backoffSchedule = backoffSchedule;
    }

    public Store getStore() {
        return store;
    }

    public void setStore(Store store) {
        this.store = store;
    }

    public long getRequestTimeoutMs() {
        return requestTimeoutMs;
    }

    public void setRequestTimeoutMs(long requestTimeoutMs) {
        this.requestTimeoutMs = requestTimeoutMs;
    }

    public SequentialProperties getSequential() {
        return sequential;
    }

    public void setSequential(SequentialProperties sequential) {
        this.sequential = sequential;
    }

    /**
     * Backing store for persisted requests.
     */
    public enum Store {
        /** Process memory; lost on restart */
        MEMORY,
        /** PostgreSQL table via JdbcTemplate */
        JDBC
    }

    /**
     * Sequential queue configuration properties.
     */
    public static class SequentialProperties {

        /**
         * Start the sequential queue on application ready.
         */
        private boolean autoStart = false;

        /**
         * Interval in milliseconds between drain passes when the queue is idle.
         */
        private long pollIntervalMs = 1000;

        /**
         * Resilience configuration for storage error recovery.
         */
        private ResilienceProperties resilience = new ResilienceProperties();

        public boolean isAutoStart() {
            return autoStart;
        }

        public void setAutoStart(boolean autoStart) {
            this.autoStart = autoStart;
        }

        public long getPollIntervalMs() {
            return pollIntervalMs;
        }

        public void setPollIntervalMs(long pollIntervalMs) {
            this.pollIntervalMs = pollIntervalMs;
        }

        public ResilienceProperties getResilience() {
            return resilience;
        }

        public void setResilience(ResilienceProperties resilience) {
            this.resilience = resilience;
        }
    }

    /**
     * Resilience configuration for storage error recovery.
     *
     * <p>When the persisted request queue cannot be read, the sequential
     * queue backs off exponentially:
     * <pre>
     * delay = min(initialBackoffMs * (backoffMultiplier ^ (errorCount - 1)), maxBackoffMs)
     * </pre>
     * with +/- 10% jitter.
     */
    public static class ResilienceProperties {

        /**
         * Initial backoff in milliseconds after the first storage error.
         */
        private long initialBackoffMs = 1000;

        /**
         * Maximum backoff in milliseconds.
         */
        private long maxBackoffMs = 30000;

        /**
         * Multiplier applied for each consecutive error.
         */
        private double backoffMultiplier = 2.0;

        /**
         * Consecutive errors before logging at ERROR instead of WARN.
         */
        private int errorThreshold = 5;

        public long getInitialBackoffMs() {
            return initialBackoffMs;
        }

        public void setInitialBackoffMs(long initialBackoffMs) {
            this.initialBackoffMs = initialBackoffMs;
        }

        public long getMaxBackoffMs() {
            return maxBackoffMs;
        }

        public void setMaxBackoffMs(long maxBackoffMs) {
            this.maxBackoffMs = maxBackoffMs;
        }

        public double getBackoffMultiplier() {
            return backoffMultiplier;
        }

        public void setBackoffMultiplier(double backoffMultiplier) {
            this.backoffMultiplier = backoffMultiplier;
        }

        public int getErrorThreshold() {
            return errorThreshold;
        }

        public void setErrorThreshold(int errorThreshold) {
            this.errorThreshold = errorThreshold;
        }

        /**
         * Calculate the backoff delay for a given error count.
         *
         * @param errorCount the number of consecutive errors (1-based)
         * @return the delay in milliseconds
         */
        public long calculateBackoff(int errorCount) {
            if (errorCount <= 0) {
                return initialBackoffMs;
            }
            double delay = initialBackoffMs * Math.pow(backoffMultiplier, errorCount - 1);
            double jitter = delay * 0.1 * (ThreadLocalRandom.current().nextDouble() * 2 - 1);
            return Math.min((long) (delay + jitter), maxBackoffMs);
        }
    }
}
