package com.ivamare.requestqueue.health;

import com.ivamare.requestqueue.sequential.SequentialQueue;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;

/**
 * Health indicator for the sequential queue.
 *
 * <p>Reports:
 * <ul>
 *   <li>Whether the queue is running and has a request in flight</li>
 *   <li>Number of persisted requests waiting</li>
 *   <li>Consecutive storage errors</li>
 * </ul>
 */
public class SequentialQueueHealthIndicator implements HealthIndicator {

    private final SequentialQueue sequentialQueue;
    private final int errorThreshold;

    public SequentialQueueHealthIndicator(SequentialQueue sequentialQueue, int errorThreshold) {
        this.sequentialQueue = sequentialQueue;
        this.errorThreshold = errorThreshold;
    }

    @Override
    public Health health() {
        if (sequentialQueue == null) {
            return Health.unknown()
                .withDetail("message", "No sequential queue registered")
                .build();
        }

        int consecutiveErrors = sequentialQueue.getConsecutiveErrorCount();
        boolean healthy = sequentialQueue.isRunning() && consecutiveErrors < errorThreshold;
        Health.Builder builder = healthy ? Health.up() : Health.down();

        builder
            .withDetail("running", sequentialQueue.isRunning())
            .withDetail("draining", sequentialQueue.isDraining())
            .withDetail("consecutiveErrors", consecutiveErrors);

        try {
            builder.withDetail("pending", sequentialQueue.pendingCount());
        } catch (RuntimeException e) {
            builder.down().withDetail("pendingError", e.getMessage());
        }

        return builder.build();
    }
}
