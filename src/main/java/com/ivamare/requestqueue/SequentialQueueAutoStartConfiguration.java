package com.ivamare.requestqueue;

import com.ivamare.requestqueue.health.SequentialQueueHealthIndicator;
import com.ivamare.requestqueue.middleware.MiddlewareChain;
import com.ivamare.requestqueue.network.NetworkClient;
import com.ivamare.requestqueue.network.RequestDispatcher;
import com.ivamare.requestqueue.policy.RetryPolicy;
import com.ivamare.requestqueue.queue.PersistedRequestQueue;
import com.ivamare.requestqueue.sequential.SequentialQueue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.event.EventListener;

import jakarta.annotation.PreDestroy;
import java.time.Duration;

/**
 * Auto-start configuration for the sequential queue.
 *
 * <p>Enable with:
 * <pre>
 * requestqueue:
 *   sequential:
 *     auto-start: true
 * </pre>
 *
 * <p>Requires a RequestDispatcher bean.
 */
@Configuration
@ConditionalOnProperty(prefix = "requestqueue.sequential", name = "auto-start", havingValue = "true")
@ConditionalOnBean(RequestDispatcher.class)
public class SequentialQueueAutoStartConfiguration {

    private static final Logger log = LoggerFactory.getLogger(SequentialQueueAutoStartConfiguration.class);

    private final SequentialQueue sequentialQueue;
    private final ObjectProvider<NetworkClient> networkClient;
    private final RequestQueueProperties properties;

    public SequentialQueueAutoStartConfiguration(
            PersistedRequestQueue persistedRequestQueue,
            RequestDispatcher requestDispatcher,
            MiddlewareChain middlewareChain,
            RetryPolicy retryPolicy,
            ObjectProvider<NetworkClient> networkClient,
            RequestQueueProperties properties) {
        RequestQueueProperties.SequentialProperties sp = properties.getSequential();
        this.sequentialQueue = SequentialQueue.builder()
            .queue(persistedRequestQueue)
            .dispatcher(requestDispatcher)
            .middlewareChain(middlewareChain)
            .retryPolicy(retryPolicy)
            .pollIntervalMs(sp.getPollIntervalMs())
            .requestTimeoutMs(properties.getRequestTimeoutMs())
            .resilience(sp.getResilience())
            .build();
        this.networkClient = networkClient;
        this.properties = properties;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void startSequentialQueue() {
        networkClient.ifAvailable(client -> client.onPersist(sequentialQueue::flush));
        sequentialQueue.start();
        log.info("Started sequential queue");
    }

    @PreDestroy
    public void stopSequentialQueue() {
        if (!sequentialQueue.isRunning()) {
            return;
        }
        log.info("Stopping sequential queue...");
        sequentialQueue.stop(Duration.ofSeconds(30)).join();
    }

    @Bean
    public SequentialQueue sequentialQueue() {
        return sequentialQueue;
    }

    @Bean
    public HealthIndicator sequentialQueueHealthIndicator() {
        return new SequentialQueueHealthIndicator(
            sequentialQueue,
            properties.getSequential().getResilience().getErrorThreshold()
        );
    }
}
