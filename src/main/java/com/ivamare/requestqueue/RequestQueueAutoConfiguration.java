package com.ivamare.requestqueue;

import com.ivamare.requestqueue.diagnostics.LoggingRequestDiagnostics;
import com.ivamare.requestqueue.diagnostics.RequestDiagnostics;
import com.ivamare.requestqueue.middleware.MiddlewareChain;
import com.ivamare.requestqueue.middleware.RetryMiddleware;
import com.ivamare.requestqueue.network.NetworkClient;
import com.ivamare.requestqueue.network.RequestDispatcher;
import com.ivamare.requestqueue.policy.RetryPolicy;
import com.ivamare.requestqueue.queue.InMemoryPersistedRequestQueue;
import com.ivamare.requestqueue.queue.JdbcPersistedRequestQueue;
import com.ivamare.requestqueue.queue.PersistedRequestQueue;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.jdbc.JdbcTemplateAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Import;
import org.springframework.jdbc.core.JdbcTemplate;

/**
 * Auto-configuration for the request retry queue.
 *
 * <p>Automatically configures:
 * <ul>
 *   <li>Retry Policy</li>
 *   <li>Request Diagnostics</li>
 *   <li>Persisted Request Queue (in-memory or JDBC)</li>
 *   <li>Retry Middleware and Middleware Chain</li>
 *   <li>Network Client, when a RequestDispatcher bean is present</li>
 * </ul>
 *
 * <p>To disable auto-configuration:
 * <pre>
 * requestqueue.enabled=false
 * </pre>
 */
@AutoConfiguration(after = JdbcTemplateAutoConfiguration.class)
@ConditionalOnProperty(prefix = "requestqueue", name = "enabled", havingValue = "true", matchIfMissing = true)
@EnableConfigurationProperties(RequestQueueProperties.class)
@Import(SequentialQueueAutoStartConfiguration.class)
public class RequestQueueAutoConfiguration {

    private static final Logger log = LoggerFactory.getLogger(RequestQueueAutoConfiguration.class);

    // --- Object Mapper ---

    @Bean
    @ConditionalOnMissingBean
    public ObjectMapper requestQueueObjectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.findAndRegisterModules();
        return mapper;
    }

    // --- Retry Policy ---

    @Bean
    @ConditionalOnMissingBean
    public RetryPolicy retryPolicy(RequestQueueProperties properties) {
        return new RetryPolicy(
            properties.getMaxRequestRetries(),
            properties.getBackoffSchedule()
        );
    }

    // --- Diagnostics ---

    @Bean
    @ConditionalOnMissingBean
    public RequestDiagnostics requestDiagnostics() {
        return new LoggingRequestDiagnostics();
    }

    // --- Persisted Request Queue ---

    @Bean
    @ConditionalOnMissingBean
    public PersistedRequestQueue persistedRequestQueue(
            RequestQueueProperties properties,
            ObjectProvider<JdbcTemplate> jdbcTemplate,
            ObjectMapper objectMapper,
            RequestDiagnostics requestDiagnostics) {
        if (properties.getStore() == RequestQueueProperties.Store.JDBC) {
            JdbcTemplate template = jdbcTemplate.getIfAvailable();
            if (template == null) {
                throw new IllegalStateException(
                    "requestqueue.store=jdbc requires a JdbcTemplate (configure a DataSource)");
            }
            log.info("Using JDBC persisted request queue");
            return new JdbcPersistedRequestQueue(template, objectMapper, requestDiagnostics);
        }
        log.info("Using in-memory persisted request queue; requests will not survive a restart");
        return new InMemoryPersistedRequestQueue();
    }

    // --- Middleware ---

    @Bean
    @ConditionalOnMissingBean
    public RetryMiddleware retryMiddleware(
            PersistedRequestQueue persistedRequestQueue,
            RequestDiagnostics requestDiagnostics,
            RetryPolicy retryPolicy) {
        return new RetryMiddleware(persistedRequestQueue, requestDiagnostics, retryPolicy);
    }

    @Bean
    @ConditionalOnMissingBean
    public MiddlewareChain middlewareChain(RetryMiddleware retryMiddleware) {
        return new MiddlewareChain().use(retryMiddleware);
    }

    // --- Network Client ---

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnBean(RequestDispatcher.class)
    public NetworkClient networkClient(
            RequestDispatcher requestDispatcher,
            PersistedRequestQueue persistedRequestQueue,
            MiddlewareChain middlewareChain,
            RequestQueueProperties properties) {
        return new NetworkClient(requestDispatcher, persistedRequestQueue, middlewareChain,
            properties.getRequestTimeoutMs());
    }
}
