package com.ivamare.requestqueue.network;

import com.ivamare.requestqueue.middleware.MiddlewareChain;
import com.ivamare.requestqueue.model.PendingResponse;
import com.ivamare.requestqueue.model.Request;
import com.ivamare.requestqueue.model.Response;
import com.ivamare.requestqueue.queue.PersistedRequestQueue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

/**
 * Entry point for issuing requests.
 *
 * <p>{@link #post} sends an interactive request: the caller always receives
 * exactly one response, the offline sentinel if the attempt failed or did not
 * complete within the request timeout.
 * {@link #persist} stores a request in the persisted request queue for the
 * sequential queue to deliver later.
 *
 * <p>Example:
 * <pre>
 * NetworkClient client = new NetworkClient(dispatcher, queue, chain, 30_000);
 *
 * client.post("OpenReport", Map.of("reportID", 42))
 *     .thenAccept(response -&gt; {
 *         if (response.isOffline()) {
 *             // render offline state
 *         }
 *     });
 *
 * client.persist("AddComment", Map.of("reportID", 42, "text", "hi"));
 * </pre>
 */
public class NetworkClient {

    private static final Logger log = LoggerFactory.getLogger(NetworkClient.class);

    private final RequestDispatcher dispatcher;
    private final PersistedRequestQueue queue;
    private final MiddlewareChain middlewareChain;
    private final long requestTimeoutMs;

    private volatile Runnable persistListener = () -> { };

    public NetworkClient(
            RequestDispatcher dispatcher,
            PersistedRequestQueue queue,
            MiddlewareChain middlewareChain,
            long requestTimeoutMs) {
        if (requestTimeoutMs <= 0) {
            throw new IllegalArgumentException("requestTimeoutMs must be positive, got: " + requestTimeoutMs);
        }
        this.dispatcher = dispatcher;
        this.queue = queue;
        this.middlewareChain = middlewareChain;
        this.requestTimeoutMs = requestTimeoutMs;
    }

    /**
     * Send an interactive request.
     *
     * @param command API command name
     * @param data command parameters
     * @return future completed once with the server response or {@link Response#offline()}
     */
    public CompletableFuture<Response> post(String command, Map<String, Object> data) {
        Request request = Request.interactive(command, data);
        PendingResponse pending = request.pendingResponse();

        log.debug("Sending {} (requestId={})", command, request.requestId());

        CompletableFuture<Response> attempt = RequestDispatcher.attempt(dispatcher, request)
            .orTimeout(requestTimeoutMs, TimeUnit.MILLISECONDS);
        middlewareChain.apply(attempt, request, false)
            .whenComplete((response, error) -> {
                if (error != null) {
                    log.error("Middleware failed for {} (requestId={})", command, request.requestId(), error);
                    pending.tryResolve(Response.offline());
                } else if (response == null) {
                    pending.tryResolve(Response.offline());
                } else {
                    pending.tryResolve(response);
                }
            });

        return pending.future();
    }

    /**
     * Store a request for later delivery by the sequential queue.
     *
     * @param command API command name
     * @param data command parameters
     * @return the persisted request
     */
    public Request persist(String command, Map<String, Object> data) {
        Request request = Request.queued(command, data);
        queue.enqueue(request);

        log.debug("Persisted {} (requestId={})", command, request.requestId());

        try {
            persistListener.run();
        } catch (RuntimeException e) {
            log.warn("Failed to notify sequential queue of request {}: {}", request.requestId(), e.getMessage());
        }
        return request;
    }

    /**
     * Register the callback run after each {@link #persist}, typically
     * {@code SequentialQueue::flush}.
     *
     * @param listener callback to run
     */
    public void onPersist(Runnable listener) {
        this.persistListener = listener != null ? listener : () -> { };
    }

    public MiddlewareChain middlewareChain() {
        return middlewareChain;
    }
}
