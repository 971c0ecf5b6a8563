package com.ivamare.requestqueue.middleware;

import com.ivamare.requestqueue.diagnostics.RequestDiagnostics;
import com.ivamare.requestqueue.model.PendingResponse;
import com.ivamare.requestqueue.model.Request;
import com.ivamare.requestqueue.model.Response;
import com.ivamare.requestqueue.policy.RetryPolicy;
import com.ivamare.requestqueue.queue.PersistedRequestQueue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.OptionalInt;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;

/**
 * Decides what happens when a network attempt fails.
 *
 * <ul>
 *   <li>Success passes through untouched.</li>
 *   <li>A failed persisted request has its retry count incremented and is
 *       removed from the queue once the count reaches the retry limit.
 *       Nothing is resolved; the queue is the record of outstanding work.</li>
 *   <li>A failed interactive request leaves the queue alone and resolves its
 *       caller with {@link Response#offline()}.</li>
 * </ul>
 *
 * <p>The returned future always completes normally. Queue mutations for one
 * identity are serialized; different identities proceed concurrently.
 *
 * <p>When the queue itself fails, the fault is reported through
 * {@link RequestDiagnostics#storageFault} and a retry count tracked in this
 * process stands in until the queue answers again.
 */
public class RetryMiddleware implements Middleware {

    private static final Logger log = LoggerFactory.getLogger(RetryMiddleware.class);

    private final PersistedRequestQueue queue;
    private final RequestDiagnostics diagnostics;
    private final RetryPolicy retryPolicy;

    private final IdentityLocks identityLocks = new IdentityLocks();
    private final Map<UUID, Integer> localRetryCounts = new ConcurrentHashMap<>();

    public RetryMiddleware(PersistedRequestQueue queue, RequestDiagnostics diagnostics, RetryPolicy retryPolicy) {
        if (retryPolicy == null) {
            throw new IllegalArgumentException("retryPolicy is required");
        }
        this.queue = queue;
        this.diagnostics = diagnostics;
        this.retryPolicy = retryPolicy;
    }

    public RetryMiddleware(PersistedRequestQueue queue, RequestDiagnostics diagnostics, int maxRequestRetries) {
        this(queue, diagnostics, new RetryPolicy(maxRequestRetries, List.of()));
    }

    @Override
    public CompletableFuture<Response> apply(
            CompletableFuture<Response> response,
            Request request,
            boolean isFromSequentialQueue) {
        return response.handle((value, error) -> {
            if (error == null) {
                if (isFromSequentialQueue) {
                    localRetryCounts.remove(request.requestId());
                }
                return value;
            }
            Throwable cause = unwrap(error);
            if (isFromSequentialQueue) {
                handlePersistedFailure(request, cause);
                return null;
            }
            return handleInteractiveFailure(request, cause);
        });
    }

    public int getMaxRequestRetries() {
        return retryPolicy.maxRetries();
    }

    int localRetryCount(UUID requestId) {
        return localRetryCounts.getOrDefault(requestId, 0);
    }

    int activeLockCount() {
        return identityLocks.activeCount();
    }

    // --- Persisted path ---

    private void handlePersistedFailure(Request request, Throwable cause) {
        String reason = describe(cause);
        try {
            identityLocks.withLock(request.requestId(), () -> {
                recordFailure(request, reason);
                return null;
            });
        } catch (RuntimeException e) {
            // Never let bookkeeping break the response chain
            log.error("Unexpected error recording failure of request {}", request.requestId(), e);
        }
    }

    private void recordFailure(Request request, String reason) {
        UUID requestId = request.requestId();
        int retryCount;

        try {
            OptionalInt incremented = queue.incrementRetries(requestId);
            if (incremented.isEmpty()) {
                localRetryCounts.remove(requestId);
                log.debug("Request {} no longer queued, nothing to retry", requestId);
                return;
            }
            retryCount = incremented.getAsInt();
            // The store is authoritative again
            localRetryCounts.remove(requestId);
        } catch (RuntimeException e) {
            emit(() -> diagnostics.storageFault("incrementRetries", request, e));
            retryCount = localRetryCounts.getOrDefault(requestId, request.retryCount()) + 1;
            localRetryCounts.put(requestId, retryCount);
        }

        int count = retryCount;
        emit(() -> diagnostics.persistedRequestFailed(request, count, reason));

        if (retryPolicy.isExhausted(count)) {
            try {
                queue.remove(requestId);
            } catch (RuntimeException e) {
                emit(() -> diagnostics.storageFault("remove", request, e));
                // Remember the count so the next failure retries the removal
                localRetryCounts.put(requestId, count);
                return;
            }
            localRetryCounts.remove(requestId);
            emit(() -> diagnostics.persistedRequestAbandoned(request, count, reason));
        }
    }

    // --- Interactive path ---

    private Response handleInteractiveFailure(Request request, Throwable cause) {
        if (request.isLogCommand()) {
            emit(() -> diagnostics.logRequestFailed(request, cause));
        } else {
            emit(() -> diagnostics.interactiveRequestFailed(request, cause));
        }

        Response offline = Response.offline();
        PendingResponse pending = request.pendingResponse();
        if (pending == null) {
            log.debug("Request {} has no waiting caller to resolve", request.requestId());
        } else if (!pending.tryResolve(offline)) {
            log.debug("Caller of request {} was already resolved", request.requestId());
        }
        return offline;
    }

    // --- Helpers ---

    private void emit(Runnable record) {
        try {
            record.run();
        } catch (RuntimeException e) {
            log.warn("Request diagnostics failed: {}", e.getMessage());
        }
    }

    private static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    static String describe(Throwable error) {
        if (error == null) {
            return "Unknown";
        }
        String message = error.getMessage();
        return message != null ? message : error.getClass().getSimpleName();
    }
}
