package com.ivamare.requestqueue.model;

import com.ivamare.requestqueue.exception.ResponseAlreadyResolvedException;

import java.util.UUID;
import java.util.concurrent.CompletableFuture;

/**
 * One-shot result channel for an interactive request.
 *
 * <p>The waiting caller holds {@link #future()}; whichever component finishes
 * the request calls {@link #resolve(Response)}. A second resolution is
 * rejected so the caller observes exactly one response.
 */
public final class PendingResponse {

    private final UUID requestId;
    private final CompletableFuture<Response> future = new CompletableFuture<>();

    public PendingResponse(UUID requestId) {
        if (requestId == null) {
            throw new IllegalArgumentException("requestId is required");
        }
        this.requestId = requestId;
    }

    /**
     * Resolve the caller's response.
     *
     * @param response the response to deliver
     * @throws ResponseAlreadyResolvedException if already resolved
     */
    public void resolve(Response response) {
        if (!tryResolve(response)) {
            throw new ResponseAlreadyResolvedException(requestId);
        }
    }

    /**
     * Resolve the caller's response unless it was already resolved.
     *
     * @param response the response to deliver
     * @return true if this call resolved it
     */
    public boolean tryResolve(Response response) {
        if (response == null) {
            throw new IllegalArgumentException("response is required");
        }
        return future.complete(response);
    }

    public boolean isResolved() {
        return future.isDone();
    }

    public UUID requestId() {
        return requestId;
    }

    /**
     * Read side of the channel. Completing the returned future directly is
     * not supported; use {@link #resolve(Response)}.
     *
     * @return a view of the response future
     */
    public CompletableFuture<Response> future() {
        return future.copy();
    }
}
