package com.ivamare.requestqueue.middleware;

import com.ivamare.requestqueue.model.Request;
import com.ivamare.requestqueue.model.Response;

import java.util.concurrent.CompletableFuture;

/**
 * A stage that observes or transforms the pending response of a request.
 *
 * <p>Stages are chained: each receives the future returned by the previous
 * stage and returns the future handed to the next.
 */
@FunctionalInterface
public interface Middleware {

    /**
     * @param response pending response of the network attempt
     * @param request the request that was sent
     * @param isFromSequentialQueue true if the request was read from the persisted request queue
     * @return the pending response for the next stage
     */
    CompletableFuture<Response> apply(
        CompletableFuture<Response> response,
        Request request,
        boolean isFromSequentialQueue
    );
}
