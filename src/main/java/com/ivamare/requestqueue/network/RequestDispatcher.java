package com.ivamare.requestqueue.network;

import com.ivamare.requestqueue.model.Request;
import com.ivamare.requestqueue.model.Response;

import java.util.concurrent.CompletableFuture;

/**
 * Transport that performs a request against the server.
 *
 * <p>A future completed exceptionally is a failed attempt (network down,
 * timeout, server error); a future completed normally is a success.
 */
@FunctionalInterface
public interface RequestDispatcher {

    /**
     * Send the request.
     *
     * @param request the request to send
     * @return the pending response
     */
    CompletableFuture<Response> send(Request request);

    /**
     * Send a request, turning a dispatcher that throws or returns nothing
     * into a failed attempt.
     *
     * @param dispatcher the transport
     * @param request the request to send
     * @return the pending response, never null
     */
    static CompletableFuture<Response> attempt(RequestDispatcher dispatcher, Request request) {
        try {
            CompletableFuture<Response> response = dispatcher.send(request);
            if (response == null) {
                return CompletableFuture.failedFuture(
                    new IllegalStateException("Dispatcher returned no response for " + request.command()));
            }
            return response;
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
    }
}
