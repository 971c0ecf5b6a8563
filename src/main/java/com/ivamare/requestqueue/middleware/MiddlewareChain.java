package com.ivamare.requestqueue.middleware;

import com.ivamare.requestqueue.model.Request;
import com.ivamare.requestqueue.model.Response;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Ordered list of middleware applied to every network attempt.
 */
public class MiddlewareChain {

    private final List<Middleware> middlewares = new CopyOnWriteArrayList<>();

    public MiddlewareChain() {
    }

    public MiddlewareChain(List<? extends Middleware> initial) {
        middlewares.addAll(initial);
    }

    /**
     * Append a middleware; it runs after those already registered.
     *
     * @param middleware the middleware to add
     * @return this chain
     */
    public MiddlewareChain use(Middleware middleware) {
        if (middleware == null) {
            throw new IllegalArgumentException("middleware is required");
        }
        middlewares.add(middleware);
        return this;
    }

    public CompletableFuture<Response> apply(
            CompletableFuture<Response> response,
            Request request,
            boolean isFromSequentialQueue) {
        CompletableFuture<Response> current = response;
        for (Middleware middleware : middlewares) {
            current = middleware.apply(current, request, isFromSequentialQueue);
        }
        return current;
    }

    public List<Middleware> middlewares() {
        return List.copyOf(middlewares);
    }
}
