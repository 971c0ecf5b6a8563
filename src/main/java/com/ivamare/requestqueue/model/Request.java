package com.ivamare.requestqueue.model;

import java.time.Instant;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.UUID;

/**
 * A network request to perform.
 *
 * <p>Requests are immutable. The retry count of a queued request is owned by
 * the persisted request queue; {@link #withRetryCount(int)} returns the copy
 * the queue hands out.
 *
 * @param requestId Unique identifier, used for removal from the queue
 * @param command Name of the API command (e.g., "OpenReport")
 * @param data Command parameters
 * @param origin Interactive or queued
 * @param retryCount Failed attempts so far
 * @param createdAt When the request was created
 * @param pendingResponse Caller's result channel (interactive only, otherwise null)
 */
public record Request(
    UUID requestId,
    String command,
    Map<String, Object> data,
    RequestOrigin origin,
    int retryCount,
    Instant createdAt,
    PendingResponse pendingResponse
) {
    /**
     * Name of the command used to ship client logs to the server.
     */
    public static final String LOG_COMMAND = "Log";

    /**
     * Creates a request with validation.
     */
    public Request {
        if (requestId == null) {
            throw new IllegalArgumentException("requestId is required");
        }
        if (command == null || command.isBlank()) {
            throw new IllegalArgumentException("command is required");
        }
        if (origin == null) {
            throw new IllegalArgumentException("origin is required");
        }
        if (retryCount < 0) {
            throw new IllegalArgumentException("retryCount must not be negative");
        }
        if (origin == RequestOrigin.INTERACTIVE && pendingResponse == null) {
            throw new IllegalArgumentException("interactive request requires a pending response");
        }
        if (origin == RequestOrigin.QUEUED && pendingResponse != null) {
            throw new IllegalArgumentException("queued request cannot carry a pending response");
        }
        if (data == null) {
            data = Map.of();
        }
        if (createdAt == null) {
            createdAt = Instant.now();
        }
        // Command parameters may carry null values, which Map.copyOf rejects
        data = Collections.unmodifiableMap(new HashMap<>(data));
    }

    /**
     * Creates an interactive request with a fresh pending response.
     */
    public static Request interactive(String command, Map<String, Object> data) {
        UUID requestId = UUID.randomUUID();
        return new Request(requestId, command, data, RequestOrigin.INTERACTIVE, 0,
            Instant.now(), new PendingResponse(requestId));
    }

    /**
     * Creates a request destined for the persisted request queue.
     */
    public static Request queued(String command, Map<String, Object> data) {
        return new Request(UUID.randomUUID(), command, data, RequestOrigin.QUEUED, 0,
            Instant.now(), null);
    }

    public boolean isInteractive() {
        return origin == RequestOrigin.INTERACTIVE;
    }

    public boolean isLogCommand() {
        return LOG_COMMAND.equals(command);
    }

    /**
     * Returns a copy with the given retry count.
     */
    public Request withRetryCount(int newRetryCount) {
        return new Request(requestId, command, data, origin, newRetryCount, createdAt, pendingResponse);
    }
}
