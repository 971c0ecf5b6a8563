package com.ivamare.requestqueue.exception;

import java.util.UUID;

/**
 * Thrown when a request is enqueued with an identity already present in the queue.
 */
public class DuplicateRequestException extends RequestQueueException {

    private final UUID requestId;

    public DuplicateRequestException(UUID requestId) {
        super("Duplicate requestId " + requestId + " in persisted request queue");
        this.requestId = requestId;
    }

    public DuplicateRequestException(UUID requestId, Throwable cause) {
        super("Duplicate requestId " + requestId + " in persisted request queue", cause);
        this.requestId = requestId;
    }

    public UUID getRequestId() {
        return requestId;
    }
}
