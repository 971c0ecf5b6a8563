package com.ivamare.requestqueue.exception;

import java.util.UUID;

/**
 * Thrown when the response of an interactive request is resolved a second time.
 */
public class ResponseAlreadyResolvedException extends RequestQueueException {

    private final UUID requestId;

    public ResponseAlreadyResolvedException(UUID requestId) {
        super("Response for request " + requestId + " was already resolved");
        this.requestId = requestId;
    }

    public UUID getRequestId() {
        return requestId;
    }
}
