package com.ivamare.requestqueue.exception;

/**
 * Base exception for all request queue errors.
 */
public class RequestQueueException extends RuntimeException {

    public RequestQueueException(String message) {
        super(message);
    }

    public RequestQueueException(String message, Throwable cause) {
        super(message, cause);
    }
}
