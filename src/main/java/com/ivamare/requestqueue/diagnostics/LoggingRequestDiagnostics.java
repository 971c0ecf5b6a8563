package com.ivamare.requestqueue.diagnostics;

import com.ivamare.requestqueue.model.Request;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes request diagnostics to SLF4J.
 *
 * <p>Failures of the log-shipping command go to a separate local trace
 * logger at DEBUG so they never feed back into server-side log reporting.
 */
public class LoggingRequestDiagnostics implements RequestDiagnostics {

    private static final Logger log = LoggerFactory.getLogger(LoggingRequestDiagnostics.class);

    static final String LOCAL_TRACE_LOGGER = "com.ivamare.requestqueue.diagnostics.LocalTrace";

    private static final Logger localTrace = LoggerFactory.getLogger(LOCAL_TRACE_LOGGER);

    @Override
    public void persistedRequestFailed(Request request, int retryCount, String reason) {
        log.info("Persisted request failed (retryCount={}, command={}, requestId={}): {}",
            retryCount, request.command(), request.requestId(), reason);
    }

    @Override
    public void persistedRequestAbandoned(Request request, int retryCount, String reason) {
        log.info("Request failed too many times, removing from storage (retryCount={}, command={}, requestId={}): {}",
            retryCount, request.command(), request.requestId(), reason);
    }

    @Override
    public void interactiveRequestFailed(Request request, Throwable error) {
        log.warn("[Network] Handled error when making request (command={}, requestId={})",
            request.command(), request.requestId(), error);
    }

    @Override
    public void logRequestFailed(Request request, Throwable error) {
        localTrace.debug("[Network] There was an error in the Log API command, unable to log to server: {}",
            error != null ? error.getMessage() : null);
    }

    @Override
    public void storageFault(String operation, Request request, RuntimeException cause) {
        log.error("Persisted request queue failed during {} for request {} ({})",
            operation, request.requestId(), request.command(), cause);
    }
}
