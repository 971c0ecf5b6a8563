package com.ivamare.requestqueue.sequential.impl;

import com.ivamare.requestqueue.RequestQueueProperties.ResilienceProperties;
import com.ivamare.requestqueue.exception.DatabaseExceptionClassifier;
import com.ivamare.requestqueue.middleware.MiddlewareChain;
import com.ivamare.requestqueue.model.Request;
import com.ivamare.requestqueue.model.Response;
import com.ivamare.requestqueue.network.RequestDispatcher;
import com.ivamare.requestqueue.policy.RetryPolicy;
import com.ivamare.requestqueue.queue.PersistedRequestQueue;
import com.ivamare.requestqueue.sequential.SequentialQueue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.BooleanSupplier;

/**
 * Default sequential queue running its passes on a single scheduler thread.
 */
public class DefaultSequentialQueue implements SequentialQueue {

    private static final Logger log = LoggerFactory.getLogger(DefaultSequentialQueue.class);

    private final PersistedRequestQueue queue;
    private final RequestDispatcher dispatcher;
    private final MiddlewareChain middlewareChain;
    private final RetryPolicy retryPolicy;
    private final long pollIntervalMs;
    private final long requestTimeoutMs;
    private final ResilienceProperties resilience;
    private final BooleanSupplier offlineProbe;

    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicBoolean stopping = new AtomicBoolean(false);
    private final AtomicBoolean draining = new AtomicBoolean(false);
    private final AtomicBoolean flushRequested = new AtomicBoolean(false);
    private final AtomicInteger consecutiveErrors = new AtomicInteger(0);
    private final ReentrantLock passLock = new ReentrantLock();
    private final Object scheduleLock = new Object();

    private ScheduledExecutorService executor;
    private ScheduledFuture<?> nextPass;

    /**
     * Creates a new DefaultSequentialQueue.
     *
     * @param queue Persisted request queue to drain
     * @param dispatcher Transport used to send requests
     * @param middlewareChain Middleware applied to each attempt
     * @param retryPolicy Policy providing the backoff after a failure
     * @param pollIntervalMs Idle poll interval in milliseconds
     * @param requestTimeoutMs Time after which an attempt counts as failed
     * @param resilience Backoff settings for storage errors
     * @param offlineProbe Returns true while the network is known to be down
     */
    public DefaultSequentialQueue(
            PersistedRequestQueue queue,
            RequestDispatcher dispatcher,
            MiddlewareChain middlewareChain,
            RetryPolicy retryPolicy,
            long pollIntervalMs,
            long requestTimeoutMs,
            ResilienceProperties resilience,
            BooleanSupplier offlineProbe) {
        this.queue = queue;
        this.dispatcher = dispatcher;
        this.middlewareChain = middlewareChain;
        this.retryPolicy = retryPolicy;
        this.pollIntervalMs = pollIntervalMs;
        this.requestTimeoutMs = requestTimeoutMs;
        this.resilience = resilience;
        this.offlineProbe = offlineProbe;
    }

    @Override
    public void start() {
        if (running.getAndSet(true)) {
            log.warn("Sequential queue already running");
            return;
        }

        stopping.set(false);
        executor = Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable, "sequential-queue");
            thread.setDaemon(true);
            return thread;
        });

        log.info("Starting sequential queue (pollIntervalMs={}, maxRetries={})",
            pollIntervalMs, retryPolicy.maxRetries());

        scheduleNext(0);
    }

    @Override
    public CompletableFuture<Void> stop(Duration timeout) {
        if (!running.get()) {
            return CompletableFuture.completedFuture(null);
        }

        stopping.set(true);
        cancelNextPass();
        log.info("Stopping sequential queue (draining={})", draining.get());

        return CompletableFuture.runAsync(() -> {
            try {
                long deadline = System.currentTimeMillis() + timeout.toMillis();
                while (draining.get() && System.currentTimeMillis() < deadline) {
                    Thread.sleep(50);
                }

                if (draining.get()) {
                    log.warn("Timeout waiting for in-flight persisted request");
                }

                running.set(false);
                executor.shutdown();

                if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                    executor.shutdownNow();
                }

                log.info("Sequential queue stopped");
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        });
    }

    @Override
    public void stopNow() {
        stopping.set(true);
        running.set(false);
        cancelNextPass();
        if (executor != null) {
            executor.shutdownNow();
        }
    }

    @Override
    public boolean isRunning() {
        return running.get() && !stopping.get();
    }

    @Override
    public boolean isDraining() {
        return draining.get();
    }

    @Override
    public void flush() {
        flushRequested.set(true);
        if (isRunning()) {
            scheduleNext(0);
        }
    }

    @Override
    public int drainOnce() {
        return drain().attempted();
    }

    @Override
    public int pendingCount() {
        return queue.size();
    }

    @Override
    public int getConsecutiveErrorCount() {
        return consecutiveErrors.get();
    }

    // --- Scheduling ---

    private void runPass() {
        if (!isRunning()) {
            return;
        }
        flushRequested.set(false);

        long delayMs;
        try {
            if (offlineProbe.getAsBoolean()) {
                log.debug("Offline, skipping drain pass");
                delayMs = pollIntervalMs;
            } else {
                PassResult result = drain();
                consecutiveErrors.set(0);
                delayMs = result.failed()
                    ? TimeUnit.SECONDS.toMillis(retryPolicy.getBackoff(result.retryCount()))
                    : pollIntervalMs;
            }
        } catch (RuntimeException e) {
            int errors = consecutiveErrors.incrementAndGet();
            delayMs = resilience.calculateBackoff(errors);
            logStorageError(errors, delayMs, e);
        }

        if (flushRequested.getAndSet(false)) {
            delayMs = 0;
        }
        scheduleNext(delayMs);
    }

    private void scheduleNext(long delayMs) {
        synchronized (scheduleLock) {
            if (!isRunning() || executor == null || executor.isShutdown()) {
                return;
            }
            if (nextPass != null) {
                nextPass.cancel(false);
            }
            try {
                nextPass = executor.schedule(this::runPass, delayMs, TimeUnit.MILLISECONDS);
            } catch (RejectedExecutionException e) {
                log.debug("Sequential queue executor shut down, pass not scheduled");
            }
        }
    }

    private void cancelNextPass() {
        synchronized (scheduleLock) {
            if (nextPass != null) {
                nextPass.cancel(false);
                nextPass = null;
            }
        }
    }

    private void logStorageError(int errorCount, long backoffMs, Exception e) {
        String reason = DatabaseExceptionClassifier.getTransientReason(e);
        String message = "Sequential queue storage error (count={}, reason={}), backing off {}ms: {}";

        if (!DatabaseExceptionClassifier.isTransient(e)) {
            log.error("Non-transient error in sequential queue (count={}), backing off {}ms",
                errorCount, backoffMs, e);
        } else if (errorCount >= resilience.getErrorThreshold()) {
            log.error(message, errorCount, reason, backoffMs, e.getMessage());
        } else {
            log.warn(message, errorCount, reason, backoffMs, e.getMessage());
        }
    }

    // --- Draining ---

    private PassResult drain() {
        passLock.lock();
        try {
            List<Request> pending = queue.listPending();
            int attempted = 0;

            for (Request request : pending) {
                if (stopping.get()) {
                    break;
                }
                attempted++;

                if (!send(request)) {
                    int retryCount = queue.get(request.requestId())
                        .map(Request::retryCount)
                        .orElse(request.retryCount() + 1);
                    return new PassResult(attempted, true, retryCount);
                }
            }
            return new PassResult(attempted, false, 0);
        } finally {
            passLock.unlock();
        }
    }

    private boolean send(Request request) {
        draining.set(true);
        try {
            CompletableFuture<Response> attempt = RequestDispatcher.attempt(dispatcher, request)
                .orTimeout(requestTimeoutMs, TimeUnit.MILLISECONDS);

            try {
                middlewareChain.apply(attempt, request, true).join();
            } catch (CompletionException | CancellationException e) {
                log.warn("Middleware failed for persisted request {} ({}): {}",
                    request.requestId(), request.command(), e.getMessage());
            }

            // The chain may not depend on the attempt; wait for it either way
            attempt.handle((response, error) -> null).join();

            if (attempt.isCompletedExceptionally()) {
                log.debug("Persisted request {} ({}) failed, ending pass",
                    request.requestId(), request.command());
                return false;
            }

            queue.remove(request.requestId());
            log.debug("Persisted request {} ({}) succeeded", request.requestId(), request.command());
            return true;
        } finally {
            draining.set(false);
        }
    }

    record PassResult(int attempted, boolean failed, int retryCount) {}
}
