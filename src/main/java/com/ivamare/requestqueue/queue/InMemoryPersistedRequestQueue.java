package com.ivamare.requestqueue.queue;

import com.ivamare.requestqueue.exception.DuplicateRequestException;
import com.ivamare.requestqueue.model.Request;
import com.ivamare.requestqueue.model.RequestOrigin;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.UUID;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Persisted request queue held in process memory.
 *
 * <p>Does not survive a restart. Used when no database is configured and as
 * the queue in tests.
 */
public class InMemoryPersistedRequestQueue implements PersistedRequestQueue {

    private static final Logger log = LoggerFactory.getLogger(InMemoryPersistedRequestQueue.class);

    private final Map<UUID, Request> requests = new LinkedHashMap<>();
    private final ReentrantLock lock = new ReentrantLock();

    @Override
    public void enqueue(Request request) {
        if (request.origin() != RequestOrigin.QUEUED) {
            throw new IllegalArgumentException("Only queued requests can be persisted");
        }
        lock.lock();
        try {
            if (requests.containsKey(request.requestId())) {
                throw new DuplicateRequestException(request.requestId());
            }
            requests.put(request.requestId(), request);
        } finally {
            lock.unlock();
        }
        log.debug("Enqueued request {} ({})", request.requestId(), request.command());
    }

    @Override
    public OptionalInt incrementRetries(UUID requestId) {
        lock.lock();
        try {
            Request current = requests.get(requestId);
            if (current == null) {
                return OptionalInt.empty();
            }
            Request updated = current.withRetryCount(current.retryCount() + 1);
            requests.put(requestId, updated);
            return OptionalInt.of(updated.retryCount());
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void remove(UUID requestId) {
        lock.lock();
        try {
            if (requests.remove(requestId) != null) {
                log.debug("Removed request {}", requestId);
            }
        } finally {
            lock.unlock();
        }
    }

    @Override
    public List<Request> listPending() {
        lock.lock();
        try {
            return List.copyOf(requests.values());
        } finally {
            lock.unlock();
        }
    }

    @Override
    public Optional<Request> get(UUID requestId) {
        lock.lock();
        try {
            return Optional.ofNullable(requests.get(requestId));
        } finally {
            lock.unlock();
        }
    }

    @Override
    public int size() {
        lock.lock();
        try {
            return requests.size();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void clear() {
        lock.lock();
        try {
            requests.clear();
        } finally {
            lock.unlock();
        }
    }
}
