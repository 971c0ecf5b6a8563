package com.ivamare.requestqueue.queue;

import com.ivamare.requestqueue.exception.DuplicateRequestException;
import com.ivamare.requestqueue.model.Request;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.OptionalInt;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("InMemoryPersistedRequestQueue")
class InMemoryPersistedRequestQueueTest {

    private InMemoryPersistedRequestQueue queue;

    @BeforeEach
    void setUp() {
        queue = new InMemoryPersistedRequestQueue();
    }

    @Nested
    @DisplayName("Enqueue")
    class EnqueueTests {

        @Test
        @DisplayName("should list requests in insertion order")
        void shouldListInInsertionOrder() {
            Request first = Request.queued("AddComment", Map.of());
            Request second = Request.queued("UpdateComment", Map.of());
            Request third = Request.queued("DeleteComment", Map.of());

            queue.enqueue(first);
            queue.enqueue(second);
            queue.enqueue(third);

            assertEquals(
                List.of(first.requestId(), second.requestId(), third.requestId()),
                queue.listPending().stream().map(Request::requestId).toList()
            );
            assertEquals(3, queue.size());
        }

        @Test
        @DisplayName("should reject interactive requests")
        void shouldRejectInteractiveRequests() {
            assertThrows(IllegalArgumentException.class, () ->
                queue.enqueue(Request.interactive("OpenReport", Map.of()))
            );
            assertEquals(0, queue.size());
        }

        @Test
        @DisplayName("should reject duplicate identity")
        void shouldRejectDuplicateIdentity() {
            Request request = Request.queued("AddComment", Map.of());
            queue.enqueue(request);

            DuplicateRequestException ex = assertThrows(DuplicateRequestException.class, () ->
                queue.enqueue(request.withRetryCount(4))
            );

            assertEquals(request.requestId(), ex.getRequestId());
            assertEquals(0, queue.get(request.requestId()).orElseThrow().retryCount());
        }
    }

    @Nested
    @DisplayName("Retry count")
    class RetryCountTests {

        @Test
        @DisplayName("should increment and return the new count")
        void shouldIncrementAndReturnNewCount() {
            Request request = Request.queued("AddComment", Map.of());
            queue.enqueue(request);

            assertEquals(OptionalInt.of(1), queue.incrementRetries(request.requestId()));
            assertEquals(OptionalInt.of(2), queue.incrementRetries(request.requestId()));
            assertEquals(2, queue.get(request.requestId()).orElseThrow().retryCount());
        }

        @Test
        @DisplayName("should return empty for unknown identity")
        void shouldReturnEmptyForUnknownIdentity() {
            Request other = Request.queued("AddComment", Map.of());
            queue.enqueue(other);

            assertTrue(queue.incrementRetries(UUID.randomUUID()).isEmpty());
            assertEquals(0, queue.get(other.requestId()).orElseThrow().retryCount());
        }

        @Test
        @DisplayName("should keep order when a request is incremented")
        void shouldKeepOrderOnIncrement() {
            Request first = Request.queued("AddComment", Map.of());
            Request second = Request.queued("UpdateComment", Map.of());
            queue.enqueue(first);
            queue.enqueue(second);

            queue.incrementRetries(first.requestId());

            assertEquals(first.requestId(), queue.listPending().get(0).requestId());
            assertEquals(1, queue.listPending().get(0).retryCount());
        }

        @Test
        @DisplayName("should not lose increments under concurrency")
        void shouldNotLoseIncrements() throws Exception {
            Request request = Request.queued("AddComment", Map.of());
            queue.enqueue(request);
            ExecutorService executor = Executors.newFixedThreadPool(8);
            CountDownLatch startGate = new CountDownLatch(1);

            try {
                List<Future<OptionalInt>> futures = new ArrayList<>();
                for (int i = 0; i < 100; i++) {
                    futures.add(executor.submit(() -> {
                        startGate.await();
                        return queue.incrementRetries(request.requestId());
                    }));
                }
                startGate.countDown();
                for (Future<OptionalInt> future : futures) {
                    future.get(5, TimeUnit.SECONDS);
                }
            } finally {
                executor.shutdownNow();
            }

            assertEquals(100, queue.get(request.requestId()).orElseThrow().retryCount());
        }
    }

    @Nested
    @DisplayName("Remove")
    class RemoveTests {

        @Test
        @DisplayName("should remove only the given identity")
        void shouldRemoveOnlyGivenIdentity() {
            Request kept = Request.queued("AddComment", Map.of());
            Request removed = Request.queued("DeleteComment", Map.of());
            queue.enqueue(kept);
            queue.enqueue(removed);
            queue.incrementRetries(kept.requestId());

            queue.remove(removed.requestId());

            assertTrue(queue.get(removed.requestId()).isEmpty());
            assertEquals(1, queue.get(kept.requestId()).orElseThrow().retryCount());
        }

        @Test
        @DisplayName("should be idempotent")
        void shouldBeIdempotent() {
            Request request = Request.queued("AddComment", Map.of());
            queue.enqueue(request);

            queue.remove(request.requestId());
            assertDoesNotThrow(() -> queue.remove(request.requestId()));
            assertDoesNotThrow(() -> queue.remove(UUID.randomUUID()));
            assertEquals(0, queue.size());
        }

        @Test
        @DisplayName("should clear all requests")
        void shouldClearAllRequests() {
            queue.enqueue(Request.queued("AddComment", Map.of()));
            queue.enqueue(Request.queued("AddComment", Map.of()));

            queue.clear();

            assertEquals(0, queue.size());
            assertTrue(queue.listPending().isEmpty());
        }
    }

    @Test
    @DisplayName("should return an immutable snapshot")
    void shouldReturnImmutableSnapshot() {
        queue.enqueue(Request.queued("AddComment", Map.of()));

        List<Request> snapshot = queue.listPending();
        queue.clear();

        assertEquals(1, snapshot.size());
        assertThrows(UnsupportedOperationException.class, snapshot::clear);
    }
}
