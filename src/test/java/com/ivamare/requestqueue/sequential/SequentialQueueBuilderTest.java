package com.ivamare.requestqueue.sequential;

import com.ivamare.requestqueue.middleware.MiddlewareChain;
import com.ivamare.requestqueue.network.RequestDispatcher;
import com.ivamare.requestqueue.queue.InMemoryPersistedRequestQueue;
import com.ivamare.requestqueue.queue.PersistedRequestQueue;
import com.ivamare.requestqueue.sequential.impl.DefaultSequentialQueue;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("SequentialQueueBuilder")
class SequentialQueueBuilderTest {

    private final PersistedRequestQueue queue = new InMemoryPersistedRequestQueue();
    private final RequestDispatcher dispatcher = r -> new CompletableFuture<>();
    private final MiddlewareChain chain = new MiddlewareChain();

    @Test
    @DisplayName("should build with defaults")
    void shouldBuildWithDefaults() {
        SequentialQueue sequentialQueue = SequentialQueue.builder()
            .queue(queue)
            .dispatcher(dispatcher)
            .middlewareChain(chain)
            .build();

        assertInstanceOf(DefaultSequentialQueue.class, sequentialQueue);
        assertFalse(sequentialQueue.isRunning());
        assertFalse(sequentialQueue.isDraining());
        assertEquals(0, sequentialQueue.pendingCount());
    }

    @Test
    @DisplayName("should require queue")
    void shouldRequireQueue() {
        IllegalStateException ex = assertThrows(IllegalStateException.class, () ->
            SequentialQueue.builder().dispatcher(dispatcher).middlewareChain(chain).build());
        assertEquals("queue is required", ex.getMessage());
    }

    @Test
    @DisplayName("should require dispatcher")
    void shouldRequireDispatcher() {
        IllegalStateException ex = assertThrows(IllegalStateException.class, () ->
            SequentialQueue.builder().queue(queue).middlewareChain(chain).build());
        assertEquals("dispatcher is required", ex.getMessage());
    }

    @Test
    @DisplayName("should require middleware chain")
    void shouldRequireMiddlewareChain() {
        IllegalStateException ex = assertThrows(IllegalStateException.class, () ->
            SequentialQueue.builder().queue(queue).dispatcher(dispatcher).build());
        assertEquals("middlewareChain is required", ex.getMessage());
    }

    @Test
    @DisplayName("should reject non-positive intervals")
    void shouldRejectNonPositiveIntervals() {
        assertThrows(IllegalStateException.class, () -> SequentialQueue.builder()
            .queue(queue).dispatcher(dispatcher).middlewareChain(chain)
            .pollIntervalMs(0)
            .build());
        assertThrows(IllegalStateException.class, () -> SequentialQueue.builder()
            .queue(queue).dispatcher(dispatcher).middlewareChain(chain)
            .requestTimeoutMs(-1)
            .build());
    }
}
