package com.ivamare.requestqueue.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Request")
class RequestTest {

    @Nested
    @DisplayName("Factories")
    class FactoryTests {

        @Test
        @DisplayName("should create interactive request with pending response")
        void shouldCreateInteractiveRequest() {
            Request request = Request.interactive("OpenReport", Map.of("reportID", 42));

            assertEquals(RequestOrigin.INTERACTIVE, request.origin());
            assertTrue(request.isInteractive());
            assertNotNull(request.pendingResponse());
            assertEquals(request.requestId(), request.pendingResponse().requestId());
            assertEquals(0, request.retryCount());
            assertEquals(42, request.data().get("reportID"));
        }

        @Test
        @DisplayName("should create queued request without pending response")
        void shouldCreateQueuedRequest() {
            Request request = Request.queued("AddComment", Map.of());

            assertEquals(RequestOrigin.QUEUED, request.origin());
            assertFalse(request.isInteractive());
            assertNull(request.pendingResponse());
            assertNotNull(request.createdAt());
        }

        @Test
        @DisplayName("should generate distinct identities")
        void shouldGenerateDistinctIdentities() {
            assertNotEquals(
                Request.queued("AddComment", Map.of()).requestId(),
                Request.queued("AddComment", Map.of()).requestId()
            );
        }
    }

    @Nested
    @DisplayName("Validation")
    class ValidationTests {

        @Test
        @DisplayName("should reject blank command")
        void shouldRejectBlankCommand() {
            assertThrows(IllegalArgumentException.class, () -> Request.queued(" ", Map.of()));
        }

        @Test
        @DisplayName("should reject missing identity")
        void shouldRejectMissingIdentity() {
            assertThrows(IllegalArgumentException.class, () ->
                new Request(null, "AddComment", Map.of(), RequestOrigin.QUEUED, 0, Instant.now(), null)
            );
        }

        @Test
        @DisplayName("should reject negative retry count")
        void shouldRejectNegativeRetryCount() {
            assertThrows(IllegalArgumentException.class, () ->
                new Request(UUID.randomUUID(), "AddComment", Map.of(), RequestOrigin.QUEUED, -1, Instant.now(), null)
            );
        }

        @Test
        @DisplayName("should reject interactive request without pending response")
        void shouldRejectInteractiveWithoutPendingResponse() {
            assertThrows(IllegalArgumentException.class, () ->
                new Request(UUID.randomUUID(), "OpenReport", Map.of(), RequestOrigin.INTERACTIVE, 0, Instant.now(), null)
            );
        }

        @Test
        @DisplayName("should reject queued request carrying a pending response")
        void shouldRejectQueuedWithPendingResponse() {
            UUID id = UUID.randomUUID();
            assertThrows(IllegalArgumentException.class, () ->
                new Request(id, "AddComment", Map.of(), RequestOrigin.QUEUED, 0, Instant.now(), new PendingResponse(id))
            );
        }

        @Test
        @DisplayName("should default data and creation time")
        void shouldDefaultDataAndCreatedAt() {
            Request request = new Request(UUID.randomUUID(), "AddComment", null, RequestOrigin.QUEUED, 0, null, null);

            assertEquals(Map.of(), request.data());
            assertNotNull(request.createdAt());
        }
    }

    @Test
    @DisplayName("should copy data defensively")
    void shouldCopyDataDefensively() {
        Map<String, Object> data = new HashMap<>();
        data.put("text", "hello");
        Request request = Request.queued("AddComment", data);

        data.put("text", "changed");

        assertEquals("hello", request.data().get("text"));
        assertThrows(UnsupportedOperationException.class, () -> request.data().put("x", 1));
    }

    @Test
    @DisplayName("should return copy with new retry count")
    void shouldReturnCopyWithRetryCount() {
        Request request = Request.queued("AddComment", Map.of("text", "hi"));

        Request updated = request.withRetryCount(3);

        assertEquals(3, updated.retryCount());
        assertEquals(0, request.retryCount());
        assertEquals(request.requestId(), updated.requestId());
        assertEquals(request.createdAt(), updated.createdAt());
    }

    @Test
    @DisplayName("should recognise the Log command")
    void shouldRecogniseLogCommand() {
        assertTrue(Request.queued("Log", Map.of()).isLogCommand());
        assertFalse(Request.queued("OpenReport", Map.of()).isLogCommand());
    }

    @Test
    @DisplayName("should accept null parameter values")
    void shouldAcceptNullParameterValues() {
        Map<String, Object> data = new HashMap<>();
        data.put("reportActionID", null);
        data.put("reportID", 42);

        Request queued = Request.queued("AddComment", data);
        Request interactive = Request.interactive("OpenReport", data);

        assertTrue(queued.data().containsKey("reportActionID"));
        assertNull(queued.data().get("reportActionID"));
        assertEquals(42, interactive.data().get("reportID"));
        assertThrows(UnsupportedOperationException.class, () -> queued.data().put("x", 1));
    }
}
