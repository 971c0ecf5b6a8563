package com.ivamare.requestqueue;

import com.ivamare.requestqueue.RequestQueueProperties.ResilienceProperties;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("RequestQueueProperties")
class RequestQueuePropertiesTest {

    @Test
    @DisplayName("should have defaults")
    void shouldHaveDefaults() {
        RequestQueueProperties properties = new RequestQueueProperties();

        assertTrue(properties.isEnabled());
        assertEquals(10, properties.getMaxRequestRetries());
        assertEquals(List.of(1, 5, 15, 30, 60), properties.getBackoffSchedule());
        assertEquals(RequestQueueProperties.Store.MEMORY, properties.getStore());
        assertFalse(properties.getSequential().isAutoStart());
        assertEquals(1000, properties.getSequential().getPollIntervalMs());
        assertEquals(30000, properties.getRequestTimeoutMs());
        assertEquals(5, properties.getSequential().getResilience().getErrorThreshold());
    }

    @Nested
    @DisplayName("Resilience backoff")
    class ResilienceBackoffTests {

        @Test
        @DisplayName("should grow exponentially within jitter")
        void shouldGrowExponentially() {
            ResilienceProperties resilience = new ResilienceProperties();

            long first = resilience.calculateBackoff(1);
            long third = resilience.calculateBackoff(3);

            assertTrue(first >= 900 && first <= 1100, "first was " + first);
            assertTrue(third >= 3600 && third <= 4400, "third was " + third);
        }

        @Test
        @DisplayName("should cap at max backoff")
        void shouldCapAtMaxBackoff() {
            ResilienceProperties resilience = new ResilienceProperties();
            resilience.setMaxBackoffMs(5000);

            assertEquals(5000, resilience.calculateBackoff(20));
        }

        @Test
        @DisplayName("should return initial backoff for non-positive count")
        void shouldReturnInitialForNonPositiveCount() {
            ResilienceProperties resilience = new ResilienceProperties();

            assertEquals(1000, resilience.calculateBackoff(0));
        }
    }
}
