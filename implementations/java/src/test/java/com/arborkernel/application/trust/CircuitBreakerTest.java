package com.arborkernel.application.trust;

import com.arborkernel.config.KernelProperties;
import com.arborkernel.domain.model.TrustEventType;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class CircuitBreakerTest {

    private static final Instant T0 = Instant.parse("2025-03-01T12:00:00Z");

    private final CircuitBreaker breaker = new CircuitBreaker(new KernelProperties());

    @Test
    void tripsWhenThresholdReachedInsideWindow() {
        assertTrue(breaker.record("a", TrustEventType.SECURITY_VIOLATION, T0).isEmpty());
        assertTrue(breaker.record("a", TrustEventType.SECURITY_VIOLATION, T0.plusSeconds(60)).isEmpty());

        Optional<TrustEventType> tripped = breaker.record("a", TrustEventType.SECURITY_VIOLATION, T0.plusSeconds(120));

        assertEquals(Optional.of(TrustEventType.SECURITY_VIOLATION), tripped);
        assertEquals(0, breaker.count("a", TrustEventType.SECURITY_VIOLATION));
    }

    @Test
    void eventsOutsideWindowExpire() {
        for (int i = 0; i < 4; i++) {
            assertTrue(breaker.record("a", TrustEventType.ACTION_FAILURE, T0).isEmpty());
        }
        assertTrue(breaker.record("a", TrustEventType.ACTION_FAILURE, T0.plus(Duration.ofSeconds(61))).isEmpty());
        assertEquals(1, breaker.count("a", TrustEventType.ACTION_FAILURE));
    }

    @Test
    void agentsAndTypesAreIndependent() {
        for (int i = 0; i < 4; i++) {
            breaker.record("a", TrustEventType.ACTION_FAILURE, T0);
            breaker.record("b", TrustEventType.TEST_FAILED, T0);
        }
        assertEquals(4, breaker.count("a", TrustEventType.ACTION_FAILURE));
        assertEquals(0, breaker.count("a", TrustEventType.TEST_FAILED));
        assertEquals(4, breaker.count("b", TrustEventType.TEST_FAILED));
    }

    @Test
    void ignoresNonFailureEvents() {
        for (int i = 0; i < 20; i++) {
            assertTrue(breaker.record("a", TrustEventType.ACTION_SUCCESS, T0).isEmpty());
        }
    }

    @Test
    void disabledNeverTrips() {
        KernelProperties properties = new KernelProperties();
        properties.getTrust().getCircuitBreaker().setEnabled(false);
        CircuitBreaker disabled = new CircuitBreaker(properties);

        for (int i = 0; i < 10; i++) {
            assertTrue(disabled.record("a", TrustEventType.SECURITY_VIOLATION, T0).isEmpty());
        }
    }

    @Test
    void resetClearsAgent() {
        breaker.record("a", TrustEventType.ROLLBACK_EXECUTED, T0);
        breaker.reset("a");
        assertEquals(0, breaker.count("a", TrustEventType.ROLLBACK_EXECUTED));
    }
}
