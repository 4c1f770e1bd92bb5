package org.example.lingua.service.resilience;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;

class CircuitBreakerTest {

    private MutableClock clock;
    private CircuitBreaker circuitBreaker;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2026-03-01T10:00:00Z"));
        circuitBreaker = new CircuitBreaker(5, Duration.ofSeconds(30), clock);
    }

    @Test
    void execute_successResetsFailureCount() {
        failOnce();
        failOnce();
        assertEquals(2, circuitBreaker.getFailureCount());

        assertEquals("ok", circuitBreaker.execute(() -> "ok"));

        assertEquals(0, circuitBreaker.getFailureCount());
        assertEquals(CircuitState.CLOSED, circuitBreaker.getState());
    }

    @Test
    void execute_opensAfterThresholdAndRejectsWithoutInvokingAction() {
        for (int i = 0; i < 5; i++) {
            failOnce();
        }
        assertEquals(CircuitState.OPEN, circuitBreaker.getState());

        AtomicInteger invocations = new AtomicInteger();
        assertThrows(CircuitOpenException.class, () -> circuitBreaker.execute(() -> {
            invocations.incrementAndGet();
            return "never";
        }));
        assertEquals(0, invocations.get());
    }

    @Test
    void execute_rethrowsOriginalError() {
        IllegalStateException original = new IllegalStateException("backend down");

        IllegalStateException thrown = assertThrows(IllegalStateException.class,
                () -> circuitBreaker.execute(() -> {
                    throw original;
                }));

        assertSame(original, thrown);
    }

    @Test
    void execute_halfOpenSuccessClosesCircuit() {
        for (int i = 0; i < 5; i++) {
            failOnce();
        }
        clock.advanceMillis(29_999);
        assertThrows(CircuitOpenException.class, () -> circuitBreaker.execute(() -> "early"));

        clock.advanceMillis(1);
        assertEquals("trial", circuitBreaker.execute(() -> "trial"));

        assertEquals(CircuitState.CLOSED, circuitBreaker.getState());
        assertEquals(0, circuitBreaker.getFailureCount());
    }

    @Test
    void execute_halfOpenFailureReopensCircuit() {
        for (int i = 0; i < 5; i++) {
            failOnce();
        }
        clock.advanceMillis(30_000);

        failOnce();

        assertEquals(CircuitState.OPEN, circuitBreaker.getState());
        assertThrows(CircuitOpenException.class, () -> circuitBreaker.execute(() -> "rejected"));
    }

    @Test
    void constructor_rejectsNonPositiveThreshold() {
        assertThrows(IllegalArgumentException.class,
                () -> new CircuitBreaker(0, Duration.ofSeconds(1), clock));
    }

    private void failOnce() {
        assertThrows(RuntimeException.class, () -> circuitBreaker.execute(() -> {
            throw new RuntimeException("failure");
        }));
    }

    private static final class MutableClock extends Clock {
        private Instant current;

        private MutableClock(Instant initial) {
            this.current = initial;
        }

        @Override
        public ZoneId getZone() {
            return ZoneId.of("UTC");
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return current;
        }

        private void advanceMillis(long millis) {
            current = current.plusMillis(millis);
        }
    }
}
