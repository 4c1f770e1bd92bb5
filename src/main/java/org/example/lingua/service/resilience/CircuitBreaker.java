package org.example.lingua.service.resilience;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.function.Supplier;

/**
 * Consecutive-failure circuit breaker guarding calls to the generation backend.
 * <p>
 * After {@code failureThreshold} consecutive failures the circuit opens and calls are
 * rejected with {@link CircuitOpenException} until {@code resetTimeout} has elapsed.
 * The next call is then let through in HALF_OPEN state: success closes the circuit,
 * failure reopens it.
 * <p>
 * State changes happen under this object's monitor; the guarded action itself runs
 * outside of it so that concurrent calls are not serialized.
 */
public class CircuitBreaker {

    private static final Logger log = LoggerFactory.getLogger(CircuitBreaker.class);

    private final int failureThreshold;
    private final Duration resetTimeout;
    private final Clock clock;

    private CircuitState state = CircuitState.CLOSED;
    private int failureCount;
    private long nextAttemptTimeMillis;

    public CircuitBreaker(int failureThreshold, Duration resetTimeout, Clock clock) {
        if (failureThreshold < 1) {
            throw new IllegalArgumentException("failureThreshold must be at least 1");
        }
        if (resetTimeout == null || resetTimeout.isNegative()) {
            throw new IllegalArgumentException("resetTimeout must not be negative");
        }
        this.failureThreshold = failureThreshold;
        this.resetTimeout = resetTimeout;
        this.clock = clock;
    }

    public <T> T execute(Supplier<T> action) {
        beforeCall();
        T result;
        try {
            result = action.get();
        } catch (RuntimeException | Error e) {
            onFailure();
            throw e;
        }
        onSuccess();
        return result;
    }

    private synchronized void beforeCall() {
        if (state != CircuitState.OPEN) {
            return;
        }
        if (clock.millis() < nextAttemptTimeMillis) {
            throw new CircuitOpenException("Circuit breaker is OPEN");
        }
        state = CircuitState.HALF_OPEN;
        log.info("Circuit breaker half-open, allowing trial call");
    }

    private synchronized void onSuccess() {
        if (state != CircuitState.CLOSED) {
            log.info("Circuit breaker closed after successful call");
        }
        failureCount = 0;
        state = CircuitState.CLOSED;
    }

    private synchronized void onFailure() {
        failureCount++;
        if (state == CircuitState.HALF_OPEN || failureCount >= failureThreshold) {
            state = CircuitState.OPEN;
            nextAttemptTimeMillis = clock.millis() + resetTimeout.toMillis();
            log.warn("Circuit breaker opened after {} consecutive failures, retry after {} ms",
                    failureCount, resetTimeout.toMillis());
        }
    }

    public synchronized CircuitState getState() {
        return state;
    }

    public synchronized int getFailureCount() {
        return failureCount;
    }
}
