package org.example.lingua.service.resilience;

import org.example.lingua.service.GenerationMetricsService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Runs a backend call through the request queue and circuit breaker, parses the raw
 * output, and retries failed attempts with exponential backoff
 * ({@code initialDelay * 2^(attempt-1)}).
 */
public class GenerationRetryExecutor {

    private static final Logger log = LoggerFactory.getLogger(GenerationRetryExecutor.class);

    @FunctionalInterface
    public interface Sleeper {
        void sleep(long millis) throws InterruptedException;
    }

    private final RequestQueue requestQueue;
    private final CircuitBreaker circuitBreaker;
    private final GenerationMetricsService metricsService;
    private final int maxAttempts;
    private final Duration initialDelay;
    private final Sleeper sleeper;
    private final Clock clock;

    public GenerationRetryExecutor(
            RequestQueue requestQueue,
            CircuitBreaker circuitBreaker,
            GenerationMetricsService metricsService,
            int maxAttempts,
            Duration initialDelay,
            Sleeper sleeper,
            Clock clock) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1");
        }
        this.requestQueue = requestQueue;
        this.circuitBreaker = circuitBreaker;
        this.metricsService = metricsService;
        this.maxAttempts = maxAttempts;
        this.initialDelay = initialDelay;
        this.sleeper = sleeper;
        this.clock = clock;
    }

    /**
     * @throws GenerationException when every attempt failed
     */
    public <T> T execute(String operation, Supplier<String> call, Function<String, T> parser) {
        for (int attempt = 1; ; attempt++) {
            long startedAt = clock.millis();
            try {
                T result = attemptOnce(call, parser);
                metricsService.recordAttempt(operation, clock.millis() - startedAt, attempt - 1, null);
                return result;
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                metricsService.recordAttempt(operation, clock.millis() - startedAt, attempt - 1,
                        GenerationErrorKind.UNKNOWN_ERROR);
                throw new GenerationException("Generation interrupted: " + operation,
                        GenerationErrorKind.UNKNOWN_ERROR, e);
            } catch (Exception e) {
                GenerationErrorKind kind = GenerationErrorClassifier.classify(e);
                metricsService.recordAttempt(operation, clock.millis() - startedAt, attempt - 1, kind);
                if (attempt >= maxAttempts) {
                    log.error("Generation failed for {} after {} attempts ({})", operation, attempt, kind);
                    throw new GenerationException("Generation failed: " + operation, kind, e);
                }
                long delayMillis = initialDelay.toMillis() * (1L << (attempt - 1));
                log.warn("Generation attempt {}/{} for {} failed ({}): {}; retrying in {} ms",
                        attempt, maxAttempts, operation, kind, e.getMessage(), delayMillis);
                backoff(operation, delayMillis, kind);
            }
        }
    }

    /**
     * Same as {@link #execute} but returns {@code fallback} instead of throwing once
     * the attempts are exhausted.
     */
    public <T> T executeOrFallback(String operation, Supplier<String> call, Function<String, T> parser, T fallback) {
        try {
            return execute(operation, call, parser);
        } catch (GenerationException e) {
            log.warn("Using fallback result for {} ({})", operation, e.getKind());
            return fallback;
        }
    }

    private <T> T attemptOnce(Supplier<String> call, Function<String, T> parser) throws Exception {
        CompletableFuture<String> future = requestQueue.add(() -> circuitBreaker.execute(call));
        String raw;
        try {
            raw = future.get();
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof Exception exception) {
                throw exception;
            }
            if (cause instanceof Error error) {
                throw error;
            }
            throw e;
        }
        return parser.apply(raw);
    }

    private void backoff(String operation, long delayMillis, GenerationErrorKind lastKind) {
        try {
            sleeper.sleep(delayMillis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new GenerationException("Generation interrupted: " + operation, lastKind, e);
        }
    }
}
