package org.example.lingua.config;

import org.example.lingua.service.GenerationMetricsService;
import org.example.lingua.service.resilience.CircuitBreaker;
import org.example.lingua.service.resilience.GenerationRetryExecutor;
import org.example.lingua.service.resilience.RequestQueue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Process-wide circuit breaker, request queue and retry executor for generation
 * calls, plus the clock and the executor used for mastery updates.
 */
@Configuration
public class GenerationResilienceConfig {

    private static final Logger log = LoggerFactory.getLogger(GenerationResilienceConfig.class);

    @Value("${ai.generation.circuit-breaker.failure-threshold:5}")
    private int failureThreshold;

    @Value("${ai.generation.circuit-breaker.reset-timeout-ms:30000}")
    private long resetTimeoutMs;

    @Value("${ai.generation.queue.concurrency:3}")
    private int queueConcurrency;

    @Value("${ai.generation.queue.rate-limit:10}")
    private int queueRateLimit;

    @Value("${ai.generation.queue.interval-ms:60000}")
    private long queueIntervalMs;

    @Value("${ai.generation.queue.poll-delay-ms:1000}")
    private long queuePollDelayMs;

    @Value("${ai.generation.retry.max-attempts:3}")
    private int retryMaxAttempts;

    @Value("${ai.generation.retry.initial-delay-ms:1000}")
    private long retryInitialDelayMs;

    @Value("${learning.mastery.update-threads:4}")
    private int masteryUpdateThreads;

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public CircuitBreaker generationCircuitBreaker(Clock clock) {
        log.info("Generation circuit breaker: failureThreshold={}, resetTimeoutMs={}", failureThreshold, resetTimeoutMs);
        return new CircuitBreaker(failureThreshold, Duration.ofMillis(resetTimeoutMs), clock);
    }

    @Bean(destroyMethod = "shutdown")
    public RequestQueue generationRequestQueue(Clock clock) {
        log.info("Generation request queue: concurrency={}, rateLimit={} per {} ms",
                queueConcurrency, queueRateLimit, queueIntervalMs);
        return new RequestQueue(
                queueConcurrency,
                queueRateLimit,
                Duration.ofMillis(queueIntervalMs),
                Duration.ofMillis(queuePollDelayMs),
                clock
        );
    }

    @Bean
    public GenerationRetryExecutor generationRetryExecutor(
            RequestQueue requestQueue,
            CircuitBreaker circuitBreaker,
            GenerationMetricsService metricsService,
            Clock clock) {
        return new GenerationRetryExecutor(
                requestQueue,
                circuitBreaker,
                metricsService,
                retryMaxAttempts,
                Duration.ofMillis(retryInitialDelayMs),
                Thread::sleep,
                clock
        );
    }

    @Bean(destroyMethod = "shutdown")
    @Qualifier("masteryUpdateExecutor")
    public ExecutorService masteryUpdateExecutor() {
        AtomicInteger counter = new AtomicInteger();
        return Executors.newFixedThreadPool(Math.max(1, masteryUpdateThreads), runnable -> {
            Thread thread = new Thread(runnable, "mastery-update-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
    }
}
