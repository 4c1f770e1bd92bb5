package org.example.lingua.controller;

import jakarta.servlet.http.HttpServletRequest;
import org.example.lingua.config.RequestCorrelation;
import org.example.lingua.service.GenerationMetricsService;
import org.example.lingua.service.generation.LanguageGenerationClient;
import org.example.lingua.service.resilience.CircuitBreaker;
import org.example.lingua.service.resilience.CircuitState;
import org.example.lingua.service.resilience.RequestQueue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.Map;

@RestController
public class HealthController {

    private static final Logger log = LoggerFactory.getLogger(HealthController.class);

    private final LanguageGenerationClient generationClient;
    private final CircuitBreaker circuitBreaker;
    private final RequestQueue requestQueue;
    private final GenerationMetricsService generationMetricsService;
    private final Clock clock;

    public HealthController(
            LanguageGenerationClient generationClient,
            CircuitBreaker circuitBreaker,
            RequestQueue requestQueue,
            GenerationMetricsService generationMetricsService,
            Clock clock) {
        this.generationClient = generationClient;
        this.circuitBreaker = circuitBreaker;
        this.requestQueue = requestQueue;
        this.generationMetricsService = generationMetricsService;
        this.clock = clock;
    }

    @GetMapping("/health")
    public Health health() {
        return new Health("ok");
    }

    @GetMapping("/health/details")
    public HealthDetails healthDetails(HttpServletRequest request) {
        boolean backendHealthy;
        try {
            generationClient.checkHealth();
            backendHealthy = true;
        } catch (RuntimeException e) {
            log.warn("Generation backend health check failed: {}", e.getMessage());
            backendHealthy = false;
        }

        CircuitState circuitState = circuitBreaker.getState();
        GenerationHealth generation = new GenerationHealth(
                generationClient.getProviderName(),
                generationClient.isProviderAvailable(),
                backendHealthy,
                circuitState,
                circuitBreaker.getFailureCount(),
                requestQueue.getPendingCount(),
                requestQueue.getActiveCount()
        );

        boolean healthy = backendHealthy && circuitState != CircuitState.OPEN;
        return new HealthDetails(
                healthy ? "ok" : "degraded",
                RequestCorrelation.resolveRequestId(request),
                LocalDateTime.now(clock),
                generation,
                generationMetricsService.snapshot()
        );
    }

    public record Health(String status) {}

    public record HealthDetails(
            String status,
            String requestId,
            LocalDateTime asOf,
            GenerationHealth generation,
            Map<String, Object> generationMetrics
    ) {
    }

    public record GenerationHealth(
            String provider,
            boolean providerConfigured,
            boolean backendReachable,
            CircuitState circuitState,
            int consecutiveFailures,
            int queuePending,
            int queueActive
    ) {
    }
}
