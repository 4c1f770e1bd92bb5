package org.example.lingua.service;

import org.example.lingua.service.resilience.GenerationErrorKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.LongAdder;

@Service
public class GenerationMetricsService {

    private static final Logger log = LoggerFactory.getLogger(GenerationMetricsService.class);

    private final LongAdder attempts = new LongAdder();
    private final LongAdder succeeded = new LongAdder();
    private final LongAdder failed = new LongAdder();
    private final LongAdder retried = new LongAdder();
    private final AtomicLong latencyTotalMs = new AtomicLong(0);
    private final Map<GenerationErrorKind, LongAdder> failuresByKind = new EnumMap<>(GenerationErrorKind.class);

    public GenerationMetricsService() {
        for (GenerationErrorKind kind : GenerationErrorKind.values()) {
            failuresByKind.put(kind, new LongAdder());
        }
    }

    /**
     * Records one attempt of a generation operation.
     *
     * @param errorKind null when the attempt succeeded
     */
    public void recordAttempt(String operation, long durationMs, int retryCount, GenerationErrorKind errorKind) {
        attempts.increment();
        if (retryCount > 0) {
            retried.increment();
        }
        if (durationMs > 0) {
            latencyTotalMs.addAndGet(durationMs);
        }
        if (errorKind == null) {
            succeeded.increment();
            log.info("generation_attempt operation={} durationMs={} retryCount={} success=true",
                    operation, durationMs, retryCount);
        } else {
            failed.increment();
            failuresByKind.get(errorKind).increment();
            log.warn("generation_attempt operation={} durationMs={} retryCount={} success=false errorKind={}",
                    operation, durationMs, retryCount, errorKind);
        }
    }

    public Map<String, Object> snapshot() {
        long total = attempts.sum();
        long avgLatencyMs = total == 0 ? 0 : latencyTotalMs.get() / total;

        Map<String, Object> metrics = new LinkedHashMap<>();
        metrics.put("attempts", total);
        metrics.put("succeeded", succeeded.sum());
        metrics.put("failed", failed.sum());
        metrics.put("retriedAttempts", retried.sum());
        metrics.put("averageLatencyMs", avgLatencyMs);
        Map<String, Long> byKind = new LinkedHashMap<>();
        failuresByKind.forEach((kind, count) -> {
            long value = count.sum();
            if (value > 0) {
                byKind.put(kind.name(), value);
            }
        });
        metrics.put("failuresByKind", byKind);
        return metrics;
    }
}
