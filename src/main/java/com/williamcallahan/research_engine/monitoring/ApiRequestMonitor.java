/**
 * Tracks outbound provider traffic
 * Publishes Micrometer counters and timers tagged by endpoint and keeps an in-process
 * summary for the actuator-independent report
 *
 * @author William Callahan
 */

package com.williamcallahan.research_engine.monitoring;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

@Service
public class ApiRequestMonitor {

    private static final Logger logger = LoggerFactory.getLogger(ApiRequestMonitor.class);

    private final MeterRegistry meterRegistry;

    private final AtomicLong totalRequests = new AtomicLong();
    private final AtomicLong totalSuccessful = new AtomicLong();
    private final AtomicLong totalFailed = new AtomicLong();
    private final AtomicLong totalRetries = new AtomicLong();
    private final AtomicLong totalRateLimited = new AtomicLong();
    private final Map<String, AtomicLong> endpointCalls = new ConcurrentHashMap<>();
    private final AtomicReference<String> lastError = new AtomicReference<>();

    public ApiRequestMonitor(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
    }

    public void recordSuccessfulRequest(String endpoint) {
        totalRequests.incrementAndGet();
        totalSuccessful.incrementAndGet();
        endpointCalls.computeIfAbsent(endpoint, k -> new AtomicLong()).incrementAndGet();
        counter("provider.requests", endpoint, "success").increment();
    }

    public void recordFailedRequest(String endpoint, String errorMessage) {
        totalRequests.incrementAndGet();
        totalFailed.incrementAndGet();
        endpointCalls.computeIfAbsent(endpoint, k -> new AtomicLong()).incrementAndGet();
        lastError.set(endpoint + ": " + errorMessage);
        counter("provider.requests", endpoint, "failure").increment();
        logger.debug("Recorded failed request to {}: {}", endpoint, errorMessage);
    }

    public void recordRetry(String endpoint, String reason) {
        totalRetries.incrementAndGet();
        counter("provider.retries", endpoint, reason).increment();
    }

    public void recordRateLimited(String endpoint) {
        totalRateLimited.incrementAndGet();
        counter("provider.rate_limited", endpoint, "429").increment();
    }

    public void recordLatency(String endpoint, Duration elapsed) {
        Timer.builder("provider.request.duration")
            .description("Wall time of provider requests including retries")
            .tag("endpoint", endpoint)
            .register(meterRegistry)
            .record(elapsed);
    }

    public long getTotalRequests() {
        return totalRequests.get();
    }

    /**
     * Snapshot of the in-process counters.
     */
    public Map<String, Object> getMetricsMap() {
        Map<String, Object> metrics = new LinkedHashMap<>();
        metrics.put("total_requests", totalRequests.get());
        metrics.put("total_successful", totalSuccessful.get());
        metrics.put("total_failed", totalFailed.get());
        metrics.put("total_retries", totalRetries.get());
        metrics.put("total_rate_limited", totalRateLimited.get());
        Map<String, Long> endpoints = new TreeMap<>();
        endpointCalls.forEach((endpoint, count) -> endpoints.put(endpoint, count.get()));
        metrics.put("endpoints", endpoints);
        metrics.put("last_error", lastError.get());
        return metrics;
    }

    public String generateReport() {
        StringBuilder report = new StringBuilder("Provider Request Monitor Report\n");
        report.append(String.format("Total: %d requests (%d successful, %d failed), %d retries, %d rate limited%n",
            totalRequests.get(), totalSuccessful.get(), totalFailed.get(), totalRetries.get(), totalRateLimited.get()));
        new TreeMap<>(endpointCalls).forEach((endpoint, count) ->
            report.append(String.format("  %s: %d%n", endpoint, count.get())));
        String error = lastError.get();
        if (error != null) {
            report.append("Last error: ").append(error).append('\n');
        }
        return report.toString();
    }

    private Counter counter(String name, String endpoint, String outcome) {
        return Counter.builder(name)
            .tag("endpoint", endpoint)
            .tag("outcome", outcome)
            .register(meterRegistry);
    }
}
