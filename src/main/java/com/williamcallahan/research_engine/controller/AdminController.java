/**
 * REST Controller for operational views of the provider layer
 *
 * @author William Callahan
 *
 * Features:
 * - Provider request counters as JSON and as a plain text report
 * - Current state of every provider circuit breaker
 * - Manual reset of one provider circuit breaker to CLOSED
 */

package com.williamcallahan.research_engine.controller;

import com.williamcallahan.research_engine.controller.support.ErrorResponseUtils;
import com.williamcallahan.research_engine.monitoring.ApiRequestMonitor;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Comparator;
import java.util.Map;
import java.util.Optional;

@RestController
@RequestMapping("/admin")
public class AdminController {

    private static final Logger logger = LoggerFactory.getLogger(AdminController.class);

    private final ApiRequestMonitor apiRequestMonitor;
    private final CircuitBreakerRegistry circuitBreakerRegistry;

    public AdminController(ApiRequestMonitor apiRequestMonitor, CircuitBreakerRegistry circuitBreakerRegistry) {
        this.apiRequestMonitor = apiRequestMonitor;
        this.circuitBreakerRegistry = circuitBreakerRegistry;
    }

    @GetMapping(value = "/providers/metrics", produces = MediaType.APPLICATION_JSON_VALUE)
    public Map<String, Object> getProviderMetrics() {
        return apiRequestMonitor.getMetricsMap();
    }

    @GetMapping(value = "/providers/report", produces = MediaType.TEXT_PLAIN_VALUE)
    public String getProviderReport() {
        return apiRequestMonitor.generateReport();
    }

    /**
     * Gets the state of every provider circuit breaker, one per line
     *
     * @return plain text lines of the form {@code name: STATE (failure rate x%)}
     */
    @GetMapping(value = "/circuit-breakers/status", produces = MediaType.TEXT_PLAIN_VALUE)
    public String getCircuitBreakerStatus() {
        StringBuilder status = new StringBuilder();
        circuitBreakerRegistry.getAllCircuitBreakers().stream()
            .sorted(Comparator.comparing(CircuitBreaker::getName))
            .forEach(breaker -> status.append(String.format("%s: %s (failure rate %.1f%%)%n",
                breaker.getName(), breaker.getState(), breaker.getMetrics().getFailureRate())));
        return status.length() == 0 ? "No circuit breakers registered.\n" : status.toString();
    }

    @PostMapping(value = "/circuit-breakers/{name}/reset")
    public ResponseEntity<Map<String, String>> resetCircuitBreaker(@PathVariable String name) {
        Optional<CircuitBreaker> breaker = circuitBreakerRegistry.find(name);
        if (breaker.isEmpty()) {
            return ErrorResponseUtils.error(HttpStatus.NOT_FOUND, "Circuit breaker not found", name);
        }
        breaker.get().reset();
        logger.info("Circuit breaker {} reset to CLOSED by admin request", name);
        return ResponseEntity.ok(Map.of("name", name, "state", breaker.get().getState().name()));
    }
}
