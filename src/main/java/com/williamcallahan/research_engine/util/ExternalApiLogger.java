package com.williamcallahan.research_engine.util;

import org.slf4j.Logger;

/**
 * Centralized logging for outbound provider calls made while aggregating evidence.
 *
 * These lines make the fan-out easy to follow in the log:
 * - OpenAlex and Semantic Scholar (paper search, in parallel)
 * - Crossref and Unpaywall (per-DOI verification and open-access lookup)
 * - Tavily (web search for datasets, learning resources and tools)
 */
public class ExternalApiLogger {

    private static final String PREFIX = "[EXTERNAL-API]";

    private ExternalApiLogger() {
    }

    /**
     * Log an external API call attempt
     */
    public static void logApiCallAttempt(Logger log, String apiName, String operation, String query) {
        log.info("{} [{}] ATTEMPT: {} for query='{}'", PREFIX, apiName, operation, query);
    }

    /**
     * Log an external API call success
     */
    public static void logApiCallSuccess(Logger log, String apiName, String operation, String query, int resultCount) {
        log.info("{} [{}] SUCCESS: {} returned {} result(s) for query='{}'", PREFIX, apiName, operation, resultCount, query);
    }

    /**
     * Log an external API call failure
     */
    public static void logApiCallFailure(Logger log, String apiName, String operation, String query, String reason) {
        log.warn("{} [{}] FAILURE: {} failed for query='{}' - {}", PREFIX, apiName, operation, query, reason);
    }

    public static void logRetryScheduled(Logger log, String apiName, int attempt, int maxAttempts, long delaySeconds, String reason) {
        log.info("{} [{}] RETRY: attempt {}/{} in {}s ({})", PREFIX, apiName, attempt, maxAttempts, delaySeconds, reason);
    }

    /**
     * Log when a provider is skipped because it has no credentials or contact address configured
     */
    public static void logProviderDisabled(Logger log, String apiName, String query) {
        log.debug("{} [{}] DISABLED: not configured, skipping query='{}'", PREFIX, apiName, query);
    }

    /**
     * Log circuit breaker blocking an API call
     */
    public static void logCircuitBreakerBlocked(Logger log, String apiName, String query) {
        log.info("{} [{}] CIRCUIT-BREAKER-OPEN: blocking call for query='{}'", PREFIX, apiName, query);
    }

    /**
     * Log HTTP response details
     */
    public static void logHttpResponse(Logger log, String apiName, int statusCode, String url, int bodySize) {
        log.debug("{} [{}] Response: status={}, url={}, bodySize={} chars", PREFIX, apiName, statusCode, url, bodySize);
    }
}
