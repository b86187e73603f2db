/**
 * Retrying HTTP client shared by every evidence provider adapter
 *
 * @author William Callahan
 *
 * Features:
 * - Bounded retry budget (providers.fetch.max-retries, default 2, so at most 3 attempts)
 * - 429 responses wait for Retry-After (default 2s) and consume an attempt
 * - 5xx responses and connect/read timeouts back off linearly (1s, 2s, ...)
 * - Any other non-2xx, or an exhausted budget, completes empty instead of erroring
 * - Holds no per-call mutable state, so one instance serves concurrent callers
 */

package com.williamcallahan.research_engine.service.fetch;

import com.williamcallahan.research_engine.config.ProviderConfigurationProperties;
import com.williamcallahan.research_engine.monitoring.ApiRequestMonitor;
import com.williamcallahan.research_engine.util.ExternalApiLogger;
import com.williamcallahan.research_engine.util.LoggingUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import reactor.core.publisher.Mono;

import java.io.IOException;
import java.time.Duration;
import java.util.concurrent.TimeoutException;

@Service
public class ResilientFetchClient {

    private static final Logger logger = LoggerFactory.getLogger(ResilientFetchClient.class);

    private final WebClient webClient;
    private final ApiRequestMonitor apiRequestMonitor;
    private final int maxRetries;
    private final long defaultRetryAfterSeconds;
    private final long backoffStepSeconds;

    public ResilientFetchClient(WebClient.Builder webClientBuilder,
                                ProviderConfigurationProperties providerProperties,
                                ApiRequestMonitor apiRequestMonitor) {
        this.webClient = webClientBuilder.build();
        this.apiRequestMonitor = apiRequestMonitor;
        ProviderConfigurationProperties.Fetch fetch = providerProperties.getFetch();
        this.maxRetries = Math.max(0, fetch.getMaxRetries());
        this.defaultRetryAfterSeconds = fetch.getDefaultRetryAfterSeconds();
        this.backoffStepSeconds = fetch.getBackoffStepSeconds();
    }

    /**
     * Executes the request with the retry policy described on the class.
     *
     * @param request request to send
     * @return the 2xx response, or an empty Mono when the provider is unavailable
     */
    public Mono<FetchResponse> fetch(FetchRequest request) {
        return Mono.defer(() -> {
            long startNanos = System.nanoTime();
            return attempt(request, 0)
                .doOnNext(response -> apiRequestMonitor.recordSuccessfulRequest(request.endpointName()))
                .switchIfEmpty(Mono.<FetchResponse>fromRunnable(() ->
                    apiRequestMonitor.recordFailedRequest(request.endpointName(), "provider unavailable")))
                .doFinally(signal -> apiRequestMonitor.recordLatency(request.endpointName(),
                    Duration.ofNanos(System.nanoTime() - startNanos)));
        });
    }

    private Mono<FetchResponse> attempt(FetchRequest request, int attempt) {
        return exchange(request)
            .flatMap(response -> handleResponse(request, attempt, response))
            .onErrorResume(ResilientFetchClient::isTransient, e -> {
                if (attempt < maxRetries) {
                    long delay = backoffStepSeconds * (attempt + 1);
                    apiRequestMonitor.recordRetry(request.endpointName(), "transport");
                    ExternalApiLogger.logRetryScheduled(logger, request.endpointName(), attempt + 2, maxRetries + 1,
                        delay, LoggingUtils.describe(e));
                    return Mono.delay(Duration.ofSeconds(delay)).then(attempt(request, attempt + 1));
                }
                ExternalApiLogger.logApiCallFailure(logger, request.endpointName(), request.method().name(),
                    request.uri().toString(), "retries exhausted: " + LoggingUtils.describe(e));
                return Mono.empty();
            })
            .onErrorResume(e -> {
                ExternalApiLogger.logApiCallFailure(logger, request.endpointName(), request.method().name(),
                    request.uri().toString(), LoggingUtils.describe(e));
                return Mono.empty();
            });
    }

    private Mono<FetchResponse> exchange(FetchRequest request) {
        WebClient.RequestBodySpec spec = webClient.method(request.method())
            .uri(request.uri())
            .headers(headers -> headers.addAll(request.headers()));
        WebClient.RequestHeadersSpec<?> ready = request.body() != null ? spec.bodyValue(request.body()) : spec;
        return ready.exchangeToMono(response -> response.bodyToMono(String.class)
            .defaultIfEmpty("")
            .map(body -> new FetchResponse(response.statusCode().value(), body,
                response.headers().asHttpHeaders())));
    }

    private Mono<FetchResponse> handleResponse(FetchRequest request, int attempt, FetchResponse response) {
        int status = response.status();
        ExternalApiLogger.logHttpResponse(logger, request.endpointName(), status, request.uri().toString(),
            response.body().length());
        if (status >= 200 && status < 300) {
            return Mono.just(response);
        }
        if (status == HttpStatus.TOO_MANY_REQUESTS.value()) {
            apiRequestMonitor.recordRateLimited(request.endpointName());
            if (attempt < maxRetries) {
                long wait = retryAfterSeconds(response.headers());
                apiRequestMonitor.recordRetry(request.endpointName(), "rate_limited");
                ExternalApiLogger.logRetryScheduled(logger, request.endpointName(), attempt + 2, maxRetries + 1,
                    wait, "429 Too Many Requests");
                return Mono.delay(Duration.ofSeconds(wait)).then(attempt(request, attempt + 1));
            }
            ExternalApiLogger.logApiCallFailure(logger, request.endpointName(), request.method().name(),
                request.uri().toString(), "rate limited, retries exhausted");
            return Mono.empty();
        }
        if (status >= 500) {
            if (attempt < maxRetries) {
                long delay = backoffStepSeconds * (attempt + 1);
                apiRequestMonitor.recordRetry(request.endpointName(), "server_error");
                ExternalApiLogger.logRetryScheduled(logger, request.endpointName(), attempt + 2, maxRetries + 1,
                    delay, "HTTP " + status);
                return Mono.delay(Duration.ofSeconds(delay)).then(attempt(request, attempt + 1));
            }
            ExternalApiLogger.logApiCallFailure(logger, request.endpointName(), request.method().name(),
                request.uri().toString(), "HTTP " + status + " after " + (attempt + 1) + " attempts");
            return Mono.empty();
        }
        ExternalApiLogger.logApiCallFailure(logger, request.endpointName(), request.method().name(),
            request.uri().toString(), "HTTP " + status);
        return Mono.empty();
    }

    long retryAfterSeconds(HttpHeaders headers) {
        String value = headers.getFirst(HttpHeaders.RETRY_AFTER);
        if (value == null || value.isBlank()) {
            return defaultRetryAfterSeconds;
        }
        try {
            return Math.max(0L, Long.parseLong(value.trim()));
        } catch (NumberFormatException e) {
            // HTTP-date form
            logger.debug("Unparseable Retry-After '{}', waiting {}s", value, defaultRetryAfterSeconds);
            return defaultRetryAfterSeconds;
        }
    }

    /**
     * Connection failures and timeouts are retried; everything else is not.
     */
    static boolean isTransient(Throwable throwable) {
        Throwable current = throwable;
        while (current != null) {
            if (current instanceof WebClientRequestException
                || current instanceof TimeoutException
                || current instanceof io.netty.handler.timeout.TimeoutException
                || current instanceof IOException) {
                return true;
            }
            if (current.getCause() == current) {
                break;
            }
            current = current.getCause();
        }
        return false;
    }
}
