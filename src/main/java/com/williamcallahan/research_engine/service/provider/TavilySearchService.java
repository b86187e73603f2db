/**
 * Service for general web search through the Tavily API
 *
 * @author William Callahan
 *
 * Features:
 * - POST /search without the generated answer, returning raw hits
 * - Cleans snippets of markdown and HTML before they reach the ranking prompt
 * - Disabled when no API key is configured
 */

package com.williamcallahan.research_engine.service.provider;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.williamcallahan.research_engine.config.ProviderConfigurationProperties;
import com.williamcallahan.research_engine.model.WebHit;
import com.williamcallahan.research_engine.service.fetch.FetchRequest;
import com.williamcallahan.research_engine.service.fetch.ResilientFetchClient;
import com.williamcallahan.research_engine.util.ExternalApiLogger;
import com.williamcallahan.research_engine.util.TextUtils;
import com.williamcallahan.research_engine.util.ValidationUtils;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.github.resilience4j.ratelimiter.annotation.RateLimiter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.web.util.UriComponentsBuilder;
import reactor.core.publisher.Mono;

import java.net.URI;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Service
public class TavilySearchService {

    private static final Logger logger = LoggerFactory.getLogger(TavilySearchService.class);
    private static final String API_NAME = "Tavily";

    private final ResilientFetchClient fetchClient;
    private final ObjectMapper objectMapper;
    private final ProviderConfigurationProperties.Tavily settings;

    public TavilySearchService(ResilientFetchClient fetchClient,
                               ObjectMapper objectMapper,
                               ProviderConfigurationProperties providerProperties) {
        this.fetchClient = fetchClient;
        this.objectMapper = objectMapper;
        this.settings = providerProperties.getTavily();
    }

    public boolean isEnabled() {
        return ValidationUtils.hasText(settings.getApiKey());
    }

    /**
     * Runs one web search
     *
     * @param query      search text
     * @param maxResults maximum hits to request
     * @return Mono emitting hits in provider order; an empty list on any failure or when disabled
     */
    @RateLimiter(name = "tavily")
    @CircuitBreaker(name = "tavily", fallbackMethod = "searchWebFallback")
    public Mono<List<WebHit>> searchWeb(String query, int maxResults) {
        if (!ValidationUtils.hasText(query)) {
            return Mono.just(List.of());
        }
        if (!isEnabled()) {
            ExternalApiLogger.logProviderDisabled(logger, API_NAME, query);
            return Mono.just(List.of());
        }
        ExternalApiLogger.logApiCallAttempt(logger, API_NAME, "searchWeb", query);
        URI target = UriComponentsBuilder.fromHttpUrl(settings.getBaseUrl())
            .path("/search")
            .build()
            .toUri();

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("api_key", settings.getApiKey());
        body.put("query", query);
        body.put("max_results", maxResults);
        body.put("include_answer", false);

        return fetchClient.fetch(FetchRequest.post("tavily/search", target, body))
            .flatMap(response -> Mono.justOrEmpty(response.json(objectMapper)))
            .map(root -> ProviderJson.mapArray(root.path("results"), this::parseHit))
            .doOnNext(hits -> ExternalApiLogger.logApiCallSuccess(logger, API_NAME, "searchWeb", query, hits.size()))
            .switchIfEmpty(Mono.<List<WebHit>>fromSupplier(() -> {
                ExternalApiLogger.logApiCallFailure(logger, API_NAME, "searchWeb", query, "no usable response");
                return List.of();
            }));
    }

    public Mono<List<WebHit>> searchWebFallback(String query, int maxResults, Throwable t) {
        logger.warn("TavilySearchService.searchWeb fallback triggered for query '{}'. Error: {}", query, t.getMessage());
        return Mono.just(List.of());
    }

    WebHit parseHit(JsonNode item) {
        String url = ProviderJson.text(item, "url");
        String title = ProviderJson.text(item, "title");
        return new WebHit(
            title != null ? title : "",
            url != null ? url : "",
            TextUtils.cleanSnippet(ProviderJson.text(item, "content")),
            TextUtils.domainOf(url)
        );
    }
}
