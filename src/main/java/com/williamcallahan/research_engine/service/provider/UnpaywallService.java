/**
 * Service for resolving open-access copies of papers through Unpaywall
 *
 * @author William Callahan
 *
 * Features:
 * - Looks up a DOI and prefers best_oa_location (PDF link, then landing page)
 * - Falls back to the first oa_locations entry with a usable link
 * - Disabled when no contact e-mail is configured, as Unpaywall requires one
 * - Caches resolved lookups per normalized DOI
 */

package com.williamcallahan.research_engine.service.provider;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.benmanes.caffeine.cache.Cache;
import com.williamcallahan.research_engine.config.ProviderConfigurationProperties;
import com.williamcallahan.research_engine.service.fetch.FetchRequest;
import com.williamcallahan.research_engine.service.fetch.ResilientFetchClient;
import com.williamcallahan.research_engine.util.DoiUtils;
import com.williamcallahan.research_engine.util.ExternalApiLogger;
import com.williamcallahan.research_engine.util.ValidationUtils;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.web.util.UriComponentsBuilder;
import reactor.core.publisher.Mono;

import java.net.URI;

@Service
public class UnpaywallService {

    private static final Logger logger = LoggerFactory.getLogger(UnpaywallService.class);
    private static final String API_NAME = "Unpaywall";
    private static final String NO_OPEN_COPY = "";

    private final ResilientFetchClient fetchClient;
    private final ObjectMapper objectMapper;
    private final ProviderConfigurationProperties.Unpaywall settings;
    private final Cache<String, String> openAccessCache;

    public UnpaywallService(ResilientFetchClient fetchClient,
                            ObjectMapper objectMapper,
                            ProviderConfigurationProperties providerProperties,
                            Cache<String, String> openAccessCache) {
        this.fetchClient = fetchClient;
        this.objectMapper = objectMapper;
        this.settings = providerProperties.getUnpaywall();
        this.openAccessCache = openAccessCache;
    }

    public boolean isEnabled() {
        return ValidationUtils.hasText(settings.getEmail());
    }

    /**
     * Finds the best open-access URL for a DOI
     *
     * @param doi DOI in any common form
     * @return Mono emitting the URL, or empty when there is none, the DOI is unknown, or the service is disabled
     */
    @CircuitBreaker(name = "unpaywall", fallbackMethod = "getOpenAccessUrlFallback")
    public Mono<String> getOpenAccessUrl(String doi) {
        String normalized = DoiUtils.normalize(doi);
        if (normalized == null) {
            return Mono.empty();
        }
        if (!isEnabled()) {
            ExternalApiLogger.logProviderDisabled(logger, API_NAME, normalized);
            return Mono.empty();
        }
        String cached = openAccessCache.getIfPresent(normalized);
        if (cached != null) {
            return cached.isEmpty() ? Mono.empty() : Mono.just(cached);
        }
        ExternalApiLogger.logApiCallAttempt(logger, API_NAME, "getOpenAccessUrl", normalized);
        URI target = UriComponentsBuilder.fromHttpUrl(settings.getBaseUrl())
            .path("/{doi}")
            .queryParam("email", settings.getEmail())
            .buildAndExpand(normalized)
            .encode()
            .toUri();

        return fetchClient.fetch(FetchRequest.get("unpaywall/doi", target))
            .flatMap(response -> Mono.justOrEmpty(response.json(objectMapper)))
            .map(this::selectOpenAccessUrl)
            .doOnNext(url -> openAccessCache.put(normalized, url))
            .filter(url -> !url.isEmpty());
    }

    public Mono<String> getOpenAccessUrlFallback(String doi, Throwable t) {
        logger.warn("UnpaywallService.getOpenAccessUrl fallback triggered for DOI {}. Error: {}", doi, t.getMessage());
        return Mono.empty();
    }

    String selectOpenAccessUrl(JsonNode root) {
        String best = locationUrl(root.path("best_oa_location"));
        if (best != null) {
            return best;
        }
        for (JsonNode location : root.path("oa_locations")) {
            String url = locationUrl(location);
            if (url != null) {
                return url;
            }
        }
        return NO_OPEN_COPY;
    }

    private String locationUrl(JsonNode location) {
        String pdf = ProviderJson.text(location, "url_for_pdf");
        return pdf != null ? pdf : ProviderJson.text(location, "url");
    }
}
