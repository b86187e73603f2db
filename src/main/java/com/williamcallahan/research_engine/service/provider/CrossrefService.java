/**
 * Service for DOI verification and metadata search through the Crossref REST API
 *
 * @author William Callahan
 *
 * Features:
 * - Verifies a DOI via /works/{doi} and returns its cleaned metadata
 * - Free-text search via /works ordered by relevance
 * - Identifies itself with a polite User-Agent carrying the contact address
 * - Caches successful verifications per normalized DOI
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
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Service;
import org.springframework.web.util.UriComponentsBuilder;
import reactor.core.publisher.Mono;

import java.net.URI;
import java.util.ArrayList;
import java.util.List;

@Service
public class CrossrefService {

    private static final Logger logger = LoggerFactory.getLogger(CrossrefService.class);
    private static final String API_NAME = "Crossref";
    private static final String USER_AGENT = "ResearchEngine/1.0 (https://github.com/williamcallahan/research-engine)";
    private static final List<String> YEAR_FIELDS = List.of("published-print", "published-online", "created");

    private final ResilientFetchClient fetchClient;
    private final ObjectMapper objectMapper;
    private final ProviderConfigurationProperties.Crossref settings;
    private final Cache<String, CrossrefWork> doiVerificationCache;

    public CrossrefService(ResilientFetchClient fetchClient,
                           ObjectMapper objectMapper,
                           ProviderConfigurationProperties providerProperties,
                           Cache<String, CrossrefWork> doiVerificationCache) {
        this.fetchClient = fetchClient;
        this.objectMapper = objectMapper;
        this.settings = providerProperties.getCrossref();
        this.doiVerificationCache = doiVerificationCache;
    }

    /**
     * Verifies a DOI against Crossref
     *
     * @param doi DOI in any common form
     * @return Mono emitting the registered metadata, or empty when unknown or unavailable
     */
    @CircuitBreaker(name = "crossref", fallbackMethod = "verifyDoiFallback")
    public Mono<CrossrefWork> verifyDoi(String doi) {
        String normalized = DoiUtils.normalize(doi);
        if (normalized == null) {
            return Mono.empty();
        }
        CrossrefWork cached = doiVerificationCache.getIfPresent(normalized);
        if (cached != null) {
            logger.debug("Crossref verification cache hit for DOI {}", normalized);
            return Mono.just(cached);
        }
        ExternalApiLogger.logApiCallAttempt(logger, API_NAME, "verifyDoi", normalized);
        URI target = UriComponentsBuilder.fromHttpUrl(settings.getBaseUrl())
            .path("/works/{doi}")
            .buildAndExpand(normalized)
            .encode()
            .toUri();

        return fetchClient.fetch(politely(FetchRequest.get("crossref/works/doi", target)))
            .flatMap(response -> Mono.justOrEmpty(response.json(objectMapper)))
            .map(root -> root.path("message"))
            .filter(JsonNode::isObject)
            .map(this::parseWork)
            .doOnNext(work -> {
                doiVerificationCache.put(normalized, work);
                ExternalApiLogger.logApiCallSuccess(logger, API_NAME, "verifyDoi", normalized, 1);
            });
    }

    /**
     * Searches Crossref works by free text, most relevant first
     */
    @CircuitBreaker(name = "crossref", fallbackMethod = "searchWorksFallback")
    public Mono<List<CrossrefWork>> searchWorks(String query, int limit) {
        if (!ValidationUtils.hasText(query)) {
            return Mono.just(List.of());
        }
        ExternalApiLogger.logApiCallAttempt(logger, API_NAME, "searchWorks", query);
        URI target = UriComponentsBuilder.fromHttpUrl(settings.getBaseUrl())
            .path("/works")
            .queryParam("query", query)
            .queryParam("rows", limit)
            .queryParam("sort", "relevance")
            .encode()
            .build()
            .toUri();

        return fetchClient.fetch(politely(FetchRequest.get("crossref/works", target)))
            .flatMap(response -> Mono.justOrEmpty(response.json(objectMapper)))
            .map(root -> ProviderJson.mapArray(root.path("message").path("items"), this::parseWork))
            .doOnNext(works -> ExternalApiLogger.logApiCallSuccess(logger, API_NAME, "searchWorks", query, works.size()))
            .switchIfEmpty(Mono.<List<CrossrefWork>>fromSupplier(() -> {
                ExternalApiLogger.logApiCallFailure(logger, API_NAME, "searchWorks", query, "no usable response");
                return List.of();
            }));
    }

    public Mono<CrossrefWork> verifyDoiFallback(String doi, Throwable t) {
        logger.warn("CrossrefService.verifyDoi fallback triggered for DOI {}. Error: {}", doi, t.getMessage());
        return Mono.empty();
    }

    public Mono<List<CrossrefWork>> searchWorksFallback(String query, int limit, Throwable t) {
        logger.warn("CrossrefService.searchWorks fallback triggered for query '{}'. Error: {}", query, t.getMessage());
        return Mono.just(List.of());
    }

    String userAgent() {
        return ValidationUtils.hasText(settings.getMailto())
            ? USER_AGENT + " mailto:" + settings.getMailto()
            : USER_AGENT;
    }

    private FetchRequest politely(FetchRequest request) {
        return request.withHeader(HttpHeaders.USER_AGENT, userAgent());
    }

    CrossrefWork parseWork(JsonNode work) {
        List<String> authors = new ArrayList<>();
        for (JsonNode author : work.path("author")) {
            String given = ProviderJson.text(author, "given");
            String family = ProviderJson.text(author, "family");
            String name = ((given != null ? given : "") + " " + (family != null ? family : "")).trim();
            if (!name.isEmpty()) {
                authors.add(name);
            }
        }
        return new CrossrefWork(
            ProviderJson.firstText(work, "title"),
            authors,
            publicationYear(work),
            ProviderJson.firstText(work, "container-title"),
            ProviderJson.text(work, "DOI"),
            ProviderJson.text(work, "URL"),
            ProviderJson.text(work, "type")
        );
    }

    /**
     * First year found in published-print, then published-online, then created.
     */
    private Integer publicationYear(JsonNode work) {
        for (String field : YEAR_FIELDS) {
            JsonNode firstPart = work.path(field).path("date-parts").path(0).path(0);
            if (firstPart.isNumber() && firstPart.asInt() != 0) {
                return firstPart.asInt();
            }
        }
        return null;
    }
}
