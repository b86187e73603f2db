/**
 * Service for paper search and lookup against the Semantic Scholar Graph API
 *
 * @author William Callahan
 *
 * Features:
 * - Relevance search over /paper/search with citation and influence counts
 * - Single-paper lookup by Semantic Scholar id or DOI
 * - Sends x-api-key when a key is configured, otherwise uses the shared public pool
 * - Rate limited and circuit broken through Resilience4j
 */

package com.williamcallahan.research_engine.service.provider;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.williamcallahan.research_engine.config.ProviderConfigurationProperties;
import com.williamcallahan.research_engine.model.Provenance;
import com.williamcallahan.research_engine.model.ProviderRecord;
import com.williamcallahan.research_engine.service.fetch.FetchRequest;
import com.williamcallahan.research_engine.service.fetch.ResilientFetchClient;
import com.williamcallahan.research_engine.util.DoiUtils;
import com.williamcallahan.research_engine.util.ExternalApiLogger;
import com.williamcallahan.research_engine.util.ValidationUtils;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.github.resilience4j.ratelimiter.annotation.RateLimiter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.web.util.UriComponentsBuilder;
import reactor.core.publisher.Mono;

import java.net.URI;
import java.util.ArrayList;
import java.util.List;

@Service
public class SemanticScholarService {

    private static final Logger logger = LoggerFactory.getLogger(SemanticScholarService.class);
    private static final String API_NAME = "SemanticScholar";
    static final String FIELDS = "title,authors,year,venue,citationCount,influentialCitationCount,abstract,externalIds,url,openAccessPdf";

    private final ResilientFetchClient fetchClient;
    private final ObjectMapper objectMapper;
    private final ProviderConfigurationProperties.SemanticScholar settings;

    public SemanticScholarService(ResilientFetchClient fetchClient,
                                  ObjectMapper objectMapper,
                                  ProviderConfigurationProperties providerProperties) {
        this.fetchClient = fetchClient;
        this.objectMapper = objectMapper;
        this.settings = providerProperties.getSemanticScholar();
    }

    /**
     * Searches Semantic Scholar papers by free-text query
     *
     * @param query search query
     * @param limit maximum number of papers
     * @return Mono emitting mapped records; an empty list on any failure
     */
    @RateLimiter(name = "semanticScholar")
    @CircuitBreaker(name = "semanticScholar", fallbackMethod = "searchPapersFallback")
    public Mono<List<ProviderRecord>> searchPapers(String query, int limit) {
        if (!ValidationUtils.hasText(query)) {
            return Mono.just(List.of());
        }
        ExternalApiLogger.logApiCallAttempt(logger, API_NAME, "searchPapers", query);
        URI target = UriComponentsBuilder.fromHttpUrl(settings.getBaseUrl())
            .path("/paper/search")
            .queryParam("query", query)
            .queryParam("limit", limit)
            .queryParam("fields", FIELDS)
            .encode()
            .build()
            .toUri();

        return fetchClient.fetch(authorize(FetchRequest.get("semanticscholar/paper/search", target)))
            .flatMap(response -> Mono.justOrEmpty(response.json(objectMapper)))
            .map(root -> ProviderJson.mapArray(root.path("data"), this::parsePaper))
            .doOnNext(records -> ExternalApiLogger.logApiCallSuccess(logger, API_NAME, "searchPapers", query, records.size()))
            .switchIfEmpty(Mono.<List<ProviderRecord>>fromSupplier(() -> {
                ExternalApiLogger.logApiCallFailure(logger, API_NAME, "searchPapers", query, "no usable response");
                return List.of();
            }));
    }

    /**
     * Looks up one paper by Semantic Scholar id, or by DOI using the {@code DOI:} prefix
     *
     * @param paperId paper identifier
     * @return Mono emitting the record, or empty when unavailable or unknown
     */
    @RateLimiter(name = "semanticScholar")
    @CircuitBreaker(name = "semanticScholar", fallbackMethod = "getPaperDetailsFallback")
    public Mono<ProviderRecord> getPaperDetails(String paperId) {
        if (!ValidationUtils.hasText(paperId)) {
            return Mono.empty();
        }
        ExternalApiLogger.logApiCallAttempt(logger, API_NAME, "getPaperDetails", paperId);
        URI target = UriComponentsBuilder.fromHttpUrl(settings.getBaseUrl())
            .path("/paper/{paperId}")
            .queryParam("fields", FIELDS)
            .buildAndExpand(paperId)
            .encode()
            .toUri();

        return fetchClient.fetch(authorize(FetchRequest.get("semanticscholar/paper", target)))
            .flatMap(response -> Mono.justOrEmpty(response.json(objectMapper)))
            .filter(JsonNode::isObject)
            .map(this::parsePaper);
    }

    public Mono<List<ProviderRecord>> searchPapersFallback(String query, int limit, Throwable t) {
        logger.warn("SemanticScholarService.searchPapers fallback triggered for query '{}'. Error: {}", query, t.getMessage());
        return Mono.just(List.of());
    }

    public Mono<ProviderRecord> getPaperDetailsFallback(String paperId, Throwable t) {
        logger.warn("SemanticScholarService.getPaperDetails fallback triggered for paper {}. Error: {}", paperId, t.getMessage());
        return Mono.empty();
    }

    private FetchRequest authorize(FetchRequest request) {
        return ValidationUtils.hasText(settings.getApiKey())
            ? request.withHeader("x-api-key", settings.getApiKey())
            : request;
    }

    ProviderRecord parsePaper(JsonNode paper) {
        List<String> authors = new ArrayList<>();
        for (JsonNode author : paper.path("authors")) {
            String name = ProviderJson.text(author, "name");
            if (name != null) {
                authors.add(name);
            }
        }
        return new ProviderRecord(
            ProviderJson.text(paper, "title"),
            authors,
            ProviderJson.integer(paper, "year"),
            ProviderJson.text(paper, "venue"),
            DoiUtils.normalize(ProviderJson.text(paper.path("externalIds"), "DOI")),
            ProviderJson.text(paper, "url"),
            ProviderJson.text(paper.path("openAccessPdf"), "url"),
            ProviderJson.integer(paper, "citationCount"),
            ProviderJson.integer(paper, "influentialCitationCount"),
            ProviderJson.text(paper, "abstract"),
            null,
            Provenance.SEMANTIC_SCHOLAR
        );
    }
}
