/**
 * Service for searching scholarly works through the OpenAlex API
 *
 * @author William Callahan
 *
 * Features:
 * - Keyword search over /works ordered by citation count
 * - Joins the polite pool when a contact address is configured
 * - Maps authorships, DOI, venue and open-access location onto provider records
 * - Returns an empty list instead of failing when OpenAlex is unavailable
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
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.web.util.UriComponentsBuilder;
import reactor.core.publisher.Mono;

import java.net.URI;
import java.util.ArrayList;
import java.util.List;

@Service
public class OpenAlexService {

    private static final Logger logger = LoggerFactory.getLogger(OpenAlexService.class);
    private static final String API_NAME = "OpenAlex";
    private static final String ENDPOINT = "openalex/works";

    private final ResilientFetchClient fetchClient;
    private final ObjectMapper objectMapper;
    private final ProviderConfigurationProperties.OpenAlex settings;

    public OpenAlexService(ResilientFetchClient fetchClient,
                           ObjectMapper objectMapper,
                           ProviderConfigurationProperties providerProperties) {
        this.fetchClient = fetchClient;
        this.objectMapper = objectMapper;
        this.settings = providerProperties.getOpenAlex();
    }

    /**
     * Searches OpenAlex works for the given keywords, most cited first
     *
     * @param keywords search keywords, joined with spaces into one query
     * @param limit    maximum number of works to request
     * @return Mono emitting the mapped records; an empty list on any failure
     */
    @CircuitBreaker(name = "openAlex", fallbackMethod = "searchPapersFallback")
    public Mono<List<ProviderRecord>> searchPapers(List<String> keywords, int limit) {
        if (ValidationUtils.isNullOrEmpty(keywords)) {
            return Mono.just(List.of());
        }
        String query = String.join(" ", keywords);
        ExternalApiLogger.logApiCallAttempt(logger, API_NAME, "searchPapers", query);

        UriComponentsBuilder uri = UriComponentsBuilder.fromHttpUrl(settings.getBaseUrl())
            .path("/works")
            .queryParam("search", query)
            .queryParam("per_page", limit)
            .queryParam("sort", "cited_by_count:desc");
        if (ValidationUtils.hasText(settings.getMailto())) {
            uri.queryParam("mailto", settings.getMailto());
        }
        URI target = uri.encode().build().toUri();

        return fetchClient.fetch(FetchRequest.get(ENDPOINT, target))
            .flatMap(response -> Mono.justOrEmpty(response.json(objectMapper)))
            .map(root -> ProviderJson.mapArray(root.path("results"), this::parseWork))
            .doOnNext(records -> ExternalApiLogger.logApiCallSuccess(logger, API_NAME, "searchPapers", query, records.size()))
            .switchIfEmpty(Mono.<List<ProviderRecord>>fromSupplier(() -> {
                ExternalApiLogger.logApiCallFailure(logger, API_NAME, "searchPapers", query, "no usable response");
                return List.of();
            }));
    }

    public Mono<List<ProviderRecord>> searchPapersFallback(List<String> keywords, int limit, Throwable t) {
        logger.warn("OpenAlexService.searchPapers fallback triggered for keywords {}. Error: {}", keywords, t.getMessage());
        return Mono.just(List.of());
    }

    ProviderRecord parseWork(JsonNode work) {
        List<String> authors = new ArrayList<>();
        for (JsonNode authorship : work.path("authorships")) {
            String name = ProviderJson.text(authorship.path("author"), "display_name");
            if (name != null) {
                authors.add(name);
            }
        }

        String rawDoi = ProviderJson.text(work, "doi");
        String url = rawDoi != null ? rawDoi : ProviderJson.text(work, "id");
        String venue = ProviderJson.text(work.path("primary_location").path("source"), "display_name");
        String openAccessUrl = ProviderJson.text(work.path("open_access"), "oa_url");

        return new ProviderRecord(
            ProviderJson.text(work, "display_name"),
            authors,
            ProviderJson.integer(work, "publication_year"),
            venue,
            DoiUtils.normalize(rawDoi),
            url,
            null,
            ProviderJson.integer(work, "cited_by_count"),
            null,
            null,
            openAccessUrl,
            Provenance.OPENALEX
        );
    }
}
