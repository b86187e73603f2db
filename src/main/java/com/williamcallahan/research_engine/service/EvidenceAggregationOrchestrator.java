/**
 * Orchestrates one evidence aggregation across academic and web providers
 *
 * @author William Callahan
 *
 * Features:
 * - Searches OpenAlex and Semantic Scholar concurrently; a failing provider contributes nothing
 *   and is reported as a warning instead of aborting the aggregation
 * - Merges both paper lists, then verifies DOIs with Crossref and resolves open-access copies
 *   with Unpaywall concurrently
 * - Has papers ranked and annotated, with provenance restored afterwards
 * - Fans out web searches for datasets, learning resources and tools, removes repeated URLs
 *   across categories and has each category filtered
 * - Reports progress through an {@link AggregationProgressListener} in a fixed order
 *
 * Provider calls run on the WebClient event loop; everything that reports progress is moved to
 * the bounded elastic scheduler first, since listeners may block on storage.
 */

package com.williamcallahan.research_engine.service;

import com.williamcallahan.research_engine.config.AppConfigurationProperties;
import com.williamcallahan.research_engine.config.ProviderConfigurationProperties;
import com.williamcallahan.research_engine.model.BundleMetadata;
import com.williamcallahan.research_engine.model.CanonicalRecord;
import com.williamcallahan.research_engine.model.DatasetEntry;
import com.williamcallahan.research_engine.model.EventKinds;
import com.williamcallahan.research_engine.model.LearningResourceEntry;
import com.williamcallahan.research_engine.model.ProviderRecord;
import com.williamcallahan.research_engine.model.ResearchBrief;
import com.williamcallahan.research_engine.model.ResultBundle;
import com.williamcallahan.research_engine.model.ToolEntry;
import com.williamcallahan.research_engine.model.WebHit;
import com.williamcallahan.research_engine.service.generation.PaperRankingService;
import com.williamcallahan.research_engine.service.generation.ResourceCurationService;
import com.williamcallahan.research_engine.service.merge.PaperMergeService;
import com.williamcallahan.research_engine.service.merge.WebHitDeduplicator;
import com.williamcallahan.research_engine.service.provider.CrossrefService;
import com.williamcallahan.research_engine.service.provider.CrossrefWork;
import com.williamcallahan.research_engine.service.provider.OpenAlexService;
import com.williamcallahan.research_engine.service.provider.SemanticScholarService;
import com.williamcallahan.research_engine.service.provider.TavilySearchService;
import com.williamcallahan.research_engine.service.provider.UnpaywallService;
import com.williamcallahan.research_engine.util.DoiUtils;
import com.williamcallahan.research_engine.util.LoggingUtils;
import com.williamcallahan.research_engine.util.ReactiveJoinUtils;
import com.williamcallahan.research_engine.util.ReactiveJoinUtils.JoinOutcome;
import com.williamcallahan.research_engine.util.ValidationUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

@Service
public class EvidenceAggregationOrchestrator {

    private static final Logger logger = LoggerFactory.getLogger(EvidenceAggregationOrchestrator.class);

    static final List<String> SOURCE_PROVIDERS = List.of("openalex", "semanticscholar", "crossref", "unpaywall", "tavily");
    private static final int WARNING_DETAIL_LENGTH = 100;

    private final OpenAlexService openAlexService;
    private final SemanticScholarService semanticScholarService;
    private final CrossrefService crossrefService;
    private final UnpaywallService unpaywallService;
    private final TavilySearchService tavilySearchService;
    private final PaperMergeService paperMergeService;
    private final PaperRankingService paperRankingService;
    private final ResourceCurationService resourceCurationService;
    private final AppConfigurationProperties.Aggregation settings;
    private final ProviderConfigurationProperties providerProperties;

    public EvidenceAggregationOrchestrator(OpenAlexService openAlexService,
                                           SemanticScholarService semanticScholarService,
                                           CrossrefService crossrefService,
                                           UnpaywallService unpaywallService,
                                           TavilySearchService tavilySearchService,
                                           PaperMergeService paperMergeService,
                                           PaperRankingService paperRankingService,
                                           ResourceCurationService resourceCurationService,
                                           AppConfigurationProperties appProperties,
                                           ProviderConfigurationProperties providerProperties) {
        this.openAlexService = openAlexService;
        this.semanticScholarService = semanticScholarService;
        this.crossrefService = crossrefService;
        this.unpaywallService = unpaywallService;
        this.tavilySearchService = tavilySearchService;
        this.paperMergeService = paperMergeService;
        this.paperRankingService = paperRankingService;
        this.resourceCurationService = resourceCurationService;
        this.settings = appProperties.getAggregation();
        this.providerProperties = providerProperties;
    }

    /**
     * Runs a full aggregation.
     *
     * @param request  brief and search keywords
     * @param listener receives progress messages in order
     * @return Mono emitting the assembled bundle; provider failures never make it error, ranking
     *         and classification problems only when the collaborator itself is unreachable
     */
    public Mono<ResultBundle> aggregate(AggregationRequest request, AggregationProgressListener listener) {
        ResearchBrief brief = request.brief();
        logger.info("Starting aggregation for topic '{}' with {} keywords", brief.topicTitle(), request.searchKeywords().size());

        return searchPapers(request.searchKeywords(), listener)
            .flatMap(merged -> enrichWithDoiLookups(merged, listener))
            .flatMap(merged -> {
                listener.onProgress(EventKinds.RANKING, "Ranking and annotating papers by relevance...");
                return paperRankingService.rank(brief, merged);
            })
            .publishOn(Schedulers.boundedElastic())
            .flatMap(papers -> discoverWebResources(brief, listener)
                .map(resources -> assemble(request, papers, resources)))
            .doOnNext(bundle -> {
                listener.onProgress(EventKinds.RANKING, String.format(
                    "Final resources: %d papers, %d datasets, %d tools, %d learning resources",
                    bundle.papers().size(), bundle.datasets().size(), bundle.tools().size(),
                    bundle.learningResources().size()));
                logger.info("Aggregation for topic '{}' finished with {} papers", brief.topicTitle(), bundle.papers().size());
            });
    }

    Mono<List<CanonicalRecord>> searchPapers(List<String> keywords, AggregationProgressListener listener) {
        List<String> openAlexKeywords = head(keywords, settings.getOpenAlexKeywordLimit());
        String semanticScholarQuery = String.join(" ", head(keywords, settings.getSemanticScholarKeywordLimit()));

        return ReactiveJoinUtils.joinBoth(
                "OpenAlex",
                Mono.defer(() -> openAlexService.searchPapers(openAlexKeywords,
                    providerProperties.getOpenAlex().getResultsPerPage())),
                "Semantic Scholar",
                Mono.defer(() -> semanticScholarService.searchPapers(semanticScholarQuery,
                    providerProperties.getSemanticScholar().getResultLimit())))
            .publishOn(Schedulers.boundedElastic())
            .map(outcomes -> {
                List<ProviderRecord> openAlex = papersOrWarn(outcomes.getT1(), listener);
                List<ProviderRecord> semanticScholar = papersOrWarn(outcomes.getT2(), listener);
                List<CanonicalRecord> merged = paperMergeService.merge(openAlex, semanticScholar);
                listener.onProgress(EventKinds.SEARCHING, String.format(
                    "Found %d papers from OpenAlex, %d from Semantic Scholar, %d unique after dedup",
                    openAlex.size(), semanticScholar.size(), merged.size()));
                return merged;
            });
    }

    Mono<List<CanonicalRecord>> enrichWithDoiLookups(List<CanonicalRecord> merged, AggregationProgressListener listener) {
        List<String> dois = merged.stream()
            .map(CanonicalRecord::getDoi)
            .filter(ValidationUtils::hasText)
            .limit(settings.getVerificationLimit())
            .toList();

        Mono<List<JoinOutcome<CrossrefWork>>> verifications = ReactiveJoinUtils.joinAll(
            taskNames("crossref", dois),
            dois.stream().map(doi -> Mono.defer(() -> crossrefService.verifyDoi(doi))).toList());
        Mono<List<JoinOutcome<String>>> openAccess = ReactiveJoinUtils.joinAll(
            taskNames("unpaywall", dois),
            dois.stream().map(doi -> Mono.defer(() -> unpaywallService.getOpenAccessUrl(doi))).toList());

        return Mono.zip(verifications, openAccess)
            .publishOn(Schedulers.boundedElastic())
            .map(results -> {
                Map<String, CrossrefWork> verified = byNormalizedDoi(dois, results.getT1());
                for (CanonicalRecord paper : merged) {
                    CrossrefWork work = verified.get(DoiUtils.normalize(paper.getDoi()));
                    if (work != null) {
                        applyVerification(paper, work);
                    }
                }
                listener.onProgress(EventKinds.SEARCHING, String.format("Verified %d DOIs via Crossref", verified.size()));

                Map<String, String> openCopies = byNormalizedDoi(dois, results.getT2());
                for (CanonicalRecord paper : merged) {
                    String openCopy = openCopies.get(DoiUtils.normalize(paper.getDoi()));
                    if (ValidationUtils.hasText(openCopy)) {
                        paper.setPdfUrl(openCopy);
                        if (!ValidationUtils.hasText(paper.getOpenAccessUrl())) {
                            paper.setOpenAccessUrl(openCopy);
                        }
                    }
                }
                listener.onProgress(EventKinds.SEARCHING,
                    String.format("Found %d open-access PDFs via Unpaywall", openCopies.size()));
                return merged;
            });
    }

    Mono<WebResources> discoverWebResources(ResearchBrief brief, AggregationProgressListener listener) {
        listener.onProgress(EventKinds.SEARCHING, "Searching for datasets, learning resources, and tools via Tavily...");

        List<String> datasetQueries = datasetQueries(brief);
        List<String> learningQueries = learningResourceQueries(brief);
        List<String> toolQueries = toolQueries(brief);
        List<String> allQueries = new ArrayList<>(datasetQueries);
        allQueries.addAll(learningQueries);
        allQueries.addAll(toolQueries);

        int maxResults = providerProperties.getTavily().getMaxResults();
        List<Mono<List<WebHit>>> searches = allQueries.stream()
            .map(query -> Mono.defer(() -> tavilySearchService.searchWeb(query, maxResults)))
            .toList();

        return ReactiveJoinUtils.joinAll(allQueries, searches)
            .publishOn(Schedulers.boundedElastic())
            .flatMap(outcomes -> {
                int datasetEnd = datasetQueries.size();
                int learningEnd = datasetEnd + learningQueries.size();
                List<List<WebHit>> deduplicated = WebHitDeduplicator.dedupeByUrl(List.of(
                    flatten(outcomes.subList(0, datasetEnd)),
                    flatten(outcomes.subList(datasetEnd, learningEnd)),
                    flatten(outcomes.subList(learningEnd, outcomes.size()))));
                List<WebHit> datasetHits = cap(deduplicated.get(0));
                List<WebHit> learningHits = cap(deduplicated.get(1));
                List<WebHit> toolHits = cap(deduplicated.get(2));

                listener.onProgress(EventKinds.SEARCHING, String.format(
                    "Found %d dataset, %d learning resource, and %d tool results via Tavily",
                    datasetHits.size(), learningHits.size(), toolHits.size()));

                return curateSequentially(brief, datasetHits, learningHits, toolHits, listener);
            });
    }

    /**
     * Classification calls run one after another so their progress messages keep a fixed order.
     */
    private Mono<WebResources> curateSequentially(ResearchBrief brief,
                                                  List<WebHit> datasetHits,
                                                  List<WebHit> learningHits,
                                                  List<WebHit> toolHits,
                                                  AggregationProgressListener listener) {
        Mono<List<DatasetEntry>> datasets = Mono.defer(() -> resourceCurationService.selectDatasets(brief, datasetHits))
            .publishOn(Schedulers.boundedElastic())
            .doOnNext(selected -> listener.onProgress(EventKinds.SEARCHING,
                String.format("Identified %d real datasets after filtering", selected.size())));
        Mono<List<LearningResourceEntry>> learningResources = Mono.defer(
                () -> resourceCurationService.selectLearningResources(brief, learningHits))
            .publishOn(Schedulers.boundedElastic())
            .doOnNext(selected -> listener.onProgress(EventKinds.SEARCHING,
                String.format("Selected %d relevant learning resources after filtering", selected.size())));
        Mono<List<ToolEntry>> tools = Mono.defer(() -> {
                listener.onProgress(EventKinds.THINKING,
                    String.format("Filtering %d tool results for relevance...", toolHits.size()));
                return resourceCurationService.selectTools(brief, toolHits);
            })
            .publishOn(Schedulers.boundedElastic());

        return datasets.flatMap(selectedDatasets -> learningResources.flatMap(selectedResources -> tools.map(
            selectedTools -> new WebResources(selectedDatasets, selectedResources, selectedTools))));
    }

    static List<String> datasetQueries(ResearchBrief brief) {
        List<String> queries = new ArrayList<>();
        queries.add(brief.topicTitle() + " dataset");
        queries.add(brief.topicTitle() + " open data benchmark");
        if (!brief.topicKeywords().isEmpty()) {
            queries.add(brief.topicKeywords().get(0) + " dataset repository");
        }
        return queries;
    }

    static List<String> learningResourceQueries(ResearchBrief brief) {
        String title = brief.selectedTitle();
        return List.of(
            title + " tutorial guide",
            title + " online course",
            title + " YouTube",
            title + " introduction overview"
        );
    }

    static List<String> toolQueries(ResearchBrief brief) {
        List<String> queries = new ArrayList<>();
        queries.add(brief.selectedTitle() + " software tools library");
        queries.add(brief.selectedTitle() + " research tools platform");
        queries.add(brief.topicTitle() + " " + brief.approachLabel() + " tools github");
        if (brief.topicKeywords().size() >= 2) {
            queries.add(brief.topicKeywords().get(0) + " " + brief.topicKeywords().get(1) + " library framework");
        }
        return queries;
    }

    private ResultBundle assemble(AggregationRequest request, List<CanonicalRecord> papers, WebResources resources) {
        ResearchBrief brief = request.brief();
        BundleMetadata metadata = new BundleMetadata(Instant.now(), brief.topicTitle(), brief.approachLabel(),
            request.searchKeywords(), SOURCE_PROVIDERS);
        return new ResultBundle(metadata, papers, resources.datasets(), resources.tools(), resources.learningResources());
    }

    private List<ProviderRecord> papersOrWarn(JoinOutcome<List<ProviderRecord>> outcome, AggregationProgressListener listener) {
        if (outcome.isSuccess()) {
            return outcome.valueOr(List.of());
        }
        LoggingUtils.warn(logger, outcome.error(), "{} search failed during aggregation", outcome.taskName());
        listener.onProgress(EventKinds.WARNING,
            outcome.taskName() + " search failed: " + truncate(LoggingUtils.describe(outcome.error())));
        return List.of();
    }

    private static void applyVerification(CanonicalRecord paper, CrossrefWork work) {
        if (!ValidationUtils.hasText(paper.getVenue()) && ValidationUtils.hasText(work.venue())) {
            paper.setVenue(work.venue());
        }
        if (!ValidationUtils.isPositive(paper.getYear()) && ValidationUtils.isPositive(work.year())) {
            paper.setYear(work.year());
        }
        if (!ValidationUtils.hasText(paper.getUrl()) && ValidationUtils.hasText(work.url())) {
            paper.setUrl(work.url());
        }
    }

    private static <T> Map<String, T> byNormalizedDoi(List<String> dois, List<JoinOutcome<T>> outcomes) {
        Map<String, T> byDoi = new HashMap<>();
        for (int i = 0; i < outcomes.size(); i++) {
            T value = outcomes.get(i).valueOr(null);
            String normalized = DoiUtils.normalize(dois.get(i));
            if (value != null && normalized != null) {
                byDoi.put(normalized, value);
            }
        }
        return byDoi;
    }

    private static List<String> taskNames(String prefix, List<String> dois) {
        return dois.stream().map(doi -> prefix + ":" + doi).toList();
    }

    private static List<WebHit> flatten(List<JoinOutcome<List<WebHit>>> outcomes) {
        List<WebHit> hits = new ArrayList<>();
        for (JoinOutcome<List<WebHit>> outcome : outcomes) {
            if (!outcome.isSuccess()) {
                LoggingUtils.warn(logger, outcome.error(), "Web search '{}' failed during aggregation", outcome.taskName());
            }
            hits.addAll(outcome.valueOr(List.of()));
        }
        return hits;
    }

    private List<WebHit> cap(List<WebHit> hits) {
        return hits.size() <= settings.getWebCandidateLimit() ? hits : List.copyOf(hits.subList(0, settings.getWebCandidateLimit()));
    }

    private static List<String> head(List<String> values, int limit) {
        return values.size() <= limit ? values : values.subList(0, limit);
    }

    private static String truncate(String detail) {
        return detail.length() <= WARNING_DETAIL_LENGTH ? detail : detail.substring(0, WARNING_DETAIL_LENGTH);
    }

    record WebResources(List<DatasetEntry> datasets, List<LearningResourceEntry> learningResources, List<ToolEntry> tools) {
    }
}
