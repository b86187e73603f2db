/**
 * Background job that discovers sources for a research project and plans evidence collection
 *
 * @author William Callahan
 *
 * Features:
 * - Generates search keywords, runs the evidence aggregation and drafts the evidence plan
 * - Reports every stage as run events from SourceScout and EvidencePlanner
 * - Stores the sources pack and the evidence plan as new artifact versions
 * - Leaves the run awaiting feedback on success; on any failure emits exactly one System error
 *   event and marks the run failed, keeping whatever was stored before
 */

package com.williamcallahan.research_engine.service.job;

import com.williamcallahan.research_engine.model.EventKinds;
import com.williamcallahan.research_engine.model.EvidencePlan;
import com.williamcallahan.research_engine.model.ResearchBrief;
import com.williamcallahan.research_engine.model.ResultBundle;
import com.williamcallahan.research_engine.model.RunStatus;
import com.williamcallahan.research_engine.service.AggregationRequest;
import com.williamcallahan.research_engine.service.ArtifactStoreService;
import com.williamcallahan.research_engine.service.EvidenceAggregationOrchestrator;
import com.williamcallahan.research_engine.service.RunService;
import com.williamcallahan.research_engine.service.events.RunEventService;
import com.williamcallahan.research_engine.service.generation.EvidencePlanService;
import com.williamcallahan.research_engine.service.generation.KeywordSuggestionService;
import com.williamcallahan.research_engine.util.LoggingUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.concurrent.CompletableFuture;

@Service
public class SourceDiscoveryJob {

    private static final Logger logger = LoggerFactory.getLogger(SourceDiscoveryJob.class);

    public static final String STEP = "phase2_sources";
    public static final String SOURCES_PACK_STEP = "phase2_sources_pack";
    public static final String EVIDENCE_PLAN_STEP = "phase2_evidence_plan";
    private static final int KEYWORD_PREVIEW = 5;
    private static final int ANALYSIS_PREVIEW = 100;

    private final RunService runService;
    private final RunEventService runEventService;
    private final ArtifactStoreService artifactStoreService;
    private final KeywordSuggestionService keywordSuggestionService;
    private final EvidenceAggregationOrchestrator aggregationOrchestrator;
    private final EvidencePlanService evidencePlanService;

    public SourceDiscoveryJob(RunService runService,
                              RunEventService runEventService,
                              ArtifactStoreService artifactStoreService,
                              KeywordSuggestionService keywordSuggestionService,
                              EvidenceAggregationOrchestrator aggregationOrchestrator,
                              EvidencePlanService evidencePlanService) {
        this.runService = runService;
        this.runEventService = runEventService;
        this.artifactStoreService = artifactStoreService;
        this.keywordSuggestionService = keywordSuggestionService;
        this.aggregationOrchestrator = aggregationOrchestrator;
        this.evidencePlanService = evidencePlanService;
    }

    @Async("jobTaskExecutor")
    public CompletableFuture<Void> runAsync(String runId, ResearchBrief brief) {
        run(runId, brief);
        return CompletableFuture.completedFuture(null);
    }

    /**
     * Runs the whole job on the calling thread. Never throws; failures end up on the run.
     */
    public void run(String runId, ResearchBrief brief) {
        try {
            runService.updateStepAndStatus(runId, STEP, RunStatus.RUNNING);

            ResultBundle sources = discoverSources(runId, brief);
            EvidencePlan plan = planEvidence(runId, brief, sources);

            artifactStoreService.putValue(runId, SOURCES_PACK_STEP, sources);
            artifactStoreService.putValue(runId, EVIDENCE_PLAN_STEP, plan);

            runService.updateStepAndStatus(runId, STEP, RunStatus.AWAITING_FEEDBACK);
        } catch (RuntimeException e) {
            LoggingUtils.error(logger, e, "Source discovery failed for run {}", runId);
            runEventService.appendMessage(runId, EventKinds.SYSTEM, EventKinds.ERROR,
                "Sources & evidence pipeline failed: " + e.getMessage());
            runService.updateStepAndStatus(runId, null, RunStatus.FAILED);
        }
    }

    private ResultBundle discoverSources(String runId, ResearchBrief brief) {
        scout(runId, EventKinds.START, "Starting source discovery across academic and web databases...");
        scout(runId, EventKinds.THINKING, "Generating targeted search keywords...");

        List<String> keywords = await(keywordSuggestionService.suggestKeywords(brief), "keyword generation");
        scout(runId, EventKinds.THINKING, String.format("Generated %d search keywords: %s%s",
            keywords.size(),
            String.join(", ", keywords.subList(0, Math.min(KEYWORD_PREVIEW, keywords.size()))),
            keywords.size() > KEYWORD_PREVIEW ? "..." : ""));

        ResultBundle sources = await(aggregationOrchestrator.aggregate(
            new AggregationRequest(brief, keywords),
            (eventKind, message) -> scout(runId, eventKind, message)), "source aggregation");

        int total = sources.papers().size() + sources.datasets().size() + sources.tools().size()
            + sources.learningResources().size();
        scout(runId, EventKinds.COMPLETE, "Source discovery complete. " + total + " total resources with links.");
        return sources;
    }

    private EvidencePlan planEvidence(String runId, ResearchBrief brief, ResultBundle sources) {
        planner(runId, EventKinds.START, "Generating evidence collection plan based on selected approach...");
        planner(runId, EventKinds.THINKING, String.format("Designing evidence plan for %s approach with %s time budget...",
            brief.approachLabel(), brief.constraints().timeBudget()));

        EvidencePlan plan = await(evidencePlanService.plan(brief, sources), "evidence planning");

        String analysis = plan.analysisOverview().isEmpty() ? "N/A" : plan.analysisOverview();
        planner(runId, EventKinds.OUTPUT, String.format("Evidence type: %s. Collection plan: %d steps. Analysis: %s...",
            plan.evidenceType(),
            plan.collectionStrategy().size(),
            analysis.substring(0, Math.min(ANALYSIS_PREVIEW, analysis.length()))));
        planner(runId, EventKinds.COMPLETE, "Evidence collection plan complete.");
        return plan;
    }

    private void scout(String runId, String eventKind, String message) {
        runEventService.appendMessage(runId, EventKinds.SOURCE_SCOUT, eventKind, message);
    }

    private void planner(String runId, String eventKind, String message) {
        runEventService.appendMessage(runId, EventKinds.EVIDENCE_PLANNER, eventKind, message);
    }

    private static <T> T await(Mono<T> result, String stage) {
        T value = result.block();
        if (value == null) {
            throw new IllegalStateException(stage + " produced no result");
        }
        return value;
    }
}
