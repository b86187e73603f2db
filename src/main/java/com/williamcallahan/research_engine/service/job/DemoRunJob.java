/**
 * Background job that plays a scripted run for trying out the live event stream
 *
 * @author William Callahan
 *
 * Features:
 * - Emits start, thinking, output and complete events for three sample stages
 * - Pauses between events so a connected client sees them arrive one by one
 * - Stores sample idea, critique and outline artifacts once the events are out
 */

package com.williamcallahan.research_engine.service.job;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.williamcallahan.research_engine.model.EventKinds;
import com.williamcallahan.research_engine.service.ArtifactStoreService;
import com.williamcallahan.research_engine.service.events.RunEventService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.concurrent.CompletableFuture;

@Service
public class DemoRunJob {

    private static final Logger logger = LoggerFactory.getLogger(DemoRunJob.class);

    record ScriptedEvent(String sourceName, String eventKind, String message) {
    }

    static final List<ScriptedEvent> SCRIPT = List.of(
        new ScriptedEvent("IdeaGenerator", EventKinds.START, "Starting idea generation..."),
        new ScriptedEvent("IdeaGenerator", EventKinds.THINKING, "Brainstorming research topics..."),
        new ScriptedEvent("IdeaGenerator", EventKinds.OUTPUT, "Generated idea: AI-assisted drug discovery using transformer architectures"),
        new ScriptedEvent("IdeaGenerator", EventKinds.COMPLETE, "Idea generation complete."),
        new ScriptedEvent("TopicCritic", EventKinds.START, "Starting topic analysis..."),
        new ScriptedEvent("TopicCritic", EventKinds.THINKING, "Evaluating feasibility and novelty..."),
        new ScriptedEvent("TopicCritic", EventKinds.OUTPUT, "Topic is feasible with strong novelty. Suggest narrowing scope to protein folding."),
        new ScriptedEvent("TopicCritic", EventKinds.COMPLETE, "Topic critique complete."),
        new ScriptedEvent("OutlineWriter", EventKinds.START, "Starting outline generation..."),
        new ScriptedEvent("OutlineWriter", EventKinds.THINKING, "Structuring paper sections..."),
        new ScriptedEvent("OutlineWriter", EventKinds.OUTPUT, "Outline: 1. Introduction 2. Background 3. Methods 4. Experiments 5. Conclusion"),
        new ScriptedEvent("OutlineWriter", EventKinds.COMPLETE, "Outline generation complete.")
    );

    private final RunEventService runEventService;
    private final ArtifactStoreService artifactStoreService;
    private final ObjectMapper objectMapper;
    private final long eventDelayMillis;

    public DemoRunJob(RunEventService runEventService,
                      ArtifactStoreService artifactStoreService,
                      ObjectMapper objectMapper,
                      @Value("${app.demo.event-delay-millis:1500}") long eventDelayMillis) {
        this.runEventService = runEventService;
        this.artifactStoreService = artifactStoreService;
        this.objectMapper = objectMapper;
        this.eventDelayMillis = eventDelayMillis;
    }

    @Async("jobTaskExecutor")
    public CompletableFuture<Void> runAsync(String runId) {
        run(runId);
        return CompletableFuture.completedFuture(null);
    }

    public void run(String runId) {
        logger.info("Demo run started for {}", runId);
        for (ScriptedEvent event : SCRIPT) {
            runEventService.appendMessage(runId, event.sourceName(), event.eventKind(), event.message());
            if (!pause()) {
                logger.info("Demo run for {} interrupted", runId);
                return;
            }
        }

        ObjectNode idea = objectMapper.createObjectNode()
            .put("title", "AI-Assisted Drug Discovery Using Transformer Architectures")
            .put("summary", "Exploring how transformer models can accelerate the drug discovery pipeline.");
        ObjectNode critique = objectMapper.createObjectNode()
            .put("feedback", "Strong topic with high novelty. Recommend narrowing to protein folding prediction.")
            .put("score", 8.5);
        ObjectNode outline = objectMapper.createObjectNode();
        outline.putArray("sections")
            .add("Introduction")
            .add("Background & Related Work")
            .add("Methodology")
            .add("Experimental Setup")
            .add("Results & Discussion")
            .add("Conclusion");

        artifactStoreService.put(runId, "idea", idea);
        artifactStoreService.put(runId, "topic_critic", critique);
        artifactStoreService.put(runId, "outline", outline);
        logger.info("Demo run finished for {}", runId);
    }

    private boolean pause() {
        if (eventDelayMillis <= 0) {
            return true;
        }
        try {
            Thread.sleep(eventDelayMillis);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }
}
