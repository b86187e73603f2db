/**
 * REST controller for runs, their artifacts and their durable event log
 *
 * @author William Callahan
 *
 * Features:
 * - Creates runs and reports their current step and status
 * - Stores artifacts as new versions and lists the latest version per step
 * - Appends events posted by external stages and broadcasts them to live subscribers
 * - Returns the durable event log in append order
 * - Answers 404 for unknown runs and 400 for incomplete bodies
 */

package com.williamcallahan.research_engine.controller;

import com.williamcallahan.research_engine.controller.dto.CreateArtifactRequest;
import com.williamcallahan.research_engine.controller.dto.CreateLogRequest;
import com.williamcallahan.research_engine.controller.dto.CreateRunRequest;
import com.williamcallahan.research_engine.model.Artifact;
import com.williamcallahan.research_engine.model.Run;
import com.williamcallahan.research_engine.model.RunEvent;
import com.williamcallahan.research_engine.service.ArtifactStoreService;
import com.williamcallahan.research_engine.service.RunService;
import com.williamcallahan.research_engine.service.events.RunEventService;
import com.williamcallahan.research_engine.util.ValidationUtils;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

import java.util.ArrayList;
import java.util.List;

@RestController
@RequestMapping("/api/runs")
public class RunController {

    private final RunService runService;
    private final ArtifactStoreService artifactStoreService;
    private final RunEventService runEventService;

    public RunController(RunService runService,
                         ArtifactStoreService artifactStoreService,
                         RunEventService runEventService) {
        this.runService = runService;
        this.artifactStoreService = artifactStoreService;
        this.runEventService = runEventService;
    }

    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    public Run createRun(@RequestBody(required = false) CreateRunRequest request) {
        return runService.create(request != null ? request.step() : null);
    }

    @GetMapping("/{runId}")
    public Run getRun(@PathVariable String runId) {
        return runService.require(runId);
    }

    /**
     * Stores the content as the next version for its step
     *
     * @return the stored artifact with its assigned version
     */
    @PostMapping("/{runId}/artifacts")
    @ResponseStatus(HttpStatus.CREATED)
    public Artifact createArtifact(@PathVariable String runId, @RequestBody(required = false) CreateArtifactRequest request) {
        if (request == null || !ValidationUtils.hasText(request.stepName())
                || request.content() == null || request.content().isNull()) {
            throw new IllegalArgumentException("step_name and content are required");
        }
        runService.require(runId);
        return artifactStoreService.put(runId, request.stepName().trim(), request.content());
    }

    /**
     * Latest version of each step, or of the one step named by {@code step_name}
     */
    @GetMapping("/{runId}/artifacts")
    public List<Artifact> listArtifacts(@PathVariable String runId,
                                        @RequestParam(name = "step_name", required = false) String stepName) {
        runService.require(runId);
        if (ValidationUtils.hasText(stepName)) {
            return artifactStoreService.getLatest(runId, stepName.trim()).map(List::of).orElse(List.of());
        }
        return new ArrayList<>(artifactStoreService.listLatest(runId).values());
    }

    @PostMapping("/{runId}/logs")
    @ResponseStatus(HttpStatus.CREATED)
    public RunEvent createLog(@PathVariable String runId, @RequestBody(required = false) CreateLogRequest request) {
        if (request == null || !ValidationUtils.hasText(request.agentName()) || !ValidationUtils.hasText(request.eventType())) {
            throw new IllegalArgumentException("agent_name and event_type are required");
        }
        runService.require(runId);
        return runEventService.append(runId, request.agentName().trim(), request.eventType().trim(), request.payload());
    }

    @GetMapping("/{runId}/logs")
    public List<RunEvent> listLogs(@PathVariable String runId) {
        runService.require(runId);
        return runEventService.listEvents(runId);
    }
}
