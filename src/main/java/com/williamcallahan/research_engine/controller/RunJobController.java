/**
 * REST controller that starts background jobs for a run
 *
 * @author William Callahan
 *
 * Features:
 * - Source discovery: validates the brief synchronously, then runs in the background
 * - Demo: plays scripted events and artifacts for trying out the live stream
 * - Both answer 202 Accepted as soon as the job is handed to the executor
 */

package com.williamcallahan.research_engine.controller;

import com.williamcallahan.research_engine.controller.dto.SourceDiscoveryRequest;
import com.williamcallahan.research_engine.model.ResearchBrief;
import com.williamcallahan.research_engine.service.RunService;
import com.williamcallahan.research_engine.service.job.DemoRunJob;
import com.williamcallahan.research_engine.service.job.SourceDiscoveryJob;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

@RestController
@RequestMapping("/api/runs/{runId}")
public class RunJobController {

    private static final Logger logger = LoggerFactory.getLogger(RunJobController.class);

    private final RunService runService;
    private final SourceDiscoveryJob sourceDiscoveryJob;
    private final DemoRunJob demoRunJob;

    public RunJobController(RunService runService, SourceDiscoveryJob sourceDiscoveryJob, DemoRunJob demoRunJob) {
        this.runService = runService;
        this.sourceDiscoveryJob = sourceDiscoveryJob;
        this.demoRunJob = demoRunJob;
    }

    @PostMapping("/sources")
    @ResponseStatus(HttpStatus.ACCEPTED)
    public Map<String, String> startSourceDiscovery(@PathVariable String runId,
                                                    @RequestBody(required = false) SourceDiscoveryRequest request) {
        if (request == null) {
            throw new IllegalArgumentException("Request body is required.");
        }
        runService.require(runId);
        ResearchBrief brief = request.toBrief();
        logger.info("Starting source discovery for run {} with approach '{}'", runId, brief.approachLabel());
        sourceDiscoveryJob.runAsync(runId, brief);
        return accepted("sources started", runId);
    }

    @PostMapping("/demo")
    @ResponseStatus(HttpStatus.ACCEPTED)
    public Map<String, String> startDemo(@PathVariable String runId) {
        runService.require(runId);
        demoRunJob.runAsync(runId);
        return accepted("demo started", runId);
    }

    private static Map<String, String> accepted(String status, String runId) {
        Map<String, String> body = new LinkedHashMap<>();
        body.put("status", status);
        body.put("run_id", runId);
        return body;
    }
}
