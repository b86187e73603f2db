/**
 * REST controller for Server-Sent Events streaming of a run's live events
 *
 * @author William Callahan
 *
 * Features:
 * - One SSE connection per client and run, events named by their kind
 * - Heartbeat comments keep idle connections open
 * - Unknown runs are rejected before the stream opens
 */

package com.williamcallahan.research_engine.controller;

import com.williamcallahan.research_engine.model.RunEvent;
import com.williamcallahan.research_engine.service.RunService;
import com.williamcallahan.research_engine.service.events.LiveEventStreamService;
import org.springframework.http.MediaType;
import org.springframework.http.codec.ServerSentEvent;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Flux;

@RestController
public class RunStreamController {

    private final RunService runService;
    private final LiveEventStreamService liveEventStreamService;

    public RunStreamController(RunService runService, LiveEventStreamService liveEventStreamService) {
        this.runService = runService;
        this.liveEventStreamService = liveEventStreamService;
    }

    /**
     * Streams events appended after the connection opens; history comes from the log endpoint
     *
     * @param runId run to follow
     * @return Flux of ServerSentEvent carrying RunEvent data
     */
    @GetMapping(path = "/api/runs/{runId}/stream", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public Flux<ServerSentEvent<RunEvent>> streamRun(@PathVariable String runId) {
        runService.require(runId);
        return liveEventStreamService.stream(runId);
    }
}
