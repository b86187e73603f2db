/**
 * Appends run events to the durable log and hands them to live observers
 *
 * @author William Callahan
 *
 * Features:
 * - Persists first, then broadcasts the stored event (with its id) to every live subscriber
 * - A storage failure is logged and the unsaved event is still broadcast; append never fails for it
 * - Lists a run's durable log in insertion order for replay
 */

package com.williamcallahan.research_engine.service.events;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.williamcallahan.research_engine.model.RunEvent;
import com.williamcallahan.research_engine.repository.RunEventRepository;
import com.williamcallahan.research_engine.util.LoggingUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.List;

@Service
public class RunEventService {

    private static final Logger logger = LoggerFactory.getLogger(RunEventService.class);

    private final RunEventRepository runEventRepository;
    private final RunSubscriberRegistry subscriberRegistry;
    private final ObjectMapper objectMapper;

    public RunEventService(RunEventRepository runEventRepository,
                           RunSubscriberRegistry subscriberRegistry,
                           ObjectMapper objectMapper) {
        this.runEventRepository = runEventRepository;
        this.subscriberRegistry = subscriberRegistry;
        this.objectMapper = objectMapper;
    }

    /**
     * Records one event for a run.
     *
     * @param payload arbitrary JSON; {@code null} is stored as an empty object
     * @return the stored event, or the unsaved event when storage failed
     */
    public RunEvent append(String runId, String sourceName, String eventKind, JsonNode payload) {
        RunEvent pending = RunEvent.unsaved(runId, sourceName, eventKind,
            payload != null && !payload.isNull() ? payload : objectMapper.createObjectNode(), Instant.now());

        RunEvent event;
        try {
            event = runEventRepository.append(pending);
        } catch (DataAccessException e) {
            LoggingUtils.warn(logger, e, "Could not persist {} event from {} for run {}; broadcasting unsaved",
                eventKind, sourceName, runId);
            event = pending;
        }

        int delivered = subscriberRegistry.broadcast(runId, event);
        logger.debug("Run {} event {}/{} delivered to {} live subscribers", runId, sourceName, eventKind, delivered);
        return event;
    }

    /**
     * Records an event whose payload is {@code {"message": message}}.
     */
    public RunEvent appendMessage(String runId, String sourceName, String eventKind, String message) {
        ObjectNode payload = objectMapper.createObjectNode();
        payload.put("message", message);
        return append(runId, sourceName, eventKind, payload);
    }

    public List<RunEvent> listEvents(String runId) {
        return runEventRepository.findByRunId(runId);
    }
}
