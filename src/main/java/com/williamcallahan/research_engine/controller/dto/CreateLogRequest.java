package com.williamcallahan.research_engine.controller.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * Event posted by an external stage. The payload may be omitted.
 */
public record CreateLogRequest(
    @JsonProperty("agent_name") String agentName,
    @JsonProperty("event_type") String eventType,
    JsonNode payload
) {
}
