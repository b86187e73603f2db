package com.williamcallahan.research_engine.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.time.Instant;

/**
 * One entry of a run's append-only progress log.
 *
 * @param id        storage-assigned id; {@code null} until persisted
 * @param sourceName emitting component, e.g. {@code SourceScout}
 * @param eventKind  kind of progress, see {@link EventKinds}
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record RunEvent(
    Long id,
    String runId,
    @JsonProperty("agent_name") String sourceName,
    @JsonProperty("event_type") String eventKind,
    JsonNode payload,
    Instant createdAt
) {
    public static RunEvent unsaved(String runId, String sourceName, String eventKind, JsonNode payload, Instant createdAt) {
        return new RunEvent(null, runId, sourceName, eventKind, payload, createdAt);
    }
}
