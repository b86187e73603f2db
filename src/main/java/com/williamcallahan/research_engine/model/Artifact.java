package com.williamcallahan.research_engine.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.time.Instant;

/**
 * One immutable version of a step's output. Versions per (run, step) start at 1 and are contiguous.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record Artifact(Long id, String runId, String stepName, int version, JsonNode content, Instant createdAt) {
}
