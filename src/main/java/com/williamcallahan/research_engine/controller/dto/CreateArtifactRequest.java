package com.williamcallahan.research_engine.controller.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;

public record CreateArtifactRequest(
    @JsonProperty("step_name") String stepName,
    JsonNode content
) {
}
