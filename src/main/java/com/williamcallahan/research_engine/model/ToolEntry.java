package com.williamcallahan.research_engine.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

/**
 * A software library, platform or framework chosen from web-search candidates.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record ToolEntry(String name, String type, String url, String whyUseful) {
}
