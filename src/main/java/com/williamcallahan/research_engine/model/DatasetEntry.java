package com.williamcallahan.research_engine.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

/**
 * A dataset chosen from web-search candidates.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record DatasetEntry(String name, String domain, String url, String whyRelevant, String license) {
}
