package com.williamcallahan.research_engine.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.time.Instant;
import java.util.List;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record BundleMetadata(
    Instant createdAt,
    String topic,
    String approach,
    List<String> searchKeywords,
    List<String> sourceProviders
) {
    public BundleMetadata {
        searchKeywords = searchKeywords == null ? List.of() : List.copyOf(searchKeywords);
        sourceProviders = sourceProviders == null ? List.of() : List.copyOf(sourceProviders);
    }
}
