/**
 * Immutable outcome of one aggregation: ranked papers plus curated datasets, tools and
 * learning resources. Persisted as a new version of the sources pack artifact.
 */
package com.williamcallahan.research_engine.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.util.List;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record ResultBundle(
    BundleMetadata metadata,
    List<CanonicalRecord> papers,
    List<DatasetEntry> datasets,
    List<ToolEntry> tools,
    @JsonProperty("knowledge_bases") List<LearningResourceEntry> learningResources
) {
    public ResultBundle {
        papers = papers == null ? List.of() : List.copyOf(papers);
        datasets = datasets == null ? List.of() : List.copyOf(datasets);
        tools = tools == null ? List.of() : List.copyOf(tools);
        learningResources = learningResources == null ? List.of() : List.copyOf(learningResources);
    }
}
