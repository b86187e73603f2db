/**
 * How evidence will be collected and analysed for the chosen approach. Persisted as the
 * evidence plan artifact next to the sources pack.
 */
package com.williamcallahan.research_engine.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.time.Instant;
import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record EvidencePlan(
    String evidenceType,
    List<String> collectionStrategy,
    InclusionExclusion inclusionExclusion,
    String analysisOverview,
    List<String> expectedOutputs,
    Metadata metadata
) {
    public EvidencePlan {
        evidenceType = evidenceType == null || evidenceType.isBlank() ? "unknown" : evidenceType;
        collectionStrategy = collectionStrategy == null ? List.of() : List.copyOf(collectionStrategy);
        inclusionExclusion = inclusionExclusion == null ? new InclusionExclusion(null, null) : inclusionExclusion;
        analysisOverview = analysisOverview == null ? "" : analysisOverview;
        expectedOutputs = expectedOutputs == null ? List.of() : List.copyOf(expectedOutputs);
    }

    public EvidencePlan withCreatedAt(Instant createdAt) {
        return new EvidencePlan(evidenceType, collectionStrategy, inclusionExclusion, analysisOverview,
            expectedOutputs, new Metadata(createdAt));
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record InclusionExclusion(List<String> include, List<String> exclude) {
        public InclusionExclusion {
            include = include == null ? List.of() : List.copyOf(include);
            exclude = exclude == null ? List.of() : List.copyOf(exclude);
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public record Metadata(Instant createdAt) {
    }
}
