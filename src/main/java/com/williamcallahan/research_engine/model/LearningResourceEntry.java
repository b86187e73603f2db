package com.williamcallahan.research_engine.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

/**
 * A tutorial, course, video or overview chosen from web-search candidates.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record LearningResourceEntry(String name, String url, String whyUseful, String source) {
}
