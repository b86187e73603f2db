package com.williamcallahan.research_engine.service;

import com.williamcallahan.research_engine.model.ResearchBrief;

import java.util.List;

/**
 * Input to one aggregation: the project brief and the keywords to search providers with.
 */
public record AggregationRequest(ResearchBrief brief, List<String> searchKeywords) {

    public AggregationRequest {
        if (brief == null) {
            throw new IllegalArgumentException("Aggregation needs a research brief");
        }
        searchKeywords = searchKeywords == null ? List.of() : List.copyOf(searchKeywords);
    }
}
