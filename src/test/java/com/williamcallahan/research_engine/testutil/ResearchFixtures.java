package com.williamcallahan.research_engine.testutil;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.williamcallahan.research_engine.model.CanonicalRecord;
import com.williamcallahan.research_engine.model.OutlineSection;
import com.williamcallahan.research_engine.model.Provenance;
import com.williamcallahan.research_engine.model.ResearchBrief;
import com.williamcallahan.research_engine.model.ResearchConstraints;
import com.williamcallahan.research_engine.model.WebHit;

import java.util.List;

/**
 * Shared sample data for service tests.
 */
public final class ResearchFixtures {

    private ResearchFixtures() {
    }

    public static ObjectMapper objectMapper() {
        return new ObjectMapper()
            .findAndRegisterModules()
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }

    public static ResearchBrief brief() {
        return brief(null);
    }

    public static ResearchBrief brief(String feedback) {
        return new ResearchBrief(
            "Transformer models for protein folding",
            "How attention-based models predict protein structure",
            List.of("protein folding", "transformers"),
            "Attention-Based Protein Structure Prediction",
            "Public Dataset Analysis",
            List.of(
                new OutlineSection("Introduction", List.of("Motivation", "Research question")),
                new OutlineSection("Methods", List.of("Data", "Model", "Evaluation", "Ablations"))
            ),
            new ResearchConstraints("months", null, "graduate"),
            feedback
        );
    }

    public static CanonicalRecord paper(String title, String doi, Integer citations, Provenance provenance) {
        CanonicalRecord record = new CanonicalRecord();
        record.setTitle(title);
        record.setDoi(doi);
        record.setUrl(doi != null ? "https://doi.org/" + doi : "https://example.org/" + title.hashCode());
        record.setCitedByCount(citations);
        record.setAuthors(List.of("A. One", "B. Two", "C. Three", "D. Four"));
        record.setYear(2021);
        record.setProvenance(provenance);
        return record;
    }

    public static WebHit hit(String title, String url) {
        return new WebHit(title, url, "Snippet about " + title, url.split("/").length > 2 ? url.split("/")[2] : "");
    }
}
