package com.williamcallahan.research_engine.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Which paper provider(s) contributed a canonical record.
 */
public enum Provenance {
    OPENALEX("openalex", "OpenAlex"),
    SEMANTIC_SCHOLAR("semantic_scholar", "Semantic Scholar"),
    BOTH("both", "OpenAlex + Semantic Scholar");

    /** Label used when a paper's provenance cannot be recovered */
    public static final String UNKNOWN_LABEL = "Academic Database";

    private final String wireValue;
    private final String displayLabel;

    Provenance(String wireValue, String displayLabel) {
        this.wireValue = wireValue;
        this.displayLabel = displayLabel;
    }

    @JsonValue
    public String getWireValue() {
        return wireValue;
    }

    public String getDisplayLabel() {
        return displayLabel;
    }
}
