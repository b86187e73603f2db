package com.williamcallahan.research_engine.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum RunStatus {
    RUNNING("running"),
    AWAITING_FEEDBACK("awaiting_feedback"),
    COMPLETED("completed"),
    FAILED("failed");

    private final String wireValue;

    RunStatus(String wireValue) {
        this.wireValue = wireValue;
    }

    @JsonValue
    public String getWireValue() {
        return wireValue;
    }

    @JsonCreator
    public static RunStatus fromWireValue(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Run status is required");
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (RunStatus status : values()) {
            if (status.wireValue.equals(normalized)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown run status: " + value);
    }
}
