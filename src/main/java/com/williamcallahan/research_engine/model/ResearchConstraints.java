package com.williamcallahan.research_engine.model;

import com.williamcallahan.research_engine.util.ValidationUtils;

/**
 * Practical limits of the person doing the research. Blank values fall back to the defaults.
 */
public record ResearchConstraints(String timeBudget, String dataAvailability, String userLevel) {

    public static final String DEFAULT_TIME_BUDGET = "weeks";
    public static final String DEFAULT_DATA_AVAILABILITY = "public_only";
    public static final String DEFAULT_USER_LEVEL = "university";

    public ResearchConstraints {
        timeBudget = ValidationUtils.hasText(timeBudget) ? timeBudget : DEFAULT_TIME_BUDGET;
        dataAvailability = ValidationUtils.hasText(dataAvailability) ? dataAvailability : DEFAULT_DATA_AVAILABILITY;
        userLevel = ValidationUtils.hasText(userLevel) ? userLevel : DEFAULT_USER_LEVEL;
    }

    public static ResearchConstraints defaults() {
        return new ResearchConstraints(null, null, null);
    }
}
