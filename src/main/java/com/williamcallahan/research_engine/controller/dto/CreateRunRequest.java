package com.williamcallahan.research_engine.controller.dto;

/**
 * Body of a run creation request; the step is optional.
 */
public record CreateRunRequest(String step) {
}
