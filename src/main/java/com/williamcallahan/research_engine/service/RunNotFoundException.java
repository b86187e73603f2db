package com.williamcallahan.research_engine.service;

/**
 * Raised when a request names a run that does not exist.
 */
public class RunNotFoundException extends RuntimeException {

    public RunNotFoundException(String runId) {
        super("Run not found: " + runId);
    }
}
