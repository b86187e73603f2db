package com.williamcallahan.research_engine.repository;

import com.fasterxml.jackson.databind.JsonNode;
import com.williamcallahan.research_engine.model.Artifact;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Storage for versioned step outputs. At most one artifact exists per (run, step, version).
 */
public interface ArtifactRepository {

    /**
     * Stores {@code content} as the version after the current latest one for the step.
     *
     * @throws org.springframework.dao.DuplicateKeyException when a concurrent writer took that version first
     */
    Artifact insertNextVersion(String runId, String stepName, JsonNode content, Instant createdAt);

    Optional<Artifact> findLatest(String runId, String stepName);

    /**
     * @return the latest version of every step of the run, ordered by step name
     */
    List<Artifact> findLatestPerStep(String runId);
}
