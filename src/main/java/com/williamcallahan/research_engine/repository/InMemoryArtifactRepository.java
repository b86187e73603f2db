package com.williamcallahan.research_engine.repository;

import com.fasterxml.jackson.databind.JsonNode;
import com.williamcallahan.research_engine.model.Artifact;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Process-local artifact storage used when no database is configured. Version assignment is
 * atomic per (run, step), so this store never reports a version conflict.
 */
public class InMemoryArtifactRepository implements ArtifactRepository {

    private final AtomicLong sequence = new AtomicLong();
    private final Map<String, Map<String, List<Artifact>>> artifactsByRun = new ConcurrentHashMap<>();

    @Override
    public Artifact insertNextVersion(String runId, String stepName, JsonNode content, Instant createdAt) {
        List<Artifact> versions = versionsOf(runId, stepName);
        synchronized (versions) {
            Artifact artifact = new Artifact(sequence.incrementAndGet(), runId, stepName, versions.size() + 1,
                content.deepCopy(), createdAt);
            versions.add(artifact);
            return artifact;
        }
    }

    @Override
    public Optional<Artifact> findLatest(String runId, String stepName) {
        Map<String, List<Artifact>> steps = artifactsByRun.get(runId);
        if (steps == null || !steps.containsKey(stepName)) {
            return Optional.empty();
        }
        return latestOf(steps.get(stepName));
    }

    @Override
    public List<Artifact> findLatestPerStep(String runId) {
        Map<String, List<Artifact>> steps = artifactsByRun.get(runId);
        if (steps == null) {
            return List.of();
        }
        List<Artifact> latest = new ArrayList<>();
        steps.values().forEach(versions -> latestOf(versions).ifPresent(latest::add));
        latest.sort(Comparator.comparing(Artifact::stepName));
        return latest;
    }

    private List<Artifact> versionsOf(String runId, String stepName) {
        return artifactsByRun
            .computeIfAbsent(runId, id -> new ConcurrentHashMap<>())
            .computeIfAbsent(stepName, step -> new ArrayList<>());
    }

    private static Optional<Artifact> latestOf(List<Artifact> versions) {
        synchronized (versions) {
            return versions.isEmpty() ? Optional.empty() : Optional.of(versions.get(versions.size() - 1));
        }
    }
}
