package com.williamcallahan.research_engine.repository;

import com.williamcallahan.research_engine.model.Run;
import com.williamcallahan.research_engine.model.RunStatus;

import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-local run storage used when no database is configured. Runs are lost on restart.
 */
public class InMemoryRunRepository implements RunRepository {

    private final Map<String, Run> runs = new ConcurrentHashMap<>();

    @Override
    public Run save(Run run) {
        runs.put(run.getId(), copy(run));
        return run;
    }

    @Override
    public Optional<Run> findById(String runId) {
        Run run = runs.get(runId);
        return run != null ? Optional.of(copy(run)) : Optional.empty();
    }

    @Override
    public boolean updateStepAndStatus(String runId, String step, RunStatus status) {
        Run updated = runs.computeIfPresent(runId, (id, existing) -> new Run(
            id,
            step != null ? step : existing.getStep(),
            status,
            existing.getCreatedAt(),
            Instant.now()
        ));
        return updated != null;
    }

    private static Run copy(Run run) {
        return new Run(run.getId(), run.getStep(), run.getStatus(), run.getCreatedAt(), run.getUpdatedAt());
    }
}
