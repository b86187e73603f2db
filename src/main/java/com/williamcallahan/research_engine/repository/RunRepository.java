package com.williamcallahan.research_engine.repository;

import com.williamcallahan.research_engine.model.Run;
import com.williamcallahan.research_engine.model.RunStatus;

import java.util.Optional;

/**
 * Storage for runs and their current step and status.
 */
public interface RunRepository {

    Run save(Run run);

    Optional<Run> findById(String runId);

    /**
     * Moves a run to a new status, and to a new step when {@code step} is not null.
     *
     * @return {@code true} when the run exists
     */
    boolean updateStepAndStatus(String runId, String step, RunStatus status);
}
