package com.williamcallahan.research_engine.repository;

import com.williamcallahan.research_engine.model.RunEvent;

import java.util.List;

/**
 * Append-only storage for run events. Ids grow with insertion order, which is the durable order
 * of a run's log.
 */
public interface RunEventRepository {

    /**
     * @param event event without an id
     * @return the stored event with its assigned id
     */
    RunEvent append(RunEvent event);

    List<RunEvent> findByRunId(String runId);
}
