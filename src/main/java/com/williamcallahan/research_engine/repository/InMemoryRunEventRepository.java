package com.williamcallahan.research_engine.repository;

import com.williamcallahan.research_engine.model.RunEvent;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Process-local event log used when no database is configured.
 */
public class InMemoryRunEventRepository implements RunEventRepository {

    private final AtomicLong sequence = new AtomicLong();
    private final Map<String, List<RunEvent>> eventsByRun = new ConcurrentHashMap<>();

    @Override
    public RunEvent append(RunEvent event) {
        List<RunEvent> events = eventsByRun.computeIfAbsent(event.runId(), id -> new ArrayList<>());
        synchronized (events) {
            RunEvent stored = new RunEvent(sequence.incrementAndGet(), event.runId(), event.sourceName(),
                event.eventKind(), event.payload(), event.createdAt());
            events.add(stored);
            return stored;
        }
    }

    @Override
    public List<RunEvent> findByRunId(String runId) {
        List<RunEvent> events = eventsByRun.get(runId);
        if (events == null) {
            return List.of();
        }
        synchronized (events) {
            return List.copyOf(events);
        }
    }
}
