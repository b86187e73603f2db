package com.williamcallahan.research_engine.service;

/**
 * Receives progress messages while an aggregation runs. Called sequentially, never concurrently.
 */
@FunctionalInterface
public interface AggregationProgressListener {

    AggregationProgressListener NONE = (eventKind, message) -> { };

    void onProgress(String eventKind, String message);
}
