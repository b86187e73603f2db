package com.williamcallahan.research_engine.model;

/**
 * Event kinds and source names emitted by the background jobs. Callers posting their own
 * events may use any other value.
 */
public final class EventKinds {

    public static final String START = "start";
    public static final String THINKING = "thinking";
    public static final String SEARCHING = "searching";
    public static final String RANKING = "ranking";
    public static final String OUTPUT = "output";
    public static final String COMPLETE = "complete";
    public static final String WARNING = "warning";
    public static final String ERROR = "error";

    public static final String SOURCE_SCOUT = "SourceScout";
    public static final String EVIDENCE_PLANNER = "EvidencePlanner";
    public static final String SYSTEM = "System";

    private EventKinds() {
    }
}
