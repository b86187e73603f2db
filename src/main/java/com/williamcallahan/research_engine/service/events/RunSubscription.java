package com.williamcallahan.research_engine.service.events;

import com.williamcallahan.research_engine.model.RunEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Sinks;

/**
 * One live observer of a run. Events are buffered until the observer requests them.
 * Delivery and closing are serialized by {@link RunSubscriberRegistry}.
 */
public final class RunSubscription {

    private static final Logger logger = LoggerFactory.getLogger(RunSubscription.class);

    private final String runId;
    private final Sinks.Many<RunEvent> sink = Sinks.many().unicast().onBackpressureBuffer();
    private volatile boolean closed;

    RunSubscription(String runId) {
        this.runId = runId;
    }

    public String getRunId() {
        return runId;
    }

    public Flux<RunEvent> events() {
        return sink.asFlux();
    }

    public boolean isClosed() {
        return closed;
    }

    boolean deliver(RunEvent event) {
        if (closed) {
            return false;
        }
        Sinks.EmitResult result = sink.tryEmitNext(event);
        if (result.isFailure()) {
            logger.debug("Dropped event {} for a subscriber of run {}: {}", event.id(), runId, result);
            return false;
        }
        return true;
    }

    void close() {
        closed = true;
        sink.tryEmitComplete();
    }
}
