/**
 * Turns a run's live events into a Server-Sent Events stream
 *
 * @author William Callahan
 *
 * Features:
 * - Subscribes when the stream is subscribed and unsubscribes on cancel, error or completion
 * - Each event is sent with its id and its kind as the SSE event name
 * - A {@code heartbeat} comment follows every idle interval so proxies keep the connection open
 * - No history is replayed; clients read the durable log first, then stream
 */

package com.williamcallahan.research_engine.service.events;

import com.williamcallahan.research_engine.config.AppConfigurationProperties;
import com.williamcallahan.research_engine.model.RunEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.codec.ServerSentEvent;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.scheduler.Schedulers;

import java.time.Duration;

@Service
public class LiveEventStreamService {

    private static final Logger logger = LoggerFactory.getLogger(LiveEventStreamService.class);
    static final String HEARTBEAT_COMMENT = "heartbeat";

    private final RunSubscriberRegistry subscriberRegistry;
    private final Duration heartbeatInterval;

    public LiveEventStreamService(RunSubscriberRegistry subscriberRegistry, AppConfigurationProperties appProperties) {
        this.subscriberRegistry = subscriberRegistry;
        this.heartbeatInterval = Duration.ofSeconds(appProperties.getEvents().getHeartbeatSeconds());
    }

    public Flux<ServerSentEvent<RunEvent>> stream(String runId) {
        return Flux.defer(() -> {
            RunSubscription subscription = subscriberRegistry.subscribe(runId);
            logger.info("Live stream opened for run {}", runId);
            Flux<ServerSentEvent<RunEvent>> events = subscription.events()
                .publishOn(Schedulers.boundedElastic())
                .map(LiveEventStreamService::toServerSentEvent);
            return withHeartbeat(events)
                .doFinally(signal -> {
                    subscriberRegistry.unsubscribe(subscription);
                    logger.info("Live stream for run {} closed ({})", runId, signal);
                });
        });
    }

    /**
     * Interleaves a heartbeat comment after each {@code heartbeatInterval} without an event.
     */
    Flux<ServerSentEvent<RunEvent>> withHeartbeat(Flux<ServerSentEvent<RunEvent>> events) {
        return events.publish(shared -> Flux.merge(
            shared,
            shared.map(event -> Boolean.TRUE)
                .startWith(Boolean.TRUE)
                .switchMap(activity -> Flux.interval(heartbeatInterval, heartbeatInterval)
                    .onBackpressureDrop()
                    .map(tick -> ServerSentEvent.<RunEvent>builder().comment(HEARTBEAT_COMMENT).build()))
                .takeUntilOther(shared.ignoreElements())
        ));
    }

    private static ServerSentEvent<RunEvent> toServerSentEvent(RunEvent event) {
        ServerSentEvent.Builder<RunEvent> builder = ServerSentEvent.<RunEvent>builder()
            .event(event.eventKind())
            .data(event);
        if (event.id() != null) {
            builder.id(String.valueOf(event.id()));
        }
        return builder.build();
    }
}
