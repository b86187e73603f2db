/**
 * Process-wide registry of live observers per run
 *
 * @author William Callahan
 *
 * Features:
 * - Subscribe, unsubscribe and broadcast are atomic relative to each other for a run
 * - A subscription never receives an event broadcast after it was removed
 * - Channels with no observers left are retired and dropped from the registry
 */

package com.williamcallahan.research_engine.service.events;

import com.williamcallahan.research_engine.model.RunEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

@Component
public class RunSubscriberRegistry {

    private static final Logger logger = LoggerFactory.getLogger(RunSubscriberRegistry.class);

    private final Map<String, RunChannel> channels = new ConcurrentHashMap<>();

    public RunSubscription subscribe(String runId) {
        RunSubscription subscription = new RunSubscription(runId);
        while (true) {
            RunChannel channel = channels.computeIfAbsent(runId, id -> new RunChannel());
            synchronized (channel) {
                // A retired channel was removed concurrently; take a fresh one.
                if (!channel.retired) {
                    channel.subscriptions.add(subscription);
                    logger.debug("Subscriber added to run {} ({} live)", runId, channel.subscriptions.size());
                    return subscription;
                }
            }
        }
    }

    public void unsubscribe(RunSubscription subscription) {
        String runId = subscription.getRunId();
        RunChannel channel = channels.get(runId);
        if (channel == null) {
            subscription.close();
            return;
        }
        synchronized (channel) {
            channel.subscriptions.remove(subscription);
            subscription.close();
            if (channel.subscriptions.isEmpty() && !channel.retired) {
                channel.retired = true;
                channels.remove(runId, channel);
            }
            logger.debug("Subscriber removed from run {} ({} live)", runId, channel.subscriptions.size());
        }
    }

    /**
     * @return number of subscriptions the event was handed to
     */
    public int broadcast(String runId, RunEvent event) {
        RunChannel channel = channels.get(runId);
        if (channel == null) {
            return 0;
        }
        synchronized (channel) {
            int delivered = 0;
            for (RunSubscription subscription : channel.subscriptions) {
                if (subscription.deliver(event)) {
                    delivered++;
                }
            }
            return delivered;
        }
    }

    public int subscriberCount(String runId) {
        RunChannel channel = channels.get(runId);
        if (channel == null) {
            return 0;
        }
        synchronized (channel) {
            return channel.subscriptions.size();
        }
    }

    private static final class RunChannel {
        private final List<RunSubscription> subscriptions = new ArrayList<>();
        private boolean retired;
    }
}
