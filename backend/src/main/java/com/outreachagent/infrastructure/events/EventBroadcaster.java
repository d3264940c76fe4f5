package com.outreachagent.infrastructure.events;

import com.outreachagent.domain.pipeline.model.PipelineEvent;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Set;
import java.util.concurrent.CopyOnWriteArraySet;

/**
 * In-process publish/subscribe bus for pipeline lifecycle events.
 * <p>
 * The worker publishes while HTTP threads subscribe and unsubscribe, so the
 * registry is a copy-on-write set: publish iterates a stable snapshot and
 * never contends with registration. No history is replayed to new subscribers.
 * </p>
 */
@Slf4j
@Component
public class EventBroadcaster {

    private final Set<EventSubscription> subscriptions = new CopyOnWriteArraySet<>();

    public EventSubscription subscribe() {
        EventSubscription subscription = new EventSubscription();
        subscriptions.add(subscription);
        log.debug("[Events] {} subscribed ({} active)", subscription, subscriptions.size());
        return subscription;
    }

    /**
     * Idempotent; further events are not delivered to {@code subscription}.
     */
    public void unsubscribe(EventSubscription subscription) {
        if (subscription == null) {
            return;
        }
        boolean removed = subscriptions.remove(subscription);
        subscription.close();
        if (removed) {
            log.debug("[Events] {} unsubscribed ({} active)", subscription, subscriptions.size());
        }
    }

    /**
     * Appends {@code event} to every active subscription's queue. Never blocks
     * and never throws because of a subscriber.
     *
     * @return number of subscriptions the event was enqueued on
     */
    public int publish(PipelineEvent event) {
        int delivered = 0;
        for (EventSubscription subscription : subscriptions) {
            try {
                if (subscription.offer(event)) {
                    delivered++;
                }
            } catch (RuntimeException e) {
                log.warn("[Events] Dropping {} for {}: {}", event.type(), subscription, e.getMessage());
            }
        }
        log.debug("[Events] Published {} to {} subscriber(s)", event.type(), delivered);
        return delivered;
    }

    public int subscriberCount() {
        return subscriptions.size();
    }
}
