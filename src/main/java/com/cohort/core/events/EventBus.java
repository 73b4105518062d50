package com.cohort.core.events;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * In-memory pub/sub bus for queue and session events.
 * <p>
 * Every subscriber sees every agent's events. A subscriber that throws is logged and
 * skipped; it never affects the publisher or the other subscribers.
 */
@Service
public class EventBus {

    private static final Logger log = LoggerFactory.getLogger(EventBus.class);

    private final CopyOnWriteArrayList<Consumer<CohortEvent>> subscribers = new CopyOnWriteArrayList<>();

    public void publish(CohortEvent event) {
        log.debug("Publishing event: {} for agent {}", event.eventType(), event.agentId());
        for (Consumer<CohortEvent> subscriber : subscribers) {
            deliverSafely(subscriber, event);
        }
    }

    /**
     * @return a {@link Subscription} handle to unsubscribe later
     */
    public Subscription subscribeAll(Consumer<CohortEvent> consumer) {
        subscribers.add(consumer);
        log.debug("Subscribed to all events");
        return () -> subscribers.remove(consumer);
    }

    @FunctionalInterface
    public interface Subscription {
        void unsubscribe();
    }

    private void deliverSafely(Consumer<CohortEvent> subscriber, CohortEvent event) {
        try {
            subscriber.accept(event);
        } catch (Exception e) {
            log.warn("Subscriber threw exception processing event {}: {}",
                    event.eventType(), e.getMessage(), e);
        }
    }
}
