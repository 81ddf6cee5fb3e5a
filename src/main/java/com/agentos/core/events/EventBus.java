package com.agentos.core.events;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;
import java.util.function.Predicate;

/**
 * In-process pub/sub for goal, task and cost events.
 * <p>
 * Subscribers register for one event-type prefix or for everything.
 * Delivery is synchronous on the publishing thread, in registration order. A subscriber
 * that throws is logged and skipped.
 */
@Service
public class EventBus {

    private static final Logger log = LoggerFactory.getLogger(EventBus.class);

    private record Subscriber(Predicate<AgentOsEvent> filter, Consumer<AgentOsEvent> consumer) {}

    private final CopyOnWriteArrayList<Subscriber> subscribers = new CopyOnWriteArrayList<>();

    public void publish(AgentOsEvent event) {
        int delivered = 0;
        for (Subscriber subscriber : subscribers) {
            if (subscriber.filter().test(event)) {
                deliver(subscriber.consumer(), event);
                delivered++;
            }
        }
        log.debug("Event {} (goal {}) delivered to {} subscriber(s)", event.eventType(), event.goalId(), delivered);
    }

    /**
     * Events whose type starts with {@code prefix}, e.g. {@code "task."} or {@code "cost.alert"}.
     */
    public Subscription subscribeToType(String prefix, Consumer<AgentOsEvent> consumer) {
        return register(e -> e.eventType().startsWith(prefix), consumer);
    }

    public Subscription subscribeAll(Consumer<AgentOsEvent> consumer) {
        return register(e -> true, consumer);
    }

    public int subscriberCount() {
        return subscribers.size();
    }

    private Subscription register(Predicate<AgentOsEvent> filter, Consumer<AgentOsEvent> consumer) {
        Subscriber subscriber = new Subscriber(filter, consumer);
        subscribers.add(subscriber);
        return () -> subscribers.remove(subscriber);
    }

    @FunctionalInterface
    public interface Subscription {
        void unsubscribe();
    }

    private void deliver(Consumer<AgentOsEvent> consumer, AgentOsEvent event) {
        try {
            consumer.accept(event);
        } catch (RuntimeException e) {
            log.warn("Subscriber failed on {} for goal {}: {}", event.eventType(), event.goalId(), e.getMessage(), e);
        }
    }
}
