package com.synergi.core.events;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * In-memory pub/sub for task events.
 * <p>
 * Subscribers either follow one task or receive every event. A subscriber that throws is
 * logged and skipped; it never prevents delivery to the others.
 */
@Service
public class EventBus {

    private static final Logger log = LoggerFactory.getLogger(EventBus.class);

    private final ConcurrentHashMap<String, CopyOnWriteArrayList<Consumer<SynergiEvent>>> taskSubscribers =
            new ConcurrentHashMap<>();

    private final CopyOnWriteArrayList<Consumer<SynergiEvent>> globalSubscribers =
            new CopyOnWriteArrayList<>();

    public void publish(SynergiEvent event) {
        log.debug("Publishing {} for task {}", event.eventType(), event.taskId());

        List<Consumer<SynergiEvent>> subs = event.taskId() != null ? taskSubscribers.get(event.taskId()) : null;
        if (subs != null) {
            for (Consumer<SynergiEvent> subscriber : subs) {
                deliverSafely(subscriber, event);
            }
        }

        for (Consumer<SynergiEvent> subscriber : globalSubscribers) {
            deliverSafely(subscriber, event);
        }
    }

    /**
     * Follow events for one task.
     *
     * @return handle that removes the subscription
     */
    public Subscription subscribe(String taskId, Consumer<SynergiEvent> consumer) {
        taskSubscribers.computeIfAbsent(taskId, k -> new CopyOnWriteArrayList<>()).add(consumer);
        log.debug("Subscribed to task {}", taskId);
        return () -> taskSubscribers.computeIfPresent(taskId, (k, subs) -> {
            subs.remove(consumer);
            return subs.isEmpty() ? null : subs;
        });
    }

    /**
     * Follow events from every task.
     */
    public Subscription subscribeAll(Consumer<SynergiEvent> consumer) {
        globalSubscribers.add(consumer);
        log.debug("Subscribed to all events");
        return () -> globalSubscribers.remove(consumer);
    }

    public int subscriberCount() {
        int count = globalSubscribers.size();
        for (List<Consumer<SynergiEvent>> subs : taskSubscribers.values()) {
            count += subs.size();
        }
        return count;
    }

    @FunctionalInterface
    public interface Subscription {
        void unsubscribe();
    }

    private void deliverSafely(Consumer<SynergiEvent> subscriber, SynergiEvent event) {
        try {
            subscriber.accept(event);
        } catch (Exception e) {
            log.warn("Subscriber threw exception processing event {}: {}",
                    event.eventType(), e.getMessage(), e);
        }
    }
}
