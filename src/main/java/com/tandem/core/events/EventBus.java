package com.tandem.core.events;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Collection;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;
import java.util.function.Predicate;

/**
 * Delivers engine and sync lifecycle events to in-process listeners.
 * <p>
 * Every subscription carries a filter; {@link #publish} hands the event to each
 * listener whose filter accepts it, on the publishing thread. A listener that
 * throws is logged and skipped.
 */
@Service
public class EventBus {

    private static final Logger log = LoggerFactory.getLogger(EventBus.class);

    private final CopyOnWriteArrayList<Listener> listeners = new CopyOnWriteArrayList<>();

    public void publish(TandemEvent event) {
        log.debug("Event {} for {}", event.eventType(), event.subjectId());
        for (Listener listener : listeners) {
            if (listener.filter().test(event)) {
                deliver(listener, event);
            }
        }
    }

    /**
     * Listens to one task or execution.
     */
    public Subscription subscribe(String subjectId, Consumer<TandemEvent> consumer) {
        return subscribe(event -> subjectId.equals(event.subjectId()), consumer);
    }

    /**
     * Listens to events of the given subjects whose type starts with {@code typePrefix},
     * e.g. the {@code task.} events of one run.
     */
    public Subscription subscribe(Collection<String> subjectIds, String typePrefix, Consumer<TandemEvent> consumer) {
        Set<String> subjects = Set.copyOf(subjectIds);
        return subscribe(event -> subjects.contains(event.subjectId()) && event.eventType().startsWith(typePrefix),
                consumer);
    }

    public Subscription subscribeAll(Consumer<TandemEvent> consumer) {
        return subscribe(event -> true, consumer);
    }

    public Subscription subscribe(Predicate<TandemEvent> filter, Consumer<TandemEvent> consumer) {
        var listener = new Listener(filter, consumer);
        listeners.add(listener);
        return () -> listeners.remove(listener);
    }

    int listenerCount() {
        return listeners.size();
    }

    @FunctionalInterface
    public interface Subscription {
        void unsubscribe();
    }

    private void deliver(Listener listener, TandemEvent event) {
        try {
            listener.consumer().accept(event);
        } catch (RuntimeException e) {
            log.warn("Listener failed on {} for {}: {}", event.eventType(), event.subjectId(), e.getMessage(), e);
        }
    }

    /** Compared by identity on removal. */
    private static final class Listener {
        private final Predicate<TandemEvent> filter;
        private final Consumer<TandemEvent> consumer;

        Listener(Predicate<TandemEvent> filter, Consumer<TandemEvent> consumer) {
            this.filter = filter;
            this.consumer = consumer;
        }

        Predicate<TandemEvent> filter() {
            return filter;
        }

        Consumer<TandemEvent> consumer() {
            return consumer;
        }
    }
}
