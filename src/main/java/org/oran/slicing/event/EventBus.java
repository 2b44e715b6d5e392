package org.oran.slicing.event;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.*;
import java.util.concurrent.*;
import java.util.function.Consumer;

/**
 * Event bus for publish-subscribe communication between the engine and its collaborators.
 *
 * Provides:
 * - Type-safe subscription
 * - Synchronous dispatch on the publishing thread, in publication order
 * - Optional event history for audit and tests, bounded to the most recent events
 *
 * A failing handler is logged and does not stop delivery to the others.
 */
public class EventBus {

    private static final Logger log = LoggerFactory.getLogger(EventBus.class);

    public static final int DEFAULT_HISTORY_LIMIT = 1000;

    private final Map<Class<? extends Event>, List<Consumer<Event>>> subscribers;
    private final List<Consumer<Event>> wildcardSubscribers;
    private final Deque<Event> eventHistory;
    private final int historyLimit;
    private final Clock clock;

    public EventBus() {
        this(DEFAULT_HISTORY_LIMIT, Clock.systemUTC());
    }

    public EventBus(boolean recordHistory) {
        this(recordHistory ? DEFAULT_HISTORY_LIMIT : 0, Clock.systemUTC());
    }

    /**
     * @param historyLimit number of most recent events kept; 0 disables recording
     */
    public EventBus(int historyLimit, Clock clock) {
        if (historyLimit < 0) {
            throw new IllegalArgumentException("History limit cannot be negative: " + historyLimit);
        }
        this.subscribers = new ConcurrentHashMap<>();
        this.wildcardSubscribers = new CopyOnWriteArrayList<>();
        this.eventHistory = new ArrayDeque<>();
        this.historyLimit = historyLimit;
        this.clock = Objects.requireNonNull(clock, "Clock cannot be null");
    }

    /**
     * Clock used to stamp events published through this bus.
     */
    public Clock clock() {
        return clock;
    }

    // ========================================================================
    // Subscription
    // ========================================================================

    /**
     * Subscribe to a specific event type.
     */
    @SuppressWarnings("unchecked")
    public <T extends Event> void subscribe(Class<T> eventType, Consumer<T> handler) {
        subscribers.computeIfAbsent(eventType, k -> new CopyOnWriteArrayList<>())
            .add(event -> handler.accept((T) event));
    }

    /**
     * Subscribe to all events.
     */
    public void subscribeAll(Consumer<Event> handler) {
        wildcardSubscribers.add(handler);
    }

    /**
     * Clear all subscribers.
     */
    public void clearSubscribers() {
        subscribers.clear();
        wildcardSubscribers.clear();
    }

    // ========================================================================
    // Publishing
    // ========================================================================

    /**
     * Publish an event to all subscribers of its type, then to wildcard subscribers.
     */
    public void publish(Event event) {
        addToHistory(event);

        List<Consumer<Event>> handlers = subscribers.get(event.getClass());
        if (handlers != null) {
            for (Consumer<Event> handler : handlers) {
                dispatch(handler, event);
            }
        }
        for (Consumer<Event> handler : wildcardSubscribers) {
            dispatch(handler, event);
        }
    }

    private void addToHistory(Event event) {
        if (historyLimit == 0) {
            return;
        }
        synchronized (eventHistory) {
            if (eventHistory.size() == historyLimit) {
                eventHistory.removeFirst();
            }
            eventHistory.addLast(event);
        }
    }

    private void dispatch(Consumer<Event> handler, Event event) {
        try {
            handler.accept(event);
        } catch (RuntimeException e) {
            log.error("Error in handler for {}: {}", event.eventType(), e.getMessage(), e);
        }
    }

    // ========================================================================
    // History Management
    // ========================================================================

    /**
     * Get the recorded events, oldest first.
     */
    public List<Event> getHistory() {
        synchronized (eventHistory) {
            return new ArrayList<>(eventHistory);
        }
    }

    /**
     * Get events of a specific type.
     */
    public <T extends Event> List<T> getHistory(Class<T> eventType) {
        List<T> filtered = new ArrayList<>();
        for (Event event : getHistory()) {
            if (eventType.isInstance(event)) {
                filtered.add(eventType.cast(event));
            }
        }
        return filtered;
    }

    /**
     * Get event count by type.
     */
    public int getEventCount(Class<? extends Event> eventType) {
        return (int) getHistory().stream()
            .filter(eventType::isInstance)
            .count();
    }

    /**
     * Clear event history.
     */
    public void clearHistory() {
        synchronized (eventHistory) {
            eventHistory.clear();
        }
    }

    public int getHistoryLimit() {
        return historyLimit;
    }

    @Override
    public String toString() {
        return String.format("EventBus[subscribers=%d, history=%d events]",
            subscribers.values().stream().mapToInt(List::size).sum() + wildcardSubscribers.size(),
            getHistory().size());
    }
}
