package com.ryuqq.hustle.testkit;

import com.ryuqq.hustle.core.observer.HustleEvent;
import com.ryuqq.hustle.core.observer.HustleObserver;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Observer that keeps every event it receives, in arrival order.
 *
 * @author Hustle Team
 * @since 1.0.0
 */
public class RecordingObserver implements HustleObserver {

    private final List<HustleEvent> events = new CopyOnWriteArrayList<>();

    @Override
    public void onEvent(HustleEvent event) {
        events.add(event);
    }

    /**
     * Returns all recorded events.
     *
     * @return snapshot of recorded events
     */
    public List<HustleEvent> events() {
        return List.copyOf(events);
    }

    /**
     * Returns the names of all recorded events.
     *
     * @return event names in arrival order
     */
    public List<String> names() {
        List<String> names = new ArrayList<>(events.size());
        for (HustleEvent event : events) {
            names.add(event.name());
        }
        return names;
    }

    /**
     * Returns recorded events with the given name.
     *
     * @param name the event name (e.g. {@link HustleEvent#RETRY_SCHEDULED})
     * @return matching events in arrival order
     */
    public List<HustleEvent> named(String name) {
        List<HustleEvent> matching = new ArrayList<>();
        for (HustleEvent event : events) {
            if (event.name().equals(name)) {
                matching.add(event);
            }
        }
        return matching;
    }

    /**
     * Counts recorded events with the given name.
     *
     * @param name the event name
     * @return number of matching events
     */
    public int count(String name) {
        return named(name).size();
    }

    /**
     * Clears all recorded events.
     */
    public void clear() {
        events.clear();
    }
}
