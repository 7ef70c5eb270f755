package com.ryuqq.workflow.adapter.inmemory.event;

import com.ryuqq.workflow.core.model.TransitionRecord;
import com.ryuqq.workflow.core.spi.EventManager;
import com.ryuqq.workflow.core.spi.EventManagerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * In-memory implementation of {@link EventManager} SPI for testing and reference purposes.
 *
 * <p>Collects every pushed {@link TransitionRecord} in push order. Since the engine creates
 * event managers per workflow instance, share one collector across instances with
 * {@link #factory()}.</p>
 *
 * <pre>
 * InMemoryEventManager events = new InMemoryEventManager();
 * builder.eventManager(events.factory());
 *
 * workflow.run("submit");
 * events.getEvents();               // [TransitionRecord[name=submit, ...]]
 * events.getEventsNamed("submit");  // same, filtered
 * </pre>
 *
 * @author Workflow Team
 * @since 1.0.0
 */
public class InMemoryEventManager implements EventManager {

    private final List<TransitionRecord> events = new CopyOnWriteArrayList<>();

    @Override
    public void pushEvent(TransitionRecord record) {
        if (record == null) {
            throw new IllegalArgumentException("record cannot be null");
        }
        events.add(record);
    }

    /**
     * Returns a factory handing this same collector to every workflow instance.
     *
     * @param <T> subject type
     * @return factory returning this instance
     */
    public <T> EventManagerFactory<T> factory() {
        return EventManagerFactory.shared(this);
    }

    /**
     * @return immutable snapshot of pushed records, in push order
     */
    public List<TransitionRecord> getEvents() {
        return List.copyOf(events);
    }

    /**
     * Returns records of one transition.
     *
     * @param transitionName transition name
     * @return matching records, in push order
     */
    public List<TransitionRecord> getEventsNamed(String transitionName) {
        List<TransitionRecord> result = new ArrayList<>();
        for (TransitionRecord record : events) {
            if (record.name().equals(transitionName)) {
                result.add(record);
            }
        }
        return result;
    }

    /**
     * @return number of pushed records
     */
    public int size() {
        return events.size();
    }

    /**
     * Clears all records (for test cleanup).
     */
    public void clear() {
        events.clear();
    }
}
