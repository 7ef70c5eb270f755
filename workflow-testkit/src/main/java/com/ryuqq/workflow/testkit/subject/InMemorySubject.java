package com.ryuqq.workflow.testkit.subject;

import com.ryuqq.workflow.core.spi.StateAccessor;
import com.ryuqq.workflow.core.spi.Subject;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * In-memory {@link Subject} for tests.
 *
 * <p>Holds any number of named state fields plus date fields, and simulates a store row:
 * {@link #persist()} takes a snapshot of the current fields, so a test can compare the
 * in-memory state with what was last "saved".</p>
 *
 * <p><strong>Usage:</strong></p>
 * <pre>
 * InMemorySubject order = new InMemorySubject("order-1", "draft");
 *
 * WorkflowDefinition&lt;InMemorySubject&gt; definition = WorkflowDefinition
 *     .builder("order", InMemorySubject.accessor())
 *     ...
 *     .build();
 *
 * new Workflow&lt;&gt;(definition, order).run("submit");
 *
 * order.getPersistedState();   // "submitted"
 * order.isDirty();             // false
 * </pre>
 *
 * <p>Not thread-safe, like the subjects a workflow drives.</p>
 *
 * @author Workflow Team
 * @since 1.0.0
 */
public class InMemorySubject implements Subject {

    private final String id;
    private final Map<String, String> states = new LinkedHashMap<>();
    private final Map<String, Instant> dates = new LinkedHashMap<>();
    private Map<String, String> persistedStates = Map.of();
    private int persistCount;

    /**
     * Creates a subject with the default state field set.
     *
     * @param id identifier used in log lines
     * @param state initial value of the {@value StateAccessor#DEFAULT_FIELD_NAME} field
     */
    public InMemorySubject(String id, String state) {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("id cannot be null or blank");
        }
        this.id = id;
        this.states.put(StateAccessor.DEFAULT_FIELD_NAME, state);
    }

    /**
     * Accessor for the default state field.
     *
     * @return state accessor
     */
    public static StateAccessor<InMemorySubject> accessor() {
        return accessor(StateAccessor.DEFAULT_FIELD_NAME);
    }

    /**
     * Accessor for a named state field.
     *
     * @param fieldName state field name
     * @return state accessor
     */
    public static StateAccessor<InMemorySubject> accessor(String fieldName) {
        return StateAccessor.of(fieldName, subject -> subject.getState(fieldName),
            (subject, value) -> subject.setState(fieldName, value));
    }

    public String getId() {
        return id;
    }

    public String getState() {
        return getState(StateAccessor.DEFAULT_FIELD_NAME);
    }

    public void setState(String state) {
        setState(StateAccessor.DEFAULT_FIELD_NAME, state);
    }

    public String getState(String fieldName) {
        return states.get(fieldName);
    }

    public void setState(String fieldName, String state) {
        states.put(fieldName, state);
    }

    @Override
    public void persist() {
        persistedStates = Collections.unmodifiableMap(new LinkedHashMap<>(states));
        persistCount++;
    }

    @Override
    public void stampDate(String dateField, Instant at) {
        dates.put(dateField, at);
    }

    /**
     * @return last persisted value of the default state field (null if never persisted)
     */
    public String getPersistedState() {
        return getPersistedState(StateAccessor.DEFAULT_FIELD_NAME);
    }

    public String getPersistedState(String fieldName) {
        return persistedStates.get(fieldName);
    }

    public Optional<Instant> getDate(String dateField) {
        return Optional.ofNullable(dates.get(dateField));
    }

    public int getPersistCount() {
        return persistCount;
    }

    /**
     * @return true if a state field differs from the last persisted snapshot
     */
    public boolean isDirty() {
        return !states.equals(persistedStates);
    }

    @Override
    public String toString() {
        return "InMemorySubject{" + id + ", " + states + '}';
    }
}
