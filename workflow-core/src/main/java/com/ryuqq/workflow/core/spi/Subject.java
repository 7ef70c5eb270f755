package com.ryuqq.workflow.core.spi;

import java.time.Instant;

/**
 * Stateful entity driven by a workflow.
 *
 * <p>The subject is owned by the caller. A workflow instance only holds a reference
 * for the duration of its calls and never manages the subject's lifecycle.</p>
 *
 * <p><strong>Contract:</strong></p>
 * <ul>
 *   <li>{@link #persist()} is invoked exactly once per successful transition</li>
 *   <li>The state attribute itself is reached through a {@link StateAccessor},
 *       so one subject may carry several independently driven state fields</li>
 *   <li>{@link #stampDate(String, Instant)} must be overridden by subjects whose
 *       transitions declare a date field</li>
 * </ul>
 *
 * @author Workflow Team
 * @since 1.0.0
 */
public interface Subject {

    /**
     * Persists the subject after its state changed.
     *
     * @throws RuntimeException if the underlying storage fails
     */
    void persist();

    /**
     * Records the time a transition happened on the given field.
     *
     * @param dateField the field declared by the transition
     * @param at the transition time
     * @throws UnsupportedOperationException if this subject has no date fields
     */
    default void stampDate(String dateField, Instant at) {
        throw new UnsupportedOperationException(
            getClass().getSimpleName() + " does not support date field: " + dateField);
    }
}
