package com.ryuqq.workflow.core.spi;

import java.util.function.BiConsumer;
import java.util.function.Function;

/**
 * Reads and writes the state attribute of a subject.
 *
 * <p>The field name is informational (logging, diagnostics); the getter and setter
 * do the actual work. The default field name is {@value #DEFAULT_FIELD_NAME}.</p>
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>
 * StateAccessor&lt;Order&gt; state = StateAccessor.of(Order::getState, Order::setState);
 * StateAccessor&lt;Order&gt; payment = StateAccessor.of("paymentState", Order::getPaymentState, Order::setPaymentState);
 * </pre>
 *
 * @param <T> subject type
 * @author Workflow Team
 * @since 1.0.0
 */
public interface StateAccessor<T> {

    String DEFAULT_FIELD_NAME = "state";

    /**
     * @return the name of the state attribute
     */
    String fieldName();

    /**
     * Reads the current state.
     *
     * @param subject the subject
     * @return the current state
     */
    String read(T subject);

    /**
     * Writes a new state. Must not persist.
     *
     * @param subject the subject
     * @param state the new state
     */
    void write(T subject, String state);

    /**
     * Creates an accessor for a named state attribute.
     *
     * @param fieldName attribute name
     * @param getter state getter
     * @param setter state setter
     * @param <T> subject type
     * @return a new accessor
     * @throws IllegalArgumentException if any argument is null
     */
    static <T> StateAccessor<T> of(String fieldName, Function<T, String> getter, BiConsumer<T, String> setter) {
        if (fieldName == null || fieldName.isBlank()) {
            throw new IllegalArgumentException("fieldName cannot be null or blank");
        }
        if (getter == null || setter == null) {
            throw new IllegalArgumentException("getter and setter cannot be null");
        }
        return new StateAccessor<>() {
            @Override
            public String fieldName() {
                return fieldName;
            }

            @Override
            public String read(T subject) {
                return getter.apply(subject);
            }

            @Override
            public void write(T subject, String state) {
                setter.accept(subject, state);
            }
        };
    }

    /**
     * Creates an accessor for the default {@value #DEFAULT_FIELD_NAME} attribute.
     *
     * @param getter state getter
     * @param setter state setter
     * @param <T> subject type
     * @return a new accessor
     */
    static <T> StateAccessor<T> of(Function<T, String> getter, BiConsumer<T, String> setter) {
        return of(DEFAULT_FIELD_NAME, getter, setter);
    }
}
