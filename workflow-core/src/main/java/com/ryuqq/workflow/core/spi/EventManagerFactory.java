package com.ryuqq.workflow.core.spi;

/**
 * Creates the {@link EventManager} of one workflow instance.
 *
 * <p>Called once when a workflow instance is constructed, with the subject it wraps.</p>
 *
 * @param <T> subject type
 * @author Workflow Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface EventManagerFactory<T> {

    EventManager create(T subject);

    /**
     * Factory that shares one manager across all instances.
     *
     * @param manager the shared manager
     * @param <T> subject type
     * @return a factory always returning {@code manager}
     */
    static <T> EventManagerFactory<T> shared(EventManager manager) {
        if (manager == null) {
            throw new IllegalArgumentException("manager cannot be null");
        }
        return subject -> manager;
    }
}
