package com.ryuqq.workflow.core.spi;

import com.ryuqq.workflow.core.model.TransitionRecord;

/**
 * Receives a record of every successful transition.
 *
 * <p>Delivery beyond this call (queues, buses, webhooks) is the implementation's concern.</p>
 *
 * @author Workflow Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface EventManager {

    /**
     * Pushes a transition record.
     *
     * @param record the committed transition
     */
    void pushEvent(TransitionRecord record);
}
