package com.ryuqq.workflow.adapter.inmemory.event;

import com.ryuqq.workflow.core.model.TransitionRecord;
import com.ryuqq.workflow.core.spi.EventManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link EventManager} that publishes transition events to the application log.
 *
 * <p>Created per workflow instance; the subject is kept only to label log lines.</p>
 *
 * <pre>
 * builder.eventManager(LoggingEventManager::new);
 * </pre>
 *
 * @author Workflow Team
 * @since 1.0.0
 */
public class LoggingEventManager implements EventManager {

    private static final Logger log = LoggerFactory.getLogger(LoggingEventManager.class);

    private final Object subject;

    /**
     * Creates an event manager bound to one subject.
     *
     * @param subject the workflow subject
     */
    public LoggingEventManager(Object subject) {
        this.subject = subject;
    }

    @Override
    public void pushEvent(TransitionRecord record) {
        log.info("Workflow event {} on {}: {} → {} params={}",
            record.name(), subject, record.fromState(), record.toState(), record.params());
    }
}
