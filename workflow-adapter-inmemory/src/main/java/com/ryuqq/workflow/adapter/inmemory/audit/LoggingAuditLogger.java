package com.ryuqq.workflow.adapter.inmemory.audit;

import com.ryuqq.workflow.core.spi.AuditLogger;
import com.ryuqq.workflow.core.spi.Subject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * {@link AuditLogger} that writes each audit record to an SLF4J logger.
 *
 * <p>Useful when no audit table exists yet and the application log is the audit trail.
 * Records are written at INFO level.</p>
 *
 * @author Workflow Team
 * @since 1.0.0
 */
public class LoggingAuditLogger implements AuditLogger {

    private final Logger log;

    /**
     * Creates a logger writing to the {@code LoggingAuditLogger} category.
     */
    public LoggingAuditLogger() {
        this(LoggerFactory.getLogger(LoggingAuditLogger.class));
    }

    /**
     * Creates a logger writing to the given SLF4J logger.
     *
     * @param log target logger
     * @throws IllegalArgumentException if log is null
     */
    public LoggingAuditLogger(Logger log) {
        if (log == null) {
            throw new IllegalArgumentException("log cannot be null");
        }
        this.log = log;
    }

    @Override
    public void log(String transitionName, String fromState, String toState, Subject subject, List<Object> params) {
        log.info("Audit {}: {} → {} on {} with {}", transitionName, fromState, toState, subject, params);
    }
}
