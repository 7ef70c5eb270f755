package com.ryuqq.workflow.core.spi;

import java.util.List;

/**
 * Audit log sink for committed transitions.
 *
 * <p>Invoked only when audit logging is enabled in the workflow configuration,
 * after the subject has been persisted.</p>
 *
 * <p><strong>Implementation Requirements:</strong></p>
 * <ul>
 *   <li>Records are append-only: the engine never updates a logged entry</li>
 *   <li>Exceptions propagate to the transition caller (state is already mutated)</li>
 * </ul>
 *
 * @author Workflow Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface AuditLogger {

    /**
     * Logs a committed transition.
     *
     * @param transitionName the transition name
     * @param fromState the exact pre-transition state
     * @param toState the destination state
     * @param subject the subject that moved
     * @param params the arguments the transition was called with
     */
    void log(String transitionName, String fromState, String toState, Subject subject, List<Object> params);
}
