/**
 * Workflow failure taxonomy.
 *
 * <p>All exceptions are unchecked, extend {@link com.ryuqq.workflow.core.exception.WorkflowException}
 * and carry an error code plus the transition and states involved.</p>
 *
 * @since 1.0.0
 * @author Workflow Team
 */
package com.ryuqq.workflow.core.exception;
