/**
 * Service Provider Interfaces for the workflow engine.
 *
 * <p>These interfaces are the narrow boundary between the engine and its external
 * collaborators. The engine calls them; their internals are out of its scope.</p>
 *
 * <h2>Components</h2>
 * <ul>
 *   <li>{@link com.ryuqq.workflow.core.spi.Subject} - the entity a workflow drives</li>
 *   <li>{@link com.ryuqq.workflow.core.spi.StateAccessor} - reads/writes the state attribute</li>
 *   <li>{@link com.ryuqq.workflow.core.spi.UnitOfWork} - storage-level atomicity of one transition</li>
 *   <li>{@link com.ryuqq.workflow.core.spi.AuditLogger} - audit trail of committed transitions</li>
 *   <li>{@link com.ryuqq.workflow.core.spi.EventManager} - event emission after commit</li>
 * </ul>
 *
 * <p>No-op implementations live in {@code com.ryuqq.workflow.core.spi.noop}.</p>
 *
 * @since 1.0.0
 * @author Workflow Team
 */
package com.ryuqq.workflow.core.spi;
