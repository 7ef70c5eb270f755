/**
 * Audit logger adapters.
 *
 * <p>Reference implementations of the {@link com.ryuqq.workflow.core.spi.AuditLogger} SPI:</p>
 * <ul>
 *   <li>{@link com.ryuqq.workflow.adapter.inmemory.audit.InMemoryAuditLogger}: keeps entries in memory for assertions</li>
 *   <li>{@link com.ryuqq.workflow.adapter.inmemory.audit.LoggingAuditLogger}: writes entries through SLF4J</li>
 * </ul>
 *
 * <p>The engine calls an audit logger only when
 * {@link com.ryuqq.workflow.core.engine.WorkflowConfig#auditLogging()} is enabled, after the
 * subject has been persisted.</p>
 *
 * @author Workflow Team
 * @since 1.0.0
 */
package com.ryuqq.workflow.adapter.inmemory.audit;
