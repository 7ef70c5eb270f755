/**
 * Transition engine.
 *
 * <p>{@link com.ryuqq.workflow.core.engine.Workflow} is the entry point: it binds a
 * {@link com.ryuqq.workflow.core.engine.WorkflowDefinition} to one subject, exposes the
 * query API and dispatches transitions to the
 * {@link com.ryuqq.workflow.core.engine.TransitionExecutor}, the only component that
 * mutates subject state.</p>
 *
 * <h2>Transition Pipeline</h2>
 * <pre>
 * source check → guards → before → exit hooks → body
 *   → STATE MUTATION
 *   → enter hooks → after → date stamp + persist → audit log → events
 * </pre>
 *
 * <h2>Failure Semantics</h2>
 * <ul>
 *   <li>Failures before the mutation leave the subject's state unchanged</li>
 *   <li>Failures after the mutation leave the in-memory state at the destination;
 *       storage-level recovery belongs to the caller's unit of work</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Workflow Team
 */
package com.ryuqq.workflow.core.engine;
