/**
 * Workflow declaration model.
 *
 * <p>Immutable types describing what a workflow type allows: states, transitions
 * and their sources, plus the records produced after a transition commits.</p>
 *
 * <h2>Components</h2>
 * <ul>
 *   <li>{@link com.ryuqq.workflow.core.model.Source} - Transition origin ({@code Specific} or wildcard {@code Any})</li>
 *   <li>{@link com.ryuqq.workflow.core.model.Transition} - Named edge to one destination state</li>
 *   <li>{@link com.ryuqq.workflow.core.model.TransitionTable} - Validated, ordered transition table</li>
 *   <li>{@link com.ryuqq.workflow.core.model.TransitionRecord} - Event / audit payload of a committed transition</li>
 *   <li>{@link com.ryuqq.workflow.core.model.NextState} - Projection of an available transition onto its destination</li>
 * </ul>
 *
 * <h2>Invariants</h2>
 * <ul>
 *   <li>Transition names are unique within a table</li>
 *   <li>Every destination is a declared state; the wildcard is never a destination</li>
 *   <li>Specific sources only reference declared states</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Workflow Team
 */
package com.ryuqq.workflow.core.model;
