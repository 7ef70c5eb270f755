/**
 * Guard evaluation.
 *
 * <p>{@link com.ryuqq.workflow.core.guard.GuardEvaluator} decides whether a transition may leave
 * a given state. Evaluation short-circuits in this order:</p>
 * <ol>
 *   <li>transition condition, with the call arguments</li>
 *   <li>enter-state checks of the destination</li>
 *   <li>exit-state checks of the current state</li>
 * </ol>
 *
 * @since 1.0.0
 * @author Workflow Team
 */
package com.ryuqq.workflow.core.guard;
