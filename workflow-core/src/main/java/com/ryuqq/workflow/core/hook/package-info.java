/**
 * Hook and guard registration.
 *
 * <p>Hooks are bound explicitly through {@link com.ryuqq.workflow.core.hook.HookBindings}
 * and frozen into a {@link com.ryuqq.workflow.core.hook.HookRegistry} once per workflow instance.</p>
 *
 * <h2>Kinds</h2>
 * <pre>
 * state-scoped (many per state, registration order):
 *   ENTER_STATE_CHECK, EXIT_STATE_CHECK   → conjunctive guards
 *   ENTER_STATE_HOOK,  EXIT_STATE_HOOK    → side-effecting callbacks, all run
 *
 * transition-scoped (one per transition):
 *   check → before → body → after
 * </pre>
 *
 * @since 1.0.0
 * @author Workflow Team
 */
package com.ryuqq.workflow.core.hook;
