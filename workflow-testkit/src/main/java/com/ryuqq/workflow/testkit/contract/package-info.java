/**
 * Contract test base classes for workflow definitions.
 *
 * <ul>
 *   <li>{@link com.ryuqq.workflow.testkit.contract.AbstractWorkflowContractTest}: in-memory SPI fixtures and assertions</li>
 *   <li>{@link com.ryuqq.workflow.testkit.contract.AbstractAllTransitionsContractTest}: runs every transition from every source</li>
 * </ul>
 *
 * <p>Add {@code workflow-testkit} with test scope and extend one of the base classes.</p>
 *
 * @author Workflow Team
 * @since 1.0.0
 */
package com.ryuqq.workflow.testkit.contract;
