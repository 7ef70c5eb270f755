/**
 * Reusable test subjects.
 *
 * @author Workflow Team
 * @since 1.0.0
 */
package com.ryuqq.workflow.testkit.subject;
