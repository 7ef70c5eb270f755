package com.ryuqq.workflow.core.exception;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Workflow 예외 계층 테스트.
 *
 * @author Workflow Team
 * @since 1.0.0
 */
class WorkflowExceptionTest {

    @Test
    void invalidTransition_CarriesContext() {
        // When
        WorkflowException e = new InvalidTransitionException("complete", "draft", "completed");

        // Then
        assertEquals("Invalid transition complete: draft -> completed", e.getMessage());
        assertEquals(InvalidTransitionException.ERROR_CODE, e.getErrorCode());
        assertEquals("complete", e.getTransition());
        assertEquals("draft", e.getCurrentState());
        assertEquals("completed", e.getToState());
    }

    @Test
    void forbiddenTransition_FormatsMessage() {
        WorkflowException e = new ForbiddenTransitionException("submit", "draft", "submitted");

        assertEquals("Transition forbidden submit: draft -> submitted", e.getMessage());
        assertEquals("FORBIDDEN_TRANSITION", e.getErrorCode());
    }

    @Test
    void transitionDoesNotExist_HasNoStates() {
        WorkflowException e = new TransitionDoesNotExistException("archive");

        assertEquals("Transition archive does not exist", e.getMessage());
        assertNull(e.getCurrentState());
        assertNull(e.getToState());
    }

    @Test
    void transitionNotFound_FormatsMessage() {
        WorkflowException e = new TransitionNotFoundException("draft", "completed");

        assertEquals("Transition not found from draft to completed", e.getMessage());
        assertNull(e.getTransition());
    }

    @Test
    void transitionUnavailable_FormatsMessage() {
        WorkflowException e = new TransitionUnavailableException("completed");

        assertEquals("No transition available out of state completed", e.getMessage());
        assertEquals("completed", e.getCurrentState());
    }

    @Test
    void transitionAmbiguous_CarriesCount() {
        TransitionAmbiguousException e = new TransitionAmbiguousException("submitted", 2);

        assertEquals("Multiple possible transitions (got 2 choices, expected 1)", e.getMessage());
        assertEquals(2, e.getCount());
    }

    @Test
    void circularWorkflow_FormatsMessage() {
        WorkflowException e = new CircularWorkflowException("reopen", "published", "draft");

        assertEquals("Cannot advance circular workflow (infinite loop): reopen re-enters draft", e.getMessage());
        assertEquals(CircularWorkflowException.ERROR_CODE, e.getErrorCode());
    }

    @Test
    void workflowValidation_CopiesErrors() {
        // Given
        List<String> errors = new ArrayList<>(List.of("receipt missing", "amount negative"));

        // When
        WorkflowValidationException e = new WorkflowValidationException(errors);
        errors.clear();

        // Then
        assertEquals(List.of("receipt missing", "amount negative"), e.getErrors());
        assertTrue(new WorkflowValidationException().getErrors().isEmpty());
    }

    @Test
    void allExceptions_AreUnchecked() {
        assertTrue(RuntimeException.class.isAssignableFrom(WorkflowException.class));
    }
}
