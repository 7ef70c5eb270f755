package com.ryuqq.workflow.core.exception;

/**
 * 현재 상태가 전이의 source와 일치하지 않을 때 발생.
 *
 * @author Workflow Team
 * @since 1.0.0
 */
public class InvalidTransitionException extends WorkflowException {

    public static final String ERROR_CODE = "INVALID_TRANSITION";

    public InvalidTransitionException(String transition, String currentState, String toState) {
        super(ERROR_CODE,
            String.format("Invalid transition %s: %s -> %s", transition, currentState, toState),
            transition, currentState, toState);
    }
}
