package com.ryuqq.workflow.core.exception;

/**
 * 현재 상태에서 목표 상태로 가는 전이가 없을 때 발생.
 *
 * @author Workflow Team
 * @since 1.0.0
 */
public class TransitionNotFoundException extends WorkflowException {

    public static final String ERROR_CODE = "TRANSITION_NOT_FOUND";

    public TransitionNotFoundException(String currentState, String toState) {
        super(ERROR_CODE,
            String.format("Transition not found from %s to %s", currentState, toState),
            null, currentState, toState);
    }
}
