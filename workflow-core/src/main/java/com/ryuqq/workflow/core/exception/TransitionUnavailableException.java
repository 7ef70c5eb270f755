package com.ryuqq.workflow.core.exception;

/**
 * 자동 진행(advance) 시 가능한 전이가 하나도 없을 때 발생.
 *
 * @author Workflow Team
 * @since 1.0.0
 */
public class TransitionUnavailableException extends WorkflowException {

    public static final String ERROR_CODE = "TRANSITION_UNAVAILABLE";

    public TransitionUnavailableException(String currentState) {
        super(ERROR_CODE,
            String.format("No transition available out of state %s", currentState),
            null, currentState, null);
    }
}
