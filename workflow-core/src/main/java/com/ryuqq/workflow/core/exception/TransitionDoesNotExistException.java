package com.ryuqq.workflow.core.exception;

/**
 * 요청한 전이 이름이 전이 테이블에 없을 때 발생.
 *
 * @author Workflow Team
 * @since 1.0.0
 */
public class TransitionDoesNotExistException extends WorkflowException {

    public static final String ERROR_CODE = "TRANSITION_DOES_NOT_EXIST";

    public TransitionDoesNotExistException(String transition) {
        super(ERROR_CODE, String.format("Transition %s does not exist", transition),
            transition, null, null);
    }
}
