package com.ryuqq.workflow.core.exception;

/**
 * 연속 자동 진행 중 이미 지나온 상태로 되돌아왔을 때 발생 (무한 루프 방지).
 *
 * @author Workflow Team
 * @since 1.0.0
 */
public class CircularWorkflowException extends WorkflowException {

    public static final String ERROR_CODE = "CIRCULAR_WORKFLOW";

    public CircularWorkflowException(String transition, String currentState, String toState) {
        super(ERROR_CODE,
            String.format("Cannot advance circular workflow (infinite loop): %s re-enters %s",
                transition, toState),
            transition, currentState, toState);
    }
}
