package com.ryuqq.workflow.core.exception;

/**
 * 가드 조건(전이 조건, 상태 진입 검사, 상태 이탈 검사)이 false를 반환했을 때 발생.
 *
 * <p>가드 단계에서 발생하므로 Subject의 상태는 변경되지 않은 상태입니다.</p>
 *
 * @author Workflow Team
 * @since 1.0.0
 */
public class ForbiddenTransitionException extends WorkflowException {

    public static final String ERROR_CODE = "FORBIDDEN_TRANSITION";

    public ForbiddenTransitionException(String transition, String currentState, String toState) {
        super(ERROR_CODE,
            String.format("Transition forbidden %s: %s -> %s", transition, currentState, toState),
            transition, currentState, toState);
    }
}
