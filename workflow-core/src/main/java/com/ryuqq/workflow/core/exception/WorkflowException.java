package com.ryuqq.workflow.core.exception;

/**
 * 모든 Workflow 오류의 기반 예외.
 *
 * <p>진단을 위해 오류 코드와 함께 전이 이름, 현재 상태, 목표 상태를 담습니다.
 * 해당 정보가 없는 오류 종류에서는 null입니다.</p>
 *
 * <p><strong>전파 정책:</strong></p>
 * <ul>
 *   <li>감지된 지점에서 동기적으로 발생</li>
 *   <li>엔진 내부에서 잡지 않음 (비발생 모드 가드 평가 제외)</li>
 * </ul>
 *
 * @author Workflow Team
 * @since 1.0.0
 */
public abstract class WorkflowException extends RuntimeException {

    private final String errorCode;
    private final String transition;
    private final String currentState;
    private final String toState;

    protected WorkflowException(String errorCode, String message,
                                String transition, String currentState, String toState) {
        super(message);
        this.errorCode = errorCode;
        this.transition = transition;
        this.currentState = currentState;
        this.toState = toState;
    }

    public String getErrorCode() {
        return errorCode;
    }

    /**
     * @return 전이 이름 (null 가능)
     */
    public String getTransition() {
        return transition;
    }

    /**
     * @return 오류 시점의 현재 상태 (null 가능)
     */
    public String getCurrentState() {
        return currentState;
    }

    /**
     * @return 목표 상태 (null 가능)
     */
    public String getToState() {
        return toState;
    }
}
