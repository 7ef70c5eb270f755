package com.ryuqq.workflow.core.hook;

/**
 * 상태 단위로 등록되는 가드/훅의 종류.
 *
 * <p>하나의 상태에 같은 종류의 함수를 여러 개 등록할 수 있으며 등록 순서대로 평가됩니다.</p>
 * <ul>
 *   <li>검사(check): 모두 true여야 전이 허용 (논리 AND)</li>
 *   <li>훅(hook): 모두 실행됨 (short-circuit 없음)</li>
 * </ul>
 *
 * @author Workflow Team
 * @since 1.0.0
 */
public enum HookKind {

    /**
     * 상태 진입 전 검사.
     */
    ENTER_STATE_CHECK,

    /**
     * 상태 이탈 전 검사.
     */
    EXIT_STATE_CHECK,

    /**
     * 상태 진입 훅 (상태 변경 후 실행).
     */
    ENTER_STATE_HOOK,

    /**
     * 상태 이탈 훅 (상태 변경 전 실행).
     */
    EXIT_STATE_HOOK;

    /**
     * 검사 종류인지 확인.
     *
     * @return ENTER_STATE_CHECK 또는 EXIT_STATE_CHECK인 경우 true
     */
    public boolean isCheck() {
        return this == ENTER_STATE_CHECK || this == EXIT_STATE_CHECK;
    }
}
