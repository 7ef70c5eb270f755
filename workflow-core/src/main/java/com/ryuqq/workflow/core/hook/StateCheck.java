package com.ryuqq.workflow.core.hook;

/**
 * 상태 진입/이탈 검사.
 *
 * <p>부수 효과가 없어야 합니다 (조회 API가 비발생 모드로 반복 평가합니다).</p>
 *
 * @author Workflow Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface StateCheck {

    /**
     * @return 전이를 허용하면 true
     */
    boolean test();
}
