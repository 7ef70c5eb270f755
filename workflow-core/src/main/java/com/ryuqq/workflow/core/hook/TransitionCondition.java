package com.ryuqq.workflow.core.hook;

/**
 * 전이 단위 조건. 전이 호출 인자를 그대로 받습니다.
 *
 * <p>조회 API에서 평가될 때는 인자 없이 호출됩니다.</p>
 *
 * @author Workflow Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface TransitionCondition {

    /**
     * @param args 전이 호출 인자
     * @return 전이를 허용하면 true
     */
    boolean test(Object... args);
}
