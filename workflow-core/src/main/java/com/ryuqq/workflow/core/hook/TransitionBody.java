package com.ryuqq.workflow.core.hook;

/**
 * 전이 본문 (사용자 로직).
 *
 * <p>상태 변경 직전에 실행되며 반환값은 after 훅과 호출자에게 전달됩니다.</p>
 *
 * @author Workflow Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface TransitionBody {

    /**
     * @param args 전이 호출 인자
     * @return 전이 결과 (null 가능)
     */
    Object apply(Object... args);
}
