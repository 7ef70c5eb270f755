package com.ryuqq.workflow.core.hook;

/**
 * 전이 직전 훅. 가드 통과 후, 상태 이탈 훅 전에 호출 인자와 함께 실행됩니다.
 *
 * @author Workflow Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface BeforeHook {

    void accept(Object... args);
}
