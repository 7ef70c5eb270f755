package com.ryuqq.workflow.core.hook;

/**
 * 전이 직후 훅. 상태 진입 훅 다음, 저장 전에 본문 결과와 함께 실행됩니다.
 *
 * @author Workflow Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface AfterHook {

    /**
     * @param result 전이 본문 결과 (본문이 없으면 null)
     */
    void accept(Object result);
}
