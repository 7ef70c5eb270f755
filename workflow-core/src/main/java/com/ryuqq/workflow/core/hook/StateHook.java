package com.ryuqq.workflow.core.hook;

import com.ryuqq.workflow.core.model.Transition;

/**
 * 상태 진입/이탈 훅.
 *
 * @author Workflow Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface StateHook {

    /**
     * @param transition 실행 중인 전이
     */
    void accept(Transition transition);
}
