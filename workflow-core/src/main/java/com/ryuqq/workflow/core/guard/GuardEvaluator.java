package com.ryuqq.workflow.core.guard;

import com.ryuqq.workflow.core.exception.ForbiddenTransitionException;
import com.ryuqq.workflow.core.hook.HookKind;
import com.ryuqq.workflow.core.hook.HookRegistry;
import com.ryuqq.workflow.core.hook.StateCheck;
import com.ryuqq.workflow.core.hook.TransitionCondition;
import com.ryuqq.workflow.core.model.Transition;

import java.util.List;
import java.util.Optional;

/**
 * 전이 가드 평가기.
 *
 * <p>전이 조건, 도착 상태 진입 검사, 현재 상태 이탈 검사를 모아 허용/거부를 결정합니다.</p>
 *
 * <p><strong>평가 순서:</strong></p>
 * <ol>
 *   <li>전이 조건 (등록된 경우, 호출 인자와 함께)</li>
 *   <li>조건을 통과한 경우에만: destination의 모든 진입 검사 (AND)</li>
 *   <li>현재 상태의 모든 이탈 검사 (AND)</li>
 * </ol>
 *
 * <p>거부 시 기본적으로 {@link ForbiddenTransitionException}을 발생시키며,
 * 조회 API는 {@link #isAllowed}로 boolean 결과만 받습니다.
 * 검사 함수 호출 외의 부수 효과는 없습니다.</p>
 *
 * @author Workflow Team
 * @since 1.0.0
 */
public final class GuardEvaluator {

    private final HookRegistry registry;

    /**
     * 생성자.
     *
     * @param registry 훅 레지스트리
     * @throws IllegalArgumentException registry가 null인 경우
     */
    public GuardEvaluator(HookRegistry registry) {
        if (registry == null) {
            throw new IllegalArgumentException("registry cannot be null");
        }
        this.registry = registry;
    }

    /**
     * 전이 허용 여부 평가 (거부 시 예외 발생).
     *
     * @param transition 평가할 전이
     * @param currentState 현재 상태
     * @param args 전이 호출 인자
     * @return 항상 true
     * @throws ForbiddenTransitionException 가드가 거부한 경우
     */
    public boolean checkTransition(Transition transition, String currentState, Object... args) {
        return evaluate(transition, currentState, true, args);
    }

    /**
     * 전이 허용 여부 평가 (비발생 모드).
     *
     * @param transition 평가할 전이
     * @param currentState 현재 상태
     * @param args 전이 호출 인자
     * @return 허용되면 true
     */
    public boolean isAllowed(Transition transition, String currentState, Object... args) {
        return evaluate(transition, currentState, false, args);
    }

    /**
     * 전이 허용 여부 평가.
     *
     * @param transition 평가할 전이
     * @param currentState 현재 상태
     * @param raise 거부 시 예외 발생 여부
     * @param args 전이 호출 인자 (null이면 인자 없음)
     * @return 허용되면 true, 거부되고 raise가 false이면 false
     * @throws ForbiddenTransitionException 거부되고 raise가 true인 경우
     */
    public boolean evaluate(Transition transition, String currentState, boolean raise, Object[] args) {
        boolean allowed = conditionHolds(transition, args)
            && allPass(registry.checks(HookKind.ENTER_STATE_CHECK, transition.destination()))
            && allPass(registry.checks(HookKind.EXIT_STATE_CHECK, currentState));

        if (allowed) {
            return true;
        }
        if (raise) {
            throw new ForbiddenTransitionException(transition.name(), currentState, transition.destination());
        }
        return false;
    }

    private boolean conditionHolds(Transition transition, Object[] args) {
        Optional<TransitionCondition> condition = registry.condition(transition.name());
        return condition.isEmpty() || condition.get().test(args == null ? new Object[0] : args);
    }

    private static boolean allPass(List<StateCheck> checks) {
        for (StateCheck check : checks) {
            if (!check.test()) {
                return false;
            }
        }
        return true;
    }
}
