package com.ryuqq.workflow.core.model;

/**
 * 주어진 상태에서 도달 가능한 다음 상태.
 *
 * @param state 도착 상태
 * @param transitionName 해당 상태로 가는 전이 이름
 * @param label 전이 라벨 (null 가능)
 *
 * @author Workflow Team
 * @since 1.0.0
 */
public record NextState(String state, String transitionName, String label) {

    /**
     * 전이로부터 NextState 생성.
     *
     * @param transition 전이
     * @return NextState 인스턴스
     */
    public static NextState of(Transition transition) {
        return new NextState(transition.destination(), transition.name(), transition.label());
    }
}
