package com.ryuqq.workflow.core.model;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * 완료된 전이 기록 (이벤트 및 감사 로그 페이로드).
 *
 * <p>전이가 메모리 상에서 커밋된 후 생성되며 이후 변경되지 않습니다.
 * {@code fromState}는 선언된 source가 아니라 전이 직전의 실제 상태입니다.
 * 상태가 아직 기록되지 않은 주체에서 와일드카드 전이가 실행되면 null일 수 있습니다.</p>
 *
 * @param name 전이 이름
 * @param fromState 전이 직전 상태 (null 허용)
 * @param toState 도착 상태
 * @param params 전이 호출 인자 (불변, null 요소 허용)
 *
 * @author Workflow Team
 * @since 1.0.0
 */
public record TransitionRecord(
    String name,
    String fromState,
    String toState,
    List<Object> params
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException name 또는 toState가 null인 경우
     */
    public TransitionRecord {
        if (name == null) {
            throw new IllegalArgumentException("name cannot be null");
        }
        // fromState는 null 가능 (상태 미기록 주체)
        if (toState == null) {
            throw new IllegalArgumentException("toState cannot be null");
        }
        params = params == null ? List.of() : Collections.unmodifiableList(Arrays.asList(params.toArray()));
    }

    /**
     * 전이와 호출 인자로부터 기록 생성.
     *
     * @param transition 실행된 전이
     * @param fromState 전이 직전 상태 (null 허용)
     * @param args 호출 인자
     * @return TransitionRecord 인스턴스
     */
    public static TransitionRecord of(Transition transition, String fromState, Object... args) {
        List<Object> params = args == null ? List.of() : Arrays.asList(args.clone());
        return new TransitionRecord(transition.name(), fromState, transition.destination(), params);
    }
}
