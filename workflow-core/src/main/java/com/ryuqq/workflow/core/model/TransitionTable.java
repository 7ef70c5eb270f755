package com.ryuqq.workflow.core.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * 선언적 전이 테이블 (불변).
 *
 * <p>Workflow 타입이 정의될 때 한 번 생성되며, 이후 조회만 수행합니다.
 * 모든 연산은 부수 효과가 없습니다.</p>
 *
 * <p><strong>불변식:</strong></p>
 * <ul>
 *   <li>상태는 1개 이상 선언되어야 하며 중복 불가</li>
 *   <li>전이 이름은 테이블 내 고유</li>
 *   <li>모든 destination은 선언된 상태여야 함</li>
 *   <li>와일드카드가 아닌 source는 선언된 상태만 참조</li>
 *   <li>초기 상태는 명시하지 않으면 첫 번째 선언 상태</li>
 * </ul>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * TransitionTable table = new TransitionTable(
 *     List.of("draft", "submitted", "completed", "rejected"),
 *     null,
 *     List.of(
 *         Transition.of("submit", "draft", "submitted"),
 *         Transition.of("complete", "submitted", "completed"),
 *         Transition.fromAny("reject", "rejected")
 *     )
 * );
 *
 * table.initialState();                 // "draft"
 * table.transitionByName("submit");     // Optional[submit]
 * </pre>
 *
 * @author Workflow Team
 * @since 1.0.0
 */
public final class TransitionTable {

    private final List<String> states;
    private final String initialState;
    private final List<Transition> transitions;
    private final Map<String, Transition> byName;

    /**
     * 생성자 (유효성 검증 포함).
     *
     * @param states 선언된 상태 목록 (선언 순서 유지)
     * @param initialState 초기 상태 (null이면 첫 번째 상태)
     * @param transitions 전이 목록 (선언 순서 유지)
     * @throws IllegalArgumentException 불변식을 위반한 경우
     */
    public TransitionTable(List<String> states, String initialState, List<Transition> transitions) {
        if (states == null || states.isEmpty()) {
            throw new IllegalArgumentException("states cannot be null or empty");
        }
        if (transitions == null) {
            throw new IllegalArgumentException("transitions cannot be null");
        }

        Set<String> declared = new LinkedHashSet<>();
        for (String state : states) {
            if (state == null || state.isBlank()) {
                throw new IllegalArgumentException("state cannot be null or blank");
            }
            if (!declared.add(state)) {
                throw new IllegalArgumentException("Duplicate state: " + state);
            }
        }

        if (initialState != null && !declared.contains(initialState)) {
            throw new IllegalArgumentException("Initial state is not declared: " + initialState);
        }

        Map<String, Transition> index = new LinkedHashMap<>();
        for (Transition transition : transitions) {
            if (transition == null) {
                throw new IllegalArgumentException("transition cannot be null");
            }
            if (index.putIfAbsent(transition.name(), transition) != null) {
                throw new IllegalArgumentException("Duplicate transition name: " + transition.name());
            }
            if (!declared.contains(transition.destination())) {
                throw new IllegalArgumentException(String.format(
                    "Transition %s targets undeclared state: %s", transition.name(), transition.destination()));
            }
            if (transition.source() instanceof Source.Specific specific) {
                for (String source : specific.states()) {
                    if (!declared.contains(source)) {
                        throw new IllegalArgumentException(String.format(
                            "Transition %s starts from undeclared state: %s", transition.name(), source));
                    }
                }
            }
        }

        this.states = List.copyOf(declared);
        this.initialState = initialState != null ? initialState : this.states.get(0);
        this.transitions = Collections.unmodifiableList(new ArrayList<>(transitions));
        this.byName = Collections.unmodifiableMap(index);
    }

    /**
     * 이름으로 전이 조회.
     *
     * @param name 전이 이름
     * @return 전이 (없으면 empty)
     */
    public Optional<Transition> transitionByName(String name) {
        return Optional.ofNullable(byName.get(name));
    }

    /**
     * 전이 존재 여부.
     *
     * @param name 전이 이름
     * @return 선언된 전이이면 true
     */
    public boolean isTransition(String name) {
        return byName.containsKey(name);
    }

    /**
     * 초기 상태.
     *
     * @return 명시된 초기 상태 또는 첫 번째 선언 상태
     */
    public String initialState() {
        return initialState;
    }

    /**
     * 전이의 source가 주어진 상태와 일치하는지 확인.
     *
     * @param transition 전이
     * @param state 상태
     * @return 와일드카드, 동일 상태, 또는 상태 집합에 포함되면 true
     */
    public boolean matchesSource(Transition transition, String state) {
        return transition.matchesSource(state);
    }

    /**
     * 상태 선언 여부.
     *
     * @param state 상태
     * @return 선언된 상태이면 true
     */
    public boolean isState(String state) {
        return states.contains(state);
    }

    /**
     * 선언된 상태 목록.
     *
     * @return 불변 상태 목록 (선언 순서)
     */
    public List<String> states() {
        return states;
    }

    /**
     * 전체 전이 목록.
     *
     * @return 불변 전이 목록 (선언 순서)
     */
    public List<Transition> all() {
        return transitions;
    }
}
