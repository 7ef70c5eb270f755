package com.ryuqq.workflow.core.hook;

import com.ryuqq.workflow.core.model.TransitionTable;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Workflow 인스턴스별 가드/훅 레지스트리 (불변).
 *
 * <p>인스턴스 생성 시 {@link HookBindings}로부터 한 번 만들어지며 이후 변경되지 않습니다.
 * 상태 이름(또는 전이 이름)으로 등록 순서가 유지된 함수 목록을 조회합니다.</p>
 *
 * <p><strong>생성 시 검증:</strong></p>
 * <ul>
 *   <li>상태 단위 함수는 선언된 상태에만 등록 가능</li>
 *   <li>전이 단위 함수는 선언된 전이에만 등록 가능</li>
 * </ul>
 *
 * @author Workflow Team
 * @since 1.0.0
 */
public final class HookRegistry {

    private final Map<HookKind, Map<String, List<StateCheck>>> checks;
    private final Map<HookKind, Map<String, List<StateHook>>> hooks;
    private final Map<String, TransitionCondition> conditions;
    private final Map<String, BeforeHook> befores;
    private final Map<String, TransitionBody> bodies;
    private final Map<String, AfterHook> afters;

    private HookRegistry(HookBindings bindings) {
        this.checks = freeze(bindings.checks());
        this.hooks = freeze(bindings.hooks());
        this.conditions = Map.copyOf(bindings.conditions());
        this.befores = Map.copyOf(bindings.befores());
        this.bodies = Map.copyOf(bindings.bodies());
        this.afters = Map.copyOf(bindings.afters());
    }

    /**
     * 등록 테이블로부터 레지스트리 생성.
     *
     * @param bindings 등록 테이블
     * @param table 전이 테이블 (참조 검증용)
     * @return HookRegistry 인스턴스
     * @throws IllegalArgumentException 선언되지 않은 상태/전이를 참조하는 경우
     */
    public static HookRegistry from(HookBindings bindings, TransitionTable table) {
        if (bindings == null) {
            throw new IllegalArgumentException("bindings cannot be null");
        }
        if (table == null) {
            throw new IllegalArgumentException("table cannot be null");
        }
        bindings.checks().forEach((kind, byState) -> requireStates(table, kind.name(), byState.keySet()));
        bindings.hooks().forEach((kind, byState) -> requireStates(table, kind.name(), byState.keySet()));
        requireTransitions(table, "condition", bindings.conditions().keySet());
        requireTransitions(table, "before hook", bindings.befores().keySet());
        requireTransitions(table, "body", bindings.bodies().keySet());
        requireTransitions(table, "after hook", bindings.afters().keySet());
        return new HookRegistry(bindings);
    }

    /**
     * 비어있는 레지스트리.
     *
     * @return 아무 함수도 등록되지 않은 레지스트리
     */
    public static HookRegistry empty() {
        return new HookRegistry(new HookBindings());
    }

    /**
     * 상태에 등록된 검사 목록.
     *
     * @param kind ENTER_STATE_CHECK 또는 EXIT_STATE_CHECK
     * @param state 상태
     * @return 등록 순서의 불변 목록 (없으면 빈 목록)
     * @throws IllegalArgumentException kind가 검사 종류가 아닌 경우
     */
    public List<StateCheck> checks(HookKind kind, String state) {
        if (!kind.isCheck()) {
            throw new IllegalArgumentException(kind + " is not a check kind");
        }
        return lookup(checks, kind, state);
    }

    /**
     * 상태에 등록된 훅 목록.
     *
     * @param kind ENTER_STATE_HOOK 또는 EXIT_STATE_HOOK
     * @param state 상태
     * @return 등록 순서의 불변 목록 (없으면 빈 목록)
     * @throws IllegalArgumentException kind가 훅 종류가 아닌 경우
     */
    public List<StateHook> hooks(HookKind kind, String state) {
        if (kind.isCheck()) {
            throw new IllegalArgumentException(kind + " is not a hook kind");
        }
        return lookup(hooks, kind, state);
    }

    public Optional<TransitionCondition> condition(String transition) {
        return Optional.ofNullable(conditions.get(transition));
    }

    public Optional<BeforeHook> before(String transition) {
        return Optional.ofNullable(befores.get(transition));
    }

    public Optional<TransitionBody> body(String transition) {
        return Optional.ofNullable(bodies.get(transition));
    }

    public Optional<AfterHook> after(String transition) {
        return Optional.ofNullable(afters.get(transition));
    }

    private static <F> List<F> lookup(Map<HookKind, Map<String, List<F>>> source, HookKind kind, String state) {
        Map<String, List<F>> byState = source.get(kind);
        if (byState == null) {
            return List.of();
        }
        return byState.getOrDefault(state, List.of());
    }

    private static <F> Map<HookKind, Map<String, List<F>>> freeze(Map<HookKind, Map<String, List<F>>> source) {
        Map<HookKind, Map<String, List<F>>> frozen = new EnumMap<>(HookKind.class);
        source.forEach((kind, byState) -> {
            Map<String, List<F>> copy = new LinkedHashMap<>();
            byState.forEach((state, functions) -> copy.put(state, List.copyOf(functions)));
            frozen.put(kind, Collections.unmodifiableMap(copy));
        });
        return Collections.unmodifiableMap(frozen);
    }

    private static void requireStates(TransitionTable table, String what, Set<String> states) {
        for (String state : states) {
            if (!table.isState(state)) {
                throw new IllegalArgumentException(
                    String.format("%s registered for undeclared state: %s", what, state));
            }
        }
    }

    private static void requireTransitions(TransitionTable table, String what, Set<String> transitions) {
        for (String transition : transitions) {
            if (!table.isTransition(transition)) {
                throw new IllegalArgumentException(
                    String.format("%s registered for undeclared transition: %s", what, transition));
            }
        }
    }
}
