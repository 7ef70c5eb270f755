package com.ryuqq.workflow.core.hook;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 가드/훅 명시적 등록 테이블.
 *
 * <p>Workflow 인스턴스 생성 시 한 번 채워지며, {@link HookRegistry#from}으로 불변 레지스트리가 됩니다.
 * 리플렉션이나 메서드 이름 탐색 없이 함수 참조를 상태/전이 이름과 종류에 직접 연결합니다.</p>
 *
 * <p><strong>등록 방식:</strong></p>
 * <ul>
 *   <li>상태 단위 (여러 상태에 동시 등록 가능, 상태당 여러 함수 가능):
 *     {@link #enterStateCheck}, {@link #exitStateCheck}, {@link #enterStateHook}, {@link #exitStateHook}</li>
 *   <li>상태 단위 단축형: {@link #onEnter}, {@link #onExit}</li>
 *   <li>전이 단위 (전이당 하나): {@link #check}, {@link #before}, {@link #body}, {@link #after}</li>
 * </ul>
 *
 * <p>같은 상태에 등록된 함수들은 등록 순서대로 평가/실행됩니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * bindings
 *     .check("submit", args -&gt; order.isSubmittable())
 *     .before("submit", args -&gt; order.lock())
 *     .body("submit", args -&gt; invoiceService.issue(order))
 *     .after("submit", result -&gt; notifier.invoiceIssued(result))
 *     .exitStateCheck(order::hasLines, "draft")
 *     .onEnter("submitted", transition -&gt; audit.mark(transition.name()));
 * </pre>
 *
 * @author Workflow Team
 * @since 1.0.0
 */
public final class HookBindings {

    private final Map<HookKind, Map<String, List<StateCheck>>> checks = new EnumMap<>(HookKind.class);
    private final Map<HookKind, Map<String, List<StateHook>>> hooks = new EnumMap<>(HookKind.class);
    private final Map<String, TransitionCondition> conditions = new LinkedHashMap<>();
    private final Map<String, BeforeHook> befores = new LinkedHashMap<>();
    private final Map<String, TransitionBody> bodies = new LinkedHashMap<>();
    private final Map<String, AfterHook> afters = new LinkedHashMap<>();

    /**
     * 상태 진입 검사 등록.
     *
     * @param check 검사 함수
     * @param states 대상 상태 (1개 이상)
     * @return this
     */
    public HookBindings enterStateCheck(StateCheck check, String... states) {
        return addCheck(HookKind.ENTER_STATE_CHECK, check, states);
    }

    /**
     * 상태 이탈 검사 등록.
     *
     * @param check 검사 함수
     * @param states 대상 상태 (1개 이상)
     * @return this
     */
    public HookBindings exitStateCheck(StateCheck check, String... states) {
        return addCheck(HookKind.EXIT_STATE_CHECK, check, states);
    }

    /**
     * 상태 진입 훅 등록.
     *
     * @param hook 훅 함수
     * @param states 대상 상태 (1개 이상)
     * @return this
     */
    public HookBindings enterStateHook(StateHook hook, String... states) {
        return addHook(HookKind.ENTER_STATE_HOOK, hook, states);
    }

    /**
     * 상태 이탈 훅 등록.
     *
     * @param hook 훅 함수
     * @param states 대상 상태 (1개 이상)
     * @return this
     */
    public HookBindings exitStateHook(StateHook hook, String... states) {
        return addHook(HookKind.EXIT_STATE_HOOK, hook, states);
    }

    public HookBindings onEnter(String state, StateHook hook) {
        return enterStateHook(hook, state);
    }

    public HookBindings onExit(String state, StateHook hook) {
        return exitStateHook(hook, state);
    }

    /**
     * 전이 조건 등록.
     *
     * @param transition 전이 이름
     * @param condition 조건 함수
     * @return this
     * @throws IllegalArgumentException 이미 등록된 전이인 경우
     */
    public HookBindings check(String transition, TransitionCondition condition) {
        putUnique(conditions, "condition", transition, condition);
        return this;
    }

    public HookBindings before(String transition, BeforeHook hook) {
        putUnique(befores, "before hook", transition, hook);
        return this;
    }

    public HookBindings body(String transition, TransitionBody body) {
        putUnique(bodies, "body", transition, body);
        return this;
    }

    public HookBindings after(String transition, AfterHook hook) {
        putUnique(afters, "after hook", transition, hook);
        return this;
    }

    Map<HookKind, Map<String, List<StateCheck>>> checks() {
        return checks;
    }

    Map<HookKind, Map<String, List<StateHook>>> hooks() {
        return hooks;
    }

    Map<String, TransitionCondition> conditions() {
        return conditions;
    }

    Map<String, BeforeHook> befores() {
        return befores;
    }

    Map<String, TransitionBody> bodies() {
        return bodies;
    }

    Map<String, AfterHook> afters() {
        return afters;
    }

    private HookBindings addCheck(HookKind kind, StateCheck check, String... states) {
        if (check == null) {
            throw new IllegalArgumentException(kind + " cannot be null");
        }
        Map<String, List<StateCheck>> byState = checks.computeIfAbsent(kind, k -> new LinkedHashMap<>());
        for (String state : requireStates(kind, states)) {
            byState.computeIfAbsent(state, s -> new ArrayList<>()).add(check);
        }
        return this;
    }

    private HookBindings addHook(HookKind kind, StateHook hook, String... states) {
        if (hook == null) {
            throw new IllegalArgumentException(kind + " cannot be null");
        }
        Map<String, List<StateHook>> byState = hooks.computeIfAbsent(kind, k -> new LinkedHashMap<>());
        for (String state : requireStates(kind, states)) {
            byState.computeIfAbsent(state, s -> new ArrayList<>()).add(hook);
        }
        return this;
    }

    private static String[] requireStates(HookKind kind, String... states) {
        if (states == null || states.length == 0) {
            throw new IllegalArgumentException(kind + " requires at least one state");
        }
        for (String state : states) {
            if (state == null || state.isBlank()) {
                throw new IllegalArgumentException(kind + " state cannot be null or blank");
            }
        }
        return states;
    }

    private static <F> void putUnique(Map<String, F> target, String what, String transition, F function) {
        if (transition == null || transition.isBlank()) {
            throw new IllegalArgumentException("transition name cannot be null or blank");
        }
        if (function == null) {
            throw new IllegalArgumentException(what + " cannot be null (transition: " + transition + ")");
        }
        if (target.putIfAbsent(transition, function) != null) {
            throw new IllegalArgumentException(
                String.format("Duplicate %s for transition: %s", what, transition));
        }
    }
}
