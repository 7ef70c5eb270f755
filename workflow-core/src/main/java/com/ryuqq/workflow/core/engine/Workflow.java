package com.ryuqq.workflow.core.engine;

import com.ryuqq.workflow.core.exception.CircularWorkflowException;
import com.ryuqq.workflow.core.exception.TransitionAmbiguousException;
import com.ryuqq.workflow.core.exception.TransitionDoesNotExistException;
import com.ryuqq.workflow.core.exception.TransitionNotFoundException;
import com.ryuqq.workflow.core.exception.TransitionUnavailableException;
import com.ryuqq.workflow.core.guard.GuardEvaluator;
import com.ryuqq.workflow.core.hook.HookBindings;
import com.ryuqq.workflow.core.hook.HookRegistry;
import com.ryuqq.workflow.core.model.NextState;
import com.ryuqq.workflow.core.model.Transition;
import com.ryuqq.workflow.core.spi.EventManager;
import com.ryuqq.workflow.core.spi.EventManagerFactory;
import com.ryuqq.workflow.core.spi.Subject;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Consumer;
import java.util.stream.Collectors;

/**
 * 하나의 Subject에 바인딩된 Workflow 인스턴스.
 *
 * <p>Subject와 1:1로 묶이며, 생성 시 훅 레지스트리와 전이 dispatch 테이블을 한 번 만든 뒤
 * 호출 간에 다른 상태를 갖지 않습니다. 상태 변경은 {@link TransitionExecutor}에 위임합니다.</p>
 *
 * <p><strong>훅 등록:</strong></p>
 * <ul>
 *   <li>하위 클래스: {@link #registerHooks(HookBindings)} 재정의</li>
 *   <li>조합: 생성자에 {@code Consumer<HookBindings>} 전달</li>
 * </ul>
 * <p>{@code registerHooks}는 생성자에서 호출되므로 하위 클래스 필드 대신
 * {@link #subject()}만 참조해야 합니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * class OrderWorkflow extends Workflow&lt;Order&gt; {
 *     OrderWorkflow(Order order) {
 *         super(OrderWorkflows.DEFINITION, order);
 *     }
 *
 *     {@literal @}Override
 *     protected void registerHooks(HookBindings bindings) {
 *         bindings.check("submit", args -&gt; subject().isComplete())
 *                 .onEnter("submitted", t -&gt; subject().notifyReviewers());
 *     }
 * }
 *
 * OrderWorkflow workflow = new OrderWorkflow(order);
 * workflow.run("submit");
 * workflow.getNextAvailableStates();   // [completed, rejected]
 * workflow.advance();                  // TransitionAmbiguousException
 * </pre>
 *
 * <p><strong>동시성:</strong> 하나의 Subject는 한 번에 하나의 호출만 사용해야 합니다.
 * 엔진은 상호 배제를 제공하지 않습니다.</p>
 *
 * @param <T> Subject 타입
 * @author Workflow Team
 * @since 1.0.0
 */
public class Workflow<T extends Subject> {

    private final WorkflowDefinition<T> definition;
    private final T subject;
    private final GuardEvaluator guards;
    private final TransitionExecutor<T> executor;
    private final Map<String, TransitionInvoker> dispatch;

    /**
     * 하위 클래스용 생성자. {@link #registerHooks(HookBindings)}로 훅을 등록합니다.
     *
     * @param definition Workflow 정의
     * @param subject 대상 Subject
     * @throws IllegalArgumentException 인자가 null이거나 훅 등록이 유효하지 않은 경우
     */
    public Workflow(WorkflowDefinition<T> definition, T subject) {
        this(definition, subject, null);
    }

    /**
     * 생성자.
     *
     * @param definition Workflow 정의
     * @param subject 대상 Subject
     * @param registrar 추가 훅 등록 함수 (null 가능)
     * @throws IllegalArgumentException 인자가 null이거나 훅 등록이 유효하지 않은 경우
     */
    public Workflow(WorkflowDefinition<T> definition, T subject, Consumer<HookBindings> registrar) {
        if (definition == null) {
            throw new IllegalArgumentException("definition cannot be null");
        }
        if (subject == null) {
            throw new IllegalArgumentException("subject cannot be null");
        }
        this.definition = definition;
        this.subject = subject;

        HookBindings bindings = new HookBindings();
        registerHooks(bindings);
        if (registrar != null) {
            registrar.accept(bindings);
        }
        HookRegistry registry = HookRegistry.from(bindings, definition.table());

        List<EventManager> eventManagers = new ArrayList<>();
        for (EventManagerFactory<T> factory : definition.eventManagerFactories()) {
            eventManagers.add(factory.create(subject));
        }

        this.guards = new GuardEvaluator(registry);
        this.executor = new TransitionExecutor<>(definition, subject, registry, guards, eventManagers);

        Map<String, TransitionInvoker> invokers = new LinkedHashMap<>();
        for (Transition transition : definition.table().all()) {
            invokers.put(transition.name(), args -> executor.execute(transition, args));
        }
        this.dispatch = Collections.unmodifiableMap(invokers);
    }

    /**
     * 훅 등록 확장 지점. 기본 구현은 아무것도 등록하지 않습니다.
     *
     * @param bindings 등록 테이블
     */
    protected void registerHooks(HookBindings bindings) {
        // 하위 클래스에서 재정의
    }

    public T subject() {
        return subject;
    }

    public WorkflowDefinition<T> definition() {
        return definition;
    }

    /**
     * 현재 상태.
     *
     * @return Subject의 현재 상태
     */
    public String state() {
        return executor.currentState();
    }

    /**
     * 초기 상태.
     *
     * <p>새 Subject를 생성하는 쪽에서 상태 필드의 기본값으로 사용합니다.</p>
     *
     * @return 명시된 초기 상태 또는 첫 번째 선언 상태
     */
    public String initialState() {
        return definition.table().initialState();
    }

    public boolean isTransition(String name) {
        return definition.table().isTransition(name);
    }

    public List<Transition> getAllTransitions() {
        return definition.table().all();
    }

    /**
     * 전이 이름으로 바인딩된 실행 함수 조회.
     *
     * @param name 전이 이름
     * @return 실행 함수 (같은 이름에 대해 항상 동일 객체)
     * @throws TransitionDoesNotExistException 선언되지 않은 전이인 경우
     */
    public TransitionInvoker transition(String name) {
        TransitionInvoker invoker = dispatch.get(name);
        if (invoker == null) {
            throw new TransitionDoesNotExistException(name);
        }
        return invoker;
    }

    /**
     * 전이 이름으로 실행.
     *
     * @param name 전이 이름
     * @param args 호출 인자
     * @return 전이 본문 결과 (본문이 없으면 null)
     * @throws TransitionDoesNotExistException 선언되지 않은 전이인 경우
     */
    public Object run(String name, Object... args) {
        return transition(name).invoke(args);
    }

    /**
     * 현재 상태에서 전이 가드 평가 (거부 시 예외 발생).
     *
     * @param name 전이 이름
     * @param args 호출 인자
     * @return 허용되면 true
     * @throws TransitionDoesNotExistException 선언되지 않은 전이인 경우
     * @throws com.ryuqq.workflow.core.exception.ForbiddenTransitionException 가드가 거부한 경우
     */
    public boolean checkTransition(String name, Object... args) {
        return guards.checkTransition(require(name), state(), args);
    }

    /**
     * 현재 상태에서 전이 가드 평가 (비발생 모드).
     *
     * @param name 전이 이름
     * @param args 호출 인자
     * @return 허용되면 true
     * @throws TransitionDoesNotExistException 선언되지 않은 전이인 경우
     */
    public boolean isTransitionAllowed(String name, Object... args) {
        return guards.isAllowed(require(name), state(), args);
    }

    // ========== 조회 API ==========

    public List<Transition> getAvailableTransitions() {
        return getAvailableTransitions(null, true);
    }

    public List<Transition> getAvailableTransitions(boolean includeUnchecked) {
        return getAvailableTransitions(null, includeUnchecked);
    }

    /**
     * 주어진 상태에서 시작할 수 있는 전이 목록 (가드 미평가).
     *
     * @param state 출발 상태 (null이면 현재 상태)
     * @return 선언 순서의 전이 목록
     */
    public List<Transition> getAvailableTransitions(String state) {
        return getAvailableTransitions(state, true);
    }

    /**
     * 주어진 상태에서 시작할 수 있는 전이 목록.
     *
     * <p>{@code includeUnchecked}가 false이면 가드를 비발생 모드로 평가하여 통과한 전이만 남깁니다.
     * 주어진 상태는 source 매칭에만 사용되며, 이탈 검사는 항상 Subject의 현재 상태 기준입니다.</p>
     *
     * @param state 출발 상태 (null이면 현재 상태)
     * @param includeUnchecked 가드 평가 생략 여부
     * @return 선언 순서의 전이 목록
     */
    public List<Transition> getAvailableTransitions(String state, boolean includeUnchecked) {
        String current = state();
        String from = state != null ? state : current;
        List<Transition> available = new ArrayList<>();
        for (Transition transition : definition.table().all()) {
            if (transition.matchesSource(from)
                && (includeUnchecked || guards.isAllowed(transition, current))) {
                available.add(transition);
            }
        }
        return available;
    }

    public Optional<Transition> getAvailableTransition(String name) {
        return getAvailableTransition(name, null);
    }

    /**
     * 가드를 통과하는 전이를 이름으로 조회.
     *
     * @param name 전이 이름
     * @param state 출발 상태 (null이면 현재 상태)
     * @return 전이 (불가능하면 empty)
     */
    public Optional<Transition> getAvailableTransition(String name, String state) {
        return getAvailableTransitions(state, false).stream()
            .filter(transition -> transition.name().equals(name))
            .findFirst();
    }

    public List<NextState> getNextAvailableStates() {
        return getNextAvailableStates(null, true);
    }

    public List<NextState> getNextAvailableStates(boolean includeUnchecked) {
        return getNextAvailableStates(null, includeUnchecked);
    }

    /**
     * 주어진 상태에서 도달 가능한 다음 상태 목록 (가드 미평가).
     *
     * @param state 출발 상태 (null이면 현재 상태)
     * @return 전이 선언 순서의 다음 상태 목록
     */
    public List<NextState> getNextAvailableStates(String state) {
        return getNextAvailableStates(state, true);
    }

    /**
     * 주어진 상태에서 도달 가능한 다음 상태 목록.
     *
     * @param state 출발 상태 (null이면 현재 상태)
     * @param includeUnchecked 가드 평가 생략 여부
     * @return 전이 선언 순서의 다음 상태 목록
     */
    public List<NextState> getNextAvailableStates(String state, boolean includeUnchecked) {
        return getAvailableTransitions(state, includeUnchecked).stream()
            .map(NextState::of)
            .collect(Collectors.toList());
    }

    /**
     * 현재 상태에서 목표 상태로 가는 전이의 실행 함수 조회.
     *
     * <p>후보가 여러 개이면 선언 순서상 첫 번째를 반환합니다. 가드는 평가하지 않습니다.</p>
     *
     * @param targetState 목표 상태
     * @return 실행 함수
     * @throws TransitionNotFoundException 목표 상태로 가는 전이가 없는 경우
     */
    public TransitionInvoker getTransitionTo(String targetState) {
        String current = state();
        return getAvailableTransitions(current, true).stream()
            .filter(transition -> transition.destination().equals(targetState))
            .findFirst()
            .map(transition -> dispatch.get(transition.name()))
            .orElseThrow(() -> new TransitionNotFoundException(current, targetState));
    }

    /**
     * 유일하게 가능한 전이를 실행 (자동 진행).
     *
     * @return 전이 본문 결과
     * @throws TransitionUnavailableException 가능한 전이가 없는 경우
     * @throws TransitionAmbiguousException 가능한 전이가 둘 이상인 경우
     */
    public Object advance() {
        return dispatch.get(nextTransition().name()).invoke();
    }

    /**
     * 더 이상 가능한 전이가 없을 때까지 자동 진행을 반복.
     *
     * <p>이미 지나온 상태로 되돌아가는 전이는 실행하기 전에 거부됩니다.</p>
     *
     * @return 최종 상태
     * @throws TransitionAmbiguousException 진행 중 가능한 전이가 둘 이상인 경우
     * @throws CircularWorkflowException 이미 지나온 상태로 되돌아가려는 경우
     */
    public String advanceToEnd() {
        Set<String> visited = new HashSet<>();
        visited.add(state());
        while (!getAvailableTransitions(false).isEmpty()) {
            String current = state();
            Transition next = nextTransition();
            if (visited.contains(next.destination())) {
                throw new CircularWorkflowException(next.name(), current, next.destination());
            }
            dispatch.get(next.name()).invoke();
            visited.add(next.destination());
        }
        return state();
    }

    /**
     * 외부 이벤트를 매핑된 전이로 전달.
     *
     * @param event 외부 이벤트 이름
     * @param data 이벤트 데이터 (전이 인자로 전달)
     * @return 전이 본문 결과 (매핑되지 않은 이벤트이거나 결과가 null이면 empty)
     */
    public Optional<Object> processEvent(String event, Object data) {
        Optional<String> transition = definition.transitionForEvent(event);
        if (transition.isEmpty()) {
            definition.logger().debug("Ignoring unmapped event {} on {}", event, definition.name());
            return Optional.empty();
        }
        return Optional.ofNullable(run(transition.get(), data));
    }

    /**
     * 메모리 상 상태만 이전 값으로 되돌림 (best-effort).
     *
     * @param previousState 되돌릴 상태
     * @param targetState 실패한 전이의 목표 상태
     * @param error 실패 원인 (null 가능)
     * @see TransitionExecutor#rollback(String, String, Throwable)
     */
    public void rollback(String previousState, String targetState, Throwable error) {
        executor.rollback(previousState, targetState, error);
    }

    private Transition nextTransition() {
        String current = state();
        List<Transition> candidates = getAvailableTransitions(current, false);
        if (candidates.isEmpty()) {
            throw new TransitionUnavailableException(current);
        }
        if (candidates.size() > 1) {
            throw new TransitionAmbiguousException(current, candidates.size());
        }
        return candidates.get(0);
    }

    private Transition require(String name) {
        return definition.table().transitionByName(name)
            .orElseThrow(() -> new TransitionDoesNotExistException(name));
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "{" + definition.name() + ", state=" + state() + '}';
    }
}
