package com.ryuqq.workflow.core.engine;

import com.ryuqq.workflow.core.exception.InvalidTransitionException;
import com.ryuqq.workflow.core.guard.GuardEvaluator;
import com.ryuqq.workflow.core.hook.HookKind;
import com.ryuqq.workflow.core.hook.HookRegistry;
import com.ryuqq.workflow.core.hook.StateHook;
import com.ryuqq.workflow.core.model.Transition;
import com.ryuqq.workflow.core.model.TransitionRecord;
import com.ryuqq.workflow.core.spi.EventManager;
import com.ryuqq.workflow.core.spi.StateAccessor;
import com.ryuqq.workflow.core.spi.Subject;
import org.slf4j.Logger;

import java.time.Instant;
import java.util.List;

/**
 * 단일 전이 실행기.
 *
 * <p>Subject의 상태를 변경하는 유일한 컴포넌트입니다. 한 번의 전이 호출은
 * 아래 단계를 되돌아감 없이 순서대로 수행하며, 전체 실행은 {@code UnitOfWork} 안에서 이루어집니다.</p>
 *
 * <p><strong>실행 단계:</strong></p>
 * <pre>
 *  1. source 검사          → InvalidTransitionException
 *  2. 가드 평가            → ForbiddenTransitionException
 *  3. before 훅 (호출 인자)
 *  4. 현재 상태 이탈 훅
 *  5. 전이 본문 (결과 반환)
 *  6. 상태 변경            ← 유일한 변경 지점
 *  7. 도착 상태 진입 훅
 *  8. after 훅 (본문 결과)
 *  9. dateField 기록 + persist()
 * 10. 감사 로그 (활성화된 경우)
 * 11. 이벤트 발행
 * </pre>
 *
 * <p><strong>실패 시 동작:</strong></p>
 * <ul>
 *   <li>1~5단계 예외: 상태는 변경되지 않음</li>
 *   <li>7~11단계 예외: 메모리 상 상태는 이미 destination. 엔진은 복구하지 않으며
 *       저장소 수준 복구는 호출자의 UnitOfWork 책임</li>
 * </ul>
 *
 * @param <T> Subject 타입
 * @author Workflow Team
 * @since 1.0.0
 */
public final class TransitionExecutor<T extends Subject> {

    private final WorkflowDefinition<T> definition;
    private final T subject;
    private final HookRegistry registry;
    private final GuardEvaluator guards;
    private final List<EventManager> eventManagers;
    private final Logger log;

    /**
     * 생성자.
     *
     * @param definition Workflow 정의
     * @param subject 대상 Subject
     * @param registry 훅 레지스트리
     * @param guards 가드 평가기
     * @param eventManagers 이 인스턴스의 이벤트 매니저
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public TransitionExecutor(WorkflowDefinition<T> definition, T subject, HookRegistry registry,
                              GuardEvaluator guards, List<EventManager> eventManagers) {
        if (definition == null) {
            throw new IllegalArgumentException("definition cannot be null");
        }
        if (subject == null) {
            throw new IllegalArgumentException("subject cannot be null");
        }
        if (registry == null || guards == null) {
            throw new IllegalArgumentException("registry and guards cannot be null");
        }
        this.definition = definition;
        this.subject = subject;
        this.registry = registry;
        this.guards = guards;
        this.eventManagers = eventManagers == null ? List.of() : List.copyOf(eventManagers);
        this.log = definition.logger();
    }

    /**
     * 전이 실행.
     *
     * @param transition 실행할 전이
     * @param args 호출 인자
     * @return 전이 본문 결과 (본문이 없으면 null)
     * @throws InvalidTransitionException 현재 상태가 source와 맞지 않는 경우
     * @throws com.ryuqq.workflow.core.exception.ForbiddenTransitionException 가드가 거부한 경우
     */
    public Object execute(Transition transition, Object... args) {
        Object[] callArgs = args == null ? new Object[0] : args;
        return definition.unitOfWork().execute(() -> run(transition, callArgs));
    }

    /**
     * 메모리 상 상태만 이전 값으로 되돌림 (best-effort).
     *
     * <p>이미 실행된 훅의 부수 효과는 되돌리지 않습니다. 보상 처리는 호출자의 책임입니다.</p>
     *
     * @param previousState 되돌릴 상태
     * @param targetState 실패한 전이의 목표 상태
     * @param error 실패 원인 (null 가능)
     */
    public void rollback(String previousState, String targetState, Throwable error) {
        log.warn("Rolling back {} {}: {} → {}", definition.name(), accessor().fieldName(),
            targetState, previousState, error);
        accessor().write(subject, previousState);
    }

    /**
     * 현재 상태 조회.
     *
     * @return Subject의 현재 상태
     */
    public String currentState() {
        return accessor().read(subject);
    }

    private Object run(Transition transition, Object[] args) {
        String source = currentState();

        // 1. source 검사
        if (!transition.matchesSource(source)) {
            throw new InvalidTransitionException(transition.name(), source, transition.destination());
        }

        // 2. 가드 평가 (이 단계 전에는 부수 효과 있는 훅을 실행하지 않음)
        guards.checkTransition(transition, source, args);

        // 3~5. before → 이탈 → 본문
        beforeTransition(transition, args);
        onExitState(transition, source);
        Object result = registry.body(transition.name())
            .map(body -> body.apply(args))
            .orElse(null);

        // 6. 상태 변경
        updateState(transition.destination());

        // 7~8. 진입 → after
        onEnterState(transition);
        afterTransition(transition, result);

        // 9. 저장
        finalizeTransition(transition);

        // 10~11. 선언된 source가 아닌 실제 출발 상태로 기록
        TransitionRecord record = TransitionRecord.of(transition, source, args);
        auditLog(record);
        createEvents(record);

        log.info("{} transition {} completed: {} → {}", definition.name(), transition.name(),
            source, transition.destination());
        return result;
    }

    private void beforeTransition(Transition transition, Object[] args) {
        registry.before(transition.name()).ifPresent(hook -> {
            log.debug("Before transition {}", transition.name());
            hook.accept(args);
        });
    }

    private void onExitState(Transition transition, String state) {
        log.debug("Leaving {} {}", accessor().fieldName(), state);
        for (StateHook hook : registry.hooks(HookKind.EXIT_STATE_HOOK, state)) {
            hook.accept(transition);
        }
    }

    private void updateState(String state) {
        log.debug("Updating {} {} to {}", definition.name(), accessor().fieldName(), state);
        accessor().write(subject, state);
    }

    private void onEnterState(Transition transition) {
        log.debug("Entering {} {}", accessor().fieldName(), transition.destination());
        for (StateHook hook : registry.hooks(HookKind.ENTER_STATE_HOOK, transition.destination())) {
            hook.accept(transition);
        }
    }

    private void afterTransition(Transition transition, Object result) {
        registry.after(transition.name()).ifPresent(hook -> {
            log.debug("After transition {}", transition.name());
            hook.accept(result);
        });
    }

    private void finalizeTransition(Transition transition) {
        transition.dateFieldOptional().ifPresent(field ->
            subject.stampDate(field, Instant.now(definition.config().clock())));
        log.debug("Saving subject");
        subject.persist();
    }

    private void auditLog(TransitionRecord record) {
        if (!definition.config().auditLogging()) {
            return;
        }
        definition.auditLogger().log(record.name(), record.fromState(), record.toState(), subject, record.params());
    }

    private void createEvents(TransitionRecord record) {
        for (EventManager manager : eventManagers) {
            manager.pushEvent(record);
        }
    }

    private StateAccessor<T> accessor() {
        return definition.stateAccessor();
    }
}
