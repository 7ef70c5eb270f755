package com.ryuqq.workflow.core.engine;

import com.ryuqq.workflow.core.model.Transition;
import com.ryuqq.workflow.core.model.TransitionTable;
import com.ryuqq.workflow.core.spi.AuditLogger;
import com.ryuqq.workflow.core.spi.EventManagerFactory;
import com.ryuqq.workflow.core.spi.StateAccessor;
import com.ryuqq.workflow.core.spi.Subject;
import com.ryuqq.workflow.core.spi.UnitOfWork;
import com.ryuqq.workflow.core.spi.noop.NoOpAuditLogger;
import com.ryuqq.workflow.core.spi.noop.NoOpUnitOfWork;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Workflow 타입 정의 (불변).
 *
 * <p>상태, 전이 테이블, 상태 접근자, 외부 협력자(UnitOfWork, AuditLogger, EventManager),
 * 외부 이벤트 매핑과 설정을 묶습니다. 한 번 생성되어 같은 타입의 모든 Workflow 인스턴스가 공유합니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * WorkflowDefinition&lt;Order&gt; definition = WorkflowDefinition
 *     .builder("order", StateAccessor.of(Order::getState, Order::setState))
 *     .states("draft", "submitted", "completed", "rejected")
 *     .transition(Transition.named("submit").from("draft").to("submitted").dateField("submittedAt").build())
 *     .transition(Transition.of("complete", "submitted", "completed"))
 *     .transition(Transition.fromAny("reject", "rejected"))
 *     .event("payment.settled", "complete")
 *     .auditLogger(auditLogger)
 *     .config(new WorkflowConfig().withAuditLogging(true))
 *     .build();
 * </pre>
 *
 * @param <T> Subject 타입
 * @author Workflow Team
 * @since 1.0.0
 */
public final class WorkflowDefinition<T extends Subject> {

    private final String name;
    private final TransitionTable table;
    private final StateAccessor<T> stateAccessor;
    private final Map<String, String> events;
    private final AuditLogger auditLogger;
    private final List<EventManagerFactory<T>> eventManagerFactories;
    private final UnitOfWork unitOfWork;
    private final WorkflowConfig config;
    private final Logger logger;

    private WorkflowDefinition(Builder<T> builder) {
        this.name = builder.name;
        this.table = new TransitionTable(builder.states, builder.initialState, builder.transitions);
        this.stateAccessor = builder.stateAccessor;
        this.auditLogger = builder.auditLogger;
        this.eventManagerFactories = List.copyOf(builder.eventManagerFactories);
        this.unitOfWork = builder.unitOfWork;
        this.config = builder.config;
        this.logger = builder.logger != null ? builder.logger : LoggerFactory.getLogger(Workflow.class);

        builder.events.forEach((event, transition) -> {
            if (!table.isTransition(transition)) {
                throw new IllegalArgumentException(String.format(
                    "Event %s is mapped to undeclared transition: %s", event, transition));
            }
        });
        this.events = Collections.unmodifiableMap(new LinkedHashMap<>(builder.events));
    }

    /**
     * Builder 시작.
     *
     * @param name Workflow 타입 이름 (로그/진단용)
     * @param stateAccessor Subject 상태 접근자
     * @param <T> Subject 타입
     * @return Builder
     */
    public static <T extends Subject> Builder<T> builder(String name, StateAccessor<T> stateAccessor) {
        return new Builder<>(name, stateAccessor);
    }

    public String name() {
        return name;
    }

    public TransitionTable table() {
        return table;
    }

    public StateAccessor<T> stateAccessor() {
        return stateAccessor;
    }

    /**
     * 외부 이벤트 이름에 매핑된 전이 이름 조회.
     *
     * @param event 외부 이벤트 이름
     * @return 전이 이름 (매핑되지 않았으면 empty)
     */
    public Optional<String> transitionForEvent(String event) {
        return Optional.ofNullable(events.get(event));
    }

    public Map<String, String> events() {
        return events;
    }

    public AuditLogger auditLogger() {
        return auditLogger;
    }

    public List<EventManagerFactory<T>> eventManagerFactories() {
        return eventManagerFactories;
    }

    public UnitOfWork unitOfWork() {
        return unitOfWork;
    }

    public WorkflowConfig config() {
        return config;
    }

    public Logger logger() {
        return logger;
    }

    @Override
    public String toString() {
        return "WorkflowDefinition{" + name + ", states=" + table.states() + '}';
    }

    /**
     * WorkflowDefinition Builder.
     *
     * @param <T> Subject 타입
     */
    public static final class Builder<T extends Subject> {

        private final String name;
        private final StateAccessor<T> stateAccessor;
        private final List<String> states = new ArrayList<>();
        private String initialState;
        private final List<Transition> transitions = new ArrayList<>();
        private final Map<String, String> events = new LinkedHashMap<>();
        private AuditLogger auditLogger = new NoOpAuditLogger();
        private final List<EventManagerFactory<T>> eventManagerFactories = new ArrayList<>();
        private UnitOfWork unitOfWork = new NoOpUnitOfWork();
        private WorkflowConfig config = new WorkflowConfig();
        private Logger logger;

        private Builder(String name, StateAccessor<T> stateAccessor) {
            if (name == null || name.isBlank()) {
                throw new IllegalArgumentException("name cannot be null or blank");
            }
            if (stateAccessor == null) {
                throw new IllegalArgumentException("stateAccessor cannot be null");
            }
            this.name = name;
            this.stateAccessor = stateAccessor;
        }

        public Builder<T> states(String... states) {
            this.states.addAll(Arrays.asList(states));
            return this;
        }

        /**
         * 초기 상태 지정. 지정하지 않으면 첫 번째 선언 상태입니다.
         *
         * @param initialState 초기 상태
         * @return this
         */
        public Builder<T> initialState(String initialState) {
            this.initialState = initialState;
            return this;
        }

        public Builder<T> transition(Transition transition) {
            this.transitions.add(transition);
            return this;
        }

        public Builder<T> transitions(List<Transition> transitions) {
            this.transitions.addAll(transitions);
            return this;
        }

        /**
         * 외부 이벤트를 전이에 매핑.
         *
         * @param event 외부 이벤트 이름
         * @param transition 실행할 전이 이름
         * @return this
         */
        public Builder<T> event(String event, String transition) {
            if (event == null || transition == null) {
                throw new IllegalArgumentException("event and transition cannot be null");
            }
            this.events.put(event, transition);
            return this;
        }

        public Builder<T> auditLogger(AuditLogger auditLogger) {
            if (auditLogger == null) {
                throw new IllegalArgumentException("auditLogger cannot be null");
            }
            this.auditLogger = auditLogger;
            return this;
        }

        public Builder<T> eventManager(EventManagerFactory<T> factory) {
            if (factory == null) {
                throw new IllegalArgumentException("factory cannot be null");
            }
            this.eventManagerFactories.add(factory);
            return this;
        }

        public Builder<T> unitOfWork(UnitOfWork unitOfWork) {
            if (unitOfWork == null) {
                throw new IllegalArgumentException("unitOfWork cannot be null");
            }
            this.unitOfWork = unitOfWork;
            return this;
        }

        public Builder<T> config(WorkflowConfig config) {
            if (config == null) {
                throw new IllegalArgumentException("config cannot be null");
            }
            this.config = config;
            return this;
        }

        /**
         * Workflow 인스턴스들이 사용할 로거 지정.
         *
         * @param logger SLF4J 로거
         * @return this
         */
        public Builder<T> logger(Logger logger) {
            this.logger = logger;
            return this;
        }

        /**
         * WorkflowDefinition 생성.
         *
         * @return WorkflowDefinition 인스턴스
         * @throws IllegalArgumentException 상태/전이/이벤트 선언이 유효하지 않은 경우
         */
        public WorkflowDefinition<T> build() {
            return new WorkflowDefinition<>(this);
        }
    }
}
