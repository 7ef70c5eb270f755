package com.ryuqq.workflow.testkit.contract;

import com.ryuqq.workflow.core.engine.Workflow;
import com.ryuqq.workflow.core.engine.WorkflowConfig;
import com.ryuqq.workflow.core.engine.WorkflowDefinition;
import com.ryuqq.workflow.core.exception.ForbiddenTransitionException;
import com.ryuqq.workflow.core.exception.InvalidTransitionException;
import com.ryuqq.workflow.core.exception.TransitionAmbiguousException;
import com.ryuqq.workflow.core.model.NextState;
import com.ryuqq.workflow.testkit.subject.InMemorySubject;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * 주문 시나리오 계약 테스트.
 *
 * <p>draft → submitted → completed 흐름, 와일드카드 reject, 잘못된 source, 이벤트 처리를
 * 하나의 Subject로 검증합니다.</p>
 *
 * @author Workflow Team
 * @since 1.0.0
 */
class OrderScenarioContractTest extends AbstractWorkflowContractTest<InMemorySubject> {

    @Override
    protected WorkflowDefinition<InMemorySubject> definition() {
        return OrderDefinitions.builder()
            .auditLogger(auditLogger)
            .eventManager(events.factory())
            .config(new WorkflowConfig().withAuditLogging(true))
            .build();
    }

    @Override
    protected InMemorySubject createSubject(String state) {
        return new InMemorySubject("order-1", state);
    }

    @Override
    protected String reloadState(InMemorySubject subject) {
        return subject.getPersistedState();
    }

    @Test
    void 제출_후_결제_이벤트로_완료된다() {
        // given
        InMemorySubject order = createSubject("draft");
        Workflow<InMemorySubject> workflow = createWorkflow(order);

        // when
        workflow.run("submit");
        Optional<Object> result = workflow.processEvent("order.paid", null);

        // then
        assertThat(result).isEmpty();
        assertStoredState(order, "completed");
        assertThat(order.isDirty()).isFalse();
        assertThat(order.getPersistCount()).isEqualTo(2);
        assertEventNames("submit", "complete");
    }

    @Test
    void 잘못된_출발_상태는_저장도_이벤트도_없다() {
        // given
        InMemorySubject order = createSubject("draft");
        Workflow<InMemorySubject> workflow = createWorkflow(order);

        // when & then
        assertThatThrownBy(() -> workflow.run("complete")).isInstanceOf(InvalidTransitionException.class);
        assertThat(order.getPersistCount()).isZero();
        assertThat(order.getPersistedState()).isNull();
        assertEventNames();
        assertThat(auditLogger.getEntries()).isEmpty();
    }

    @Test
    void 어느_상태에서든_거절할_수_있고_감사로그는_실제_출발_상태를_남긴다() {
        // given
        InMemorySubject order = createSubject("submitted");

        // when
        createWorkflow(order).run("reject", "out of stock");

        // then
        assertStoredState(order, "rejected");
        assertThat(auditLogger.getEntries()).singleElement().satisfies(entry -> {
            assertThat(entry.fromState()).isEqualTo("submitted");
            assertThat(entry.params()).containsExactly("out of stock");
        });
    }

    @Test
    void 완료_상태에서는_reject와_archive_두_전이가_가능하다() {
        // given
        Workflow<InMemorySubject> workflow = createWorkflow(createSubject("completed"));

        // when & then
        assertThat(workflow.getNextAvailableStates())
            .extracting(NextState::state)
            .containsExactly("rejected", "archived");
        assertThatThrownBy(workflow::advance)
            .isInstanceOfSatisfying(TransitionAmbiguousException.class,
                e -> assertThat(e.getCount()).isEqualTo(2));
    }

    @Test
    void 가드가_거부하면_상태가_유지된다() {
        // given
        InMemorySubject order = createSubject("draft");
        Workflow<InMemorySubject> workflow = new Workflow<>(workflowDefinition(), order,
            bindings -> bindings.exitStateCheck(() -> false, "draft"));

        // when & then
        assertThatThrownBy(() -> workflow.run("submit")).isInstanceOf(ForbiddenTransitionException.class);
        assertThat(order.getState()).isEqualTo("draft");
        assertThat(order.getDate("submittedAt")).isEmpty();
    }
}
