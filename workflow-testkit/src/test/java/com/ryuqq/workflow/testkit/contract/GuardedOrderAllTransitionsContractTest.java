package com.ryuqq.workflow.testkit.contract;

import com.ryuqq.workflow.core.engine.Workflow;
import com.ryuqq.workflow.core.engine.WorkflowDefinition;
import com.ryuqq.workflow.core.model.Transition;
import com.ryuqq.workflow.testkit.subject.InMemorySubject;

import java.util.List;

/**
 * 가드가 등록된 Workflow 하위 클래스에 대한 모든 전이 계약 테스트.
 *
 * <ul>
 *   <li>reject는 이미 rejected인 경우 거부되므로 해당 출발 상태를 제외</li>
 *   <li>complete는 영수증 번호 인자를 요구</li>
 * </ul>
 *
 * @author Workflow Team
 * @since 1.0.0
 */
class GuardedOrderAllTransitionsContractTest extends AbstractAllTransitionsContractTest<InMemorySubject> {

    /**
     * 가드가 등록된 주문 Workflow.
     */
    static class GuardedOrderWorkflow extends Workflow<InMemorySubject> {

        GuardedOrderWorkflow(WorkflowDefinition<InMemorySubject> definition, InMemorySubject order) {
            super(definition, order, bindings -> bindings
                .check("reject", args -> !"rejected".equals(order.getState()))
                .check("complete", args -> args.length == 1 && args[0] instanceof String));
        }
    }

    @Override
    protected WorkflowDefinition<InMemorySubject> definition() {
        return OrderDefinitions.builder().build();
    }

    @Override
    protected InMemorySubject createSubject(String state) {
        return new InMemorySubject("guarded-" + state, state);
    }

    @Override
    protected Workflow<InMemorySubject> createWorkflow(InMemorySubject subject) {
        return new GuardedOrderWorkflow(workflowDefinition(), subject);
    }

    @Override
    protected List<String> sourcesFor(Transition transition) {
        if (transition.name().equals("reject")) {
            return List.of("draft", "submitted", "completed", "archived");
        }
        return super.sourcesFor(transition);
    }

    @Override
    protected Object[] argumentsFor(Transition transition) {
        if (transition.name().equals("complete")) {
            return new Object[] {"receipt-1"};
        }
        return super.argumentsFor(transition);
    }
}
