package com.ryuqq.workflow.core.engine;

import com.ryuqq.workflow.core.hook.HookBindings;
import com.ryuqq.workflow.core.model.Transition;
import com.ryuqq.workflow.core.spi.StateAccessor;

/**
 * 테스트용 Workflow.
 *
 * <pre>
 * draft ──submit──► submitted ──complete──► completed
 *   *  ──reject──► rejected
 * </pre>
 */
class OrderWorkflow extends Workflow<Order> {

    static final String RECEIPT = "receipt-1";

    static final WorkflowDefinition<Order> DEFINITION = definitionBuilder().build();

    OrderWorkflow(Order order) {
        super(DEFINITION, order);
    }

    OrderWorkflow(WorkflowDefinition<Order> definition, Order order) {
        super(definition, order);
    }

    static WorkflowDefinition.Builder<Order> definitionBuilder() {
        return WorkflowDefinition.builder("order", StateAccessor.of(Order::getState, Order::setState))
            .states("draft", "submitted", "completed", "rejected")
            .transition(Transition.named("submit").from("draft").to("submitted").dateField("submittedAt").build())
            .transition(Transition.named("complete").from("submitted").to("completed").label("Complete").build())
            .transition(Transition.fromAny("reject", "rejected"))
            .event("order.paid", "complete");
    }

    @Override
    protected void registerHooks(HookBindings bindings) {
        bindings
            .check("submit", args -> record("check:submit") && subject().allowSubmit)
            .before("submit", args -> record("before:submit"))
            .body("submit", args -> {
                record("body:submit");
                return RECEIPT;
            })
            .after("submit", result -> record("after:submit:" + result))
            .onExit("draft", transition -> record("exit:draft@" + subject().getState()))
            .onEnter("submitted", transition -> record("enter:submitted@" + subject().getState()))
            .exitStateCheck(() -> subject().allowLeavingDraft, "draft")
            .enterStateCheck(() -> subject().allowEnteringSubmitted, "submitted")
            .enterStateCheck(() -> true, "submitted")
            .check("reject", args -> !"rejected".equals(subject().getState()));
    }

    private boolean record(String call) {
        subject().calls.add(call);
        return true;
    }
}
