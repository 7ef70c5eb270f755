package com.ryuqq.workflow.core.hook;

import com.ryuqq.workflow.core.model.Transition;
import com.ryuqq.workflow.core.model.TransitionTable;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * HookBindings / HookRegistry 유닛 테스트.
 *
 * @author Workflow Team
 * @since 1.0.0
 */
@DisplayName("HookRegistry 테스트")
class HookRegistryTest {

    private final TransitionTable table = new TransitionTable(
        List.of("draft", "submitted", "completed"),
        null,
        List.of(
            Transition.of("submit", "draft", "submitted"),
            Transition.of("complete", "submitted", "completed")
        )
    );

    @Test
    @DisplayName("태그 등록과 관례 등록이 같은 목록에 등록 순서대로 쌓인다")
    void 태그_등록과_관례_등록이_같은_목록에_쌓인다() {
        // given
        List<String> calls = new ArrayList<>();
        StateHook tagged = t -> calls.add("tagged");
        StateHook convention = t -> calls.add("convention");
        HookBindings bindings = new HookBindings()
            .enterStateHook(tagged, "submitted", "completed")
            .onEnter("submitted", convention);

        // when
        HookRegistry registry = HookRegistry.from(bindings, table);

        // then
        assertThat(registry.hooks(HookKind.ENTER_STATE_HOOK, "submitted")).containsExactly(tagged, convention);
        assertThat(registry.hooks(HookKind.ENTER_STATE_HOOK, "completed")).containsExactly(tagged);
        assertThat(registry.hooks(HookKind.EXIT_STATE_HOOK, "submitted")).isEmpty();
    }

    @Test
    @DisplayName("검사 함수는 종류와 상태별로 조회된다")
    void 검사_함수는_종류와_상태별로_조회된다() {
        // given
        StateCheck enter = () -> true;
        StateCheck exit = () -> false;
        HookBindings bindings = new HookBindings()
            .enterStateCheck(enter, "submitted")
            .exitStateCheck(exit, "draft", "submitted");

        // when
        HookRegistry registry = HookRegistry.from(bindings, table);

        // then
        assertThat(registry.checks(HookKind.ENTER_STATE_CHECK, "submitted")).containsExactly(enter);
        assertThat(registry.checks(HookKind.EXIT_STATE_CHECK, "draft")).containsExactly(exit);
        assertThat(registry.checks(HookKind.EXIT_STATE_CHECK, "completed")).isEmpty();
    }

    @Test
    @DisplayName("검사 종류가 아닌 kind로 checks()를 호출하면 예외가 발생한다")
    void 훅_종류로_checks_호출시_예외() {
        HookRegistry registry = HookRegistry.empty();

        assertThatThrownBy(() -> registry.checks(HookKind.ENTER_STATE_HOOK, "draft"))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> registry.hooks(HookKind.EXIT_STATE_CHECK, "draft"))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("전이 단위 함수는 전이 이름으로 조회된다")
    void 전이_단위_함수는_전이_이름으로_조회된다() {
        // given
        TransitionCondition condition = args -> args.length > 0;
        TransitionBody body = args -> "done";
        HookBindings bindings = new HookBindings()
            .check("submit", condition)
            .body("submit", body)
            .after("complete", result -> { });

        // when
        HookRegistry registry = HookRegistry.from(bindings, table);

        // then
        assertThat(registry.condition("submit")).containsSame(condition);
        assertThat(registry.body("submit")).containsSame(body);
        assertThat(registry.before("submit")).isEmpty();
        assertThat(registry.after("complete")).isPresent();
        assertThat(registry.condition("complete")).isEmpty();
    }

    @Test
    @DisplayName("같은 전이에 before 훅을 두 번 등록하면 예외가 발생한다")
    void 전이_단위_중복_등록시_예외() {
        HookBindings bindings = new HookBindings().before("submit", args -> { });

        assertThatThrownBy(() -> bindings.before("submit", args -> { }))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("Duplicate before hook for transition: submit");
    }

    @Test
    @DisplayName("선언되지 않은 상태나 전이를 참조하면 레지스트리 생성이 실패한다")
    void 선언되지_않은_참조는_생성시_실패() {
        HookBindings unknownState = new HookBindings().onExit("archived", t -> { });
        HookBindings unknownTransition = new HookBindings().check("archive", args -> true);

        assertThatThrownBy(() -> HookRegistry.from(unknownState, table))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("undeclared state: archived");
        assertThatThrownBy(() -> HookRegistry.from(unknownTransition, table))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("undeclared transition: archive");
    }

    @Test
    @DisplayName("상태 없이 태그 등록하면 예외가 발생한다")
    void 상태_없는_태그_등록시_예외() {
        assertThatThrownBy(() -> new HookBindings().enterStateCheck(() -> true))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("requires at least one state");
    }

    @Test
    @DisplayName("레지스트리 생성 후 바인딩을 수정해도 영향받지 않는다")
    void 생성_후_바인딩_수정은_반영되지_않는다() {
        // given
        HookBindings bindings = new HookBindings().onEnter("submitted", t -> { });
        HookRegistry registry = HookRegistry.from(bindings, table);

        // when
        bindings.onEnter("submitted", t -> { });

        // then
        assertThat(registry.hooks(HookKind.ENTER_STATE_HOOK, "submitted")).hasSize(1);
    }
}
