package com.ryuqq.workflow.core.engine;

/**
 * 특정 Workflow 인스턴스의 특정 전이에 바인딩된 실행 함수.
 *
 * <p>전이 테이블이 로드될 때 전이 이름별로 한 번 생성되어 dispatch 테이블에 보관됩니다.
 * 같은 인스턴스, 같은 전이에 대해서는 항상 동일한 객체가 반환됩니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * TransitionInvoker submit = workflow.transition("submit");
 * Object result = submit.invoke(reviewer);
 * </pre>
 *
 * @author Workflow Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface TransitionInvoker {

    /**
     * 전이 실행.
     *
     * @param args 전이 호출 인자 (조건, before 훅, 본문에 전달됨)
     * @return 전이 본문 결과 (본문이 없으면 null)
     */
    Object invoke(Object... args);
}
