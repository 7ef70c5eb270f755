package com.ryuqq.workflow.core.exception;

import java.util.List;

/**
 * 애플리케이션 수준 검증 실패.
 *
 * <p>엔진 자체는 이 예외를 발생시키지 않습니다. 훅이나 전이 본문에서
 * 호스트 애플리케이션이 여러 검증 오류를 한 번에 보고할 때 사용합니다.</p>
 *
 * <p><strong>예시:</strong></p>
 * <pre>
 * bindings.before("submit", args -&gt; {
 *     List&lt;String&gt; errors = validator.validate(order);
 *     if (!errors.isEmpty()) {
 *         throw new WorkflowValidationException(errors);
 *     }
 * });
 * </pre>
 *
 * @author Workflow Team
 * @since 1.0.0
 */
public class WorkflowValidationException extends WorkflowException {

    public static final String ERROR_CODE = "WORKFLOW_VALIDATION_FAILED";

    private final List<String> errors;

    public WorkflowValidationException(List<String> errors) {
        super(ERROR_CODE, "Workflow validation failed", null, null, null);
        this.errors = errors == null ? List.of() : List.copyOf(errors);
    }

    public WorkflowValidationException() {
        this(null);
    }

    /**
     * @return 하위 오류 목록 (없으면 빈 목록)
     */
    public List<String> getErrors() {
        return errors;
    }
}
