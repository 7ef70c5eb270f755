package com.ryuqq.workflow.core.exception;

/**
 * 자동 진행(advance) 시 가능한 전이가 둘 이상일 때 발생.
 *
 * @author Workflow Team
 * @since 1.0.0
 */
public class TransitionAmbiguousException extends WorkflowException {

    public static final String ERROR_CODE = "TRANSITION_AMBIGUOUS";

    private final int count;

    public TransitionAmbiguousException(String currentState, int count) {
        super(ERROR_CODE,
            String.format("Multiple possible transitions (got %d choices, expected 1)", count),
            null, currentState, null);
        this.count = count;
    }

    /**
     * @return 후보 전이 개수
     */
    public int getCount() {
        return count;
    }
}
