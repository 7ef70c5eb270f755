package com.ryuqq.workflow.core.spi.noop;

import com.ryuqq.workflow.core.spi.AuditLogger;
import com.ryuqq.workflow.core.spi.Subject;

import java.util.List;

/**
 * AuditLogger의 No-Op 구현체.
 *
 * <p>감사 로그 저장소가 설정되지 않은 경우 기본값으로 사용됩니다.</p>
 *
 * @author Workflow Team
 * @since 1.0.0
 */
public final class NoOpAuditLogger implements AuditLogger {

    @Override
    public void log(String transitionName, String fromState, String toState, Subject subject, List<Object> params) {
        // NoOp
    }
}
