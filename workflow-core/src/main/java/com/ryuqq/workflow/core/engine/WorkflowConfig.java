package com.ryuqq.workflow.core.engine;

import java.time.Clock;

/**
 * Workflow 설정 (불변 record).
 *
 * <p>이 record는 Workflow 타입의 부가 동작을 제어하는 설정값을 담고 있습니다.</p>
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>auditLogging: 전이 완료 시 AuditLogger 호출 여부 (기본 false)</li>
 *   <li>clock: dateField 기록에 사용할 시계 (기본 UTC 시스템 시계)</li>
 * </ul>
 *
 * @author Workflow Team
 * @since 1.0.0
 * @param auditLogging 감사 로그 활성화 여부
 * @param clock 전이 시각 기록용 시계
 */
public record WorkflowConfig(boolean auditLogging, Clock clock) {

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: auditLogging=false, clock=Clock.systemUTC()</p>
     */
    public WorkflowConfig() {
        this(false, Clock.systemUTC());
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException clock이 null인 경우
     */
    public WorkflowConfig {
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
    }

    /**
     * auditLogging만 변경한 새 인스턴스 생성.
     *
     * @param auditLogging 감사 로그 활성화 여부
     * @return 새 WorkflowConfig 인스턴스
     */
    public WorkflowConfig withAuditLogging(boolean auditLogging) {
        return new WorkflowConfig(auditLogging, this.clock);
    }

    /**
     * clock만 변경한 새 인스턴스 생성.
     *
     * @param clock 새로운 시계
     * @return 새 WorkflowConfig 인스턴스
     */
    public WorkflowConfig withClock(Clock clock) {
        return new WorkflowConfig(this.auditLogging, clock);
    }
}
