package com.ryuqq.workflow.core.spi.noop;

import com.ryuqq.workflow.core.spi.UnitOfWork;

import java.util.function.Supplier;

/**
 * UnitOfWork의 No-Op 구현체.
 *
 * <p>작업을 그대로 실행하며 트랜잭션 경계를 제공하지 않습니다.
 * 저장소 수준 원자성이 필요 없는 환경(테스트, 인메모리 Subject)에서 기본값으로 사용됩니다.</p>
 *
 * @author Workflow Team
 * @since 1.0.0
 */
public final class NoOpUnitOfWork implements UnitOfWork {

    @Override
    public <R> R execute(Supplier<R> work) {
        return work.get();
    }
}
