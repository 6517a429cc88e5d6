package com.ryuqq.runcontrol.core.context;

/**
 * 닫을 때 이전 상관관계 ID를 복원하는 스코프.
 *
 * <p>try-with-resources 용도이며 checked 예외를 던지지 않습니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 * @see CorrelationContext#open(com.ryuqq.runcontrol.core.model.CorrelationId)
 */
@FunctionalInterface
public interface CorrelationScope extends AutoCloseable {

    /**
     * 이전 값 복원.
     */
    @Override
    void close();
}
