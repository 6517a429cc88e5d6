package com.ryuqq.runcontrol.core.wait;

import java.time.Duration;
import java.util.concurrent.TimeUnit;
import java.util.function.BooleanSupplier;

/**
 * 폴링 기반 대기 프리미티브.
 *
 * <p>조건이 참이 될 때까지 고정 간격으로 재확인하며 호출 스레드만 블로킹합니다.</p>
 *
 * <p><strong>알고리즘:</strong></p>
 * <ol>
 *   <li>조건 확인 → 참이면 즉시 true 반환</li>
 *   <li>timeout이 있고 남은 시간이 0 이하이면 false 반환</li>
 *   <li>min(pollInterval, 남은 시간)만큼 sleep 후 1로 반복</li>
 * </ol>
 *
 * <p><strong>보장:</strong></p>
 * <ul>
 *   <li>false 반환 시 경과 시간 ≥ timeout</li>
 *   <li>timeout = null (무제한 대기)이면 false를 반환하지 않음</li>
 *   <li>timeout = 0 이면 한 번만 확인</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class FlagPoller {

    /**
     * 기본 폴링 간격 (500ms).
     */
    public static final Duration DEFAULT_POLL_INTERVAL = Duration.ofMillis(500);

    private final long pollIntervalNanos;

    /**
     * 기본 폴링 간격(500ms)으로 생성.
     */
    public FlagPoller() {
        this(DEFAULT_POLL_INTERVAL);
    }

    /**
     * 폴링 간격 커스터마이징.
     *
     * @param pollInterval 폴링 간격 (양수)
     * @throws IllegalArgumentException pollInterval이 null이거나 양수가 아닌 경우
     */
    public FlagPoller(Duration pollInterval) {
        if (pollInterval == null || pollInterval.isZero() || pollInterval.isNegative()) {
            throw new IllegalArgumentException("pollInterval must be positive (current: " + pollInterval + ")");
        }
        this.pollIntervalNanos = pollInterval.toNanos();
    }

    /**
     * 조건이 참이 될 때까지 대기.
     *
     * @param condition 확인할 조건 (예외는 그대로 전파)
     * @param timeout 최대 대기 시간 (null이면 무제한)
     * @return 조건 충족 시 true, 타임아웃 시 false
     * @throws IllegalArgumentException condition이 null이거나 timeout이 음수인 경우
     * @throws IllegalStateException 대기 중 인터럽트 발생 시
     */
    public boolean await(BooleanSupplier condition, Duration timeout) {
        if (condition == null) {
            throw new IllegalArgumentException("condition cannot be null");
        }
        if (timeout != null && timeout.isNegative()) {
            throw new IllegalArgumentException("timeout cannot be negative (current: " + timeout + ")");
        }

        long startNanos = System.nanoTime();
        Long timeoutNanos = timeout == null ? null : timeout.toNanos();

        while (true) {
            if (condition.getAsBoolean()) {
                return true;
            }

            long sleepNanos = pollIntervalNanos;
            if (timeoutNanos != null) {
                long remaining = timeoutNanos - (System.nanoTime() - startNanos);
                if (remaining <= 0) {
                    return false;
                }
                sleepNanos = Math.min(sleepNanos, remaining);
            }

            sleep(sleepNanos);
        }
    }

    /**
     * 폴링 간격 조회.
     *
     * @return 폴링 간격
     */
    public Duration getPollInterval() {
        return Duration.ofNanos(pollIntervalNanos);
    }

    private void sleep(long nanos) {
        try {
            TimeUnit.NANOSECONDS.sleep(nanos);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Polling interrupted", e);
        }
    }
}
