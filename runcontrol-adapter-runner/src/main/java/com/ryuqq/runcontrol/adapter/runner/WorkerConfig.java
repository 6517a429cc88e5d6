package com.ryuqq.runcontrol.adapter.runner;

/**
 * WorkItemRunner 설정.
 *
 * <p>워커의 실행 방식을 제어하는 설정값들입니다.</p>
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>concurrency: 동시 실행 작업 수 (1이면 호출 스레드에서 순차 실행)</li>
 *   <li>pauseTimeoutMs: 일시정지 대기 최대 시간 (0이면 무제한)</li>
 *   <li>shutdownTimeoutMs: 종료 시 진행 중 작업 대기 시간</li>
 * </ul>
 *
 * <p><strong>기본값:</strong></p>
 * <ul>
 *   <li>concurrency: 1</li>
 *   <li>pauseTimeoutMs: 0 (재개 또는 취소까지 대기)</li>
 *   <li>shutdownTimeoutMs: 60000 (60초)</li>
 * </ul>
 *
 * <p>pauseTimeoutMs가 경과하면 일시정지 상태여도 작업을 그대로 실행합니다.</p>
 *
 * @param concurrency 동시 실행 작업 수
 * @param pauseTimeoutMs 일시정지 대기 최대 시간 (밀리초, 0이면 무제한)
 * @param shutdownTimeoutMs 종료 대기 시간 (밀리초)
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record WorkerConfig(
    int concurrency,
    long pauseTimeoutMs,
    long shutdownTimeoutMs
) {

    /**
     * 기본 설정으로 생성.
     */
    public WorkerConfig() {
        this(1, 0, 60000);
    }

    /**
     * Compact constructor with validation.
     *
     * @throws IllegalArgumentException 유효하지 않은 설정값인 경우
     */
    public WorkerConfig {
        if (concurrency <= 0) {
            throw new IllegalArgumentException(
                "concurrency must be positive (current: " + concurrency + ")"
            );
        }
        if (pauseTimeoutMs < 0) {
            throw new IllegalArgumentException(
                "pauseTimeoutMs cannot be negative (current: " + pauseTimeoutMs + ")"
            );
        }
        if (shutdownTimeoutMs <= 0) {
            throw new IllegalArgumentException(
                "shutdownTimeoutMs must be positive (current: " + shutdownTimeoutMs + ")"
            );
        }
    }

    /**
     * 순차 실행 여부.
     *
     * @return concurrency가 1이면 true
     */
    public boolean isSequential() {
        return concurrency == 1;
    }

    /**
     * 일시정지 대기 무제한 여부.
     *
     * @return pauseTimeoutMs가 0이면 true
     */
    public boolean isPauseWaitUnbounded() {
        return pauseTimeoutMs == 0;
    }

    public WorkerConfig withConcurrency(int concurrency) {
        return new WorkerConfig(concurrency, pauseTimeoutMs, shutdownTimeoutMs);
    }

    public WorkerConfig withPauseTimeoutMs(long pauseTimeoutMs) {
        return new WorkerConfig(concurrency, pauseTimeoutMs, shutdownTimeoutMs);
    }

    public WorkerConfig withShutdownTimeoutMs(long shutdownTimeoutMs) {
        return new WorkerConfig(concurrency, pauseTimeoutMs, shutdownTimeoutMs);
    }
}
