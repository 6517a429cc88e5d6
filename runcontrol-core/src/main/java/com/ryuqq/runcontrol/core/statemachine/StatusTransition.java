package com.ryuqq.runcontrol.core.statemachine;

/**
 * Run 상태 전이 검증 및 실행.
 *
 * <p><strong>허용되는 전이:</strong></p>
 * <ul>
 *   <li>PENDING → RUNNING</li>
 *   <li>RUNNING → COMPLETED</li>
 *   <li>RUNNING → FAILED</li>
 *   <li>동일 상태 재기록 (멱등, 종료 상태 포함)</li>
 * </ul>
 *
 * <p><strong>불변식:</strong></p>
 * <ul>
 *   <li>종료 상태(COMPLETED, FAILED)에서는 다른 상태로 전이 불가</li>
 *   <li>역방향 전이 불가 (예: RUNNING → PENDING)</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class StatusTransition {

    // Utility class - prevent instantiation
    private StatusTransition() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 상태 전이가 유효한지 검증.
     *
     * <p>{@code from}이 null이면 아직 상태가 기록되지 않은 Run이며,
     * 어떤 초기 상태든 허용합니다. 오케스트레이터 없이 시작된 워커가
     * 곧바로 RUNNING을 기록하는 경우입니다.</p>
     *
     * @param from 현재 상태 (null 가능 - 미기록)
     * @param to 전이할 상태
     * @throws IllegalArgumentException to가 null인 경우
     * @throws IllegalStateException 유효하지 않은 전이인 경우
     */
    public static void validate(RunStatus from, RunStatus to) {
        if (to == null) {
            throw new IllegalArgumentException("Target status cannot be null (from: " + from + ")");
        }
        if (from == null || from == to) {
            return;
        }

        if (from.isTerminal()) {
            throw new IllegalStateException(
                String.format("Cannot transition from terminal status: %s → %s", from, to)
            );
        }

        boolean valid = switch (from) {
            case PENDING -> to == RunStatus.RUNNING;
            case RUNNING -> to == RunStatus.COMPLETED || to == RunStatus.FAILED;
            case COMPLETED, FAILED -> false;
        };

        if (!valid) {
            throw new IllegalStateException(
                String.format("Invalid status transition: %s → %s", from, to)
            );
        }
    }
}
