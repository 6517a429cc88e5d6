package com.ryuqq.runcontrol.core.statemachine;

/**
 * Run의 생명주기 상태.
 *
 * <p><strong>상태 전이 규칙:</strong></p>
 * <ul>
 *   <li>PENDING → RUNNING (워커 run-start 제어 지점)</li>
 *   <li>RUNNING → COMPLETED (run-end, 전체 결과 성공)</li>
 *   <li>RUNNING → FAILED (run-end, 전체 결과 실패)</li>
 *   <li><strong>역방향 전이 불가 (불변식)</strong></li>
 * </ul>
 *
 * <p>일시정지와 취소는 상태가 아니라 RUNNING 위에 겹쳐지는 플래그입니다.
 * 요청은 비동기로 도착하고 제어 지점에서 <em>관찰</em>될 뿐 <em>진입</em>되지 않습니다.</p>
 *
 * <pre>
 * PENDING
 *    │
 *    ▼ (run start)
 * RUNNING  ◄── paused / cancelled 플래그
 *    │
 *    ├─► COMPLETED
 *    │
 *    └─► FAILED
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public enum RunStatus {

    /**
     * 생성됨 (워커 미시작).
     */
    PENDING,

    /**
     * 실행 중.
     */
    RUNNING,

    /**
     * 완료 (성공).
     */
    COMPLETED,

    /**
     * 실패.
     */
    FAILED;

    /**
     * 종료 상태인지 확인.
     *
     * @return COMPLETED 또는 FAILED인 경우 true
     */
    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }
}
