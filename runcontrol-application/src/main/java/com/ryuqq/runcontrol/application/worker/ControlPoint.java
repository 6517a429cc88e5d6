package com.ryuqq.runcontrol.application.worker;

/**
 * 워커 실행 중 컨트롤 스토어를 확인하는 고정 지점.
 *
 * <p>실행 순서: RUN_START → COLLECTION → (BEFORE_ITEM → 실행 → AFTER_ITEM)* → RUN_END</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public enum ControlPoint {

    /** Run 시작: status=RUNNING 기록. */
    RUN_START,

    /** 작업 목록 수집 직후: 취소 시 전체 건너뜀. */
    COLLECTION,

    /** 각 작업 실행 직전: 취소 시 건너뜀, 일시정지 시 대기. */
    BEFORE_ITEM,

    /** 각 작업 실행 직후: 사후 취소 감지 (정보성). */
    AFTER_ITEM,

    /** Run 종료: status=COMPLETED/FAILED 기록. */
    RUN_END
}
