package com.ryuqq.runcontrol.application.worker;

/**
 * 작업 단위의 최종 결과.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public enum ItemState {

    /** 실행 성공. */
    PASSED,

    /** 실행 중 예외 발생. */
    FAILED,

    /** 취소 요청으로 실행되지 않음. "발견되지 않음"과 구분됩니다. */
    SKIPPED_CANCELLED
}
