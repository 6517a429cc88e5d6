package com.ryuqq.runcontrol.application.worker;

/**
 * 컨트롤 포인트의 진행 여부 결정.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public enum ItemDecision {

    /** 실행 진행. */
    PROCEED,

    /** 취소 요청으로 실행하지 않음. 리포트에는 남김. */
    SKIP_CANCELLED;

    /**
     * 건너뛰어야 하는지 확인.
     *
     * @return SKIP_CANCELLED인 경우 true
     */
    public boolean isSkip() {
        return this == SKIP_CANCELLED;
    }
}
