package com.ryuqq.runcontrol.application.controller;

/**
 * Run 메타데이터 키 상수.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class RunMetadataKeys {

    /** Run 생성 시각 (ISO-8601), 오케스트레이터가 기록. */
    public static final String CREATED_AT = "created_at";

    /** 취소 사유, 오케스트레이터가 기록. */
    public static final String CANCEL_REASON = "cancel_reason";

    /** 워커 호스트명, 워커가 run start 시점에 기록. */
    public static final String WORKER_HOST = "worker_host";

    /** 워커 시작 시각 (ISO-8601). */
    public static final String STARTED_AT = "started_at";

    /** 워커 종료 시각 (ISO-8601). */
    public static final String FINISHED_AT = "finished_at";

    private RunMetadataKeys() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }
}
