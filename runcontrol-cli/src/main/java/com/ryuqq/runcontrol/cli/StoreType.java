package com.ryuqq.runcontrol.cli;

/**
 * runctl이 연결할 ControlStore 백엔드 종류.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public enum StoreType {

    /**
     * 같은 호스트, 파일 잠금 기반.
     */
    FILE,

    /**
     * 여러 호스트, Redis 기반.
     */
    REDIS
}
