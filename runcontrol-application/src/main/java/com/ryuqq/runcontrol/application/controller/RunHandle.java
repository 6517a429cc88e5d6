package com.ryuqq.runcontrol.application.controller;

import com.ryuqq.runcontrol.core.model.RunId;
import com.ryuqq.runcontrol.core.statemachine.RunStatus;

import java.time.Instant;

/**
 * Run 상태 스냅샷.
 *
 * <p>조회 시점의 status, 플래그, 주요 메타데이터를 담는 불변 객체입니다.
 * 스토어는 계속 변하므로 스냅샷은 조회 직후부터 오래된 값일 수 있습니다.</p>
 *
 * <p><strong>Null 규칙:</strong> {@code ...OrNull} 접미사 getter만 null을 반환합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class RunHandle {

    private final RunId runId;
    private final RunStatus statusOrNull;
    private final boolean cancelled;
    private final boolean paused;
    private final Instant createdAtOrNull;
    private final String cancelReasonOrNull;
    private final String workerHostOrNull;

    private RunHandle(Builder builder) {
        if (builder.runId == null) {
            throw new IllegalArgumentException("runId cannot be null");
        }
        this.runId = builder.runId;
        this.statusOrNull = builder.status;
        this.cancelled = builder.cancelled;
        this.paused = builder.paused;
        this.createdAtOrNull = builder.createdAt;
        this.cancelReasonOrNull = builder.cancelReason;
        this.workerHostOrNull = builder.workerHost;
    }

    /**
     * 빌더 생성.
     *
     * @param runId Run ID
     * @return 빌더
     */
    public static Builder builder(RunId runId) {
        return new Builder(runId);
    }

    public RunId getRunId() {
        return runId;
    }

    /**
     * 상태 조회.
     *
     * @return 상태, 기록된 적 없으면 null
     */
    public RunStatus getStatusOrNull() {
        return statusOrNull;
    }

    public boolean isCancelled() {
        return cancelled;
    }

    public boolean isPaused() {
        return paused;
    }

    /**
     * 종료 상태 여부.
     *
     * @return COMPLETED/FAILED이면 true
     */
    public boolean isTerminal() {
        return statusOrNull != null && statusOrNull.isTerminal();
    }

    public Instant getCreatedAtOrNull() {
        return createdAtOrNull;
    }

    public String getCancelReasonOrNull() {
        return cancelReasonOrNull;
    }

    public String getWorkerHostOrNull() {
        return workerHostOrNull;
    }

    @Override
    public String toString() {
        return "RunHandle{runId=" + runId.getValue()
            + ", status=" + (statusOrNull == null ? "UNKNOWN" : statusOrNull)
            + ", cancelled=" + cancelled
            + ", paused=" + paused
            + ", createdAt=" + createdAtOrNull + "}";
    }

    /**
     * RunHandle 빌더.
     */
    public static final class Builder {

        private final RunId runId;
        private RunStatus status;
        private boolean cancelled;
        private boolean paused;
        private Instant createdAt;
        private String cancelReason;
        private String workerHost;

        private Builder(RunId runId) {
            this.runId = runId;
        }

        public Builder status(RunStatus status) {
            this.status = status;
            return this;
        }

        public Builder cancelled(boolean cancelled) {
            this.cancelled = cancelled;
            return this;
        }

        public Builder paused(boolean paused) {
            this.paused = paused;
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public Builder cancelReason(String cancelReason) {
            this.cancelReason = cancelReason;
            return this;
        }

        public Builder workerHost(String workerHost) {
            this.workerHost = workerHost;
            return this;
        }

        public RunHandle build() {
            return new RunHandle(this);
        }
    }
}
