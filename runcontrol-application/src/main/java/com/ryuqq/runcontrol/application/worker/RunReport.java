package com.ryuqq.runcontrol.application.worker;

import com.ryuqq.runcontrol.core.model.RunId;
import com.ryuqq.runcontrol.core.statemachine.RunStatus;

import java.util.List;

/**
 * Run 실행 리포트.
 *
 * <p>발견된 모든 작업이 실행 여부와 무관하게 수집 순서대로 포함됩니다.</p>
 *
 * <p><strong>종합 결과:</strong> 실패한 작업이 하나라도 있으면 FAILED, 아니면 COMPLETED.
 * 취소로 건너뛴 작업은 종합 결과에 영향을 주지 않습니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class RunReport {

    private final RunId runIdOrNull;
    private final List<ItemResult> results;
    private final boolean cancellationDetectedAfterItem;

    /**
     * RunReport 생성.
     *
     * @param runIdOrNull Run ID (uncontrolled 모드면 null)
     * @param results 작업 결과 (수집 순서)
     * @param cancellationDetectedAfterItem 작업 실행 직후 취소가 감지되었는지
     * @throws IllegalArgumentException results가 null인 경우
     */
    public RunReport(RunId runIdOrNull, List<ItemResult> results, boolean cancellationDetectedAfterItem) {
        if (results == null) {
            throw new IllegalArgumentException("results cannot be null");
        }
        this.runIdOrNull = runIdOrNull;
        this.results = List.copyOf(results);
        this.cancellationDetectedAfterItem = cancellationDetectedAfterItem;
    }

    public RunId getRunIdOrNull() {
        return runIdOrNull;
    }

    /**
     * 컨트롤 스토어에 연결된 Run인지 확인.
     *
     * @return uncontrolled 모드가 아니면 true
     */
    public boolean isControlled() {
        return runIdOrNull != null;
    }

    public List<ItemResult> getResults() {
        return results;
    }

    public boolean isCancellationDetectedAfterItem() {
        return cancellationDetectedAfterItem;
    }

    /**
     * 상태별 작업 수.
     *
     * @param state 작업 상태
     * @return 해당 상태의 작업 수
     */
    public long count(ItemState state) {
        return results.stream().filter(r -> r.getState() == state).count();
    }

    /**
     * 종합 결과.
     *
     * @return FAILED 작업이 있으면 FAILED, 아니면 COMPLETED
     */
    public RunStatus getOverallStatus() {
        return count(ItemState.FAILED) > 0 ? RunStatus.FAILED : RunStatus.COMPLETED;
    }

    @Override
    public String toString() {
        return "RunReport{runId=" + (runIdOrNull == null ? "uncontrolled" : runIdOrNull.getValue())
            + ", passed=" + count(ItemState.PASSED)
            + ", failed=" + count(ItemState.FAILED)
            + ", skipped=" + count(ItemState.SKIPPED_CANCELLED)
            + ", overall=" + getOverallStatus() + "}";
    }
}
