package com.ryuqq.runcontrol.adapter.runner;

import com.ryuqq.runcontrol.application.worker.ControlPointInterceptor;
import com.ryuqq.runcontrol.application.worker.ItemDecision;
import com.ryuqq.runcontrol.application.worker.ItemState;
import com.ryuqq.runcontrol.application.worker.WorkItem;
import com.ryuqq.runcontrol.core.context.CorrelationContext;
import com.ryuqq.runcontrol.core.model.CorrelationId;
import com.ryuqq.runcontrol.core.model.RunId;
import com.ryuqq.runcontrol.core.statemachine.RunStatus;

import java.util.List;

/**
 * RunId 없이 실행되는 워커용 ControlPointInterceptor.
 *
 * <p>컨트롤 스토어를 전혀 사용하지 않습니다. 모든 작업을 실행하며,
 * 상관관계 ID만 설정/해제합니다. Run 계층에는 실행마다 새 ID를 생성하여
 * 제어되는 Run과 같은 형식의 로그 라인을 남깁니다.</p>
 *
 * <p>uncontrolled 모드 경고는 {@link RunIdResolver}가 한 번만 남기며,
 * 이 클래스는 컨트롤 포인트마다 로그를 남기지 않습니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class UncontrolledControlPointInterceptor implements ControlPointInterceptor {

    @Override
    public void onRunStart() {
        CorrelationContext.setRun(CorrelationId.generate());
    }

    @Override
    public ItemDecision onCollection(List<? extends WorkItem> items) {
        return ItemDecision.PROCEED;
    }

    @Override
    public ItemDecision beforeItem(WorkItem item) {
        CorrelationContext.setCurrent(CorrelationId.generate());
        return ItemDecision.PROCEED;
    }

    @Override
    public boolean afterItem(WorkItem item, ItemState state) {
        CorrelationContext.clearCurrent();
        return false;
    }

    @Override
    public void onRunEnd(RunStatus outcome) {
        CorrelationContext.clearRun();
    }

    @Override
    public RunId getRunIdOrNull() {
        return null;
    }
}
