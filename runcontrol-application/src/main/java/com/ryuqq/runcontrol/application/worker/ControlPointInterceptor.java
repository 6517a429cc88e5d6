package com.ryuqq.runcontrol.application.worker;

import com.ryuqq.runcontrol.core.model.RunId;
import com.ryuqq.runcontrol.core.statemachine.RunStatus;

import java.util.List;

/**
 * 워커 실행 흐름의 고정 지점에서 호출되는 제어 훅.
 *
 * <p>컨트롤 스토어의 플래그를 읽어 일시정지 대기, 건너뛰기, 상태 전이를 수행합니다.
 * 호출 순서는 {@link ControlPoint}를 참고하세요.</p>
 *
 * <p><strong>불변식:</strong> 한 번 실행이 시작된 작업은 중간에 중단되지 않습니다.
 * 취소는 이후 작업의 시작만 막습니다.</p>
 *
 * <p><strong>스레드 규칙:</strong> {@link #beforeItem}과 {@link #afterItem}은
 * 작업을 실행하는 스레드에서 호출되어야 합니다. 작업 단위 상관관계 ID가
 * 그 스레드에 설정/해제되기 때문입니다.</p>
 *
 * <p><strong>오류 정책:</strong> 컨트롤 포인트는 스토어 읽기 실패로 예외를 던지지 않습니다.
 * 제어 신호가 없는 것으로 간주하고 경고를 남깁니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface ControlPointInterceptor {

    /**
     * Run 시작 ({@link ControlPoint#RUN_START}).
     */
    void onRunStart();

    /**
     * 작업 목록 수집 직후 ({@link ControlPoint#COLLECTION}).
     *
     * @param items 수집된 작업 목록
     * @return SKIP_CANCELLED이면 모든 작업을 건너뜀
     */
    ItemDecision onCollection(List<? extends WorkItem> items);

    /**
     * 작업 실행 직전 ({@link ControlPoint#BEFORE_ITEM}).
     *
     * <p>일시정지 상태면 재개(또는 취소)될 때까지 호출 스레드를 블로킹합니다.
     * PROCEED를 반환하면 호출 스레드에 작업 단위 상관관계 ID가 설정되어 있습니다.</p>
     *
     * @param item 실행할 작업
     * @return 진행 여부
     */
    ItemDecision beforeItem(WorkItem item);

    /**
     * 작업 실행 직후 ({@link ControlPoint#AFTER_ITEM}).
     *
     * <p>작업 단위 상관관계 ID를 해제합니다.</p>
     *
     * @param item 실행된 작업
     * @param state 실행 결과
     * @return 실행 직후 취소가 감지되면 true (정보성)
     */
    boolean afterItem(WorkItem item, ItemState state);

    /**
     * Run 종료 ({@link ControlPoint#RUN_END}).
     *
     * @param outcome COMPLETED 또는 FAILED
     */
    void onRunEnd(RunStatus outcome);

    /**
     * 제어 대상 RunId 조회.
     *
     * @return RunId, uncontrolled 모드면 null
     */
    RunId getRunIdOrNull();

    /**
     * 컨트롤 스토어에 연결되어 있는지 확인.
     *
     * @return uncontrolled 모드면 false
     */
    default boolean isControlled() {
        return getRunIdOrNull() != null;
    }
}
