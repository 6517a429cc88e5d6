package com.ryuqq.runcontrol.application.controller;

import com.ryuqq.runcontrol.core.model.RunId;
import com.ryuqq.runcontrol.core.statemachine.RunStatus;

import java.time.Duration;
import java.util.Optional;

/**
 * 오케스트레이터 측 Run 제어 API.
 *
 * <p>오케스트레이터는 워커 프로세스와 직접 통신하지 않습니다. 모든 요청은
 * 워커와 공유하는 {@link com.ryuqq.runcontrol.core.spi.ControlStore}에 기록되며,
 * 워커는 다음 컨트롤 포인트에서 이를 관찰합니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * RunId runId = controller.createRun();
 * // 워커 프로세스 시작: --run-id=runId
 *
 * controller.requestPause(runId);
 * controller.requestResume(runId);
 * controller.requestCancel(runId, "user aborted");
 *
 * Optional&lt;RunStatus&gt; terminal = controller.awaitTerminal(runId, Duration.ofMinutes(5));
 * controller.purgeIfTerminal(runId);
 * </pre>
 *
 * <p><strong>오류 정책:</strong> 쓰기 실패는
 * {@link com.ryuqq.runcontrol.core.spi.StoreUnavailableException}으로 그대로 전파됩니다.
 * 취소 요청이 조용히 유실되어서는 안 됩니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface RunController {

    /**
     * 새 RunId로 Run 생성.
     *
     * <p>status=PENDING, created_at 메타데이터를 기록합니다.</p>
     *
     * @return 생성된 RunId
     */
    RunId createRun();

    /**
     * 지정한 RunId로 Run 생성.
     *
     * @param runId Run ID
     * @return 전달받은 RunId
     * @throws IllegalArgumentException runId가 null인 경우
     * @throws IllegalStateException 이미 PENDING 이후 상태로 진행된 Run인 경우
     */
    RunId createRun(RunId runId);

    /**
     * 취소 요청 ({@code cancelled=true}).
     *
     * <p>취소는 되돌릴 수 없습니다. 이미 실행 중인 작업 단위는 끝까지 실행되며,
     * 이후 작업 단위만 건너뜁니다.</p>
     *
     * @param runId Run ID
     * @param reason 취소 사유 (null 가능, cancel_reason 메타데이터로 기록)
     */
    void requestCancel(RunId runId, String reason);

    /**
     * 일시정지 요청 ({@code paused=true}).
     *
     * @param runId Run ID
     */
    void requestPause(RunId runId);

    /**
     * 재개 요청 ({@code paused=false}).
     *
     * @param runId Run ID
     */
    void requestResume(RunId runId);

    /**
     * Run 상태 조회.
     *
     * @param runId Run ID
     * @return 상태, 기록된 적 없으면 empty
     */
    Optional<RunStatus> queryStatus(RunId runId);

    /**
     * 취소 요청 여부.
     *
     * @param runId Run ID
     * @return cancelled 플래그 값
     */
    boolean isCancelled(RunId runId);

    /**
     * 일시정지 요청 여부.
     *
     * @param runId Run ID
     * @return paused 플래그 값
     */
    boolean isPaused(RunId runId);

    /**
     * 상태, 플래그, 메타데이터를 한 번에 조회.
     *
     * @param runId Run ID
     * @return Run 스냅샷
     */
    RunHandle describe(RunId runId);

    /**
     * 종료 상태(COMPLETED/FAILED)까지 대기.
     *
     * @param runId Run ID
     * @param timeout 최대 대기 시간 (null이면 무제한)
     * @return 종료 상태, 타임아웃 시 empty
     * @throws IllegalArgumentException timeout이 음수인 경우
     */
    Optional<RunStatus> awaitTerminal(RunId runId, Duration timeout);

    /**
     * 종료된 Run의 모든 상태 삭제.
     *
     * @param runId Run ID
     * @return 삭제했으면 true, 종료 상태가 아니라서 남겨뒀으면 false
     */
    boolean purgeIfTerminal(RunId runId);
}
