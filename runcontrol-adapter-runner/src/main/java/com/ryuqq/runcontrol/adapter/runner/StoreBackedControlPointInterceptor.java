package com.ryuqq.runcontrol.adapter.runner;

import com.ryuqq.runcontrol.application.controller.RunMetadataKeys;
import com.ryuqq.runcontrol.application.worker.ControlPointInterceptor;
import com.ryuqq.runcontrol.application.worker.ItemDecision;
import com.ryuqq.runcontrol.application.worker.ItemState;
import com.ryuqq.runcontrol.application.worker.WorkItem;
import com.ryuqq.runcontrol.core.context.CorrelationContext;
import com.ryuqq.runcontrol.core.model.CorrelationId;
import com.ryuqq.runcontrol.core.model.FlagName;
import com.ryuqq.runcontrol.core.model.RunId;
import com.ryuqq.runcontrol.core.spi.ControlStore;
import com.ryuqq.runcontrol.core.spi.StoreUnavailableException;
import com.ryuqq.runcontrol.core.spi.WaitCondition;
import com.ryuqq.runcontrol.core.statemachine.RunStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.InetAddress;
import java.net.UnknownHostException;
import java.time.Clock;
import java.time.Duration;
import java.util.List;

/**
 * ControlStore 기반 ControlPointInterceptor 구현체.
 *
 * <p>오케스트레이터가 기록한 플래그를 컨트롤 포인트마다 읽어
 * 건너뛰기와 일시정지 대기를 수행하고, Run 상태를 기록합니다.</p>
 *
 * <p><strong>처리 흐름:</strong></p>
 * <pre>
 * onRunStart()      → status=RUNNING, started_at, worker_host
 * onCollection()    → cancelled면 전체 SKIP
 * beforeItem()      → cancelled면 SKIP
 *                     paused면 재개 또는 취소까지 대기 후 cancelled 재확인
 *                     PROCEED면 작업 단위 상관관계 ID 설정
 * afterItem()       → 상관관계 ID 해제, cancelled 재확인 (정보성)
 * onRunEnd(outcome) → status=COMPLETED|FAILED, finished_at
 * </pre>
 *
 * <p><strong>오류 정책:</strong></p>
 * <ul>
 *   <li>플래그 읽기 실패: 제어 신호 없음으로 간주하고 WARN 로그</li>
 *   <li>상태 쓰기 실패: ERROR 로그, 작업 실행에는 영향 없음</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class StoreBackedControlPointInterceptor implements ControlPointInterceptor {

    private static final Logger log = LoggerFactory.getLogger(StoreBackedControlPointInterceptor.class);

    private final ControlStore store;
    private final RunId runId;
    private final WorkerConfig config;
    private final String workerHost;
    private final Clock clock;

    /**
     * 생성자 (기본 설정 사용).
     *
     * @param store 컨트롤 스토어
     * @param runId 제어 대상 Run ID
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public StoreBackedControlPointInterceptor(ControlStore store, RunId runId) {
        this(store, runId, new WorkerConfig());
    }

    /**
     * 생성자 (로컬 호스트 이름, UTC 시계 사용).
     *
     * @param store 컨트롤 스토어
     * @param runId 제어 대상 Run ID
     * @param config 워커 설정
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public StoreBackedControlPointInterceptor(ControlStore store, RunId runId, WorkerConfig config) {
        this(store, runId, config, localHostName(), Clock.systemUTC());
    }

    /**
     * 생성자.
     *
     * @param store 컨트롤 스토어
     * @param runId 제어 대상 Run ID
     * @param config 워커 설정
     * @param workerHost worker_host 메타데이터로 기록할 호스트 이름
     * @param clock started_at/finished_at 기록용 시계
     * @throws IllegalArgumentException 인자가 null인 경우
     */
    public StoreBackedControlPointInterceptor(ControlStore store, RunId runId, WorkerConfig config,
                                              String workerHost, Clock clock) {
        if (store == null) {
            throw new IllegalArgumentException("store cannot be null");
        }
        if (runId == null) {
            throw new IllegalArgumentException("runId cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (workerHost == null) {
            throw new IllegalArgumentException("workerHost cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }

        this.store = store;
        this.runId = runId;
        this.config = config;
        this.workerHost = workerHost;
        this.clock = clock;
    }

    @Override
    public void onRunStart() {
        CorrelationContext.setRun(CorrelationId.of(runId.getValue()));

        try {
            store.setStatus(runId, RunStatus.RUNNING);
            store.setMetadata(runId, RunMetadataKeys.STARTED_AT, clock.instant().toString());
            store.setMetadata(runId, RunMetadataKeys.WORKER_HOST, workerHost);
            log.info("Run {} started on {}", runId.getValue(), workerHost);
        } catch (StoreUnavailableException e) {
            log.error("Failed to record RUNNING status for {}", runId.getValue(), e);
        } catch (IllegalStateException e) {
            log.error("Run {} cannot enter RUNNING: {}", runId.getValue(), e.getMessage());
        }
    }

    @Override
    public ItemDecision onCollection(List<? extends WorkItem> items) {
        if (items == null) {
            throw new IllegalArgumentException("items cannot be null");
        }
        if (readFlag(FlagName.CANCELLED)) {
            log.info("Run {} cancelled before collection, skipping {} items", runId.getValue(), items.size());
            return ItemDecision.SKIP_CANCELLED;
        }
        return ItemDecision.PROCEED;
    }

    @Override
    public ItemDecision beforeItem(WorkItem item) {
        if (item == null) {
            throw new IllegalArgumentException("item cannot be null");
        }

        // 1. 취소 확인
        if (readFlag(FlagName.CANCELLED)) {
            log.info("Skipping item {}: run {} cancelled", item.getId(), runId.getValue());
            return ItemDecision.SKIP_CANCELLED;
        }

        // 2. 일시정지면 재개 또는 취소까지 대기
        if (readFlag(FlagName.PAUSED)) {
            awaitResume(item);

            // 3. 대기 중 취소되었는지 재확인
            if (readFlag(FlagName.CANCELLED)) {
                log.info("Skipping item {}: run {} cancelled while paused", item.getId(), runId.getValue());
                return ItemDecision.SKIP_CANCELLED;
            }
        }

        // 4. 작업 단위 상관관계 ID 설정
        CorrelationContext.setCurrent(CorrelationId.generate());
        return ItemDecision.PROCEED;
    }

    @Override
    public boolean afterItem(WorkItem item, ItemState state) {
        if (item == null) {
            throw new IllegalArgumentException("item cannot be null");
        }
        try {
            boolean cancelled = readFlag(FlagName.CANCELLED);
            if (cancelled) {
                log.info("Cancellation of run {} detected after item {} ({})", runId.getValue(), item.getId(), state);
            }
            return cancelled;
        } finally {
            CorrelationContext.clearCurrent();
        }
    }

    @Override
    public void onRunEnd(RunStatus outcome) {
        if (outcome == null || !outcome.isTerminal()) {
            throw new IllegalArgumentException("outcome must be a terminal status (current: " + outcome + ")");
        }

        try {
            store.setStatus(runId, outcome);
            store.setMetadata(runId, RunMetadataKeys.FINISHED_AT, clock.instant().toString());
            log.info("Run {} finished: {}", runId.getValue(), outcome);
        } catch (StoreUnavailableException e) {
            log.error("Failed to record {} status for {}", outcome, runId.getValue(), e);
        } catch (IllegalStateException e) {
            log.error("Run {} cannot enter {}: {}", runId.getValue(), outcome, e.getMessage());
        } finally {
            CorrelationContext.clearRun();
        }
    }

    @Override
    public RunId getRunIdOrNull() {
        return runId;
    }

    private void awaitResume(WorkItem item) {
        Duration timeout = config.isPauseWaitUnbounded() ? null : Duration.ofMillis(config.pauseTimeoutMs());
        log.info("Run {} paused before item {}, waiting for resume", runId.getValue(), item.getId());

        long startNanos = System.nanoTime();
        try {
            boolean resumed = store.waitForFlag(runId, FlagName.PAUSED, WaitCondition.clearedOrCancelled(), timeout);
            long waitedMs = Duration.ofNanos(System.nanoTime() - startNanos).toMillis();
            if (resumed) {
                log.info("Run {} resumed after {}ms", runId.getValue(), waitedMs);
            } else {
                log.warn("Pause wait for run {} timed out after {}ms, proceeding", runId.getValue(), waitedMs);
            }
        } catch (StoreUnavailableException e) {
            log.warn("Pause wait for run {} failed, proceeding: {}", runId.getValue(), e.getMessage());
        }
    }

    private boolean readFlag(FlagName flagName) {
        try {
            return store.checkFlag(runId, flagName);
        } catch (StoreUnavailableException e) {
            log.warn("Failed to read {} for run {}, assuming not set: {}",
                flagName.getValue(), runId.getValue(), e.getMessage());
            return false;
        }
    }

    private static String localHostName() {
        try {
            return InetAddress.getLocalHost().getHostName();
        } catch (UnknownHostException e) {
            log.debug("Local host name unavailable, using 'unknown'", e);
            return "unknown";
        }
    }
}
