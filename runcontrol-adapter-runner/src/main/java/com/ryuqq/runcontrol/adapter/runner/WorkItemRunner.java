package com.ryuqq.runcontrol.adapter.runner;

import com.ryuqq.runcontrol.application.worker.ControlPoint;
import com.ryuqq.runcontrol.application.worker.ControlPointInterceptor;
import com.ryuqq.runcontrol.application.worker.ItemDecision;
import com.ryuqq.runcontrol.application.worker.ItemResult;
import com.ryuqq.runcontrol.application.worker.ItemState;
import com.ryuqq.runcontrol.application.worker.RunReport;
import com.ryuqq.runcontrol.application.worker.WorkItem;
import com.ryuqq.runcontrol.core.context.CorrelationContext;
import com.ryuqq.runcontrol.core.statemachine.RunStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Work Item Runner 구현체.
 *
 * <p>작업 목록을 실행하면서 정해진 컨트롤 포인트마다
 * {@link ControlPointInterceptor}를 호출합니다.</p>
 *
 * <p><strong>처리 흐름:</strong></p>
 * <pre>
 * run(items) 호출
 *   ↓
 * onRunStart()
 *   ↓
 * onCollection(items) → SKIP_CANCELLED면 모든 작업 건너뜀
 *   ↓
 * For each WorkItem (순차 또는 스레드 풀):
 *   1. beforeItem(item) → SKIP_CANCELLED면 건너뜀
 *   2. item.execute() → 예외 또는 AssertionError 발생 시 FAILED
 *   3. afterItem(item, state)
 *   ↓
 * onRunEnd(COMPLETED | FAILED)
 * </pre>
 *
 * <p><strong>동시성 제어:</strong></p>
 * <ul>
 *   <li>concurrency=1: 호출 스레드에서 순차 실행</li>
 *   <li>concurrency&gt;1: 고정 크기 스레드 풀, Run 상관관계 ID는 풀 스레드로 전파</li>
 *   <li>beforeItem/execute/afterItem은 항상 같은 스레드에서 실행</li>
 * </ul>
 *
 * <p>작업 실패는 Run을 중단시키지 않습니다. 결과 목록은 입력 순서를 유지합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class WorkItemRunner {

    private static final Logger log = LoggerFactory.getLogger(WorkItemRunner.class);

    private final ControlPointInterceptor interceptor;
    private final WorkerConfig config;
    private final ExecutorService workerExecutor;

    /**
     * 생성자 (기본 설정: 순차 실행).
     *
     * @param interceptor 컨트롤 포인트 훅
     * @throws IllegalArgumentException interceptor가 null인 경우
     */
    public WorkItemRunner(ControlPointInterceptor interceptor) {
        this(interceptor, new WorkerConfig());
    }

    /**
     * 생성자.
     *
     * @param interceptor 컨트롤 포인트 훅
     * @param config 워커 설정
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public WorkItemRunner(ControlPointInterceptor interceptor, WorkerConfig config) {
        if (interceptor == null) {
            throw new IllegalArgumentException("interceptor cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }

        this.interceptor = interceptor;
        this.config = config;
        this.workerExecutor = config.isSequential() ? null : Executors.newFixedThreadPool(config.concurrency());
    }

    /**
     * 작업 목록 실행.
     *
     * @param items 실행할 작업 목록
     * @return 실행 결과 (입력 순서 유지)
     * @throws IllegalArgumentException items가 null이거나 null 원소를 포함하는 경우
     * @throws IllegalStateException 일시정지 대기 중 인터럽트 발생 시
     */
    public RunReport run(List<? extends WorkItem> items) {
        if (items == null) {
            throw new IllegalArgumentException("items cannot be null");
        }
        for (WorkItem item : items) {
            if (item == null) {
                throw new IllegalArgumentException("items cannot contain null");
            }
        }

        // 1. Run 시작
        interceptor.onRunStart();

        AtomicBoolean cancellationDetected = new AtomicBoolean(false);
        List<ItemResult> results;
        try {
            // 2. 수집 시점 취소 확인
            ItemDecision decision = interceptor.onCollection(items);

            // 3. 작업 실행
            if (decision.isSkip()) {
                results = skipAll(items);
            } else if (workerExecutor == null) {
                results = runSequential(items, cancellationDetected);
            } else {
                results = runConcurrent(items, cancellationDetected);
            }
        } catch (RuntimeException | Error e) {
            // 실행 루프 자체가 중단된 경우 Run을 FAILED로 마감
            interceptor.onRunEnd(RunStatus.FAILED);
            throw e;
        }

        RunReport report = new RunReport(interceptor.getRunIdOrNull(), results, cancellationDetected.get());

        // 4. Run 종료
        interceptor.onRunEnd(report.getOverallStatus());
        log.info("Run finished: {}", report);
        return report;
    }

    /**
     * Runner 종료 (리소스 정리).
     *
     * <p>ExecutorService를 graceful shutdown하여 진행 중인 작업이
     * 완료되도록 대기합니다.</p>
     *
     * @throws InterruptedException shutdown 대기 중 인터럽트 발생 시
     */
    public void shutdown() throws InterruptedException {
        if (workerExecutor == null) {
            return;
        }
        workerExecutor.shutdown();
        if (!workerExecutor.awaitTermination(config.shutdownTimeoutMs(), TimeUnit.MILLISECONDS)) {
            workerExecutor.shutdownNow();
        }
    }

    private List<ItemResult> skipAll(List<? extends WorkItem> items) {
        List<ItemResult> results = new ArrayList<>(items.size());
        for (WorkItem item : items) {
            results.add(ItemResult.skipped(item.getId(), ControlPoint.COLLECTION));
        }
        return results;
    }

    private List<ItemResult> runSequential(List<? extends WorkItem> items, AtomicBoolean cancellationDetected) {
        List<ItemResult> results = new ArrayList<>(items.size());
        for (WorkItem item : items) {
            results.add(processItem(item, cancellationDetected));
        }
        return results;
    }

    private List<ItemResult> runConcurrent(List<? extends WorkItem> items, AtomicBoolean cancellationDetected) {
        List<Future<ItemResult>> futures = new ArrayList<>(items.size());
        for (WorkItem item : items) {
            Callable<ItemResult> task = () -> processItem(item, cancellationDetected);
            futures.add(workerExecutor.submit(CorrelationContext.wrap(task)));
        }

        List<ItemResult> results = new ArrayList<>(futures.size());
        for (int i = 0; i < futures.size(); i++) {
            results.add(awaitResult(futures.get(i), items.get(i)));
        }
        return results;
    }

    private ItemResult awaitResult(Future<ItemResult> future, WorkItem item) {
        try {
            return future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Run interrupted while waiting for item " + item.getId(), e);
        } catch (ExecutionException e) {
            throw new IllegalStateException("Control point failed for item " + item.getId(), e.getCause());
        }
    }

    /**
     * 단일 작업 처리 (beforeItem → execute → afterItem).
     *
     * @param item 작업
     * @param cancellationDetected 실행 직후 취소 감지 여부 누적
     * @return 작업 결과
     */
    private ItemResult processItem(WorkItem item, AtomicBoolean cancellationDetected) {
        // 1. 실행 전 컨트롤 포인트
        ItemDecision decision = interceptor.beforeItem(item);
        if (decision.isSkip()) {
            return ItemResult.skipped(item.getId(), ControlPoint.BEFORE_ITEM);
        }

        // 2. 실행 (시작된 작업은 취소로 중단되지 않음)
        ItemResult result = null;
        try {
            result = execute(item);
        } finally {
            // 3. 실행 후 컨트롤 포인트 (execute가 빠져나가도 상관관계 ID 해제)
            ItemState state = result != null ? result.getState() : ItemState.FAILED;
            if (interceptor.afterItem(item, state)) {
                cancellationDetected.set(true);
            }
        }
        return result;
    }

    private ItemResult execute(WorkItem item) {
        long startNanos = System.nanoTime();
        try {
            item.execute();
            return ItemResult.passed(item.getId(), elapsedSince(startNanos));
        } catch (VirtualMachineError e) {
            throw e;
        } catch (Exception | Error e) {
            // AssertionError 등 테스트 실패도 작업 실패로 기록
            log.warn("Item {} failed", item.getId(), e);
            String message = e.getMessage() != null ? e.getMessage() : e.getClass().getName();
            return ItemResult.failed(item.getId(), message, elapsedSince(startNanos));
        }
    }

    private static Duration elapsedSince(long startNanos) {
        return Duration.ofNanos(System.nanoTime() - startNanos);
    }
}
