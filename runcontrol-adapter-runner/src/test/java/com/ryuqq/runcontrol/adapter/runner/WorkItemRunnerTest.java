package com.ryuqq.runcontrol.adapter.runner;

import com.ryuqq.runcontrol.adapter.inmemory.InMemoryControlStore;
import com.ryuqq.runcontrol.application.worker.ControlPoint;
import com.ryuqq.runcontrol.application.worker.ControlPointInterceptor;
import com.ryuqq.runcontrol.application.worker.ItemResult;
import com.ryuqq.runcontrol.application.worker.ItemState;
import com.ryuqq.runcontrol.application.worker.RunReport;
import com.ryuqq.runcontrol.application.worker.WorkItem;
import com.ryuqq.runcontrol.core.context.CorrelationContext;
import com.ryuqq.runcontrol.core.model.CorrelationId;
import com.ryuqq.runcontrol.core.model.RunId;
import com.ryuqq.runcontrol.core.statemachine.RunStatus;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Queue;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * WorkItemRunner 통합 테스트 (InMemoryControlStore 사용).
 *
 * <p>오케스트레이터 역할은 {@link DefaultRunController}가 같은 스토어에 쓰는 방식으로 흉내냅니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class WorkItemRunnerTest {

    private InMemoryControlStore store;
    private DefaultRunController controller;
    private ScheduledExecutorService scheduler;
    private WorkItemRunner runner;
    private RunId runId;

    @BeforeEach
    void setUp() {
        store = new InMemoryControlStore(Duration.ofMillis(50));
        controller = new DefaultRunController(store, Duration.ofMillis(20), Clock.systemUTC());
        scheduler = Executors.newSingleThreadScheduledExecutor();
        runId = controller.createRun();
    }

    @AfterEach
    void tearDown() throws InterruptedException {
        if (runner != null) {
            runner.shutdown();
        }
        scheduler.shutdownNow();
        store.close();
        CorrelationContext.clearCurrent();
        CorrelationContext.clearRun();
    }

    // ============================================================
    // 취소
    // ============================================================

    @Test
    @DisplayName("3번째 작업 전에 취소되면 1~2는 실행, 3~5는 건너뛰고 COMPLETED로 종료")
    void run_CancelBeforeThirdItem_SkipsRemainingAndCompletes() {
        // Given
        Queue<String> executed = new ConcurrentLinkedQueue<>();
        List<WorkItem> items = new ArrayList<>();
        for (int i = 1; i <= 5; i++) {
            String id = "item-" + i;
            items.add(WorkItem.of(id, () -> {
                executed.add(id);
                if (id.equals("item-2")) {
                    controller.requestCancel(runId, "operator abort");
                }
            }));
        }
        runner = new WorkItemRunner(new StoreBackedControlPointInterceptor(store, runId));

        // When
        RunReport report = runner.run(items);

        // Then
        assertThat(executed).containsExactly("item-1", "item-2");
        assertThat(report.getResults()).extracting(ItemResult::getState).containsExactly(
            ItemState.PASSED, ItemState.PASSED,
            ItemState.SKIPPED_CANCELLED, ItemState.SKIPPED_CANCELLED, ItemState.SKIPPED_CANCELLED
        );
        assertThat(report.getResults().get(2).getSkippedAtOrNull()).isEqualTo(ControlPoint.BEFORE_ITEM);
        assertThat(report.isCancellationDetectedAfterItem()).isTrue();
        assertThat(report.getOverallStatus()).isEqualTo(RunStatus.COMPLETED);
        assertThat(controller.queryStatus(runId)).contains(RunStatus.COMPLETED);
    }

    @Test
    @DisplayName("수집 전에 취소되면 모든 작업이 COLLECTION 지점에서 건너뛰어지고 보고서에 남는다")
    void run_CancelledBeforeCollection_AllSkippedAtCollection() {
        // Given
        controller.requestCancel(runId, null);
        Queue<String> executed = new ConcurrentLinkedQueue<>();
        List<WorkItem> items = List.of(
            WorkItem.of("a", () -> executed.add("a")),
            WorkItem.of("b", () -> executed.add("b"))
        );
        runner = new WorkItemRunner(new StoreBackedControlPointInterceptor(store, runId));

        // When
        RunReport report = runner.run(items);

        // Then
        assertThat(executed).isEmpty();
        assertThat(report.getResults()).hasSize(2);
        assertThat(report.getResults()).allSatisfy(result -> {
            assertThat(result.getState()).isEqualTo(ItemState.SKIPPED_CANCELLED);
            assertThat(result.getSkippedAtOrNull()).isEqualTo(ControlPoint.COLLECTION);
        });
        assertThat(controller.queryStatus(runId)).contains(RunStatus.COMPLETED);
    }

    // ============================================================
    // 일시정지
    // ============================================================

    @Test
    @DisplayName("2번째 작업 전 일시정지 후 200ms 뒤 재개하면 재개 이후에만 실행된다")
    void run_PausedBeforeSecondItem_StartsOnlyAfterResume() {
        // Given: 기본 폴링 간격(500ms) 스토어
        InMemoryControlStore defaultStore = new InMemoryControlStore();
        DefaultRunController defaultController = new DefaultRunController(defaultStore);
        RunId pausedRun = defaultController.createRun();

        AtomicLong pausedAt = new AtomicLong();
        AtomicLong resumedAt = new AtomicLong();
        AtomicLong secondStartedAt = new AtomicLong();
        List<WorkItem> items = List.of(
            WorkItem.of("item-1", () -> {
                defaultController.requestPause(pausedRun);
                pausedAt.set(System.nanoTime());
                scheduler.schedule(() -> {
                    resumedAt.set(System.nanoTime());
                    defaultController.requestResume(pausedRun);
                }, 200, TimeUnit.MILLISECONDS);
            }),
            WorkItem.of("item-2", () -> secondStartedAt.set(System.nanoTime()))
        );
        runner = new WorkItemRunner(new StoreBackedControlPointInterceptor(defaultStore, pausedRun));

        // When
        RunReport report = runner.run(items);

        // Then
        long delayMs = TimeUnit.NANOSECONDS.toMillis(secondStartedAt.get() - pausedAt.get());
        assertThat(secondStartedAt.get()).isGreaterThanOrEqualTo(resumedAt.get());
        assertThat(delayMs).isGreaterThanOrEqualTo(200L);
        assertThat(delayMs).isLessThan(200L + defaultStore.getPollInterval().toMillis());
        assertThat(report.count(ItemState.PASSED)).isEqualTo(2);

        defaultStore.close();
    }

    @Test
    @DisplayName("일시정지 대기 중 취소되면 즉시 풀려나 남은 작업을 건너뛴다")
    void run_CancelledWhilePaused_UnblocksAndSkips() {
        // Given
        List<WorkItem> items = List.of(
            WorkItem.of("item-1", () -> {
                controller.requestPause(runId);
                scheduler.schedule(() -> controller.requestCancel(runId, "abort while paused"),
                    100, TimeUnit.MILLISECONDS);
            }),
            WorkItem.of("item-2", () -> { }),
            WorkItem.of("item-3", () -> { })
        );
        runner = new WorkItemRunner(new StoreBackedControlPointInterceptor(store, runId));
        long start = System.nanoTime();

        // When
        RunReport report = runner.run(items);

        // Then
        long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);
        assertThat(elapsedMs).isLessThan(5000L);
        assertThat(report.getResults()).extracting(ItemResult::getState).containsExactly(
            ItemState.PASSED, ItemState.SKIPPED_CANCELLED, ItemState.SKIPPED_CANCELLED
        );
        assertThat(controller.isPaused(runId)).isTrue();
        assertThat(controller.queryStatus(runId)).contains(RunStatus.COMPLETED);
    }

    // ============================================================
    // 실패
    // ============================================================

    @Test
    @DisplayName("작업 예외는 해당 작업만 FAILED로 만들고 Run은 FAILED로 종료")
    void run_ItemThrows_ItemFailedAndRunFailed() {
        // Given
        Queue<String> executed = new ConcurrentLinkedQueue<>();
        List<WorkItem> items = List.of(
            WorkItem.of("ok-1", () -> executed.add("ok-1")),
            WorkItem.of("boom", () -> {
                throw new IllegalStateException("boom");
            }),
            WorkItem.of("ok-2", () -> executed.add("ok-2"))
        );
        runner = new WorkItemRunner(new StoreBackedControlPointInterceptor(store, runId));

        // When
        RunReport report = runner.run(items);

        // Then
        assertThat(executed).containsExactly("ok-1", "ok-2");
        assertThat(report.getResults().get(1).getState()).isEqualTo(ItemState.FAILED);
        assertThat(report.getResults().get(1).getErrorMessageOrNull()).isEqualTo("boom");
        assertThat(report.getOverallStatus()).isEqualTo(RunStatus.FAILED);
        assertThat(controller.queryStatus(runId)).contains(RunStatus.FAILED);
    }

    @Test
    @DisplayName("AssertionError를 던진 작업도 FAILED로 기록되고 다음 작업과 Run 종료가 진행된다")
    void run_ItemThrowsAssertionError_RunStillFinalized() {
        // Given
        Queue<String> executed = new ConcurrentLinkedQueue<>();
        List<WorkItem> items = List.of(
            WorkItem.of("a", () -> {
                throw new AssertionError("expected 1 but was 2");
            }),
            WorkItem.of("b", () -> executed.add("b"))
        );
        runner = new WorkItemRunner(new StoreBackedControlPointInterceptor(store, runId));

        // When
        RunReport report = runner.run(items);

        // Then
        assertThat(executed).containsExactly("b");
        assertThat(report.getResults()).extracting(ItemResult::getState)
            .containsExactly(ItemState.FAILED, ItemState.PASSED);
        assertThat(report.getResults().get(0).getErrorMessageOrNull()).isEqualTo("expected 1 but was 2");
        assertThat(controller.queryStatus(runId)).contains(RunStatus.FAILED);
        assertThat(CorrelationContext.getCurrent().isUnset()).isTrue();
        assertThat(CorrelationContext.getRun().isUnset()).isTrue();
    }

    @Test
    @DisplayName("동시 실행에서도 AssertionError는 해당 작업만 FAILED로 만든다")
    void run_ConcurrentItemThrowsAssertionError_OtherItemsPass() {
        // Given
        List<WorkItem> items = new ArrayList<>();
        for (int i = 0; i < 6; i++) {
            String id = "item-" + i;
            items.add(WorkItem.of(id, () -> {
                if (id.equals("item-2")) {
                    throw new AssertionError("item-2 broke");
                }
            }));
        }
        runner = new WorkItemRunner(
            new StoreBackedControlPointInterceptor(store, runId),
            new WorkerConfig().withConcurrency(3)
        );

        // When
        RunReport report = runner.run(items);

        // Then
        assertThat(report.count(ItemState.FAILED)).isEqualTo(1);
        assertThat(report.count(ItemState.PASSED)).isEqualTo(5);
        assertThat(controller.queryStatus(runId)).contains(RunStatus.FAILED);
    }

    @Test
    @DisplayName("컨트롤 포인트가 Error로 중단되면 Run을 FAILED로 마감하고 Error를 전파한다")
    void run_ControlPointThrowsError_ClosesRunAsFailed() {
        // Given
        ControlPointInterceptor interceptor = mock(ControlPointInterceptor.class);
        when(interceptor.onCollection(anyList())).thenThrow(new AssertionError("collection broke"));
        runner = new WorkItemRunner(interceptor);

        // When & Then
        assertThatThrownBy(() -> runner.run(List.of(WorkItem.of("a", () -> { }))))
            .isInstanceOf(AssertionError.class)
            .hasMessageContaining("collection broke");
        verify(interceptor).onRunEnd(RunStatus.FAILED);
    }

    @Test
    @DisplayName("null 작업 목록은 거부된다")
    void run_NullItems_ThrowsException() {
        runner = new WorkItemRunner(new UncontrolledControlPointInterceptor());

        assertThatThrownBy(() -> runner.run(null))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("items cannot be null");
    }

    // ============================================================
    // 상관관계 ID
    // ============================================================

    @Test
    @DisplayName("순차 실행: 작업마다 새 상관관계 ID가 설정되고 다음 작업 전에 해제된다")
    void run_Sequential_CorrelationIdPerItemAndClearedAfter() {
        // Given
        List<CorrelationId> observed = new ArrayList<>();
        List<WorkItem> items = new ArrayList<>();
        for (int i = 0; i < 3; i++) {
            items.add(WorkItem.of("item-" + i, () -> observed.add(CorrelationContext.getCurrent())));
        }
        runner = new WorkItemRunner(new StoreBackedControlPointInterceptor(store, runId));

        // When
        runner.run(items);

        // Then
        assertThat(observed).hasSize(3);
        assertThat(observed).noneMatch(CorrelationId::isUnset);
        assertThat(new HashSet<>(observed)).hasSize(3);
        assertThat(CorrelationContext.getCurrent().isUnset()).isTrue();
        assertThat(CorrelationContext.getRun().isUnset()).isTrue();
    }

    @Test
    @DisplayName("동시 실행: 상관관계 ID가 다른 작업으로 새지 않고 Run ID는 풀 스레드로 전파된다")
    void run_Concurrent_CorrelationIdsIsolated() {
        // Given
        int itemCount = 12;
        Map<String, CorrelationId> firstSeen = new ConcurrentHashMap<>();
        Map<String, CorrelationId> lastSeen = new ConcurrentHashMap<>();
        Map<String, CorrelationId> runSeen = new ConcurrentHashMap<>();
        List<WorkItem> items = new ArrayList<>();
        for (int i = 0; i < itemCount; i++) {
            String id = "item-" + i;
            items.add(WorkItem.of(id, () -> {
                firstSeen.put(id, CorrelationContext.getCurrent());
                runSeen.put(id, CorrelationContext.getRun());
                Thread.sleep(20);
                lastSeen.put(id, CorrelationContext.getCurrent());
            }));
        }
        runner = new WorkItemRunner(
            new StoreBackedControlPointInterceptor(store, runId),
            new WorkerConfig().withConcurrency(4)
        );

        // When
        RunReport report = runner.run(items);

        // Then
        assertThat(report.count(ItemState.PASSED)).isEqualTo(itemCount);
        assertThat(report.getResults()).extracting(ItemResult::getItemId)
            .containsExactlyElementsOf(items.stream().map(WorkItem::getId).toList());
        Set<CorrelationId> distinct = new HashSet<>(firstSeen.values());
        assertThat(distinct).hasSize(itemCount);
        assertThat(distinct).noneMatch(CorrelationId::isUnset);
        for (WorkItem item : items) {
            assertThat(lastSeen.get(item.getId())).isEqualTo(firstSeen.get(item.getId()));
            assertThat(runSeen.get(item.getId()).getValue()).isEqualTo(runId.getValue());
        }
    }

    @Test
    @DisplayName("uncontrolled 실행도 생성된 Run ID를 모든 작업에 전파하고 끝나면 해제한다")
    void run_Uncontrolled_GeneratedRunIdPropagated() {
        // Given
        Map<String, CorrelationId> runSeen = new ConcurrentHashMap<>();
        List<WorkItem> items = new ArrayList<>();
        for (int i = 0; i < 4; i++) {
            String id = "item-" + i;
            items.add(WorkItem.of(id, () -> runSeen.put(id, CorrelationContext.getRun())));
        }
        runner = new WorkItemRunner(new UncontrolledControlPointInterceptor(), new WorkerConfig().withConcurrency(2));

        // When
        RunReport report = runner.run(items);

        // Then
        assertThat(report.count(ItemState.PASSED)).isEqualTo(4);
        assertThat(runSeen.values()).noneMatch(CorrelationId::isUnset);
        assertThat(new HashSet<>(runSeen.values())).hasSize(1);
        assertThat(CorrelationContext.getRun().isUnset()).isTrue();
    }

    @Test
    @DisplayName("취소된 Run은 동시 실행 모드에서도 작업을 실행하지 않는다")
    void run_ConcurrentAlreadyCancelled_NothingExecuted() {
        // Given
        controller.requestCancel(runId, null);
        List<WorkItem> items = List.of(WorkItem.of("x", () -> { }), WorkItem.of("y", () -> { }));
        runner = new WorkItemRunner(
            new StoreBackedControlPointInterceptor(store, runId),
            new WorkerConfig().withConcurrency(2)
        );

        // When
        RunReport report = runner.run(items);

        // Then
        assertThat(report.count(ItemState.SKIPPED_CANCELLED)).isEqualTo(2);
        assertThat(report.count(ItemState.PASSED)).isZero();
    }
}
