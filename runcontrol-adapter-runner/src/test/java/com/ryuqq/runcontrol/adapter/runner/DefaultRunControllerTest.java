package com.ryuqq.runcontrol.adapter.runner;

import com.ryuqq.runcontrol.adapter.inmemory.InMemoryControlStore;
import com.ryuqq.runcontrol.application.controller.RunHandle;
import com.ryuqq.runcontrol.application.controller.RunMetadataKeys;
import com.ryuqq.runcontrol.core.model.FlagName;
import com.ryuqq.runcontrol.core.model.RunId;
import com.ryuqq.runcontrol.core.spi.ControlStore;
import com.ryuqq.runcontrol.core.spi.StoreUnavailableException;
import com.ryuqq.runcontrol.core.statemachine.RunStatus;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Optional;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

/**
 * DefaultRunController 테스트.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class DefaultRunControllerTest {

    private static final Instant CREATED = Instant.parse("2026-03-01T08:30:00Z");

    private InMemoryControlStore store;
    private DefaultRunController controller;

    @BeforeEach
    void setUp() {
        store = new InMemoryControlStore(Duration.ofMillis(20));
        controller = new DefaultRunController(store, Duration.ofMillis(20), Clock.fixed(CREATED, ZoneOffset.UTC));
    }

    @AfterEach
    void tearDown() {
        store.close();
    }

    // ============================================================
    // createRun
    // ============================================================

    @Test
    @DisplayName("createRun()은 PENDING 상태와 created_at을 기록한다")
    void createRun_WritesPendingAndCreatedAt() {
        // When
        RunId runId = controller.createRun();

        // Then
        assertThat(controller.queryStatus(runId)).contains(RunStatus.PENDING);
        assertThat(store.getMetadata(runId, RunMetadataKeys.CREATED_AT)).contains(CREATED.toString());
    }

    @Test
    @DisplayName("이미 시작된 Run은 다시 생성할 수 없다")
    void createRun_AlreadyRunning_ThrowsException() {
        // Given
        RunId runId = controller.createRun(RunId.of("run-dup"));
        store.setStatus(runId, RunStatus.RUNNING);

        // When & Then
        assertThatThrownBy(() -> controller.createRun(runId))
            .isInstanceOf(IllegalStateException.class);
    }

    @Test
    @DisplayName("PENDING Run을 다시 생성하면 멱등이며 created_at은 유지된다")
    void createRun_Twice_Idempotent() {
        // Given
        RunId runId = controller.createRun(RunId.of("run-again"));
        DefaultRunController later = new DefaultRunController(store, Duration.ofMillis(20),
            Clock.fixed(CREATED.plusSeconds(60), ZoneOffset.UTC));

        // When
        later.createRun(runId);

        // Then
        assertThat(controller.queryStatus(runId)).contains(RunStatus.PENDING);
        assertThat(store.getMetadata(runId, RunMetadataKeys.CREATED_AT)).contains(CREATED.toString());
    }

    // ============================================================
    // 제어 요청
    // ============================================================

    @Test
    @DisplayName("requestCancel()은 cancelled 플래그와 사유를 기록하며 되돌릴 수 없다")
    void requestCancel_SetsStickyFlagAndReason() {
        // Given
        RunId runId = controller.createRun();

        // When
        controller.requestCancel(runId, "user aborted");

        // Then
        assertThat(controller.isCancelled(runId)).isTrue();
        assertThat(store.getMetadata(runId, RunMetadataKeys.CANCEL_REASON)).contains("user aborted");
        assertThatThrownBy(() -> store.setFlag(runId, FlagName.CANCELLED, false))
            .isInstanceOf(IllegalStateException.class);
    }

    @Test
    @DisplayName("requestPause()/requestResume()은 paused 플래그를 토글한다")
    void pauseAndResume_TogglePausedFlag() {
        RunId runId = controller.createRun();

        controller.requestPause(runId);
        assertThat(controller.isPaused(runId)).isTrue();

        controller.requestResume(runId);
        assertThat(controller.isPaused(runId)).isFalse();
    }

    @Test
    @DisplayName("describe()는 상태, 플래그, 메타데이터를 한 번에 반환한다")
    void describe_ReturnsSnapshot() {
        // Given
        RunId runId = controller.createRun();
        store.setStatus(runId, RunStatus.RUNNING);
        store.setMetadata(runId, RunMetadataKeys.WORKER_HOST, "worker-02");
        controller.requestPause(runId);
        controller.requestCancel(runId, "maintenance");

        // When
        RunHandle handle = controller.describe(runId);

        // Then
        assertThat(handle.getRunId()).isEqualTo(runId);
        assertThat(handle.getStatusOrNull()).isEqualTo(RunStatus.RUNNING);
        assertThat(handle.isPaused()).isTrue();
        assertThat(handle.isCancelled()).isTrue();
        assertThat(handle.getCreatedAtOrNull()).isEqualTo(CREATED);
        assertThat(handle.getCancelReasonOrNull()).isEqualTo("maintenance");
        assertThat(handle.getWorkerHostOrNull()).isEqualTo("worker-02");
        assertThat(handle.isTerminal()).isFalse();
    }

    @Test
    @DisplayName("describe()는 알 수 없는 Run에 대해 빈 스냅샷을 반환한다")
    void describe_UnknownRun_EmptySnapshot() {
        RunHandle handle = controller.describe(RunId.of("never-created"));

        assertThat(handle.getStatusOrNull()).isNull();
        assertThat(handle.isCancelled()).isFalse();
        assertThat(handle.getCreatedAtOrNull()).isNull();
        assertThat(store.size()).isZero();
    }

    @Test
    @DisplayName("describe()는 형식이 잘못된 created_at을 무시한다")
    void describe_MalformedCreatedAt_Ignored() {
        RunId runId = RunId.of("run-malformed");
        store.setMetadata(runId, RunMetadataKeys.CREATED_AT, "yesterday");

        assertThat(controller.describe(runId).getCreatedAtOrNull()).isNull();
    }

    // ============================================================
    // awaitTerminal
    // ============================================================

    @Test
    @DisplayName("awaitTerminal()은 종료 상태가 기록되면 반환한다")
    void awaitTerminal_WorkerCompletes_ReturnsStatus() {
        // Given
        RunId runId = controller.createRun();
        store.setStatus(runId, RunStatus.RUNNING);
        ScheduledExecutorService scheduler = Executors.newSingleThreadScheduledExecutor();
        scheduler.schedule(() -> store.setStatus(runId, RunStatus.COMPLETED), 100, TimeUnit.MILLISECONDS);

        try {
            // When
            Optional<RunStatus> result = controller.awaitTerminal(runId, Duration.ofSeconds(10));

            // Then
            assertThat(result).contains(RunStatus.COMPLETED);
        } finally {
            scheduler.shutdownNow();
        }
    }

    @Test
    @DisplayName("awaitTerminal()은 타임아웃 시 empty를 반환한다")
    void awaitTerminal_Timeout_ReturnsEmpty() {
        RunId runId = controller.createRun();

        Optional<RunStatus> result = controller.awaitTerminal(runId, Duration.ofMillis(100));

        assertThat(result).isEmpty();
    }

    @Test
    @DisplayName("awaitTerminal()은 음수 타임아웃을 거부한다")
    void awaitTerminal_NegativeTimeout_ThrowsException() {
        RunId runId = controller.createRun();

        assertThatThrownBy(() -> controller.awaitTerminal(runId, Duration.ofMillis(-1)))
            .isInstanceOf(IllegalArgumentException.class);
    }

    // ============================================================
    // purgeIfTerminal
    // ============================================================

    @Test
    @DisplayName("종료된 Run만 삭제한다")
    void purgeIfTerminal_OnlyTerminalRunsPurged() {
        // Given
        RunId running = controller.createRun();
        store.setStatus(running, RunStatus.RUNNING);
        RunId finished = controller.createRun();
        store.setStatus(finished, RunStatus.RUNNING);
        store.setStatus(finished, RunStatus.FAILED);

        // When & Then
        assertThat(controller.purgeIfTerminal(running)).isFalse();
        assertThat(controller.purgeIfTerminal(finished)).isTrue();
        assertThat(controller.queryStatus(running)).contains(RunStatus.RUNNING);
        assertThat(controller.queryStatus(finished)).isEmpty();
        assertThat(store.getMetadata(finished, RunMetadataKeys.CREATED_AT)).isEmpty();
    }

    // ============================================================
    // 오류 전파
    // ============================================================

    @Test
    @DisplayName("취소 요청 쓰기 실패는 호출자에게 전파된다")
    void requestCancel_StoreUnavailable_Propagates() {
        // Given
        ControlStore failing = mock(ControlStore.class);
        RunId runId = RunId.of("run-down");
        doThrow(new StoreUnavailableException("connection refused"))
            .when(failing).setFlag(eq(runId), eq(FlagName.CANCELLED), eq(true));
        DefaultRunController failingController = new DefaultRunController(failing);

        // When & Then
        assertThatThrownBy(() -> failingController.requestCancel(runId, "abort"))
            .isInstanceOf(StoreUnavailableException.class)
            .hasMessageContaining("connection refused");
        verify(failing, never()).setMetadata(any(), any(), any());
    }

    @Test
    @DisplayName("null RunId는 거부된다")
    void nullRunId_ThrowsException() {
        assertThatThrownBy(() -> controller.requestPause(null))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("runId cannot be null");
        assertThatThrownBy(() -> new DefaultRunController(null))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("store cannot be null");
    }
}
