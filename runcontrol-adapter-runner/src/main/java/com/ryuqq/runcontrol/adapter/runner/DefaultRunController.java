package com.ryuqq.runcontrol.adapter.runner;

import com.ryuqq.runcontrol.application.controller.RunController;
import com.ryuqq.runcontrol.application.controller.RunHandle;
import com.ryuqq.runcontrol.application.controller.RunMetadataKeys;
import com.ryuqq.runcontrol.core.model.FlagName;
import com.ryuqq.runcontrol.core.model.RunId;
import com.ryuqq.runcontrol.core.spi.ControlStore;
import com.ryuqq.runcontrol.core.statemachine.RunStatus;
import com.ryuqq.runcontrol.core.wait.FlagPoller;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * ControlStore 기반 RunController 구현체.
 *
 * <p>모든 요청은 ControlStore 쓰기로 변환됩니다. 쓰기 실패
 * ({@link com.ryuqq.runcontrol.core.spi.StoreUnavailableException})는 그대로 전파됩니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * RunController controller = new DefaultRunController(store);
 * RunId runId = controller.createRun();
 * controller.requestCancel(runId, "user aborted");
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class DefaultRunController implements RunController {

    private static final Logger log = LoggerFactory.getLogger(DefaultRunController.class);

    private final ControlStore store;
    private final FlagPoller poller;
    private final Clock clock;

    /**
     * 생성자 (기본 폴링 간격 500ms, UTC 시계).
     *
     * @param store 컨트롤 스토어
     * @throws IllegalArgumentException store가 null인 경우
     */
    public DefaultRunController(ControlStore store) {
        this(store, FlagPoller.DEFAULT_POLL_INTERVAL, Clock.systemUTC());
    }

    /**
     * 생성자.
     *
     * @param store 컨트롤 스토어
     * @param pollInterval awaitTerminal 폴링 간격
     * @param clock created_at 기록용 시계
     * @throws IllegalArgumentException 인자가 null이거나 pollInterval이 양수가 아닌 경우
     */
    public DefaultRunController(ControlStore store, Duration pollInterval, Clock clock) {
        if (store == null) {
            throw new IllegalArgumentException("store cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.store = store;
        this.poller = new FlagPoller(pollInterval);
        this.clock = clock;
    }

    @Override
    public RunId createRun() {
        return createRun(RunId.generate());
    }

    @Override
    public RunId createRun(RunId runId) {
        requireRunId(runId);

        store.setStatus(runId, RunStatus.PENDING);
        if (store.getMetadata(runId, RunMetadataKeys.CREATED_AT).isEmpty()) {
            store.setMetadata(runId, RunMetadataKeys.CREATED_AT, clock.instant().toString());
        }
        log.info("Run {} created", runId.getValue());
        return runId;
    }

    @Override
    public void requestCancel(RunId runId, String reason) {
        requireRunId(runId);

        store.setFlag(runId, FlagName.CANCELLED, true);
        if (reason != null && !reason.isBlank()) {
            store.setMetadata(runId, RunMetadataKeys.CANCEL_REASON, reason);
        }
        log.info("Cancel requested for {}{}", runId.getValue(), reason == null ? "" : ": " + reason);
    }

    @Override
    public void requestPause(RunId runId) {
        requireRunId(runId);
        store.setFlag(runId, FlagName.PAUSED, true);
        log.info("Pause requested for {}", runId.getValue());
    }

    @Override
    public void requestResume(RunId runId) {
        requireRunId(runId);
        store.setFlag(runId, FlagName.PAUSED, false);
        log.info("Resume requested for {}", runId.getValue());
    }

    @Override
    public Optional<RunStatus> queryStatus(RunId runId) {
        requireRunId(runId);
        return store.getStatus(runId);
    }

    @Override
    public boolean isCancelled(RunId runId) {
        requireRunId(runId);
        return store.checkFlag(runId, FlagName.CANCELLED);
    }

    @Override
    public boolean isPaused(RunId runId) {
        requireRunId(runId);
        return store.checkFlag(runId, FlagName.PAUSED);
    }

    @Override
    public RunHandle describe(RunId runId) {
        requireRunId(runId);

        return RunHandle.builder(runId)
            .status(store.getStatus(runId).orElse(null))
            .cancelled(store.checkFlag(runId, FlagName.CANCELLED))
            .paused(store.checkFlag(runId, FlagName.PAUSED))
            .createdAt(parseInstant(runId, store.getMetadata(runId, RunMetadataKeys.CREATED_AT)))
            .cancelReason(store.getMetadata(runId, RunMetadataKeys.CANCEL_REASON).orElse(null))
            .workerHost(store.getMetadata(runId, RunMetadataKeys.WORKER_HOST).orElse(null))
            .build();
    }

    @Override
    public Optional<RunStatus> awaitTerminal(RunId runId, Duration timeout) {
        requireRunId(runId);

        AtomicReference<RunStatus> terminal = new AtomicReference<>();
        boolean reached = poller.await(() -> {
            Optional<RunStatus> status = store.getStatus(runId);
            if (status.isPresent() && status.get().isTerminal()) {
                terminal.set(status.get());
                return true;
            }
            return false;
        }, timeout);

        return reached ? Optional.of(terminal.get()) : Optional.empty();
    }

    @Override
    public boolean purgeIfTerminal(RunId runId) {
        requireRunId(runId);

        Optional<RunStatus> status = store.getStatus(runId);
        if (status.isEmpty() || !status.get().isTerminal()) {
            log.debug("Run {} not purged: status {}", runId.getValue(), status.orElse(null));
            return false;
        }
        store.purge(runId);
        log.info("Run {} purged ({})", runId.getValue(), status.get());
        return true;
    }

    private Instant parseInstant(RunId runId, Optional<String> value) {
        if (value.isEmpty()) {
            return null;
        }
        try {
            return Instant.parse(value.get());
        } catch (DateTimeParseException e) {
            log.warn("Ignoring malformed {} for {}: {}", RunMetadataKeys.CREATED_AT, runId.getValue(), value.get());
            return null;
        }
    }

    private static void requireRunId(RunId runId) {
        if (runId == null) {
            throw new IllegalArgumentException("runId cannot be null");
        }
    }
}
