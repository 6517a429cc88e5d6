package com.ryuqq.runcontrol.cli;

import com.ryuqq.runcontrol.adapter.runner.DefaultRunController;
import com.ryuqq.runcontrol.adapter.runner.RunIdResolver;
import com.ryuqq.runcontrol.adapter.runner.WorkItemRunner;
import com.ryuqq.runcontrol.adapter.runner.WorkerConfig;
import com.ryuqq.runcontrol.application.controller.RunController;
import com.ryuqq.runcontrol.application.controller.RunHandle;
import com.ryuqq.runcontrol.application.worker.ControlPointInterceptor;
import com.ryuqq.runcontrol.application.worker.ItemResult;
import com.ryuqq.runcontrol.application.worker.RunReport;
import com.ryuqq.runcontrol.application.worker.WorkItem;
import com.ryuqq.runcontrol.core.model.RunId;
import com.ryuqq.runcontrol.core.spi.ControlStore;
import com.ryuqq.runcontrol.core.spi.StoreUnavailableException;
import com.ryuqq.runcontrol.core.statemachine.RunStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

import java.io.PrintWriter;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Callable;

/**
 * runctl: 오케스트레이터 측 Run 제어 CLI.
 *
 * <p>워커와 같은 ControlStore(파일 또는 Redis)에 제어 신호를 기록합니다.</p>
 *
 * <p><strong>종료 코드:</strong></p>
 * <ul>
 *   <li>0: 성공</li>
 *   <li>1: 요청 거부 (허용되지 않는 상태 전이, Run 실패)</li>
 *   <li>2: 잘못된 사용법</li>
 *   <li>3: 아직 종료되지 않은 Run (대기 타임아웃, 삭제 보류, 알 수 없는 Run)</li>
 *   <li>4: 스토어 연결 실패</li>
 * </ul>
 *
 * <pre>
 * runctl create
 * runctl --store=redis --redis-host=cache.internal pause run-42
 * runctl await run-42 --timeout-ms=60000
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
@Command(
    name = "runctl",
    mixinStandardHelpOptions = true,
    version = "runctl 1.0.0",
    description = "Pause, resume or cancel a worker run through the shared control store",
    subcommands = {
        RunCtlCommand.CreateCommand.class,
        RunCtlCommand.CancelCommand.class,
        RunCtlCommand.PauseCommand.class,
        RunCtlCommand.ResumeCommand.class,
        RunCtlCommand.StatusCommand.class,
        RunCtlCommand.AwaitCommand.class,
        RunCtlCommand.PurgeCommand.class,
        RunCtlCommand.WorkerCommand.class
    }
)
public final class RunCtlCommand implements Runnable {

    public static final int EXIT_OK = 0;
    public static final int EXIT_REJECTED = 1;
    public static final int EXIT_NOT_READY = 3;
    public static final int EXIT_STORE_UNAVAILABLE = 4;

    private static final Logger log = LoggerFactory.getLogger(RunCtlCommand.class);

    @Mixin
    StoreOptions storeOptions;

    @Spec
    CommandSpec spec;

    private final StoreFactory storeFactory;
    private final RunIdResolver runIdResolver;

    /**
     * 기본 생성자 (프로세스 환경 변수 사용).
     */
    public RunCtlCommand() {
        this(new StoreFactory(), new RunIdResolver());
    }

    /**
     * 생성자.
     *
     * @param storeFactory 스토어 팩토리
     * @param runIdResolver worker 서브커맨드용 RunId 해석기
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public RunCtlCommand(StoreFactory storeFactory, RunIdResolver runIdResolver) {
        if (storeFactory == null) {
            throw new IllegalArgumentException("storeFactory cannot be null");
        }
        if (runIdResolver == null) {
            throw new IllegalArgumentException("runIdResolver cannot be null");
        }
        this.storeFactory = storeFactory;
        this.runIdResolver = runIdResolver;
    }

    public static void main(String[] args) {
        System.exit(newCommandLine(new RunCtlCommand()).execute(args));
    }

    /**
     * 변환기와 예외 처리기가 등록된 CommandLine 생성.
     *
     * @param command 최상위 커맨드
     * @return CommandLine
     */
    public static CommandLine newCommandLine(RunCtlCommand command) {
        CommandLine commandLine = new CommandLine(command);
        commandLine.setCaseInsensitiveEnumValuesAllowed(true);
        commandLine.registerConverter(RunId.class, RunId::of);
        commandLine.setExecutionExceptionHandler((ex, cmd, parseResult) -> {
            if (ex instanceof StoreUnavailableException) {
                log.debug("Store unavailable", ex);
                cmd.getErr().println("store unavailable: " + ex.getMessage());
                return EXIT_STORE_UNAVAILABLE;
            }
            if (ex instanceof IllegalStateException || ex instanceof IllegalArgumentException) {
                cmd.getErr().println("rejected: " + ex.getMessage());
                return EXIT_REJECTED;
            }
            throw ex;
        });
        return commandLine;
    }

    @Override
    public void run() {
        spec.commandLine().usage(spec.commandLine().getOut());
    }

    ControlStore openStore() {
        return storeFactory.open(storeOptions);
    }

    RunController controller(ControlStore store) {
        return new DefaultRunController(store, Duration.ofMillis(storeOptions.pollIntervalMs), Clock.systemUTC());
    }

    // ============================================================
    // 서브커맨드
    // ============================================================

    @Command(name = "create", description = "Create a run (status PENDING) and print its id")
    static final class CreateCommand implements Callable<Integer> {
        @ParentCommand
        RunCtlCommand parent;

        @Spec
        CommandSpec spec;

        @Option(names = {"--run-id"}, description = "Run id to use (generated when omitted)")
        RunId runId;

        @Override
        public Integer call() {
            try (ControlStore store = parent.openStore()) {
                RunController controller = parent.controller(store);
                RunId created = runId == null ? controller.createRun() : controller.createRun(runId);
                spec.commandLine().getOut().println(created.getValue());
                return EXIT_OK;
            }
        }
    }

    @Command(name = "cancel", description = "Request cancellation (irreversible)")
    static final class CancelCommand implements Callable<Integer> {
        @ParentCommand
        RunCtlCommand parent;

        @Spec
        CommandSpec spec;

        @Parameters(index = "0", description = "Run id")
        RunId runId;

        @Option(names = {"--reason"}, description = "Cancellation reason")
        String reason;

        @Override
        public Integer call() {
            try (ControlStore store = parent.openStore()) {
                parent.controller(store).requestCancel(runId, reason);
                spec.commandLine().getOut().println("cancel requested: " + runId.getValue());
                return EXIT_OK;
            }
        }
    }

    @Command(name = "pause", description = "Request pause before the next work item")
    static final class PauseCommand implements Callable<Integer> {
        @ParentCommand
        RunCtlCommand parent;

        @Spec
        CommandSpec spec;

        @Parameters(index = "0", description = "Run id")
        RunId runId;

        @Override
        public Integer call() {
            try (ControlStore store = parent.openStore()) {
                parent.controller(store).requestPause(runId);
                spec.commandLine().getOut().println("pause requested: " + runId.getValue());
                return EXIT_OK;
            }
        }
    }

    @Command(name = "resume", description = "Resume a paused run")
    static final class ResumeCommand implements Callable<Integer> {
        @ParentCommand
        RunCtlCommand parent;

        @Spec
        CommandSpec spec;

        @Parameters(index = "0", description = "Run id")
        RunId runId;

        @Override
        public Integer call() {
            try (ControlStore store = parent.openStore()) {
                parent.controller(store).requestResume(runId);
                spec.commandLine().getOut().println("resume requested: " + runId.getValue());
                return EXIT_OK;
            }
        }
    }

    @Command(name = "status", description = "Show status, flags and metadata of a run")
    static final class StatusCommand implements Callable<Integer> {
        @ParentCommand
        RunCtlCommand parent;

        @Spec
        CommandSpec spec;

        @Parameters(index = "0", description = "Run id")
        RunId runId;

        @Override
        public Integer call() {
            try (ControlStore store = parent.openStore()) {
                RunHandle handle = parent.controller(store).describe(runId);
                PrintWriter out = spec.commandLine().getOut();
                out.println("run_id: " + handle.getRunId().getValue());
                out.println("status: " + (handle.getStatusOrNull() == null ? "UNKNOWN" : handle.getStatusOrNull()));
                out.println("cancelled: " + handle.isCancelled());
                out.println("paused: " + handle.isPaused());
                printIfPresent(out, "created_at", handle.getCreatedAtOrNull());
                printIfPresent(out, "cancel_reason", handle.getCancelReasonOrNull());
                printIfPresent(out, "worker_host", handle.getWorkerHostOrNull());
                return handle.getStatusOrNull() == null ? EXIT_NOT_READY : EXIT_OK;
            }
        }

        private static void printIfPresent(PrintWriter out, String key, Object value) {
            if (value != null) {
                out.println(key + ": " + value);
            }
        }
    }

    @Command(name = "await", description = "Wait until the run reaches COMPLETED or FAILED")
    static final class AwaitCommand implements Callable<Integer> {
        @ParentCommand
        RunCtlCommand parent;

        @Spec
        CommandSpec spec;

        @Parameters(index = "0", description = "Run id")
        RunId runId;

        @Option(names = {"--timeout-ms"}, defaultValue = "0",
            description = "Maximum wait in ms, 0 waits forever (default: ${DEFAULT-VALUE})")
        long timeoutMs;

        @Override
        public Integer call() {
            if (timeoutMs < 0) {
                throw new IllegalArgumentException("timeout-ms cannot be negative (current: " + timeoutMs + ")");
            }
            try (ControlStore store = parent.openStore()) {
                Duration timeout = timeoutMs == 0 ? null : Duration.ofMillis(timeoutMs);
                Optional<RunStatus> terminal = parent.controller(store).awaitTerminal(runId, timeout);
                if (terminal.isEmpty()) {
                    spec.commandLine().getOut().println("timeout");
                    return EXIT_NOT_READY;
                }
                spec.commandLine().getOut().println(terminal.get());
                return terminal.get() == RunStatus.COMPLETED ? EXIT_OK : EXIT_REJECTED;
            }
        }
    }

    @Command(name = "purge", description = "Delete all state of a finished run")
    static final class PurgeCommand implements Callable<Integer> {
        @ParentCommand
        RunCtlCommand parent;

        @Spec
        CommandSpec spec;

        @Parameters(index = "0", description = "Run id")
        RunId runId;

        @Override
        public Integer call() {
            try (ControlStore store = parent.openStore()) {
                if (parent.controller(store).purgeIfTerminal(runId)) {
                    spec.commandLine().getOut().println("purged: " + runId.getValue());
                    return EXIT_OK;
                }
                spec.commandLine().getOut().println("not terminal, kept: " + runId.getValue());
                return EXIT_NOT_READY;
            }
        }
    }

    @Command(name = "worker", description = "Run sample work items under run control (for manual testing)")
    static final class WorkerCommand implements Callable<Integer> {
        @ParentCommand
        RunCtlCommand parent;

        @Spec
        CommandSpec spec;

        @Option(names = {"--run-id"}, description = "Run id (falls back to " + RunIdResolver.ENV_VARIABLE + ")")
        String runId;

        @Option(names = {"--items"}, defaultValue = "5", description = "Number of work items (default: ${DEFAULT-VALUE})")
        int items;

        @Option(names = {"--item-delay-ms"}, defaultValue = "1000",
            description = "Time each item takes in ms (default: ${DEFAULT-VALUE})")
        long itemDelayMs;

        @Option(names = {"--concurrency"}, defaultValue = "1", description = "Items run in parallel (default: ${DEFAULT-VALUE})")
        int concurrency;

        @Option(names = {"--pause-timeout-ms"}, defaultValue = "0",
            description = "Give up waiting for resume after this many ms, 0 waits forever (default: ${DEFAULT-VALUE})")
        long pauseTimeoutMs;

        @Override
        public Integer call() throws Exception {
            WorkerConfig config = new WorkerConfig()
                .withConcurrency(concurrency)
                .withPauseTimeoutMs(pauseTimeoutMs);
            String[] args = runId == null ? new String[0] : new String[]{RunIdResolver.ARGUMENT, runId};

            try (ControlStore store = parent.openStore()) {
                ControlPointInterceptor interceptor = parent.runIdResolver.createInterceptor(args, store, config);
                WorkItemRunner runner = new WorkItemRunner(interceptor, config);
                RunReport report;
                try {
                    report = runner.run(sampleItems());
                } finally {
                    runner.shutdown();
                }

                PrintWriter out = spec.commandLine().getOut();
                for (ItemResult result : report.getResults()) {
                    out.println(result.getItemId() + " " + result.getState());
                }
                out.println(report.getOverallStatus());
                return report.getOverallStatus() == RunStatus.COMPLETED ? EXIT_OK : EXIT_REJECTED;
            }
        }

        private List<WorkItem> sampleItems() {
            if (items < 0) {
                throw new IllegalArgumentException("items cannot be negative (current: " + items + ")");
            }
            List<WorkItem> workItems = new ArrayList<>(items);
            for (int i = 1; i <= items; i++) {
                String id = "item-" + i;
                workItems.add(WorkItem.of(id, () -> {
                    log.info("Processing {}", id);
                    Thread.sleep(itemDelayMs);
                }));
            }
            return workItems;
        }
    }
}
