package com.ryuqq.runcontrol.adapter.runner;

import com.ryuqq.runcontrol.application.worker.ControlPointInterceptor;
import com.ryuqq.runcontrol.core.model.RunId;
import com.ryuqq.runcontrol.core.spi.ControlStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;
import java.util.function.Function;

/**
 * 워커 프로세스의 RunId 해석기.
 *
 * <p><strong>해석 순서:</strong></p>
 * <ol>
 *   <li>명령행 인자 {@code --run-id <id>} 또는 {@code --run-id=<id>}</li>
 *   <li>환경 변수 {@value #ENV_VARIABLE}</li>
 * </ol>
 *
 * <p>둘 다 없으면 워커는 uncontrolled 모드로 실행됩니다 (제어 신호 무시).
 * 이 경우 경고는 {@link #createInterceptor}에서 한 번만 남깁니다.</p>
 *
 * <p>빈 값은 없는 것으로 간주합니다. 형식이 잘못된 RunId는
 * {@link IllegalArgumentException}으로 실패합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class RunIdResolver {

    private static final Logger log = LoggerFactory.getLogger(RunIdResolver.class);

    /**
     * 명령행 인자 이름.
     */
    public static final String ARGUMENT = "--run-id";

    /**
     * 환경 변수 이름.
     */
    public static final String ENV_VARIABLE = "RUNCONTROL_RUN_ID";

    private final Function<String, String> environment;

    /**
     * 생성자 (프로세스 환경 변수 사용).
     */
    public RunIdResolver() {
        this(System::getenv);
    }

    /**
     * 생성자 (환경 변수 조회 주입).
     *
     * @param environment 환경 변수 조회 함수 (없으면 null 반환)
     * @throws IllegalArgumentException environment가 null인 경우
     */
    public RunIdResolver(Function<String, String> environment) {
        if (environment == null) {
            throw new IllegalArgumentException("environment cannot be null");
        }
        this.environment = environment;
    }

    /**
     * RunId 해석.
     *
     * @param args 명령행 인자 (null 가능)
     * @return RunId, 해석 불가 시 empty
     * @throws IllegalArgumentException 값이 RunId 형식이 아닌 경우
     */
    public Optional<RunId> resolve(String[] args) {
        String fromArgs = fromArguments(args);
        if (fromArgs != null) {
            return Optional.of(RunId.of(fromArgs));
        }

        String fromEnv = environment.apply(ENV_VARIABLE);
        if (fromEnv != null && !fromEnv.isBlank()) {
            return Optional.of(RunId.of(fromEnv.trim()));
        }
        return Optional.empty();
    }

    /**
     * RunId 해석 결과에 맞는 ControlPointInterceptor 생성.
     *
     * <p>RunId가 없으면 WARN 로그 한 줄을 남기고
     * {@link UncontrolledControlPointInterceptor}를 반환합니다.</p>
     *
     * @param args 명령행 인자 (null 가능)
     * @param store 컨트롤 스토어
     * @param config 워커 설정
     * @return interceptor
     * @throws IllegalArgumentException store 또는 config가 null인 경우
     */
    public ControlPointInterceptor createInterceptor(String[] args, ControlStore store, WorkerConfig config) {
        if (store == null) {
            throw new IllegalArgumentException("store cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }

        Optional<RunId> runId = resolve(args);
        if (runId.isEmpty()) {
            log.warn("No run id given ({} or {}), running uncontrolled",
                ARGUMENT, ENV_VARIABLE);
            return new UncontrolledControlPointInterceptor();
        }

        log.info("Worker controlled by run {}", runId.get().getValue());
        return new StoreBackedControlPointInterceptor(store, runId.get(), config);
    }

    private String fromArguments(String[] args) {
        if (args == null) {
            return null;
        }
        String prefix = ARGUMENT + "=";
        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            if (arg == null) {
                continue;
            }
            if (arg.startsWith(prefix)) {
                String value = arg.substring(prefix.length()).trim();
                if (!value.isEmpty()) {
                    return value;
                }
            } else if (arg.equals(ARGUMENT) && i + 1 < args.length && args[i + 1] != null) {
                String value = args[i + 1].trim();
                if (!value.isEmpty() && !value.startsWith("--")) {
                    return value;
                }
            }
        }
        return null;
    }
}
