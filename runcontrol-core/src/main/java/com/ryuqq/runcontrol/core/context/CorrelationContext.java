package com.ryuqq.runcontrol.core.context;

import com.ryuqq.runcontrol.core.model.CorrelationId;
import org.slf4j.MDC;

import java.util.concurrent.Callable;

/**
 * 스레드 단위 상관관계 ID 컨텍스트.
 *
 * <p>두 계층을 관리합니다:</p>
 * <ul>
 *   <li><strong>Run 계층:</strong> Run 전체에 걸쳐 고정된 식별자 (MDC 키 {@value #MDC_RUN_ID})</li>
 *   <li><strong>Item 계층:</strong> 작업 단위마다 새로 생성되는 식별자 (MDC 키 {@value #MDC_TRACE_ID})</li>
 * </ul>
 *
 * <p>값은 호출 스레드에만 보이며, 동시에 실행되는 다른 작업 단위로 새지 않습니다.
 * 설정된 값은 SLF4J MDC에도 반영되어 로그 라인마다 식별자가 그대로 출력됩니다.</p>
 *
 * <p><strong>스레드 재사용 주의:</strong> 풀 스레드에서 실행되는 작업 단위는
 * 종료 시점에 반드시 {@link #clearCurrent()}를 호출하거나
 * {@link #open(CorrelationId)}의 try-with-resources를 사용해야 합니다.</p>
 *
 * <pre>
 * try (CorrelationScope scope = CorrelationContext.open(CorrelationId.generate())) {
 *     // 중첩 호출 어디서든 조회 가능
 *     String header = CorrelationContext.getCurrent().getValue();
 * }
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class CorrelationContext {

    /**
     * Run 계층 MDC 키.
     */
    public static final String MDC_RUN_ID = "runId";

    /**
     * Item 계층 MDC 키.
     */
    public static final String MDC_TRACE_ID = "traceId";

    private static final ThreadLocal<CorrelationId> CURRENT = new ThreadLocal<>();
    private static final ThreadLocal<CorrelationId> RUN = new ThreadLocal<>();

    private CorrelationContext() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 현재 스레드의 작업 단위 식별자 설정.
     *
     * @param id 식별자
     * @throws IllegalArgumentException id가 null인 경우
     */
    public static void setCurrent(CorrelationId id) {
        if (id == null) {
            throw new IllegalArgumentException("id cannot be null");
        }
        CURRENT.set(id);
        MDC.put(MDC_TRACE_ID, id.getValue());
    }

    /**
     * 현재 스레드의 작업 단위 식별자 조회.
     *
     * @return 식별자, 미설정이면 {@link CorrelationId#UNSET}
     */
    public static CorrelationId getCurrent() {
        CorrelationId id = CURRENT.get();
        return id == null ? CorrelationId.UNSET : id;
    }

    /**
     * 현재 스레드의 작업 단위 식별자 제거.
     */
    public static void clearCurrent() {
        CURRENT.remove();
        MDC.remove(MDC_TRACE_ID);
    }

    /**
     * 작업 단위 식별자를 설정하고, 닫으면 이전 값을 복원하는 스코프를 반환.
     *
     * @param id 식별자
     * @return 이전 값을 복원하는 스코프
     * @throws IllegalArgumentException id가 null인 경우
     */
    public static CorrelationScope open(CorrelationId id) {
        CorrelationId previous = CURRENT.get();
        setCurrent(id);
        return () -> {
            if (previous == null) {
                clearCurrent();
            } else {
                setCurrent(previous);
            }
        };
    }

    /**
     * 현재 스레드의 Run 식별자 설정.
     *
     * @param id Run 식별자
     * @throws IllegalArgumentException id가 null인 경우
     */
    public static void setRun(CorrelationId id) {
        if (id == null) {
            throw new IllegalArgumentException("id cannot be null");
        }
        RUN.set(id);
        MDC.put(MDC_RUN_ID, id.getValue());
    }

    /**
     * 현재 스레드의 Run 식별자 조회.
     *
     * @return Run 식별자, 미설정이면 {@link CorrelationId#UNSET}
     */
    public static CorrelationId getRun() {
        CorrelationId id = RUN.get();
        return id == null ? CorrelationId.UNSET : id;
    }

    /**
     * 현재 스레드의 Run 식별자 제거.
     */
    public static void clearRun() {
        RUN.remove();
        MDC.remove(MDC_RUN_ID);
    }

    /**
     * 호출 시점의 Run 식별자를 실행 스레드로 옮기는 Runnable 래핑.
     *
     * <p>작업 단위 식별자는 옮기지 않습니다. 실행 후 실행 스레드의 Run 식별자는
     * 이전 값으로 복원됩니다.</p>
     *
     * @param task 원본 작업
     * @return 래핑된 작업
     * @throws IllegalArgumentException task가 null인 경우
     */
    public static Runnable wrap(Runnable task) {
        if (task == null) {
            throw new IllegalArgumentException("task cannot be null");
        }
        CorrelationId captured = RUN.get();
        return () -> {
            CorrelationId previous = RUN.get();
            applyRun(captured);
            try {
                task.run();
            } finally {
                applyRun(previous);
            }
        };
    }

    /**
     * 호출 시점의 Run 식별자를 실행 스레드로 옮기는 Callable 래핑.
     *
     * @param task 원본 작업
     * @param <T> 결과 타입
     * @return 래핑된 작업
     * @throws IllegalArgumentException task가 null인 경우
     */
    public static <T> Callable<T> wrap(Callable<T> task) {
        if (task == null) {
            throw new IllegalArgumentException("task cannot be null");
        }
        CorrelationId captured = RUN.get();
        return () -> {
            CorrelationId previous = RUN.get();
            applyRun(captured);
            try {
                return task.call();
            } finally {
                applyRun(previous);
            }
        };
    }

    private static void applyRun(CorrelationId id) {
        if (id == null) {
            clearRun();
        } else {
            setRun(id);
        }
    }
}
