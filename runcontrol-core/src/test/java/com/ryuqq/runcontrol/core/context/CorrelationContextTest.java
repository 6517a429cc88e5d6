package com.ryuqq.runcontrol.core.context;

import com.ryuqq.runcontrol.core.model.CorrelationId;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * CorrelationContext 테스트.
 *
 * <ul>
 *   <li>미설정 시 UNSET 센티널 반환</li>
 *   <li>스코프 종료 시 이전 값 복원</li>
 *   <li>동시 실행 작업 간 격리</li>
 *   <li>MDC 반영</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class CorrelationContextTest {

    @AfterEach
    void tearDown() {
        CorrelationContext.clearCurrent();
        CorrelationContext.clearRun();
    }

    // ===== 기본 동작 =====

    @Test
    void getCurrent_NothingSet_ReturnsUnset() {
        assertThat(CorrelationContext.getCurrent()).isEqualTo(CorrelationId.UNSET);
        assertThat(CorrelationContext.getRun().isUnset()).isTrue();
    }

    @Test
    void setCurrent_MirrorsIntoMdc() {
        // Given
        CorrelationId id = CorrelationId.of("item-1");

        // When
        CorrelationContext.setCurrent(id);

        // Then
        assertThat(CorrelationContext.getCurrent()).isEqualTo(id);
        assertThat(MDC.get(CorrelationContext.MDC_TRACE_ID)).isEqualTo("item-1");
    }

    @Test
    void clearCurrent_RemovesValueAndMdcKey() {
        // Given
        CorrelationContext.setCurrent(CorrelationId.of("item-1"));

        // When
        CorrelationContext.clearCurrent();

        // Then
        assertThat(CorrelationContext.getCurrent().isUnset()).isTrue();
        assertThat(MDC.get(CorrelationContext.MDC_TRACE_ID)).isNull();
    }

    @Test
    void open_NestedScopes_RestorePreviousValue() {
        // Given
        CorrelationId outer = CorrelationId.of("outer");
        CorrelationId inner = CorrelationId.of("inner");

        // When & Then
        try (CorrelationScope outerScope = CorrelationContext.open(outer)) {
            try (CorrelationScope innerScope = CorrelationContext.open(inner)) {
                assertThat(CorrelationContext.getCurrent()).isEqualTo(inner);
            }
            assertThat(CorrelationContext.getCurrent()).isEqualTo(outer);
            assertThat(MDC.get(CorrelationContext.MDC_TRACE_ID)).isEqualTo("outer");
        }
        assertThat(CorrelationContext.getCurrent().isUnset()).isTrue();
    }

    @Test
    void setRun_IndependentOfItemTier() {
        // Given
        CorrelationContext.setRun(CorrelationId.of("run-1"));
        CorrelationContext.setCurrent(CorrelationId.of("item-1"));

        // When
        CorrelationContext.clearCurrent();

        // Then
        assertThat(CorrelationContext.getRun().getValue()).isEqualTo("run-1");
        assertThat(MDC.get(CorrelationContext.MDC_RUN_ID)).isEqualTo("run-1");
    }

    // ===== 동시성 격리 =====

    @Test
    void setCurrent_ConcurrentUnits_NeverSeeEachOthersValue() throws Exception {
        // Given
        int units = 8;
        ExecutorService pool = Executors.newFixedThreadPool(units);
        CountDownLatch allSet = new CountDownLatch(units);
        List<String> mismatches = Collections.synchronizedList(new ArrayList<>());
        List<Future<?>> futures = new ArrayList<>();

        // When
        for (int i = 0; i < units; i++) {
            String value = "item-" + i;
            futures.add(pool.submit(() -> {
                CorrelationContext.setCurrent(CorrelationId.of(value));
                allSet.countDown();
                try {
                    allSet.await(5, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
                if (!value.equals(CorrelationContext.getCurrent().getValue())) {
                    mismatches.add(value);
                }
                CorrelationContext.clearCurrent();
            }));
        }
        for (Future<?> future : futures) {
            future.get(5, TimeUnit.SECONDS);
        }
        pool.shutdown();

        // Then
        assertThat(mismatches).isEmpty();
    }

    @Test
    void clearCurrent_ReusedPoolThread_NextUnitSeesUnset() throws Exception {
        // Given
        ExecutorService pool = Executors.newSingleThreadExecutor();

        // When
        pool.submit(() -> {
            try (CorrelationScope scope = CorrelationContext.open(CorrelationId.of("item-n"))) {
                assertThat(CorrelationContext.getCurrent().getValue()).isEqualTo("item-n");
            }
        }).get(5, TimeUnit.SECONDS);
        CorrelationId observed = pool.submit(CorrelationContext::getCurrent).get(5, TimeUnit.SECONDS);
        pool.shutdown();

        // Then
        assertThat(observed.isUnset()).isTrue();
    }

    // ===== 래핑 =====

    @Test
    void wrap_CarriesRunIdButNotItemId() throws Exception {
        // Given
        CorrelationContext.setRun(CorrelationId.of("run-7"));
        CorrelationContext.setCurrent(CorrelationId.of("item-3"));
        ExecutorService pool = Executors.newSingleThreadExecutor();

        // When
        Callable<String[]> probe = () -> new String[] {
            CorrelationContext.getRun().getValue(),
            CorrelationContext.getCurrent().getValue(),
            MDC.get(CorrelationContext.MDC_RUN_ID)
        };
        String[] observed = pool.submit(CorrelationContext.wrap(probe)).get(5, TimeUnit.SECONDS);
        CorrelationId afterwards = pool.submit(CorrelationContext::getRun).get(5, TimeUnit.SECONDS);
        pool.shutdown();

        // Then
        assertThat(observed).containsExactly("run-7", "unknown", "run-7");
        assertThat(afterwards.isUnset()).isTrue();
    }

    @Test
    void wrap_Runnable_RunsTaskWithCapturedRunId() throws Exception {
        // Given
        CorrelationContext.setRun(CorrelationId.of("run-9"));
        List<String> seen = new ArrayList<>();
        Runnable task = () -> seen.add(CorrelationContext.getRun().getValue());
        Thread thread = new Thread(CorrelationContext.wrap(task));

        // When
        thread.start();
        thread.join(2000);

        // Then
        assertThat(seen).containsExactly("run-9");
    }
}
