package com.ryuqq.runcontrol.application.worker;

/**
 * 독립적으로 실행하거나 건너뛸 수 있는 최소 작업 단위.
 *
 * <p>무엇을 계산하는지는 워커의 관심사이며 이 모듈은 관여하지 않습니다.
 * 실행이 시작된 작업은 취소 요청과 무관하게 끝까지 실행됩니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface WorkItem {

    /**
     * 리포트에 표시될 작업 식별자.
     *
     * @return 작업 ID (non-null)
     */
    String getId();

    /**
     * 작업 실행.
     *
     * @throws Exception 작업 실패 시 (해당 작업만 FAILED 처리)
     */
    void execute() throws Exception;

    /**
     * 람다 기반 WorkItem 생성.
     *
     * @param id 작업 ID
     * @param action 실행 내용
     * @return WorkItem
     * @throws IllegalArgumentException id가 null/blank이거나 action이 null인 경우
     */
    static WorkItem of(String id, Action action) {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("id cannot be null or blank");
        }
        if (action == null) {
            throw new IllegalArgumentException("action cannot be null");
        }
        return new WorkItem() {
            @Override
            public String getId() {
                return id;
            }

            @Override
            public void execute() throws Exception {
                action.run();
            }

            @Override
            public String toString() {
                return "WorkItem{" + id + "}";
            }
        };
    }

    /**
     * checked 예외를 허용하는 실행 내용.
     */
    @FunctionalInterface
    interface Action {
        void run() throws Exception;
    }
}
