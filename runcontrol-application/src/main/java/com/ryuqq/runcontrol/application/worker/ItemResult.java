package com.ryuqq.runcontrol.application.worker;

import java.time.Duration;

/**
 * 작업 단위 실행 결과.
 *
 * <p><strong>불변성:</strong> 생성 후 변경 불가</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class ItemResult {

    private final String itemId;
    private final ItemState state;
    private final ControlPoint skippedAtOrNull;
    private final String errorMessageOrNull;
    private final Duration duration;

    private ItemResult(String itemId, ItemState state, ControlPoint skippedAtOrNull,
                       String errorMessageOrNull, Duration duration) {
        if (itemId == null) {
            throw new IllegalArgumentException("itemId cannot be null");
        }
        if (state == null) {
            throw new IllegalArgumentException("state cannot be null");
        }
        if (duration == null || duration.isNegative()) {
            throw new IllegalArgumentException("duration cannot be null or negative");
        }
        this.itemId = itemId;
        this.state = state;
        this.skippedAtOrNull = skippedAtOrNull;
        this.errorMessageOrNull = errorMessageOrNull;
        this.duration = duration;
    }

    /**
     * 성공 결과.
     *
     * @param itemId 작업 ID
     * @param duration 실행 시간
     * @return PASSED 결과
     */
    public static ItemResult passed(String itemId, Duration duration) {
        return new ItemResult(itemId, ItemState.PASSED, null, null, duration);
    }

    /**
     * 실패 결과.
     *
     * @param itemId 작업 ID
     * @param errorMessage 실패 메시지
     * @param duration 실행 시간
     * @return FAILED 결과
     */
    public static ItemResult failed(String itemId, String errorMessage, Duration duration) {
        return new ItemResult(itemId, ItemState.FAILED, null, errorMessage, duration);
    }

    /**
     * 취소로 건너뛴 결과.
     *
     * @param itemId 작업 ID
     * @param skippedAt 건너뛰기를 결정한 컨트롤 포인트 (COLLECTION 또는 BEFORE_ITEM)
     * @return SKIPPED_CANCELLED 결과
     * @throws IllegalArgumentException skippedAt이 null인 경우
     */
    public static ItemResult skipped(String itemId, ControlPoint skippedAt) {
        if (skippedAt == null) {
            throw new IllegalArgumentException("skippedAt cannot be null");
        }
        return new ItemResult(itemId, ItemState.SKIPPED_CANCELLED, skippedAt, null, Duration.ZERO);
    }

    public String getItemId() {
        return itemId;
    }

    public ItemState getState() {
        return state;
    }

    /**
     * 건너뛰기를 결정한 컨트롤 포인트.
     *
     * @return 컨트롤 포인트, 건너뛰지 않았으면 null
     */
    public ControlPoint getSkippedAtOrNull() {
        return skippedAtOrNull;
    }

    public String getErrorMessageOrNull() {
        return errorMessageOrNull;
    }

    public Duration getDuration() {
        return duration;
    }

    @Override
    public String toString() {
        return switch (state) {
            case PASSED -> "ItemResult{" + itemId + ", PASSED, " + duration.toMillis() + "ms}";
            case FAILED -> "ItemResult{" + itemId + ", FAILED, error=" + errorMessageOrNull + "}";
            case SKIPPED_CANCELLED -> "ItemResult{" + itemId + ", SKIPPED_CANCELLED at " + skippedAtOrNull + "}";
        };
    }
}
