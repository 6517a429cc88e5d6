package com.ryuqq.runcontrol.core.model;

/**
 * Run 범위의 제어 플래그 이름.
 *
 * <p>플래그는 오케스트레이터가 쓰고 워커가 제어 지점에서 읽는 불리언 신호입니다.</p>
 *
 * <p><strong>정의된 플래그:</strong></p>
 * <ul>
 *   <li>{@link #CANCELLED} - sticky. 한 번 true가 되면 해당 Run이 끝날 때까지 true 유지</li>
 *   <li>{@link #PAUSED} - toggle. true로 일시정지, false로 재개</li>
 * </ul>
 *
 * <p>그 외 이름도 허용되며, 한 번도 쓰이지 않은 플래그는 false로 읽힙니다.</p>
 *
 * <p><strong>유효성 검증:</strong></p>
 * <ul>
 *   <li>null 또는 빈 문자열 불가</li>
 *   <li>길이: 1~64자</li>
 *   <li>패턴: 소문자, 숫자, 언더스코어만 허용 (예: cancelled)</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class FlagName {

    /**
     * 취소 요청 플래그 (sticky).
     */
    public static final FlagName CANCELLED = new FlagName("cancelled", true);

    /**
     * 일시정지 요청 플래그 (toggle).
     */
    public static final FlagName PAUSED = new FlagName("paused", false);

    private final String value;
    private final boolean sticky;

    private FlagName(String value, boolean sticky) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("FlagName cannot be null or blank");
        }
        if (value.length() > 64) {
            throw new IllegalArgumentException("FlagName length cannot exceed 64 characters");
        }
        if (!value.matches("^[a-z0-9_]+$")) {
            throw new IllegalArgumentException("FlagName must contain only lowercase letters, digits and underscores");
        }
        this.value = value;
        this.sticky = sticky;
    }

    /**
     * FlagName 생성.
     *
     * <p>정의된 이름("cancelled", "paused")은 해당 상수를 반환하므로
     * sticky 속성이 항상 유지됩니다.</p>
     *
     * @param value 플래그 이름
     * @return FlagName 인스턴스
     * @throws IllegalArgumentException 유효하지 않은 값인 경우
     */
    public static FlagName of(String value) {
        if (CANCELLED.value.equals(value)) {
            return CANCELLED;
        }
        if (PAUSED.value.equals(value)) {
            return PAUSED;
        }
        return new FlagName(value, false);
    }

    /**
     * FlagName 값 조회.
     *
     * @return 플래그 이름
     */
    public String getValue() {
        return value;
    }

    /**
     * sticky 플래그인지 확인.
     *
     * <p>sticky 플래그는 true → false 전이가 금지됩니다.</p>
     *
     * @return sticky인 경우 true
     */
    public boolean isSticky() {
        return sticky;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        FlagName flagName = (FlagName) o;
        return value.equals(flagName.value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return "FlagName{" + value + '}';
    }
}
