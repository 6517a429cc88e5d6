package com.ryuqq.runcontrol.core.model;

import java.util.UUID;

/**
 * 로그/진단 출력을 Run 또는 작업 단위로 묶는 상관관계 식별자.
 *
 * <p>설정되지 않은 상태는 {@link #UNSET} 센티널("unknown")로 표현하며,
 * null을 반환하지 않습니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class CorrelationId {

    /**
     * 미설정 센티널.
     */
    public static final CorrelationId UNSET = new CorrelationId("unknown");

    private final String value;

    private CorrelationId(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("CorrelationId cannot be null or blank");
        }
        if (value.length() > 255) {
            throw new IllegalArgumentException("CorrelationId length cannot exceed 255 characters");
        }
        this.value = value;
    }

    /**
     * CorrelationId 생성.
     *
     * @param value 식별자 값
     * @return CorrelationId 인스턴스
     * @throws IllegalArgumentException 유효하지 않은 값인 경우
     */
    public static CorrelationId of(String value) {
        return new CorrelationId(value);
    }

    /**
     * UUID 기반 CorrelationId 생성.
     *
     * @return 새 CorrelationId
     */
    public static CorrelationId generate() {
        return new CorrelationId(UUID.randomUUID().toString());
    }

    /**
     * 식별자 값 조회.
     *
     * @return 식별자 값
     */
    public String getValue() {
        return value;
    }

    /**
     * 미설정 센티널인지 확인.
     *
     * @return {@link #UNSET}인 경우 true
     */
    public boolean isUnset() {
        return UNSET.value.equals(value);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        CorrelationId that = (CorrelationId) o;
        return value.equals(that.value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return value;
    }
}
