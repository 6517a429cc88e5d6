package com.ryuqq.runcontrol.core.model;

import java.util.UUID;

/**
 * Run의 전역 고유 식별자.
 *
 * <p>RunId는 오케스트레이터가 워커 프로세스를 시작하기 전에 발급하며,
 * 제어 저장소의 모든 플래그/상태/메타데이터 키의 네임스페이스로 사용됩니다.</p>
 *
 * <p><strong>불변성:</strong> 생성 후 값 변경 불가</p>
 * <p><strong>유효성 검증:</strong></p>
 * <ul>
 *   <li>null 또는 빈 문자열 불가</li>
 *   <li>길이: 1~255자</li>
 * </ul>
 *
 * <p>값은 불투명한 문자열입니다. 파일 이름이나 Redis 키로 쓸 때의 인코딩은 각 백엔드가 담당합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class RunId {

    private final String value;

    private RunId(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("RunId cannot be null or blank");
        }
        if (value.length() > 255) {
            throw new IllegalArgumentException("RunId length cannot exceed 255 characters");
        }
        this.value = value;
    }

    /**
     * RunId 생성.
     *
     * @param value RunId 값
     * @return RunId 인스턴스
     * @throws IllegalArgumentException 유효하지 않은 값인 경우
     */
    public static RunId of(String value) {
        return new RunId(value);
    }

    /**
     * UUID 기반 RunId 생성.
     *
     * @return 새 RunId
     */
    public static RunId generate() {
        return new RunId(UUID.randomUUID().toString());
    }

    /**
     * RunId 값 조회.
     *
     * @return RunId 값
     */
    public String getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        RunId runId = (RunId) o;
        return value.equals(runId.value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return "RunId{" + value + '}';
    }
}
