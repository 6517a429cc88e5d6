package com.ryuqq.runcontrol.adapter.file;

import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * FileControlStore 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>directory: Run 문서와 락 파일을 저장할 디렉터리 (기본 ${java.io.tmpdir}/runcontrol)</li>
 *   <li>pollIntervalMs: 대기 재확인 주기 (기본 500ms)</li>
 * </ul>
 *
 * <p>오케스트레이터와 워커는 같은 호스트에서 같은 directory를 바라봐야 합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 * @param directory 저장 디렉터리 (null이 아니어야 함)
 * @param pollIntervalMs 대기 재확인 주기 (밀리초, 양수여야 함)
 */
public record FileStoreConfig(
    Path directory,
    long pollIntervalMs
) {

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: directory=${java.io.tmpdir}/runcontrol, pollIntervalMs=500ms</p>
     */
    public FileStoreConfig() {
        this(Paths.get(System.getProperty("java.io.tmpdir"), "runcontrol"), 500);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public FileStoreConfig {
        if (directory == null) {
            throw new IllegalArgumentException("directory cannot be null");
        }
        if (pollIntervalMs <= 0) {
            throw new IllegalArgumentException(
                "pollIntervalMs must be positive (current: " + pollIntervalMs + ")"
            );
        }
    }

    /**
     * directory만 변경한 새 인스턴스 생성.
     */
    public FileStoreConfig withDirectory(Path directory) {
        return new FileStoreConfig(directory, pollIntervalMs);
    }

    /**
     * pollIntervalMs만 변경한 새 인스턴스 생성.
     */
    public FileStoreConfig withPollIntervalMs(long pollIntervalMs) {
        return new FileStoreConfig(directory, pollIntervalMs);
    }
}
