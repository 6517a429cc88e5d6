package com.ryuqq.runcontrol.adapter.redis;

/**
 * RedisControlStore 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>host / port: Redis 서버 (기본 localhost:6379)</li>
 *   <li>username / password: 인증 정보 (null이면 인증 없음)</li>
 *   <li>ssl: TLS 사용 여부 (기본 false)</li>
 *   <li>database: DB 인덱스 (기본 0)</li>
 *   <li>keyPrefix: 키 접두사 (기본 "runcontrol")</li>
 *   <li>pollIntervalMs: 대기 재확인 주기 (기본 500ms)</li>
 *   <li>commandTimeoutMs: 명령 타임아웃 (기본 10000ms)</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 * @param host Redis 호스트 (blank 불가)
 * @param port Redis 포트 (1~65535)
 * @param username 사용자명 (null 가능)
 * @param password 비밀번호 (null 가능)
 * @param ssl TLS 사용 여부
 * @param database DB 인덱스 (0 이상)
 * @param keyPrefix 키 접두사 (blank 불가)
 * @param pollIntervalMs 대기 재확인 주기 (밀리초, 양수여야 함)
 * @param commandTimeoutMs 명령 타임아웃 (밀리초, 양수여야 함)
 */
public record RedisStoreConfig(
    String host,
    int port,
    String username,
    String password,
    boolean ssl,
    int database,
    String keyPrefix,
    long pollIntervalMs,
    long commandTimeoutMs
) {

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: localhost:6379, 인증 없음, ssl=false, database=0, keyPrefix="runcontrol",
     * pollIntervalMs=500ms, commandTimeoutMs=10000ms</p>
     */
    public RedisStoreConfig() {
        this("localhost", 6379, null, null, false, 0, "runcontrol", 500, 10000);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public RedisStoreConfig {
        if (host == null || host.isBlank()) {
            throw new IllegalArgumentException("host cannot be null or blank");
        }
        if (port <= 0 || port > 65535) {
            throw new IllegalArgumentException("port must be between 1 and 65535 (current: " + port + ")");
        }
        if (database < 0) {
            throw new IllegalArgumentException("database cannot be negative (current: " + database + ")");
        }
        if (keyPrefix == null || keyPrefix.isBlank()) {
            throw new IllegalArgumentException("keyPrefix cannot be null or blank");
        }
        if (pollIntervalMs <= 0) {
            throw new IllegalArgumentException(
                "pollIntervalMs must be positive (current: " + pollIntervalMs + ")"
            );
        }
        if (commandTimeoutMs <= 0) {
            throw new IllegalArgumentException(
                "commandTimeoutMs must be positive (current: " + commandTimeoutMs + ")"
            );
        }
    }

    /**
     * host/port만 변경한 새 인스턴스 생성.
     */
    public RedisStoreConfig withEndpoint(String host, int port) {
        return new RedisStoreConfig(host, port, username, password, ssl, database, keyPrefix, pollIntervalMs, commandTimeoutMs);
    }

    /**
     * 인증 정보만 변경한 새 인스턴스 생성.
     */
    public RedisStoreConfig withCredentials(String username, String password) {
        return new RedisStoreConfig(host, port, username, password, ssl, database, keyPrefix, pollIntervalMs, commandTimeoutMs);
    }

    /**
     * ssl만 변경한 새 인스턴스 생성.
     */
    public RedisStoreConfig withSsl(boolean ssl) {
        return new RedisStoreConfig(host, port, username, password, ssl, database, keyPrefix, pollIntervalMs, commandTimeoutMs);
    }

    /**
     * database만 변경한 새 인스턴스 생성.
     */
    public RedisStoreConfig withDatabase(int database) {
        return new RedisStoreConfig(host, port, username, password, ssl, database, keyPrefix, pollIntervalMs, commandTimeoutMs);
    }

    /**
     * keyPrefix만 변경한 새 인스턴스 생성.
     */
    public RedisStoreConfig withKeyPrefix(String keyPrefix) {
        return new RedisStoreConfig(host, port, username, password, ssl, database, keyPrefix, pollIntervalMs, commandTimeoutMs);
    }

    /**
     * pollIntervalMs만 변경한 새 인스턴스 생성.
     */
    public RedisStoreConfig withPollIntervalMs(long pollIntervalMs) {
        return new RedisStoreConfig(host, port, username, password, ssl, database, keyPrefix, pollIntervalMs, commandTimeoutMs);
    }

    @Override
    public String toString() {
        return "RedisStoreConfig{" + host + ":" + port + "/" + database
            + ", ssl=" + ssl + ", user=" + username + ", password=" + (password == null ? "none" : "***")
            + ", keyPrefix=" + keyPrefix + "}";
    }
}
