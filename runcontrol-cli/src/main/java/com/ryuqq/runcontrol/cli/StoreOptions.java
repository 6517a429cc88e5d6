package com.ryuqq.runcontrol.cli;

import picocli.CommandLine.Option;

import java.nio.file.Path;

/**
 * ControlStore 연결 옵션 (picocli mixin).
 *
 * <p>모든 옵션은 환경 변수로도 지정할 수 있습니다. 명령행 옵션이 우선합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class StoreOptions {

    @Option(names = {"--store"}, defaultValue = "${env:RUNCONTROL_STORE:-file}",
        description = "Store backend: ${COMPLETION-CANDIDATES} (default: ${DEFAULT-VALUE})")
    StoreType storeType;

    @Option(names = {"--dir"}, defaultValue = "${env:RUNCONTROL_DIR}",
        description = "File store directory (default: <tmpdir>/runcontrol)")
    Path directory;

    @Option(names = {"--poll-interval-ms"}, defaultValue = "${env:RUNCONTROL_POLL_INTERVAL_MS:-500}",
        description = "Flag/status poll interval in ms (default: ${DEFAULT-VALUE})")
    long pollIntervalMs;

    @Option(names = {"--redis-host"}, defaultValue = "${env:RUNCONTROL_REDIS_HOST:-localhost}",
        description = "Redis host (default: ${DEFAULT-VALUE})")
    String redisHost;

    @Option(names = {"--redis-port"}, defaultValue = "${env:RUNCONTROL_REDIS_PORT:-6379}",
        description = "Redis port (default: ${DEFAULT-VALUE})")
    int redisPort;

    @Option(names = {"--redis-username"}, defaultValue = "${env:RUNCONTROL_REDIS_USERNAME}",
        description = "Redis ACL username")
    String redisUsername;

    @Option(names = {"--redis-password"}, defaultValue = "${env:RUNCONTROL_REDIS_PASSWORD}",
        description = "Redis password (prefer the RUNCONTROL_REDIS_PASSWORD environment variable)")
    String redisPassword;

    @Option(names = {"--redis-ssl"}, defaultValue = "${env:RUNCONTROL_REDIS_SSL:-false}",
        description = "Use TLS for the Redis connection")
    boolean redisSsl;

    @Option(names = {"--redis-database"}, defaultValue = "${env:RUNCONTROL_REDIS_DATABASE:-0}",
        description = "Redis logical database (default: ${DEFAULT-VALUE})")
    int redisDatabase;

    @Option(names = {"--redis-prefix"}, defaultValue = "${env:RUNCONTROL_REDIS_PREFIX:-runcontrol}",
        description = "Redis key prefix (default: ${DEFAULT-VALUE})")
    String redisKeyPrefix;
}
