package com.ryuqq.runcontrol.cli;

import com.ryuqq.runcontrol.adapter.file.FileControlStore;
import com.ryuqq.runcontrol.adapter.file.FileStoreConfig;
import com.ryuqq.runcontrol.adapter.redis.RedisControlStore;
import com.ryuqq.runcontrol.adapter.redis.RedisStoreConfig;
import com.ryuqq.runcontrol.core.spi.ControlStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link StoreOptions}를 백엔드 설정으로 변환하고 ControlStore를 연결.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class StoreFactory {

    private static final Logger log = LoggerFactory.getLogger(StoreFactory.class);

    /**
     * ControlStore 연결.
     *
     * @param options 연결 옵션
     * @return 연결된 스토어 (호출자가 close)
     * @throws IllegalArgumentException 옵션이 유효하지 않은 경우
     * @throws com.ryuqq.runcontrol.core.spi.StoreUnavailableException 연결 실패 시
     */
    public ControlStore open(StoreOptions options) {
        if (options == null) {
            throw new IllegalArgumentException("options cannot be null");
        }
        if (options.storeType == StoreType.REDIS) {
            RedisStoreConfig config = redisConfig(options);
            log.debug("Opening Redis store: {}", config);
            return new RedisControlStore(config);
        }
        FileStoreConfig config = fileConfig(options);
        log.debug("Opening file store: {}", config);
        return new FileControlStore(config);
    }

    FileStoreConfig fileConfig(StoreOptions options) {
        FileStoreConfig config = new FileStoreConfig().withPollIntervalMs(options.pollIntervalMs);
        if (options.directory != null) {
            config = config.withDirectory(options.directory);
        }
        return config;
    }

    RedisStoreConfig redisConfig(StoreOptions options) {
        return new RedisStoreConfig()
            .withEndpoint(options.redisHost, options.redisPort)
            .withCredentials(options.redisUsername, options.redisPassword)
            .withSsl(options.redisSsl)
            .withDatabase(options.redisDatabase)
            .withKeyPrefix(options.redisKeyPrefix)
            .withPollIntervalMs(options.pollIntervalMs);
    }
}
