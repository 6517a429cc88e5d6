package com.ryuqq.runcontrol.adapter.redis;

import io.lettuce.core.RedisClient;
import io.lettuce.core.RedisURI;
import io.lettuce.core.ScriptOutputType;
import io.lettuce.core.api.StatefulRedisConnection;
import io.lettuce.core.api.sync.RedisCommands;

import java.time.Duration;

/**
 * Lettuce-backed {@link RedisOperations}.
 *
 * <p>Compare-and-set runs as a Lua script, which Redis executes atomically.
 * An absent value is passed to the scripts as the empty string.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
final class LettuceRedisOperations implements RedisOperations {

    static final String HSET_IF_EQUALS_SCRIPT =
        "local cur = redis.call('HGET', KEYS[1], ARGV[1]) "
            + "if cur == false then cur = '' end "
            + "if cur ~= ARGV[2] then return 0 end "
            + "redis.call('HSET', KEYS[1], ARGV[1], ARGV[3]) "
            + "return 1";

    static final String SET_IF_EQUALS_SCRIPT =
        "local cur = redis.call('GET', KEYS[1]) "
            + "if cur == false then cur = '' end "
            + "if cur ~= ARGV[1] then return 0 end "
            + "redis.call('SET', KEYS[1], ARGV[2]) "
            + "return 1";

    private static final String ABSENT = "";

    private final RedisClient clientOrNull;
    private final StatefulRedisConnection<String, String> connectionOrNull;
    private final RedisCommands<String, String> commands;

    private LettuceRedisOperations(RedisClient clientOrNull,
                                   StatefulRedisConnection<String, String> connectionOrNull,
                                   RedisCommands<String, String> commands) {
        this.clientOrNull = clientOrNull;
        this.connectionOrNull = connectionOrNull;
        this.commands = commands;
    }

    /**
     * Connects to the configured server.
     *
     * @param config connection settings
     * @return connected operations
     * @throws io.lettuce.core.RedisConnectionException if the server cannot be reached
     */
    static LettuceRedisOperations connect(RedisStoreConfig config) {
        RedisURI.Builder builder = RedisURI.builder()
            .withHost(config.host())
            .withPort(config.port())
            .withSsl(config.ssl())
            .withDatabase(config.database())
            .withTimeout(Duration.ofMillis(config.commandTimeoutMs()));
        if (config.username() != null && config.password() != null) {
            builder.withAuthentication(config.username(), config.password().toCharArray());
        } else if (config.password() != null) {
            builder.withPassword(config.password().toCharArray());
        }
        RedisClient client = RedisClient.create(builder.build());
        try {
            StatefulRedisConnection<String, String> connection = client.connect();
            return new LettuceRedisOperations(client, connection, connection.sync());
        } catch (RuntimeException e) {
            client.shutdown();
            throw e;
        }
    }

    /**
     * Wraps existing commands. The caller keeps ownership of the connection.
     *
     * @param commands synchronous Lettuce commands
     * @return operations
     */
    static LettuceRedisOperations wrap(RedisCommands<String, String> commands) {
        if (commands == null) {
            throw new IllegalArgumentException("commands cannot be null");
        }
        return new LettuceRedisOperations(null, null, commands);
    }

    @Override
    public String hget(String key, String field) {
        return commands.hget(key, field);
    }

    @Override
    public void hset(String key, String field, String value) {
        commands.hset(key, field, value);
    }

    @Override
    public String get(String key) {
        return commands.get(key);
    }

    @Override
    public boolean hsetIfEquals(String key, String field, String expected, String value) {
        Long result = commands.eval(HSET_IF_EQUALS_SCRIPT, ScriptOutputType.INTEGER,
            new String[] {key}, field, expected == null ? ABSENT : expected, value);
        return result != null && result == 1L;
    }

    @Override
    public boolean setIfEquals(String key, String expected, String value) {
        Long result = commands.eval(SET_IF_EQUALS_SCRIPT, ScriptOutputType.INTEGER,
            new String[] {key}, expected == null ? ABSENT : expected, value);
        return result != null && result == 1L;
    }

    @Override
    public void del(String... keys) {
        commands.del(keys);
    }

    @Override
    public void close() {
        if (connectionOrNull != null) {
            connectionOrNull.close();
        }
        if (clientOrNull != null) {
            clientOrNull.shutdown();
        }
    }
}
