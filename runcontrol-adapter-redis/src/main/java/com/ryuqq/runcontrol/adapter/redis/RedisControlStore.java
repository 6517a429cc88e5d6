package com.ryuqq.runcontrol.adapter.redis;

import com.ryuqq.runcontrol.core.model.FlagName;
import com.ryuqq.runcontrol.core.model.RunId;
import com.ryuqq.runcontrol.core.spi.AbstractControlStore;
import com.ryuqq.runcontrol.core.spi.ControlStore;
import com.ryuqq.runcontrol.core.spi.StoreUnavailableException;
import com.ryuqq.runcontrol.core.statemachine.RunStatus;
import io.lettuce.core.RedisException;
import io.lettuce.core.api.sync.RedisCommands;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.function.Supplier;

/**
 * Redis implementation of {@link ControlStore} for processes on different hosts.
 *
 * <p><strong>Key layout</strong> (hash tag keeps one run on one cluster slot):</p>
 * <pre>
 * {prefix}:{runId}:flags    HASH    flagName → "1" | "0"
 * {prefix}:{runId}:status   STRING  PENDING | RUNNING | COMPLETED | FAILED
 * {prefix}:{runId}:meta     HASH    key → value
 * </pre>
 *
 * <p>Run ids are opaque; braces and {@code %} are percent-escaped inside the hash tag.</p>
 *
 * <p>Compare-and-set writes run as Lua scripts, so lifecycle validation and sticky
 * flags hold across hosts. Waiting polls on the configured interval.</p>
 *
 * <p><strong>Failures:</strong> every {@link RedisException} (lost connection, timeout)
 * surfaces as {@link StoreUnavailableException}.</p>
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>
 * try (ControlStore store = new RedisControlStore(new RedisStoreConfig().withEndpoint("redis", 6379))) {
 *     store.setFlag(runId, FlagName.CANCELLED, true);
 * }
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class RedisControlStore extends AbstractControlStore {

    private static final Logger log = LoggerFactory.getLogger(RedisControlStore.class);

    private static final String TRUE = "1";
    private static final String FALSE = "0";

    private final RedisOperations operations;
    private final String keyPrefix;

    /**
     * Connects to the configured Redis server.
     *
     * @param config connection settings
     * @throws IllegalArgumentException if config is null
     * @throws StoreUnavailableException if the server cannot be reached
     */
    public RedisControlStore(RedisStoreConfig config) {
        this(connect(requireConfig(config)), config);
        log.info("Redis control store connected to {}", config);
    }

    /**
     * Uses caller-managed Lettuce commands. {@link #close()} leaves the connection open.
     *
     * @param commands synchronous commands
     * @param config settings (connection fields are ignored)
     */
    public RedisControlStore(RedisCommands<String, String> commands, RedisStoreConfig config) {
        this(LettuceRedisOperations.wrap(commands), config);
    }

    RedisControlStore(RedisOperations operations, RedisStoreConfig config) {
        super(Duration.ofMillis(requireConfig(config).pollIntervalMs()));
        if (operations == null) {
            throw new IllegalArgumentException("operations cannot be null");
        }
        this.operations = operations;
        this.keyPrefix = config.keyPrefix();
    }

    @Override
    protected Boolean readFlag(RunId runId, FlagName flagName) {
        String value = call("HGET flag", () -> operations.hget(flagsKey(runId), flagName.getValue()));
        return value == null ? null : TRUE.equals(value);
    }

    @Override
    protected void writeFlag(RunId runId, FlagName flagName, boolean value) {
        call("HSET flag", () -> {
            operations.hset(flagsKey(runId), flagName.getValue(), encode(value));
            return null;
        });
    }

    @Override
    protected boolean compareAndSetFlag(RunId runId, FlagName flagName, Boolean expected, boolean value) {
        String expectedValue = expected == null ? null : encode(expected);
        return call("CAS flag", () ->
            operations.hsetIfEquals(flagsKey(runId), flagName.getValue(), expectedValue, encode(value)));
    }

    @Override
    protected RunStatus readStatus(RunId runId) {
        String value = call("GET status", () -> operations.get(statusKey(runId)));
        if (value == null) {
            return null;
        }
        try {
            return RunStatus.valueOf(value);
        } catch (IllegalArgumentException e) {
            throw new StoreUnavailableException("Corrupted status value '" + value + "' for run " + runId.getValue(), e);
        }
    }

    @Override
    protected boolean compareAndSetStatus(RunId runId, RunStatus expected, RunStatus next) {
        String expectedValue = expected == null ? null : expected.name();
        return call("CAS status", () -> operations.setIfEquals(statusKey(runId), expectedValue, next.name()));
    }

    @Override
    protected String readMetadata(RunId runId, String key) {
        return call("HGET meta", () -> operations.hget(metaKey(runId), key));
    }

    @Override
    protected void writeMetadata(RunId runId, String key, String value) {
        call("HSET meta", () -> {
            operations.hset(metaKey(runId), key, value);
            return null;
        });
    }

    @Override
    protected void deleteRun(RunId runId) {
        call("DEL run", () -> {
            operations.del(flagsKey(runId), statusKey(runId), metaKey(runId));
            return null;
        });
        log.debug("Purged run {}", runId.getValue());
    }

    @Override
    public void close() {
        operations.close();
    }

    String flagsKey(RunId runId) {
        return runKey(runId) + ":flags";
    }

    String statusKey(RunId runId) {
        return runKey(runId) + ":status";
    }

    String metaKey(RunId runId) {
        return runKey(runId) + ":meta";
    }

    private String runKey(RunId runId) {
        return keyPrefix + ":{" + hashTagSafe(runId.getValue()) + "}";
    }

    /**
     * Escapes braces so the run id cannot change which hash tag the cluster picks.
     * {@code %} is escaped too, keeping distinct run ids on distinct keys.
     */
    static String hashTagSafe(String value) {
        return value.replace("%", "%25").replace("{", "%7B").replace("}", "%7D");
    }

    private static String encode(boolean value) {
        return value ? TRUE : FALSE;
    }

    private static <T> T call(String operation, Supplier<T> command) {
        try {
            return command.get();
        } catch (RedisException e) {
            throw new StoreUnavailableException("Redis " + operation + " failed: " + e.getMessage(), e);
        }
    }

    private static RedisOperations connect(RedisStoreConfig config) {
        try {
            return LettuceRedisOperations.connect(config);
        } catch (RedisException e) {
            throw new StoreUnavailableException("Cannot connect to Redis at " + config.host() + ":" + config.port(), e);
        }
    }

    private static RedisStoreConfig requireConfig(RedisStoreConfig config) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        return config;
    }
}
