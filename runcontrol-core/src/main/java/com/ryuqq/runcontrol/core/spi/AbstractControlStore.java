package com.ryuqq.runcontrol.core.spi;

import com.ryuqq.runcontrol.core.model.FlagName;
import com.ryuqq.runcontrol.core.model.RunId;
import com.ryuqq.runcontrol.core.statemachine.RunStatus;
import com.ryuqq.runcontrol.core.statemachine.StatusTransition;
import com.ryuqq.runcontrol.core.wait.FlagPoller;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Optional;

/**
 * Template implementation of {@link ControlStore} protocol rules.
 *
 * <p>Argument validation, sticky-flag enforcement, lifecycle validation and the
 * polling wait live here once. Backends supply only raw primitives:</p>
 * <ul>
 *   <li>{@link #readFlag}/{@link #writeFlag}/{@link #compareAndSetFlag}</li>
 *   <li>{@link #readStatus}/{@link #compareAndSetStatus}</li>
 *   <li>{@link #readMetadata}/{@link #writeMetadata}</li>
 *   <li>{@link #deleteRun}</li>
 * </ul>
 *
 * <p><strong>Compare-and-set loops:</strong></p>
 * <pre>
 * setStatus(runId, next):
 *   loop:
 *     current = readStatus(runId)
 *     StatusTransition.validate(current, next)   // throws on illegal transition
 *     if current == next → return                // idempotent
 *     if compareAndSetStatus(runId, current, next) → return
 * </pre>
 *
 * <p>A failed compare-and-set means another writer changed the value in between,
 * so the loop always makes global progress.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public abstract class AbstractControlStore implements ControlStore {

    private static final Logger log = LoggerFactory.getLogger(AbstractControlStore.class);
    private static final int MAX_METADATA_KEY_LENGTH = 128;

    private final FlagPoller poller;

    /**
     * Creates a store polling on the given interval.
     *
     * @param pollInterval wait re-check interval
     * @throws IllegalArgumentException if pollInterval is null or not positive
     */
    protected AbstractControlStore(Duration pollInterval) {
        this.poller = new FlagPoller(pollInterval);
    }

    @Override
    public final void setFlag(RunId runId, FlagName flagName, boolean value) {
        requireRunId(runId);
        requireFlagName(flagName);

        if (!flagName.isSticky()) {
            writeFlag(runId, flagName, value);
            return;
        }

        while (true) {
            Boolean current = readFlag(runId, flagName);
            if (Boolean.TRUE.equals(current)) {
                if (value) {
                    return;
                }
                throw new IllegalStateException(
                    String.format("Flag '%s' is sticky and already set for %s", flagName.getValue(), runId));
            }
            if (compareAndSetFlag(runId, flagName, current, value)) {
                return;
            }
        }
    }

    @Override
    public final boolean checkFlag(RunId runId, FlagName flagName) {
        requireRunId(runId);
        requireFlagName(flagName);
        return Boolean.TRUE.equals(readFlag(runId, flagName));
    }

    /**
     * {@inheritDoc}
     *
     * <p>Default implementation polls on the configured interval. Backends with a
     * push channel may override it as long as the contract is preserved.</p>
     */
    @Override
    public boolean waitForFlag(RunId runId, FlagName flagName, WaitCondition condition, Duration timeout) {
        requireWaitArguments(runId, flagName, condition, timeout);
        return poller.await(() -> condition.isSatisfied(this, runId, flagName), timeout);
    }

    @Override
    public final void setStatus(RunId runId, RunStatus status) {
        requireRunId(runId);
        if (status == null) {
            throw new IllegalArgumentException("status cannot be null");
        }

        while (true) {
            RunStatus current = readStatus(runId);
            StatusTransition.validate(current, status);
            if (current == status) {
                return;
            }
            if (compareAndSetStatus(runId, current, status)) {
                log.debug("Run {} status {} → {}", runId.getValue(), current, status);
                return;
            }
        }
    }

    @Override
    public final Optional<RunStatus> getStatus(RunId runId) {
        requireRunId(runId);
        return Optional.ofNullable(readStatus(runId));
    }

    @Override
    public final void setMetadata(RunId runId, String key, String value) {
        requireRunId(runId);
        requireMetadataKey(key);
        if (value == null) {
            throw new IllegalArgumentException("value cannot be null");
        }
        writeMetadata(runId, key, value);
    }

    @Override
    public final Optional<String> getMetadata(RunId runId, String key) {
        requireRunId(runId);
        requireMetadataKey(key);
        return Optional.ofNullable(readMetadata(runId, key));
    }

    @Override
    public final void purge(RunId runId) {
        requireRunId(runId);
        deleteRun(runId);
    }

    /**
     * Poll interval used by the default wait.
     *
     * @return poll interval
     */
    public Duration getPollInterval() {
        return poller.getPollInterval();
    }

    /**
     * Reads a raw flag value.
     *
     * @param runId the run namespace
     * @param flagName the flag
     * @return the stored value, or null if never written
     */
    protected abstract Boolean readFlag(RunId runId, FlagName flagName);

    /**
     * Writes a flag unconditionally (last-writer-wins).
     *
     * @param runId the run namespace
     * @param flagName the flag
     * @param value the value
     */
    protected abstract void writeFlag(RunId runId, FlagName flagName, boolean value);

    /**
     * Atomically writes a flag if its current raw value equals {@code expected}.
     *
     * @param runId the run namespace
     * @param flagName the flag
     * @param expected expected raw value (null = never written)
     * @param value the new value
     * @return true if the write happened
     */
    protected abstract boolean compareAndSetFlag(RunId runId, FlagName flagName, Boolean expected, boolean value);

    /**
     * Reads the raw status.
     *
     * @param runId the run namespace
     * @return the status, or null if never written
     */
    protected abstract RunStatus readStatus(RunId runId);

    /**
     * Atomically writes the status if the current one equals {@code expected}.
     *
     * @param runId the run namespace
     * @param expected expected status (null = never written)
     * @param next the new status
     * @return true if the write happened
     */
    protected abstract boolean compareAndSetStatus(RunId runId, RunStatus expected, RunStatus next);

    /**
     * Reads a raw metadata value.
     *
     * @param runId the run namespace
     * @param key the key
     * @return the value, or null if never written
     */
    protected abstract String readMetadata(RunId runId, String key);

    /**
     * Writes a metadata value unconditionally.
     *
     * @param runId the run namespace
     * @param key the key
     * @param value the value
     */
    protected abstract void writeMetadata(RunId runId, String key, String value);

    /**
     * Deletes all state of a run. Deleting an unknown run is a no-op.
     *
     * @param runId the run namespace
     */
    protected abstract void deleteRun(RunId runId);

    /**
     * Validates {@link #waitForFlag} arguments. For backends overriding the wait.
     *
     * @param runId the run namespace
     * @param flagName the flag
     * @param condition the wait condition
     * @param timeout the timeout (nullable)
     * @throws IllegalArgumentException if an argument is invalid
     */
    protected static void requireWaitArguments(RunId runId, FlagName flagName, WaitCondition condition, Duration timeout) {
        requireRunId(runId);
        requireFlagName(flagName);
        if (condition == null) {
            throw new IllegalArgumentException("condition cannot be null");
        }
        if (timeout != null && timeout.isNegative()) {
            throw new IllegalArgumentException("timeout cannot be negative (current: " + timeout + ")");
        }
    }

    private static void requireRunId(RunId runId) {
        if (runId == null) {
            throw new IllegalArgumentException("runId cannot be null");
        }
    }

    private static void requireFlagName(FlagName flagName) {
        if (flagName == null) {
            throw new IllegalArgumentException("flagName cannot be null");
        }
    }

    private static void requireMetadataKey(String key) {
        if (key == null || key.isBlank()) {
            throw new IllegalArgumentException("metadata key cannot be null or blank");
        }
        if (key.length() > MAX_METADATA_KEY_LENGTH) {
            throw new IllegalArgumentException("metadata key length cannot exceed " + MAX_METADATA_KEY_LENGTH + " characters");
        }
    }
}
