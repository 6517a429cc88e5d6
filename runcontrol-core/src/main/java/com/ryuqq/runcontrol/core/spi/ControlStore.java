package com.ryuqq.runcontrol.core.spi;

import com.ryuqq.runcontrol.core.model.FlagName;
import com.ryuqq.runcontrol.core.model.RunId;
import com.ryuqq.runcontrol.core.statemachine.RunStatus;

import java.time.Duration;
import java.util.Optional;

/**
 * Shared keyed state store SPI for run control signals and run status.
 *
 * <p>The orchestrator and the worker never talk to each other directly. Both hold a
 * ControlStore pointing at the same backend and coordinate exclusively through it:
 * the orchestrator writes flags ({@code cancelled}, {@code paused}), the worker
 * reads them at its control points and writes the run status.</p>
 *
 * <p><strong>Responsibilities:</strong></p>
 * <ul>
 *   <li>Per-run boolean flags: {@code (runId, flagName) -> boolean}</li>
 *   <li>Per-run lifecycle status: {@code runId -> RunStatus}</li>
 *   <li>Per-run string metadata (created_at, cancel reason, ...)</li>
 *   <li>Blocking wait on a flag with optional timeout</li>
 * </ul>
 *
 * <p><strong>Implementation Requirements:</strong></p>
 * <ul>
 *   <li>Thread-safe: All methods must be safely callable from multiple threads</li>
 *   <li>Isolation: writes to one runId never change reads of another runId</li>
 *   <li>Last-writer-wins for concurrent writes to the same key, without torn values</li>
 *   <li>Sticky flags ({@link FlagName#isSticky()}) never go back from true to false</li>
 *   <li>Status writes follow {@link com.ryuqq.runcontrol.core.statemachine.StatusTransition}</li>
 *   <li>Backend failures surface as {@link StoreUnavailableException}</li>
 * </ul>
 *
 * <p>Backends (in-memory, file lock, Redis) differ only in visibility scope and must be
 * observably identical to a caller. {@link AbstractControlStore} implements the
 * protocol rules once on top of a small set of backend primitives.</p>
 *
 * <p><strong>Orchestrator-facing operations:</strong></p>
 * <pre>
 * request cancel  ≡ setFlag(runId, CANCELLED, true)
 * request pause   ≡ setFlag(runId, PAUSED, true)
 * request resume  ≡ setFlag(runId, PAUSED, false)
 * query status    ≡ getStatus(runId)
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface ControlStore extends FlagReader, AutoCloseable {

    /**
     * Writes a flag. Idempotent, last-writer-wins.
     *
     * @param runId the run namespace
     * @param flagName the flag to write
     * @param value the new value
     * @throws IllegalArgumentException if runId or flagName is null
     * @throws IllegalStateException if clearing a sticky flag that is already set
     * @throws StoreUnavailableException if the backend cannot be reached
     */
    void setFlag(RunId runId, FlagName flagName, boolean value);

    /**
     * {@inheritDoc}
     *
     * <p>Never fails on an unknown flag name: unset flags read as {@code false}.</p>
     */
    @Override
    boolean checkFlag(RunId runId, FlagName flagName);

    /**
     * Blocks the calling thread until {@code condition} holds or {@code timeout} elapses.
     *
     * <p>The flag is re-checked on the backend's poll interval (default 500ms).
     * Only the calling thread blocks; waits on other runs or other threads are unaffected.</p>
     *
     * @param runId the run namespace
     * @param flagName the flag being waited on
     * @param condition condition ending the wait
     * @param timeout maximum wait, or {@code null} for an unbounded wait
     * @return true if the condition was satisfied, false if the timeout elapsed
     *         (an unbounded wait never returns false)
     * @throws IllegalArgumentException if an argument is null (except timeout) or timeout is negative
     * @throws IllegalStateException if the waiting thread is interrupted
     * @throws StoreUnavailableException if the backend cannot be reached
     */
    boolean waitForFlag(RunId runId, FlagName flagName, WaitCondition condition, Duration timeout);

    /**
     * Waits until the flag is cleared ({@link WaitCondition#flagCleared()}).
     *
     * @param runId the run namespace
     * @param flagName the flag being waited on
     * @param timeout maximum wait, or {@code null} for an unbounded wait
     * @return true if the flag was cleared before the timeout
     */
    default boolean waitForFlag(RunId runId, FlagName flagName, Duration timeout) {
        return waitForFlag(runId, flagName, WaitCondition.flagCleared(), timeout);
    }

    /**
     * Writes the run status.
     *
     * <p>Re-writing the current status is a no-op. Writing a status for a run
     * without one is always accepted.</p>
     *
     * @param runId the run namespace
     * @param status the new status
     * @throws IllegalArgumentException if runId or status is null
     * @throws IllegalStateException if the transition is not allowed
     * @throws StoreUnavailableException if the backend cannot be reached
     */
    void setStatus(RunId runId, RunStatus status);

    /**
     * Reads the run status.
     *
     * @param runId the run namespace
     * @return the status, or empty if none was ever written
     * @throws StoreUnavailableException if the backend cannot be reached
     */
    Optional<RunStatus> getStatus(RunId runId);

    /**
     * Writes a metadata attribute.
     *
     * @param runId the run namespace
     * @param key attribute key (non-blank, at most 128 characters)
     * @param value attribute value (non-null)
     * @throws IllegalArgumentException if an argument is invalid
     * @throws StoreUnavailableException if the backend cannot be reached
     */
    void setMetadata(RunId runId, String key, String value);

    /**
     * Reads a metadata attribute.
     *
     * @param runId the run namespace
     * @param key attribute key
     * @return the value, or empty if not set
     * @throws StoreUnavailableException if the backend cannot be reached
     */
    Optional<String> getMetadata(RunId runId, String key);

    /**
     * Removes every flag, status and metadata entry of a run.
     *
     * <p>Called only by the orchestrator when garbage-collecting terminal runs.</p>
     *
     * @param runId the run namespace
     * @throws StoreUnavailableException if the backend cannot be reached
     */
    void purge(RunId runId);

    /**
     * Releases backend resources (connections, file handles). No-op by default.
     */
    @Override
    default void close() {
    }
}
