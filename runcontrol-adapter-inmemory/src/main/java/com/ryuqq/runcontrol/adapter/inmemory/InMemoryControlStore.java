package com.ryuqq.runcontrol.adapter.inmemory;

import com.ryuqq.runcontrol.core.model.FlagName;
import com.ryuqq.runcontrol.core.model.RunId;
import com.ryuqq.runcontrol.core.spi.AbstractControlStore;
import com.ryuqq.runcontrol.core.spi.ControlStore;
import com.ryuqq.runcontrol.core.spi.WaitCondition;
import com.ryuqq.runcontrol.core.statemachine.RunStatus;
import com.ryuqq.runcontrol.core.wait.FlagPoller;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Function;

/**
 * In-memory implementation of {@link ControlStore} for a single process.
 *
 * <p>Orchestrator and worker share the same instance, typically in tests or when the
 * worker runs as a thread of the orchestrator process.</p>
 *
 * <p><strong>Data Structures:</strong></p>
 * <ul>
 *   <li><strong>runs:</strong> ConcurrentHashMap&lt;RunId, RunState&gt; - one entry per run</li>
 *   <li><strong>RunState:</strong> flags, status and metadata guarded by a per-run
 *       {@link ReentrantLock}, so writers to different runs never contend</li>
 * </ul>
 *
 * <p><strong>Wait Semantics:</strong> push-based. Every write bumps a store-wide change
 * counter and signals waiters, which re-evaluate immediately. The poll interval is kept as
 * an upper bound between re-checks.</p>
 *
 * <p><strong>Limitations:</strong></p>
 * <ul>
 *   <li>Visible only within one JVM</li>
 *   <li>Data lost on process restart</li>
 * </ul>
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>
 * ControlStore store = new InMemoryControlStore();
 * store.setStatus(runId, RunStatus.PENDING);
 * store.setFlag(runId, FlagName.PAUSED, true);
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class InMemoryControlStore extends AbstractControlStore {

    private static final Logger log = LoggerFactory.getLogger(InMemoryControlStore.class);

    private final ConcurrentHashMap<RunId, RunState> runs;
    private final ReentrantLock changeLock = new ReentrantLock();
    private final Condition changed = changeLock.newCondition();
    private long version;

    /**
     * Creates a store with the default poll interval (500ms).
     */
    public InMemoryControlStore() {
        this(FlagPoller.DEFAULT_POLL_INTERVAL);
    }

    /**
     * Creates a store with the given re-check interval.
     *
     * @param pollInterval upper bound between wait re-checks
     * @throws IllegalArgumentException if pollInterval is null or not positive
     */
    public InMemoryControlStore(Duration pollInterval) {
        super(pollInterval);
        this.runs = new ConcurrentHashMap<>();
    }

    /**
     * {@inheritDoc}
     *
     * <p><strong>Implementation Notes:</strong></p>
     * <ul>
     *   <li>The condition is evaluated with no lock held, so it may read any run</li>
     *   <li>Waiters park on one store-wide {@link Condition}; the change counter read before
     *       each check means a write between check and park is never missed</li>
     *   <li>Waiting on an unknown run creates no entry</li>
     * </ul>
     */
    @Override
    public boolean waitForFlag(RunId runId, FlagName flagName, WaitCondition condition, Duration timeout) {
        requireWaitArguments(runId, flagName, condition, timeout);

        long pollNanos = getPollInterval().toNanos();
        long deadline = timeout == null ? 0L : System.nanoTime() + timeout.toNanos();
        try {
            while (true) {
                long seenVersion = currentVersion();
                if (condition.isSatisfied(this, runId, flagName)) {
                    return true;
                }
                long waitNanos = pollNanos;
                if (timeout != null) {
                    long remaining = deadline - System.nanoTime();
                    if (remaining <= 0) {
                        return false;
                    }
                    waitNanos = Math.min(pollNanos, remaining);
                }
                awaitChange(seenVersion, waitNanos);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Polling interrupted", e);
        }
    }

    @Override
    protected Boolean readFlag(RunId runId, FlagName flagName) {
        return read(runId, state -> state.flags.get(flagName.getValue()));
    }

    @Override
    protected void writeFlag(RunId runId, FlagName flagName, boolean value) {
        RunState state = lockedState(runId);
        try {
            state.flags.put(flagName.getValue(), value);
        } finally {
            state.lock.unlock();
        }
        signalChange();
    }

    @Override
    protected boolean compareAndSetFlag(RunId runId, FlagName flagName, Boolean expected, boolean value) {
        RunState state = lockedState(runId);
        try {
            if (!Objects.equals(state.flags.get(flagName.getValue()), expected)) {
                return false;
            }
            state.flags.put(flagName.getValue(), value);
        } finally {
            state.lock.unlock();
        }
        signalChange();
        return true;
    }

    @Override
    protected RunStatus readStatus(RunId runId) {
        return read(runId, state -> state.status);
    }

    @Override
    protected boolean compareAndSetStatus(RunId runId, RunStatus expected, RunStatus next) {
        RunState state = lockedState(runId);
        try {
            if (state.status != expected) {
                return false;
            }
            state.status = next;
        } finally {
            state.lock.unlock();
        }
        signalChange();
        return true;
    }

    @Override
    protected String readMetadata(RunId runId, String key) {
        return read(runId, state -> state.metadata.get(key));
    }

    @Override
    protected void writeMetadata(RunId runId, String key, String value) {
        RunState state = lockedState(runId);
        try {
            state.metadata.put(key, value);
        } finally {
            state.lock.unlock();
        }
    }

    @Override
    protected void deleteRun(RunId runId) {
        RunState state = runs.get(runId);
        if (state == null) {
            return;
        }
        state.lock.lock();
        try {
            state.purged = true;
            runs.remove(runId, state);
        } finally {
            state.lock.unlock();
        }
        signalChange();
        log.debug("Purged run {}", runId.getValue());
    }

    /**
     * Number of runs currently held (for monitoring and tests).
     *
     * @return run count
     */
    public int size() {
        return runs.size();
    }

    /**
     * Returns the live state of a run with its lock held, creating it if absent.
     * Retries when it races with a purge.
     */
    private RunState lockedState(RunId runId) {
        while (true) {
            RunState state = runs.computeIfAbsent(runId, id -> new RunState());
            state.lock.lock();
            if (!state.purged) {
                return state;
            }
            state.lock.unlock();
        }
    }

    private long currentVersion() {
        changeLock.lock();
        try {
            return version;
        } finally {
            changeLock.unlock();
        }
    }

    private void awaitChange(long seenVersion, long waitNanos) throws InterruptedException {
        changeLock.lock();
        try {
            if (version == seenVersion) {
                changed.awaitNanos(waitNanos);
            }
        } finally {
            changeLock.unlock();
        }
    }

    private void signalChange() {
        changeLock.lock();
        try {
            version++;
            changed.signalAll();
        } finally {
            changeLock.unlock();
        }
    }

    private <T> T read(RunId runId, Function<RunState, T> reader) {
        RunState state = runs.get(runId);
        if (state == null) {
            return null;
        }
        state.lock.lock();
        try {
            return state.purged ? null : reader.apply(state);
        } finally {
            state.lock.unlock();
        }
    }

    /**
     * Mutable per-run state. Every field is guarded by {@link #lock}.
     */
    private static final class RunState {
        private final ReentrantLock lock = new ReentrantLock();
        private final Map<String, Boolean> flags = new HashMap<>();
        private final Map<String, String> metadata = new HashMap<>();
        private RunStatus status;
        private boolean purged;
    }
}
