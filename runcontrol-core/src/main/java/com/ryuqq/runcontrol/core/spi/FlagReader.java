package com.ryuqq.runcontrol.core.spi;

import com.ryuqq.runcontrol.core.model.FlagName;
import com.ryuqq.runcontrol.core.model.RunId;

/**
 * Read-only view of per-run flags, used when evaluating a {@link WaitCondition}.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface FlagReader {

    /**
     * Reads a flag.
     *
     * @param runId the run namespace
     * @param flagName the flag to read
     * @return the flag value, {@code false} when the flag was never written
     * @throws StoreUnavailableException if the backend cannot be reached
     */
    boolean checkFlag(RunId runId, FlagName flagName);
}
