package com.ryuqq.runcontrol.core.spi;

import com.ryuqq.runcontrol.core.model.FlagName;
import com.ryuqq.runcontrol.core.model.RunId;

/**
 * Predicate that ends a {@link ControlStore#waitForFlag} call.
 *
 * <p>The wait returns {@code true} as soon as the condition is satisfied.
 * The default condition is {@link #flagCleared()}.</p>
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>
 * // block until resumed, or until the run is cancelled
 * store.waitForFlag(runId, FlagName.PAUSED, WaitCondition.clearedOrCancelled(), null);
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface WaitCondition {

    /**
     * Evaluates the condition against current store state.
     *
     * @param reader flag reader bound to the store being waited on
     * @param runId the run namespace
     * @param flagName the flag being waited on
     * @return true when the wait should end
     */
    boolean isSatisfied(FlagReader reader, RunId runId, FlagName flagName);

    /**
     * Satisfied when the waited flag is false (or unset).
     *
     * @return condition
     */
    static WaitCondition flagCleared() {
        return (reader, runId, flagName) -> !reader.checkFlag(runId, flagName);
    }

    /**
     * Satisfied when the waited flag is cleared or the run has been cancelled.
     *
     * <p>Waiting for a resume on a cancelled run serves no purpose, so the
     * pause wait uses this condition.</p>
     *
     * @return condition
     */
    static WaitCondition clearedOrCancelled() {
        return flagCleared().or((reader, runId, flagName) -> reader.checkFlag(runId, FlagName.CANCELLED));
    }

    /**
     * Logical OR of two conditions (short-circuit).
     *
     * @param other the other condition
     * @return composed condition
     * @throws IllegalArgumentException if other is null
     */
    default WaitCondition or(WaitCondition other) {
        if (other == null) {
            throw new IllegalArgumentException("other cannot be null");
        }
        return (reader, runId, flagName) ->
            isSatisfied(reader, runId, flagName) || other.isSatisfied(reader, runId, flagName);
    }
}
