package com.ryuqq.runcontrol.core.spi;

/**
 * Thrown when a {@link ControlStore} backend cannot be reached or its data is corrupted.
 *
 * <p>This is distinct from "flag not set". Orchestrator-side writes must let it
 * propagate; worker-side reads translate it into a documented conservative
 * default (no control signal pending) and log a warning.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class StoreUnavailableException extends RuntimeException {

    /**
     * Creates a new exception.
     *
     * @param message description of the failed operation
     * @param cause underlying backend failure
     */
    public StoreUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Creates a new exception without a cause.
     *
     * @param message description of the failed operation
     */
    public StoreUnavailableException(String message) {
        super(message);
    }
}
