/**
 * Run lifecycle state machine.
 *
 * <h2>Components</h2>
 * <ul>
 *   <li>{@link com.ryuqq.runcontrol.core.statemachine.RunStatus} - run lifecycle states (enum)</li>
 *   <li>{@link com.ryuqq.runcontrol.core.statemachine.StatusTransition} - transition validation</li>
 * </ul>
 *
 * <h2>State Transition Rules</h2>
 * <pre>
 * PENDING → RUNNING (worker run start)
 * RUNNING → COMPLETED (run end, success)
 * RUNNING → FAILED (run end, failure)
 *
 * Forbidden:
 * - COMPLETED → * (terminal state)
 * - FAILED → * (terminal state)
 * - Backward transitions (e.g., RUNNING → PENDING)
 * </pre>
 *
 * <p>Pause and cancellation are flags layered on RUNNING, not states.</p>
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.runcontrol.core.statemachine;
