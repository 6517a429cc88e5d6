/**
 * Value objects of the run control protocol.
 *
 * <h2>Components</h2>
 * <ul>
 *   <li>{@link com.ryuqq.runcontrol.core.model.RunId} - namespace of every control-store key</li>
 *   <li>{@link com.ryuqq.runcontrol.core.model.FlagName} - named per-run boolean signal (cancelled, paused, ...)</li>
 *   <li>{@link com.ryuqq.runcontrol.core.model.CorrelationId} - run/item identifier attached to log output</li>
 * </ul>
 *
 * <h2>Design Principles</h2>
 * <ul>
 *   <li><strong>Immutability:</strong> All value objects are final and immutable</li>
 *   <li><strong>Fail-Fast:</strong> Invalid values throw IllegalArgumentException on creation</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.runcontrol.core.model;
