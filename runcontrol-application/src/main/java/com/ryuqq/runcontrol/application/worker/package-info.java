/**
 * Worker-side control point contract.
 *
 * <p>Defines the hooks a worker invokes at fixed points of its execution and the
 * report it produces.</p>
 *
 * <h2>Core Types</h2>
 * <ul>
 *   <li>{@link com.ryuqq.runcontrol.application.worker.ControlPointInterceptor} - control point hooks</li>
 *   <li>{@link com.ryuqq.runcontrol.application.worker.WorkItem} - unit of work</li>
 *   <li>{@link com.ryuqq.runcontrol.application.worker.RunReport} - per-item results and overall outcome</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.runcontrol.application.worker;
