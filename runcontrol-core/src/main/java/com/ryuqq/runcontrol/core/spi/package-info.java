/**
 * Service Provider Interface (SPI) package.
 *
 * <p>This package defines the control store contract shared by the orchestrator
 * and the worker, and the template every backend builds on.</p>
 *
 * <h2>SPI Interfaces</h2>
 * <ul>
 *   <li>{@link com.ryuqq.runcontrol.core.spi.ControlStore} - flags, status, metadata and blocking wait per run</li>
 *   <li>{@link com.ryuqq.runcontrol.core.spi.AbstractControlStore} - protocol rules on top of backend primitives</li>
 *   <li>{@link com.ryuqq.runcontrol.core.spi.WaitCondition} - predicate ending a wait</li>
 * </ul>
 *
 * <h2>Implementation Responsibility</h2>
 * <p>Adapter modules (runcontrol-adapter-inmemory, runcontrol-adapter-file,
 * runcontrol-adapter-redis) provide concrete backends. Each backend is verified
 * by the shared contract tests in runcontrol-testkit.</p>
 *
 * <h2>Design Principles</h2>
 * <ul>
 *   <li><strong>Hexagonal Architecture:</strong> Core defines interfaces, adapters provide implementations</li>
 *   <li><strong>Dependency Injection:</strong> Components receive a ControlStore through their constructor, never via a global lookup</li>
 *   <li><strong>Pluggability:</strong> Backends are interchangeable and observably identical</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.runcontrol.core.spi;
