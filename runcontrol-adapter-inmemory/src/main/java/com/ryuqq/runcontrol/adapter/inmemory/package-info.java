/**
 * In-memory ControlStore adapter.
 *
 * <p>Single-process backend. Suitable for tests and for workers running inside the
 * orchestrator's JVM.</p>
 *
 * <p><strong>Main Components:</strong></p>
 * <ul>
 *   <li>{@link com.ryuqq.runcontrol.adapter.inmemory.InMemoryControlStore}:
 *       per-run lock with condition signalling</li>
 * </ul>
 *
 * <p><strong>Limitations:</strong></p>
 * <ul>
 *   <li>Data lost on process restart</li>
 *   <li>Not visible to other processes; use the file or Redis adapter for that</li>
 * </ul>
 *
 * @see com.ryuqq.runcontrol.core.spi.ControlStore
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.runcontrol.adapter.inmemory;
