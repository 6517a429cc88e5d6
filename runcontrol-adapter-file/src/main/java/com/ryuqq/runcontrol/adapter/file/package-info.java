/**
 * File-lock ControlStore adapter.
 *
 * <p>Same-host, multi-process backend: one JSON document per run, serialized with Jackson,
 * guarded by an OS file lock.</p>
 *
 * <p><strong>Main Components:</strong></p>
 * <ul>
 *   <li>{@link com.ryuqq.runcontrol.adapter.file.FileControlStore}: the store</li>
 *   <li>{@link com.ryuqq.runcontrol.adapter.file.FileStoreConfig}: directory and poll interval</li>
 * </ul>
 *
 * @see com.ryuqq.runcontrol.core.spi.ControlStore
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.runcontrol.adapter.file;
