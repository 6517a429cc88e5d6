/**
 * Thread-scoped correlation identifiers.
 *
 * <p>Run-level and item-level ids, readable anywhere on the executing thread and
 * mirrored into the SLF4J MDC for log correlation.</p>
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.runcontrol.core.context;
