/**
 * Redis ControlStore adapter.
 *
 * <p>Multi-host backend on the Lettuce client. Lifecycle and sticky-flag rules are
 * enforced with server-side Lua compare-and-set scripts.</p>
 *
 * @see com.ryuqq.runcontrol.core.spi.ControlStore
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.runcontrol.adapter.redis;
