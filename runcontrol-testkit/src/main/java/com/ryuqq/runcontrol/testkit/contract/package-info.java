/**
 * Contract tests shared by every {@link com.ryuqq.runcontrol.core.spi.ControlStore} backend.
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.runcontrol.testkit.contract;
