/**
 * Polling wait primitive shared by the store backends and the orchestrator controller.
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.runcontrol.core.wait;
