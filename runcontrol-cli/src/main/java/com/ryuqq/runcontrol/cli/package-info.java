/**
 * runctl command line tool (picocli).
 *
 * <p>Orchestrator-side commands write control signals into a file or Redis store;
 * the {@code worker} subcommand runs sample work items under run control for manual testing.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.runcontrol.cli;
