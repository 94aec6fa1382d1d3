/**
 * DeskFlow source tree root.
 *
 * <p>Primary entry points while reading code:
 *
 * <ul>
 *   <li>{@code io.deskflow.Main} bootstraps the CLI process.</li>
 *   <li>{@code io.deskflow.cli.DeskFlowCommand} maps commands to runtime APIs.</li>
 *   <li>{@code io.deskflow.runtime.FlowRunner} executes flow steps under the run lock.</li>
 *   <li>{@code io.deskflow.scheduler.CronScheduler} fires configured jobs.</li>
 * </ul>
 */
package io.deskflow;
