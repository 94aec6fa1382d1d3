/**
 * Flow execution package.
 *
 * <p>{@link io.deskflow.runtime.DeskFlowRuntime} wires storage, actions and
 * statistics for one data root; {@link io.deskflow.runtime.FlowRunner} runs steps
 * and guards flow operations by role.
 */
package io.deskflow.runtime;
