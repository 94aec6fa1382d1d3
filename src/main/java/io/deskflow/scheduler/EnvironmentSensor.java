package io.deskflow.scheduler;

/**
 * Host state that scheduled jobs can be gated on.
 */
public interface EnvironmentSensor {
    boolean vpnConnected();

    boolean acPowerConnected();

    boolean screenLocked();
}
