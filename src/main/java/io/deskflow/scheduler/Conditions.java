package io.deskflow.scheduler;

import java.util.List;
import java.util.Locale;
import java.util.function.BooleanSupplier;

/**
 * Job gate predicates. A job fires only when every condition holds; evaluation
 * stops at the first false one.
 */
public final class Conditions {
    public static final String VPN = "vpn";
    public static final String AC_POWER = "ac_power";
    public static final String SCREEN_LOCKED = "screen_locked";

    private Conditions() {
    }

    public static boolean allTrue(List<BooleanSupplier> conditions) {
        for (BooleanSupplier condition : conditions) {
            if (!condition.getAsBoolean()) {
                return false;
            }
        }
        return true;
    }

    public static BooleanSupplier and(BooleanSupplier... conditions) {
        List<BooleanSupplier> all = List.of(conditions);
        return () -> allTrue(all);
    }

    public static BooleanSupplier not(BooleanSupplier condition) {
        return () -> !condition.getAsBoolean();
    }

    public static BooleanSupplier vpnConnected(EnvironmentSensor sensor) {
        return sensor::vpnConnected;
    }

    public static BooleanSupplier acPowerConnected(EnvironmentSensor sensor) {
        return sensor::acPowerConnected;
    }

    public static BooleanSupplier screenLocked(EnvironmentSensor sensor) {
        return sensor::screenLocked;
    }

    /**
     * Resolves a built-in condition by name. A leading {@code !} negates it, so
     * {@code "!screen_locked"} fires only while the screen is unlocked.
     */
    public static BooleanSupplier named(String name, EnvironmentSensor sensor) {
        String trimmed = name == null ? "" : name.trim();
        if (trimmed.startsWith("!")) {
            return not(named(trimmed.substring(1), sensor));
        }
        return switch (trimmed.toLowerCase(Locale.ROOT)) {
            case VPN -> vpnConnected(sensor);
            case AC_POWER -> acPowerConnected(sensor);
            case SCREEN_LOCKED -> screenLocked(sensor);
            default -> throw new IllegalArgumentException("Unknown condition: " + name);
        };
    }
}
