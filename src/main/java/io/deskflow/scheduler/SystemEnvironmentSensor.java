package io.deskflow.scheduler;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.NetworkInterface;
import java.net.SocketException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.TimeUnit;
import java.util.stream.Stream;

/**
 * Best-effort readings of the local machine. Where a platform offers no signal the
 * answer is the one that keeps jobs running: AC power connected, screen unlocked.
 */
public final class SystemEnvironmentSensor implements EnvironmentSensor {
    private static final Logger log = LoggerFactory.getLogger(SystemEnvironmentSensor.class);
    private static final List<String> VPN_PREFIXES = List.of("tun", "tap", "wg", "ppp", "utun", "ipsec", "vpn");

    private final Path powerSupplyRoot;

    public SystemEnvironmentSensor() {
        this(Path.of("/sys/class/power_supply"));
    }

    SystemEnvironmentSensor(Path powerSupplyRoot) {
        this.powerSupplyRoot = powerSupplyRoot;
    }

    @Override
    public boolean vpnConnected() {
        try {
            for (NetworkInterface nic : Collections.list(NetworkInterface.getNetworkInterfaces())) {
                if (!nic.isUp() || nic.isLoopback()) {
                    continue;
                }
                String name = nic.getName().toLowerCase(Locale.ROOT);
                String display = nic.getDisplayName() == null ? "" : nic.getDisplayName().toLowerCase(Locale.ROOT);
                if (display.contains("vpn") || VPN_PREFIXES.stream().anyMatch(name::startsWith)) {
                    return true;
                }
            }
            return false;
        } catch (SocketException e) {
            log.warn("Cannot enumerate network interfaces: {}", e.getMessage());
            return false;
        }
    }

    @Override
    public boolean acPowerConnected() {
        if (!Files.isDirectory(powerSupplyRoot)) {
            return true;
        }
        boolean sawMains = false;
        try (Stream<Path> supplies = Files.list(powerSupplyRoot)) {
            for (Path supply : supplies.toList()) {
                String type = read(supply.resolve("type"));
                if (!"Mains".equalsIgnoreCase(type)) {
                    continue;
                }
                sawMains = true;
                if ("1".equals(read(supply.resolve("online")))) {
                    return true;
                }
            }
        } catch (IOException e) {
            log.warn("Cannot read power supply state: {}", e.getMessage());
            return true;
        }
        return !sawMains;
    }

    @Override
    public boolean screenLocked() {
        String os = System.getProperty("os.name", "").toLowerCase(Locale.ROOT);
        if (!os.contains("linux")) {
            return false;
        }
        String session = System.getenv("XDG_SESSION_ID");
        if (session == null || session.isBlank()) {
            return false;
        }
        try {
            Process process = new ProcessBuilder("loginctl", "show-session", session, "-p", "LockedHint", "--value")
                    .redirectErrorStream(true)
                    .start();
            if (!process.waitFor(2, TimeUnit.SECONDS)) {
                process.destroyForcibly();
                return false;
            }
            String out = new String(process.getInputStream().readAllBytes(), StandardCharsets.UTF_8).trim();
            return "yes".equalsIgnoreCase(out);
        } catch (IOException e) {
            log.debug("loginctl unavailable: {}", e.getMessage());
            return false;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private static String read(Path file) throws IOException {
        return Files.exists(file) ? Files.readString(file, StandardCharsets.UTF_8).trim() : "";
    }
}
