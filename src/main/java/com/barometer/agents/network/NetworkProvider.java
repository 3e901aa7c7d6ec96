package com.barometer.agents.network;

import com.barometer.core.model.Target;
import com.barometer.core.provider.PerTargetProvider;
import com.barometer.core.provider.ProviderException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;

/**
 * Samples the byte counters under {@code /sys/class/net/<iface>/statistics}
 * twice and divides the difference by the sampling window.
 */
public class NetworkProvider extends PerTargetProvider<NetworkThroughput> {

    private static final Logger log = LoggerFactory.getLogger(NetworkProvider.class);

    private final Path netRoot;
    private final Duration sampleInterval;

    public NetworkProvider() {
        this(Path.of("/sys/class/net"), Duration.ofSeconds(1));
    }

    NetworkProvider(Path netRoot, Duration sampleInterval) {
        this.netRoot = netRoot;
        this.sampleInterval = sampleInterval;
    }

    @Override
    protected NetworkThroughput measure(Target target) throws ProviderException {
        String iface = target.name();
        Path device = netRoot.resolve(iface);
        if (!Files.isDirectory(device)) {
            throw new ProviderException(iface + " does not exist");
        }
        if (!isConnected(device)) {
            throw new ProviderException(iface + " disconnected");
        }

        long rx1 = counter(device, "rx_bytes");
        long tx1 = counter(device, "tx_bytes");
        long started = System.nanoTime();
        try {
            Thread.sleep(sampleInterval.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ProviderException("interrupted while sampling " + iface, e);
        }
        long rx2 = counter(device, "rx_bytes");
        long tx2 = counter(device, "tx_bytes");
        double seconds = Math.max((System.nanoTime() - started) / 1e9, 0.001);

        log.debug("{}: rx {} -> {}, tx {} -> {} over {}s", iface, rx1, rx2, tx1, tx2, seconds);
        return new NetworkThroughput(
                iface,
                Files.isDirectory(device.resolve("wireless")),
                readOptional(device.resolve("address")),
                Math.max(rx2 - rx1, 0) / seconds,
                Math.max(tx2 - tx1, 0) / seconds,
                rx2,
                tx2);
    }

    /** Reading {@code carrier} fails with EINVAL while the interface is administratively down. */
    private static boolean isConnected(Path device) {
        try {
            return "1".equals(Files.readString(device.resolve("carrier")).strip());
        } catch (IOException e) {
            log.debug("{} has no readable carrier: {}", device.getFileName(), e.getMessage());
            return false;
        }
    }

    private static long counter(Path device, String name) throws ProviderException {
        Path file = device.resolve("statistics").resolve(name);
        try {
            return Long.parseLong(Files.readString(file).strip());
        } catch (IOException | NumberFormatException e) {
            throw new ProviderException("failed to read " + file + ": " + e.getMessage(), e);
        }
    }

    private static String readOptional(Path file) {
        try {
            return Files.readString(file).strip();
        } catch (IOException e) {
            log.debug("{} not readable: {}", file, e.getMessage());
            return null;
        }
    }
}
