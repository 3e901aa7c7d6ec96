package com.barometer.core.reactor;

import com.barometer.core.agent.ConfigurationException;
import com.barometer.core.metrics.BarometerMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import sun.misc.Signal;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Translates OS signals into requests against the {@link SynchronizationCore}.
 * <p>
 * The JVM runs signal handlers on a short-lived dispatcher thread rather than in
 * async-signal context, so taking the core's lock there is safe. Handler bodies still
 * do nothing but record the signal and call {@code wake} or {@code toggle}; all real
 * work happens on the worker thread.
 * <ul>
 *   <li>refresh ({@code SIGHUP} by default): fetch and redraw</li>
 *   <li>toggle ({@code SIGUSR1} by default): next format index, redraw only</li>
 *   <li>terminate ({@code SIGTERM}, {@code SIGINT}): exit with status 0</li>
 * </ul>
 */
public class SignalBridge {

    private static final Logger log = LoggerFactory.getLogger(SignalBridge.class);

    /**
     * Registers a handler for a named signal.
     */
    @FunctionalInterface
    public interface Registrar {
        /**
         * @throws IllegalArgumentException if the platform does not know the signal
         *                                  or does not allow it to be handled
         */
        void register(String signalName, Runnable handler);

        /** Registrar backed by {@code sun.misc.Signal}. */
        static Registrar jvm() {
            return (signalName, handler) -> Signal.handle(new Signal(signalName), sig -> handler.run());
        }
    }

    private final Registrar registrar;
    private final BarometerMetrics metrics;

    public SignalBridge(Registrar registrar, BarometerMetrics metrics) {
        this.registrar = registrar;
        this.metrics = metrics;
    }

    /**
     * Installs one handler per signal. Must run before the worker starts.
     *
     * @param core        the core the handlers wake
     * @param refresh     refresh signal name, e.g. {@code HUP}
     * @param toggle      toggle signal name, e.g. {@code USR1}
     * @param terminate   signal names that end the process
     * @param onTerminate invoked by the terminate handlers
     * @return the names of the signals that were actually installed
     * @throws ConfigurationException if the same signal is named twice
     */
    public Set<String> install(SynchronizationCore<?> core,
                               String refresh,
                               String toggle,
                               List<String> terminate,
                               Runnable onTerminate) {
        var names = new LinkedHashSet<String>();
        names.add(refresh);
        if (!names.add(toggle)) {
            throw new ConfigurationException("refresh and toggle signals must differ, both are SIG" + toggle);
        }
        for (String name : terminate) {
            if (!names.add(name)) {
                throw new ConfigurationException("signal SIG" + name + " is configured more than once");
            }
        }

        var installed = new LinkedHashSet<String>();
        register(installed, refresh, () -> {
            metrics.recordSignal("refresh");
            log.info("Received SIG{}, re-fetching data", refresh);
            core.wake(true, true);
        });
        register(installed, toggle, () -> {
            metrics.recordSignal("toggle");
            int index = core.toggle();
            log.info("Received SIG{}, switching to format {}", toggle, index);
        });
        for (String name : terminate) {
            register(installed, name, () -> {
                metrics.recordSignal("terminate");
                log.info("Received SIG{}, exiting", name);
                onTerminate.run();
            });
        }
        return installed;
    }

    private void register(Set<String> installed, String name, Runnable handler) {
        try {
            registrar.register(name, handler);
            installed.add(name);
            log.debug("Installed handler for SIG{}", name);
        } catch (IllegalArgumentException e) {
            log.warn("Cannot handle SIG{} on this platform: {}", name, e.getMessage());
        }
    }
}
