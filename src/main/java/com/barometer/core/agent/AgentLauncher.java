package com.barometer.core.agent;

import com.barometer.core.format.Glyphs;
import com.barometer.core.logging.MdcContext;
import com.barometer.core.metrics.BarometerMetrics;
import com.barometer.core.model.Result;
import com.barometer.core.model.StatusClass;
import com.barometer.core.model.StatusRecord;
import com.barometer.core.output.Emitter;
import com.barometer.core.reactor.Reactor;
import com.barometer.core.reactor.ReactorProperties;
import com.barometer.core.reactor.RefreshScheduler;
import com.barometer.core.reactor.SignalBridge;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.logging.LogLevel;
import org.springframework.boot.logging.LoggingSystem;
import org.springframework.stereotype.Service;

import java.io.PrintStream;
import java.time.Duration;
import java.util.List;
import java.util.function.IntConsumer;

/**
 * Runs an agent: either the one-shot {@code --test} path or the full reactor.
 * <p>
 * In reactor mode the calling thread installs the signal handlers, starts the worker
 * and then becomes the refresh scheduler, so {@link #launch} only returns if that
 * thread is interrupted.
 */
@Service
public class AgentLauncher {

    private static final Logger log = LoggerFactory.getLogger(AgentLauncher.class);

    static final String LOGGER_ROOT = "com.barometer";

    private final Emitter emitter;
    private final ReactorProperties properties;
    private final BarometerMetrics metrics;
    private final LoggingSystem loggingSystem;
    private final SignalBridge.Registrar signalRegistrar;
    private final PrintStream console;
    private final IntConsumer exit;

    @Autowired
    public AgentLauncher(Emitter emitter,
                         ReactorProperties properties,
                         BarometerMetrics metrics,
                         LoggingSystem loggingSystem) {
        this(emitter, properties, metrics, loggingSystem, SignalBridge.Registrar.jvm(), System.out, System::exit);
    }

    AgentLauncher(Emitter emitter,
                  ReactorProperties properties,
                  BarometerMetrics metrics,
                  LoggingSystem loggingSystem,
                  SignalBridge.Registrar signalRegistrar,
                  PrintStream console,
                  IntConsumer exit) {
        this.emitter = emitter;
        this.properties = properties;
        this.metrics = metrics;
        this.loggingSystem = loggingSystem;
        this.signalRegistrar = signalRegistrar;
        this.console = console;
        this.exit = exit;
    }

    /**
     * Builds the agent's definition and runs it.
     *
     * @param agent   agent name, used for logging before the definition exists
     * @param factory builds the definition; may throw {@link ConfigurationException}
     * @return the process exit code
     */
    public <T> int launch(String agent, DefinitionFactory<T> factory, LaunchOptions options) {
        MdcContext.setAgent(agent);
        if (options.debug()) {
            loggingSystem.setLogLevel(LOGGER_ROOT, LogLevel.DEBUG);
            log.debug("Debug logging enabled");
        }

        try {
            validateInterval(agent, options.interval());
            AgentDefinition<T> definition = factory.create();
            if (options.test()) {
                return runOnce(definition);
            }
            return runReactor(definition, options);
        } catch (ConfigurationException e) {
            log.error("Configuration error: {}", e.getMessage());
            emitter.emit(StatusRecord.of(Glyphs.prefix(Glyphs.ALERT, e.getMessage()), StatusClass.ERROR));
            return 1;
        }
    }

    /**
     * The interval must be positive and representable in milliseconds, which is
     * what the scheduler waits in.
     */
    static void validateInterval(String agent, Duration interval) {
        if (interval == null || interval.isNegative() || interval.isZero()) {
            throw new ConfigurationException(agent + ": interval must be a positive number of seconds");
        }
        try {
            interval.toMillis();
        } catch (ArithmeticException e) {
            throw new ConfigurationException(agent + ": interval of " + interval.toSeconds() + "s is too large");
        }
    }

    /**
     * One synchronous fetch and render of the first target, printed as the
     * text, class and tooltip lines; the reactor is not involved.
     */
    <T> int runOnce(AgentDefinition<T> definition) {
        log.info("Test mode: single fetch of {}", definition.targets());
        List<Result<T>> results = definition.provider().fetch(definition.targets());
        Result<T> first = results.isEmpty()
                ? Result.failure("no results")
                : results.get(0);
        StatusRecord record = definition.renderer().render(first, 0);
        console.println(record.text());
        console.println(record.status().wireName());
        console.println(record.tooltip() == null ? "" : record.tooltip());
        console.flush();
        return 0;
    }

    private <T> int runReactor(AgentDefinition<T> definition, LaunchOptions options) {
        Duration fetchTimeout = definition.fetchTimeoutOr(properties.getFetchTimeout());
        Reactor<T> reactor = Reactor.create(definition, emitter, fetchTimeout, metrics, exit);
        var scheduler = new RefreshScheduler(reactor.core(), options.interval(), metrics);

        var bridge = new SignalBridge(signalRegistrar, metrics);
        var installed = bridge.install(reactor.core(),
                properties.getRefreshSignal(),
                properties.getToggleSignal(),
                properties.getTerminateSignals(),
                () -> exit.accept(0));
        log.info("Starting {} with {} target(s), {} format(s), signals {}",
                definition.name(), definition.targets().size(), definition.formatCount(), installed);
        log.debug("Fetch timeout {}s", fetchTimeout.toSeconds());

        reactor.start();
        scheduler.run();
        reactor.stop();
        return 0;
    }

    /**
     * Deferred construction of an agent definition, so that option validation errors
     * are reported the same way as other configuration errors.
     */
    @FunctionalInterface
    public interface DefinitionFactory<T> {
        AgentDefinition<T> create();
    }
}
