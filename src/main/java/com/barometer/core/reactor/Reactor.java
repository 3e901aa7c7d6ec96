package com.barometer.core.reactor;

import com.barometer.core.agent.AgentDefinition;
import com.barometer.core.metrics.BarometerMetrics;
import com.barometer.core.output.Emitter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.function.IntConsumer;

/**
 * One agent's refresh engine: the synchronization core plus the worker thread that serves it.
 * <p>
 * The worker runs as a daemon thread. Anything escaping it is an internal failure:
 * it is logged and the process exits with status 1, so the host sees the module
 * go away instead of a line that silently stops updating.
 *
 * @param <T> the payload type of the agent
 */
public class Reactor<T> {

    private static final Logger log = LoggerFactory.getLogger(Reactor.class);

    static final int FATAL_EXIT_CODE = 1;

    private final String agent;
    private final SynchronizationCore<T> core;
    private final WorkerLoop<T> worker;
    private final IntConsumer exit;
    private Thread workerThread;

    Reactor(String agent, SynchronizationCore<T> core, WorkerLoop<T> worker, IntConsumer exit) {
        this.agent = agent;
        this.core = core;
        this.worker = worker;
        this.exit = exit;
    }

    /**
     * @param exit called with {@value #FATAL_EXIT_CODE} when the worker dies unexpectedly
     */
    public static <T> Reactor<T> create(AgentDefinition<T> definition,
                                        Emitter emitter,
                                        Duration fetchTimeout,
                                        BarometerMetrics metrics,
                                        IntConsumer exit) {
        var core = new SynchronizationCore<T>(definition.formatCount());
        ExecutorService fetchExecutor = Executors.newSingleThreadExecutor(runnable -> {
            var thread = new Thread(runnable, "fetch-" + definition.name());
            thread.setDaemon(true);
            return thread;
        });
        var worker = new WorkerLoop<>(
                definition.name(),
                definition.targets(),
                core,
                definition.provider(),
                definition.renderer(),
                emitter,
                definition.availability(),
                fetchTimeout,
                fetchExecutor,
                metrics);
        return new Reactor<>(definition.name(), core, worker, exit);
    }

    public SynchronizationCore<T> core() {
        return core;
    }

    /**
     * Starts the worker thread. The core starts with fetch and redraw pending, so the
     * worker fetches and renders immediately.
     */
    public synchronized Thread start() {
        if (workerThread != null) {
            throw new IllegalStateException("Reactor for " + agent + " already started");
        }
        workerThread = new Thread(worker, "worker-" + agent);
        workerThread.setDaemon(true);
        workerThread.setUncaughtExceptionHandler((thread, error) -> {
            log.error("Worker for {} failed, terminating: {}", agent, error.getMessage(), error);
            exit.accept(FATAL_EXIT_CODE);
        });
        workerThread.start();
        return workerThread;
    }

    public synchronized void stop() {
        if (workerThread != null) {
            workerThread.interrupt();
        }
    }
}
