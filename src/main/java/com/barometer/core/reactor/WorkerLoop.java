package com.barometer.core.reactor;

import com.barometer.core.logging.MdcContext;
import com.barometer.core.metrics.BarometerMetrics;
import com.barometer.core.model.Result;
import com.barometer.core.model.StatusRecord;
import com.barometer.core.model.Target;
import com.barometer.core.output.Emitter;
import com.barometer.core.provider.AvailabilityCheck;
import com.barometer.core.provider.Provider;
import com.barometer.core.provider.Renderer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.Semaphore;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * The reactor's single consumer: waits for a trigger, fetches, caches, renders and emits.
 * <p>
 * Provider calls run on a dedicated single-thread executor so each one can be bounded
 * by a timeout. A call that outlives its timeout is cancelled. If the provider ignores the
 * interrupt, later fetches wait one timeout for it and then fail with "previous fetch still
 * running", so at most one provider call is ever in flight and nothing queues behind it.
 * <p>
 * Provider failures, timeouts and an unavailable environment all become
 * {@link Result.Failure} values; nothing thrown by the provider leaves {@link #runOnce}.
 *
 * @param <T> the payload type of the agent
 */
public class WorkerLoop<T> implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(WorkerLoop.class);

    private final String agent;
    private final List<Target> targets;
    private final SynchronizationCore<T> core;
    private final Provider<T> provider;
    private final Renderer<T> renderer;
    private final Emitter emitter;
    private final AvailabilityCheck availability;
    private final Duration fetchTimeout;
    private final ExecutorService fetchExecutor;
    private final BarometerMetrics metrics;
    private final Semaphore providerPermit = new Semaphore(1);

    public WorkerLoop(String agent,
                      List<Target> targets,
                      SynchronizationCore<T> core,
                      Provider<T> provider,
                      Renderer<T> renderer,
                      Emitter emitter,
                      AvailabilityCheck availability,
                      Duration fetchTimeout,
                      ExecutorService fetchExecutor,
                      BarometerMetrics metrics) {
        this.agent = agent;
        this.targets = List.copyOf(targets);
        this.core = core;
        this.provider = provider;
        this.renderer = renderer;
        this.emitter = emitter;
        this.availability = availability;
        this.fetchTimeout = fetchTimeout;
        this.fetchExecutor = fetchExecutor;
        this.metrics = metrics;
    }

    @Override
    public void run() {
        MdcContext.setAgent(agent);
        log.info("Worker started for {} target(s): {}", targets.size(), targets);
        try {
            while (!Thread.currentThread().isInterrupted()) {
                runOnce(core.awaitTrigger());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.info("Worker interrupted, stopping");
        } finally {
            fetchExecutor.shutdownNow();
            MdcContext.clear();
        }
    }

    /**
     * Serves one drained trigger: optional fetch, then optional redraw.
     */
    void runOnce(SynchronizationCore.Trigger trigger) throws InterruptedException {
        log.debug("Woken with fetch={} redraw={}", trigger.fetch(), trigger.redraw());

        if (trigger.fetch()) {
            emitLoading();
            List<Result<T>> results = fetch();
            if (results.isEmpty()) {
                log.warn("Fetch produced no results, skipping render");
                return;
            }
            core.replaceResults(results);
        }

        if (trigger.redraw()) {
            redraw();
        }
    }

    private void emitLoading() {
        var snapshot = core.snapshot();
        Target target = targetAt(snapshot.formatIndex());
        if (snapshot.isEmpty()) {
            emit(renderer.fetching(target));
        } else {
            emit(renderer.loading(target, snapshot.selected(), snapshot.formatIndex()));
        }
    }

    List<Result<T>> fetch() throws InterruptedException {
        long started = System.nanoTime();

        if (!availability.isAvailable()) {
            String message = availability.unavailableMessage();
            log.warn("Environment unavailable ({}), skipping provider", message);
            metrics.recordFetch(agent, elapsedSince(started), "unreachable");
            return failAll(message);
        }

        if (!providerPermit.tryAcquire(fetchTimeout.toMillis(), TimeUnit.MILLISECONDS)) {
            log.warn("Previous provider call has not returned, skipping fetch");
            metrics.recordFetch(agent, elapsedSince(started), "busy");
            return failAll("previous fetch still running");
        }

        // Whoever claims first owns the permit: the task when it starts, or the
        // timeout path when the task is cancelled before it ever ran.
        var claimed = new AtomicBoolean();
        Future<List<Result<T>>> future = fetchExecutor.submit(() -> {
            if (!claimed.compareAndSet(false, true)) {
                return Collections.emptyList();
            }
            try {
                MdcContext.setAgent(agent);
                return provider.fetch(targets);
            } finally {
                providerPermit.release();
            }
        });
        try {
            List<Result<T>> results = future.get(fetchTimeout.toMillis(), TimeUnit.MILLISECONDS);
            if (results == null || results.isEmpty()) {
                metrics.recordFetch(agent, elapsedSince(started), "failure");
                return Collections.emptyList();
            }
            if (results.size() != targets.size()) {
                log.error("Provider returned {} result(s) for {} target(s)", results.size(), targets.size());
                metrics.recordFetch(agent, elapsedSince(started), "failure");
                return failAll("expected " + targets.size() + " results, got " + results.size());
            }
            boolean allSucceeded = results.stream().allMatch(Result::isSuccess);
            metrics.recordFetch(agent, elapsedSince(started), allSucceeded ? "success" : "failure");
            log.debug("Fetched {} result(s) in {} ms", results.size(), elapsedSince(started).toMillis());
            return results;
        } catch (TimeoutException e) {
            future.cancel(true);
            if (claimed.compareAndSet(false, true)) {
                providerPermit.release();
            }
            log.warn("Provider did not finish within {}s", fetchTimeout.toSeconds());
            metrics.recordFetch(agent, elapsedSince(started), "timeout");
            return failAll("timed out after " + fetchTimeout.toSeconds() + "s");
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            log.error("Provider threw instead of returning a failure: {}", cause.getMessage(), cause);
            metrics.recordFetch(agent, elapsedSince(started), "failure");
            return failAll(cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName());
        }
    }

    private void redraw() {
        var snapshot = core.snapshot();
        if (snapshot.isEmpty()) {
            emit(renderer.pending(targetAt(snapshot.formatIndex())));
            return;
        }
        emit(renderer.render(snapshot.selected(), snapshot.formatIndex()));
    }

    private void emit(StatusRecord record) {
        emitter.emit(record);
        metrics.recordEmit(agent, record.status());
    }

    private Target targetAt(int formatIndex) {
        return targets.get(formatIndex % targets.size());
    }

    private List<Result<T>> failAll(String message) {
        return targets.stream().<Result<T>>map(t -> Result.failure(message)).toList();
    }

    private static Duration elapsedSince(long startedNanos) {
        return Duration.ofNanos(System.nanoTime() - startedNanos);
    }
}
