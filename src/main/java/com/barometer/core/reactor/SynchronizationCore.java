package com.barometer.core.reactor;

import com.barometer.core.model.Result;

import java.util.List;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * The reactor's shared state and the single lock guarding it.
 * <p>
 * Producers (the scheduler and signal handlers) only call {@link #wake} and
 * {@link #toggle}; the worker thread is the only caller of {@link #awaitTrigger}
 * and {@link #replaceResults}. Requests that arrive before the worker drains them
 * coalesce into one pending trigger.
 * <p>
 * Both flags start raised so the first drain performs a fetch and a render.
 *
 * @param <T> the payload type of the cached results
 */
public class SynchronizationCore<T> {

    private final ReentrantLock lock = new ReentrantLock();
    private final Condition triggered = lock.newCondition();
    private final int formatCount;

    private boolean needsFetch = true;
    private boolean needsRedraw = true;
    private int formatIndex;
    private List<Result<T>> cachedResults = List.of();

    /**
     * @param formatCount number of display formats the toggle cycles through; at least 1
     */
    public SynchronizationCore(int formatCount) {
        if (formatCount < 1) {
            throw new IllegalArgumentException("formatCount must be at least 1, was " + formatCount);
        }
        this.formatCount = formatCount;
    }

    /**
     * Requests work from the worker. Flags are OR-ed into any request still pending.
     */
    public void wake(boolean fetch, boolean redraw) {
        lock.lock();
        try {
            needsFetch |= fetch;
            needsRedraw |= redraw;
            triggered.signal();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Advances the format index modulo the format count and requests a redraw of the
     * cached data, without a fetch.
     *
     * @return the new format index
     */
    public int toggle() {
        lock.lock();
        try {
            formatIndex = (formatIndex + 1) % formatCount;
            needsRedraw = true;
            triggered.signal();
            return formatIndex;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Blocks until a fetch or redraw is pending, then clears both flags and returns
     * what was pending.
     *
     * @throws InterruptedException if the worker is interrupted while waiting
     */
    public Trigger awaitTrigger() throws InterruptedException {
        lock.lock();
        try {
            while (!(needsFetch || needsRedraw)) {
                triggered.await();
            }
            // a fetch is always followed by a render of its results
            var trigger = new Trigger(needsFetch, needsRedraw || needsFetch);
            needsFetch = false;
            needsRedraw = false;
            return trigger;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Replaces the whole cache in one step; readers never see a partly updated list.
     */
    public void replaceResults(List<Result<T>> results) {
        var copy = List.copyOf(results);
        lock.lock();
        try {
            cachedResults = copy;
        } finally {
            lock.unlock();
        }
    }

    /** The cached results and the format index, read together under the lock. */
    public Snapshot<T> snapshot() {
        lock.lock();
        try {
            return new Snapshot<>(cachedResults, formatIndex);
        } finally {
            lock.unlock();
        }
    }

    public int formatIndex() {
        lock.lock();
        try {
            return formatIndex;
        } finally {
            lock.unlock();
        }
    }

    public int formatCount() {
        return formatCount;
    }

    /**
     * Work requested since the previous drain.
     *
     * @param fetch  at least one refresh (timer tick or refresh signal) was requested
     * @param redraw at least one redraw (or a refresh, which implies one) was requested
     */
    public record Trigger(boolean fetch, boolean redraw) {}

    /**
     * Consistent view of the cache for rendering.
     *
     * @param results     the cached results, empty before the first completed fetch
     * @param formatIndex the selected format, in {@code [0, formatCount)}
     */
    public record Snapshot<T>(List<Result<T>> results, int formatIndex) {

        public boolean isEmpty() {
            return results.isEmpty();
        }

        /** The result shown at the current index; the index wraps when formats outnumber results. */
        public Result<T> selected() {
            return results.get(formatIndex % results.size());
        }
    }
}
