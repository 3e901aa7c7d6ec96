package com.barometer.core.provider;

import com.barometer.core.format.Glyphs;
import com.barometer.core.model.Result;
import com.barometer.core.model.StatusClass;
import com.barometer.core.model.StatusRecord;
import com.barometer.core.model.Target;

/**
 * Maps a cached result to the record shown in the bar.
 * <p>
 * Rendering is pure: the same result and mode always produce an equal record,
 * and no method performs I/O.
 *
 * @param <T> the payload type of the agent
 */
public interface Renderer<T> {

    /**
     * @param result the cached result of the selected target
     * @param mode   the current format index
     */
    StatusRecord render(Result<T> result, int mode);

    /**
     * Transient record shown while a fetch is in flight and an older result exists.
     * Defaults to the stale rendering restyled as {@code loading}.
     */
    default StatusRecord loading(Target target, Result<T> stale, int mode) {
        return render(stale, mode).withStatus(StatusClass.LOADING);
    }

    /** Transient record shown while the first fetch of a target is in flight. */
    default StatusRecord fetching(Target target) {
        String text = "Fetching " + target.name() + "...";
        return new StatusRecord(Glyphs.prefix(Glyphs.TIMER, text), StatusClass.LOADING, text);
    }

    /** Record shown when a redraw is requested before any fetch has completed. */
    default StatusRecord pending(Target target) {
        String text = "Waiting for " + target.name() + "...";
        return new StatusRecord(Glyphs.prefix(Glyphs.TIMER, text), StatusClass.LOADING, text);
    }

    /** Shared rendering of a failure: alert icon and the error message. */
    static StatusRecord failure(Result.Failure<?> failure) {
        return StatusRecord.of(Glyphs.prefix(Glyphs.ALERT, failure.error()), StatusClass.ERROR);
    }
}
