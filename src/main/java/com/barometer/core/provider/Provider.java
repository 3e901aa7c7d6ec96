package com.barometer.core.provider;

import com.barometer.core.model.Result;
import com.barometer.core.model.Target;

import java.util.List;

/**
 * Gathers one measurement per configured target.
 * <p>
 * Implementations may block (subprocesses, network I/O, sampling delays) but must
 * not throw: every failure mode is returned as a {@link Result.Failure} in the
 * position of the target it belongs to.
 *
 * @param <T> the payload type of a successful measurement
 */
@FunctionalInterface
public interface Provider<T> {

    /**
     * @param targets the configured targets, in order
     * @return one result per target, in the same order
     */
    List<Result<T>> fetch(List<Target> targets);
}
