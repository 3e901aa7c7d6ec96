package com.barometer.core.output;

import com.barometer.core.model.StatusRecord;

/**
 * Sink for status records. The reactor's worker thread is the only caller.
 */
@FunctionalInterface
public interface Emitter {

    void emit(StatusRecord record);
}
