package com.barometer.core.metrics;

import com.barometer.core.model.StatusClass;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Centralised Micrometer metrics for the reactor.
 */
@Service
public class BarometerMetrics {

    private final MeterRegistry registry;

    public BarometerMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    /**
     * @param outcome {@code success}, {@code failure}, {@code timeout} or {@code unreachable}
     */
    public void recordFetch(String agent, Duration duration, String outcome) {
        Timer.builder("barometer.fetch.duration")
                .tag("agent", agent)
                .tag("outcome", outcome)
                .register(registry)
                .record(duration);
    }

    public void recordEmit(String agent, StatusClass status) {
        Counter.builder("barometer.records.emitted")
                .tag("agent", agent)
                .tag("class", status.wireName())
                .register(registry)
                .increment();
    }

    /**
     * @param kind {@code refresh}, {@code toggle} or {@code terminate}
     */
    public void recordSignal(String kind) {
        Counter.builder("barometer.signals.received")
                .tag("kind", kind)
                .register(registry)
                .increment();
    }

    public void recordTick() {
        Counter.builder("barometer.scheduler.ticks")
                .register(registry)
                .increment();
    }
}
