package com.barometer.core.provider;

import com.barometer.core.model.Result;
import com.barometer.core.model.Target;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class PerTargetProviderTest {

    private final List<String> seenTargets = new ArrayList<>();

    private final PerTargetProvider<Integer> provider = new PerTargetProvider<>() {
        @Override
        protected Integer measure(Target target) throws ProviderException {
            seenTargets.add(MDC.get("target"));
            if (target.name().startsWith("bad")) {
                throw new ProviderException(target.name() + " does not exist");
            }
            return target.name().length();
        }
    };

    @AfterEach
    void tearDown() {
        MDC.clear();
    }

    @Test
    @DisplayName("returns one result per target in order")
    void oneResultPerTarget() {
        var results = provider.fetch(Target.of(List.of("a", "bbb", "cc")));

        assertEquals(3, results.size());
        assertEquals(List.of(1, 3, 2), results.stream()
                .map(r -> ((Result.Success<Integer>) r).payload())
                .toList());
    }

    @Test
    @DisplayName("a failing target does not stop the others")
    void failureIsolated() {
        var results = provider.fetch(Target.of(List.of("bad-one", "ok")));

        assertEquals("bad-one does not exist", ((Result.Failure<Integer>) results.get(0)).error());
        assertTrue(results.get(1).isSuccess());
    }

    @Test
    @DisplayName("the target is in the MDC while it is measured and removed afterwards")
    void targetInMdc() {
        provider.fetch(Target.of(List.of("x", "y")));

        assertEquals(List.of("x", "y"), seenTargets);
        assertNull(MDC.get("target"));
    }
}
