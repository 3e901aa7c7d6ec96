package com.barometer.core.model;

import java.time.Instant;
import java.util.Objects;

/**
 * Outcome of fetching one target: either a payload or an error message.
 * <p>
 * Providers produce exactly one {@code Result} per target per fetch and never
 * populate a result partially.
 *
 * @param <T> the payload type of the agent
 */
public sealed interface Result<T> permits Result.Success, Result.Failure {

    static <T> Result<T> success(T payload) {
        return new Success<>(payload, Instant.now());
    }

    static <T> Result<T> failure(String error) {
        return new Failure<>(error);
    }

    boolean isSuccess();

    record Success<T>(T payload, Instant updatedAt) implements Result<T> {
        public Success {
            Objects.requireNonNull(payload, "payload");
            Objects.requireNonNull(updatedAt, "updatedAt");
        }

        @Override
        public boolean isSuccess() {
            return true;
        }
    }

    record Failure<T>(String error) implements Result<T> {
        public Failure {
            if (error == null || error.isBlank()) {
                error = "Unknown error";
            }
        }

        @Override
        public boolean isSuccess() {
            return false;
        }
    }
}
