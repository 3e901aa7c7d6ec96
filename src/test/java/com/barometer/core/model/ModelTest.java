package com.barometer.core.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ModelTest {

    @Nested
    @DisplayName("Result")
    class ResultTests {

        @Test
        @DisplayName("success carries the payload and a timestamp")
        void successCarriesPayload() {
            Result<Integer> result = Result.success(42);

            assertTrue(result.isSuccess());
            var success = assertInstanceOf(Result.Success.class, result);
            assertEquals(42, success.payload());
            assertNotNull(success.updatedAt());
        }

        @Test
        @DisplayName("a blank failure message becomes 'Unknown error'")
        void blankFailureMessage() {
            assertEquals("Unknown error", ((Result.Failure<?>) Result.failure("")).error());
            assertEquals("Unknown error", ((Result.Failure<?>) Result.failure(null)).error());
        }

        @Test
        @DisplayName("success rejects a null payload")
        void successRejectsNull() {
            assertThrows(NullPointerException.class, () -> Result.success(null));
        }
    }

    @Nested
    @DisplayName("StatusClass")
    class StatusClassTests {

        @Test
        @DisplayName("below 20% free is critical, below 50% warning")
        void thresholds() {
            assertEquals(StatusClass.CRITICAL, StatusClass.forFreePercent(0));
            assertEquals(StatusClass.CRITICAL, StatusClass.forFreePercent(19));
            assertEquals(StatusClass.WARNING, StatusClass.forFreePercent(20));
            assertEquals(StatusClass.WARNING, StatusClass.forFreePercent(49));
            assertEquals(StatusClass.SUCCESS, StatusClass.forFreePercent(50));
            assertEquals(StatusClass.SUCCESS, StatusClass.forFreePercent(100));
        }

        @Test
        @DisplayName("wire names are lowercase")
        void wireNames() {
            assertEquals("loading", StatusClass.LOADING.wireName());
            assertEquals("critical", StatusClass.CRITICAL.wireName());
        }
    }

    @Nested
    @DisplayName("StatusRecord and Target")
    class RecordTests {

        @Test
        @DisplayName("withStatus keeps text and tooltip")
        void withStatusKeepsContent() {
            var record = new StatusRecord("text", StatusClass.SUCCESS, "tip");

            assertEquals(new StatusRecord("text", StatusClass.LOADING, "tip"), record.withStatus(StatusClass.LOADING));
        }

        @Test
        @DisplayName("targets keep their configured order")
        void targetsKeepOrder() {
            var targets = Target.of(List.of("/home", "/", "/var"));

            assertEquals(List.of("/home", "/", "/var"), targets.stream().map(Target::name).toList());
        }
    }
}
