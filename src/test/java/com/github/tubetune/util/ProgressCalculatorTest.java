package com.github.tubetune.util;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("ProgressCalculator")
class ProgressCalculatorTest {

    @Nested
    @DisplayName("transferPercent")
    class TransferPercentTests {

        @ParameterizedTest
        @CsvSource({
            "0, 100, 0",
            "1, 3, 33",
            "50, 100, 50",
            "999, 1000, 99"
        })
        @DisplayName("should floor the percentage")
        void shouldFloorPercentage(long transferred, long total, int expected) {
            assertEquals(expected, ProgressCalculator.transferPercent(transferred, total));
        }

        @Test
        @DisplayName("should never report completion")
        void shouldCapBelowCompletion() {
            assertEquals(99, ProgressCalculator.transferPercent(100, 100));
            assertEquals(99, ProgressCalculator.transferPercent(150, 100));
        }

        @Test
        @DisplayName("should return -1 when total is unknown")
        void shouldReturnMinusOneForUnknownTotal() {
            assertEquals(-1, ProgressCalculator.transferPercent(10, 0));
            assertEquals(-1, ProgressCalculator.transferPercent(10, -1));
        }
    }

    @Nested
    @DisplayName("estimateOutputBytes")
    class EstimateOutputBytesTests {

        @Test
        @DisplayName("should estimate from duration and bitrate")
        void shouldEstimate() {
            assertEquals(1_440_000, ProgressCalculator.estimateOutputBytes(60, 192));
        }

        @Test
        @DisplayName("a two hour track exceeds the artifact ceiling")
        void longTrackExceedsCeiling() {
            long estimate = ProgressCalculator.estimateOutputBytes(7200, 192);
            assertTrue(estimate > 45L * 1024 * 1024);
        }

        @Test
        @DisplayName("should return zero for unknown duration")
        void shouldReturnZeroForUnknownDuration() {
            assertEquals(0, ProgressCalculator.estimateOutputBytes(0, 192));
            assertEquals(0, ProgressCalculator.estimateOutputBytes(-1, 192));
        }
    }
}
