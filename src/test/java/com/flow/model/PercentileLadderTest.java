package com.flow.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class PercentileLadderTest {

    @Nested
    @DisplayName("Construction")
    class Construction {

        @Test
        @DisplayName("Samples 1..101 give ranks at their linear positions")
        void fromSamplesInterpolates() {
            double[] samples = new double[101];
            for (int i = 0; i < samples.length; i++) samples[100 - i] = i + 1;

            PercentileLadder ladder = PercentileLadder.fromSamples(samples);

            assertThat(ladder.values()).containsExactly(11, 26, 51, 76, 91, 96, 100);
        }

        @Test
        @DisplayName("Interpolates between neighbouring samples")
        void interpolatesBetweenSamples() {
            PercentileLadder ladder = PercentileLadder.fromSamples(new double[]{1.0, 2.0});
            assertThat(ladder.valueAt(50)).isCloseTo(1.5, within(1e-12));
            assertThat(ladder.valueAt(10)).isCloseTo(1.1, within(1e-12));
        }

        @Test
        @DisplayName("Normal approximation is non-decreasing and never negative")
        void normalApproximation() {
            PercentileLadder ladder = PercentileLadder.normal(0.2, 1.0);
            double[] values = ladder.values();
            assertThat(values[0]).isZero();
            for (int i = 1; i < values.length; i++) {
                assertThat(values[i]).isGreaterThanOrEqualTo(values[i - 1]);
            }
            assertThat(ladder.median()).isCloseTo(0.2, within(1e-12));
        }

        @Test
        @DisplayName("Random samples always produce a non-decreasing ladder")
        void randomSamplesMonotone() {
            Random random = new Random(42);
            for (int round = 0; round < 200; round++) {
                double[] samples = new double[1 + random.nextInt(50)];
                for (int i = 0; i < samples.length; i++) samples[i] = random.nextDouble() * 5;
                double[] values = PercentileLadder.fromSamples(samples).values();
                for (int i = 1; i < values.length; i++) {
                    assertThat(values[i]).isGreaterThanOrEqualTo(values[i - 1]);
                }
            }
        }

        @Test
        @DisplayName("Decreasing values are rejected")
        void rejectsDecreasing() {
            assertThatThrownBy(() -> PercentileLadder.of(1, 2, 3, 2, 5, 6, 7))
                    .isInstanceOf(IllegalArgumentException.class);
        }
    }

    @Nested
    @DisplayName("Percentile rank")
    class Rank {

        private final PercentileLadder ladder = PercentileLadder.of(1, 2, 3, 4, 5, 6, 7);

        @Test
        @DisplayName("Exact rung values map to their ranks")
        void rungs() {
            assertThat(ladder.percentileRank(3)).isEqualTo(50.0);
            assertThat(ladder.percentileRank(7)).isEqualTo(99.0);
        }

        @Test
        @DisplayName("Between rungs the rank is interpolated")
        void between() {
            assertThat(ladder.percentileRank(3.5)).isCloseTo(62.5, within(1e-9));
        }

        @Test
        @DisplayName("Outside the ladder the rank scales from 0 below and is 100 above")
        void outside() {
            assertThat(ladder.percentileRank(0.5)).isCloseTo(5.0, within(1e-9));
            assertThat(ladder.percentileRank(8)).isEqualTo(100.0);
        }

        @Test
        @DisplayName("A value on flat rungs takes the lowest of their ranks")
        void tiesGoLow() {
            PercentileLadder flat = PercentileLadder.of(1, 2, 2, 2, 5, 6, 7);
            assertThat(flat.percentileRank(2)).isEqualTo(25.0);
        }
    }
}
