package com.flow.store;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class RunningStatsTest {

    @Test
    @DisplayName("Welford updates match a two-pass mean and variance")
    void welfordMatchesTwoPass() {
        Random random = new Random(11);
        double[] values = new double[5_000];
        RunningStats stats = RunningStats.EMPTY;
        for (int i = 0; i < values.length; i++) {
            values[i] = 1.0 + random.nextGaussian() * 0.3;
            stats = stats.add(values[i]);
        }

        double mean = 0;
        for (double v : values) mean += v;
        mean /= values.length;
        double variance = 0;
        for (double v : values) variance += (v - mean) * (v - mean);
        variance /= values.length;

        assertThat(stats.count()).isEqualTo(values.length);
        assertThat(stats.mean()).isCloseTo(mean, within(1e-9));
        assertThat(stats.variance()).isCloseTo(variance, within(1e-9));
    }

    @Test
    @DisplayName("Merging split series equals folding the whole series")
    void mergeEqualsSequential() {
        Random random = new Random(5);
        RunningStats whole = RunningStats.EMPTY;
        RunningStats left = RunningStats.EMPTY;
        RunningStats right = RunningStats.EMPTY;
        for (int i = 0; i < 1_000; i++) {
            double v = random.nextDouble() * 4;
            whole = whole.add(v);
            if (i < 370) left = left.add(v);
            else right = right.add(v);
        }

        RunningStats merged = left.merge(right);

        assertThat(merged.count()).isEqualTo(whole.count());
        assertThat(merged.mean()).isCloseTo(whole.mean(), within(1e-12));
        assertThat(merged.m2()).isCloseTo(whole.m2(), within(1e-9));
        assertThat(merged.min()).isEqualTo(whole.min());
        assertThat(merged.max()).isEqualTo(whole.max());
    }

    @Test
    @DisplayName("Empty stats are the identity for merge")
    void emptyIdentity() {
        RunningStats one = RunningStats.of(2.5);
        assertThat(RunningStats.EMPTY.merge(one)).isEqualTo(one);
        assertThat(one.merge(RunningStats.EMPTY)).isEqualTo(one);
        assertThat(one.std()).isZero();
    }
}
