package com.flow.detection;

import com.flow.model.InstrumentKey;
import com.flow.model.OptionSide;
import com.flow.model.PressureWindow;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Random;

import static com.flow.Fixtures.CALL_21900;
import static com.flow.Fixtures.CALL_21950;
import static com.flow.Fixtures.PUT_21900;
import static com.flow.Fixtures.T0;
import static com.flow.Fixtures.window;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CoordinationIndexTest {

    private static final Comparator<PressureWindow> IDENTITY = Comparator
            .comparingDouble((PressureWindow w) -> w.key().strike())
            .thenComparing(w -> w.key().side())
            .thenComparingLong(PressureWindow::windowStart);

    private static List<PressureWindow> randomBatch(Random random, int size, double strikeSpan) {
        List<PressureWindow> batch = new ArrayList<>(size);
        for (int i = 0; i < size; i++) {
            double strike = 20_000 + 50 * Math.floor(random.nextDouble() * strikeSpan / 50);
            OptionSide side = random.nextBoolean() ? OptionSide.CALL : OptionSide.PUT;
            batch.add(window(new InstrumentKey(strike, side), T0 + i, 100, 100 + random.nextInt(300)));
        }
        return batch;
    }

    @ParameterizedTest(name = "n={0}")
    @ValueSource(ints = {10, 100, 1000})
    @DisplayName("nearby returns exactly what a linear scan returns")
    void matchesBruteForce(int size) {
        Random random = new Random(42L + size);
        List<PressureWindow> batch = randomBatch(random, size, 5_000);
        CoordinationIndex index = CoordinationIndex.build(batch);

        for (int q = 0; q < 200; q++) {
            double strike = 19_900 + random.nextDouble() * 5_200;
            double radius = random.nextInt(4) * 50.0;
            List<PressureWindow> expected = batch.stream()
                    .filter(w -> Math.abs(w.key().strike() - strike) <= radius)
                    .sorted(IDENTITY)
                    .toList();

            assertThat(index.nearby(strike, radius)).containsExactlyElementsOf(expected);
        }
    }

    @Test
    @DisplayName("Radius bounds are inclusive and zero radius selects one strike")
    void inclusiveBounds() {
        PressureWindow call = window(CALL_21900, T0, 100, 300);
        PressureWindow put = window(PUT_21900, T0, 100, 300);
        PressureWindow neighbour = window(CALL_21950, T0, 100, 300);
        CoordinationIndex index = CoordinationIndex.build(List.of(neighbour, put, call));

        assertThat(index.nearby(21900, 50)).containsExactly(call, put, neighbour);
        assertThat(index.nearby(21900, 49.99)).containsExactly(call, put);
        assertThat(index.atStrike(21950)).containsExactly(neighbour);
        assertThat(index.atStrike(22000)).isEmpty();
        assertThat(index.size()).isEqualTo(3);
    }

    @Test
    @DisplayName("Empty batches and negative radii")
    void edgeCases() {
        assertThat(CoordinationIndex.build(List.of()).isEmpty()).isTrue();
        assertThat(CoordinationIndex.empty().nearby(21900, 100)).isEmpty();
        assertThatThrownBy(() -> CoordinationIndex.empty().nearby(21900, -1))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Lookup cost grows with log n, not n, at constant strike density")
    void sublinearLookup() {
        Random random = new Random(7);
        List<PressureWindow> small = randomBatch(random, 1_000, 5_000);
        List<PressureWindow> large = randomBatch(random, 100_000, 500_000);
        CoordinationIndex smallIndex = CoordinationIndex.build(small);
        CoordinationIndex largeIndex = CoordinationIndex.build(large);

        for (int i = 0; i < 5; i++) {
            timeQueries(smallIndex, 5_000, random);
            timeQueries(largeIndex, 500_000, random);
        }
        long smallNanos = timeQueries(smallIndex, 5_000, random);
        long largeNanos = timeQueries(largeIndex, 500_000, random);

        // a linear scan would be about 100x slower on the large batch
        assertThat((double) largeNanos / Math.max(smallNanos, 1)).isLessThan(25.0);
    }

    private static long timeQueries(CoordinationIndex index, double span, Random random) {
        long sink = 0;
        long started = System.nanoTime();
        for (int q = 0; q < 20_000; q++) {
            sink += index.nearby(20_000 + random.nextDouble() * span, 100).size();
        }
        long elapsed = System.nanoTime() - started;
        assertThat(sink).isNotNegative();
        return elapsed;
    }
}
