package com.demandlens.insight.series;

import static org.assertj.core.api.Assertions.assertThat;

import com.demandlens.insight.model.AlignedPairs;
import com.demandlens.insight.model.DateAlignedSeries;
import com.demandlens.insight.model.Granularity;
import java.time.LocalDate;
import java.util.Map;
import org.junit.jupiter.api.Test;

class SeriesAlignerTest {

    private static final LocalDate START = LocalDate.of(2024, 1, 1);

    @Test
    void positiveLagPairsFirstSeriesWithLaterSecondSeries() {
        DateAlignedSeries x = DateAlignedSeries.daily("x", START, 1, 2, 3, 4, 5);
        DateAlignedSeries y = DateAlignedSeries.daily("y", START, 10, 20, 30, 40, 50);

        AlignedPairs pairs = SeriesAligner.align(x, y, 2);

        assertThat(pairs.lag()).isEqualTo(2);
        assertThat(pairs.x()).containsExactly(1, 2, 3);
        assertThat(pairs.y()).containsExactly(30, 40, 50);
        assertThat(pairs.dates()).containsExactly(START, START.plusDays(1), START.plusDays(2));
    }

    @Test
    void negativeLagPairsFirstSeriesWithEarlierSecondSeries() {
        DateAlignedSeries x = DateAlignedSeries.daily("x", START, 1, 2, 3, 4, 5);
        DateAlignedSeries y = DateAlignedSeries.daily("y", START, 10, 20, 30, 40, 50);

        AlignedPairs pairs = SeriesAligner.align(x, y, -1);

        assertThat(pairs.x()).containsExactly(2, 3, 4, 5);
        assertThat(pairs.y()).containsExactly(10, 20, 30, 40);
    }

    @Test
    void dropsDatesMissingOnEitherSide() {
        DateAlignedSeries x = DateAlignedSeries.of("x", Map.of(
                START, 1.0, START.plusDays(1), 2.0, START.plusDays(3), 4.0));
        DateAlignedSeries y = DateAlignedSeries.of("y", Map.of(
                START, 10.0, START.plusDays(2), 30.0, START.plusDays(3), 40.0));

        AlignedPairs pairs = SeriesAligner.align(x, y, 0);

        assertThat(pairs.size()).isEqualTo(2);
        assertThat(pairs.x()).containsExactly(1, 4);
        assertThat(pairs.y()).containsExactly(10, 40);
    }

    @Test
    void weeklyLagShiftsWholeWeeks() {
        DateAlignedSeries x = DateAlignedSeries.of("x", Map.of(
                START, 1.0, START.plusWeeks(1), 2.0, START.plusWeeks(2), 3.0));
        DateAlignedSeries y = DateAlignedSeries.of("y", Map.of(
                START.plusWeeks(1), 20.0, START.plusWeeks(2), 30.0, START.plusWeeks(3), 40.0));

        AlignedPairs pairs = SeriesAligner.align(x, y, 1, Granularity.WEEKLY);

        assertThat(pairs.x()).containsExactly(1, 2, 3);
        assertThat(pairs.y()).containsExactly(20, 30, 40);
    }

    @Test
    void disjointSeriesAlignToNothing() {
        DateAlignedSeries x = DateAlignedSeries.daily("x", START, 1, 2);
        DateAlignedSeries y = DateAlignedSeries.daily("y", START.plusDays(10), 1, 2);

        assertThat(SeriesAligner.align(x, y, 0).isEmpty()).isTrue();
    }
}
