package com.demandlens.insight.model;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.demandlens.insight.exception.InvalidParameterException;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class DateAlignedSeriesTest {

    private static final LocalDate START = LocalDate.of(2024, 3, 1);

    @Test
    void rejectsUnorderedOrDuplicateDates() {
        List<SeriesPoint> duplicate = List.of(new SeriesPoint(START, 1), new SeriesPoint(START, 2));
        List<SeriesPoint> reversed = List.of(new SeriesPoint(START.plusDays(1), 1), new SeriesPoint(START, 2));

        assertThatThrownBy(() -> new DateAlignedSeries("s", duplicate)).isInstanceOf(InvalidParameterException.class);
        assertThatThrownBy(() -> new DateAlignedSeries("s", reversed)).isInstanceOf(InvalidParameterException.class);
    }

    @Test
    void rejectsNonFiniteValues() {
        List<SeriesPoint> points = List.of(new SeriesPoint(START, Double.NaN));

        assertThatThrownBy(() -> new DateAlignedSeries("s", points))
                .isInstanceOf(InvalidParameterException.class)
                .hasMessageContaining("non-finite");
    }

    @Test
    void sortsMapInputAndLooksUpByDate() {
        DateAlignedSeries series = DateAlignedSeries.of("temp", Map.of(
                START.plusDays(2), 3.0,
                START, 1.0,
                START.plusDays(5), 6.0));

        assertThat(series.dates()).containsExactly(START, START.plusDays(2), START.plusDays(5));
        assertThat(series.valueAt(START.plusDays(2))).hasValue(3.0);
        assertThat(series.valueAt(START.plusDays(1))).isEmpty();
        assertThat(series.firstDate()).isEqualTo(START);
        assertThat(series.lastDate()).isEqualTo(START.plusDays(5));
    }

    @Test
    void restrictsToClosedRange() {
        DateAlignedSeries series = DateAlignedSeries.daily("sales", START, 1, 2, 3, 4, 5);

        DateAlignedSeries slice = series.between(START.plusDays(1), START.plusDays(3));

        assertThat(slice.values()).containsExactly(2, 3, 4);
        assertThat(slice.id()).isEqualTo("sales");
        assertThatThrownBy(() -> series.between(START.plusDays(3), START))
                .isInstanceOf(InvalidParameterException.class);
    }

    @Test
    void emptySeriesHasNoBounds() {
        DateAlignedSeries empty = DateAlignedSeries.empty("none");

        assertThat(empty.isEmpty()).isTrue();
        assertThatThrownBy(empty::firstDate).isInstanceOf(IllegalStateException.class);
    }
}
