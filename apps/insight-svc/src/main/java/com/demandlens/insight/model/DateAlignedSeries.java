package com.demandlens.insight.model;

import com.demandlens.insight.exception.InvalidParameterException;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalDouble;
import java.util.TreeMap;

/**
 * Ordered (date, value) observations of one named series.
 * <p>
 * Dates are strictly increasing and values finite. Missing dates are simply absent;
 * nothing here ever fills a gap.
 */
public final class DateAlignedSeries {

    private final String id;
    private final List<SeriesPoint> points;
    private final Map<LocalDate, Double> byDate;

    public DateAlignedSeries(String id, List<SeriesPoint> points) {
        if (points == null) {
            throw new InvalidParameterException("points must be provided");
        }
        this.id = id == null ? "" : id;
        Map<LocalDate, Double> index = new HashMap<>(points.size() * 2);
        LocalDate previous = null;
        for (SeriesPoint point : points) {
            if (point == null || point.date() == null) {
                throw new InvalidParameterException("series '" + this.id + "' contains a point without a date");
            }
            if (!Double.isFinite(point.value())) {
                throw new InvalidParameterException("series '" + this.id + "' has non-finite value at " + point.date());
            }
            if (previous != null && !point.date().isAfter(previous)) {
                throw new InvalidParameterException("series '" + this.id + "' dates must be strictly increasing: "
                        + previous + " then " + point.date());
            }
            index.put(point.date(), point.value());
            previous = point.date();
        }
        this.points = List.copyOf(points);
        this.byDate = Collections.unmodifiableMap(index);
    }

    public static DateAlignedSeries of(String id, Map<LocalDate, Double> values) {
        List<SeriesPoint> sorted = new ArrayList<>(values.size());
        new TreeMap<>(values).forEach((date, value) -> sorted.add(new SeriesPoint(date, value)));
        return new DateAlignedSeries(id, sorted);
    }

    /**
     * Consecutive daily observations starting at {@code start}.
     */
    public static DateAlignedSeries daily(String id, LocalDate start, double... values) {
        List<SeriesPoint> points = new ArrayList<>(values.length);
        for (int i = 0; i < values.length; i++) {
            points.add(new SeriesPoint(start.plusDays(i), values[i]));
        }
        return new DateAlignedSeries(id, points);
    }

    public static DateAlignedSeries empty(String id) {
        return new DateAlignedSeries(id, List.of());
    }

    public String id() {
        return id;
    }

    public List<SeriesPoint> points() {
        return points;
    }

    public int size() {
        return points.size();
    }

    public boolean isEmpty() {
        return points.isEmpty();
    }

    public List<LocalDate> dates() {
        return points.stream().map(SeriesPoint::date).toList();
    }

    public double[] values() {
        return points.stream().mapToDouble(SeriesPoint::value).toArray();
    }

    public OptionalDouble valueAt(LocalDate date) {
        Double value = byDate.get(date);
        return value == null ? OptionalDouble.empty() : OptionalDouble.of(value);
    }

    public LocalDate firstDate() {
        requireNotEmpty();
        return points.get(0).date();
    }

    public LocalDate lastDate() {
        requireNotEmpty();
        return points.get(points.size() - 1).date();
    }

    /**
     * Points whose date falls in the closed range [fromInclusive, toInclusive].
     */
    public DateAlignedSeries between(LocalDate fromInclusive, LocalDate toInclusive) {
        if (fromInclusive.isAfter(toInclusive)) {
            throw new InvalidParameterException("empty date range " + fromInclusive + " > " + toInclusive);
        }
        List<SeriesPoint> slice = points.stream()
                .filter(point -> !point.date().isBefore(fromInclusive) && !point.date().isAfter(toInclusive))
                .toList();
        return new DateAlignedSeries(id, slice);
    }

    private void requireNotEmpty() {
        if (points.isEmpty()) {
            throw new IllegalStateException("series '" + id + "' is empty");
        }
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof DateAlignedSeries that)) {
            return false;
        }
        return id.equals(that.id) && points.equals(that.points);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, points);
    }

    @Override
    public String toString() {
        return "DateAlignedSeries[id=" + id + ", size=" + points.size() + "]";
    }
}
