package com.demandlens.insight.model;

import java.time.LocalDate;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Paired observations produced by alignment. {@code dates} are the x-side dates.
 * The value arrays are copied in and out, so instances stay immutable.
 */
public record AlignedPairs(int lag, List<LocalDate> dates, double[] x, double[] y) {

    public static final AlignedPairs EMPTY = new AlignedPairs(0, List.of(), new double[0], new double[0]);

    public AlignedPairs {
        if (x.length != y.length || x.length != dates.size()) {
            throw new IllegalArgumentException("aligned arrays must share one length");
        }
        dates = List.copyOf(dates);
        x = x.clone();
        y = y.clone();
    }

    @Override
    public double[] x() {
        return x.clone();
    }

    @Override
    public double[] y() {
        return y.clone();
    }

    public int size() {
        return x.length;
    }

    public boolean isEmpty() {
        return x.length == 0;
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof AlignedPairs that)) {
            return false;
        }
        return lag == that.lag && dates.equals(that.dates) && Arrays.equals(x, that.x) && Arrays.equals(y, that.y);
    }

    @Override
    public int hashCode() {
        return Objects.hash(lag, dates, Arrays.hashCode(x), Arrays.hashCode(y));
    }

    @Override
    public String toString() {
        return "AlignedPairs[lag=" + lag + ", dates=" + dates + ", x=" + Arrays.toString(x) + ", y=" + Arrays.toString(y) + "]";
    }
}
