package com.demandlens.insight.series;

import com.demandlens.insight.model.AlignedPairs;
import com.demandlens.insight.model.DateAlignedSeries;
import com.demandlens.insight.model.Granularity;
import com.demandlens.insight.model.SeriesPoint;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.OptionalDouble;

/**
 * Pairs two series on common dates.
 * <p>
 * Lag convention: with a positive {@code lag}, x at date d is paired with y at d + lag
 * periods, i.e. x leads y. A negative lag means y leads x. Dates missing on either side
 * after the shift are dropped, never interpolated.
 */
public final class SeriesAligner {

    private SeriesAligner() {
    }

    public static AlignedPairs align(DateAlignedSeries x, DateAlignedSeries y, int lag) {
        return align(x, y, lag, Granularity.DAILY);
    }

    public static AlignedPairs align(DateAlignedSeries x, DateAlignedSeries y, int lag, Granularity granularity) {
        List<LocalDate> dates = new ArrayList<>(x.size());
        double[] xs = new double[x.size()];
        double[] ys = new double[x.size()];
        int n = 0;
        for (SeriesPoint point : x.points()) {
            OptionalDouble paired = y.valueAt(granularity.shift(point.date(), lag));
            if (paired.isEmpty()) {
                continue;
            }
            dates.add(point.date());
            xs[n] = point.value();
            ys[n] = paired.getAsDouble();
            n++;
        }
        return new AlignedPairs(lag, dates, trim(xs, n), trim(ys, n));
    }

    private static double[] trim(double[] values, int length) {
        if (values.length == length) {
            return values;
        }
        double[] out = new double[length];
        System.arraycopy(values, 0, out, 0, length);
        return out;
    }
}
