package com.demandlens.insight.series;

import com.demandlens.insight.model.DateAlignedSeries;
import com.demandlens.insight.model.SeriesPoint;
import com.demandlens.insight.stats.StatsPrimitives;
import java.util.ArrayList;
import java.util.List;

/**
 * Stationarity-inducing transforms. Inputs are never modified.
 */
public final class SeriesTransforms {

    private SeriesTransforms() {
    }

    /**
     * v[i] - v[i-1] for consecutive observations, dated at the later observation.
     */
    public static DateAlignedSeries firstDifference(DateAlignedSeries series) {
        List<SeriesPoint> points = series.points();
        double[] diffs = StatsPrimitives.firstDifference(series.values());
        List<SeriesPoint> out = new ArrayList<>(diffs.length);
        for (int i = 0; i < diffs.length; i++) {
            out.add(new SeriesPoint(points.get(i + 1).date(), diffs[i]));
        }
        return new DateAlignedSeries(series.id() + ":diff", out);
    }

    public static DateAlignedSeries detrend(DateAlignedSeries series) {
        List<SeriesPoint> points = series.points();
        double[] residuals = StatsPrimitives.detrend(series.values());
        List<SeriesPoint> out = new ArrayList<>(residuals.length);
        for (int i = 0; i < residuals.length; i++) {
            out.add(new SeriesPoint(points.get(i).date(), residuals[i]));
        }
        return new DateAlignedSeries(series.id() + ":detrended", out);
    }
}
