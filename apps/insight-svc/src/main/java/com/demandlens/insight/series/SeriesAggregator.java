package com.demandlens.insight.series;

import com.demandlens.insight.exception.InvalidParameterException;
import com.demandlens.insight.model.AggregatedPeriod;
import com.demandlens.insight.model.AggregatedSeries;
import com.demandlens.insight.model.AggregationMethod;
import com.demandlens.insight.model.DateAlignedSeries;
import com.demandlens.insight.model.Granularity;
import com.demandlens.insight.model.SeriesPoint;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * Buckets a series into calendar periods. Periods without source points are omitted.
 */
public final class SeriesAggregator {

    private SeriesAggregator() {
    }

    public static AggregatedSeries aggregate(DateAlignedSeries series, Granularity granularity, AggregationMethod method) {
        if (granularity == null || method == null) {
            throw new InvalidParameterException("granularity and aggregation method must be provided");
        }
        List<AggregatedPeriod> periods = new ArrayList<>();
        LocalDate currentStart = null;
        List<Double> bucket = new ArrayList<>();
        // points are date-ordered, so every bucket is contiguous
        for (SeriesPoint point : series.points()) {
            LocalDate start = granularity.periodStart(point.date());
            if (currentStart != null && !currentStart.equals(start)) {
                periods.add(close(granularity, method, currentStart, bucket));
                bucket = new ArrayList<>();
            }
            currentStart = start;
            bucket.add(point.value());
        }
        if (currentStart != null) {
            periods.add(close(granularity, method, currentStart, bucket));
        }
        return new AggregatedSeries(series.id(), granularity, method, periods);
    }

    private static AggregatedPeriod close(Granularity granularity, AggregationMethod method, LocalDate start, List<Double> values) {
        double value = switch (method) {
            case SUM -> values.stream().mapToDouble(Double::doubleValue).sum();
            case MEAN -> values.stream().mapToDouble(Double::doubleValue).average().orElse(0d);
            case LAST -> values.get(values.size() - 1);
        };
        return new AggregatedPeriod(granularity.label(start), start, granularity.periodEnd(start), value, values.size());
    }
}
