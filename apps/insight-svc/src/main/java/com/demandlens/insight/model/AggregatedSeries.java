package com.demandlens.insight.model;

import java.util.List;

/**
 * Non-overlapping, chronologically ordered calendar periods built from one series.
 */
public record AggregatedSeries(
        String sourceId,
        Granularity granularity,
        AggregationMethod method,
        List<AggregatedPeriod> periods
) {
    public AggregatedSeries {
        periods = List.copyOf(periods);
    }

    public int size() {
        return periods.size();
    }

    public double[] values() {
        return periods.stream().mapToDouble(AggregatedPeriod::value).toArray();
    }

    public List<String> labels() {
        return periods.stream().map(AggregatedPeriod::label).toList();
    }

    /**
     * Re-keys each period by its start date so aggregated data can be aligned or scanned.
     */
    public DateAlignedSeries toSeries() {
        return new DateAlignedSeries(sourceId, periods.stream()
                .map(period -> new SeriesPoint(period.startDate(), period.value()))
                .toList());
    }
}
