package com.demandlens.insight.model;

import java.time.LocalDate;
import java.util.List;

public record PeriodAnalysis(
        String sourceId,
        Granularity granularity,
        List<PeriodSummary> periods,
        OverallStats overall,
        TrendSummary trend
) {
    public record PeriodSummary(
            int index,
            String label,
            LocalDate startDate,
            LocalDate endDate,
            double total,
            double average,
            double min,
            double max,
            int observations,
            double stdDev,
            double changePercent
    ) {
    }

    public record OverallStats(
            double averagePerPeriod,
            double median,
            double stdDev,
            String bestPeriod,
            String worstPeriod,
            double growthRatePercent,
            double volatility
    ) {
        public static final OverallStats EMPTY = new OverallStats(0, 0, 0, null, null, 0, 0);
    }

    public record TrendSummary(
            Direction direction,
            double strength,
            double averageChangePercent,
            String peakPeriod,
            String lowPeriod
    ) {
        public enum Direction {
            UP,
            DOWN,
            FLAT,
            INSUFFICIENT_DATA
        }
    }
}
