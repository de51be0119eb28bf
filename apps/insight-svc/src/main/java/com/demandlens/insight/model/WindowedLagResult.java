package com.demandlens.insight.model;

import java.time.LocalDate;

public record WindowedLagResult(
        LocalDate windowStart,
        LocalDate windowEnd,
        int bestLag,
        double coefficient,
        double pValue,
        double adjustedPValue,
        int sampleSize
) {
    public static WindowedLagResult from(LocalDate windowStart, LocalDate windowEnd, CorrelationResult best) {
        return new WindowedLagResult(
                windowStart,
                windowEnd,
                best.lag(),
                best.coefficient(),
                best.pValue(),
                best.adjustedPValue() != null ? best.adjustedPValue() : best.pValue(),
                best.sampleSize()
        );
    }
}
