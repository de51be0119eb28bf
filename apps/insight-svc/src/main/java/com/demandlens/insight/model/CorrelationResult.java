package com.demandlens.insight.model;

/**
 * Pearson correlation of a factor against a target at one signed lag.
 * A positive lag means the first series leads the second by {@code lag} periods.
 * {@code adjustedPValue} stays null until a multiple-comparison pass assigns it.
 */
public record CorrelationResult(
        String factor,
        int lag,
        double coefficient,
        double pValue,
        Double adjustedPValue,
        int sampleSize,
        String interpretation
) {
    public CorrelationResult withAdjustedPValue(double adjusted) {
        return new CorrelationResult(factor, lag, coefficient, pValue, adjusted, sampleSize, interpretation);
    }

    public CorrelationResult withFactor(String newFactor) {
        return new CorrelationResult(newFactor, lag, coefficient, pValue, adjustedPValue, sampleSize, interpretation);
    }

    public double absCoefficient() {
        return Math.abs(coefficient);
    }

    /**
     * Uses the adjusted p-value when present, otherwise the raw one.
     */
    public boolean significant(double alpha) {
        double p = adjustedPValue != null ? adjustedPValue : pValue;
        return p < alpha;
    }

    public String describeLag() {
        if (lag > 0) {
            return "leads by " + lag + (lag == 1 ? " period" : " periods");
        }
        if (lag < 0) {
            return "lags by " + -lag + (lag == -1 ? " period" : " periods");
        }
        return "contemporaneous";
    }
}
