package com.demandlens.insight.model;

public record RegressionResult(
        double slope,
        double intercept,
        double rSquared,
        double predictAt,
        double prediction,
        int sampleSize,
        String description
) {
    public double predict(double x) {
        return slope * x + intercept;
    }
}
