package com.demandlens.insight.model;

import com.demandlens.insight.exception.InvalidParameterException;

/**
 * Per-call anomaly settings. {@code trailingWindow} is only read for {@link Baseline#TRAILING};
 * zero selects the granularity default.
 */
public record AnomalyOptions(
        Granularity granularity,
        double threshold,
        Baseline baseline,
        int trailingWindow,
        String groupKey
) {
    public static final double DEFAULT_THRESHOLD = 3.0d;

    public enum Baseline {
        GLOBAL,
        TRAILING
    }

    public AnomalyOptions {
        if (granularity == null) {
            granularity = Granularity.WEEKLY;
        }
        if (baseline == null) {
            baseline = Baseline.GLOBAL;
        }
        if (!(threshold > 0) || !Double.isFinite(threshold)) {
            throw new InvalidParameterException("anomaly threshold must be a positive number of standard deviations");
        }
        if (trailingWindow < 0) {
            throw new InvalidParameterException("trailingWindow must not be negative");
        }
    }

    public static AnomalyOptions of(Granularity granularity) {
        return new AnomalyOptions(granularity, DEFAULT_THRESHOLD, Baseline.GLOBAL, 0, null);
    }

    public AnomalyOptions withThreshold(double newThreshold) {
        return new AnomalyOptions(granularity, newThreshold, baseline, trailingWindow, groupKey);
    }

    public AnomalyOptions withGroupKey(String newGroupKey) {
        return new AnomalyOptions(granularity, threshold, baseline, trailingWindow, newGroupKey);
    }

    public AnomalyOptions withBaseline(Baseline newBaseline, int window) {
        return new AnomalyOptions(granularity, threshold, newBaseline, window, groupKey);
    }

    /**
     * Trailing window length in periods: 30 days, 4 weeks or 3 months unless overridden.
     */
    public int effectiveTrailingWindow() {
        if (trailingWindow > 0) {
            return trailingWindow;
        }
        return switch (granularity) {
            case DAILY -> 30;
            case WEEKLY -> 4;
            case MONTHLY -> 3;
        };
    }

    /**
     * Share of the trailing mean a period may deviate by before it is flagged regardless of z.
     */
    public double trailingDeviationRatio() {
        return switch (granularity) {
            case DAILY -> 0.5d;
            case WEEKLY -> 0.4d;
            case MONTHLY -> 0.3d;
        };
    }
}
