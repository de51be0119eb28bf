package com.demandlens.insight.analytics;

import com.demandlens.insight.config.InsightProperties;
import com.demandlens.insight.exception.InsufficientDataException;
import com.demandlens.insight.model.AlignedPairs;
import com.demandlens.insight.model.CorrelationResult;
import com.demandlens.insight.model.DateAlignedSeries;
import com.demandlens.insight.model.Granularity;
import com.demandlens.insight.series.SeriesAligner;
import com.demandlens.insight.stats.StatsPrimitives;
import org.springframework.stereotype.Component;

/**
 * Pearson correlation with a t-test p-value for one lag.
 * Positive {@code lag} pairs x at d with y at d + lag (x leads y).
 */
@Component
public class CorrelationAnalyzer {

    private final InsightProperties.Correlation settings;

    public CorrelationAnalyzer(InsightProperties properties) {
        this.settings = properties.correlation();
    }

    public CorrelationResult analyze(DateAlignedSeries x, DateAlignedSeries y, int lag) {
        return analyze(x, y, lag, Granularity.DAILY);
    }

    public CorrelationResult analyze(DateAlignedSeries x, DateAlignedSeries y, int lag, Granularity granularity) {
        AlignedPairs pairs = SeriesAligner.align(x, y, lag, granularity);
        return analyze(pairs, y.id());
    }

    public CorrelationResult analyze(AlignedPairs pairs, String factor) {
        int minSamples = Math.max(StatsPrimitives.MIN_PEARSON_SAMPLES, settings.minSamples());
        if (pairs.size() < minSamples) {
            throw new InsufficientDataException("correlation at lag " + pairs.lag(), minSamples, pairs.size());
        }
        double r = StatsPrimitives.pearson(pairs.x(), pairs.y());
        double p = StatsPrimitives.studentTPValue(r, pairs.size());
        return new CorrelationResult(factor, pairs.lag(), r, p, null, pairs.size(), interpret(r, p));
    }

    /**
     * e.g. "strong positive correlation (significant)".
     */
    String interpret(double r, double pValue) {
        double magnitude = Math.abs(r);
        String strength;
        if (magnitude >= settings.strongThreshold()) {
            strength = "strong";
        } else if (magnitude >= settings.moderateThreshold()) {
            strength = "moderate";
        } else {
            strength = "weak";
        }
        String sign = r < 0 ? "negative" : "positive";
        String significance = pValue < settings.significance() ? "(significant)" : "(not significant)";
        return strength + " " + sign + " correlation " + significance;
    }
}
