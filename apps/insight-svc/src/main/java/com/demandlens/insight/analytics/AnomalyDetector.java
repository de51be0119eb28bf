package com.demandlens.insight.analytics;

import com.demandlens.insight.config.InsightProperties;
import com.demandlens.insight.exception.InsufficientDataException;
import com.demandlens.insight.model.AggregatedPeriod;
import com.demandlens.insight.model.AggregatedSeries;
import com.demandlens.insight.model.AggregationMethod;
import com.demandlens.insight.model.AnomalyOptions;
import com.demandlens.insight.model.AnomalyRecord;
import com.demandlens.insight.model.DateAlignedSeries;
import com.demandlens.insight.model.Granularity;
import com.demandlens.insight.series.SeriesAggregator;
import com.demandlens.insight.stats.StatsPrimitives;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * z-score detector over a series summed into calendar periods.
 * <p>
 * The GLOBAL baseline compares every period with the mean and sample standard deviation
 * of the whole aggregated series. The TRAILING baseline compares each period with the
 * window of periods immediately before it and also flags a period whose deviation exceeds
 * {@link AnomalyOptions#trailingDeviationRatio()} of a positive window mean.
 */
@Component
public class AnomalyDetector {

    private static final Logger log = LoggerFactory.getLogger(AnomalyDetector.class);

    private final InsightProperties.Anomaly settings;

    public AnomalyDetector(InsightProperties properties) {
        this.settings = properties.anomaly();
    }

    public List<AnomalyRecord> detect(DateAlignedSeries series) {
        return detect(series, settings.toOptions());
    }

    public List<AnomalyRecord> detect(DateAlignedSeries series, Granularity granularity, Double threshold, String groupKey) {
        AnomalyOptions options = new AnomalyOptions(
                granularity,
                threshold != null ? threshold : settings.threshold(),
                settings.baseline(),
                0,
                groupKey);
        return detect(series, options);
    }

    public List<AnomalyRecord> detect(DateAlignedSeries series, AnomalyOptions options) {
        AggregatedSeries aggregated = SeriesAggregator.aggregate(series, options.granularity(), AggregationMethod.SUM);
        int minPeriods = settings.minPeriods();
        if (aggregated.size() < minPeriods) {
            throw new InsufficientDataException("anomaly baseline", minPeriods, aggregated.size());
        }
        log.debug("anomaly_aggregate source={} granularity={} periods={} baseline={}",
                series.id(), options.granularity(), aggregated.size(), options.baseline());
        return switch (options.baseline()) {
            case GLOBAL -> detectGlobal(aggregated, options);
            case TRAILING -> detectTrailing(aggregated, options);
        };
    }

    private List<AnomalyRecord> detectGlobal(AggregatedSeries aggregated, AnomalyOptions options) {
        double[] values = aggregated.values();
        double mean = StatsPrimitives.mean(values);
        double stdDev = StatsPrimitives.stddev(values);
        if (stdDev == 0d) {
            log.debug("anomaly_skip source={} reason=zero_variance", aggregated.sourceId());
            return List.of();
        }
        List<AnomalyRecord> anomalies = new ArrayList<>();
        for (AggregatedPeriod period : aggregated.periods()) {
            toRecord(period, mean, stdDev, options, anomalies);
        }
        return anomalies;
    }

    private List<AnomalyRecord> detectTrailing(AggregatedSeries aggregated, AnomalyOptions options) {
        int window = options.effectiveTrailingWindow();
        List<AggregatedPeriod> periods = aggregated.periods();
        if (periods.size() <= window) {
            throw new InsufficientDataException("trailing anomaly baseline of " + window + " periods", window + 1, periods.size());
        }
        double[] values = aggregated.values();
        double ratio = options.trailingDeviationRatio();
        List<AnomalyRecord> anomalies = new ArrayList<>();
        for (int i = window; i < periods.size(); i++) {
            double[] baseline = Arrays.copyOfRange(values, i - window, i);
            double mean = StatsPrimitives.mean(baseline);
            double stdDev = StatsPrimitives.stddev(baseline);
            AggregatedPeriod period = periods.get(i);
            double deviation = period.value() - mean;
            // a flat window has no spread, z stays 0 and only the relative rule can fire
            double zScore = stdDev > 0d ? deviation / stdDev : 0d;
            boolean relative = mean > 0d && Math.abs(deviation) > mean * ratio;
            if (relative || Math.abs(zScore) >= options.threshold()) {
                anomalies.add(record(period, mean, zScore, options));
            }
        }
        return anomalies;
    }

    private static void toRecord(AggregatedPeriod period, double mean, double stdDev, AnomalyOptions options, List<AnomalyRecord> sink) {
        double zScore = (period.value() - mean) / stdDev;
        if (Math.abs(zScore) < options.threshold()) {
            return;
        }
        sink.add(record(period, mean, zScore, options));
    }

    private static AnomalyRecord record(AggregatedPeriod period, double mean, double zScore, AnomalyOptions options) {
        double deviation = period.value() - mean;
        return new AnomalyRecord(
                options.groupKey(),
                period.label(),
                period.startDate(),
                period.endDate(),
                period.value(),
                mean,
                deviation,
                zScore,
                AnomalyRecord.Severity.fromAbsZScore(Math.abs(zScore)),
                period.value() > mean ? AnomalyRecord.Kind.SPIKE : AnomalyRecord.Kind.DROP);
    }
}
