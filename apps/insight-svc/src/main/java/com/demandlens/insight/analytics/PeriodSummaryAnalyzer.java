package com.demandlens.insight.analytics;

import com.demandlens.insight.model.AggregatedPeriod;
import com.demandlens.insight.model.AggregatedSeries;
import com.demandlens.insight.model.AggregationMethod;
import com.demandlens.insight.model.DateAlignedSeries;
import com.demandlens.insight.model.Granularity;
import com.demandlens.insight.model.PeriodAnalysis;
import com.demandlens.insight.model.PeriodAnalysis.OverallStats;
import com.demandlens.insight.model.PeriodAnalysis.PeriodSummary;
import com.demandlens.insight.model.PeriodAnalysis.TrendSummary;
import com.demandlens.insight.series.SeriesAggregator;
import com.demandlens.insight.stats.StatsPrimitives;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import org.apache.commons.math3.stat.StatUtils;
import org.apache.commons.math3.stat.descriptive.rank.Median;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Descriptive per-period statistics: totals, period-over-period change and an overall trend.
 */
@Component
public class PeriodSummaryAnalyzer {

    private static final Logger log = LoggerFactory.getLogger(PeriodSummaryAnalyzer.class);

    static final double FLAT_BAND_PERCENT = 2d;

    public PeriodAnalysis analyze(DateAlignedSeries series, Granularity granularity) {
        AggregatedSeries totals = SeriesAggregator.aggregate(series, granularity, AggregationMethod.SUM);
        double[] source = series.values();

        List<PeriodSummary> periods = new ArrayList<>(totals.size());
        double previousTotal = Double.NaN;
        int index = 1;
        int offset = 0;
        for (AggregatedPeriod period : totals.periods()) {
            // buckets are contiguous runs of the source, sourceCount points each
            double[] values = Arrays.copyOfRange(source, offset, offset + period.sourceCount());
            offset += period.sourceCount();
            double total = period.value();
            double change = previousTotal > 0 ? (total - previousTotal) / previousTotal * 100d : 0d;
            periods.add(new PeriodSummary(
                    index++,
                    period.label(),
                    period.startDate(),
                    period.endDate(),
                    total,
                    StatUtils.mean(values),
                    StatUtils.min(values),
                    StatUtils.max(values),
                    values.length,
                    StatsPrimitives.stddev(values),
                    change));
            previousTotal = total;
        }

        OverallStats overall = overall(periods);
        TrendSummary trend = trend(periods);
        log.debug("period_summary source={} granularity={} periods={} trend={}",
                series.id(), granularity, periods.size(), trend.direction());
        return new PeriodAnalysis(series.id(), granularity, periods, overall, trend);
    }

    private static OverallStats overall(List<PeriodSummary> periods) {
        if (periods.isEmpty()) {
            return OverallStats.EMPTY;
        }
        double[] totals = periods.stream().mapToDouble(PeriodSummary::total).toArray();
        double average = StatUtils.mean(totals);
        double stdDev = StatsPrimitives.stddev(totals);
        PeriodSummary best = periods.get(0);
        PeriodSummary worst = periods.get(0);
        for (PeriodSummary period : periods) {
            if (period.total() > best.total()) {
                best = period;
            }
            if (period.total() < worst.total()) {
                worst = period;
            }
        }
        double first = totals[0];
        double last = totals[totals.length - 1];
        double growth = totals.length >= 2 && first > 0 ? (last - first) / first * 100d : 0d;
        double volatility = average > 0 ? stdDev / average : 0d;
        return new OverallStats(average, new Median().evaluate(totals), stdDev, best.label(), worst.label(), growth, volatility);
    }

    private static TrendSummary trend(List<PeriodSummary> periods) {
        if (periods.size() < 2) {
            return new TrendSummary(TrendSummary.Direction.INSUFFICIENT_DATA, 0d, 0d, null, null);
        }
        double changeSum = 0d;
        PeriodSummary peak = periods.get(0);
        PeriodSummary low = periods.get(0);
        for (int i = 0; i < periods.size(); i++) {
            PeriodSummary period = periods.get(i);
            if (i > 0) {
                changeSum += period.changePercent();
            }
            if (period.total() > peak.total()) {
                peak = period;
            }
            if (period.total() < low.total()) {
                low = period;
            }
        }
        double averageChange = changeSum / (periods.size() - 1);
        TrendSummary.Direction direction;
        double strength;
        if (averageChange > FLAT_BAND_PERCENT) {
            direction = TrendSummary.Direction.UP;
            strength = Math.min(averageChange / 10d, 1d);
        } else if (averageChange < -FLAT_BAND_PERCENT) {
            direction = TrendSummary.Direction.DOWN;
            strength = Math.min(Math.abs(averageChange) / 10d, 1d);
        } else {
            // flat: the closer to zero change, the stronger the flatness
            direction = TrendSummary.Direction.FLAT;
            strength = 1d - Math.min(Math.abs(averageChange) / FLAT_BAND_PERCENT, 1d);
        }
        return new TrendSummary(direction, strength, averageChange, peak.label(), low.label());
    }
}
