package com.demandlens.insight.analytics;

import com.demandlens.insight.exception.AnalysisException;
import com.demandlens.insight.exception.InvalidParameterException;
import com.demandlens.insight.model.CorrelationResult;
import com.demandlens.insight.model.DateAlignedSeries;
import com.demandlens.insight.model.Granularity;
import com.demandlens.insight.model.LagScanResult;
import com.demandlens.insight.model.UnitFailure;
import com.demandlens.insight.stats.StatsPrimitives;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Correlates x against y at every lag in [-maxLag, maxLag] and applies one
 * Benjamini-Hochberg pass over the lags that produced a result.
 */
@Component
public class LagScanner {

    private static final Logger log = LoggerFactory.getLogger(LagScanner.class);

    static final Comparator<CorrelationResult> RANKING = Comparator
            .comparingDouble(CorrelationResult::absCoefficient).reversed()
            .thenComparingInt(result -> Math.abs(result.lag()))
            .thenComparingInt(CorrelationResult::lag);

    /** Ten years of daily lags; anything wider cannot pair two real series. */
    public static final int MAX_LAG = 3660;

    private final CorrelationAnalyzer correlationAnalyzer;

    public LagScanner(CorrelationAnalyzer correlationAnalyzer) {
        this.correlationAnalyzer = correlationAnalyzer;
    }

    public LagScanResult scan(DateAlignedSeries x, DateAlignedSeries y, int maxLag) {
        return scan(x, y, maxLag, Granularity.DAILY);
    }

    public LagScanResult scan(DateAlignedSeries x, DateAlignedSeries y, int maxLag, Granularity granularity) {
        requireValidMaxLag(maxLag);
        List<CorrelationResult> raw = new ArrayList<>(2 * maxLag + 1);
        List<UnitFailure> skipped = new ArrayList<>();
        for (int lag = -maxLag; lag <= maxLag; lag++) {
            try {
                raw.add(correlationAnalyzer.analyze(x, y, lag, granularity));
            } catch (AnalysisException ex) {
                log.debug("lag_skipped source={} factor={} lag={} kind={} reason={}",
                        x.id(), y.id(), lag, ex.kind(), ex.getMessage());
                skipped.add(UnitFailure.of("lag " + lag, ex));
            }
        }

        double[] pValues = raw.stream().mapToDouble(CorrelationResult::pValue).toArray();
        double[] adjusted = StatsPrimitives.benjaminiHochberg(pValues);
        List<CorrelationResult> ranked = new ArrayList<>(raw.size());
        for (int i = 0; i < raw.size(); i++) {
            ranked.add(raw.get(i).withAdjustedPValue(adjusted[i]));
        }
        ranked.sort(RANKING);

        log.debug("lag_scan source={} factor={} lags={} skipped={}", x.id(), y.id(), ranked.size(), skipped.size());
        return new LagScanResult(x.id(), y.id(), maxLag, ranked, skipped);
    }

    public static void requireValidMaxLag(int maxLag) {
        if (maxLag < 0 || maxLag > MAX_LAG) {
            throw new InvalidParameterException("maxLag must be between 0 and " + MAX_LAG + ": " + maxLag);
        }
    }
}
